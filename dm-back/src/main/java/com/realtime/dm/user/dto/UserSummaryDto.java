package com.realtime.dm.user.dto;

import java.util.UUID;

public record UserSummaryDto(
        UUID id,
        String username,
        String displayName,
        String avatarUrl,
        String status,   // 사용자가 고른 상태
        boolean online   // 실제 접속 여부 (Redis presence)
) {}
