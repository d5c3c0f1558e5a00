package com.realtime.dm.conversation.dto;

import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.user.dto.UserSummaryDto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ConversationDto(
        UUID id,
        List<UserSummaryDto> participants,
        MessageDto lastMessage,   // 메시지가 없으면 null
        int unreadCount,          // 조회한 사용자 기준
        Instant createdAt,
        Instant lastActivityAt    // 마지막 메시지 시각, 없으면 createdAt
) {}
