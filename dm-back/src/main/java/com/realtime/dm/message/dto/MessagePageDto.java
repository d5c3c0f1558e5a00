package com.realtime.dm.message.dto;

import java.time.Instant;
import java.util.List;

/**
 * (created_at, id) 내림차순 페이지. hasMore 일 때만 다음 커서(nextBefore, nextBeforeId)가 채워진다.
 */
public record MessagePageDto(
        List<MessageDto> messages,
        boolean hasMore,
        Instant nextBefore,
        Long nextBeforeId
) {}
