package com.realtime.dm.message.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record MessageDto(
        Long id,
        UUID conversationId,
        UUID authorId,
        JsonNode content,     // 구조화 문서 {type:"doc", content:[...]}
        Instant createdAt,
        Instant updatedAt     // 수정된 적 없으면 null
) {}
