package com.realtime.dm.message.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

public record MessageContentRequest(
        @NotNull(message = "content는 필수입니다.")
        JsonNode content
) {}
