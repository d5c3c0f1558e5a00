package com.realtime.dm.conversation.dto;

import jakarta.validation.constraints.NotBlank;

public record OpenConversationRequest(
        @NotBlank(message = "상대 username을 입력하세요.")
        String participantUsername
) {}
