package com.realtime.dm.conversation.dto;

import java.util.UUID;

public record ReadAck(
        UUID conversationId,
        UUID meId,
        UUID peerId,
        int unread,      // 항상 0
        boolean ok       // reset이 실제로 반영됐는지
) {}
