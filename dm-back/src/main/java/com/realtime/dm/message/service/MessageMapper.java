package com.realtime.dm.message.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.entity.ChatMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MessageMapper {

    private final ObjectMapper objectMapper;

    public MessageDto toDto(ChatMessage m) {
        try {
            return new MessageDto(
                    m.getId(),
                    m.getConversationId(),
                    m.getAuthorId(),
                    objectMapper.readTree(m.getContent()),
                    m.getCreatedAt(),
                    m.getUpdatedAt()
            );
        } catch (JsonProcessingException e) {
            // 저장 시 검증을 거치므로 여기 오면 데이터 손상
            throw new IllegalStateException("stored content is not valid JSON: message=" + m.getId(), e);
        }
    }
}
