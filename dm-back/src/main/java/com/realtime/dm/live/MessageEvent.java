package com.realtime.dm.live;

import com.realtime.dm.message.dto.MessageDto;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 대화 단위 라이브 이벤트. INSERT/UPDATE 는 전체 행, DELETE 는 id 만 가진다.
 * 같은 형태로 Spring 이벤트 → RabbitMQ → STOMP 까지 그대로 흐른다.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
@ToString
public class MessageEvent {

    public enum Type { INSERT, UPDATE, DELETE }

    private Type type;
    private UUID conversationId;
    private Long messageId;
    private MessageDto message;   // DELETE 면 null
    private Instant occurredAt;

    public static MessageEvent insert(MessageDto m) {
        return of(Type.INSERT, m.conversationId(), m.id(), m);
    }

    public static MessageEvent update(MessageDto m) {
        return of(Type.UPDATE, m.conversationId(), m.id(), m);
    }

    public static MessageEvent delete(UUID conversationId, Long messageId) {
        return of(Type.DELETE, conversationId, messageId, null);
    }

    private static MessageEvent of(Type type, UUID conversationId, Long messageId, MessageDto m) {
        return MessageEvent.builder()
                .type(type)
                .conversationId(conversationId)
                .messageId(messageId)
                .message(m)
                .occurredAt(Instant.now())
                .build();
    }
}
