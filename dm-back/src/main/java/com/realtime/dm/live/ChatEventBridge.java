package com.realtime.dm.live;

import com.realtime.dm.config.RabbitConfig;
import com.realtime.dm.conversation.repository.ConversationParticipantRepository;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.service.MessageContentValidator;
import com.realtime.dm.user.entity.User;
import com.realtime.dm.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * 브로커 → STOMP 중계. 인스턴스가 여러 대여도 각자 자기 세션에 뿌린다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatEventBridge {

    private final SimpMessagingTemplate messagingTemplate;
    private final ConversationParticipantRepository participantRepo;
    private final UserRepository userRepo;
    private final MessageContentValidator contentValidator;

    @Transactional(readOnly = true)
    @RabbitListener(queues = RabbitConfig.WS_BRIDGE_QUEUE)
    public void onEvent(
            MessageEvent event,
            @Header(name = AmqpHeaders.RECEIVED_ROUTING_KEY, required = false) String routingKey
    ) {
        UUID conversationId = resolveConversationId(event, routingKey);
        if (conversationId == null) return;

        // 1) 대화 타임라인 구독자에게 원문 이벤트
        messagingTemplate.convertAndSend(LiveTopics.conversation(conversationId), event);

        // 2) 새 메시지면 상대 참여자에게 미리보기 알림
        if (event.getType() == MessageEvent.Type.INSERT && event.getMessage() != null) {
            notifyParticipants(conversationId, event.getMessage());
        }
    }

    private void notifyParticipants(UUID conversationId, MessageDto message) {
        UUID authorId = message.authorId();
        String label = userRepo.findById(authorId).map(User::getLabel).orElse(String.valueOf(authorId));
        String preview = abbreviate(contentValidator.plainText(message.content()), 80);
        long createdAt = message.createdAt() != null ? message.createdAt().toEpochMilli() : System.currentTimeMillis();

        List<UUID> participantIds = participantRepo.findParticipantIds(conversationId);
        for (UUID uid : participantIds) {
            // 본인에게는 알림 X
            if (uid.equals(authorId)) continue;

            ChatNotify notif = ChatNotify.builder()
                    .type("MESSAGE")
                    .conversationId(conversationId.toString())
                    .messageId(message.id())
                    .senderUserId(authorId.toString())
                    .username(label)
                    .preview(preview)
                    .createdAt(createdAt)
                    .build();

            messagingTemplate.convertAndSend(LiveTopics.notify(uid), notif);
        }
    }

    private UUID resolveConversationId(MessageEvent e, String rk) {
        if (e.getConversationId() != null) return e.getConversationId();
        if (rk != null && rk.startsWith(RabbitConfig.ROUTING_KEY_PREFIX)) {
            try {
                return UUID.fromString(rk.substring(RabbitConfig.ROUTING_KEY_PREFIX.length()));
            } catch (IllegalArgumentException ex) {
                log.warn("WS bridge: routing key is not a conversation id: {}", rk);
            }
        }
        log.warn("WS bridge dropped: conversationId missing. rk={}, payload={}", rk, e);
        return null;
    }

    static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, Math.max(0, max - 1)) + "…";
    }
}
