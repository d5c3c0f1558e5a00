package com.realtime.dm.live;

import com.realtime.dm.config.RabbitConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋된 메시지 변경만 브로커로 내보낸다 (롤백된 INSERT 가 화면에 뜨지 않도록).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatFanoutService {

    private final RabbitTemplate rabbitTemplate;

    @Async("chatExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onMessageEvent(MessageEvent event) {
        String routingKey = RabbitConfig.routingKey(event.getConversationId());
        rabbitTemplate.convertAndSend(RabbitConfig.DM_EXCHANGE, routingKey, event);
        log.debug("fanout {} message={} rk={}", event.getType(), event.getMessageId(), routingKey);
    }
}
