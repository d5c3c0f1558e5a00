package com.realtime.dm.notify;

import com.realtime.dm.live.LiveTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 서비스가 트랜잭션 안에서 발행한 NotifyEvent 를 커밋 이후에만 전송한다.
 * 트랜잭션 밖에서 발행된 경우(fallbackExecution) 즉시 전송.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotifyPublisher {

    private final SimpMessagingTemplate messaging;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotify(NotifyEvent event) {
        if (event.getTo() == null) {
            log.warn("notify dropped: recipient missing. type={}", event.getType());
            return;
        }
        try {
            messaging.convertAndSend(LiveTopics.notify(event.getTo()), event);
        } catch (MessagingException e) {
            // 알림은 부가 기능: 커밋된 변경은 되돌리지 않는다
            log.warn("notify send failed: type={} to={} cause={}", event.getType(), event.getTo(), e.getMessage());
        }
    }
}
