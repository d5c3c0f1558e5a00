package com.realtime.dm.conversation.service;

import com.realtime.dm.conversation.repository.ConversationParticipantRepository;
import com.realtime.dm.live.MessageEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 메시지 INSERT 커밋 이후 상대 참여자 미읽음 +1. append 자체는 단일 행 INSERT 로 유지된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UnreadTracker {

    private final ConversationParticipantRepository participantRepo;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onMessageEvent(MessageEvent event) {
        if (event.getType() != MessageEvent.Type.INSERT || event.getMessage() == null) return;
        int bumped = participantRepo.bumpUnread(event.getConversationId(), event.getMessage().authorId());
        log.debug("unread bumped: conversation={} rows={}", event.getConversationId(), bumped);
    }
}
