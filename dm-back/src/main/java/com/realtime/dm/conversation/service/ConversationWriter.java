package com.realtime.dm.conversation.service;

import com.realtime.dm.common.PairKey;
import com.realtime.dm.conversation.entity.Conversation;
import com.realtime.dm.conversation.entity.ConversationParticipant;
import com.realtime.dm.conversation.repository.ConversationParticipantRepository;
import com.realtime.dm.conversation.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * 대화방 + 참여자 2행을 한 트랜잭션으로 생성. uk_conversation_dm_key 위반은 호출자가 처리한다.
 */
@Component
@RequiredArgsConstructor
public class ConversationWriter {

    private final ConversationRepository conversationRepo;
    private final ConversationParticipantRepository participantRepo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Conversation createDm(PairKey pair) {
        Conversation c = conversationRepo.saveAndFlush(Conversation.builder()
                .id(UUID.randomUUID())
                .dmKey(pair.asKey())
                .build());

        participantRepo.saveAllAndFlush(List.of(
                ConversationParticipant.builder().conversationId(c.getId()).userId(pair.low()).build(),
                ConversationParticipant.builder().conversationId(c.getId()).userId(pair.high()).build()
        ));
        return c;
    }
}
