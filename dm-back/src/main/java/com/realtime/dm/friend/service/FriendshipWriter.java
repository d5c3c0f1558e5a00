package com.realtime.dm.friend.service;

import com.realtime.dm.friend.entity.FriendshipEdge;
import com.realtime.dm.friend.repository.FriendshipEdgeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * INSERT 전용. 별도 트랜잭션으로 즉시 flush 해서
 * uk_friendship_pair 위반이 호출자에게 DataIntegrityViolationException 으로 바로 보이게 한다.
 */
@Component
@RequiredArgsConstructor
public class FriendshipWriter {

    private final FriendshipEdgeRepository edgeRepo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FriendshipEdge insertPending(UUID requesterId, UUID addresseeId) {
        return edgeRepo.saveAndFlush(FriendshipEdge.pending(requesterId, addresseeId));
    }
}
