package com.realtime.dm.friend.entity;

import com.realtime.dm.common.PairKey;
import com.realtime.dm.friend.model.FriendshipStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * 방향이 있는 친구 관계(요청자 → 받는 사람). 순서 없는 쌍(pair_low, pair_high)당 한 행만 존재한다.
 */
@Entity
@Table(
    name = "friendship_edges",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_friendship_pair", columnNames = {"pair_low", "pair_high"})
    },
    indexes = {
        @Index(name = "ix_friendship_requester", columnList = "requester_id"),
        @Index(name = "ix_friendship_addressee", columnList = "addressee_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FriendshipEdge {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private UUID requesterId;

    @Column(name = "addressee_id", nullable = false, updatable = false)
    private UUID addresseeId;

    @Column(name = "pair_low", nullable = false, updatable = false)
    private UUID pairLow;

    @Column(name = "pair_high", nullable = false, updatable = false)
    private UUID pairHigh;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FriendshipStatus status;

    @Column(name = "last_actor_id", nullable = false)
    private UUID lastActorId;

    // accept/block 동시 처리 시 한쪽만 성공
    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static FriendshipEdge pending(UUID requesterId, UUID addresseeId) {
        PairKey pair = PairKey.of(requesterId, addresseeId);
        return FriendshipEdge.builder()
                .requesterId(requesterId)
                .addresseeId(addresseeId)
                .pairLow(pair.low())
                .pairHigh(pair.high())
                .status(FriendshipStatus.PENDING)
                .lastActorId(requesterId)
                .build();
    }

    public boolean involves(UUID userId) {
        return requesterId.equals(userId) || addresseeId.equals(userId);
    }

    public UUID counterpartOf(UUID userId) {
        return requesterId.equals(userId) ? addresseeId : requesterId;
    }

    /** 전이표 밖의 변경은 IllegalStateException */
    public void transitionTo(FriendshipStatus next, UUID actorId) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(status + " → " + next + " is not allowed");
        }
        this.status = next;
        this.lastActorId = actorId;
    }
}
