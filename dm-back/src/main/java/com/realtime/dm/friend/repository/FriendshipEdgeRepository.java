package com.realtime.dm.friend.repository;

import com.realtime.dm.friend.entity.FriendshipEdge;
import com.realtime.dm.friend.model.FriendshipStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FriendshipEdgeRepository extends JpaRepository<FriendshipEdge, Long> {

    Optional<FriendshipEdge> findByPairLowAndPairHigh(UUID pairLow, UUID pairHigh);

    boolean existsByPairLowAndPairHighAndStatus(UUID pairLow, UUID pairHigh, FriendshipStatus status);

    long countByPairLowAndPairHigh(UUID pairLow, UUID pairHigh);

    /** 내가 어느 쪽이든 관련된 관계 (최근 변경 순) */
    @Query("""
           select e from FriendshipEdge e
           where (e.requesterId = :userId or e.addresseeId = :userId)
             and (:status is null or e.status = :status)
           order by e.updatedAt desc, e.id desc
           """)
    List<FriendshipEdge> findInvolving(@Param("userId") UUID userId,
                                       @Param("status") FriendshipStatus status);
}
