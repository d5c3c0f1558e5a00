package com.realtime.dm.conversation.repository;

import com.realtime.dm.conversation.entity.ConversationParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConversationParticipantRepository extends JpaRepository<ConversationParticipant, Long> {

    boolean existsByConversationIdAndUserId(UUID conversationId, UUID userId);

    Optional<ConversationParticipant> findByConversationIdAndUserId(UUID conversationId, UUID userId);

    List<ConversationParticipant> findByUserId(UUID userId);

    List<ConversationParticipant> findByConversationIdIn(Collection<UUID> conversationIds);

    /** 대화 참여자들의 UUID 목록 */
    @Query("""
           select p.userId
           from ConversationParticipant p
           where p.conversationId = :conversationId
           """)
    List<UUID> findParticipantIds(@Param("conversationId") UUID conversationId);

    /** 미읽음 +1 (보낸 본인 제외) */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update ConversationParticipant p
           set p.unreadCount = p.unreadCount + 1
           where p.conversationId = :conversationId
             and p.userId <> :authorId
           """)
    int bumpUnread(@Param("conversationId") UUID conversationId, @Param("authorId") UUID authorId);

    /** 내 미읽음 0으로 */
    @Modifying(clearAutomatically = true)
    @Query("""
           update ConversationParticipant p
           set p.unreadCount = 0
           where p.conversationId = :conversationId
             and p.userId = :userId
           """)
    int resetUnread(@Param("conversationId") UUID conversationId, @Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ConversationParticipant p where p.conversationId = :conversationId")
    int deleteByConversationId(@Param("conversationId") UUID conversationId);
}
