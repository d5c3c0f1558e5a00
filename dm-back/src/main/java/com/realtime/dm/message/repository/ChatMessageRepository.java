package com.realtime.dm.message.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.realtime.dm.message.entity.ChatMessage;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    // 최신 N개
    @Query("""
           select m from ChatMessage m
           where m.conversationId = :conversationId
           order by m.createdAt desc, m.id desc
           """)
    List<ChatMessage> findLatest(@Param("conversationId") UUID conversationId, Pageable pageable);

    // 시각 커서 이전 N개
    @Query("""
           select m from ChatMessage m
           where m.conversationId = :conversationId
             and m.createdAt < :before
           order by m.createdAt desc, m.id desc
           """)
    List<ChatMessage> findBefore(@Param("conversationId") UUID conversationId,
                                 @Param("before") Instant before,
                                 Pageable pageable);

    // (시각, id) 복합 커서 이전 N개: 경계 시각을 공유하는 메시지를 건너뛰지 않는다
    @Query("""
           select m from ChatMessage m
           where m.conversationId = :conversationId
             and (m.createdAt < :before
                  or (m.createdAt = :before and m.id < :beforeId))
           order by m.createdAt desc, m.id desc
           """)
    List<ChatMessage> findBeforeCursor(@Param("conversationId") UUID conversationId,
                                       @Param("before") Instant before,
                                       @Param("beforeId") Long beforeId,
                                       Pageable pageable);

    // millis 복합 커서: [before, boundaryEnd) 구간은 한 경계로 보고 id 로 가른다
    @Query("""
           select m from ChatMessage m
           where m.conversationId = :conversationId
             and (m.createdAt < :before
                  or (m.createdAt < :boundaryEnd and m.id < :beforeId))
           order by m.createdAt desc, m.id desc
           """)
    List<ChatMessage> findBeforeMillisCursor(@Param("conversationId") UUID conversationId,
                                             @Param("before") Instant before,
                                             @Param("boundaryEnd") Instant boundaryEnd,
                                             @Param("beforeId") Long beforeId,
                                             Pageable pageable);

    /** 대화별 마지막 메시지 (더 새 메시지가 없는 행) */
    @Query("""
           select m from ChatMessage m
           where m.conversationId in :conversationIds
             and not exists (
                 select n.id from ChatMessage n
                 where n.conversationId = m.conversationId
                   and (n.createdAt > m.createdAt
                        or (n.createdAt = m.createdAt and n.id > m.id))
             )
           """)
    List<ChatMessage> findLastPerConversation(@Param("conversationIds") Collection<UUID> conversationIds);

    long countByConversationId(UUID conversationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ChatMessage m where m.conversationId = :conversationId")
    int deleteByConversationId(@Param("conversationId") UUID conversationId);
}
