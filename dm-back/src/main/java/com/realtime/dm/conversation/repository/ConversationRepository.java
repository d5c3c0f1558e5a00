package com.realtime.dm.conversation.repository;

import com.realtime.dm.conversation.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    Optional<Conversation> findByDmKey(String dmKey);

    long countByDmKey(String dmKey);
}
