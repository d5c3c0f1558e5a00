package com.realtime.dm.message.entity;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import jakarta.persistence.*;
import lombok.*;

/**
 * 대화 메시지. 정렬 키는 (created_at, id). 같은 시각 충돌은 단조 증가 id 로 가른다.
 */
@Entity
@Table(
        name = "messages",
        indexes = {
                @Index(name = "ix_messages_conversation_created", columnList = "conversation_id, created_at desc, id desc"),
                @Index(name = "ix_messages_author", columnList = "author_id")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, updatable = false)
    private UUID conversationId;

    @Column(name = "author_id", nullable = false, updatable = false)
    private UUID authorId;

    /** 정제된 문서(JSON 문자열) */
    @Column(nullable = false, length = 8000)
    private String content;

    // 컬럼 정밀도(µs)에 맞춰 잘라서 저장 → 작성자에게 돌려준 값 = 커서 값
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = now();
    }

    public void edit(String newContent) {
        this.content = newContent;
        this.updatedAt = now();
    }

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
