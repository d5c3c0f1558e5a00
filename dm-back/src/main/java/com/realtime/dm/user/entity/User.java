package com.realtime.dm.user.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "users",
        uniqueConstraints = @UniqueConstraint(name = "uk_users_username", columnNames = "username")
)
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class User {

    /** Identity Provider가 발급한 식별자 (JWT subject) */
    @Id
    private UUID id;

    /** 소문자로 저장/조회 */
    @Column(nullable = false, length = 50)
    private String username;

    /** 화면 표시용 이름 */
    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "avatar_url", length = 512)
    private String avatarUrl;

    /** online / idle / dnd / offline (사용자가 직접 고른 상태) */
    @Builder.Default
    @Column(nullable = false, length = 16)
    private String status = "online";

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public String getLabel() {
        return (displayName != null && !displayName.isBlank()) ? displayName : username;
    }
}
