package com.lunchmate.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Opaque bearer token. Issuing tokens belongs to the login service; this service only validates them.
 */
@Data
@Entity
@Table(name = "auth_tokens", indexes = @Index(name = "ix_auth_tokens_user", columnList = "user_id"))
public class AuthToken {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean revoked = false;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isActiveAt(Instant now) {
        return !revoked && expiresAt != null && expiresAt.isAfter(now);
    }
}
