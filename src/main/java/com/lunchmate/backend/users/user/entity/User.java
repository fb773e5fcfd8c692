package com.lunchmate.backend.users.user.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(
        name = "users",
        uniqueConstraints = @UniqueConstraint(name = "ux_users_email", columnNames = {"email"})
)
public class User {

    /** Issued by the identity provider; opaque here. */
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "name", length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private UserRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase();
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
