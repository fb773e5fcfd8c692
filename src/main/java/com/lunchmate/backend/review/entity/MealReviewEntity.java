package com.lunchmate.backend.review.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One review per (meal, user).
 */
@Getter
@Setter
@Entity
@Table(
        name = "meal_reviews",
        uniqueConstraints = @UniqueConstraint(name = "ux_reviews_meal_user", columnNames = {"meal_id", "user_id"}),
        indexes = @Index(name = "ix_reviews_meal", columnList = "meal_id")
)
public class MealReviewEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "meal_id", nullable = false, length = 64)
    private String mealId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    /** 1..5 */
    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "comment", length = 1000)
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
