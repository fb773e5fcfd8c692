package com.lunchmate.backend.meal.dto;

import com.lunchmate.backend.meal.entity.MealEntity;

import java.math.BigDecimal;

public record MealInfo(
        String id,
        String cookId,
        String name,
        BigDecimal price,
        String description,
        String imageUrl,
        String ingredients,
        String cookName,
        boolean active
) {
    public static MealInfo from(MealEntity e) {
        return new MealInfo(
                e.getId(),
                e.getCookId(),
                e.getName(),
                e.getPrice() == null ? BigDecimal.ZERO : e.getPrice(),
                e.getDescription(),
                e.getImageUrl(),
                e.getIngredients(),
                e.getCookName(),
                e.isActive()
        );
    }
}
