package com.lunchmate.backend.weekly.dto;

import java.math.BigDecimal;

public record DishInfo(
        int index,
        String mealId,
        String name,
        String notes,
        String description,
        String ingredients,
        BigDecimal price,
        String imageUrl,
        String cookName,
        double averageRating,
        long totalReviews
) {}
