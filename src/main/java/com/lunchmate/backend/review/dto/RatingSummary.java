package com.lunchmate.backend.review.dto;

public record RatingSummary(double average, long count) {

    public static final RatingSummary NONE = new RatingSummary(0.0, 0L);
}
