package com.lunchmate.backend.review.service;

import com.lunchmate.backend.review.dto.RatingSummary;

import java.util.Collection;
import java.util.Map;

public interface RatingAggregator {

    /** (0, 0) when the meal has no reviews. */
    RatingSummary averageRating(String mealId);

    /** Every requested id is present in the result; meals without reviews map to (0, 0). */
    Map<String, RatingSummary> averageRatings(Collection<String> mealIds);
}
