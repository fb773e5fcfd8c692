package com.lunchmate.backend.review;

import com.lunchmate.backend.review.dto.RatingSummary;
import com.lunchmate.backend.review.repo.MealReviewRepository;
import com.lunchmate.backend.review.service.JpaRatingAggregator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class JpaRatingAggregatorTest {

    private final MealReviewRepository repo = mock(MealReviewRepository.class);
    private final JpaRatingAggregator aggregator = new JpaRatingAggregator(repo);

    @Test
    void mealsWithoutReviews_defaultToZero() {
        MealReviewRepository.RatingView v = mock(MealReviewRepository.RatingView.class);
        when(v.getMealId()).thenReturn("m1");
        when(v.getAverage()).thenReturn(4.5);
        when(v.getTotal()).thenReturn(2L);
        when(repo.aggregateByMealIds(anyCollection())).thenReturn(List.of(v));

        Map<String, RatingSummary> out = aggregator.averageRatings(List.of("m1", "m2"));

        assertEquals(new RatingSummary(4.5, 2), out.get("m1"));
        assertEquals(RatingSummary.NONE, out.get("m2"));
    }

    @Test
    void emptyInput_skipsQuery() {
        assertTrue(aggregator.averageRatings(List.of()).isEmpty());
        assertEquals(RatingSummary.NONE, aggregator.averageRating(null));
        verifyNoInteractions(repo);
    }
}
