package com.lunchmate.backend.review.service;

import com.lunchmate.backend.review.dto.RatingSummary;
import com.lunchmate.backend.review.repo.MealReviewRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaRatingAggregator implements RatingAggregator {

    private final MealReviewRepository reviews;

    @Override
    public RatingSummary averageRating(String mealId) {
        if (mealId == null || mealId.isBlank()) return RatingSummary.NONE;
        return averageRatings(List.of(mealId)).getOrDefault(mealId, RatingSummary.NONE);
    }

    @Override
    public Map<String, RatingSummary> averageRatings(Collection<String> mealIds) {
        if (mealIds == null || mealIds.isEmpty()) return Map.of();
        List<String> ids = mealIds.stream().filter(Objects::nonNull).filter(s -> !s.isBlank()).distinct().toList();
        Map<String, RatingSummary> out = new HashMap<>();
        ids.forEach(id -> out.put(id, RatingSummary.NONE));
        if (ids.isEmpty()) return out;

        for (MealReviewRepository.RatingView v : reviews.aggregateByMealIds(ids)) {
            double avg = v.getAverage() == null ? 0.0 : v.getAverage();
            long total = v.getTotal() == null ? 0L : v.getTotal();
            out.put(v.getMealId(), new RatingSummary(avg, total));
        }
        return out;
    }
}
