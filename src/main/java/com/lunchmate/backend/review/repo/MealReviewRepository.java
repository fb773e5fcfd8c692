package com.lunchmate.backend.review.repo;

import com.lunchmate.backend.review.entity.MealReviewEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface MealReviewRepository extends JpaRepository<MealReviewEntity, Long> {

    interface RatingView {
        String getMealId();
        Double getAverage();
        Long getTotal();
    }

    @Query("""
        select r.mealId as mealId, avg(r.rating) as average, count(r) as total
          from MealReviewEntity r
         where r.mealId in :mealIds
         group by r.mealId
    """)
    List<RatingView> aggregateByMealIds(@Param("mealIds") Collection<String> mealIds);
}
