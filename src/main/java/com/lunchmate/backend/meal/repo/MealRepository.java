package com.lunchmate.backend.meal.repo;

import com.lunchmate.backend.meal.entity.MealEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MealRepository extends JpaRepository<MealEntity, String> {
}
