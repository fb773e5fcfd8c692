package com.lunchmate.backend.meal.service;

import com.lunchmate.backend.meal.dto.MealInfo;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the meal catalog. Orders copy the price from here at order time.
 */
public interface MealCatalog {

    Optional<MealInfo> getMeal(String mealId);

    /** Unknown ids are absent from the result. */
    Map<String, MealInfo> getMeals(Collection<String> mealIds);
}
