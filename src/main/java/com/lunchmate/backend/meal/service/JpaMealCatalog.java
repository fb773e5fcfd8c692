package com.lunchmate.backend.meal.service;

import com.lunchmate.backend.meal.dto.MealInfo;
import com.lunchmate.backend.meal.repo.MealRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaMealCatalog implements MealCatalog {

    private final MealRepository meals;

    @Override
    public Optional<MealInfo> getMeal(String mealId) {
        if (mealId == null || mealId.isBlank()) return Optional.empty();
        return meals.findById(mealId).map(MealInfo::from);
    }

    @Override
    public Map<String, MealInfo> getMeals(Collection<String> mealIds) {
        if (mealIds == null || mealIds.isEmpty()) return Map.of();
        var ids = mealIds.stream().filter(Objects::nonNull).filter(s -> !s.isBlank()).distinct().toList();
        if (ids.isEmpty()) return Map.of();
        return meals.findAllById(ids).stream()
                .map(MealInfo::from)
                .collect(Collectors.toMap(MealInfo::id, m -> m));
    }
}
