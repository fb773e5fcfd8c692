package com.lunchmate.backend.weekly.dto;

import com.lunchmate.backend.menuday.dto.MenuDayDto;
import com.lunchmate.backend.order.dto.OrderDto;

import java.time.LocalDate;
import java.util.List;

/**
 * One calendar day as the customer sees it. menuDay and myOrder are null when absent;
 * dishes only holds slots that are bound to a meal.
 */
public record DayProjection(
        LocalDate date,
        MenuDayDto menuDay,
        OrderDto myOrder,
        String selectedMealId,
        boolean canCancel,
        List<DishInfo> dishes
) {}
