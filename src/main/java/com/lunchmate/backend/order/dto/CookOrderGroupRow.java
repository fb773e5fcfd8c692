package com.lunchmate.backend.order.dto;

import java.time.LocalDate;

/** Per (day, meal) totals; inProcess counts PENDING orders. */
public record CookOrderGroupRow(
        LocalDate date,
        String mealId,
        String mealName,
        int total,
        int cancelled,
        int inProcess,
        int ready,
        int delivered
) {}
