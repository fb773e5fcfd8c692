package com.lunchmate.backend.order.dto;

import com.lunchmate.backend.order.model.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/** One line per order on the cook's board. */
public record CookOrderRow(
        String orderId,
        LocalDate date,
        String customerId,
        String customerName,
        String mealId,
        String mealName,
        BigDecimal priceAtOrder,
        OrderStatus status,
        Instant cancelUntilUtc,
        Instant createdAt
) {}
