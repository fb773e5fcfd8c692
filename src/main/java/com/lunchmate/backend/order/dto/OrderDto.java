package com.lunchmate.backend.order.dto;

import com.lunchmate.backend.common.time.DayKey;
import com.lunchmate.backend.order.entity.OrderEntity;
import com.lunchmate.backend.order.model.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/** canCancel is evaluated against the clock when the snapshot is taken. */
public record OrderDto(
        String id,
        String customerId,
        String cookId,
        String mealId,
        LocalDate deliveryDate,
        Instant deliveryDateUtc,
        BigDecimal priceAtOrder,
        OrderStatus status,
        Instant cancelUntilUtc,
        String timeZone,
        boolean canCancel,
        Instant createdAt,
        Instant updatedAt
) {
    public static OrderDto from(OrderEntity e, boolean canCancel) {
        return new OrderDto(
                e.getId(),
                e.getCustomerId(),
                e.getCookId(),
                e.getMealId(),
                DayKey.fromUtcKey(e.getDeliveryDateUtc()),
                e.getDeliveryDateUtc(),
                e.getPriceAtOrder(),
                e.getStatus(),
                e.getCancelUntilUtc(),
                e.getTimeZone(),
                canCancel,
                e.getCreatedAt(),
                e.getUpdatedAt()
        );
    }
}
