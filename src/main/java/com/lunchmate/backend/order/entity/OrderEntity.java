package com.lunchmate.backend.order.entity;

import com.lunchmate.backend.order.model.OrderStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "orders",
        uniqueConstraints = @UniqueConstraint(
                name = "ux_orders_customer_cook_day",
                columnNames = {"customer_id", "cook_id", "delivery_date_utc"}
        ),
        indexes = @Index(name = "ix_orders_cook_day", columnList = "cook_id,delivery_date_utc")
)
public class OrderEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "customer_id", nullable = false, length = 64)
    private String customerId;

    @Column(name = "cook_id", nullable = false, length = 64)
    private String cookId;

    @Column(name = "meal_id", nullable = false, length = 64)
    private String mealId;

    /** 00:00 UTC of the delivery calendar date; see DayKey#utcKey */
    @Column(name = "delivery_date_utc", nullable = false)
    private Instant deliveryDateUtc;

    @Column(name = "price_at_order", nullable = false, precision = 10, scale = 2)
    private BigDecimal priceAtOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OrderStatus status = OrderStatus.PENDING;

    @Column(name = "cancel_until_utc", nullable = false)
    private Instant cancelUntilUtc;

    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
