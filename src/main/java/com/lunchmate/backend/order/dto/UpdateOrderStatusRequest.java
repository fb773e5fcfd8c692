package com.lunchmate.backend.order.dto;

import com.lunchmate.backend.order.model.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateOrderStatusRequest(@NotNull OrderStatus status) {}
