package com.lunchmate.backend.order.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record PlaceOrderRequest(
        @NotBlank @Size(max = 64) String cookId,
        @NotBlank @Size(max = 64) String mealId,
        @NotNull LocalDate date,
        @Size(max = 64) String timeZone
) {}
