package com.lunchmate.backend.menuday.dto;

import com.lunchmate.backend.menuday.model.MenuDayStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/** a missing status keeps the stored one (DRAFT for a new day), timeZone defaults to the client header / configured default. */
public record UpsertMenuDayRequest(
        @Valid @Size(max = 10) List<MenuDishDto> dishes,
        MenuDayStatus status,
        @Size(max = 64) String timeZone
) {}
