package com.lunchmate.backend.menuday.dto;

import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDishSlots;
import com.lunchmate.backend.menuday.model.MenuDayStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Read snapshot of a menu day; always carries slots 1..3. */
public record MenuDayDto(
        Long id,
        String cookId,
        LocalDate date,
        MenuDayStatus status,
        String timeZone,
        List<MenuDishDto> dishes,
        Instant publishedAt,
        Instant closedAt,
        int confirmationsCount,
        Instant updatedAt
) {
    public static MenuDayDto from(MenuDayEntity e) {
        List<MenuDishDto> dishes = MenuDishSlots.ensureThree(e.getDishes()).stream()
                .map(MenuDishDto::from)
                .toList();
        return new MenuDayDto(
                e.getId(),
                e.getCookId(),
                e.getLocalDate(),
                e.getStatus(),
                e.getTimeZone(),
                dishes,
                e.getPublishedAt(),
                e.getClosedAt(),
                e.getConfirmationsCount(),
                e.getUpdatedAt()
        );
    }
}
