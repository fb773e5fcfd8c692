package com.lunchmate.backend.menuday.dto;

import com.lunchmate.backend.menuday.entity.MenuDish;

public record MenuDishDto(int index, String mealId, String name, String notes) {

    public static MenuDishDto from(MenuDish d) {
        return new MenuDishDto(d.getDishIndex(), d.getMealId(), d.getName(), d.getNotes());
    }

    public MenuDish toEmbeddable() {
        return new MenuDish(index, mealId, name, notes);
    }
}
