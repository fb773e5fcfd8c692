package com.lunchmate.backend.menuday.entity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A menu day always has exactly slots 1, 2 and 3.
 * Missing slots become empty ones; slots outside 1..3 and repeated indices (first one wins) are dropped.
 * Applying it to its own output returns an equal list.
 */
public final class MenuDishSlots {

    public static final int SLOT_COUNT = 3;

    private MenuDishSlots() {}

    public static List<MenuDish> ensureThree(List<MenuDish> dishes) {
        Map<Integer, MenuDish> byIndex = new LinkedHashMap<>();
        if (dishes != null) {
            for (MenuDish d : dishes) {
                if (d == null) continue;
                int idx = d.getDishIndex();
                if (idx < 1 || idx > SLOT_COUNT) continue;
                byIndex.putIfAbsent(idx, normalize(d));
            }
        }
        for (int i = 1; i <= SLOT_COUNT; i++) {
            byIndex.putIfAbsent(i, MenuDish.empty(i));
        }

        List<MenuDish> out = new ArrayList<>(byIndex.values());
        out.sort(Comparator.comparingInt(MenuDish::getDishIndex));
        return out;
    }

    private static MenuDish normalize(MenuDish d) {
        String mealId = d.getMealId() == null || d.getMealId().isBlank() ? null : d.getMealId().trim();
        String name = d.getName() == null ? "" : d.getName().trim();
        String notes = d.getNotes() == null ? "" : d.getNotes().trim();
        return new MenuDish(d.getDishIndex(), mealId, name, notes);
    }
}
