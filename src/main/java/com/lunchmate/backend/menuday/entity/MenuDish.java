package com.lunchmate.backend.menuday.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@Embeddable
public class MenuDish {

    @Column(name = "dish_index", nullable = false)
    private int dishIndex;

    /** null when the slot is not bound to a catalog meal */
    @Column(name = "meal_id", length = 64)
    private String mealId;

    @Column(name = "name", nullable = false, length = 160)
    private String name = "";

    @Column(name = "notes", nullable = false, length = 500)
    private String notes = "";

    public static MenuDish empty(int index) {
        return new MenuDish(index, null, "", "");
    }

    public MenuDish copy() {
        return new MenuDish(dishIndex, mealId, name, notes);
    }

    public boolean hasMeal() {
        return mealId != null && !mealId.isBlank();
    }
}
