package com.lunchmate.backend.menuday.entity;

import com.lunchmate.backend.common.crypto.Sha256Keys;
import com.lunchmate.backend.menuday.model.MenuDayStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(
        name = "menu_days",
        uniqueConstraints = @UniqueConstraint(name = "ux_menu_days_cook_date", columnNames = {"cook_id", "local_date"})
)
public class MenuDayEntity {

    /** {@link #keyFor(String, LocalDate)}; the unique index is what actually guarantees one row per day. */
    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "cook_id", nullable = false, length = 64)
    private String cookId;

    @Column(name = "local_date", nullable = false)
    private LocalDate localDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MenuDayStatus status = MenuDayStatus.DRAFT;

    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "menu_day_dishes", joinColumns = @JoinColumn(name = "menu_day_id"))
    @OrderBy("dishIndex ASC")
    private List<MenuDish> dishes = new ArrayList<>();

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    /** Non-cancelled orders for this day. Written only by MenuDayRepository#adjustConfirmations, never by entity updates. */
    @Column(name = "confirmations_count", nullable = false, updatable = false)
    private int confirmationsCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public static long keyFor(String cookId, LocalDate localDate) {
        return Sha256Keys.positiveLong(cookId + "|" + localDate);
    }

    public void replaceDishes(List<MenuDish> normalized) {
        dishes.clear();
        for (MenuDish d : normalized) dishes.add(d.copy());
    }
}
