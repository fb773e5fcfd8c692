package com.lunchmate.backend.menuday.service;

import com.lunchmate.backend.common.error.DomainException;
import com.lunchmate.backend.common.store.KeyedWriteTemplate;
import com.lunchmate.backend.common.time.DayKey;
import com.lunchmate.backend.common.time.TimeZoneResolver;
import com.lunchmate.backend.meal.dto.MealInfo;
import com.lunchmate.backend.meal.service.MealCatalog;
import com.lunchmate.backend.menuday.dto.MenuDayDto;
import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.entity.MenuDishSlots;
import com.lunchmate.backend.menuday.model.MenuDayStatus;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cook-side menu days, one row per (cookId, localDate).
 * Cook edits are not gated by the order cutoff; only the status machine restricts them.
 */
@Slf4j
@Service
public class MenuDayService {

    private final MenuDayRepository repo;
    private final MealCatalog catalog;
    private final TimeZoneResolver timeZones;
    private final KeyedWriteTemplate writes;
    private final Clock clock;
    private final String defaultTimeZone;
    private final int weekLengthDays;

    public MenuDayService(MenuDayRepository repo,
                          MealCatalog catalog,
                          TimeZoneResolver timeZones,
                          KeyedWriteTemplate writes,
                          Clock clock,
                          @Value("${app.order.default-time-zone:UTC}") String defaultTimeZone,
                          @Value("${app.menu.week-length-days:7}") int weekLengthDays) {
        this.repo = repo;
        this.catalog = catalog;
        this.timeZones = timeZones;
        this.writes = writes;
        this.clock = clock;
        this.defaultTimeZone = defaultTimeZone;
        this.weekLengthDays = weekLengthDays;
    }

    public MenuDayDto getOrCreate(String cookId, LocalDate date) {
        String cook = requireCookId(cookId);
        LocalDate day = requireDate(date);

        return writes.execute("menuDay.getOrCreate", tx ->
                repo.findByCookIdAndLocalDate(cook, day)
                        .map(MenuDayDto::from)
                        .orElseGet(() -> {
                            MenuDayEntity created = newDraft(cook, day, defaultTimeZone, Instant.now(clock));
                            log.debug("creating draft menu day cookId={} date={}", cook, day);
                            return MenuDayDto.from(repo.saveAndFlush(created));
                        }));
    }

    public MenuDayDto upsert(String cookId, LocalDate date, List<MenuDish> dishes,
                             MenuDayStatus status, String timeZone) {
        String cook = requireCookId(cookId);
        LocalDate day = requireDate(date);
        String zone = normalizeTimeZone(timeZone);
        List<MenuDish> slots = MenuDishSlots.ensureThree(fillNamesFromCatalog(dishes));

        return writes.execute("menuDay.upsert", tx -> {
            Instant now = Instant.now(clock);
            MenuDayEntity e = repo.findByCookIdAndLocalDate(cook, day)
                    .orElseGet(() -> newDraft(cook, day, zone, now));

            // no status in the request keeps the stored one; a new day starts as Draft
            MenuDayStatus target = status != null ? status : e.getStatus();
            applyStatus(e, target, now);
            e.replaceDishes(slots);
            e.setTimeZone(zone);
            e.setUpdatedAt(now);

            MenuDayEntity saved = repo.saveAndFlush(e);
            log.info("menu day saved cookId={} date={} status={}", cook, day, saved.getStatus());
            return MenuDayDto.from(saved);
        });
    }

    public MenuDayDto publish(String cookId, LocalDate date) {
        return changeStatus(cookId, date, MenuDayStatus.PUBLISHED);
    }

    public MenuDayDto close(String cookId, LocalDate date) {
        return changeStatus(cookId, date, MenuDayStatus.CLOSED);
    }

    /** Stored days only, ascending; days that were never touched are not synthesized. */
    @Transactional(readOnly = true)
    public List<MenuDayDto> getWeek(String cookId, LocalDate weekStartLocal) {
        String cook = requireCookId(cookId);
        LocalDate start = requireDate(weekStartLocal);
        return repo.findRange(cook, start, start.plusDays(weekLengthDays)).stream()
                .map(MenuDayDto::from)
                .toList();
    }

    private MenuDayDto changeStatus(String cookId, LocalDate date, MenuDayStatus target) {
        String cook = requireCookId(cookId);
        LocalDate day = requireDate(date);

        return writes.execute("menuDay." + target.name().toLowerCase(), tx -> {
            MenuDayEntity e = repo.findByCookIdAndLocalDate(cook, day)
                    .orElseThrow(() -> DomainException.notFound("no menu for day " + day));
            Instant now = Instant.now(clock);
            applyStatus(e, target, now);
            e.replaceDishes(MenuDishSlots.ensureThree(e.getDishes()));
            e.setUpdatedAt(now);
            return MenuDayDto.from(repo.saveAndFlush(e));
        });
    }

    /**
     * publishedAt is stamped once, the first time the day becomes Published.
     * closedAt follows the status: stamped on entering Closed, cleared otherwise.
     */
    static void applyStatus(MenuDayEntity e, MenuDayStatus next, Instant now) {
        MenuDayStatus prev = e.getStatus() == null ? MenuDayStatus.DRAFT : e.getStatus();
        if (!prev.canTransitionTo(next)) {
            throw DomainException.invalidTransition(prev, next);
        }
        if (next == MenuDayStatus.PUBLISHED && prev != MenuDayStatus.PUBLISHED && e.getPublishedAt() == null) {
            e.setPublishedAt(now);
        }
        if (next == MenuDayStatus.CLOSED) {
            if (prev != MenuDayStatus.CLOSED || e.getClosedAt() == null) e.setClosedAt(now);
        } else {
            e.setClosedAt(null);
        }
        e.setStatus(next);
    }

    private MenuDayEntity newDraft(String cookId, LocalDate day, String timeZone, Instant now) {
        MenuDayEntity e = new MenuDayEntity();
        e.setId(MenuDayEntity.keyFor(cookId, day));
        e.setCookId(cookId);
        e.setLocalDate(day);
        e.setStatus(MenuDayStatus.DRAFT);
        e.setTimeZone(timeZone);
        e.replaceDishes(MenuDishSlots.ensureThree(List.of()));
        e.setCreatedAt(now);
        e.setUpdatedAt(now);
        return e;
    }

    /** A slot bound to a meal but sent without a name shows the catalog name. */
    private List<MenuDish> fillNamesFromCatalog(List<MenuDish> dishes) {
        if (dishes == null || dishes.isEmpty()) return List.of();
        List<String> needNames = dishes.stream()
                .filter(d -> d != null && d.hasMeal() && (d.getName() == null || d.getName().isBlank()))
                .map(d -> d.getMealId().trim())
                .distinct()
                .toList();
        Map<String, MealInfo> meals = needNames.isEmpty() ? Map.of() : catalog.getMeals(needNames);

        List<MenuDish> out = new ArrayList<>(dishes.size());
        for (MenuDish d : dishes) {
            if (d == null) continue;
            MenuDish c = d.copy();
            if (c.hasMeal() && (c.getName() == null || c.getName().isBlank())) {
                MealInfo m = meals.get(c.getMealId().trim());
                if (m != null && m.name() != null) c.setName(m.name());
            }
            out.add(c);
        }
        return out;
    }

    private String normalizeTimeZone(String timeZone) {
        String raw = (timeZone == null || timeZone.isBlank()) ? defaultTimeZone : timeZone.trim();
        TimeZoneResolver.Resolution r = timeZones.resolve(raw);
        if (r.fellBack()) {
            log.warn("unknown time zone '{}' on menu day, storing UTC", raw);
            return "UTC";
        }
        return raw;
    }

    private static String requireCookId(String cookId) {
        if (cookId == null || cookId.isBlank()) throw DomainException.invalidArgument("cookId is required");
        return cookId.trim();
    }

    private static LocalDate requireDate(LocalDate date) {
        if (date == null) throw DomainException.invalidArgument("date is required");
        return DayKey.normalizeLocalDate(date);
    }
}
