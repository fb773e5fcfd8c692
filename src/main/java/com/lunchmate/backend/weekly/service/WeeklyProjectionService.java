package com.lunchmate.backend.weekly.service;

import com.lunchmate.backend.common.error.DomainException;
import com.lunchmate.backend.common.time.DayKey;
import com.lunchmate.backend.meal.dto.MealInfo;
import com.lunchmate.backend.meal.service.MealCatalog;
import com.lunchmate.backend.menuday.dto.MenuDayDto;
import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.entity.MenuDishSlots;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import com.lunchmate.backend.order.dto.OrderDto;
import com.lunchmate.backend.order.entity.OrderEntity;
import com.lunchmate.backend.order.model.OrderStatus;
import com.lunchmate.backend.order.repo.OrderRepository;
import com.lunchmate.backend.review.dto.RatingSummary;
import com.lunchmate.backend.review.service.RatingAggregator;
import com.lunchmate.backend.weekly.dto.DayProjection;
import com.lunchmate.backend.weekly.dto.DishInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only join of a cook's week with one customer's orders, meal details and ratings.
 */
@Slf4j
@Service
public class WeeklyProjectionService {

    private final MenuDayRepository menuDays;
    private final OrderRepository orders;
    private final MealCatalog catalog;
    private final RatingAggregator ratings;
    private final Clock clock;
    private final int weekLengthDays;

    public WeeklyProjectionService(MenuDayRepository menuDays,
                                   OrderRepository orders,
                                   MealCatalog catalog,
                                   RatingAggregator ratings,
                                   Clock clock,
                                   @Value("${app.menu.week-length-days:7}") int weekLengthDays) {
        this.menuDays = menuDays;
        this.orders = orders;
        this.catalog = catalog;
        this.ratings = ratings;
        this.clock = clock;
        this.weekLengthDays = weekLengthDays;
    }

    @Transactional(readOnly = true)
    public List<DayProjection> projectWeek(String customerId, String cookId, LocalDate weekStartLocal) {
        if (customerId == null || customerId.isBlank()) throw DomainException.invalidArgument("customerId is required");
        if (cookId == null || cookId.isBlank()) throw DomainException.invalidArgument("cookId is required");
        if (weekStartLocal == null) throw DomainException.invalidArgument("weekStart is required");

        String customer = customerId.trim();
        String cook = cookId.trim();
        LocalDate start = DayKey.normalizeLocalDate(weekStartLocal);
        LocalDate end = start.plusDays(weekLengthDays);

        Map<LocalDate, MenuDayEntity> dayByDate = new HashMap<>();
        for (MenuDayEntity m : menuDays.findRange(cook, start, end)) dayByDate.put(m.getLocalDate(), m);

        Map<Instant, OrderEntity> orderByKey = new HashMap<>();
        for (OrderEntity o : orders.findCustomerRange(customer, DayKey.utcKey(start), DayKey.utcKey(end), cook)) {
            orderByKey.put(o.getDeliveryDateUtc(), o);
        }

        List<String> mealIds = dayByDate.values().stream()
                .flatMap(m -> m.getDishes().stream())
                .filter(MenuDish::hasMeal)
                .map(MenuDish::getMealId)
                .distinct()
                .toList();
        Map<String, MealInfo> meals = mealIds.isEmpty() ? Map.of() : catalog.getMeals(mealIds);
        Map<String, RatingSummary> stars = mealIds.isEmpty() ? Map.of() : ratings.averageRatings(mealIds);

        Instant now = Instant.now(clock);
        List<DayProjection> out = new ArrayList<>(weekLengthDays);
        for (int i = 0; i < weekLengthDays; i++) {
            LocalDate date = start.plusDays(i);
            MenuDayEntity day = dayByDate.get(date);
            OrderEntity order = orderByKey.get(DayKey.utcKey(date));

            boolean cancellable = order != null
                    && order.getStatus() != OrderStatus.CANCELLED
                    && !now.isAfter(order.getCancelUntilUtc());

            out.add(new DayProjection(
                    date,
                    day == null ? null : MenuDayDto.from(day),
                    order == null ? null : OrderDto.from(order, cancellable),
                    order == null || order.getStatus() == OrderStatus.CANCELLED ? null : order.getMealId(),
                    cancellable,
                    day == null ? List.of() : hydrate(day, meals, stars)
            ));
        }
        log.debug("projected week customerId={} cookId={} start={} menuDays={} orders={}",
                customer, cook, start, dayByDate.size(), orderByKey.size());
        return out;
    }

    private static List<DishInfo> hydrate(MenuDayEntity day, Map<String, MealInfo> meals, Map<String, RatingSummary> stars) {
        List<DishInfo> out = new ArrayList<>();
        for (MenuDish d : MenuDishSlots.ensureThree(day.getDishes())) {
            if (!d.hasMeal()) continue;
            MealInfo m = meals.get(d.getMealId());
            RatingSummary r = stars.getOrDefault(d.getMealId(), RatingSummary.NONE);
            String name = (m != null && m.name() != null && !m.name().isBlank()) ? m.name() : d.getName();
            out.add(new DishInfo(
                    d.getDishIndex(),
                    d.getMealId(),
                    name,
                    d.getNotes(),
                    m == null ? null : m.description(),
                    m == null ? null : m.ingredients(),
                    m == null ? BigDecimal.ZERO : m.price(),
                    m == null ? null : m.imageUrl(),
                    m == null ? null : m.cookName(),
                    r.average(),
                    r.count()
            ));
        }
        return out;
    }
}
