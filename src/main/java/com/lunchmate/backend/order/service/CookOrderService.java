package com.lunchmate.backend.order.service;

import com.lunchmate.backend.common.error.DomainException;
import com.lunchmate.backend.common.store.KeyedWriteTemplate;
import com.lunchmate.backend.common.time.DayKey;
import com.lunchmate.backend.meal.dto.MealInfo;
import com.lunchmate.backend.meal.service.MealCatalog;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import com.lunchmate.backend.order.dto.CookOrderGroupRow;
import com.lunchmate.backend.order.dto.CookOrderRow;
import com.lunchmate.backend.order.dto.OrderDto;
import com.lunchmate.backend.order.entity.OrderEntity;
import com.lunchmate.backend.order.model.OrderStatus;
import com.lunchmate.backend.order.repo.OrderRepository;
import com.lunchmate.backend.users.user.service.UserRoleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cook side of orders: status advancement (no cutoff restriction) and the order board views.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CookOrderService {

    private final OrderRepository orders;
    private final MenuDayRepository menuDays;
    private final MealCatalog catalog;
    private final UserRoleService users;
    private final KeyedWriteTemplate writes;
    private final Clock clock;

    public OrderDto advanceStatus(String cookId, String orderId, OrderStatus next) {
        String cook = OrderLifecycleService.requireId(cookId, "cookId");
        String id = OrderLifecycleService.requireId(orderId, "orderId");
        if (next == null) throw DomainException.invalidArgument("status is required");

        return writes.execute("order.advanceStatus", tx -> {
            // another cook's order looks the same as a missing one
            OrderEntity o = orders.findById(id)
                    .filter(x -> cook.equals(x.getCookId()))
                    .orElseThrow(() -> DomainException.notFound("order " + id));
            Instant now = Instant.now(clock);

            if (o.getStatus() == next) {
                return OrderDto.from(o, OrderLifecycleService.canCancel(o, now));
            }
            if (!o.getStatus().canTransitionTo(next)) {
                throw DomainException.invalidTransition(o.getStatus(), next);
            }

            OrderStatus prev = o.getStatus();
            o.setStatus(next);
            o.setUpdatedAt(now);
            OrderEntity saved = orders.saveAndFlush(o);

            if (prev.isActive() && !next.isActive()) {
                LocalDate day = DayKey.fromUtcKey(saved.getDeliveryDateUtc());
                menuDays.findByCookIdAndLocalDate(cook, day)
                        .ifPresent(m -> menuDays.adjustConfirmations(m.getId(), -1));
            }
            log.info("order status id={} {} -> {}", saved.getId(), prev, next);
            return OrderDto.from(saved, OrderLifecycleService.canCancel(saved, now));
        });
    }

    /**
     * One row per order in [fromLocal, toLocal). onDate narrows to a single day inside that range.
     */
    @Transactional(readOnly = true)
    public List<CookOrderRow> getOrdersExpanded(String cookId, LocalDate fromLocal, LocalDate toLocal,
                                                LocalDate onDate, String mealId) {
        String cook = OrderLifecycleService.requireId(cookId, "cookId");
        List<OrderEntity> rows = load(cook, fromLocal, toLocal, onDate, mealId);
        if (rows.isEmpty()) return List.of();

        Map<String, MealInfo> meals = catalog.getMeals(rows.stream().map(OrderEntity::getMealId).distinct().toList());
        Map<String, String> names = users.displayNames(rows.stream().map(OrderEntity::getCustomerId).distinct().toList());

        return rows.stream()
                .map(o -> new CookOrderRow(
                        o.getId(),
                        DayKey.fromUtcKey(o.getDeliveryDateUtc()),
                        o.getCustomerId(),
                        names.getOrDefault(o.getCustomerId(), o.getCustomerId()),
                        o.getMealId(),
                        mealName(meals, o.getMealId()),
                        o.getPriceAtOrder(),
                        o.getStatus(),
                        o.getCancelUntilUtc(),
                        o.getCreatedAt()))
                .toList();
    }

    /** Totals per (day, meal), sorted by day then meal name. */
    @Transactional(readOnly = true)
    public List<CookOrderGroupRow> getOrdersGrouped(String cookId, LocalDate fromLocal, LocalDate toLocal, String mealId) {
        String cook = OrderLifecycleService.requireId(cookId, "cookId");
        List<OrderEntity> rows = load(cook, fromLocal, toLocal, null, mealId);
        if (rows.isEmpty()) return List.of();

        Map<String, MealInfo> meals = catalog.getMeals(rows.stream().map(OrderEntity::getMealId).distinct().toList());

        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, OrderEntity> firstOfGroup = new LinkedHashMap<>();
        for (OrderEntity o : rows) {
            String k = o.getDeliveryDateUtc() + "|" + o.getMealId();
            firstOfGroup.putIfAbsent(k, o);
            int[] c = counts.computeIfAbsent(k, x -> new int[5]);
            c[0]++;
            switch (o.getStatus()) {
                case CANCELLED -> c[1]++;
                case PENDING -> c[2]++;
                case READY -> c[3]++;
                case DELIVERED -> c[4]++;
            }
        }

        List<CookOrderGroupRow> out = new ArrayList<>(counts.size());
        counts.forEach((k, c) -> {
            OrderEntity o = firstOfGroup.get(k);
            out.add(new CookOrderGroupRow(
                    DayKey.fromUtcKey(o.getDeliveryDateUtc()),
                    o.getMealId(),
                    mealName(meals, o.getMealId()),
                    c[0], c[1], c[2], c[3], c[4]));
        });
        out.sort(Comparator.comparing(CookOrderGroupRow::date)
                .thenComparing(CookOrderGroupRow::mealName, Comparator.nullsLast(Comparator.naturalOrder())));
        return out;
    }

    private List<OrderEntity> load(String cook, LocalDate fromLocal, LocalDate toLocal, LocalDate onDate, String mealId) {
        if (fromLocal == null || toLocal == null) throw DomainException.invalidArgument("from and to are required");
        Instant from = DayKey.utcKey(fromLocal);
        Instant to = DayKey.utcKey(toLocal);
        if (onDate != null) {
            Instant dayFrom = DayKey.utcKey(onDate);
            Instant dayTo = DayKey.utcKey(onDate.plusDays(1));
            if (dayFrom.isAfter(from)) from = dayFrom;
            if (dayTo.isBefore(to)) to = dayTo;
        }
        if (!from.isBefore(to)) return List.of();
        String meal = (mealId == null || mealId.isBlank()) ? null : mealId.trim();
        return orders.findCookRange(cook, from, to, meal);
    }

    private static String mealName(Map<String, MealInfo> meals, String mealId) {
        MealInfo m = meals.get(mealId);
        return m == null ? Objects.toString(mealId, "") : m.name();
    }
}
