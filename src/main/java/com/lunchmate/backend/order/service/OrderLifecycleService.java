package com.lunchmate.backend.order.service;

import com.lunchmate.backend.common.error.DomainException;
import com.lunchmate.backend.common.store.KeyedWriteTemplate;
import com.lunchmate.backend.common.time.CutoffCalculator;
import com.lunchmate.backend.common.time.DayKey;
import com.lunchmate.backend.common.time.TimeZoneResolver;
import com.lunchmate.backend.meal.dto.MealInfo;
import com.lunchmate.backend.meal.service.MealCatalog;
import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import com.lunchmate.backend.order.dto.OrderDto;
import com.lunchmate.backend.order.entity.OrderEntity;
import com.lunchmate.backend.order.model.OrderStatus;
import com.lunchmate.backend.order.repo.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Customer side of orders: one row per (customer, cook, delivery day).
 * <p>
 * Every mutation re-reads the row inside its own transaction before checking the cutoff.
 * Creation is refused once the day's computed cutoff has passed;
 * updates and cancels are refused once the stored cancelUntilUtc has passed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLifecycleService {

    private final OrderRepository orders;
    private final MenuDayRepository menuDays;
    private final MealCatalog catalog;
    private final CutoffCalculator cutoffs;
    private final TimeZoneResolver timeZones;
    private final KeyedWriteTemplate writes;
    private final Clock clock;

    public OrderDto createOrUpdate(String customerId, String cookId, String mealId,
                                   LocalDate date, String timeZoneId) {
        String customer = requireId(customerId, "customerId");
        String cook = requireId(cookId, "cookId");
        String meal = requireId(mealId, "mealId");
        LocalDate day = requireDate(date);

        TimeZoneResolver.Resolution tz = timeZones.resolve(timeZoneId);
        if (tz.fellBack()) {
            log.warn("unresolvable time zone '{}' for order customerId={} date={}, using UTC", timeZoneId, customer, day);
        }
        String storedZone = tz.fellBack() ? "UTC" : timeZoneId.trim();
        Instant cancelUntil = cutoffs.cancelUntil(day, tz.zone());
        Instant key = DayKey.utcKey(day);

        return writes.execute("order.createOrUpdate", tx -> {
            MenuDayEntity menuDay = menuDays.findByCookIdAndLocalDate(cook, day)
                    .orElseThrow(() -> DomainException.notFound("no menu for day " + day));

            boolean offered = menuDay.getDishes().stream()
                    .filter(MenuDish::hasMeal)
                    .anyMatch(d -> d.getMealId().equals(meal));
            if (!offered) {
                throw DomainException.invalidSelection("meal " + meal + " is not on the menu for " + day);
            }

            MealInfo info = catalog.getMeal(meal)
                    .orElseThrow(() -> DomainException.notFound("meal " + meal));

            Instant now = Instant.now(clock);
            Optional<OrderEntity> existing = orders.findByCustomerIdAndCookIdAndDeliveryDateUtc(customer, cook, key);

            if (existing.isEmpty()) {
                if (now.isAfter(cancelUntil)) {
                    log.info("order creation after cutoff customerId={} cookId={} date={} cutoff={}", customer, cook, day, cancelUntil);
                    throw DomainException.cutoffExpired("ordering for " + day + " closed at " + cancelUntil);
                }
                OrderEntity o = new OrderEntity();
                o.setId(UUID.randomUUID().toString());
                o.setCustomerId(customer);
                o.setCookId(cook);
                o.setDeliveryDateUtc(key);
                o.setMealId(meal);
                o.setPriceAtOrder(info.price());
                o.setStatus(OrderStatus.PENDING);
                o.setCancelUntilUtc(cancelUntil);
                o.setTimeZone(storedZone);
                o.setCreatedAt(now);
                o.setUpdatedAt(now);

                OrderEntity saved = orders.saveAndFlush(o);
                menuDays.adjustConfirmations(menuDay.getId(), 1);
                log.info("order created id={} customerId={} cookId={} date={}", saved.getId(), customer, cook, day);
                return OrderDto.from(saved, canCancel(saved, now));
            }

            OrderEntity o = existing.get();
            if (!canCancel(o, now)) {
                log.info("order update after cutoff id={} cutoff={}", o.getId(), o.getCancelUntilUtc());
                throw DomainException.cutoffExpired("order for " + day + " can no longer be changed");
            }
            if (o.getStatus() == OrderStatus.READY || o.getStatus() == OrderStatus.DELIVERED) {
                throw DomainException.notEditable("order is already " + o.getStatus());
            }

            boolean reactivated = o.getStatus() == OrderStatus.CANCELLED;
            o.setMealId(meal);
            o.setPriceAtOrder(info.price());
            o.setTimeZone(storedZone);
            o.setCancelUntilUtc(cancelUntil);
            o.setStatus(OrderStatus.PENDING);
            o.setUpdatedAt(now);

            OrderEntity saved = orders.saveAndFlush(o);
            if (reactivated) {
                menuDays.adjustConfirmations(menuDay.getId(), 1);
            }
            log.info("order updated id={} reactivated={}", saved.getId(), reactivated);
            return OrderDto.from(saved, canCancel(saved, now));
        });
    }

    /** Cancelling an already cancelled order (before cutoff) is a no-op. */
    public OrderDto cancel(String customerId, String cookId, LocalDate date) {
        String customer = requireId(customerId, "customerId");
        String cook = requireId(cookId, "cookId");
        LocalDate day = requireDate(date);
        Instant key = DayKey.utcKey(day);

        return writes.execute("order.cancel", tx -> {
            OrderEntity o = orders.findByCustomerIdAndCookIdAndDeliveryDateUtc(customer, cook, key)
                    .orElseThrow(() -> DomainException.notFound("no order for " + day));
            Instant now = Instant.now(clock);

            if (!canCancel(o, now)) {
                log.info("cancel after cutoff id={} cutoff={}", o.getId(), o.getCancelUntilUtc());
                throw DomainException.cutoffExpired("order for " + day + " can no longer be cancelled");
            }
            if (o.getStatus() == OrderStatus.CANCELLED) {
                return OrderDto.from(o, true);
            }
            if (!o.getStatus().canTransitionTo(OrderStatus.CANCELLED)) {
                throw DomainException.invalidTransition(o.getStatus(), OrderStatus.CANCELLED);
            }

            o.setStatus(OrderStatus.CANCELLED);
            o.setUpdatedAt(now);
            OrderEntity saved = orders.saveAndFlush(o);
            menuDays.findByCookIdAndLocalDate(cook, day)
                    .ifPresent(m -> menuDays.adjustConfirmations(m.getId(), -1));
            log.info("order cancelled id={}", saved.getId());
            return OrderDto.from(saved, true);
        });
    }

    public boolean canCancel(OrderEntity order) {
        return canCancel(order, Instant.now(clock));
    }

    static boolean canCancel(OrderEntity order, Instant now) {
        return order.getCancelUntilUtc() != null && !now.isAfter(order.getCancelUntilUtc());
    }

    /** Half-open [fromUtc, toUtc), ordered by delivery day. */
    @Transactional(readOnly = true)
    public List<OrderDto> getMyOrders(String customerId, Instant fromUtc, Instant toUtc, String cookId) {
        String customer = requireId(customerId, "customerId");
        if (fromUtc == null || toUtc == null) throw DomainException.invalidArgument("from and to are required");
        if (!fromUtc.isBefore(toUtc)) return List.of();
        String cook = (cookId == null || cookId.isBlank()) ? null : cookId.trim();

        Instant now = Instant.now(clock);
        return orders.findCustomerRange(customer, fromUtc, toUtc, cook).stream()
                .map(o -> OrderDto.from(o, canCancel(o, now)))
                .toList();
    }

    static String requireId(String value, String name) {
        if (value == null || value.isBlank()) throw DomainException.invalidArgument(name + " is required");
        return value.trim();
    }

    static LocalDate requireDate(LocalDate date) {
        if (date == null) throw DomainException.invalidArgument("date is required");
        return DayKey.normalizeLocalDate(date);
    }
}
