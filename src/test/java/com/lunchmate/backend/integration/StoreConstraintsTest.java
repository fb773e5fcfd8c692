package com.lunchmate.backend.integration;

import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.entity.MenuDishSlots;
import com.lunchmate.backend.menuday.model.MenuDayStatus;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import com.lunchmate.backend.order.entity.OrderEntity;
import com.lunchmate.backend.order.model.OrderStatus;
import com.lunchmate.backend.order.repo.OrderRepository;
import com.lunchmate.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The uniqueness guarantees live in the schema; these checks run against the generated DDL.
 */
@SpringBootTest
class StoreConstraintsTest extends BaseSpringTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 10);

    @Autowired MenuDayRepository menuDays;
    @Autowired OrderRepository orders;
    @Autowired PlatformTransactionManager txManager;

    @BeforeEach
    void clean() {
        orders.deleteAll();
        menuDays.deleteAll();
    }

    @Test
    void secondMenuDayForSameCookAndDate_isRejectedByUniqueIndex() {
        menuDays.saveAndFlush(menuDay(1L));

        assertThrows(DataIntegrityViolationException.class, () -> menuDays.saveAndFlush(menuDay(2L)));
        assertEquals(1, menuDays.count());
    }

    @Test
    void secondOrderForSameCustomerCookDay_isRejectedByUniqueIndex() {
        orders.saveAndFlush(order());

        assertThrows(DataIntegrityViolationException.class, () -> orders.saveAndFlush(order()));
        assertEquals(1, orders.count());
    }

    @Test
    void confirmationsCounter_neverGoesNegative() {
        MenuDayEntity saved = menuDays.saveAndFlush(menuDay(MenuDayEntity.keyFor("c1", DAY)));
        TransactionTemplate tx = new TransactionTemplate(txManager);

        int up = tx.execute(s -> menuDays.adjustConfirmations(saved.getId(), 1));
        int down = tx.execute(s -> menuDays.adjustConfirmations(saved.getId(), -1));
        int refused = tx.execute(s -> menuDays.adjustConfirmations(saved.getId(), -1));

        assertEquals(1, up);
        assertEquals(1, down);
        assertEquals(0, refused);

        assertEquals(0, menuDays.findById(saved.getId()).orElseThrow().getConfirmationsCount());
    }

    @Test
    void dishes_roundTripInSlotOrder() {
        MenuDayEntity e = menuDay(MenuDayEntity.keyFor("c1", DAY));
        e.replaceDishes(MenuDishSlots.ensureThree(List.of(
                new MenuDish(3, "m3", "Olla", ""),
                new MenuDish(1, "m1", "Casado", "sin cebolla"))));
        menuDays.saveAndFlush(e);

        MenuDayEntity loaded = menuDays.findByCookIdAndLocalDate("c1", DAY).orElseThrow();
        assertEquals(List.of(1, 2, 3), loaded.getDishes().stream().map(MenuDish::getDishIndex).toList());
        assertEquals("sin cebolla", loaded.getDishes().get(0).getNotes());
    }

    private static MenuDayEntity menuDay(long id) {
        Instant now = Instant.parse("2025-06-09T15:00:00Z");
        MenuDayEntity e = new MenuDayEntity();
        e.setId(id);
        e.setCookId("c1");
        e.setLocalDate(DAY);
        e.setStatus(MenuDayStatus.DRAFT);
        e.setTimeZone("UTC");
        e.replaceDishes(MenuDishSlots.ensureThree(List.of()));
        e.setCreatedAt(now);
        e.setUpdatedAt(now);
        return e;
    }

    private static OrderEntity order() {
        Instant now = Instant.parse("2025-06-09T15:00:00Z");
        OrderEntity o = new OrderEntity();
        o.setId(UUID.randomUUID().toString());
        o.setCustomerId("u1");
        o.setCookId("c1");
        o.setMealId("m1");
        o.setDeliveryDateUtc(Instant.parse("2025-06-10T00:00:00Z"));
        o.setPriceAtOrder(new BigDecimal("4.50"));
        o.setStatus(OrderStatus.PENDING);
        o.setCancelUntilUtc(Instant.parse("2025-06-10T08:00:00Z"));
        o.setTimeZone("UTC");
        o.setCreatedAt(now);
        o.setUpdatedAt(now);
        return o;
    }
}
