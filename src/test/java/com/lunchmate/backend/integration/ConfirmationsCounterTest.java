package com.lunchmate.backend.integration;

import com.lunchmate.backend.meal.entity.MealEntity;
import com.lunchmate.backend.meal.repo.MealRepository;
import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.model.MenuDayStatus;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import com.lunchmate.backend.menuday.service.MenuDayService;
import com.lunchmate.backend.order.repo.OrderRepository;
import com.lunchmate.backend.order.service.OrderLifecycleService;
import com.lunchmate.backend.testsupport.BaseSpringTest;
import com.lunchmate.backend.testsupport.MutableClock;
import com.lunchmate.backend.testsupport.TestOverridesConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * confirmationsCount is moved only by the atomic delta query; menu day saves must not write it back.
 */
@SpringBootTest
@Import(TestOverridesConfiguration.class)
class ConfirmationsCounterTest extends BaseSpringTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 10);

    @Autowired MenuDayService menuDayService;
    @Autowired OrderLifecycleService orderService;
    @Autowired MenuDayRepository menuDays;
    @Autowired OrderRepository orders;
    @Autowired MealRepository meals;
    @Autowired PlatformTransactionManager txManager;
    @Autowired MutableClock clock;

    private final ExecutorService customerThread = Executors.newSingleThreadExecutor();

    @BeforeEach
    void seed() {
        orders.deleteAll();
        menuDays.deleteAll();
        meals.deleteAll();

        MealEntity m = new MealEntity();
        m.setId("m1");
        m.setCookId("c1");
        m.setName("Casado");
        m.setPrice(new BigDecimal("4.50"));
        meals.save(m);

        clock.set(Instant.parse("2025-06-09T15:00:00Z"));
        menuDayService.upsert("c1", DAY, List.of(new MenuDish(1, "m1", "Casado", "")), MenuDayStatus.PUBLISHED, "UTC");
    }

    @AfterEach
    void stop() throws Exception {
        customerThread.shutdownNow();
        customerThread.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void cookEditReadBeforeAnOrderCommits_doesNotRollTheCountBack() {
        TransactionTemplate tx = new TransactionTemplate(txManager);

        tx.executeWithoutResult(s -> {
            MenuDayEntity cookView = menuDays.findByCookIdAndLocalDate("c1", DAY).orElseThrow();
            assertEquals(0, cookView.getConfirmationsCount());

            // the customer's order commits on its own connection while the cook's read is still open
            try {
                customerThread.submit(() -> orderService.createOrUpdate("u1", "c1", "m1", DAY, "UTC"))
                        .get(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }

            cookView.setUpdatedAt(Instant.parse("2025-06-09T15:05:00Z"));
            menuDays.saveAndFlush(cookView);
        });

        assertEquals(1, orders.count());
        assertEquals(1, menuDays.findByCookIdAndLocalDate("c1", DAY).orElseThrow().getConfirmationsCount());
    }

    @Test
    void cookRepublishesAfterOrders_countStillMatchesActiveOrders() {
        orderService.createOrUpdate("u1", "c1", "m1", DAY, "UTC");
        orderService.createOrUpdate("u2", "c1", "m1", DAY, "UTC");
        orderService.cancel("u2", "c1", DAY);

        menuDayService.upsert("c1", DAY, List.of(new MenuDish(1, "m1", "Casado grande", "")), null, "UTC");
        menuDayService.close("c1", DAY);

        MenuDayEntity stored = menuDays.findByCookIdAndLocalDate("c1", DAY).orElseThrow();
        assertEquals(MenuDayStatus.CLOSED, stored.getStatus());
        assertEquals(1, stored.getConfirmationsCount());
    }
}
