package com.lunchmate.backend.menuday;

import com.lunchmate.backend.common.error.DomainException;
import com.lunchmate.backend.common.error.ErrorCode;
import com.lunchmate.backend.common.store.KeyedWriteTemplate;
import com.lunchmate.backend.common.time.TimeZoneResolver;
import com.lunchmate.backend.meal.dto.MealInfo;
import com.lunchmate.backend.meal.service.MealCatalog;
import com.lunchmate.backend.menuday.dto.MenuDayDto;
import com.lunchmate.backend.menuday.dto.MenuDishDto;
import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.model.MenuDayStatus;
import com.lunchmate.backend.menuday.repo.MenuDayRepository;
import com.lunchmate.backend.menuday.service.MenuDayService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MenuDayServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 10);
    private static final Instant NOW = Instant.parse("2025-06-09T15:00:00Z");

    private MenuDayRepository repo;
    private MealCatalog catalog;
    private MenuDayService svc;

    @BeforeEach
    void setUp() {
        repo = mock(MenuDayRepository.class);
        catalog = mock(MealCatalog.class);
        svc = new MenuDayService(
                repo,
                catalog,
                new TimeZoneResolver(),
                new KeyedWriteTemplate(mock(PlatformTransactionManager.class), 2),
                Clock.fixed(NOW, ZoneOffset.UTC),
                "UTC",
                7);
        when(repo.saveAndFlush(any(MenuDayEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void upsert_newDay_fillsThreeSlots_andUsesDeterministicKey() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.empty());

        MenuDayDto out = svc.upsert("c1", DAY, List.of(new MenuDish(1, "m1", "Casado", "")),
                MenuDayStatus.DRAFT, "UTC");

        assertEquals(3, out.dishes().size());
        assertEquals("m1", out.dishes().get(0).mealId());
        assertNull(out.dishes().get(1).mealId());
        assertNull(out.dishes().get(2).mealId());
        assertEquals(MenuDayEntity.keyFor("c1", DAY), out.id());
        assertEquals(MenuDayStatus.DRAFT, out.status());
        assertNull(out.publishedAt());
        assertNull(out.closedAt());
    }

    @Test
    void upsert_blankName_isFilledFromCatalog() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.empty());
        when(catalog.getMeals(List.of("m1"))).thenReturn(Map.of("m1",
                new MealInfo("m1", "c1", "Gallo pinto", BigDecimal.TEN, null, null, null, "Ana", true)));

        MenuDayDto out = svc.upsert("c1", DAY, List.of(new MenuDish(1, "m1", "", "")), null, null);

        assertEquals("Gallo pinto", out.dishes().get(0).name());
        assertEquals("UTC", out.timeZone());
    }

    @Test
    void upsert_publish_setsPublishedAtOnce() {
        MenuDayEntity existing = entity(MenuDayStatus.PUBLISHED);
        Instant firstPublish = Instant.parse("2025-06-01T00:00:00Z");
        existing.setPublishedAt(firstPublish);
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.of(existing));

        MenuDayDto out = svc.upsert("c1", DAY, List.of(), MenuDayStatus.PUBLISHED, "UTC");

        assertEquals(firstPublish, out.publishedAt());
    }

    @Test
    void upsert_draftToPublished_stampsNow() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.of(entity(MenuDayStatus.DRAFT)));

        MenuDayDto out = svc.upsert("c1", DAY, List.of(), MenuDayStatus.PUBLISHED, "UTC");

        assertEquals(NOW, out.publishedAt());
    }

    @Test
    void upsert_withoutStatus_keepsPublishedDayPublished() {
        MenuDayEntity published = entity(MenuDayStatus.PUBLISHED);
        Instant firstPublish = Instant.parse("2025-06-01T00:00:00Z");
        published.setPublishedAt(firstPublish);
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.of(published));

        MenuDayDto out = svc.upsert("c1", DAY, List.of(new MenuDish(2, "m2", "Arroz con pollo", "")), null, "UTC");

        assertEquals(MenuDayStatus.PUBLISHED, out.status());
        assertEquals(firstPublish, out.publishedAt());
        assertEquals("m2", out.dishes().get(1).mealId());
    }

    @Test
    void upsert_withoutStatus_newDayStartsAsDraft() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.empty());

        MenuDayDto out = svc.upsert("c1", DAY, List.of(), null, "UTC");

        assertEquals(MenuDayStatus.DRAFT, out.status());
        assertNull(out.publishedAt());
    }

    @Test
    void close_setsClosedAt() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.of(entity(MenuDayStatus.PUBLISHED)));

        MenuDayDto out = svc.close("c1", DAY);

        assertEquals(MenuDayStatus.CLOSED, out.status());
        assertEquals(NOW, out.closedAt());
    }

    @Test
    void closedDay_cannotGoBack() {
        MenuDayEntity closed = entity(MenuDayStatus.CLOSED);
        closed.setClosedAt(NOW.minusSeconds(60));
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.of(closed));

        DomainException ex = assertThrows(DomainException.class,
                () -> svc.upsert("c1", DAY, List.of(), MenuDayStatus.DRAFT, "UTC"));
        assertEquals(ErrorCode.INVALID_STATUS_TRANSITION, ex.getCode());
        verify(repo, never()).saveAndFlush(any());
    }

    @Test
    void upsert_emptyCookId_isInvalidArgument() {
        DomainException ex = assertThrows(DomainException.class,
                () -> svc.upsert(" ", DAY, List.of(), MenuDayStatus.DRAFT, "UTC"));
        assertEquals(ErrorCode.INVALID_ARGUMENT, ex.getCode());
        verifyNoInteractions(repo);
    }

    @Test
    void upsert_unknownZone_storesUtc() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.empty());

        MenuDayDto out = svc.upsert("c1", DAY, List.of(), MenuDayStatus.DRAFT, "Nowhere/Special");

        assertEquals("UTC", out.timeZone());
    }

    @Test
    void getOrCreate_missing_createsDraftWithThreeEmptySlots() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.empty());

        MenuDayDto out = svc.getOrCreate("c1", DAY);

        ArgumentCaptor<MenuDayEntity> captor = ArgumentCaptor.forClass(MenuDayEntity.class);
        verify(repo).saveAndFlush(captor.capture());
        assertEquals(MenuDayStatus.DRAFT, captor.getValue().getStatus());
        assertEquals(3, out.dishes().size());
        assertTrue(out.dishes().stream().noneMatch(d -> d.mealId() != null));
    }

    @Test
    void getOrCreate_lostInsertRace_returnsWinnersRow() {
        MenuDayEntity winner = entity(MenuDayStatus.PUBLISHED);
        when(repo.findByCookIdAndLocalDate("c1", DAY))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(repo.saveAndFlush(any(MenuDayEntity.class)))
                .thenThrow(new DataIntegrityViolationException("ux_menu_days_cook_date"));

        MenuDayDto out = svc.getOrCreate("c1", DAY);

        assertEquals(MenuDayStatus.PUBLISHED, out.status());
        verify(repo, times(2)).findByCookIdAndLocalDate("c1", DAY);
        verify(repo, times(1)).saveAndFlush(any());
    }

    @Test
    void getOrCreate_existingWithFewerSlots_isReturnedWithThree() {
        MenuDayEntity legacy = entity(MenuDayStatus.DRAFT);
        legacy.getDishes().clear();
        legacy.getDishes().add(new MenuDish(2, "m2", "Sopa", ""));
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.of(legacy));

        MenuDayDto out = svc.getOrCreate("c1", DAY);

        assertEquals(List.of(1, 2, 3), out.dishes().stream().map(MenuDishDto::index).toList());
        verify(repo, never()).saveAndFlush(any());
    }

    @Test
    void publish_missingDay_isNotFound() {
        when(repo.findByCookIdAndLocalDate("c1", DAY)).thenReturn(Optional.empty());

        DomainException ex = assertThrows(DomainException.class, () -> svc.publish("c1", DAY));
        assertEquals(ErrorCode.NOT_FOUND, ex.getCode());
    }

    @Test
    void getWeek_queriesSevenDayWindow() {
        when(repo.findRange("c1", DAY, DAY.plusDays(7))).thenReturn(List.of(entity(MenuDayStatus.DRAFT)));

        List<MenuDayDto> week = svc.getWeek("c1", DAY);

        assertEquals(1, week.size());
        verify(repo).findRange(eq("c1"), eq(DAY), eq(LocalDate.of(2025, 6, 17)));
    }

    private static MenuDayEntity entity(MenuDayStatus status) {
        MenuDayEntity e = new MenuDayEntity();
        e.setId(MenuDayEntity.keyFor("c1", DAY));
        e.setCookId("c1");
        e.setLocalDate(DAY);
        e.setStatus(status);
        e.setTimeZone("UTC");
        e.replaceDishes(List.of(MenuDish.empty(1), MenuDish.empty(2), MenuDish.empty(3)));
        e.setCreatedAt(NOW.minusSeconds(3600));
        e.setUpdatedAt(NOW.minusSeconds(3600));
        return e;
    }
}
