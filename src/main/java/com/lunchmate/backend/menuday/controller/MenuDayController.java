package com.lunchmate.backend.menuday.controller;

import com.lunchmate.backend.auth.security.AuthContext;
import com.lunchmate.backend.common.web.ClientTimeZoneResolver;
import com.lunchmate.backend.menuday.dto.MenuDayDto;
import com.lunchmate.backend.menuday.dto.MenuDishDto;
import com.lunchmate.backend.menuday.dto.UpsertMenuDayRequest;
import com.lunchmate.backend.menuday.entity.MenuDish;
import com.lunchmate.backend.menuday.service.MenuDayService;
import com.lunchmate.backend.users.user.entity.UserRole;
import com.lunchmate.backend.users.user.service.UserRoleService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/cook/menu-days")
public class MenuDayController {

    private final MenuDayService service;
    private final AuthContext auth;
    private final UserRoleService roles;
    private final ClientTimeZoneResolver clientTz;

    @GetMapping("/{date}")
    public MenuDayDto get(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return service.getOrCreate(requireCook(), date);
    }

    @PutMapping("/{date}")
    public MenuDayDto upsert(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                             @Valid @RequestBody UpsertMenuDayRequest body,
                             HttpServletRequest request) {
        String cookId = requireCook();
        List<MenuDish> dishes = body.dishes() == null
                ? List.of()
                : body.dishes().stream().filter(d -> d != null).map(MenuDishDto::toEmbeddable).toList();
        String tz = clientTz.resolve(request, body.timeZone());
        return service.upsert(cookId, date, dishes, body.status(), tz);
    }

    @PostMapping("/{date}/publish")
    public MenuDayDto publish(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return service.publish(requireCook(), date);
    }

    @PostMapping("/{date}/close")
    public MenuDayDto close(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return service.close(requireCook(), date);
    }

    @GetMapping
    public List<MenuDayDto> week(@RequestParam("weekStart") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        return service.getWeek(requireCook(), weekStart);
    }

    private String requireCook() {
        String userId = auth.requireUserId();
        roles.requireRole(userId, UserRole.COOK);
        return userId;
    }
}
