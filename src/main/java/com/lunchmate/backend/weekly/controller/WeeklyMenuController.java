package com.lunchmate.backend.weekly.controller;

import com.lunchmate.backend.auth.security.AuthContext;
import com.lunchmate.backend.users.user.entity.UserRole;
import com.lunchmate.backend.users.user.service.UserRoleService;
import com.lunchmate.backend.weekly.dto.DayProjection;
import com.lunchmate.backend.weekly.service.WeeklyProjectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/menus")
public class WeeklyMenuController {

    private final WeeklyProjectionService service;
    private final AuthContext auth;
    private final UserRoleService roles;

    @GetMapping("/{cookId}/week")
    public List<DayProjection> week(@PathVariable String cookId,
                                    @RequestParam("weekStart") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        String customerId = auth.requireUserId();
        roles.requireRole(customerId, UserRole.CUSTOMER);
        return service.projectWeek(customerId, cookId, weekStart);
    }
}
