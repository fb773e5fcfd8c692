package com.lunchmate.backend.order.controller;

import com.lunchmate.backend.auth.security.AuthContext;
import com.lunchmate.backend.order.dto.CookOrderGroupRow;
import com.lunchmate.backend.order.dto.CookOrderRow;
import com.lunchmate.backend.order.dto.OrderDto;
import com.lunchmate.backend.order.dto.UpdateOrderStatusRequest;
import com.lunchmate.backend.order.service.CookOrderService;
import com.lunchmate.backend.users.user.entity.UserRole;
import com.lunchmate.backend.users.user.service.UserRoleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/cook/orders")
public class CookOrderController {

    private final CookOrderService service;
    private final AuthContext auth;
    private final UserRoleService roles;

    @GetMapping
    public List<CookOrderRow> expanded(@RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                       @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
                                       @RequestParam(value = "date", required = false)
                                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                       @RequestParam(value = "mealId", required = false) String mealId) {
        return service.getOrdersExpanded(requireCook(), from, to, date, mealId);
    }

    @GetMapping("/grouped")
    public List<CookOrderGroupRow> grouped(@RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                           @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
                                           @RequestParam(value = "mealId", required = false) String mealId) {
        return service.getOrdersGrouped(requireCook(), from, to, mealId);
    }

    @PatchMapping("/{orderId}/status")
    public OrderDto advance(@PathVariable String orderId, @Valid @RequestBody UpdateOrderStatusRequest body) {
        return service.advanceStatus(requireCook(), orderId, body.status());
    }

    private String requireCook() {
        String userId = auth.requireUserId();
        roles.requireRole(userId, UserRole.COOK);
        return userId;
    }
}
