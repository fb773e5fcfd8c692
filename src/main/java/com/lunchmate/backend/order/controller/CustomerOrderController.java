package com.lunchmate.backend.order.controller;

import com.lunchmate.backend.auth.security.AuthContext;
import com.lunchmate.backend.common.web.ClientTimeZoneResolver;
import com.lunchmate.backend.order.dto.OrderDto;
import com.lunchmate.backend.order.dto.PlaceOrderRequest;
import com.lunchmate.backend.order.service.OrderLifecycleService;
import com.lunchmate.backend.users.user.entity.UserRole;
import com.lunchmate.backend.users.user.service.UserRoleService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/orders")
public class CustomerOrderController {

    private final OrderLifecycleService service;
    private final AuthContext auth;
    private final UserRoleService roles;
    private final ClientTimeZoneResolver clientTz;

    @PutMapping
    public OrderDto place(@Valid @RequestBody PlaceOrderRequest body, HttpServletRequest request) {
        String customerId = requireCustomer();
        String tz = clientTz.resolve(request, body.timeZone());
        return service.createOrUpdate(customerId, body.cookId(), body.mealId(), body.date(), tz);
    }

    @DeleteMapping
    public OrderDto cancel(@RequestParam("cookId") String cookId,
                           @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return service.cancel(requireCustomer(), cookId, date);
    }

    @GetMapping
    public List<OrderDto> history(@RequestParam("from") Instant fromUtc,
                                  @RequestParam("to") Instant toUtc,
                                  @RequestParam(value = "cookId", required = false) String cookId) {
        return service.getMyOrders(requireCustomer(), fromUtc, toUtc, cookId);
    }

    private String requireCustomer() {
        String userId = auth.requireUserId();
        roles.requireRole(userId, UserRole.CUSTOMER);
        return userId;
    }
}
