package com.lunchmate.backend.users.user.service;

import com.lunchmate.backend.common.error.DomainException;
import com.lunchmate.backend.users.user.entity.User;
import com.lunchmate.backend.users.user.entity.UserRole;
import com.lunchmate.backend.users.user.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserRoleService {

    private final UserRepo users;

    @Transactional(readOnly = true)
    public boolean isRole(String userId, UserRole role) {
        if (userId == null || userId.isBlank() || role == null) return false;
        return users.existsByIdAndRole(userId, role);
    }

    public void requireRole(String userId, UserRole role) {
        if (!isRole(userId, role)) {
            log.info("role check failed userId={} required={}", userId, role);
            throw DomainException.forbiddenRole("user does not have role " + role);
        }
    }

    /** id -> display name; unknown ids are simply absent. */
    @Transactional(readOnly = true)
    public Map<String, String> displayNames(Collection<String> userIds) {
        if (userIds == null || userIds.isEmpty()) return Map.of();
        return users.findAllById(userIds).stream()
                .collect(Collectors.toMap(User::getId, u -> (u.getName() == null || u.getName().isBlank()) ? u.getId() : u.getName(),
                        (a, b) -> a));
    }
}
