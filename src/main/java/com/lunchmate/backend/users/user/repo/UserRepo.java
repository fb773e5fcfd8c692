package com.lunchmate.backend.users.user.repo;

import com.lunchmate.backend.users.user.entity.User;
import com.lunchmate.backend.users.user.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepo extends JpaRepository<User, String> {

    boolean existsByIdAndRole(String id, UserRole role);
}
