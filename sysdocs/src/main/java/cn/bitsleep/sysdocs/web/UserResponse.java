package cn.bitsleep.sysdocs.web;

import cn.bitsleep.sysdocs.auth.AuthUser;
import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.User;

import java.time.Instant;

/**
 * Public view of a user. The password hash never leaves the service layer.
 */
public record UserResponse(Long id, String name, String email, Role role, Instant createdAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getName(), user.getEmail(), user.getRole(), user.getCreatedAt());
    }

    public static UserResponse from(AuthUser user) {
        return new UserResponse(user.id(), user.name(), user.email(), user.role(), null);
    }
}
