package cn.bitsleep.sysdocs.auth;

import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.domain.UserSummary;

/**
 * The caller of the current request, as last read from the user table.
 */
public record AuthUser(Long id, String name, String email, Role role) {

    public static AuthUser from(UserSummary summary) {
        return new AuthUser(summary.getId(), summary.getName(), summary.getEmail(), summary.getRole());
    }

    public boolean isAdmin() { return role == Role.ADMIN; }
}
