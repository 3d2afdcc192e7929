package cn.bitsleep.sysdocs.auth;

import cn.bitsleep.sysdocs.domain.Role;

/**
 * Identity facts carried inside a session token.
 */
public record TokenClaims(Long userId, String email, Role role) {
}
