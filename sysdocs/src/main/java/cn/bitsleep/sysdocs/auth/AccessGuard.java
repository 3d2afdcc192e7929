package cn.bitsleep.sysdocs.auth;

import cn.bitsleep.sysdocs.domain.Role;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Role check for an already resolved identity. Does no I/O.
 */
@Component
public class AccessGuard {

    public AccessDecision authorize(Optional<AuthUser> identity) {
        return authorize(identity, Set.of());
    }

    /**
     * @param requiredRoles roles allowed to proceed; empty means any authenticated caller
     */
    public AccessDecision authorize(Optional<AuthUser> identity, Set<Role> requiredRoles) {
        if (identity.isEmpty()) return AccessDecision.UNAUTHENTICATED;
        if (requiredRoles != null && !requiredRoles.isEmpty() && !requiredRoles.contains(identity.get().role())) {
            return AccessDecision.FORBIDDEN;
        }
        return AccessDecision.ALLOWED;
    }
}
