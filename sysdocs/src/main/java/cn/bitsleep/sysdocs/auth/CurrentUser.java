package cn.bitsleep.sysdocs.auth;

import cn.bitsleep.sysdocs.domain.Role;
import cn.bitsleep.sysdocs.error.ForbiddenException;
import cn.bitsleep.sysdocs.error.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Controller-side access to the identity placed in the security context by
 * {@link SecurityConfig.SessionTokenFilter}.
 */
@Component
@RequiredArgsConstructor
public class CurrentUser {

    private final AccessGuard accessGuard;

    public Optional<AuthUser> get() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof AuthUser user) return Optional.of(user);
        return Optional.empty();
    }

    public AuthUser require(Role... roles) {
        Optional<AuthUser> identity = get();
        switch (accessGuard.authorize(identity, Set.of(roles))) {
            case UNAUTHENTICATED -> throw new UnauthenticatedException();
            case FORBIDDEN -> throw new ForbiddenException("Forbidden: insufficient role");
            default -> { }
        }
        return identity.get();
    }
}
