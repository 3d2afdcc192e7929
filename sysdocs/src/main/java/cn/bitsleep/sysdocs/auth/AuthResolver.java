package cn.bitsleep.sysdocs.auth;

import cn.bitsleep.sysdocs.repo.UserRepository;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

import java.util.Optional;

/**
 * Turns the session token of a request into the caller's identity.
 * <p>
 * The user row is read again on every call, so role changes and deleted
 * accounts take effect on the next request rather than at the next login.
 * The role embedded in the token is never trusted for access decisions.
 */
@Component
@RequiredArgsConstructor
public class AuthResolver {

    public static final String TOKEN_COOKIE = "auth-token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final UserRepository users;

    public Optional<AuthUser> resolveIdentity(HttpServletRequest request) {
        String token = extractToken(request);
        if (token == null) return Optional.empty();
        return tokenService.verify(token)
                .flatMap(claims -> users.findSummaryById(claims.userId()))
                .map(AuthUser::from);
    }

    // cookie first, bearer header for API clients
    static String extractToken(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, TOKEN_COOKIE);
        if (cookie != null && cookie.getValue() != null && !cookie.getValue().isBlank()) {
            return cookie.getValue();
        }
        String auth = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.startsWith(BEARER_PREFIX)) {
            String token = auth.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
