package cn.bitsleep.sysdocs.auth;

import cn.bitsleep.sysdocs.domain.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Stateless HS256 session tokens. Nothing is stored server side: a token stays
 * valid until it expires or the signing secret is rotated.
 */
@Slf4j
@Service
public class TokenService {

    public static final Duration TOKEN_TTL = Duration.ofDays(7);

    // HS256 needs at least 256 bits of key material
    static final int MIN_SECRET_BYTES = 32;

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLE = "role";

    private final SecretKey key;
    private final Clock clock;

    public TokenService(@Value("${sysdocs.auth.jwt-secret:}") String secret, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("sysdocs.auth.jwt-secret (JWT_SECRET) is not set; refusing to start without a signing secret");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("sysdocs.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes long");
        }
        this.key = Keys.hmacShaKeyFor(bytes);
        this.clock = clock;
    }

    public String sign(TokenClaims claims) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(claims.userId()))
                .claim(CLAIM_EMAIL, claims.email())
                .claim(CLAIM_ROLE, claims.role().name())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(TOKEN_TTL)))
                .signWith(key)
                .compact();
    }

    /**
     * @return the claims of a well-formed, correctly signed and unexpired token, otherwise empty
     */
    public Optional<TokenClaims> verify(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        try {
            Claims body = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            String subject = body.getSubject();
            String email = body.get(CLAIM_EMAIL, String.class);
            String role = body.get(CLAIM_ROLE, String.class);
            if (subject == null || email == null || role == null) return Optional.empty();
            return Optional.of(new TokenClaims(Long.valueOf(subject), email, Role.fromName(role)));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected session token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
