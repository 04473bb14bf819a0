package decentralabs.sso.service.auth;

import decentralabs.sso.config.SamlSsoProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Issues the short-lived login tokens a client exchanges for an access token after SSO.
 */
@Service
@Slf4j
public class LoginTokenService {

    static final String TOKEN_TYPE = "m.login.token";

    private final SecretKey signingKey;
    private final long ttlMs;
    private final Clock clock;

    public LoginTokenService(SamlSsoProperties properties, Clock clock) {
        this.signingKey = resolveKey(properties.getLoginToken().getSecret());
        this.ttlMs = properties.getLoginToken().getTtl().toMillis();
        this.clock = clock;
    }

    /**
     * Generates a login token for the user
     *
     * @param userId full user id
     * @return compact signed JWT
     */
    public String generateLoginToken(String userId) {
        long now = clock.millis();
        return Jwts.builder()
            .header()
            .add("typ", "JWT")
            .and()
            .subject(userId)
            .claim("type", TOKEN_TYPE)
            .id(UUID.randomUUID().toString())
            .issuedAt(new Date(now))
            .expiration(new Date(now + ttlMs))
            .signWith(signingKey)
            .compact();
    }

    /**
     * Validates a login token
     *
     * @param token login token
     * @return user id the token was issued for, or empty if invalid or expired
     */
    public Optional<String> validateLoginToken(String token) {
        try {
            Claims claims = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> new Date(clock.millis()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
            if (!TOKEN_TYPE.equals(claims.get("type", String.class))) {
                return Optional.empty();
            }
            return Optional.ofNullable(claims.getSubject());
        } catch (Exception e) {
            log.debug("Login token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static SecretKey resolveKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("saml2.login-token.secret not set; using a random key. Login tokens will not survive a restart.");
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            return Keys.hmacShaKeyFor(random);
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalStateException("saml2.login-token.secret must be at least 32 bytes");
        }
        return Keys.hmacShaKeyFor(bytes);
    }
}
