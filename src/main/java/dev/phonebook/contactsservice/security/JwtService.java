package dev.phonebook.contactsservice.security;

import dev.phonebook.contactsservice.config.JwtProperties;
import dev.phonebook.contactsservice.exception.ApiException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.UUID;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Issues and verifies the three token kinds: access, refresh and email verification.
 *
 * <p>The signing key and algorithm are resolved once at construction; a missing or weak
 * secret, or an algorithm other than an HMAC one, fails application startup. Every
 * verification re-checks signature, algorithm and expiry against the injected clock.
 *
 * <p>Failure messages are the same whatever the cause (tampering, expiry, wrong scope),
 * the cause itself is only logged at debug level.
 */
@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String SCOPE_CLAIM = "scope";
    public static final String CREDENTIALS_ERROR = "Could not validate credentials";
    public static final String EMAIL_TOKEN_ERROR = "Invalid token for email verification";

    private final JwtProperties jwtProperties;
    private final Clock clock;
    private final MacAlgorithm algorithm;
    private final SecretKey signingKey;

    public JwtService(JwtProperties jwtProperties, Clock clock) {
        this.jwtProperties = jwtProperties;
        this.clock = clock;
        this.algorithm = resolveAlgorithm(jwtProperties.algorithm());
        this.signingKey = buildKey(jwtProperties.secret(), algorithm);
    }

    public String issueAccessToken(String subject) {
        return issueAccessToken(subject, jwtProperties.accessTokenExpirationSeconds());
    }

    public String issueAccessToken(String subject, long ttlSeconds) {
        return issue(subject, ttlSeconds, TokenScope.ACCESS);
    }

    public String issueRefreshToken(String subject) {
        return issueRefreshToken(subject, jwtProperties.refreshTokenExpirationSeconds());
    }

    public String issueRefreshToken(String subject, long ttlSeconds) {
        return issue(subject, ttlSeconds, TokenScope.REFRESH);
    }

    public String issueEmailToken(String subject) {
        return issue(subject, jwtProperties.emailTokenExpirationSeconds(), null);
    }

    public String verifyAccessToken(String token) {
        return verifyScoped(token, TokenScope.ACCESS);
    }

    public String verifyRefreshToken(String token) {
        return verifyScoped(token, TokenScope.REFRESH);
    }

    public String verifyEmailToken(String token) {
        Claims claims;
        try {
            claims = parse(token);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Email verification token rejected: {}", ex.getMessage());
            throw ApiException.unprocessable(EMAIL_TOKEN_ERROR);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw ApiException.unprocessable(EMAIL_TOKEN_ERROR);
        }
        return subject;
    }

    private String issue(String subject, long ttlSeconds, TokenScope scope) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject is required");
        }
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
            .id(UUID.randomUUID().toString())
            .subject(subject)
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plusSeconds(ttlSeconds)));
        if (scope != null) {
            builder.claim(SCOPE_CLAIM, scope.claimValue());
        }
        return builder.signWith(signingKey, algorithm).compact();
    }

    private String verifyScoped(String token, TokenScope expected) {
        Claims claims;
        try {
            claims = parse(token);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("{} rejected: {}", expected.claimValue(), ex.getMessage());
            throw ApiException.unauthorized(CREDENTIALS_ERROR);
        }
        if (!expected.claimValue().equals(claims.get(SCOPE_CLAIM))) {
            log.debug("Token with scope {} presented where {} was required", claims.get(SCOPE_CLAIM), expected.claimValue());
            throw ApiException.unauthorized(CREDENTIALS_ERROR);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw ApiException.unauthorized(CREDENTIALS_ERROR);
        }
        return subject;
    }

    private Claims parse(String token) {
        Jws<Claims> jws = Jwts.parser()
            .verifyWith(signingKey)
            .clock(() -> Date.from(clock.instant()))
            .build()
            .parseSignedClaims(token);
        if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
            throw new JwtException("Unexpected signing algorithm " + jws.getHeader().getAlgorithm());
        }
        return jws.getPayload();
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("ALGORITHM must be configured");
        }
        SecureDigestAlgorithm<?, ?> candidate = Jwts.SIG.get().get(name.trim().toUpperCase(Locale.ROOT));
        if (!(candidate instanceof MacAlgorithm mac)) {
            throw new IllegalStateException("Unsupported JWT algorithm: " + name);
        }
        return mac;
    }

    private static SecretKey buildKey(String secret, MacAlgorithm algorithm) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("SECRET_KEY must be configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret);
        } catch (DecodingException | IllegalArgumentException ex) {
            log.warn("SECRET_KEY is not valid Base64, using raw bytes");
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        int requiredBytes = algorithm.getKeyBitLength() / Byte.SIZE;
        if (keyBytes.length < requiredBytes) {
            throw new IllegalStateException(
                "SECRET_KEY must be at least " + requiredBytes + " bytes for " + algorithm.getId());
        }
        return new SecretKeySpec(keyBytes, "HmacSHA" + algorithm.getId().substring(2));
    }
}
