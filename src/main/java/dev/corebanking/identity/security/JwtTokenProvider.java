package dev.corebanking.identity.security;

import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.exception.TokenExpiredException;
import dev.corebanking.identity.exception.TokenInvalidException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS512-signed access and refresh tokens. Access and refresh
 * tokens use distinct secrets, so one kind never verifies as the other.
 * Stateless: revocation is handled by {@code TokenRevocationService}.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    /**
     * Minimum required secret length for HS512 algorithm (64 bytes = 512 bits)
     */
    private static final int MIN_SECRET_LENGTH = 64;

    static final String CLAIM_TENANT_ID = "tenantId";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_TOKEN_TYPE = "type";

    private final Clock clock;

    @Value("${jwt.access-secret}")
    private String accessSecret;

    @Value("${jwt.refresh-secret}")
    private String refreshSecret;

    @Value("${jwt.access-expiration:900000}")
    private long accessExpiration;

    @Value("${jwt.refresh-expiration:604800000}")
    private long refreshExpiration;

    @Value("${jwt.issuer:tenant-identity}")
    private String issuer;

    @Value("${jwt.audience:core-banking-api}")
    private String audience;

    private SecretKey accessKey;
    private SecretKey refreshKey;
    private JwtParser accessParser;
    private JwtParser refreshParser;

    public JwtTokenProvider(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        requireStrongSecret("jwt.access-secret", accessSecret);
        requireStrongSecret("jwt.refresh-secret", refreshSecret);
        if (accessSecret.equals(refreshSecret)) {
            throw new IllegalStateException("jwt.access-secret and jwt.refresh-secret must differ");
        }
        this.accessKey = Keys.hmacShaKeyFor(accessSecret.getBytes(StandardCharsets.UTF_8));
        this.refreshKey = Keys.hmacShaKeyFor(refreshSecret.getBytes(StandardCharsets.UTF_8));
        this.accessParser = buildParser(accessKey);
        this.refreshParser = buildParser(refreshKey);
        log.info("JWT token provider initialized with HS512 algorithm (access={}ms, refresh={}ms)",
                accessExpiration, refreshExpiration);
    }

    private static void requireStrongSecret(String property, String secret) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                    String.format("%s must be at least %d characters for HS512 algorithm. Current length: %d.",
                            property, MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
    }

    private JwtParser buildParser(SecretKey key) {
        return Jwts.parser()
                .verifyWith(key)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public TokenPair issuePair(String userId, String tenantId, UserRole role, String email) {
        String accessToken = sign(userId, tenantId, role, email, TokenKind.ACCESS);
        String refreshToken = sign(userId, tenantId, role, email, TokenKind.REFRESH);
        log.debug("Issued token pair for user {} in tenant {}", userId, tenantId);
        return new TokenPair(accessToken, refreshToken, Duration.ofMillis(accessExpiration).toSeconds());
    }

    /**
     * Mints a fresh access token carrying the identity of already-verified claims.
     */
    public String issueAccessToken(TokenClaims claims) {
        return sign(claims.userId(), claims.tenantId(), claims.role(), claims.email(), TokenKind.ACCESS);
    }

    public long getAccessExpirationSeconds() {
        return Duration.ofMillis(accessExpiration).toSeconds();
    }

    private String sign(String userId, String tenantId, UserRole role, String email, TokenKind kind) {
        Instant now = clock.instant();
        long lifetime = kind == TokenKind.ACCESS ? accessExpiration : refreshExpiration;
        SecretKey key = kind == TokenKind.ACCESS ? accessKey : refreshKey;

        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId)
                .claim(CLAIM_TENANT_ID, tenantId)
                .claim(CLAIM_ROLE, role.name())
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_TOKEN_TYPE, kind.claimValue())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(lifetime)))
                .signWith(key, Jwts.SIG.HS512)
                .compact();
    }

    /**
     * Checks signature, issuer, audience, expiry and kind in a single pass.
     *
     * @throws TokenExpiredException when the token is past its expiry
     * @throws TokenInvalidException for any other verification failure
     */
    public TokenClaims verify(String token, TokenKind kind) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Empty or null token");
        }
        JwtParser parser = kind == TokenKind.ACCESS ? accessParser : refreshParser;
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
            throw new TokenExpiredException();
        } catch (MalformedJwtException e) {
            log.warn("JWT token malformed: {}", e.getMessage());
            throw new TokenInvalidException("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("JWT token uses unsupported features: {}", e.getMessage());
            throw new TokenInvalidException("Unsupported token format");
        } catch (JwtException e) {
            log.warn("JWT validation failed, possible forgery or wrong token kind: {}", e.getMessage());
            throw new TokenInvalidException("Invalid token");
        } catch (IllegalArgumentException e) {
            throw new TokenInvalidException("Empty or null token");
        }
        return toTokenClaims(claims, kind);
    }

    private static TokenClaims toTokenClaims(Claims claims, TokenKind kind) {
        if (!kind.claimValue().equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
            throw new TokenInvalidException("Invalid token");
        }
        String userId = claims.getSubject();
        String tenantId = claims.get(CLAIM_TENANT_ID, String.class);
        String role = claims.get(CLAIM_ROLE, String.class);
        if (userId == null || tenantId == null || role == null) {
            throw new TokenInvalidException("Token is missing required claims");
        }
        UserRole userRole;
        try {
            userRole = UserRole.valueOf(role);
        } catch (IllegalArgumentException e) {
            throw new TokenInvalidException("Unknown role in token");
        }
        return new TokenClaims(
                userId,
                tenantId,
                userRole,
                claims.get(CLAIM_EMAIL, String.class),
                claims.getId(),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant(),
                kind);
    }

    /**
     * @return time left until expiry, never negative
     */
    public Duration remainingLifetime(TokenClaims claims) {
        Duration remaining = Duration.between(clock.instant(), claims.expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
