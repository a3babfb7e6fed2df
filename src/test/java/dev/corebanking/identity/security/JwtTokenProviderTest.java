package dev.corebanking.identity.security;

import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.exception.TokenExpiredException;
import dev.corebanking.identity.exception.TokenInvalidException;
import dev.corebanking.identity.support.MutableClock;
import dev.corebanking.identity.support.TestJwt;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtTokenProvider")
class JwtTokenProviderTest {

    private MutableClock clock;
    private JwtTokenProvider tokenProvider;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        tokenProvider = TestJwt.provider(clock);
    }

    @Nested
    @DisplayName("issue and verify")
    class IssueAndVerify {

        @Test
        @DisplayName("access token should round-trip its claims")
        void accessToken_ShouldRoundTrip() {
            TokenPair pair = tokenProvider.issuePair("user-1", "tenant-a", UserRole.MANAGER, "m@bank.com");

            TokenClaims claims = tokenProvider.verify(pair.accessToken(), TokenKind.ACCESS);

            assertThat(claims.userId()).isEqualTo("user-1");
            assertThat(claims.tenantId()).isEqualTo("tenant-a");
            assertThat(claims.role()).isEqualTo(UserRole.MANAGER);
            assertThat(claims.email()).isEqualTo("m@bank.com");
            assertThat(claims.tokenId()).isNotBlank();
            assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS);
            assertThat(pair.accessToken().split("\\.")).hasSize(3);
            assertThat(pair.expiresIn()).isEqualTo(900);
        }

        @Test
        @DisplayName("refresh token should verify only as REFRESH")
        void refreshToken_ShouldNotVerifyAsAccess() {
            TokenPair pair = tokenProvider.issuePair("user-1", "tenant-a", UserRole.CUSTOMER, "c@bank.com");

            assertThat(tokenProvider.verify(pair.refreshToken(), TokenKind.REFRESH).userId()).isEqualTo("user-1");
            assertThatThrownBy(() -> tokenProvider.verify(pair.refreshToken(), TokenKind.ACCESS))
                    .isInstanceOf(TokenInvalidException.class);
            assertThatThrownBy(() -> tokenProvider.verify(pair.accessToken(), TokenKind.REFRESH))
                    .isInstanceOf(TokenInvalidException.class);
        }

        @Test
        @DisplayName("each issued token should carry a unique id")
        void tokens_ShouldHaveUniqueIds() {
            TokenPair first = tokenProvider.issuePair("user-1", "tenant-a", UserRole.CUSTOMER, "c@bank.com");
            TokenPair second = tokenProvider.issuePair("user-1", "tenant-a", UserRole.CUSTOMER, "c@bank.com");

            assertThat(first.accessToken()).isNotEqualTo(second.accessToken());
        }

        @Test
        @DisplayName("issueAccessToken should mint a new access token from refresh claims")
        void issueAccessToken_FromRefreshClaims() {
            TokenPair pair = tokenProvider.issuePair("user-1", "tenant-a", UserRole.TELLER, "t@bank.com");
            TokenClaims refreshClaims = tokenProvider.verify(pair.refreshToken(), TokenKind.REFRESH);

            String access = tokenProvider.issueAccessToken(refreshClaims);

            TokenClaims claims = tokenProvider.verify(access, TokenKind.ACCESS);
            assertThat(claims.userId()).isEqualTo("user-1");
            assertThat(claims.role()).isEqualTo(UserRole.TELLER);
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("access token should expire after 15 minutes")
        void accessToken_ShouldExpire() {
            String access = tokenProvider.issuePair("u", "t", UserRole.CUSTOMER, "c@bank.com").accessToken();

            clock.advance(Duration.ofMinutes(14));
            assertThat(tokenProvider.verify(access, TokenKind.ACCESS)).isNotNull();

            clock.advance(Duration.ofMinutes(1).plusSeconds(1));
            assertThatThrownBy(() -> tokenProvider.verify(access, TokenKind.ACCESS))
                    .isInstanceOf(TokenExpiredException.class);
        }

        @Test
        @DisplayName("refresh token should outlive the access token")
        void refreshToken_ShouldLastSevenDays() {
            String refresh = tokenProvider.issuePair("u", "t", UserRole.CUSTOMER, "c@bank.com").refreshToken();

            clock.advance(Duration.ofDays(6));
            assertThat(tokenProvider.verify(refresh, TokenKind.REFRESH)).isNotNull();

            clock.advance(Duration.ofDays(1).plusSeconds(1));
            assertThatThrownBy(() -> tokenProvider.verify(refresh, TokenKind.REFRESH))
                    .isInstanceOf(TokenExpiredException.class);
        }

        @Test
        @DisplayName("remainingLifetime should shrink with the clock and never go negative")
        void remainingLifetime() {
            String access = tokenProvider.issuePair("u", "t", UserRole.CUSTOMER, "c@bank.com").accessToken();
            TokenClaims claims = tokenProvider.verify(access, TokenKind.ACCESS);

            assertThat(tokenProvider.remainingLifetime(claims)).isEqualTo(Duration.ofMinutes(15));

            clock.advance(Duration.ofMinutes(10));
            assertThat(tokenProvider.remainingLifetime(claims)).isEqualTo(Duration.ofMinutes(5));

            clock.advance(Duration.ofHours(1));
            assertThat(tokenProvider.remainingLifetime(claims)).isEqualTo(Duration.ZERO);
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("should reject malformed, null and blank tokens")
        void malformed() {
            assertThatThrownBy(() -> tokenProvider.verify("not.a.jwt", TokenKind.ACCESS))
                    .isInstanceOf(TokenInvalidException.class);
            assertThatThrownBy(() -> tokenProvider.verify(null, TokenKind.ACCESS))
                    .isInstanceOf(TokenInvalidException.class);
            assertThatThrownBy(() -> tokenProvider.verify("  ", TokenKind.ACCESS))
                    .isInstanceOf(TokenInvalidException.class);
        }

        @Test
        @DisplayName("should reject a token signed with another secret")
        void foreignSignature() {
            String forged = Jwts.builder()
                    .subject("user-1")
                    .claim("tenantId", "tenant-a")
                    .claim("role", "SUPER_ADMIN")
                    .claim("type", "access")
                    .issuer("tenant-identity")
                    .audience().add("core-banking-api").and()
                    .issuedAt(Date.from(clock.instant()))
                    .expiration(Date.from(clock.instant().plusSeconds(600)))
                    .signWith(Keys.hmacShaKeyFor(("x".repeat(64)).getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS512)
                    .compact();

            assertThatThrownBy(() -> tokenProvider.verify(forged, TokenKind.ACCESS))
                    .isInstanceOf(TokenInvalidException.class);
        }

        @Test
        @DisplayName("should reject a correctly signed token for another audience")
        void wrongAudience() {
            String token = Jwts.builder()
                    .subject("user-1")
                    .claim("tenantId", "tenant-a")
                    .claim("role", "CUSTOMER")
                    .claim("type", "access")
                    .issuer("tenant-identity")
                    .audience().add("someone-else").and()
                    .expiration(Date.from(clock.instant().plusSeconds(600)))
                    .signWith(Keys.hmacShaKeyFor(TestJwt.ACCESS_SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS512)
                    .compact();

            assertThatThrownBy(() -> tokenProvider.verify(token, TokenKind.ACCESS))
                    .isInstanceOf(TokenInvalidException.class);
        }
    }

    @Nested
    @DisplayName("init()")
    class Init {

        @Test
        @DisplayName("should refuse secrets shorter than 64 characters")
        void shortSecret_ShouldFail() {
            JwtTokenProvider provider = new JwtTokenProvider(clock);
            ReflectionTestUtils.setField(provider, "accessSecret", "too-short");
            ReflectionTestUtils.setField(provider, "refreshSecret", TestJwt.REFRESH_SECRET);

            assertThatThrownBy(provider::init)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("jwt.access-secret");
        }

        @Test
        @DisplayName("should refuse identical access and refresh secrets")
        void sameSecrets_ShouldFail() {
            JwtTokenProvider provider = new JwtTokenProvider(clock);
            ReflectionTestUtils.setField(provider, "accessSecret", TestJwt.ACCESS_SECRET);
            ReflectionTestUtils.setField(provider, "refreshSecret", TestJwt.ACCESS_SECRET);

            assertThatThrownBy(provider::init).isInstanceOf(IllegalStateException.class);
        }
    }
}
