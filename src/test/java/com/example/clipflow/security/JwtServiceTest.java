package com.example.clipflow.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JwtService Tests")
class JwtServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final String base64Secret = Base64.getEncoder()
            .encodeToString("TestSecretKeyMustBeAtLeast32BytesLongForHS256".getBytes(StandardCharsets.UTF_8));
    private final long expirationMs = 3600 * 1000;
    private final String issuer = "TestIssuer";

    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        jwtService = newService(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JwtService newService(Clock clock) {
        JwtService service = new JwtService(base64Secret, expirationMs, issuer, clock);
        service.initializeKey();
        return service;
    }

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("❌ Rejects a blank issuer")
        void blankIssuer() {
            assertThatThrownBy(() -> new JwtService(base64Secret, expirationMs, " ", Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("jwt.issuer");
        }

        @Test
        @DisplayName("❌ Rejects a non-positive expiration")
        void zeroExpiration() {
            assertThatThrownBy(() -> new JwtService(base64Secret, 0, issuer, Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("❌ Rejects a key shorter than 256 bits")
        void shortKey() {
            JwtService service = new JwtService(Base64.getEncoder().encodeToString("short".getBytes()),
                    expirationMs, issuer, Clock.systemUTC());

            assertThatThrownBy(service::initializeKey)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("256 bits");
        }

        @Test
        @DisplayName("❌ Rejects a key that is not Base64")
        void invalidBase64() {
            JwtService service = new JwtService("not base64 !!", expirationMs, issuer, Clock.systemUTC());

            assertThatThrownBy(service::initializeKey)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid Base64");
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("✅ A generated token validates to its subject")
        void roundTrip() {
            String token = jwtService.generateToken("alice");

            assertThat(jwtService.validateToken(token)).contains("alice");
        }

        @Test
        @DisplayName("❌ An expired token is rejected")
        void expired() {
            String token = newService(Clock.fixed(NOW.minusSeconds(7200), ZoneOffset.UTC)).generateToken("alice");

            assertThat(jwtService.validateToken(token)).isEmpty();
        }

        @Test
        @DisplayName("❌ A token from another issuer is rejected")
        void wrongIssuer() {
            SecretKey key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(base64Secret));
            String token = Jwts.builder()
                    .subject("alice")
                    .issuer("SomeoneElse")
                    .issuedAt(Date.from(NOW))
                    .expiration(Date.from(NOW.plusSeconds(600)))
                    .signWith(key)
                    .compact();

            assertThat(jwtService.validateToken(token)).isEmpty();
        }

        @Test
        @DisplayName("❌ A token signed with another key is rejected")
        void wrongKey() {
            SecretKey otherKey = Keys.hmacShaKeyFor(
                    "AnotherSecretKeyThatIsAlsoLongEnoughForHS256".getBytes(StandardCharsets.UTF_8));
            String token = Jwts.builder()
                    .subject("alice")
                    .issuer(issuer)
                    .issuedAt(Date.from(NOW))
                    .expiration(Date.from(NOW.plusSeconds(600)))
                    .signWith(otherKey)
                    .compact();

            assertThat(jwtService.validateToken(token)).isEmpty();
        }

        @Test
        @DisplayName("❌ Garbage and blank tokens are rejected")
        void garbage() {
            assertThat(jwtService.validateToken("abc.def.ghi")).isEmpty();
            assertThat(jwtService.validateToken("")).isEmpty();
            assertThat(jwtService.validateToken(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Request handling")
    class RequestTests {

        @Test
        @DisplayName("✅ Reads the bearer token from the Authorization header")
        void validateRequest_Bearer() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + jwtService.generateToken("bob"));

            assertThat(jwtService.validateRequest(request)).contains("bob");
        }

        @Test
        @DisplayName("❌ Ignores other authorization schemes")
        void validateRequest_Basic() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader(HttpHeaders.AUTHORIZATION, "Basic Ym9iOnNlY3JldA==");

            assertThat(jwtService.validateRequest(request)).isEmpty();
            assertThat(JwtService.extractBearer(null)).isEmpty();
        }
    }
}
