package com.example.clipflow.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

/**
 * Validates the bearer tokens issued by the account service. Tokens are HMAC-signed JWTs whose
 * subject is the owner id used for all ownership checks.
 */
@Component
public class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String PREFIX = "Bearer ";

    private SecretKey key;
    private final String base64Secret;
    private final long expirationTime;
    private final String issuer;
    private final Clock clock;

    public JwtService(
            @Value("${jwt.secret.key.base64}") String base64Secret,
            @Value("${jwt.expiration.ms:3600000}") long expirationTime,
            @Value("${jwt.issuer}") String issuer,
            Clock clock) {
        this.base64Secret = base64Secret;
        if (issuer == null || issuer.trim().isEmpty()) {
            throw new IllegalArgumentException("JWT Issuer (jwt.issuer) must not be null or empty");
        }
        if (expirationTime <= 0) {
            throw new IllegalArgumentException("JWT Expiration time (jwt.expiration.ms) must be positive");
        }
        this.expirationTime = expirationTime;
        this.issuer = issuer;
        this.clock = clock;
        log.info("JWT Service Initializing. Issuer: {}, Expiration: {}ms", issuer, expirationTime);
    }

    @PostConstruct
    void initializeKey() {
        if (!StringUtils.hasText(this.base64Secret)) {
            log.error("CRITICAL: JWT Secret Key (jwt.secret.key.base64) is missing or empty!");
            throw new IllegalArgumentException("JWT Secret Key (jwt.secret.key.base64) must be provided");
        }
        byte[] decodedKey;
        try {
            decodedKey = Base64.getDecoder().decode(this.base64Secret);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Base64 encoding for JWT secret key (jwt.secret.key.base64)", e);
        }
        if (decodedKey.length < 32) {
            log.error("CRITICAL: Provided JWT secret key is too short ({} bytes).", decodedKey.length);
            throw new IllegalArgumentException("JWT Secret key must be at least 256 bits (32 bytes)");
        }
        this.key = Keys.hmacShaKeyFor(decodedKey);
        log.info("JWT Secret Key initialized successfully.");
    }

    /**
     * Issues a token for {@code username}. Production tokens come from the account service; this is
     * used by tooling and tests sharing the same key.
     */
    public String generateToken(String username) {
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("Username must not be null or empty");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(username)
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(Duration.ofMillis(expirationTime))))
                .signWith(key)
                .compact();
    }

    /**
     * @return the subject of a valid token, or empty if the token is missing, expired or forged
     */
    public Optional<String> validateToken(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String subject = claims.getSubject();
            if (!StringUtils.hasText(subject)) {
                log.warn("JWT has no subject.");
                return Optional.empty();
            }
            return Optional.of(subject);
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid token format or claim issue: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> validateRequest(HttpServletRequest request) {
        return extractBearer(request.getHeader(HttpHeaders.AUTHORIZATION)).flatMap(this::validateToken);
    }

    public static Optional<String> extractBearer(String header) {
        if (header != null && header.startsWith(PREFIX)) {
            return Optional.of(header.substring(PREFIX.length()).trim());
        }
        return Optional.empty();
    }
}
