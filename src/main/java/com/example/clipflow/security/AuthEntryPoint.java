package com.example.clipflow.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Answers unauthenticated API calls with a 401 {@link ProblemDetail} and a bearer challenge.
 * The detail tells a missing token apart from one that failed validation.
 */
@Component
public class AuthEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(AuthEntryPoint.class);

    static final String MISSING_TOKEN_DETAIL = "A bearer token is required to access this resource.";
    static final String INVALID_TOKEN_DETAIL = "The bearer token is invalid or has expired.";
    static final String BEARER_CHALLENGE = "Bearer realm=\"clipflow\"";
    static final String INVALID_TOKEN_CHALLENGE = BEARER_CHALLENGE + ", error=\"invalid_token\"";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuthEntryPoint(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) {
        boolean tokenPresented = JwtService.extractBearer(request.getHeader(HttpHeaders.AUTHORIZATION)).isPresent();
        log.warn("Rejected {} {} ({}): {}", request.getMethod(), request.getRequestURI(),
                tokenPresented ? "invalid token" : "no token", authException.getMessage());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, tokenPresented ? INVALID_TOKEN_CHALLENGE : BEARER_CHALLENGE);

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNAUTHORIZED, tokenPresented ? INVALID_TOKEN_DETAIL : MISSING_TOKEN_DETAIL);
        problemDetail.setTitle("Unauthorized");
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        problemDetail.setProperty("timestamp", clock.instant());

        try {
            objectMapper.writeValue(response.getWriter(), problemDetail);
        } catch (IOException e) {
            log.error("Failed to write 401 ProblemDetail for {}", request.getRequestURI(), e);
        }
    }
}
