package com.example.clipflow.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders every error leaving the HTTP surface as an RFC 7807 {@link ProblemDetail}.
 * Internal details (stack traces, tool stderr) are logged, never returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String ERRORS_PROPERTY = "errors";

    // --- Application exceptions ---

    @ExceptionHandler(BlobStoreException.class)
    public ProblemDetail handleBlobStoreException(BlobStoreException ex, WebRequest request) {
        log.error("Blob store operation failed: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to access stored media. Please contact support if the problem persists.", request);
    }

    @ExceptionHandler(PipelineException.class)
    public ProblemDetail handlePipelineException(PipelineException ex, WebRequest request) {
        if (ex instanceof MediaToolException mediaEx && mediaEx.getStderrOutput() != null) {
            log.error("Media tool failure reached the web layer: {} - stderr:\n{}",
                    ex.getMessage(), mediaEx.getStderrOutput(), ex);
        } else {
            log.error("Pipeline failure reached the web layer ({}): {}", ex.getClassification(), ex.getMessage(), ex);
        }
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "Media processing failed. Please try again later.", request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleDataIntegrityViolation(DataIntegrityViolationException ex, WebRequest request) {
        log.warn("Data integrity conflict for request {}: {}", request.getDescription(false),
                ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT,
                "The request conflicts with the current state of the resource.", request);
    }

    // --- Spring Security exceptions ---

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDeniedException(AccessDeniedException ex, WebRequest request) {
        log.warn("Access Denied for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.FORBIDDEN,
                "Access Denied. You do not have sufficient permissions to access this resource.", request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthenticationException(AuthenticationException ex, WebRequest request) {
        log.warn("Authentication failure for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Authentication failed. Please log in.", request);
    }

    // --- Validation ---

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
        log.warn("Constraint violation for request {}: {}", request.getDescription(false), ex.getMessage());
        Map<String, String> errors = ex.getConstraintViolations().stream()
                .collect(Collectors.toMap(
                        violation -> getPropertyName(violation.getPropertyPath().toString()),
                        ConstraintViolation::getMessage,
                        (first, second) -> first,
                        LinkedHashMap::new));
        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST,
                "Input validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return problemDetail;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        log.warn("Argument type mismatch for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'.", request);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Request body validation failed for {}: {}", request.getDescription(false), ex.getMessage());
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.putIfAbsent(fieldName, error.getDefaultMessage());
        });
        ProblemDetail problemDetail = problem(status,
                "Request body validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Unreadable request body for {}: {}", request.getDescription(false), ex.getMessage());
        return new ResponseEntity<>(problem(status, "Malformed request body.", request), headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleHttpRequestMethodNotSupported(
            @NonNull HttpRequestMethodNotSupportedException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("HTTP method not supported for {}: {}", request.getDescription(false), ex.getMessage());
        String[] supported = ex.getSupportedMethods();
        if (supported != null && supported.length > 0) {
            Set<HttpMethod> allowed = Arrays.stream(supported)
                    .map(HttpMethod::valueOf)
                    .collect(Collectors.toSet());
            headers.setAllow(allowed);
        }
        return new ResponseEntity<>(problem(status, ex.getMessage(), request), headers, status);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                request.getDescription(false), ex.getStatusCode(), ex.getReason());
        return problem(ex.getStatusCode(), ex.getReason(), request);
    }

    // --- Fallback ---

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Unhandled exception for request {}:", request.getDescription(false), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support.", request);
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {
        ProblemDetail problemDetail;
        if (body instanceof ProblemDetail existing) {
            problemDetail = existing;
            if (problemDetail.getProperties() == null || !problemDetail.getProperties().containsKey(TIMESTAMP_PROPERTY)) {
                problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            }
            if (problemDetail.getInstance() == null) {
                problemDetail.setInstance(URI.create(request.getDescription(false)));
            }
            if (problemDetail.getTitle() == null) {
                problemDetail.setTitle(getReasonPhrase(statusCode));
            }
        } else {
            log.warn("Creating basic ProblemDetail for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetail = problem(statusCode, ex.getMessage(), request);
        }
        return new ResponseEntity<>(problemDetail, headers, statusCode);
    }

    // --- Helpers ---

    private ProblemDetail problem(HttpStatusCode status, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(getReasonPhrase(status));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    private String getPropertyName(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "unknown";
        }
        int lastSeparator = Math.max(propertyPath.lastIndexOf('.'), propertyPath.lastIndexOf('['));
        return lastSeparator == -1 ? propertyPath : propertyPath.substring(lastSeparator + 1);
    }

    private String getReasonPhrase(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus ? httpStatus.getReasonPhrase() : "Status";
    }
}
