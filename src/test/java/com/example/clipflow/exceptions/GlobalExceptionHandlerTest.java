package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Tests")
@MockitoSettings(strictness = Strictness.LENIENT)
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler globalExceptionHandler = new GlobalExceptionHandler();

    @Mock
    private WebRequest webRequest;

    private final String requestUri = "/api/work-units/1";

    @BeforeEach
    void setUp() {
        when(webRequest.getDescription(false)).thenReturn(requestUri);
    }

    private void assertCommonFields(ProblemDetail problemDetail, HttpStatus status) {
        assertThat(problemDetail.getStatus()).isEqualTo(status.value());
        assertThat(problemDetail.getTitle()).isEqualTo(status.getReasonPhrase());
        assertThat(problemDetail.getInstance()).isEqualTo(URI.create(requestUri));
        assertThat(problemDetail.getProperties())
                .containsKey("timestamp")
                .extracting("timestamp").isInstanceOf(Instant.class);
    }

    @Nested
    @DisplayName("Application exceptions")
    class ApplicationExceptions {

        @Test
        @DisplayName("✅ BlobStoreException maps to 500 without internal detail")
        void blobStore() {
            ProblemDetail problemDetail = globalExceptionHandler.handleBlobStoreException(
                    new BlobStoreException("disk /var/blobs full"), webRequest);

            assertCommonFields(problemDetail, HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(problemDetail.getDetail()).doesNotContain("/var/blobs");
        }

        @Test
        @DisplayName("✅ Media tool failures never leak stderr")
        void mediaTool_HidesStderr() {
            MediaToolException ex = new MediaToolException(ErrorClassification.PERMANENT, "ffmpeg exited with 1",
                    1, "Invalid data found when processing input");

            ProblemDetail problemDetail = globalExceptionHandler.handlePipelineException(ex, webRequest);

            assertCommonFields(problemDetail, HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(problemDetail.getDetail()).isEqualTo("Media processing failed. Please try again later.");
        }

        @Test
        @DisplayName("✅ A data integrity violation maps to 409")
        void dataIntegrity() {
            ProblemDetail problemDetail = globalExceptionHandler.handleDataIntegrityViolation(
                    new DataIntegrityViolationException("uk_work_unit_live"), webRequest);

            assertCommonFields(problemDetail, HttpStatus.CONFLICT);
        }

        @Test
        @DisplayName("✅ WorkUnitConflictException keeps its status and reason")
        void conflict() {
            ProblemDetail problemDetail = globalExceptionHandler.handleResponseStatusException(
                    new WorkUnitConflictException("Only failed work units can be retried"), webRequest);

            assertCommonFields(problemDetail, HttpStatus.CONFLICT);
            assertThat(problemDetail.getDetail()).isEqualTo("Only failed work units can be retried");
        }

        @Test
        @DisplayName("✅ WorkUnitNotFoundException maps to 404")
        void notFound() {
            ResponseStatusException ex = new WorkUnitNotFoundException(42L);

            ProblemDetail problemDetail = globalExceptionHandler.handleResponseStatusException(ex, webRequest);

            assertCommonFields(problemDetail, HttpStatus.NOT_FOUND);
            assertThat(problemDetail.getDetail()).contains("42");
        }
    }

    @Nested
    @DisplayName("Spring Security exceptions")
    class SecurityExceptions {

        @Test
        @DisplayName("✅ AccessDeniedException maps to 403")
        void accessDenied() {
            ProblemDetail problemDetail = globalExceptionHandler.handleAccessDeniedException(
                    new AccessDeniedException("nope"), webRequest);

            assertCommonFields(problemDetail, HttpStatus.FORBIDDEN);
        }

        @Test
        @DisplayName("✅ AuthenticationException maps to 401")
        void authentication() {
            ProblemDetail problemDetail = globalExceptionHandler.handleAuthenticationException(
                    new BadCredentialsException("bad token"), webRequest);

            assertCommonFields(problemDetail, HttpStatus.UNAUTHORIZED);
        }
    }

    @Test
    @DisplayName("✅ Constraint violations are listed by property name")
    void constraintViolation_ListsErrors() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = mock(ConstraintViolation.class);
        Path path = mock(Path.class);
        when(path.toString()).thenReturn("cancel.request.reason");
        when(violation.getPropertyPath()).thenReturn(path);
        when(violation.getMessage()).thenReturn("reason cannot exceed 500 characters");

        ProblemDetail problemDetail = globalExceptionHandler.handleConstraintViolationException(
                new ConstraintViolationException(Set.of(violation)), webRequest);

        assertCommonFields(problemDetail, HttpStatus.BAD_REQUEST);
        assertThat(problemDetail.getProperties()).containsEntry("errors",
                Map.of("reason", "reason cannot exceed 500 characters"));
    }

    @Test
    @DisplayName("✅ Unsupported method sets the Allow header")
    void methodNotSupported_SetsAllow() {
        HttpRequestMethodNotSupportedException ex =
                new HttpRequestMethodNotSupportedException("DELETE", List.of("GET", "POST"));

        ResponseEntity<Object> response = globalExceptionHandler.handleHttpRequestMethodNotSupported(
                ex, new HttpHeaders(), HttpStatus.METHOD_NOT_ALLOWED, webRequest);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(response.getHeaders().getAllow()).containsExactlyInAnyOrder(HttpMethod.GET, HttpMethod.POST);
        assertThat(response.getBody()).isInstanceOf(ProblemDetail.class);
    }

    @Test
    @DisplayName("❌ Unexpected exceptions map to a generic 500")
    void generic() {
        ProblemDetail problemDetail = globalExceptionHandler.handleGenericException(
                new IllegalStateException("secret internals"), webRequest);

        assertCommonFields(problemDetail, HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(problemDetail.getDetail()).doesNotContain("secret");
    }
}
