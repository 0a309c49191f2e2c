package com.example.clipflow.web;

import com.example.clipflow.config.ClockConfig;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.domain.WorkUnitKind;
import com.example.clipflow.domain.WorkUnitLogEntry;
import com.example.clipflow.exceptions.GlobalExceptionHandler;
import com.example.clipflow.exceptions.WorkUnitConflictException;
import com.example.clipflow.exceptions.WorkUnitNotFoundException;
import com.example.clipflow.security.AuthEntryPoint;
import com.example.clipflow.security.AuthenticationFilter;
import com.example.clipflow.security.JwtService;
import com.example.clipflow.security.SecurityConfig;
import com.example.clipflow.service.EnqueueResult;
import com.example.clipflow.service.WorkUnitService;
import com.example.clipflow.web.controller.WorkUnitController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkUnitController.class)
@Import({SecurityConfig.class, AuthenticationFilter.class, AuthEntryPoint.class, GlobalExceptionHandler.class,
        ClockConfig.class})
class WorkUnitControllerTest {

    private static final String TEST_USERNAME = "testUser";
    private static final String BEARER = "Bearer test-token";
    private static final Long UNIT_ID = 42L;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkUnitService workUnitService;
    @MockitoBean
    private JwtService jwtService;

    private WorkUnit testUnit;

    @BeforeEach
    void setUp() {
        given(jwtService.validateRequest(any())).willAnswer(inv -> {
            jakarta.servlet.http.HttpServletRequest request = inv.getArgument(0);
            return BEARER.equals(request.getHeader(HttpHeaders.AUTHORIZATION))
                    ? Optional.of(TEST_USERNAME) : Optional.empty();
        });
        testUnit = new WorkUnit(TEST_USERNAME, "video-7", WorkUnitKind.DOWNLOAD, Map.of(),
                Instant.parse("2026-03-01T10:00:00Z"));
        testUnit.setId(UNIT_ID);
        testUnit.setStatus(WorkUnitStatus.RUNNING);
        testUnit.setProgress(25.0);
    }

    @Nested
    @DisplayName("POST /api/work-units")
    class EnqueueTests {

        private static final String BODY = "{\"kind\":\"download\",\"target_id\":\"video-7\",\"params\":{\"url\":\"https://x/y\"}}";

        @Test
        @DisplayName("✅ A new unit answers 201")
        void enqueue_Created() throws Exception {
            given(workUnitService.enqueue(eq(WorkUnitKind.DOWNLOAD), eq("video-7"), eq(TEST_USERNAME), anyMap()))
                    .willReturn(new EnqueueResult(UNIT_ID, true));

            mockMvc.perform(post("/api/work-units")
                            .header(HttpHeaders.AUTHORIZATION, BEARER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(BODY))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.work_unit_id", is(42)))
                    .andExpect(jsonPath("$.created", is(true)));
        }

        @Test
        @DisplayName("✅ An existing live unit answers 200")
        void enqueue_Existing() throws Exception {
            given(workUnitService.enqueue(any(), any(), any(), any())).willReturn(new EnqueueResult(UNIT_ID, false));

            mockMvc.perform(post("/api/work-units")
                            .header(HttpHeaders.AUTHORIZATION, BEARER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.created", is(false)));
        }

        @Test
        @DisplayName("❌ A missing target id answers 400 with field errors")
        void enqueue_Invalid() throws Exception {
            mockMvc.perform(post("/api/work-units")
                            .header(HttpHeaders.AUTHORIZATION, BEARER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"kind\":\"download\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors.targetId").exists());
            then(workUnitService).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("❌ An unknown kind answers 400")
        void enqueue_UnknownKind() throws Exception {
            mockMvc.perform(post("/api/work-units")
                            .header(HttpHeaders.AUTHORIZATION, BEARER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"kind\":\"teleport\",\"target_id\":\"video-7\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("❌ No bearer token answers 401")
        void enqueue_Unauthenticated() throws Exception {
            mockMvc.perform(post("/api/work-units")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(BODY))
                    .andExpect(status().isUnauthorized());
            then(workUnitService).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("✅ GET /{id} returns the snapshot")
        void getWorkUnit() throws Exception {
            given(workUnitService.getWorkUnit(UNIT_ID, TEST_USERNAME)).willReturn(testUnit);

            mockMvc.perform(get("/api/work-units/{id}", UNIT_ID).header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id", is(42)))
                    .andExpect(jsonPath("$.target_id", is("video-7")))
                    .andExpect(jsonPath("$.status", is("running")))
                    .andExpect(jsonPath("$.stage", is("transfer_in")))
                    .andExpect(jsonPath("$.progress", is(25.0)))
                    .andExpect(jsonPath("$.lease_token").doesNotExist());
        }

        @Test
        @DisplayName("❌ GET /{id} of an unknown or foreign unit answers 404")
        void getWorkUnit_NotFound() throws Exception {
            given(workUnitService.getWorkUnit(UNIT_ID, TEST_USERNAME)).willThrow(new WorkUnitNotFoundException(UNIT_ID));

            mockMvc.perform(get("/api/work-units/{id}", UNIT_ID).header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("❌ A non-numeric id answers 400")
        void getWorkUnit_BadId() throws Exception {
            mockMvc.perform(get("/api/work-units/abc").header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("✅ GET lists the caller's units as a page")
        void listWorkUnits() throws Exception {
            Pageable pageable = PageRequest.of(0, 20);
            given(workUnitService.listOwnerWorkUnits(eq(TEST_USERNAME), any(Pageable.class)))
                    .willReturn(new PageImpl<>(List.of(testUnit), pageable, 1));

            mockMvc.perform(get("/api/work-units").header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.content", hasSize(1)))
                    .andExpect(jsonPath("$.content[0].kind", is("DOWNLOAD")))
                    .andExpect(jsonPath("$.page.totalElements", is(1)));
        }

        @Test
        @DisplayName("✅ GET /{id}/log returns the transition history")
        void getLog() throws Exception {
            WorkUnitLogEntry entry = new WorkUnitLogEntry(testUnit, WorkUnitStatus.PENDING,
                    Instant.parse("2026-03-01T10:00:05Z"));
            given(workUnitService.getLog(UNIT_ID, TEST_USERNAME)).willReturn(List.of(entry));

            mockMvc.perform(get("/api/work-units/{id}/log", UNIT_ID).header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(1)))
                    .andExpect(jsonPath("$[0].old_status", is("pending")))
                    .andExpect(jsonPath("$[0].new_status", is("running")));
        }
    }

    @Nested
    @DisplayName("Control")
    class ControlTests {

        @Test
        @DisplayName("✅ Cancel without a body passes no reason")
        void cancel_NoBody() throws Exception {
            testUnit.finish(WorkUnitStatus.FAILURE, "Cancelled by user",
                    com.example.clipflow.domain.ErrorClassification.CANCELLED, Instant.now());
            given(workUnitService.cancel(eq(UNIT_ID), eq(TEST_USERNAME), isNull())).willReturn(testUnit);

            mockMvc.perform(post("/api/work-units/{id}/cancel", UNIT_ID).header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status", is("failure")))
                    .andExpect(jsonPath("$.error_classification", is("CANCELLED")));
        }

        @Test
        @DisplayName("✅ Retry answers 202")
        void retry_Accepted() throws Exception {
            given(workUnitService.retry(UNIT_ID, TEST_USERNAME)).willReturn(testUnit);

            mockMvc.perform(post("/api/work-units/{id}/retry", UNIT_ID).header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isAccepted());
        }

        @Test
        @DisplayName("❌ Retry of a unit that did not fail answers 409")
        void retry_Conflict() throws Exception {
            given(workUnitService.retry(UNIT_ID, TEST_USERNAME))
                    .willThrow(new WorkUnitConflictException("Only failed work units can be retried"));

            mockMvc.perform(post("/api/work-units/{id}/retry", UNIT_ID).header(HttpHeaders.AUTHORIZATION, BEARER))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.detail", is("Only failed work units can be retried")));
        }
    }
}
