package com.example.clipflow.service.impl;

import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.domain.WorkUnitKind;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.repository.CallbackCorrelationRepository;
import com.example.clipflow.repository.WorkUnitRepository;
import com.example.clipflow.service.WorkUnitStatusUpdater;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecognitionCorrelationService Implementation Tests")
class RecognitionCorrelationServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Long UNIT_ID = 12L;
    private static final String CORRELATION_ID = "corr-abc";

    @Mock
    private CallbackCorrelationRepository correlationRepository;
    @Mock
    private WorkUnitRepository workUnitRepository;
    @Mock
    private WorkUnitStatusUpdater statusUpdater;

    private RecognitionCorrelationServiceImpl correlationService;

    @BeforeEach
    void setUp() {
        correlationService = new RecognitionCorrelationServiceImpl(correlationRepository, workUnitRepository,
                statusUpdater, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private CallbackCorrelation delivered(String resultRef, String error) {
        CallbackCorrelation correlation = new CallbackCorrelation(CORRELATION_ID, UNIT_ID, NOW.minusSeconds(60),
                NOW.plusSeconds(3600));
        correlation.setStatus(CorrelationStatus.DELIVERED);
        correlation.setResultRef(resultRef);
        correlation.setError(error);
        correlation.setDeliveredAt(NOW);
        return correlation;
    }

    private WorkUnit runningUnit(boolean parked) {
        WorkUnit unit = new WorkUnit("alice", "video-1", WorkUnitKind.GENERATE_TRANSCRIPT, Map.of(), NOW);
        unit.setId(UNIT_ID);
        unit.setStatus(WorkUnitStatus.RUNNING);
        unit.setAwaitingCallback(parked);
        unit.setLeaseToken(parked ? null : "lease-1");
        return unit;
    }

    @Test
    @DisplayName("✅ open: Creates an awaiting correlation with an unguessable id and expiry")
    void open_CreatesAwaitingCorrelation() {
        given(correlationRepository.save(any(CallbackCorrelation.class))).willAnswer(inv -> inv.getArgument(0));

        CallbackCorrelation first = correlationService.open(UNIT_ID, Duration.ofHours(2));
        CallbackCorrelation second = correlationService.open(UNIT_ID, Duration.ofHours(2));

        assertThat(first.getStatus()).isEqualTo(CorrelationStatus.AWAITING);
        assertThat(first.getWorkUnitId()).isEqualTo(UNIT_ID);
        assertThat(first.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
        assertThat(first.getCorrelationId()).hasSize(32).isNotEqualTo(second.getCorrelationId());
    }

    @Test
    @DisplayName("✅ recordRemoteTask: Stores the remote task id on the correlation")
    void recordRemoteTask_Stores() {
        CallbackCorrelation correlation = new CallbackCorrelation(CORRELATION_ID, UNIT_ID, NOW, NOW.plusSeconds(60));
        given(correlationRepository.findById(CORRELATION_ID)).willReturn(Optional.of(correlation));

        correlationService.recordRemoteTask(CORRELATION_ID, "task-7");

        assertThat(correlation.getRemoteTaskId()).isEqualTo("task-7");
    }

    @Nested
    @DisplayName("consumeDelivered")
    class ConsumeDelivered {

        @Test
        @DisplayName("✅ Resumes the parked unit with the result reference")
        void consume_Successful_Resumes() {
            given(workUnitRepository.findById(UNIT_ID)).willReturn(Optional.of(runningUnit(true)));
            given(correlationRepository.deleteIfStatus(CORRELATION_ID, CorrelationStatus.DELIVERED)).willReturn(1);
            given(statusUpdater.resumeFromCallback(eq(UNIT_ID), eq(CORRELATION_ID), any())).willReturn(true);

            assertThat(correlationService.consumeDelivered(delivered("results/1", null))).isTrue();

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, String>> artifacts = ArgumentCaptor.forClass(Map.class);
            then(statusUpdater).should().resumeFromCallback(eq(UNIT_ID), eq(CORRELATION_ID), artifacts.capture());
            assertThat(artifacts.getValue()).containsEntry(StageArtifacts.RECOGNITION_RESULT, "results/1");
        }

        @Test
        @DisplayName("❌ A failed recognition fails the unit permanently")
        void consume_Failed_FailsUnit() {
            given(workUnitRepository.findById(UNIT_ID)).willReturn(Optional.of(runningUnit(true)));
            given(correlationRepository.deleteIfStatus(CORRELATION_ID, CorrelationStatus.DELIVERED)).willReturn(1);

            assertThat(correlationService.consumeDelivered(delivered(null, "unsupported codec"))).isTrue();

            then(statusUpdater).should().failParked(UNIT_ID, CORRELATION_ID, "Recognition failed: unsupported codec",
                    ErrorClassification.PERMANENT);
            then(statusUpdater).should(never()).resumeFromCallback(any(), any(), any());
        }

        @Test
        @DisplayName("✅ Defers while the worker still holds the unit")
        void consume_NotParkedYet_Defers() {
            given(workUnitRepository.findById(UNIT_ID)).willReturn(Optional.of(runningUnit(false)));

            assertThat(correlationService.consumeDelivered(delivered("results/1", null))).isFalse();

            then(correlationRepository).should(never()).deleteIfStatus(anyString(), any());
            then(statusUpdater).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("✅ Loses quietly to a concurrent consumer")
        void consume_AlreadyConsumed_ReturnsFalse() {
            given(workUnitRepository.findById(UNIT_ID)).willReturn(Optional.of(runningUnit(true)));
            given(correlationRepository.deleteIfStatus(CORRELATION_ID, CorrelationStatus.DELIVERED)).willReturn(0);

            assertThat(correlationService.consumeDelivered(delivered("results/1", null))).isFalse();

            then(statusUpdater).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("expire")
    class Expire {

        @Test
        @DisplayName("❌ Fails the unit with a callback timeout")
        void expire_Overdue_FailsUnit() {
            CallbackCorrelation overdue = new CallbackCorrelation(CORRELATION_ID, UNIT_ID, NOW.minusSeconds(120),
                    NOW.minusSeconds(1));
            given(correlationRepository.markExpired(CORRELATION_ID, NOW, CorrelationStatus.AWAITING,
                    CorrelationStatus.EXPIRED)).willReturn(1);

            assertThat(correlationService.expire(overdue, NOW)).isTrue();

            ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
            then(statusUpdater).should().failParked(eq(UNIT_ID), eq(CORRELATION_ID), message.capture(),
                    eq(ErrorClassification.CALLBACK_TIMEOUT));
            assertThat(message.getValue()).startsWith("Timed out: recognition result not received");
        }

        @Test
        @DisplayName("✅ Does nothing if the result was delivered in the meantime")
        void expire_AlreadyDelivered_NoOp() {
            CallbackCorrelation overdue = new CallbackCorrelation(CORRELATION_ID, UNIT_ID, NOW.minusSeconds(120),
                    NOW.minusSeconds(1));
            given(correlationRepository.markExpired(CORRELATION_ID, NOW, CorrelationStatus.AWAITING,
                    CorrelationStatus.EXPIRED)).willReturn(0);

            assertThat(correlationService.expire(overdue, NOW)).isFalse();

            then(statusUpdater).shouldHaveNoInteractions();
        }
    }
}
