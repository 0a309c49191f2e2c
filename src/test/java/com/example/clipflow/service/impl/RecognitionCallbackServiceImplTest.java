package com.example.clipflow.service.impl;

import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import com.example.clipflow.exceptions.CallbackRejectedException;
import com.example.clipflow.repository.CallbackCorrelationRepository;
import com.example.clipflow.service.RecognitionCallbackService.DeliveryOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecognitionCallbackService Implementation Tests")
class RecognitionCallbackServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String CORRELATION_ID = "corr-abc";

    @Mock
    private CallbackCorrelationRepository correlationRepository;

    private RecognitionCallbackServiceImpl callbackService;

    @BeforeEach
    void setUp() {
        callbackService = new RecognitionCallbackServiceImpl(correlationRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private CallbackCorrelation correlation(CorrelationStatus status) {
        CallbackCorrelation correlation = new CallbackCorrelation(CORRELATION_ID, 7L, NOW.minusSeconds(600),
                NOW.minusSeconds(60));
        correlation.setStatus(status);
        return correlation;
    }

    @Test
    @DisplayName("✅ A completed callback stores the result reference")
    void deliver_Completed() {
        given(correlationRepository.markDelivered(CORRELATION_ID, "results/42", null, NOW,
                CorrelationStatus.AWAITING, CorrelationStatus.DELIVERED)).willReturn(1);

        DeliveryOutcome outcome = callbackService.deliver(CORRELATION_ID, "completed", "results/42", null);

        assertThat(outcome).isEqualTo(DeliveryOutcome.ACCEPTED);
        then(correlationRepository).should(never()).findById(any());
    }

    @Test
    @DisplayName("✅ A failed callback is recorded with its error")
    void deliver_Failed() {
        given(correlationRepository.markDelivered(eq(CORRELATION_ID), isNull(), eq("model crashed"), eq(NOW),
                any(), any())).willReturn(1);

        assertThat(callbackService.deliver(CORRELATION_ID, "failed", null, "model crashed"))
                .isEqualTo(DeliveryOutcome.ACCEPTED);
    }

    @Test
    @DisplayName("✅ A completed callback without a result reference counts as a failure")
    void deliver_CompletedWithoutRef() {
        given(correlationRepository.markDelivered(eq(CORRELATION_ID), isNull(),
                eq("Completed callback carried no result reference"), eq(NOW), any(), any())).willReturn(1);

        assertThat(callbackService.deliver(CORRELATION_ID, "completed", " ", null))
                .isEqualTo(DeliveryOutcome.ACCEPTED);
    }

    @Test
    @DisplayName("✅ A duplicate delivery is acknowledged without changes")
    void deliver_Duplicate() {
        given(correlationRepository.markDelivered(any(), any(), any(), any(), any(), any())).willReturn(0);
        given(correlationRepository.findById(CORRELATION_ID))
                .willReturn(Optional.of(correlation(CorrelationStatus.DELIVERED)));

        assertThat(callbackService.deliver(CORRELATION_ID, "completed", "results/42", null))
                .isEqualTo(DeliveryOutcome.ALREADY_DELIVERED);
    }

    @Test
    @DisplayName("❌ An unknown correlation id is rejected with 404")
    void deliver_Unknown() {
        given(correlationRepository.markDelivered(any(), any(), any(), any(), any(), any())).willReturn(0);
        given(correlationRepository.findById(CORRELATION_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> callbackService.deliver(CORRELATION_ID, "completed", "results/42", null))
                .isInstanceOf(CallbackRejectedException.class)
                .satisfies(ex -> assertThat(((CallbackRejectedException) ex).getStatusCode())
                        .isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    @DisplayName("❌ A late callback for an expired correlation is rejected with 410")
    void deliver_Expired() {
        given(correlationRepository.markDelivered(any(), any(), any(), any(), any(), any())).willReturn(0);
        given(correlationRepository.findById(CORRELATION_ID))
                .willReturn(Optional.of(correlation(CorrelationStatus.EXPIRED)));

        assertThatThrownBy(() -> callbackService.deliver(CORRELATION_ID, "completed", "results/42", null))
                .isInstanceOf(CallbackRejectedException.class)
                .satisfies(ex -> assertThat(((CallbackRejectedException) ex).getStatusCode())
                        .isEqualTo(HttpStatus.GONE));
    }
}
