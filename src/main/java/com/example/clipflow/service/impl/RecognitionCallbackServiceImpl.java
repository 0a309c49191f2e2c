package com.example.clipflow.service.impl;

import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import com.example.clipflow.exceptions.CallbackRejectedException;
import com.example.clipflow.repository.CallbackCorrelationRepository;
import com.example.clipflow.service.RecognitionCallbackService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
public class RecognitionCallbackServiceImpl implements RecognitionCallbackService {

    private static final Logger log = LoggerFactory.getLogger(RecognitionCallbackServiceImpl.class);
    static final String STATUS_COMPLETED = "completed";

    private final CallbackCorrelationRepository correlationRepository;
    private final Clock clock;

    public RecognitionCallbackServiceImpl(CallbackCorrelationRepository correlationRepository, Clock clock) {
        this.correlationRepository = correlationRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public DeliveryOutcome deliver(String correlationId, String status, String resultRef, String error) {
        Instant now = clock.instant();
        boolean completed = STATUS_COMPLETED.equalsIgnoreCase(status) && resultRef != null && !resultRef.isBlank();
        String storedRef = completed ? resultRef : null;
        String storedError = completed ? null : describeError(status, resultRef, error);

        int updated = correlationRepository.markDelivered(correlationId, storedRef, storedError, now,
                CorrelationStatus.AWAITING, CorrelationStatus.DELIVERED);
        if (updated == 1) {
            log.info("[Callback] Delivered correlation {} (status: {})", correlationId, status);
            return DeliveryOutcome.ACCEPTED;
        }

        CallbackCorrelation correlation = correlationRepository.findById(correlationId)
                .orElseThrow(() -> {
                    log.warn("[Callback] Unknown correlation {}", correlationId);
                    return new CallbackRejectedException(HttpStatus.NOT_FOUND, "Unknown correlation id");
                });
        if (correlation.getStatus() == CorrelationStatus.DELIVERED) {
            log.info("[Callback] Duplicate delivery for correlation {} ignored", correlationId);
            return DeliveryOutcome.ALREADY_DELIVERED;
        }
        log.warn("[Callback] Late delivery for correlation {} (status: {}, expired at {})",
                correlationId, correlation.getStatus(), correlation.getExpiresAt());
        throw new CallbackRejectedException(HttpStatus.GONE, "Correlation has expired");
    }

    private static String describeError(String status, String resultRef, String error) {
        if (error != null && !error.isBlank()) {
            return error;
        }
        if (STATUS_COMPLETED.equalsIgnoreCase(status) && (resultRef == null || resultRef.isBlank())) {
            return "Completed callback carried no result reference";
        }
        return "Recognition ended with status " + status;
    }
}
