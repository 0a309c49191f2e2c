package com.example.clipflow.service.impl;

import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.exceptions.CallbackTimeoutException;
import com.example.clipflow.exceptions.ErrorClassifier;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.repository.CallbackCorrelationRepository;
import com.example.clipflow.repository.WorkUnitRepository;
import com.example.clipflow.service.RecognitionCorrelationService;
import com.example.clipflow.service.WorkUnitStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

@Service
public class RecognitionCorrelationServiceImpl implements RecognitionCorrelationService {

    private static final Logger log = LoggerFactory.getLogger(RecognitionCorrelationServiceImpl.class);
    private static final int CORRELATION_ID_BYTES = 24;

    private final CallbackCorrelationRepository correlationRepository;
    private final WorkUnitRepository workUnitRepository;
    private final WorkUnitStatusUpdater statusUpdater;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public RecognitionCorrelationServiceImpl(CallbackCorrelationRepository correlationRepository,
                                             WorkUnitRepository workUnitRepository,
                                             WorkUnitStatusUpdater statusUpdater,
                                             Clock clock) {
        this.correlationRepository = correlationRepository;
        this.workUnitRepository = workUnitRepository;
        this.statusUpdater = statusUpdater;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public CallbackCorrelation open(Long workUnitId, Duration expiry) {
        Instant now = clock.instant();
        CallbackCorrelation correlation = new CallbackCorrelation(newCorrelationId(), workUnitId, now, now.plus(expiry));
        CallbackCorrelation saved = correlationRepository.save(correlation);
        log.info("[Correlation] Opened {} for work unit {} (expires {})",
                saved.getCorrelationId(), workUnitId, saved.getExpiresAt());
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordRemoteTask(String correlationId, String remoteTaskId) {
        correlationRepository.findById(correlationId).ifPresentOrElse(
                correlation -> correlation.setRemoteTaskId(remoteTaskId),
                () -> log.warn("[Correlation] {} vanished before remote task {} was recorded", correlationId, remoteTaskId));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void discard(String correlationId) {
        int deleted = correlationRepository.deleteIfStatus(correlationId, CorrelationStatus.AWAITING);
        log.info("[Correlation] Discarded {} after failed submission (deleted: {})", correlationId, deleted);
    }

    @Override
    @Transactional
    public boolean consumeDelivered(CallbackCorrelation correlation) {
        String correlationId = correlation.getCorrelationId();
        WorkUnit unit = workUnitRepository.findById(correlation.getWorkUnitId()).orElse(null);
        if (unit != null && unit.getStatus() == WorkUnit.WorkUnitStatus.RUNNING
                && !unit.isAwaitingCallback() && unit.getLeaseToken() != null) {
            // Result arrived before the worker finished parking; pick it up on the next poll
            log.debug("[Correlation] Work unit {} is not parked yet; deferring {}", unit.getId(), correlationId);
            return false;
        }
        if (correlationRepository.deleteIfStatus(correlationId, CorrelationStatus.DELIVERED) == 0) {
            log.debug("[Correlation] {} already consumed elsewhere", correlationId);
            return false;
        }
        Long workUnitId = correlation.getWorkUnitId();
        if (correlation.isSuccessful()) {
            boolean resumed = statusUpdater.resumeFromCallback(workUnitId, correlationId,
                    Map.of(StageArtifacts.RECOGNITION_RESULT, correlation.getResultRef()));
            log.info("[Correlation] Consumed {} for work unit {} (resumed: {})", correlationId, workUnitId, resumed);
        } else {
            String error = correlation.getError() != null ? correlation.getError() : "no result reference";
            boolean failed = statusUpdater.failParked(workUnitId, correlationId, "Recognition failed: " + error,
                    ErrorClassification.PERMANENT);
            log.info("[Correlation] Consumed failed result {} for work unit {} (failed: {})",
                    correlationId, workUnitId, failed);
        }
        return true;
    }

    @Override
    @Transactional
    public boolean expire(CallbackCorrelation correlation, Instant now) {
        String correlationId = correlation.getCorrelationId();
        int updated = correlationRepository.markExpired(correlationId, now,
                CorrelationStatus.AWAITING, CorrelationStatus.EXPIRED);
        if (updated == 0) {
            return false;
        }
        CallbackTimeoutException timeout = new CallbackTimeoutException(
                "recognition result not received before " + correlation.getExpiresAt());
        statusUpdater.failParked(correlation.getWorkUnitId(), correlationId, ErrorClassifier.describe(timeout),
                timeout.getClassification());
        log.warn("[Correlation] {} expired; work unit {} failed with callback timeout",
                correlationId, correlation.getWorkUnitId());
        return true;
    }

    @Override
    @Transactional
    public int purgeExpired(Instant expiredBefore) {
        int purged = correlationRepository.purgeByStatusExpiredBefore(CorrelationStatus.EXPIRED, expiredBefore);
        if (purged > 0) {
            log.info("[Correlation] Purged {} expired correlations", purged);
        }
        return purged;
    }

    private String newCorrelationId() {
        byte[] bytes = new byte[CORRELATION_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
