package com.example.clipflow.pipeline;

import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import com.example.clipflow.repository.CallbackCorrelationRepository;
import com.example.clipflow.service.RecognitionCorrelationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Hands delivered recognition results back to their parked work units and times out the ones that
 * never arrive. Scheduled on worker processes; the reaper calls {@link #expireOverdue()} as well.
 */
@Component
public class RecognitionResultPoller {

    private static final Logger log = LoggerFactory.getLogger(RecognitionResultPoller.class);

    private final CallbackCorrelationRepository correlationRepository;
    private final RecognitionCorrelationService correlationService;
    private final Clock clock;
    private final boolean workerEnabled;
    private final int batchSize;

    public RecognitionResultPoller(CallbackCorrelationRepository correlationRepository,
                                   RecognitionCorrelationService correlationService,
                                   Clock clock,
                                   @Value("${clipflow.worker.enabled:true}") boolean workerEnabled,
                                   @Value("${clipflow.recognition.poll-batch-size:100}") int batchSize) {
        this.correlationRepository = correlationRepository;
        this.correlationService = correlationService;
        this.clock = clock;
        this.workerEnabled = workerEnabled;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${clipflow.recognition.poll-interval-ms:5000}")
    public void scheduledPoll() {
        if (!workerEnabled) {
            return;
        }
        pollDelivered();
        expireOverdue();
    }

    /**
     * @return number of correlations this process consumed
     */
    public int pollDelivered() {
        List<CallbackCorrelation> delivered = correlationRepository.findByStatusOrderByDeliveredAtAsc(
                CorrelationStatus.DELIVERED, PageRequest.of(0, batchSize));
        int consumed = 0;
        for (CallbackCorrelation correlation : delivered) {
            try {
                if (correlationService.consumeDelivered(correlation)) {
                    consumed++;
                }
            } catch (Exception e) {
                log.error("[Poller] Failed to consume correlation {} for work unit {}. Will retry next poll.",
                        correlation.getCorrelationId(), correlation.getWorkUnitId(), e);
            }
        }
        if (consumed > 0) {
            log.info("[Poller] Consumed {} recognition results", consumed);
        }
        return consumed;
    }

    /**
     * @return number of correlations this process expired
     */
    public int expireOverdue() {
        Instant now = clock.instant();
        List<CallbackCorrelation> overdue = correlationRepository.findByStatusAndExpiresAtBefore(
                CorrelationStatus.AWAITING, now, PageRequest.of(0, batchSize));
        int expired = 0;
        for (CallbackCorrelation correlation : overdue) {
            try {
                if (correlationService.expire(correlation, now)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("[Poller] Failed to expire correlation {} for work unit {}. Will retry next poll.",
                        correlation.getCorrelationId(), correlation.getWorkUnitId(), e);
            }
        }
        if (expired > 0) {
            log.warn("[Poller] Expired {} overdue recognition correlations", expired);
        }
        return expired;
    }
}
