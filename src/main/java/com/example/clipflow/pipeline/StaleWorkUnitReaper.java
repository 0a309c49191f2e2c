package com.example.clipflow.pipeline;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.config.SettingsWatcher;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.repository.WorkUnitLogRepository;
import com.example.clipflow.repository.WorkUnitRepository;
import com.example.clipflow.service.RecognitionCorrelationService;
import com.example.clipflow.service.WorkUnitStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic sweep that finalizes work nobody is driving anymore and purges old terminal records.
 * Every write is conditional on the row still matching the threshold it was selected with.
 */
@Component
public class StaleWorkUnitReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleWorkUnitReaper.class);

    public record ReaperReport(int failedRunning,
                               int failedPending,
                               int purgedFailures,
                               int purgedSuccesses,
                               int expiredCorrelations,
                               int purgedCorrelations) {
    }

    private final WorkUnitRepository workUnitRepository;
    private final WorkUnitLogRepository logRepository;
    private final WorkUnitStatusUpdater statusUpdater;
    private final RecognitionResultPoller resultPoller;
    private final RecognitionCorrelationService correlationService;
    private final SettingsWatcher settingsWatcher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final boolean enabled;
    private final Duration expiredCorrelationRetention;

    public StaleWorkUnitReaper(WorkUnitRepository workUnitRepository,
                               WorkUnitLogRepository logRepository,
                               WorkUnitStatusUpdater statusUpdater,
                               RecognitionResultPoller resultPoller,
                               RecognitionCorrelationService correlationService,
                               SettingsWatcher settingsWatcher,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               @Value("${clipflow.reaper.enabled:true}") boolean enabled,
                               @Value("${clipflow.recognition.expired-retention-hours:24}") long expiredRetentionHours) {
        this.workUnitRepository = workUnitRepository;
        this.logRepository = logRepository;
        this.statusUpdater = statusUpdater;
        this.resultPoller = resultPoller;
        this.correlationService = correlationService;
        this.settingsWatcher = settingsWatcher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.enabled = enabled;
        this.expiredCorrelationRetention = Duration.ofHours(expiredRetentionHours);
    }

    @Scheduled(fixedDelayString = "${clipflow.reaper.interval-ms:3600000}",
            initialDelayString = "${clipflow.reaper.initial-delay-ms:60000}")
    public void scheduledSweep() {
        if (enabled) {
            sweep();
        }
    }

    public ReaperReport sweep() {
        PipelineSettings settings = settingsWatcher.current();
        Instant now = clock.instant();
        boolean dryRun = settings.reaperDryRun();
        log.info("[Reaper] Sweep started (dryRun: {})", dryRun);

        int failedRunning = failStale(WorkUnitStatus.RUNNING, now.minus(settings.runningTimeout()),
                "Timed out: no progress for " + settings.runningTimeout().toHours() + "h", settings);
        int failedPending = failStale(WorkUnitStatus.PENDING, now.minus(settings.pendingTimeout()),
                "Timed out: not scheduled within " + settings.pendingTimeout().toHours() + "h", settings);
        int purgedFailures = purgeTerminal(WorkUnitStatus.FAILURE, now.minus(settings.failureRetention()), settings);
        int purgedSuccesses = purgeTerminal(WorkUnitStatus.SUCCESS, now.minus(settings.successRetention()), settings);

        int expiredCorrelations = 0;
        int purgedCorrelations = 0;
        if (!dryRun) {
            expiredCorrelations = resultPoller.expireOverdue();
            purgedCorrelations = correlationService.purgeExpired(now.minus(expiredCorrelationRetention));
        }

        ReaperReport report = new ReaperReport(failedRunning, failedPending, purgedFailures, purgedSuccesses,
                expiredCorrelations, purgedCorrelations);
        log.info("[Reaper] Sweep finished: {}", report);
        return report;
    }

    private int failStale(WorkUnitStatus status, Instant threshold, String message, PipelineSettings settings) {
        List<Long> ids = workUnitRepository.findIdsByStatusUpdatedBefore(status, threshold,
                PageRequest.of(0, settings.purgeBatchSize()));
        if (settings.reaperDryRun()) {
            log.info("[Reaper] Dry run: would fail {} {} work units: {}", ids.size(), status, ids);
            return ids.size();
        }
        int failed = 0;
        for (Long id : ids) {
            try {
                if (statusUpdater.failIfStale(id, status, threshold, message, ErrorClassification.PERMANENT)) {
                    failed++;
                }
            } catch (Exception e) {
                log.error("[Reaper] Failed to finalize stale work unit {}", id, e);
            }
        }
        if (failed > 0) {
            log.warn("[Reaper] Failed {} stale {} work units", failed, status);
        }
        return failed;
    }

    private int purgeTerminal(WorkUnitStatus status, Instant threshold, PipelineSettings settings) {
        int purged = 0;
        while (true) {
            List<Long> ids = workUnitRepository.findIdsByStatusUpdatedBefore(status, threshold,
                    PageRequest.of(0, settings.purgeBatchSize()));
            if (ids.isEmpty()) {
                break;
            }
            if (settings.reaperDryRun()) {
                log.info("[Reaper] Dry run: would purge {} {} work units", ids.size(), status);
                return ids.size();
            }
            Integer deleted = transactionTemplate.execute(tx -> {
                logRepository.deleteByWorkUnitIds(ids);
                return workUnitRepository.deleteTerminal(ids, status, threshold);
            });
            int batch = deleted != null ? deleted : 0;
            purged += batch;
            if (batch == 0 || ids.size() < settings.purgeBatchSize()) {
                break;
            }
        }
        if (purged > 0) {
            log.info("[Reaper] Purged {} {} work units older than {}", purged, status, threshold);
        }
        return purged;
    }
}
