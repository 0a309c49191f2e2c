package com.example.clipflow.service.impl;

import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnitKind;
import com.example.clipflow.domain.WorkUnitLogEntry;
import com.example.clipflow.exceptions.WorkUnitNotFoundException;
import com.example.clipflow.repository.WorkUnitLogRepository;
import com.example.clipflow.repository.WorkUnitRepository;
import com.example.clipflow.service.EnqueueResult;
import com.example.clipflow.service.WorkUnitService;
import com.example.clipflow.service.WorkUnitStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class WorkUnitServiceImpl implements WorkUnitService {

    private static final Logger log = LoggerFactory.getLogger(WorkUnitServiceImpl.class);
    private static final String FORBIDDEN_MESSAGE_OWNER_ACTION = "User does not have permission to access this work unit";
    private static final int MAX_CREATE_ATTEMPTS = 3;

    private final WorkUnitRepository workUnitRepository;
    private final WorkUnitLogRepository logRepository;
    private final WorkUnitStatusUpdater statusUpdater;
    private final int maxLogEntries;

    public WorkUnitServiceImpl(WorkUnitRepository workUnitRepository,
                               WorkUnitLogRepository logRepository,
                               WorkUnitStatusUpdater statusUpdater,
                               @Value("${clipflow.worklog.max-entries:50}") int maxLogEntries) {
        this.workUnitRepository = workUnitRepository;
        this.logRepository = logRepository;
        this.statusUpdater = statusUpdater;
        this.maxLogEntries = Math.max(1, maxLogEntries);
    }

    // Public service methods

    @Override
    public EnqueueResult enqueue(WorkUnitKind kind, String targetId, String ownerId, Map<String, String> params) {
        log.info("Enqueue requested: {} for target {} by {}", kind, targetId, ownerId);
        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            List<WorkUnit> existing = workUnitRepository.findByTargetIdAndKindOrderByCreatedAtDescIdDesc(targetId, kind);
            if (!existing.isEmpty() && !existing.get(0).isTerminal()) {
                WorkUnit live = existing.get(0);
                log.info("Work unit {} is already {} for target {} ({}). Returning it.",
                        live.getId(), live.getStatus(), targetId, kind);
                return new EnqueueResult(live.getId(), false);
            }
            try {
                WorkUnit created = statusUpdater.createLive(ownerId, targetId, kind, params);
                return new EnqueueResult(created.getId(), true);
            } catch (DataIntegrityViolationException e) {
                log.info("Concurrent enqueue for target {} ({}) detected on attempt {}. Re-reading live unit.",
                        targetId, kind, attempt);
                Optional<WorkUnit> live = workUnitRepository.findLive(targetId, kind);
                if (live.isPresent()) {
                    return new EnqueueResult(live.get().getId(), false);
                }
            }
        }
        log.error("Could not enqueue {} for target {} after {} attempts", kind, targetId, MAX_CREATE_ATTEMPTS);
        throw new ResponseStatusException(HttpStatus.CONFLICT, "Could not enqueue work unit, please retry");
    }

    @Override
    @Transactional(readOnly = true)
    public WorkUnit getWorkUnit(Long workUnitId, String ownerId) {
        return findAndAuthorize(workUnitId, ownerId, "VIEW");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkUnit> findLatestForTarget(String targetId) {
        return workUnitRepository.findFirstByTargetIdOrderByCreatedAtDescIdDesc(targetId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<WorkUnit> listOwnerWorkUnits(String ownerId, Pageable pageable) {
        return workUnitRepository.findByOwnerId(ownerId, pageable);
    }

    @Override
    public WorkUnit cancel(Long workUnitId, String ownerId, String reason) {
        findAndAuthorize(workUnitId, ownerId, "CANCEL");
        return statusUpdater.cancel(workUnitId, reason);
    }

    @Override
    public WorkUnit retry(Long workUnitId, String ownerId) {
        findAndAuthorize(workUnitId, ownerId, "RETRY");
        return statusUpdater.retryFailed(workUnitId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkUnitLogEntry> getLog(Long workUnitId, String ownerId) {
        findAndAuthorize(workUnitId, ownerId, "VIEW_LOG");
        return logRepository.findByWorkUnitIdOrderByIdDesc(workUnitId, PageRequest.of(0, maxLogEntries));
    }

    // Helper methods

    private WorkUnit findAndAuthorize(Long workUnitId, String ownerId, String action) {
        WorkUnit unit = workUnitRepository.findById(workUnitId)
                .orElseThrow(() -> {
                    log.warn("Action {} failed: work unit {} not found.", action, workUnitId);
                    return new WorkUnitNotFoundException(workUnitId);
                });
        if (!unit.getOwnerId().equals(ownerId)) {
            log.warn("Authorization failed: user {} attempted {} on work unit {} owned by {}",
                    ownerId, action, workUnitId, unit.getOwnerId());
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, FORBIDDEN_MESSAGE_OWNER_ACTION);
        }
        return unit;
    }
}
