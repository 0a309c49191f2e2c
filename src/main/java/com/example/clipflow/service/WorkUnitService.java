package com.example.clipflow.service;

import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnitKind;
import com.example.clipflow.domain.WorkUnitLogEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface WorkUnitService {

    /**
     * Returns the live unit for (target, kind) if there is one, otherwise creates it.
     */
    EnqueueResult enqueue(WorkUnitKind kind, String targetId, String ownerId, Map<String, String> params);

    WorkUnit getWorkUnit(Long workUnitId, String ownerId);

    Optional<WorkUnit> findLatestForTarget(String targetId);

    Page<WorkUnit> listOwnerWorkUnits(String ownerId, Pageable pageable);

    WorkUnit cancel(Long workUnitId, String ownerId, String reason);

    WorkUnit retry(Long workUnitId, String ownerId);

    List<WorkUnitLogEntry> getLog(Long workUnitId, String ownerId);
}
