package com.example.clipflow.repository;

import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.domain.WorkUnitKind;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkUnitRepository extends JpaRepository<WorkUnit, Long> {

    /**
     * All units for a (target, kind) pair, most recent first. Several historical rows are normal;
     * callers take the first match.
     */
    List<WorkUnit> findByTargetIdAndKindOrderByCreatedAtDescIdDesc(String targetId, WorkUnitKind kind);

    Optional<WorkUnit> findFirstByTargetIdOrderByCreatedAtDescIdDesc(String targetId);

    @Query("SELECT w FROM WorkUnit w WHERE w.targetId = :targetId AND w.kind = :kind AND w.liveMarker = true")
    Optional<WorkUnit> findLive(@Param("targetId") String targetId, @Param("kind") WorkUnitKind kind);

    Page<WorkUnit> findByOwnerId(String ownerId, Pageable pageable);

    @Query("SELECT w.id FROM WorkUnit w WHERE w.leaseToken IS NULL AND w.awaitingCallback = false " +
            "AND w.status IN :statuses AND (w.nextAttemptAt IS NULL OR w.nextAttemptAt <= :now) " +
            "ORDER BY w.createdAt ASC, w.id ASC")
    List<Long> findClaimableIds(@Param("statuses") Collection<WorkUnitStatus> statuses,
                                @Param("now") Instant now,
                                Pageable pageable);

    /**
     * Atomic claim. Succeeds for exactly one caller; everyone else sees 0 updated rows.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WorkUnit w SET w.status = :running, w.leaseToken = :token, " +
            "w.startedAt = COALESCE(w.startedAt, :now), w.updatedAt = :now, w.nextAttemptAt = NULL, " +
            "w.version = w.version + 1 " +
            "WHERE w.id = :id AND w.leaseToken IS NULL AND w.awaitingCallback = false " +
            "AND w.status IN :claimable AND (w.nextAttemptAt IS NULL OR w.nextAttemptAt <= :now)")
    int claim(@Param("id") Long id,
              @Param("token") String token,
              @Param("running") WorkUnitStatus running,
              @Param("claimable") Collection<WorkUnitStatus> claimable,
              @Param("now") Instant now);

    @Query("SELECT w.id FROM WorkUnit w WHERE w.status = :status AND w.updatedAt < :threshold ORDER BY w.updatedAt ASC")
    List<Long> findIdsByStatusUpdatedBefore(@Param("status") WorkUnitStatus status,
                                           @Param("threshold") Instant threshold,
                                           Pageable pageable);

    /**
     * Finalizes a unit as failed only if it is still in the expected status and its
     * updated_at is still older than the threshold at write time.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WorkUnit w SET w.status = :failure, w.message = :message, w.errorClassification = :classification, " +
            "w.liveMarker = NULL, w.leaseToken = NULL, w.awaitingCallback = false, w.nextAttemptAt = NULL, " +
            "w.completedAt = :now, w.updatedAt = :now, w.version = w.version + 1 " +
            "WHERE w.id = :id AND w.status = :expected AND w.updatedAt < :threshold")
    int failIfStale(@Param("id") Long id,
                    @Param("expected") WorkUnitStatus expected,
                    @Param("threshold") Instant threshold,
                    @Param("failure") WorkUnitStatus failure,
                    @Param("message") String message,
                    @Param("classification") ErrorClassification classification,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM WorkUnit w WHERE w.id IN :ids AND w.status = :status AND w.updatedAt < :threshold")
    int deleteTerminal(@Param("ids") Collection<Long> ids,
                       @Param("status") WorkUnitStatus status,
                       @Param("threshold") Instant threshold);

    @Query("SELECT count(w) FROM WorkUnit w WHERE w.targetId = :targetId AND w.kind = :kind AND w.liveMarker = true")
    long countLive(@Param("targetId") String targetId, @Param("kind") WorkUnitKind kind);
}
