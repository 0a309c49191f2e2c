package com.example.clipflow.repository;

import com.example.clipflow.domain.WorkUnitLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface WorkUnitLogRepository extends JpaRepository<WorkUnitLogEntry, Long> {

    List<WorkUnitLogEntry> findByWorkUnitIdOrderByIdDesc(Long workUnitId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM WorkUnitLogEntry e WHERE e.workUnitId = :workUnitId AND e.id < :cutoffId")
    int deleteOlderThan(@Param("workUnitId") Long workUnitId, @Param("cutoffId") Long cutoffId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM WorkUnitLogEntry e WHERE e.workUnitId IN :workUnitIds")
    int deleteByWorkUnitIds(@Param("workUnitIds") Collection<Long> workUnitIds);
}
