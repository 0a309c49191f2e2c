package com.example.clipflow.repository;

import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface CallbackCorrelationRepository extends JpaRepository<CallbackCorrelation, String> {

    /**
     * Records a completion. Only an awaiting, unexpired correlation can be moved to delivered.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CallbackCorrelation c SET c.status = :delivered, c.resultRef = :resultRef, c.error = :error, " +
            "c.deliveredAt = :now " +
            "WHERE c.correlationId = :id AND c.status = :awaiting AND c.expiresAt > :now")
    int markDelivered(@Param("id") String correlationId,
                      @Param("resultRef") String resultRef,
                      @Param("error") String error,
                      @Param("now") Instant now,
                      @Param("awaiting") CorrelationStatus awaiting,
                      @Param("delivered") CorrelationStatus delivered);

    List<CallbackCorrelation> findByStatusOrderByDeliveredAtAsc(CorrelationStatus status, Pageable pageable);

    List<CallbackCorrelation> findByStatusAndExpiresAtBefore(CorrelationStatus status, Instant threshold, Pageable pageable);

    /**
     * Check-and-delete used to consume a delivered result. Returns 1 for exactly one consumer.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CallbackCorrelation c WHERE c.correlationId = :id AND c.status = :status")
    int deleteIfStatus(@Param("id") String correlationId, @Param("status") CorrelationStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CallbackCorrelation c SET c.status = :expired " +
            "WHERE c.correlationId = :id AND c.status = :awaiting AND c.expiresAt <= :now")
    int markExpired(@Param("id") String correlationId,
                    @Param("now") Instant now,
                    @Param("awaiting") CorrelationStatus awaiting,
                    @Param("expired") CorrelationStatus expired);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CallbackCorrelation c WHERE c.status = :status AND c.expiresAt < :threshold")
    int purgeByStatusExpiredBefore(@Param("status") CorrelationStatus status, @Param("threshold") Instant threshold);
}
