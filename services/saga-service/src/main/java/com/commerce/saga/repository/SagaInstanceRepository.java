package com.commerce.saga.repository;

import com.commerce.saga.entity.SagaInstance;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface SagaInstanceRepository extends JpaRepository<SagaInstance, UUID> {

    @Query("""
            SELECT s FROM SagaInstance s
            WHERE s.status = com.commerce.saga.entity.SagaStatus.RUNNING
              AND s.nextAttemptAt <= :now
            ORDER BY s.nextAttemptAt
            """)
    List<SagaInstance> findDueRetries(@Param("now") Instant now, Pageable pageable);

    @Query("""
            SELECT s FROM SagaInstance s
            WHERE s.status IN (com.commerce.saga.entity.SagaStatus.PENDING,
                               com.commerce.saga.entity.SagaStatus.RUNNING,
                               com.commerce.saga.entity.SagaStatus.COMPENSATING)
              AND s.nextAttemptAt IS NULL
              AND s.updatedAt < :cutoff
            ORDER BY s.updatedAt
            """)
    List<SagaInstance> findStale(@Param("cutoff") Instant cutoff, Pageable pageable);

    /**
     * Hands the saga to a new worker if nobody changed it since {@code version} was read.
     * Clearing the retry schedule keeps the next recovery pass from claiming it again.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE SagaInstance s
            SET s.executionToken = :token, s.nextAttemptAt = NULL, s.updatedAt = :now, s.version = s.version + 1
            WHERE s.id = :id AND s.version = :version
            """)
    int claim(@Param("id") UUID id, @Param("version") long version,
              @Param("token") UUID token, @Param("now") Instant now);
}
