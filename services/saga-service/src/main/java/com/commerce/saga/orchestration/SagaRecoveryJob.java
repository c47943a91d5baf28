package com.commerce.saga.orchestration;

import com.commerce.saga.entity.SagaInstance;
import com.commerce.saga.repository.SagaInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resumes sagas whose retry is due and sagas nobody has touched for longer than
 * the stale interval, which is how executions lost in a crash get finished.
 */
@Component
@ConditionalOnProperty(name = "saga.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class SagaRecoveryJob {

    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryJob.class);

    private final SagaInstanceRepository repository;
    private final SagaOrchestrator orchestrator;
    private final Clock clock;
    private final Duration staleAfter;
    private final int batchSize;

    public SagaRecoveryJob(SagaInstanceRepository repository,
                           SagaOrchestrator orchestrator,
                           Clock clock,
                           @Value("${saga.recovery.stale-after:PT5M}") Duration staleAfter,
                           @Value("${saga.recovery.batch-size:50}") int batchSize) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${saga.recovery.interval-ms:10000}")
    public int recover() {
        Instant now = clock.instant();
        List<SagaInstance> candidates = new ArrayList<>(repository.findDueRetries(now, PageRequest.of(0, batchSize)));
        candidates.addAll(repository.findStale(now.minus(staleAfter), PageRequest.of(0, batchSize)));

        int resumed = 0;
        for (SagaInstance candidate : candidates) {
            if (orchestrator.resume(candidate)) {
                resumed++;
            }
        }
        if (resumed > 0) {
            log.info("Recovery resumed {} sagas", resumed);
        }
        return resumed;
    }
}
