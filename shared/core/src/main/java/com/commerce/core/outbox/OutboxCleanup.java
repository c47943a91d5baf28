package com.commerce.core.outbox;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drops relayed envelopes once they have been published for longer than the
 * retention window. Unpublished rows are never touched.
 */
@Component
public class OutboxCleanup {

    private static final Logger log = LoggerFactory.getLogger(OutboxCleanup.class);

    private final OutboxRepository outboxRepository;
    private final Clock clock;
    private final Duration retention;
    private final MeterRegistry meterRegistry;

    public OutboxCleanup(OutboxRepository outboxRepository,
                         Clock clock,
                         @Value("${outbox.cleanup.retention:P7D}") Duration retention,
                         MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.clock = clock;
        this.retention = retention;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${outbox.cleanup.interval-ms:3600000}")
    @Transactional
    public int purgePublished() {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = outboxRepository.deletePublishedBefore(cutoff);
        if (deleted > 0) {
            meterRegistry.counter("outbox_purged_total").increment(deleted);
            log.info("Purged {} outbox envelopes published before {}", deleted, cutoff);
        }
        return deleted;
    }
}
