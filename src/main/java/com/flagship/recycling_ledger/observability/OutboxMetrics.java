package com.flagship.recycling_ledger.observability;

import com.flagship.recycling_ledger.deposit.event.DepositRecordedEvent;
import com.flagship.recycling_ledger.outbox.OutboxEventRepository;
import com.flagship.recycling_ledger.totals.event.UserTotalsRebuiltEvent;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and publish counters.
 *
 * The backlog is reported in total and per ledger event type, so a stuck
 * rebuild stream is visible next to a healthy deposit stream. Gauges read
 * cached values that {@link MetricsScheduler} refreshes; a scrape never hits
 * the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    static final List<String> LEDGER_EVENT_TYPES =
        List.of(DepositRecordedEvent.EVENT_TYPE, UserTotalsRebuiltEvent.EVENT_TYPE);

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final Map<String, AtomicLong> backlogByType = new LinkedHashMap<>();
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong exhaustedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Unpublished ledger events")
                .tag("event_type", "all")
                .register(meterRegistry);

        for (String eventType : LEDGER_EVENT_TYPES) {
            AtomicLong pending = new AtomicLong(0);
            backlogByType.put(eventType, pending);
            Gauge.builder("outbox.backlog.size", pending, AtomicLong::get)
                    .description("Unpublished ledger events")
                    .tag("event_type", eventType)
                    .register(meterRegistry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event")
                .register(meterRegistry);

        Gauge.builder("outbox.events.exhausted", exhaustedEventCount, AtomicLong::get)
                .description("Unpublished events with no retries left, awaiting manual replay")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogByType.values().forEach(pending -> pending.set(0));
            long total = 0;
            for (OutboxEventRepository.PendingByType row : outboxRepository.countUnpublishedByEventType()) {
                total += row.getPending();
                AtomicLong pending = backlogByType.get(row.getEventType());
                if (pending != null) {
                    pending.set(row.getPending());
                }
            }
            backlogSize.set(total);

            long ageSeconds = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L);
            oldestEventAgeSeconds.set(ageSeconds);

            exhaustedEventCount.set(
                    outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, byType={}, oldestAge={}s, exhausted={}",
                    total, backlogByType, ageSeconds, exhaustedEventCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
