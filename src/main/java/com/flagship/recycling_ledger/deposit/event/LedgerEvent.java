package com.flagship.recycling_ledger.deposit.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about one user's ledger, published through the outbox.
 *
 * Consumers deduplicate on {@link #getEventId()}; all events of a user share
 * the user ID as Kafka key.
 */
public interface LedgerEvent {

    UUID getEventId();

    UUID getUserId();

    Instant getOccurredAt();

    /**
     * Event type name, e.g. "DepositRecorded".
     */
    String getEventType();
}
