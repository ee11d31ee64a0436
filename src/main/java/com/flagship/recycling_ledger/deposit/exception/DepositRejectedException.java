package com.flagship.recycling_ledger.deposit.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a deposit fails validation or a guard policy.
 *
 * Rejections are client-facing and never retried server side. Nothing has been
 * written to the ledger when one is thrown.
 */
@Getter
public class DepositRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final Map<String, String> details;

    public DepositRejectedException(RejectionReason reason, String message) {
        this(reason, message, Map.of());
    }

    public DepositRejectedException(RejectionReason reason, String message, Map<String, String> details) {
        super(message);
        this.reason = reason;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
