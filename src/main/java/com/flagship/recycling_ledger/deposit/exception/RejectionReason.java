package com.flagship.recycling_ledger.deposit.exception;

import org.springframework.http.HttpStatus;

/**
 * Why a deposit attempt was refused before it reached the ledger.
 * Each reason carries the HTTP status the REST layer reports it with.
 */
public enum RejectionReason {
    INVALID_REFERENCE(HttpStatus.BAD_REQUEST),
    INVALID_WEIGHT(HttpStatus.BAD_REQUEST),
    DUPLICATE_SUBMISSION(HttpStatus.CONFLICT),
    DAILY_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    VELOCITY_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    MACHINE_CAPACITY_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS);

    private final HttpStatus status;

    RejectionReason(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
