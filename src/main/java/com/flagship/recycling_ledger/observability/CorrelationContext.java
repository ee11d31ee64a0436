package com.flagship.recycling_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys carried by every log line, and helpers to bind them.
 *
 * - correlationId: one per HTTP request (X-Correlation-ID) or background job run
 * - userId: the depositing user, while a deposit is processed
 * - transactionId: the ledger transaction ID, once one has been assigned
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private static final int MAX_INBOUND_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Binds the caller's correlation ID, or a fresh one when the caller sent none
     * or sent something unusable in a log line.
     *
     * @return the bound ID
     */
    public static String bindCorrelationId(String inbound) {
        String stripped = inbound == null ? null : inbound.strip();
        String id = isUsable(stripped) ? stripped : newCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Binds a correlation ID for a scheduled job run, e.g. "reconcile-1a2b3c4d".
     */
    public static String bindJobCorrelationId(String job) {
        String id = job + "-" + newCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static void bindUser(UUID userId) {
        MDC.put(USER_ID_MDC_KEY, String.valueOf(userId));
    }

    public static void bindTransaction(String transactionId) {
        MDC.put(TRANSACTION_ID_MDC_KEY, transactionId);
    }

    /**
     * Drops the per-deposit keys; the correlation ID stays for the rest of the request.
     */
    public static void clearDeposit() {
        MDC.remove(USER_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }

    public static void clearAll() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        clearDeposit();
    }

    static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static boolean isUsable(String id) {
        if (id == null || id.isEmpty() || id.length() > MAX_INBOUND_LENGTH) {
            return false;
        }
        return id.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.');
    }
}
