package com.flagship.interunit_recon.observability;

import java.util.UUID;

/**
 * Thread-local holder for the request correlation id, plus the MDC keys used across
 * the service.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header or is generated per
 * request. A reconciliation run adds its own run id on top, so every log line of a run
 * can be tied back to both the request and the run.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String UID_MDC_KEY = "uid";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generated on first access outside a request.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
