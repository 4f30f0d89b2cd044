package com.gatehouse.observability;

/**
 * Immutable correlation context that flows with a single request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its values are injected
 * into SLF4J MDC so that every log line written while serving the request carries them, and the
 * correlation ID is echoed back to the client.
 *
 * @param correlationId unique ID for the client-visible flow (propagated or generated)
 * @param requestId     unique ID for this specific request (nullable)
 * @param userId        authenticated principal id, once the access guard has resolved one (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String userId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the authenticated user ID. */
    public static final String MDC_USER_ID = "userId";

    /**
     * @throws IllegalArgumentException if correlationId is null or blank
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given authenticated user.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, requestId, userId);
    }
}
