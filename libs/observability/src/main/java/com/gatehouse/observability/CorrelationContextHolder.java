package com.gatehouse.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Binds a {@link CorrelationContext} to the current thread and mirrors it into the SLF4J MDC.
 * <p>
 * {@link #bind(CorrelationContext)} returns a {@link Binding}; closing it restores whatever was
 * bound before, or clears the thread when nothing was. Servlet threads are pooled, so a request
 * must close its binding before the thread goes back to the pool.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Binds {@code context} to the current thread until the returned binding is closed.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static Binding bind(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        Binding binding = new Binding(CONTEXT.get());
        apply(context);
        return binding;
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** The user the current request was authenticated as, once the access guard has run. */
    public static Optional<String> currentUserId() {
        return get().map(CorrelationContext::userId);
    }

    /**
     * Records the authenticated user on the bound context. A no-op outside a request.
     */
    public static void bindUser(String userId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            apply(current.withUserId(userId));
        }
    }

    /** Drops any bound context and its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
    }

    private static void apply(CorrelationContext context) {
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        putOrRemove(CorrelationContext.MDC_USER_ID, context.userId());
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    /**
     * An open binding. Closing it twice is harmless.
     */
    public static final class Binding implements AutoCloseable {

        private final CorrelationContext previous;
        private boolean closed;

        private Binding(CorrelationContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous == null) {
                clear();
            } else {
                apply(previous);
            }
        }
    }
}
