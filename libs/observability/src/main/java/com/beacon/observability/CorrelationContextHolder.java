package com.beacon.observability;

import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 *
 * <p>Setting a context populates the MDC keys {@code correlationId}, {@code cycleId} and {@code
 * serviceName}; clearing removes them. Work handed to another thread (probe executors, read
 * executors) does not inherit the context; wrap it with {@link #wrap(Callable)} or {@link
 * #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's correlation context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_CYCLE_ID);
        MDC.remove(CorrelationContext.MDC_SERVICE_NAME);
    }

    /**
     * Runs work with the given context, then restores whatever context was active before (or clears
     * it if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            restore(previous);
        }
    }

    /** Like {@link #runWithContext(CorrelationContext, Runnable)}, for work that returns a value. */
    public static <T> T callWithContext(CorrelationContext context, Callable<T> callable)
            throws Exception {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return callable.call();
        } finally {
            restore(previous);
        }
    }

    /**
     * Captures the caller's current context so the callable runs under it on whichever thread
     * executes it. Returns the callable unchanged when no context is active.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return callable;
        }
        return () -> callWithContext(captured, callable);
    }

    private static void restore(CorrelationContext previous) {
        if (previous != null) {
            set(previous);
        } else {
            clear();
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_CYCLE_ID, ctx.cycleId());
        setMdc(CorrelationContext.MDC_SERVICE_NAME, ctx.serviceName());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
