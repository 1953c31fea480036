package com.voucherpay.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Per-thread {@link CorrelationContext}, mirrored into the SLF4J MDC.
 * <p>
 * Whatever is set here shows up in every log line the thread writes until {@link #clear()}.
 * Threads do not inherit the context; work handed to another thread, such as analytics
 * delivery, carries it across with {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Replaces the current thread's context and its MDC entries.
     *
     * @throws IllegalArgumentException if context is null; use {@link #clear()} instead
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        removeMdcKeys();
        context.mdcEntries().forEach(MDC::put);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Records the verified user on the current context. Does nothing outside a request. */
    public static void bindUser(String userId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withUserId(userId));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        removeMdcKeys();
    }

    /**
     * Runs {@code work} under {@code context}, then puts back whatever the thread had before.
     * A null context runs the work as is.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        if (context == null) {
            work.run();
            return;
        }
        CorrelationContext previous = CONTEXT.get();
        set(context);
        try {
            work.run();
        } finally {
            if (previous == null) {
                clear();
            } else {
                set(previous);
            }
        }
    }

    private static void removeMdcKeys() {
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }
}
