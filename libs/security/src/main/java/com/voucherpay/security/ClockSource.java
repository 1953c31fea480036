package com.voucherpay.security;

import java.time.Clock;
import java.time.Instant;

/**
 * Supplies the current instant to token and TOTP logic.
 * <p>
 * Every time-dependent decision in this library (token expiry, TOTP step) reads the clock
 * through this interface so tests can pin or advance time.
 */
@FunctionalInterface
public interface ClockSource {

    /** Returns the current instant. */
    Instant now();

    /** Clock source backed by the system UTC clock. */
    static ClockSource system() {
        return fromClock(Clock.systemUTC());
    }

    /** Adapts a {@link Clock} (e.g. {@code Clock.fixed(...)}). */
    static ClockSource fromClock(Clock clock) {
        return clock::instant;
    }
}
