package com.lorekeeper.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retry policy for a single provider: exponential backoff, honouring a
 * {@code Retry-After} hint on 429, and giving up at once on errors that
 * waiting cannot fix.
 */
public final class ResilientCall {

    private static final Logger log = LoggerFactory.getLogger(ResilientCall.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    enum Outcome { RETRY, RATE_LIMITED, GIVE_UP }

    static final long MAX_BACKOFF_MS = 10_000;
    static final long RETRY_AFTER_CAP_MS = 30_000;

    private static final Pattern STATUS_IN_MESSAGE = Pattern.compile("\\b([1-5]\\d{2})\\b");
    private static final Pattern RETRY_AFTER = Pattern.compile("(?i)retry[_-]after[:\\s]+([\\d.]+)");

    private final int maxRetries;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public ResilientCall(int maxRetries, long baseDelayMs) {
        this(maxRetries, baseDelayMs, Thread::sleep);
    }

    ResilientCall(int maxRetries, long baseDelayMs, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(1, baseDelayMs);
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code action} up to {@code maxRetries + 1} times. The last
     * {@link ProviderException} is rethrown as is; anything else is wrapped.
     */
    public <T> T call(String providerId, Supplier<T> action) {
        RuntimeException last = null;
        long backoff = baseDelayMs;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                var outcome = classify(e);
                if (outcome == Outcome.GIVE_UP || attempt == maxRetries) break;

                long wait = outcome == Outcome.RATE_LIMITED ? Math.max(backoff, retryAfterMs(e)) : backoff;
                log.debug("{} attempt {} failed ({}), retrying in {} ms", providerId, attempt + 1, outcome, wait);
                pause(providerId, wait);
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
            }
        }
        if (last instanceof ProviderException pe) throw pe;
        throw new ProviderException(providerId, statusOf(last), "all retries exhausted", last);
    }

    static Outcome classify(RuntimeException e) {
        if (e instanceof ProviderException pe && pe.statusCode() == 0
                && String.valueOf(pe.getMessage()).contains("no API key")) {
            return Outcome.GIVE_UP;
        }
        int status = statusOf(e);
        if (status == 429) return Outcome.RATE_LIMITED;
        if (status >= 400 && status < 500 && status != 408) return Outcome.GIVE_UP;
        return Outcome.RETRY;
    }

    /** Seconds from a {@code retry-after} hint in the message, in ms and capped; 0 when absent. */
    static long retryAfterMs(RuntimeException e) {
        if (e.getMessage() == null) return 0;
        Matcher m = RETRY_AFTER.matcher(e.getMessage());
        if (!m.find()) return 0;
        try {
            double seconds = Double.parseDouble(m.group(1));
            return Double.isFinite(seconds) && seconds >= 0
                    ? Math.min((long) (seconds * 1000), RETRY_AFTER_CAP_MS)
                    : 0;
        } catch (NumberFormatException nfe) {
            log.debug("Unreadable retry-after hint: {}", m.group(1));
            return 0;
        }
    }

    private static int statusOf(RuntimeException e) {
        if (e instanceof ProviderException pe && pe.statusCode() > 0) return pe.statusCode();
        if (e == null || e.getMessage() == null) return 0;
        var m = STATUS_IN_MESSAGE.matcher(e.getMessage());
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }

    private void pause(String providerId, long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerId, 0, "interrupted during retry", ie);
        }
    }
}
