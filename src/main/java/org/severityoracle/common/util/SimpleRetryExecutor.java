package org.severityoracle.common.util;

import org.severityoracle.common.interfaces.RetryExecutor;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter for transient failures.
 * Delays go base, 2*base, 4*base ... capped at {@code maxDelayMs}, plus up to {@code jitterMs}.
 */
public final class SimpleRetryExecutor implements RetryExecutor {

    /** Maximum number of attempts (inclusive of first try). */
    private final int maxAttempts;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long jitterMs;

    /**
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelayMs delay before the first retry
     * @param maxDelayMs  cap for the exponential backoff
     * @param jitterMs    random extra delay, up to this amount
     */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs  = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs    = Math.max(0, jitterMs);
    }

    public int maxAttempts() { return maxAttempts; }

    @Override
    public <T> T execute(Callable<T> op) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }

                long delay = baseDelayMs << Math.max(0, attempt - 1);
                if (delay > maxDelayMs || delay < 0) delay = maxDelayMs;
                long sleep = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L);

                System.out.println("[Retry] attempt " + (attempt + 1) + " in " + sleep +
                        "ms (error: " + e.getMessage() + ")");

                try {
                    Thread.sleep(sleep);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
