package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.config.WorkerProperties;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for worker calls against the queue (claim, complete, fail).
 * The delay doubles per failed attempt, is capped at {@code maxDelay} and spread by
 * {@code jitter} so a fleet of workers does not retry in lockstep after an outage.
 */
@Value
@Builder
public class CallRetryPolicy {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    /** Fraction of the delay added or removed at random, 0 disables jitter */
    @Builder.Default
    double jitter = 0.2;

    public static CallRetryPolicy fromProperties(WorkerProperties.Retry retry) {
        return CallRetryPolicy.builder()
                .maxRetries(retry.getMaxRetries())
                .initialDelay(retry.getInitialDelay())
                .maxDelay(retry.getMaxDelay())
                .jitter(retry.getJitter())
                .build();
    }

    /**
     * @param failedAttempts calls that already failed in this round, at least 1
     */
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts <= maxRetries;
    }

    /**
     * Pause before the next call after {@code failedAttempts} failures
     */
    public Duration delayAfter(int failedAttempts) {
        long capMs = maxDelay.toMillis();
        double baseMs = Math.min(initialDelay.toMillis() * Math.pow(2, Math.max(0, failedAttempts - 1)), capMs);
        if (jitter > 0) {
            baseMs += baseMs * jitter * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        }
        return Duration.ofMillis(Math.max(0, Math.min((long) baseMs, capMs)));
    }
}
