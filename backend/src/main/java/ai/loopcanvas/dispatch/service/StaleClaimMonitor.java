package ai.loopcanvas.dispatch.service;

import ai.loopcanvas.dispatch.config.QueueProperties;
import ai.loopcanvas.dispatch.store.JobStore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background loop returning abandoned claims to the queue.
 * Several API replicas may run one each; the requeue is conditional on the job still being active.
 */
@Slf4j
@Component
public class StaleClaimMonitor {

    private final JobStore jobStore;
    private final Clock clock;
    private final Duration staleThreshold;
    private final QueueMetricsService metricsService;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    @Autowired
    public StaleClaimMonitor(JobStore jobStore, Clock clock, QueueProperties queueProperties,
                             QueueMetricsService metricsService) {
        this(jobStore, clock, queueProperties.getMonitor().getStaleThreshold(), metricsService);
    }

    public StaleClaimMonitor(JobStore jobStore, Clock clock, Duration staleThreshold,
                             QueueMetricsService metricsService) {
        this.jobStore = jobStore;
        this.clock = clock;
        this.staleThreshold = staleThreshold;
        this.metricsService = metricsService;
    }

    /**
     * Starts the loop; a second call while running is ignored
     *
     * @param interval delay between cycles
     */
    public synchronized void start(Duration interval) {
        if (running) {
            log.debug("Stale-claim monitor already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stale-claim-monitor");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = Math.max(1, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::runCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Stale-claim monitor started (interval: {}, threshold: {})", interval, staleThreshold);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Stale-claim monitor shutdown timeout, forcing shutdown");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stale-claim monitor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One monitor pass. Failures are logged and reported as zero so the schedule keeps running.
     *
     * @return number of jobs requeued
     */
    public int runCycle() {
        try {
            Instant cutoff = clock.instant().minus(staleThreshold);
            int requeued = jobStore.requeueStale(cutoff);
            if (requeued > 0) {
                log.info("Requeued {} stale job(s) claimed before {}", requeued, cutoff);
                metricsService.recordStaleRequeued(requeued);
            } else {
                log.debug("No stale claims before {}", cutoff);
            }
            return requeued;
        } catch (RuntimeException e) {
            log.error("Stale-claim monitor cycle failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    Duration getStaleThreshold() {
        return staleThreshold;
    }
}
