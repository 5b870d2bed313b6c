package ai.loopcanvas.dispatch.health;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.QueueStats;
import ai.loopcanvas.dispatch.service.StaleClaimMonitor;
import ai.loopcanvas.dispatch.store.JobStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Health of the job store: reachable, how fast, how many jobs wait, and whether the
 * stale-claim monitor is running.
 */
@Component
public class JobStoreHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(JobStoreHealthIndicator.class);

    // Performance thresholds (milliseconds)
    private static final long GOOD_RESPONSE_TIME_MS = 100;
    private static final long WARNING_RESPONSE_TIME_MS = 500;
    private static final long CRITICAL_RESPONSE_TIME_MS = 2000;

    private final JobStore jobStore;
    private final StaleClaimMonitor staleClaimMonitor;

    public JobStoreHealthIndicator(JobStore jobStore, StaleClaimMonitor staleClaimMonitor) {
        this.jobStore = jobStore;
        this.staleClaimMonitor = staleClaimMonitor;
    }

    @Override
    public Health health() {
        Health.Builder healthBuilder = new Health.Builder();
        Instant startTime = Instant.now();

        try {
            QueueStats stats = jobStore.stats();
            long responseTimeMs = Duration.between(startTime, Instant.now()).toMillis();

            if (responseTimeMs <= WARNING_RESPONSE_TIME_MS) {
                healthBuilder.up();
            } else if (responseTimeMs <= CRITICAL_RESPONSE_TIME_MS) {
                healthBuilder.status("SLOW");
            } else {
                healthBuilder.status("CRITICAL");
            }

            healthBuilder
                .withDetail("backend", jobStore.backendName())
                .withDetail("response_time_ms", responseTimeMs)
                .withDetail("performance_rating", getPerformanceRating(responseTimeMs))
                .withDetail("total_jobs", stats.getTotal())
                .withDetail("queued_jobs", stats.count(JobStatus.QUEUED))
                .withDetail("dead_jobs", stats.count(JobStatus.DEAD))
                .withDetail("monitor_running", staleClaimMonitor.isRunning())
                .withDetail("last_check", Instant.now().toString());

        } catch (Exception e) {
            logger.warn("Job store health check failed: {}", e.getMessage());
            healthBuilder.down()
                .withDetail("backend", jobStore.backendName())
                .withDetail("error", e.getMessage())
                .withDetail("response_time_ms", Duration.between(startTime, Instant.now()).toMillis())
                .withDetail("last_check", Instant.now().toString());
        }

        return healthBuilder.build();
    }

    private String getPerformanceRating(long responseTimeMs) {
        if (responseTimeMs <= GOOD_RESPONSE_TIME_MS) {
            return "EXCELLENT";
        } else if (responseTimeMs <= WARNING_RESPONSE_TIME_MS) {
            return "GOOD";
        } else if (responseTimeMs <= CRITICAL_RESPONSE_TIME_MS) {
            return "SLOW";
        } else {
            return "CRITICAL";
        }
    }
}
