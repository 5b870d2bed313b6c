package ai.loopcanvas.dispatch.service;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.QueueStats;
import ai.loopcanvas.dispatch.store.JobStore;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the dispatch queue.
 *
 * Key metrics:
 * - generation_jobs{status}: jobs currently in each status, refreshed from the store
 * - generation_jobs_submitted_total, generation_jobs_claimed_total, generation_jobs_completed_total
 * - generation_jobs_failed_total{outcome}: failure reports by resulting status (queued/dead)
 * - generation_jobs_stale_requeued_total: jobs returned to the queue by the monitor
 */
@Slf4j
@Service
public class QueueMetricsService {

    private final MeterRegistry meterRegistry;
    private final JobStore jobStore;

    private final Map<JobStatus, AtomicLong> statusCounts = new EnumMap<>(JobStatus.class);
    private final Map<JobStatus, Counter> failedCounters = new EnumMap<>(JobStatus.class);

    private Counter submittedCounter;
    private Counter claimedCounter;
    private Counter completedCounter;
    private Counter staleRequeuedCounter;
    private Timer statsRefreshTimer;

    public QueueMetricsService(MeterRegistry meterRegistry, JobStore jobStore) {
        this.meterRegistry = meterRegistry;
        this.jobStore = jobStore;
        initializeMetrics();
        log.info("QueueMetricsService initialized for {} store", jobStore.backendName());
    }

    private void initializeMetrics() {
        for (JobStatus status : JobStatus.values()) {
            AtomicLong count = new AtomicLong();
            statusCounts.put(status, count);
            Gauge.builder("generation_jobs", count, AtomicLong::get)
                    .description("Current number of generation jobs in a status")
                    .tag("status", status.getValue())
                    .tag("backend", jobStore.backendName())
                    .register(meterRegistry);
        }

        submittedCounter = Counter.builder("generation_jobs_submitted_total")
                .description("Total number of submitted generation jobs")
                .register(meterRegistry);
        claimedCounter = Counter.builder("generation_jobs_claimed_total")
                .description("Total number of successful claims")
                .register(meterRegistry);
        completedCounter = Counter.builder("generation_jobs_completed_total")
                .description("Total number of completed generation jobs")
                .register(meterRegistry);
        staleRequeuedCounter = Counter.builder("generation_jobs_stale_requeued_total")
                .description("Total number of jobs requeued after their claim timed out")
                .register(meterRegistry);

        for (JobStatus outcome : new JobStatus[]{JobStatus.QUEUED, JobStatus.DEAD}) {
            failedCounters.put(outcome, Counter.builder("generation_jobs_failed_total")
                    .description("Total number of failure reports by resulting status")
                    .tag("outcome", outcome.getValue())
                    .register(meterRegistry));
        }

        statsRefreshTimer = Timer.builder("generation_jobs_stats_refresh_duration_seconds")
                .description("Time spent reading queue statistics from the store")
                .register(meterRegistry);
    }

    /**
     * Refreshes the per-status gauges from the store
     */
    @Scheduled(fixedDelayString = "${app.queue.metrics.refresh-interval:15000}")
    public void refreshStatusGauges() {
        try {
            QueueStats stats = statsRefreshTimer.recordCallable(jobStore::stats);
            if (stats != null) {
                statusCounts.forEach((status, count) -> count.set(stats.count(status)));
            }
        } catch (Exception e) {
            log.warn("Failed to refresh queue status gauges: {}", e.getMessage());
        }
    }

    public void recordSubmitted() {
        submittedCounter.increment();
    }

    public void recordClaimed() {
        claimedCounter.increment();
    }

    public void recordCompleted() {
        completedCounter.increment();
    }

    public void recordFailed(JobStatus outcome) {
        Counter counter = failedCounters.get(outcome);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordStaleRequeued(int count) {
        if (count > 0) {
            staleRequeuedCounter.increment(count);
        }
    }

    long currentCount(JobStatus status) {
        return statusCounts.get(status).get();
    }
}
