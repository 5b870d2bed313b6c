package ai.loopcanvas.dispatch.worker;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-worker counters, reported when the worker stops
 */
public class WorkerStats {

    private final AtomicLong jobsCompleted = new AtomicLong(0);
    private final AtomicLong jobsFailed = new AtomicLong(0);
    private final AtomicLong totalGenerationMillis = new AtomicLong(0);

    void recordCompleted(Duration generationTime) {
        jobsCompleted.incrementAndGet();
        totalGenerationMillis.addAndGet(generationTime.toMillis());
    }

    void recordFailed() {
        jobsFailed.incrementAndGet();
    }

    public long getJobsCompleted() {
        return jobsCompleted.get();
    }

    public long getJobsFailed() {
        return jobsFailed.get();
    }

    /**
     * Average generation time of completed jobs, zero before the first completion
     */
    public Duration getAverageGenerationTime() {
        long completed = jobsCompleted.get();
        return completed > 0 ? Duration.ofMillis(totalGenerationMillis.get() / completed) : Duration.ZERO;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("jobsCompleted", getJobsCompleted());
        map.put("jobsFailed", getJobsFailed());
        map.put("averageGenerationSeconds", getAverageGenerationTime().toMillis() / 1000.0);
        return map;
    }
}
