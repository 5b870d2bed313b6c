package ai.loopcanvas.dispatch.service;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.QueueStats;
import ai.loopcanvas.dispatch.store.JobStore;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueueMetricsService
 */
@ExtendWith(MockitoExtension.class)
class QueueMetricsServiceTest {

    @Mock
    private JobStore jobStore;

    private SimpleMeterRegistry meterRegistry;
    private QueueMetricsService metricsService;

    @BeforeEach
    void setUp() {
        when(jobStore.backendName()).thenReturn("shared");
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new QueueMetricsService(meterRegistry, jobStore);
    }

    @Test
    void refreshStatusGauges_CopiesStoreCounts() {
        // Given
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        counts.put(JobStatus.QUEUED, 4L);
        counts.put(JobStatus.DEAD, 1L);
        when(jobStore.stats()).thenReturn(QueueStats.builder().backend("shared").total(5).byStatus(counts).build());

        // When
        metricsService.refreshStatusGauges();

        // Then
        assertThat(metricsService.currentCount(JobStatus.QUEUED)).isEqualTo(4);
        assertThat(metricsService.currentCount(JobStatus.CLAIMED)).isZero();
        assertThat(meterRegistry.get("generation_jobs")
                .tag("status", "dead").tag("backend", "shared").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("generation_jobs_stats_refresh_duration_seconds").timer().count()).isEqualTo(1);
    }

    @Test
    void refreshStatusGauges_StoreFailureKeepsLastValues() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        counts.put(JobStatus.QUEUED, 2L);
        when(jobStore.stats())
                .thenReturn(QueueStats.builder().total(2).byStatus(counts).build())
                .thenThrow(new JobStore.JobStoreException("unavailable"));

        metricsService.refreshStatusGauges();
        metricsService.refreshStatusGauges();

        assertThat(metricsService.currentCount(JobStatus.QUEUED)).isEqualTo(2);
    }

    @Test
    void counters_RecordLifecycleEvents() {
        metricsService.recordSubmitted();
        metricsService.recordSubmitted();
        metricsService.recordClaimed();
        metricsService.recordCompleted();
        metricsService.recordFailed(JobStatus.QUEUED);
        metricsService.recordFailed(JobStatus.DEAD);
        metricsService.recordFailed(JobStatus.DEAD);
        metricsService.recordStaleRequeued(0);

        assertThat(meterRegistry.get("generation_jobs_submitted_total").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("generation_jobs_claimed_total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("generation_jobs_completed_total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("generation_jobs_failed_total").tag("outcome", "dead").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("generation_jobs_failed_total").tag("outcome", "queued").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("generation_jobs_stale_requeued_total").counter().count()).isZero();
    }
}
