package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.config.WorkerProperties;
import ai.loopcanvas.dispatch.service.QueueManager;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkerRunnerTest {

    @Test
    void resolveWorkerId_PrefersConfiguredId() {
        assertThat(WorkerRunner.resolveWorkerId("gpu-box-1")).isEqualTo("gpu-box-1");
    }

    @Test
    void resolveWorkerId_GeneratesUniqueIdsWhenBlank() {
        String first = WorkerRunner.resolveWorkerId("");
        String second = WorkerRunner.resolveWorkerId(null);

        assertThat(first).matches(".+-[0-9a-f]{8}");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void startAndShutdown_RunsWorkerAgainstLocalQueue() throws Exception {
        // Given
        QueueManager queueManager = mock(QueueManager.class);
        when(queueManager.getBackendName()).thenReturn("local");
        WorkerProperties properties = new WorkerProperties();
        properties.setId("w-test");
        properties.setPollInterval(Duration.ofMillis(20));

        WorkerRunner runner = new WorkerRunner(properties, queueManager, new RestTemplate(), new ObjectMapper());

        // When
        runner.start();

        // Then
        verify(queueManager, timeout(2000).atLeast(2)).claim("w-test", "local");
        runner.shutdown();
        assertThat(runner.getWorker().getWorkerId()).isEqualTo("w-test");
        assertThat(runner.getWorker().isRunning()).isFalse();
    }
}
