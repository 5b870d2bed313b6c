package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.config.WorkerProperties;
import ai.loopcanvas.dispatch.service.QueueManager;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Paths;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs one continuous generation worker inside this process when app.worker.enabled=true.
 * Talks to the remote queue when app.worker.server-url is set, to the local queue otherwise.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.worker.enabled", havingValue = "true")
public class WorkerRunner {

    private final WorkerProperties workerProperties;
    private final GenerationWorker worker;
    private ExecutorService executor;

    public WorkerRunner(WorkerProperties workerProperties,
                        QueueManager queueManager,
                        @Qualifier("workerRestTemplate") RestTemplate restTemplate,
                        ObjectMapper objectMapper) {
        this.workerProperties = workerProperties;

        WorkerClient client = workerProperties.getServerUrl() == null || workerProperties.getServerUrl().isBlank()
                ? new LocalWorkerClient(queueManager)
                : new RemoteWorkerClient(restTemplate, workerProperties.getServerUrl());

        WorkerProperties.Pipeline pipelineProperties = workerProperties.getPipeline();
        GenerationPipeline pipeline = new ProcessGenerationPipeline(
                pipelineProperties.getCommand(),
                Paths.get(pipelineProperties.getOutputRoot()),
                pipelineProperties.getTimeout(),
                objectMapper);

        this.worker = new GenerationWorker(
                resolveWorkerId(workerProperties.getId()),
                workerProperties.getType(),
                client,
                pipeline,
                CallRetryPolicy.fromProperties(workerProperties.getRetry()),
                workerProperties.getPollInterval(),
                workerProperties.getMaxIdle());
    }

    @PostConstruct
    public void start() {
        executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "generation-worker"));
        executor.submit(() -> {
            try {
                worker.runContinuous();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Worker {} interrupted", worker.getWorkerId());
            } catch (RuntimeException e) {
                log.error("Worker {} crashed: {}", worker.getWorkerId(), e.getMessage(), e);
            }
        });
        log.info("Started worker {} ({})", worker.getWorkerId(), workerProperties.getType());
    }

    @PreDestroy
    public void shutdown() {
        worker.stop();
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker {} did not stop in time", worker.getWorkerId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    GenerationWorker getWorker() {
        return worker;
    }

    static String resolveWorkerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "worker";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
