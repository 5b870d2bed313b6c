package ai.loopcanvas.dispatch.config;

import ai.loopcanvas.dispatch.repository.GenerationJobRepository;
import ai.loopcanvas.dispatch.store.JobStore;
import ai.loopcanvas.dispatch.store.LocalJobStore;
import ai.loopcanvas.dispatch.store.SharedJobStore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Selects and builds the single {@link JobStore} shared by the API and any in-process worker.
 */
@Slf4j
@Configuration
public class JobStoreConfig {

    static final String DATASOURCE_URL_PROPERTY = "spring.datasource.url";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(QueueProperties queueProperties,
                             Environment environment,
                             ObjectProvider<GenerationJobRepository> repositoryProvider,
                             Clock clock) {
        QueueProperties.Backend backend = resolveBackend(queueProperties.getBackend(),
                environment.getProperty(DATASOURCE_URL_PROPERTY));

        if (backend == QueueProperties.Backend.SHARED) {
            GenerationJobRepository repository = repositoryProvider.getIfAvailable();
            if (repository == null) {
                throw new IllegalStateException("Shared job store requested but no JPA repository is available");
            }
            QueueProperties.Shared shared = queueProperties.getShared();
            log.info("Using shared job store (claim candidates: {}, conflict retries: {})",
                    shared.getClaimCandidates(), shared.getConflictRetries());
            return new SharedJobStore(repository, clock, shared.getClaimCandidates(), shared.getConflictRetries());
        }

        log.info("Using local job store in {}", queueProperties.getLocal().getDataDir());
        return new LocalJobStore(Paths.get(queueProperties.getLocal().getDataDir()), clock);
    }

    /**
     * AUTO picks the shared store as soon as a datasource URL is configured
     */
    static QueueProperties.Backend resolveBackend(QueueProperties.Backend configured, String datasourceUrl) {
        if (configured != null && configured != QueueProperties.Backend.AUTO) {
            return configured;
        }
        return datasourceUrl != null && !datasourceUrl.isBlank()
                ? QueueProperties.Backend.SHARED
                : QueueProperties.Backend.LOCAL;
    }
}
