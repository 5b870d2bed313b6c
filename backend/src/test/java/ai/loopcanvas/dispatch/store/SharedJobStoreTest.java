package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.entity.GenerationJobEntity;
import ai.loopcanvas.dispatch.repository.GenerationJobRepository;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Pageable;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs the store behaviour against H2. Each repository call commits on its own,
 * the way concurrent nodes see each other.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class SharedJobStoreTest extends AbstractJobStoreTest {

    @Autowired
    private GenerationJobRepository repository;

    private SharedJobStore store;

    @BeforeEach
    void setUp() {
        store = new SharedJobStore(repository, clock, 5, 3);
    }

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Override
    protected JobStore store() {
        return store;
    }

    @Test
    void claim_ReadBackFailureAfterWinningIsAStoreError() {
        // Given
        GenerationJobRepository failing = mock(GenerationJobRepository.class);
        when(failing.findClaimCandidateIds(eq(JobStatus.QUEUED), any(Pageable.class))).thenReturn(List.of("j1"));
        when(failing.claimIfQueued(eq("j1"), eq("w1"), eq("gpu"), any(), eq(JobStatus.CLAIMED), eq(JobStatus.QUEUED)))
                .thenReturn(1);
        when(failing.findById("j1")).thenThrow(new QueryTimeoutException("statement timeout"));
        SharedJobStore failingStore = new SharedJobStore(failing, clock, 5, 3);

        // When & Then
        assertThatThrownBy(() -> failingStore.claim("w1", "gpu"))
                .isInstanceOf(JobStore.JobStoreException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void claim_SingleJobRacedByManyWorkers_HasOneWinner() throws Exception {
        // Given
        String jobId = enqueue(10, 3);
        int workers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch startGate = new CountDownLatch(1);
        List<String> winners = Collections.synchronizedList(new ArrayList<>());

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            String workerId = "w" + w;
            futures.add(executor.submit(() -> {
                startGate.await();
                store.claim(workerId, "gpu").ifPresent(job -> winners.add(workerId));
                return null;
            }));
        }
        startGate.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(winners).hasSize(1);
        GenerationJob job = store.get(jobId).orElseThrow();
        assertThat(job.getClaimedBy()).isEqualTo(winners.get(0));
        assertThat(job.getStatus()).isEqualTo(JobStatus.CLAIMED);
    }

    @Test
    void claim_BumpsVersionSoStaleWritersConflict() {
        String jobId = enqueue(10, 3);
        Long versionBefore = repository.findById(jobId).map(GenerationJobEntity::getVersion).orElseThrow();

        store.claim("w1", "gpu");

        Long versionAfter = repository.findById(jobId).map(GenerationJobEntity::getVersion).orElseThrow();
        assertThat(versionAfter).isGreaterThan(versionBefore);
    }

    @Test
    void inputRef_RoundTripsThroughJsonColumn() {
        GenerationJob job = newJob(10, 3);
        GenerationJob withNested = job.toBuilder()
                .inputRef(new LinkedHashMap<>(Map.of(
                        "media_url", "s3://bucket/clip.mp4",
                        "params", Map.of("bpm", 120))))
                .build();
        store.enqueue(withNested);

        Optional<GenerationJob> loaded = store.get(withNested.getJobId());

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getInputRef()).containsEntry("media_url", "s3://bucket/clip.mp4");
        assertThat(loaded.get().getInputRef().get("params")).isEqualTo(Map.of("bpm", 120));
    }

    @Test
    void backendName_IsShared() {
        assertThat(store.backendName()).isEqualTo("shared");
        assertThat(store.stats().getBackend()).isEqualTo("shared");
    }
}
