package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class JobStateMachineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private GenerationJob queuedJob(String id, int priority, Instant createdAt) {
        return GenerationJob.builder()
                .jobId(id)
                .status(JobStatus.QUEUED)
                .priority(priority)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    private GenerationJob claimedJob(String workerId) {
        GenerationJob job = queuedJob("job-1", 10, T0);
        JobStateMachine.applyClaim(job, workerId, "gpu", T0);
        return job;
    }

    @Test
    void claimOrder_PriorityThenAgeThenId() {
        // Given
        List<GenerationJob> jobs = new ArrayList<>(List.of(
                queuedJob("c", 5, T0.plusSeconds(2)),
                queuedJob("b", 1, T0.plusSeconds(5)),
                queuedJob("z", 5, T0),
                queuedJob("a", 5, T0)));

        // When
        jobs.sort(JobStateMachine.CLAIM_ORDER);

        // Then
        assertThat(jobs).extracting(GenerationJob::getJobId).containsExactly("b", "a", "z", "c");
    }

    @Test
    void applyClaim_OnlyFromQueued() {
        GenerationJob job = queuedJob("job-1", 10, T0);

        assertThat(JobStateMachine.applyClaim(job, "w1", "gpu", T0.plusSeconds(1))).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CLAIMED);
        assertThat(job.getClaimedBy()).isEqualTo("w1");
        assertThat(job.getClaimedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(job.getWorkerType()).isEqualTo("gpu");

        assertThat(JobStateMachine.applyClaim(job, "w2", "gpu", T0.plusSeconds(2))).isFalse();
        assertThat(job.getClaimedBy()).isEqualTo("w1");
    }

    @Test
    void applyProgress_ClampsAndMovesStatusForwardOnly() {
        GenerationJob job = claimedJob("w1");

        assertThat(JobStateMachine.applyProgress(job, "w1", 150, "rendering", JobStatus.UPLOADING, T0)).isTrue();
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getStatus()).isEqualTo(JobStatus.UPLOADING);

        // backwards request keeps the status but records the progress
        assertThat(JobStateMachine.applyProgress(job, "w1", -5, "again", JobStatus.GENERATING, T0)).isTrue();
        assertThat(job.getProgress()).isZero();
        assertThat(job.getStatus()).isEqualTo(JobStatus.UPLOADING);

        // terminal status cannot be requested through progress
        assertThat(JobStateMachine.applyProgress(job, "w1", 50, "done?", JobStatus.COMPLETE, T0)).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.UPLOADING);
    }

    @Test
    void applyProgress_IgnoresOtherWorkerAndInactiveJobs() {
        GenerationJob job = claimedJob("w1");
        assertThat(JobStateMachine.applyProgress(job, "w2", 40, "late", null, T0)).isFalse();
        assertThat(job.getProgress()).isZero();

        GenerationJob queued = queuedJob("job-2", 10, T0);
        assertThat(JobStateMachine.applyProgress(queued, null, 40, "x", null, T0)).isFalse();
    }

    @Test
    void applyComplete_DuplicateAcceptedConflictingRejected() {
        GenerationJob job = claimedJob("w1");
        JobOutput output = JobOutput.builder().outputRef("out/1").qualityScore(9.0).build();

        assertThat(JobStateMachine.applyComplete(job, "w1", output, T0))
                .isEqualTo(JobStateMachine.CompletionOutcome.APPLIED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETE);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getMessage()).isEqualTo(JobStateMachine.MESSAGE_COMPLETE);

        assertThat(JobStateMachine.applyComplete(job, "w1", output, T0))
                .isEqualTo(JobStateMachine.CompletionOutcome.DUPLICATE);
        assertThat(JobStateMachine.applyComplete(job, "w1", JobOutput.of("out/2"), T0))
                .isEqualTo(JobStateMachine.CompletionOutcome.REJECTED);
        assertThat(job.getOutputRef()).isEqualTo("out/1");
    }

    @Test
    void applyFail_RequeuesUntilAttemptsExhausted() {
        GenerationJob job = claimedJob("w1");
        job.setMaxAttempts(2);

        Optional<JobStatus> first = JobStateMachine.applyFail(job, "w1", "oom", T0);
        assertThat(first).contains(JobStatus.QUEUED);
        assertThat(job.getAttempt()).isEqualTo(1);
        assertThat(job.getClaimedBy()).isNull();
        assertThat(job.getLastError()).isEqualTo("retry 1/2: oom");
        assertThat(job.getMessage()).isEqualTo("Retry 1/2: oom");

        JobStateMachine.applyClaim(job, "w2", "gpu", T0);
        Optional<JobStatus> second = JobStateMachine.applyFail(job, "w2", "oom again", T0);
        assertThat(second).contains(JobStatus.DEAD);
        assertThat(job.getAttempt()).isEqualTo(2);
        assertThat(job.getLastError()).isEqualTo("oom again");
        assertThat(job.getMessage()).isEqualTo("Failed after 2 attempts: oom again");

        assertThat(JobStateMachine.applyFail(job, "w2", "x", T0)).isEmpty();
        assertThat(job.getAttempt()).isEqualTo(2);
    }

    @Test
    void staleRequeue_KeepsAttempt() {
        GenerationJob job = claimedJob("w1");
        Instant cutoff = T0.plus(Duration.ofMinutes(1));

        assertThat(JobStateMachine.isStale(job, T0)).isFalse();
        assertThat(JobStateMachine.isStale(job, cutoff)).isTrue();
        assertThat(JobStateMachine.applyRequeue(job, cutoff)).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getAttempt()).isZero();
        assertThat(job.getClaimedBy()).isNull();
        assertThat(job.getMessage()).isEqualTo(JobStateMachine.MESSAGE_REQUEUED);
        assertThat(JobStateMachine.isStale(job, cutoff)).isFalse();
    }
}
