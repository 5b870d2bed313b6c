package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Transition rules shared by every {@link JobStore} backend.
 * Each method mutates the given record in place and reports whether anything changed,
 * so a backend only has to take care of atomicity and persistence.
 */
@Slf4j
public final class JobStateMachine {

    public static final String MESSAGE_COMPLETE = "Generation complete";
    public static final String MESSAGE_REQUEUED = "requeued: claim timed out";

    /**
     * Claim order: lowest priority value first, then oldest, then job id
     */
    public static final Comparator<GenerationJob> CLAIM_ORDER = Comparator
            .comparingInt(GenerationJob::getPriority)
            .thenComparing(GenerationJob::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GenerationJob::getJobId, Comparator.nullsLast(Comparator.naturalOrder()));

    private JobStateMachine() {
    }

    /**
     * Outcome of a completion report
     */
    public enum CompletionOutcome {
        APPLIED,
        DUPLICATE,
        REJECTED;

        public boolean isAccepted() {
            return this != REJECTED;
        }
    }

    /**
     * QUEUED → CLAIMED
     *
     * @return false if the job is no longer QUEUED
     */
    public static boolean applyClaim(GenerationJob job, String workerId, String workerType, Instant now) {
        if (job.getStatus() != JobStatus.QUEUED) {
            return false;
        }
        job.setStatus(JobStatus.CLAIMED);
        job.setClaimedBy(workerId);
        job.setClaimedAt(now);
        job.setWorkerType(workerType);
        job.setUpdatedAt(now);
        return true;
    }

    /**
     * Records advisory progress. Ignored for inactive jobs and for reports from a worker
     * that no longer holds the claim. A requested status is applied only along a forward edge.
     *
     * @return true if the record changed
     */
    public static boolean applyProgress(GenerationJob job, String workerId, int progress,
                                        String message, JobStatus requestedStatus, Instant now) {
        if (!isReportFromClaimant(job, workerId)) {
            return false;
        }
        job.setProgress(clampProgress(progress));
        job.setMessage(message != null ? message : "");
        if (requestedStatus != null && requestedStatus != job.getStatus()) {
            if (requestedStatus.isActive() && isForward(job.getStatus(), requestedStatus)) {
                job.setStatus(requestedStatus);
            } else {
                log.debug("Keeping job {} in {} - progress requested {}",
                        job.getJobId(), job.getStatus(), requestedStatus);
            }
        }
        job.setUpdatedAt(now);
        return true;
    }

    /**
     * Active → COMPLETE. A repeat with the same payload on a completed job is a duplicate,
     * anything else on an inactive job is rejected.
     */
    public static CompletionOutcome applyComplete(GenerationJob job, String workerId, JobOutput output, Instant now) {
        if (job.getStatus() == JobStatus.COMPLETE) {
            return output.matches(job) ? CompletionOutcome.DUPLICATE : CompletionOutcome.REJECTED;
        }
        if (!isReportFromClaimant(job, workerId)) {
            return CompletionOutcome.REJECTED;
        }
        job.setStatus(JobStatus.COMPLETE);
        job.setProgress(100);
        job.setMessage(MESSAGE_COMPLETE);
        job.setOutputRef(output.getOutputRef());
        job.setOutputDir(output.getOutputDir());
        job.setQualityScore(output.getQualityScore());
        job.setLoopScore(output.getLoopScore());
        job.setUpdatedAt(now);
        return CompletionOutcome.APPLIED;
    }

    /**
     * Active → QUEUED or DEAD, consuming one attempt
     *
     * @return the resulting status, empty when the report was ignored
     */
    public static Optional<JobStatus> applyFail(GenerationJob job, String workerId, String error, Instant now) {
        if (!isReportFromClaimant(job, workerId)) {
            return Optional.empty();
        }
        int attempt = job.getAttempt() + 1;
        job.setAttempt(attempt);
        job.setUpdatedAt(now);

        if (attempt >= job.getMaxAttempts()) {
            job.setStatus(JobStatus.DEAD);
            job.setLastError(error);
            job.setMessage(String.format("Failed after %d attempts: %s", attempt, error));
        } else {
            job.setStatus(JobStatus.QUEUED);
            job.setClaimedBy(null);
            job.setClaimedAt(null);
            job.setLastError(String.format("retry %d/%d: %s", attempt, job.getMaxAttempts(), error));
            job.setMessage(String.format("Retry %d/%d: %s", attempt, job.getMaxAttempts(), error));
        }
        return Optional.of(job.getStatus());
    }

    /**
     * True when an active job was claimed before the cutoff
     */
    public static boolean isStale(GenerationJob job, Instant cutoff) {
        return job.getStatus() != null
                && job.getStatus().isActive()
                && job.getClaimedAt() != null
                && job.getClaimedAt().isBefore(cutoff);
    }

    /**
     * Active → QUEUED without consuming an attempt
     */
    public static boolean applyRequeue(GenerationJob job, Instant now) {
        if (job.getStatus() == null || !job.getStatus().isActive()) {
            return false;
        }
        job.setStatus(JobStatus.QUEUED);
        job.setClaimedBy(null);
        job.setClaimedAt(null);
        job.setMessage(MESSAGE_REQUEUED);
        job.setUpdatedAt(now);
        return true;
    }

    /**
     * A null worker id is accepted for callers that predate ownership checks
     */
    static boolean isReportFromClaimant(GenerationJob job, String workerId) {
        if (job.getStatus() == null || !job.getStatus().isActive()) {
            return false;
        }
        return workerId == null || Objects.equals(workerId, job.getClaimedBy());
    }

    private static boolean isForward(JobStatus current, JobStatus requested) {
        return current.canTransitionTo(requested) && requested.ordinal() > current.ordinal();
    }

    private static int clampProgress(int progress) {
        return Math.max(0, Math.min(100, progress));
    }
}
