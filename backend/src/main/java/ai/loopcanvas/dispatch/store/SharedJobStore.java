package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;
import ai.loopcanvas.dispatch.model.dto.QueueStats;
import ai.loopcanvas.dispatch.model.entity.GenerationJobEntity;
import ai.loopcanvas.dispatch.repository.GenerationJobRepository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Multi-node job store on a relational database.
 *
 * Claim is a conditional UPDATE decided by affected-row count, never a read-then-write.
 * Every other mutation is an optimistic read-modify-write guarded by the version column
 * and retried a bounded number of times on conflict.
 */
@Slf4j
public class SharedJobStore implements JobStore {

    private final GenerationJobRepository repository;
    private final Clock clock;
    private final int claimCandidates;
    private final int conflictRetries;

    public SharedJobStore(GenerationJobRepository repository, Clock clock, int claimCandidates, int conflictRetries) {
        this.repository = repository;
        this.clock = clock;
        this.claimCandidates = Math.max(1, claimCandidates);
        this.conflictRetries = Math.max(0, conflictRetries);
    }

    @Override
    public String enqueue(GenerationJob job) {
        try {
            repository.saveAndFlush(GenerationJobEntity.fromJob(job));
            log.info("Enqueued job {} with priority {}", job.getJobId(), job.getPriority());
            return job.getJobId();
        } catch (DataAccessException e) {
            log.error("Failed to enqueue job {}", job.getJobId(), e);
            throw new JobStoreException("Failed to enqueue job " + job.getJobId(), e);
        }
    }

    @Override
    public Optional<GenerationJob> claim(String workerId, String workerType) {
        List<String> candidates;
        try {
            candidates = repository.findClaimCandidateIds(JobStatus.QUEUED, PageRequest.of(0, claimCandidates));
        } catch (DataAccessException e) {
            log.error("Failed to read claim candidates", e);
            throw new JobStoreException("Failed to read claim candidates", e);
        }

        for (String jobId : candidates) {
            int updated;
            try {
                updated = repository.claimIfQueued(jobId, workerId, workerType, clock.instant(),
                        JobStatus.CLAIMED, JobStatus.QUEUED);
            } catch (DataAccessException e) {
                // lock wait or statement timeout, another worker is on this row
                log.warn("Claim of job {} by {} lost to a concurrent update: {}", jobId, workerId, e.getMessage());
                continue;
            }
            if (updated == 1) {
                log.info("Job {} claimed by {} ({})", jobId, workerId, workerType);
                return readClaimed(jobId, workerId);
            }
            log.debug("Job {} was taken before {} could claim it", jobId, workerId);
        }
        return Optional.empty();
    }

    /**
     * The claim is already committed here; if the read-back fails the stale-claim monitor
     * returns the job to the queue.
     */
    private Optional<GenerationJob> readClaimed(String jobId, String workerId) {
        try {
            return repository.findById(jobId).map(GenerationJobEntity::toJob);
        } catch (DataAccessException e) {
            log.error("Job {} claimed by {} but could not be read back", jobId, workerId, e);
            throw new JobStoreException("Failed to read claimed job " + jobId, e);
        }
    }

    @Override
    public boolean updateProgress(String jobId, String workerId, int progress, String message, JobStatus status) {
        boolean applied = mutate(jobId, false,
                job -> JobStateMachine.applyProgress(job, workerId, progress, message, status, clock.instant()),
                Boolean::booleanValue);
        if (!applied) {
            log.debug("Progress for job {} from {} ignored", jobId, workerId);
        }
        return applied;
    }

    @Override
    public boolean complete(String jobId, String workerId, JobOutput output) {
        JobStateMachine.CompletionOutcome outcome = mutate(jobId, JobStateMachine.CompletionOutcome.REJECTED,
                job -> JobStateMachine.applyComplete(job, workerId, output, clock.instant()),
                result -> result == JobStateMachine.CompletionOutcome.APPLIED);
        switch (outcome) {
            case APPLIED:
                log.info("Job {} completed: {}", jobId, output.getOutputRef());
                break;
            case DUPLICATE:
                log.debug("Duplicate completion for job {} accepted", jobId);
                break;
            default:
                log.warn("Completion for job {} from {} rejected", jobId, workerId);
                break;
        }
        return outcome.isAccepted();
    }

    @Override
    public Optional<JobStatus> fail(String jobId, String workerId, String error) {
        Optional<JobStatus> result = mutate(jobId, Optional.empty(),
                job -> JobStateMachine.applyFail(job, workerId, error, clock.instant()),
                Optional::isPresent);
        if (result.isPresent()) {
            log.info("Job {} failed -> {}: {}", jobId, result.get(), error);
        } else {
            log.warn("Failure report for job {} from {} ignored", jobId, workerId);
        }
        return result;
    }

    @Override
    public int requeueStale(Instant cutoff) {
        try {
            if (log.isInfoEnabled()) {
                repository.findByStatusInAndClaimedAtBefore(JobStatus.activeStatuses(), cutoff)
                        .forEach(entity -> log.info("Requeueing stale job {} claimed by {}",
                                entity.getJobId(), entity.getClaimedBy()));
            }
            return repository.requeueClaimedBefore(cutoff, clock.instant(), JobStateMachine.MESSAGE_REQUEUED,
                    JobStatus.QUEUED, JobStatus.activeStatuses());
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to requeue stale jobs", e);
        }
    }

    @Override
    public Optional<GenerationJob> get(String jobId) {
        try {
            return repository.findById(jobId).map(GenerationJobEntity::toJob);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to read job " + jobId, e);
        }
    }

    @Override
    public QueueStats stats() {
        try {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            long total = 0;
            for (Object[] row : repository.countByStatus()) {
                long count = ((Number) row[1]).longValue();
                counts.put((JobStatus) row[0], count);
                total += count;
            }
            return QueueStats.builder()
                    .backend(backendName())
                    .total(total)
                    .byStatus(counts)
                    .averageQualityScore(repository.averageQualityScore(JobStatus.COMPLETE))
                    .averageLoopScore(repository.averageLoopScore(JobStatus.COMPLETE))
                    .build();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to read queue statistics", e);
        }
    }

    @Override
    public String backendName() {
        return "shared";
    }

    /**
     * Optimistic read-modify-write. The mutation runs on a fresh copy each attempt, so a retry
     * after a conflict re-evaluates the transition against the winning writer's state.
     */
    private <T> T mutate(String jobId, T whenMissing, Function<GenerationJob, T> mutation, Predicate<T> shouldWrite) {
        for (int attempt = 0; ; attempt++) {
            try {
                Optional<GenerationJobEntity> found = repository.findById(jobId);
                if (found.isEmpty()) {
                    log.warn("Update for unknown job {} ignored", jobId);
                    return whenMissing;
                }
                GenerationJobEntity entity = found.get();
                GenerationJob job = entity.toJob();
                T result = mutation.apply(job);
                if (!shouldWrite.test(result)) {
                    return result;
                }
                entity.applyFrom(job);
                repository.saveAndFlush(entity);
                return result;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= conflictRetries) {
                    throw new JobStoreException("Job " + jobId + " kept changing concurrently", e);
                }
                log.debug("Version conflict on job {}, retrying ({}/{})", jobId, attempt + 1, conflictRetries);
            } catch (DataAccessException e) {
                log.error("Failed to update job {}", jobId, e);
                throw new JobStoreException("Failed to update job " + jobId, e);
            }
        }
    }
}
