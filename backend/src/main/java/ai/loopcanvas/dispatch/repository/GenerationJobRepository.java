package ai.loopcanvas.dispatch.repository;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.entity.GenerationJobEntity;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Data access for the shared job table.
 * Claim and stale requeue are single conditional UPDATE statements; callers decide by affected-row count.
 */
@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJobEntity, String> {

    String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    /**
     * Returns ids of jobs in the given status in claim order (priority, then age).
     * Optimized with idx_generation_jobs_claim index.
     *
     * @param status usually QUEUED
     * @param pageable limits how many candidates are fetched
     * @return candidate job ids, best first
     */
    @Transactional(readOnly = true)
    @QueryHints(@QueryHint(name = QUERY_TIMEOUT_HINT, value = "5000"))
    @Query("select j.jobId from GenerationJobEntity j where j.status = :status "
            + "order by j.priority asc, j.createdAt asc, j.jobId asc")
    List<String> findClaimCandidateIds(@Param("status") JobStatus status, Pageable pageable);

    /**
     * Moves one job from QUEUED to CLAIMED if, and only if, it is still QUEUED.
     *
     * @return 1 when this caller won the job, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @QueryHints(@QueryHint(name = QUERY_TIMEOUT_HINT, value = "5000"))
    @Query("update GenerationJobEntity j set j.status = :claimed, j.claimedBy = :workerId, "
            + "j.claimedAt = :now, j.workerType = :workerType, j.updatedAt = :now, j.version = j.version + 1 "
            + "where j.jobId = :jobId and j.status = :queued")
    int claimIfQueued(@Param("jobId") String jobId,
                      @Param("workerId") String workerId,
                      @Param("workerType") String workerType,
                      @Param("now") Instant now,
                      @Param("claimed") JobStatus claimed,
                      @Param("queued") JobStatus queued);

    /**
     * Returns every active job claimed before the cutoff to QUEUED, leaving attempt untouched.
     *
     * @return number of requeued rows
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update GenerationJobEntity j set j.status = :queued, j.claimedBy = null, j.claimedAt = null, "
            + "j.message = :message, j.updatedAt = :now, j.version = j.version + 1 "
            + "where j.status in :active and j.claimedAt < :cutoff")
    int requeueClaimedBefore(@Param("cutoff") Instant cutoff,
                             @Param("now") Instant now,
                             @Param("message") String message,
                             @Param("queued") JobStatus queued,
                             @Param("active") Collection<JobStatus> active);

    /**
     * Returns active jobs claimed before the cutoff, for logging what the monitor is about to requeue.
     */
    @Transactional(readOnly = true)
    List<GenerationJobEntity> findByStatusInAndClaimedAtBefore(Collection<JobStatus> statuses, Instant cutoff);

    /**
     * Job counts grouped by status as (status, count) pairs
     */
    @Transactional(readOnly = true)
    @Query("select j.status, count(j) from GenerationJobEntity j group by j.status")
    List<Object[]> countByStatus();

    @Transactional(readOnly = true)
    @Query("select avg(j.qualityScore) from GenerationJobEntity j where j.status = :status and j.qualityScore is not null")
    Double averageQualityScore(@Param("status") JobStatus status);

    @Transactional(readOnly = true)
    @Query("select avg(j.loopScore) from GenerationJobEntity j where j.status = :status and j.loopScore is not null")
    Double averageLoopScore(@Param("status") JobStatus status);
}
