package ai.loopcanvas.dispatch.model.entity;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the shared job table. The version column guards every non-claim update.
 */
@Entity
@Table(name = "generation_jobs", indexes = {
        @Index(name = "idx_generation_jobs_claim", columnList = "status, priority, created_at"),
        @Index(name = "idx_generation_jobs_claimed_at", columnList = "status, claimed_at")
})
public class GenerationJobEntity {

    @Id
    @Column(name = "job_id", length = 64, nullable = false, updatable = false)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private JobStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "input_ref", length = 10000)
    private Map<String, Object> inputRef = new LinkedHashMap<>();

    @Column(name = "generation_mode", length = 32, nullable = false)
    private String generationMode;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "worker_type", length = 64)
    private String workerType;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Column(name = "message", length = 2000)
    private String message;

    @Column(name = "output_ref", length = 1024)
    private String outputRef;

    @Column(name = "output_dir", length = 1024)
    private String outputDir;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "loop_score")
    private Double loopScore;

    @Column(name = "attempt", nullable = false)
    private int attempt;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Version
    @Column(name = "version")
    private Long version;

    public static GenerationJobEntity fromJob(GenerationJob job) {
        GenerationJobEntity entity = new GenerationJobEntity();
        entity.jobId = job.getJobId();
        entity.createdAt = job.getCreatedAt();
        entity.applyFrom(job);
        return entity;
    }

    /**
     * Copies every mutable field from the record, leaving identity and version alone
     */
    public void applyFrom(GenerationJob job) {
        this.status = job.getStatus();
        this.updatedAt = job.getUpdatedAt();
        this.inputRef = job.getInputRef() != null ? new LinkedHashMap<>(job.getInputRef()) : new LinkedHashMap<>();
        this.generationMode = job.getGenerationMode();
        this.priority = job.getPriority();
        this.claimedBy = job.getClaimedBy();
        this.claimedAt = job.getClaimedAt();
        this.workerType = job.getWorkerType();
        this.progress = job.getProgress();
        this.message = job.getMessage();
        this.outputRef = job.getOutputRef();
        this.outputDir = job.getOutputDir();
        this.qualityScore = job.getQualityScore();
        this.loopScore = job.getLoopScore();
        this.attempt = job.getAttempt();
        this.maxAttempts = job.getMaxAttempts();
        this.lastError = job.getLastError();
    }

    public GenerationJob toJob() {
        return GenerationJob.builder()
                .jobId(jobId)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .inputRef(inputRef != null ? new LinkedHashMap<>(inputRef) : new LinkedHashMap<>())
                .generationMode(generationMode)
                .priority(priority)
                .claimedBy(claimedBy)
                .claimedAt(claimedAt)
                .workerType(workerType)
                .progress(progress)
                .message(message != null ? message : "")
                .outputRef(outputRef)
                .outputDir(outputDir)
                .qualityScore(qualityScore)
                .loopScore(loopScore)
                .attempt(attempt)
                .maxAttempts(maxAttempts)
                .lastError(lastError)
                .build();
    }

    // Getters and setters

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Map<String, Object> getInputRef() { return inputRef; }
    public void setInputRef(Map<String, Object> inputRef) { this.inputRef = inputRef; }

    public String getGenerationMode() { return generationMode; }
    public void setGenerationMode(String generationMode) { this.generationMode = generationMode; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public String getClaimedBy() { return claimedBy; }
    public void setClaimedBy(String claimedBy) { this.claimedBy = claimedBy; }

    public Instant getClaimedAt() { return claimedAt; }
    public void setClaimedAt(Instant claimedAt) { this.claimedAt = claimedAt; }

    public String getWorkerType() { return workerType; }
    public void setWorkerType(String workerType) { this.workerType = workerType; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getOutputRef() { return outputRef; }
    public void setOutputRef(String outputRef) { this.outputRef = outputRef; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public Double getQualityScore() { return qualityScore; }
    public void setQualityScore(Double qualityScore) { this.qualityScore = qualityScore; }

    public Double getLoopScore() { return loopScore; }
    public void setLoopScore(Double loopScore) { this.loopScore = loopScore; }

    public int getAttempt() { return attempt; }
    public void setAttempt(int attempt) { this.attempt = attempt; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
