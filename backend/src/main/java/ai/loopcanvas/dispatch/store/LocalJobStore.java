package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;
import ai.loopcanvas.dispatch.model.dto.QueueStats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Single-node job store backed by one JSON document mapping job id to record.
 *
 * Every operation holds an in-process lock for its full read-modify-write cycle and writes
 * through a temp file that is atomically moved over the document. The lock is not shared
 * between processes, so only one server instance may use a given data directory.
 */
@Slf4j
public class LocalJobStore implements JobStore {

    public static final String DOCUMENT_NAME = "jobs.json";

    private final Path documentPath;
    private final Path tempPath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public LocalJobStore(Path dataDir, Clock clock) {
        this(dataDir, documentMapper(), clock);
    }

    public LocalJobStore(Path dataDir, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.documentPath = dataDir.resolve(DOCUMENT_NAME);
        this.tempPath = dataDir.resolve(DOCUMENT_NAME + ".tmp");
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new JobStoreException("Local job store directory is not usable: " + dataDir, e);
        }
        if (!Files.isWritable(dataDir)) {
            throw new JobStoreException("Local job store directory is not writable: " + dataDir);
        }
        log.info("Local job store using {}", documentPath);
    }

    /**
     * Mapper for the on-disk document: ISO-8601 timestamps, snake_case keys from the record type
     */
    public static ObjectMapper documentMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public String enqueue(GenerationJob job) {
        return withDocument(document -> {
            document.jobs.put(job.getJobId(), job.copy());
            document.dirty = true;
            log.info("Enqueued job {} with priority {}", job.getJobId(), job.getPriority());
            return job.getJobId();
        });
    }

    @Override
    public Optional<GenerationJob> claim(String workerId, String workerType) {
        return withDocument(document -> {
            Optional<GenerationJob> candidate = document.jobs.values().stream()
                    .filter(job -> job.getStatus() == JobStatus.QUEUED)
                    .min(JobStateMachine.CLAIM_ORDER);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            GenerationJob job = candidate.get();
            JobStateMachine.applyClaim(job, workerId, workerType, clock.instant());
            document.dirty = true;
            log.info("Job {} claimed by {} ({})", job.getJobId(), workerId, workerType);
            return Optional.of(job.copy());
        });
    }

    @Override
    public boolean updateProgress(String jobId, String workerId, int progress, String message, JobStatus status) {
        return withDocument(document -> {
            GenerationJob job = document.jobs.get(jobId);
            if (job == null) {
                log.debug("Progress for unknown job {} ignored", jobId);
                return false;
            }
            boolean applied = JobStateMachine.applyProgress(job, workerId, progress, message, status, clock.instant());
            if (applied) {
                document.dirty = true;
            } else {
                log.debug("Progress for job {} from {} ignored in status {}", jobId, workerId, job.getStatus());
            }
            return applied;
        });
    }

    @Override
    public boolean complete(String jobId, String workerId, JobOutput output) {
        return withDocument(document -> {
            GenerationJob job = document.jobs.get(jobId);
            if (job == null) {
                log.warn("Completion for unknown job {} ignored", jobId);
                return false;
            }
            JobStateMachine.CompletionOutcome outcome =
                    JobStateMachine.applyComplete(job, workerId, output, clock.instant());
            switch (outcome) {
                case APPLIED:
                    document.dirty = true;
                    log.info("Job {} completed: {}", jobId, output.getOutputRef());
                    break;
                case DUPLICATE:
                    log.debug("Duplicate completion for job {} accepted", jobId);
                    break;
                default:
                    log.warn("Completion for job {} from {} rejected in status {}", jobId, workerId, job.getStatus());
                    break;
            }
            return outcome.isAccepted();
        });
    }

    @Override
    public Optional<JobStatus> fail(String jobId, String workerId, String error) {
        return withDocument(document -> {
            GenerationJob job = document.jobs.get(jobId);
            if (job == null) {
                log.warn("Failure report for unknown job {} ignored", jobId);
                return Optional.empty();
            }
            Optional<JobStatus> result = JobStateMachine.applyFail(job, workerId, error, clock.instant());
            if (result.isPresent()) {
                document.dirty = true;
                log.info("Job {} failed (attempt {}/{}) -> {}: {}",
                        jobId, job.getAttempt(), job.getMaxAttempts(), result.get(), error);
            } else {
                log.warn("Failure report for job {} from {} ignored in status {}", jobId, workerId, job.getStatus());
            }
            return result;
        });
    }

    @Override
    public int requeueStale(Instant cutoff) {
        return withDocument(document -> {
            Instant now = clock.instant();
            int requeued = 0;
            for (GenerationJob job : document.jobs.values()) {
                if (JobStateMachine.isStale(job, cutoff)) {
                    String previousClaimant = job.getClaimedBy();
                    JobStateMachine.applyRequeue(job, now);
                    log.info("Requeued stale job {} claimed by {}", job.getJobId(), previousClaimant);
                    requeued++;
                }
            }
            document.dirty = requeued > 0;
            return requeued;
        });
    }

    @Override
    public Optional<GenerationJob> get(String jobId) {
        return withDocument(document -> Optional.ofNullable(document.jobs.get(jobId)).map(GenerationJob::copy));
    }

    @Override
    public QueueStats stats() {
        return withDocument(document -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            double qualitySum = 0;
            int qualityCount = 0;
            double loopSum = 0;
            int loopCount = 0;
            for (GenerationJob job : document.jobs.values()) {
                counts.merge(job.getStatus(), 1L, Long::sum);
                if (job.getStatus() == JobStatus.COMPLETE) {
                    if (job.getQualityScore() != null) {
                        qualitySum += job.getQualityScore();
                        qualityCount++;
                    }
                    if (job.getLoopScore() != null) {
                        loopSum += job.getLoopScore();
                        loopCount++;
                    }
                }
            }
            return QueueStats.builder()
                    .backend(backendName())
                    .total(document.jobs.size())
                    .byStatus(counts)
                    .averageQualityScore(qualityCount > 0 ? qualitySum / qualityCount : null)
                    .averageLoopScore(loopCount > 0 ? loopSum / loopCount : null)
                    .build();
        });
    }

    @Override
    public String backendName() {
        return "local";
    }

    Path getDocumentPath() {
        return documentPath;
    }

    private <T> T withDocument(Function<JobDocument, T> operation) {
        lock.lock();
        try {
            JobDocument document = load();
            T result = operation.apply(document);
            if (document.dirty) {
                save(document);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private JobDocument load() {
        JobDocument document = new JobDocument();
        if (!Files.exists(documentPath)) {
            return document;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(documentPath, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            backUpCorruptDocument(e);
            return document;
        } catch (IOException e) {
            throw new JobStoreException("Failed to read job document " + documentPath, e);
        }
        if (root == null || root.isMissingNode()) {
            return document;
        }
        if (!root.isObject()) {
            backUpCorruptDocument(new IllegalStateException("document root is not an object"));
            return document;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            try {
                GenerationJob job = objectMapper.treeToValue(entry.getValue(), GenerationJob.class);
                if (job == null || job.getStatus() == null || !entry.getKey().equals(job.getJobId())) {
                    throw new IllegalStateException("missing status or mismatched job_id");
                }
                document.jobs.put(entry.getKey(), job);
            } catch (JsonProcessingException | IllegalArgumentException | IllegalStateException e) {
                log.warn("Skipping malformed job record {}: {}", entry.getKey(), e.getMessage());
                document.unparsed.put(entry.getKey(), entry.getValue());
            }
        }
        return document;
    }

    private void save(JobDocument document) {
        ObjectNode root = objectMapper.createObjectNode();
        document.jobs.forEach((id, job) -> root.set(id, objectMapper.valueToTree(job)));
        // unreadable records are carried over untouched
        document.unparsed.forEach(root::set);
        try {
            Files.writeString(tempPath, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root),
                    StandardCharsets.UTF_8);
            Files.move(tempPath, documentPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to write job document {}", documentPath, e);
            throw new JobStoreException("Failed to write job document " + documentPath, e);
        }
    }

    private void backUpCorruptDocument(Exception cause) {
        Path backup = documentPath.resolveSibling(DOCUMENT_NAME + ".corrupt-" + clock.millis());
        log.error("Job document {} is unreadable, moving it to {} and starting empty", documentPath, backup, cause);
        try {
            Files.move(documentPath, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new JobStoreException("Failed to back up corrupt job document " + documentPath, e);
        }
    }

    private static final class JobDocument {
        private final Map<String, GenerationJob> jobs = new LinkedHashMap<>();
        private final Map<String, JsonNode> unparsed = new LinkedHashMap<>();
        private boolean dirty;
    }
}
