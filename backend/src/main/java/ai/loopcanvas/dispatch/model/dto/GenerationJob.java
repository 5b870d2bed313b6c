package ai.loopcanvas.dispatch.model.dto;

import ai.loopcanvas.dispatch.model.JobStatus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A generation job as seen by every queue backend and worker.
 * Serialized with snake_case keys, both on the wire and in the local store document.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerationJob {

    public static final String MODE_FULL = "full";
    public static final int DEFAULT_PRIORITY = 10;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * Unique job identifier (UUID)
     */
    private String jobId;

    private JobStatus status;

    private Instant createdAt;

    /**
     * Bumped on every mutation
     */
    private Instant updatedAt;

    /**
     * Source media pointer and generation parameters, never interpreted by the queue
     */
    @Builder.Default
    private Map<String, Object> inputRef = new LinkedHashMap<>();

    @Builder.Default
    private String generationMode = MODE_FULL;

    /**
     * Lower value is served first
     */
    @Builder.Default
    private int priority = DEFAULT_PRIORITY;

    private String claimedBy;

    private Instant claimedAt;

    private String workerType;

    @Builder.Default
    private int progress = 0;

    @Builder.Default
    private String message = "";

    private String outputRef;

    private String outputDir;

    private Double qualityScore;

    private Double loopScore;

    @Builder.Default
    private int attempt = 0;

    @Builder.Default
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private String lastError;

    /**
     * Deep enough copy for store-internal mutation; the input reference map is copied shallowly.
     */
    public GenerationJob copy() {
        return toBuilder()
                .inputRef(inputRef != null ? new LinkedHashMap<>(inputRef) : null)
                .build();
    }
}
