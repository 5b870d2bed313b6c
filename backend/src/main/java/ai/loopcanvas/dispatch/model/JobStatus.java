package ai.loopcanvas.dispatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Generation job lifecycle states
 *
 * State transitions:
 * QUEUED → CLAIMED → GENERATING → UPLOADING → COMPLETE
 * CLAIMED/GENERATING/UPLOADING → QUEUED (fail with attempts left, or claim timed out)
 * CLAIMED/GENERATING/UPLOADING → DEAD (fail with attempts exhausted)
 */
public enum JobStatus {

    /**
     * Waiting for a worker to claim it
     */
    QUEUED("queued"),

    /**
     * Owned by a worker, generation not yet reported
     */
    CLAIMED("claimed"),

    /**
     * Worker reported generation progress
     */
    GENERATING("generating"),

    /**
     * Worker is publishing the output
     */
    UPLOADING("uploading"),

    /**
     * Output stored, terminal
     */
    COMPLETE("complete"),

    /**
     * Transient failure marker. fail() resolves straight to QUEUED or DEAD,
     * so the queue never leaves a record here; kept for the persisted vocabulary.
     */
    FAILED("failed"),

    /**
     * Retry attempts exhausted, terminal
     */
    DEAD("dead");

    private static final Set<JobStatus> ACTIVE = EnumSet.of(CLAIMED, GENERATING, UPLOADING);

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == DEAD;
    }

    /**
     * Check if a worker currently holds the job
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public static Set<JobStatus> activeStatuses() {
        return EnumSet.copyOf(ACTIVE);
    }

    /**
     * Check whether the state machine has an edge from this status to the target.
     * Self-transitions of active states are allowed so repeated progress reports stay valid.
     */
    public boolean canTransitionTo(JobStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case QUEUED:
                return target == CLAIMED;
            case CLAIMED:
                return target == CLAIMED || target == GENERATING
                        || target == QUEUED || target == DEAD || target == COMPLETE;
            case GENERATING:
                return target == GENERATING || target == UPLOADING
                        || target == QUEUED || target == DEAD || target == COMPLETE;
            case UPLOADING:
                return target == UPLOADING
                        || target == QUEUED || target == DEAD || target == COMPLETE;
            default:
                return false;
        }
    }
}
