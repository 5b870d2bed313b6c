package ai.loopcanvas.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import java.time.Duration;

/**
 * Queue settings bound from {@code app.queue.*}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.queue")
public class QueueProperties {

    public enum Backend {
        /** Shared store when a datasource URL is configured, local store otherwise */
        AUTO,
        LOCAL,
        SHARED
    }

    private Backend backend = Backend.AUTO;

    private Local local = new Local();

    private Shared shared = new Shared();

    private Monitor monitor = new Monitor();

    @Min(0)
    private int defaultPriority = 10;

    @Min(1)
    private int defaultMaxAttempts = 3;

    @Data
    public static class Local {
        /** Directory holding jobs.json */
        private String dataDir = "./data/queue";
    }

    @Data
    public static class Shared {
        /** How many QUEUED rows a claim tries before giving up on this poll */
        @Min(1)
        private int claimCandidates = 5;

        /** Retries of an optimistic update that hit a version conflict */
        @Min(0)
        private int conflictRetries = 3;
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;

        private Duration interval = Duration.ofSeconds(30);

        /** Claims older than this are considered abandoned */
        private Duration staleThreshold = Duration.ofMinutes(30);
    }
}
