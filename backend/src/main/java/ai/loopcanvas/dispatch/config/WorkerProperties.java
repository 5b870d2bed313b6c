package ai.loopcanvas.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker settings bound from {@code app.worker.*}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.worker")
public class WorkerProperties {

    /** Run a generation worker inside this process */
    private boolean enabled = false;

    /** Worker id, generated from host name when blank */
    private String id = "";

    private String type = "local";

    private Duration pollInterval = Duration.ofSeconds(15);

    /** Stop after this long without work, zero keeps polling forever */
    private Duration maxIdle = Duration.ZERO;

    /** Queue API base URL; the worker talks to the in-process store when blank */
    private String serverUrl = "";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    private Retry retry = new Retry();

    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Retry {
        /** Retries of claim/complete/fail calls before giving up for this cycle */
        @Min(0)
        private int maxRetries = 3;

        private Duration initialDelay = Duration.ofSeconds(1);

        private Duration maxDelay = Duration.ofSeconds(30);

        /** Random spread applied to each delay, as a fraction of it */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.2;
    }

    @Data
    public static class Pipeline {
        /** Generation command; job id, input reference file and output directory are appended */
        private List<String> command = new ArrayList<>();

        private String outputRoot = "./data/output";

        private Duration timeout = Duration.ofHours(2);
    }
}
