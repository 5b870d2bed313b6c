package ai.loopcanvas.dispatch.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

/**
 * DTO for submitting a generation job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubmitJobRequest {

    /**
     * Source media pointer and generation parameters, stored as given
     */
    @NotNull(message = "input_ref is required")
    private Map<String, Object> inputRef;

    /**
     * Lower is served first, negative values included; the configured default when absent
     */
    private Integer priority;

    @Min(value = 1, message = "max_attempts must be at least 1")
    private Integer maxAttempts;
}
