package ai.loopcanvas.dispatch.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.NotBlank;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FailRequest {

    @NotBlank(message = "job_id is required")
    private String jobId;

    /**
     * Must be the current claimant; reports from a worker whose claim was requeued are ignored
     */
    @NotBlank(message = "worker_id is required")
    private String workerId;

    private String error;
}
