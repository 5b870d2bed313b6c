package ai.loopcanvas.dispatch.model.dto;

import ai.loopcanvas.dispatch.model.JobStatus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProgressRequest {

    @NotBlank(message = "job_id is required")
    private String jobId;

    private String workerId;

    @Min(0)
    @Max(100)
    private int progress;

    private String message;

    /**
     * Optional forward status (generating, uploading)
     */
    private JobStatus status;
}
