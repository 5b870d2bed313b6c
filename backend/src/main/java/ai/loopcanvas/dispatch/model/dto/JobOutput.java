package ai.loopcanvas.dispatch.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Outcome of a successful generation: where the output lives plus the externally computed scores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOutput {

    private String outputRef;

    private String outputDir;

    private Double qualityScore;

    private Double loopScore;

    public static JobOutput of(String outputRef) {
        return JobOutput.builder().outputRef(outputRef).build();
    }

    /**
     * True when the job already carries exactly this output
     */
    public boolean matches(GenerationJob job) {
        return Objects.equals(outputRef, job.getOutputRef())
                && Objects.equals(outputDir, job.getOutputDir())
                && Objects.equals(qualityScore, job.getQualityScore())
                && Objects.equals(loopScore, job.getLoopScore());
    }
}
