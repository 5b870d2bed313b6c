package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.dto.JobOutput;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a successful pipeline run produced
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    private String outputRef;

    private String outputDir;

    private Double qualityScore;

    private Double loopScore;

    public JobOutput toOutput() {
        return JobOutput.builder()
                .outputRef(outputRef)
                .outputDir(outputDir)
                .qualityScore(qualityScore)
                .loopScore(loopScore)
                .build();
    }
}
