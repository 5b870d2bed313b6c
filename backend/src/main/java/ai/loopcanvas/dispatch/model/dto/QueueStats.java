package ai.loopcanvas.dispatch.model.dto;

import ai.loopcanvas.dispatch.model.JobStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job counts by status plus score averages over completed jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    private String backend;

    private long total;

    @Builder.Default
    private Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);

    private Double averageQualityScore;

    private Double averageLoopScore;

    public long count(JobStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }

    /**
     * Counts for every status, zero-filled, keyed by the wire value
     */
    public Map<String, Long> asValueMap() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("total", total);
        for (JobStatus status : JobStatus.values()) {
            values.put(status.getValue(), count(status));
        }
        return values;
    }
}
