package colorbatch.reporters;

import colorbatch.models.*;
import colorbatch.utils.*;
import com.fasterxml.jackson.annotation.*;

import java.util.*;
import java.util.stream.*;

/**
 * JSON document written to stdout in {@code --json} mode.
 * Field names are part of the tool's scripting contract.
 */
@JsonPropertyOrder({"success", "total", "successful", "failed", "processing_time_seconds", "results"})
public record BatchReport(
        @JsonProperty("success") boolean success,
        @JsonProperty("total") int total,
        @JsonProperty("successful") int successful,
        @JsonProperty("failed") int failed,
        @JsonProperty("processing_time_seconds") double processingTimeSeconds,
        @JsonProperty("results") List<FileReport> results
) {
    public static BatchReport from(BatchSummary summary) {
        return new BatchReport(
                summary.success(),
                summary.total(),
                summary.successful(),
                summary.failed(),
                TimeUtils.roundMillis(summary.totalSeconds()),
                summary.results().stream().map(FileReport::from).collect(Collectors.toList())
        );
    }
}
