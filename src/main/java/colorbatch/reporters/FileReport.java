package colorbatch.reporters;

import colorbatch.models.*;
import colorbatch.utils.*;
import com.fasterxml.jackson.annotation.*;

/**
 * JSON view of one file's result. Optional fields are left out when unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"input", "output", "success", "width", "height", "processing_time_seconds", "error"})
public record FileReport(
        @JsonProperty("input") String input,
        @JsonProperty("output") String output,
        @JsonProperty("success") boolean success,
        @JsonProperty("width") Integer width,
        @JsonProperty("height") Integer height,
        @JsonProperty("processing_time_seconds") Double processingTimeSeconds,
        @JsonProperty("error") String error
) {
    public static FileReport from(ProcessResult result) {
        return new FileReport(
                result.inputPath().toString(),
                result.outputPath() != null ? result.outputPath().toString() : "",
                result.success(),
                result.width(),
                result.height(),
                TimeUtils.roundMillis(result.elapsedSeconds()),
                result.failure().map(ProcessError::message).orElse(null)
        );
    }
}
