package colorbatch.reporters;

import com.fasterxml.jackson.annotation.*;

// Replaces the batch report when the run cannot start at all.
public record SetupErrorReport(@JsonProperty("error") String error) {
}
