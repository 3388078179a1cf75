package colorbatch.models;

import java.nio.file.*;
import java.util.*;

/**
 * Outcome of processing a single input file.
 * <p>
 * Instances are immutable. The pipeline fills a {@link Draft} while it runs and freezes it
 * with {@link Draft#finish(double)} once the file is done; a draft is never reused.
 */
public record ProcessResult(
        Path inputPath,
        Path outputPath,
        boolean success,
        ProcessError error,
        Integer width,
        Integer height,
        double elapsedSeconds
) {
    public Optional<ProcessError> failure() {
        return Optional.ofNullable(error);
    }

    public static Draft start(Path inputPath, Path outputPath) {
        return new Draft(inputPath, outputPath);
    }

    public static final class Draft {
        private final Path inputPath;
        private final Path outputPath;
        private ProcessError error;
        private Integer width;
        private Integer height;
        private boolean completed;

        private Draft(Path inputPath, Path outputPath) {
            this.inputPath = Objects.requireNonNull(inputPath, "inputPath");
            this.outputPath = outputPath;
        }

        public Draft dimensions(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Draft fail(ProcessError error) {
            this.error = Objects.requireNonNull(error, "error");
            return this;
        }

        public Draft completed() {
            this.completed = true;
            return this;
        }

        public ProcessResult finish(double elapsedSeconds) {
            boolean success = completed && error == null;
            return new ProcessResult(inputPath, outputPath, success, error, width, height, elapsedSeconds);
        }
    }
}
