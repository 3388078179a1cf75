package colorbatch.models;

import java.nio.file.*;
import java.util.*;

// One input file, plus the output path the user named explicitly (single-file mode only).
public record Job(
        Path inputPath,
        Path explicitOutputPath
) {
    public Job {
        Objects.requireNonNull(inputPath, "inputPath");
    }

    public static Job of(Path inputPath) {
        return new Job(inputPath, null);
    }

    public Optional<Path> explicitOutput() {
        return Optional.ofNullable(explicitOutputPath);
    }
}
