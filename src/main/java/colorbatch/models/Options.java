package colorbatch.models;

import java.nio.file.*;
import java.util.*;

// Run-wide settings. JSON output always implies quiet.
public record Options(
        boolean quiet,
        boolean jsonOutput,
        Path statusFilePath,
        Path outputDir
) {
    public Options {
        quiet = quiet || jsonOutput;
    }

    public static Options defaults() {
        return new Options(false, false, null, null);
    }

    public Optional<Path> statusFile() {
        return Optional.ofNullable(statusFilePath);
    }

    public Optional<Path> outputDirectory() {
        return Optional.ofNullable(outputDir);
    }
}
