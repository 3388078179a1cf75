package colorbatch.processors;

import colorbatch.utils.*;

import java.nio.file.*;

/**
 * Picks the default output path for an input file: {@code <stem>-colorized<ext>} in the
 * output directory (or next to the input), numbered {@code -1, -2, ...} until the name is free.
 * Only probes the file system, never creates anything.
 */
public final class OutputPathResolver {
    public static final String COLORIZED_SUFFIX = "-colorized";

    private OutputPathResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Path resolve(Path inputPath, Path outputDirOverride) {
        Path baseDir = outputDirOverride != null ? outputDirOverride : inputPath.getParent();
        String stem = FileNameUtils.stem(inputPath) + COLORIZED_SUFFIX;
        String ext = FileNameUtils.extension(inputPath);

        Path candidate = inDirectory(baseDir, stem + ext);
        for (int counter = 1; Files.exists(candidate); counter++) {
            candidate = inDirectory(baseDir, stem + "-" + counter + ext);
        }
        return candidate;
    }

    // A null directory means the current working directory.
    private static Path inDirectory(Path dir, String fileName) {
        return dir == null ? Path.of(fileName) : dir.resolve(fileName);
    }
}
