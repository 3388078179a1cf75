package colorbatch.processors;

import colorbatch.models.*;
import org.slf4j.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;

/**
 * Out-of-band status text for external pollers.
 * <p>
 * Every write replaces the whole file with one status string. Writes and deletes are attempted
 * once and any failure is ignored (logged at debug): a broken status file must never fail or
 * stall a colorization.
 */
public class StatusFile {
    private static final Logger log = LoggerFactory.getLogger(StatusFile.class);

    public static final String LOADING    = "loading";
    public static final String PROCESSING = "processing";
    public static final String SAVING     = "saving";
    public static final String COMPLETE   = "complete";

    private static final String TEMP_SUFFIX = ".tmp";
    private static final StatusFile DISABLED = new StatusFile(null);

    private final Path path;

    private StatusFile(Path path) {
        this.path = path;
    }

    public static StatusFile at(Path path) {
        return path == null ? DISABLED : new StatusFile(path);
    }

    public static StatusFile of(Options options) {
        return options.statusFile().map(StatusFile::at).orElse(DISABLED);
    }

    public boolean isEnabled() {
        return path != null;
    }

    public void write(String status) {
        if (!isEnabled()) return;
        Path temp = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            Files.writeString(temp, status, StandardCharsets.UTF_8);
            moveIntoPlace(temp);
        } catch (IOException | SecurityException e) {
            log.debug("Ignoring status file write failure ({}): {}", path, e.toString());
            deleteQuietly(temp);
        }
    }

    public void progress(int percent) {
        write(PROCESSING + ":" + percent);
    }

    public void delete() {
        if (!isEnabled()) return;
        deleteQuietly(path);
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException | SecurityException e) {
            log.debug("Ignoring status file delete failure ({}): {}", file, e.toString());
        }
    }
}
