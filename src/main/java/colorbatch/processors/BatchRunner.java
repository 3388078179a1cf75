package colorbatch.processors;

import colorbatch.models.*;
import colorbatch.utils.*;
import org.slf4j.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Processes jobs one after another, in order, collecting one result per job.
 * <p>
 * Files are never processed in parallel. Between files of a multi-file batch a memory
 * checkpoint runs so the previous file's pixels are reclaimed before the next one is decoded.
 */
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    public static final Runnable GC_CHECKPOINT = System::gc;

    private static final String STARTUP_FORMAT = "Processing %d files...%n";
    private static final String FILE_FORMAT    = "%n[%d/%d] %s%n";
    private static final String QUIET_FAILURE  = "ERROR: %s: %s%n";

    private final FileProcessor processor;
    private final Runnable memoryCheckpoint;
    private final PrintStream out;
    private final PrintStream err;

    public BatchRunner(FileProcessor processor, PrintStream out, PrintStream err) {
        this(processor, GC_CHECKPOINT, out, err);
    }

    public BatchRunner(FileProcessor processor, Runnable memoryCheckpoint, PrintStream out, PrintStream err) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.memoryCheckpoint = Objects.requireNonNull(memoryCheckpoint, "memoryCheckpoint");
        this.out = out;
        this.err = err;
    }

    public BatchSummary run(List<Job> jobs, Options options) {
        long start = System.nanoTime();
        int total = jobs.size();
        boolean multiFile = total > 1;
        List<ProcessResult> results = new ArrayList<>(total);

        if (!options.quiet() && multiFile) {
            out.printf(STARTUP_FORMAT, total);
        }

        for (int i = 0; i < total; i++) {
            Job job = jobs.get(i);
            if (!options.quiet() && multiFile) {
                out.printf(FILE_FORMAT, i + 1, total, job.inputPath());
            }

            Path outputPath = outputPathFor(job, options, multiFile);
            ProcessResult result = processor.process(job.inputPath(), outputPath, options);
            results.add(result);
            log.debug("{} -> {}: {}", job.inputPath(), outputPath, result.success() ? "ok" : result.failure().map(ProcessError::describe).orElse("failed"));

            if (options.quiet() && !options.jsonOutput()) {
                printQuietLine(result);
            }
            if (multiFile && i < total - 1) {
                memoryCheckpoint.run();
            }
        }

        return BatchSummary.of(results, TimeUtils.secondsSince(start));
    }

    // An explicit output only applies when the batch is a single file.
    private static Path outputPathFor(Job job, Options options, boolean multiFile) {
        if (!multiFile && job.explicitOutput().isPresent()) {
            return job.explicitOutput().get();
        }
        return OutputPathResolver.resolve(job.inputPath(), options.outputDirectory().orElse(null));
    }

    private void printQuietLine(ProcessResult result) {
        if (result.success()) {
            out.println(result.outputPath());
        } else {
            err.printf(QUIET_FAILURE, result.inputPath(),
                    result.failure().map(ProcessError::message).orElse("failed"));
        }
    }
}
