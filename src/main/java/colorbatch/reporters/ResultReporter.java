package colorbatch.reporters;

import colorbatch.*;
import colorbatch.models.*;
import colorbatch.processors.*;
import colorbatch.utils.*;
import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.databind.*;

import java.io.*;

/**
 * Writes the batch outcome and decides the exit status.
 * <ul>
 *   <li>JSON mode: one single-line {@link BatchReport} on stdout and nothing else.</li>
 *   <li>Quiet mode: nothing; the per-file lines were already written while processing.</li>
 *   <li>Otherwise: a summary banner with counts, total time and the failed files.</li>
 * </ul>
 * The status file is removed afterwards in every mode.
 */
public class ResultReporter {
    private static final String RULE          = "========================================";
    private static final String SUMMARY_FORMAT = "Batch complete: %,d succeeded, %,d failed (%,d total)%n";
    private static final String TIME_FORMAT    = "Total time: %s%n";
    private static final String FAILED_FORMAT  = "  - %s: %s%n";

    private final ObjectMapper mapper;
    private final PrintStream out;

    public ResultReporter(PrintStream out) {
        this(new ObjectMapper(), out);
    }

    public ResultReporter(ObjectMapper mapper, PrintStream out) {
        this.mapper = mapper;
        this.out = out;
    }

    public int render(BatchSummary summary, Options options) {
        try {
            if (options.jsonOutput()) {
                out.println(toJson(BatchReport.from(summary)));
            } else if (!options.quiet()) {
                printBanner(summary);
            }
            out.flush();
        } finally {
            StatusFile.of(options).delete();
        }
        return exitStatus(summary);
    }

    public void renderSetupError(String message) {
        out.println(toJson(new SetupErrorReport(message)));
        out.flush();
    }

    public static int exitStatus(BatchSummary summary) {
        return summary.failed() > 0 ? ExitCode.ERROR : ExitCode.OK;
    }

    String toJson(Object report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize report: " + e.getOriginalMessage(), e);
        }
    }

    private void printBanner(BatchSummary summary) {
        out.println();
        out.println(RULE);
        out.printf(SUMMARY_FORMAT, summary.successful(), summary.failed(), summary.total());
        out.printf(TIME_FORMAT, TimeUtils.formatHMS(summary.totalSeconds()));
        if (summary.failed() > 0) {
            out.println("Failed files:");
            for (ProcessResult r : summary.results()) {
                if (!r.success()) {
                    out.printf(FAILED_FORMAT, r.inputPath(),
                            r.failure().map(ProcessError::describe).orElse("failed"));
                }
            }
        }
        out.println(RULE);
    }
}
