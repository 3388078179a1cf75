package colorbatch.processors;

import colorbatch.engine.*;

import java.io.*;

/**
 * Forwards colorizer progress to the console line and the status file, at most once per
 * crossed ten-percent step (0, 10, ..., 100).
 */
public class ProgressBridge implements ProgressListener {
    static final int REPORT_STEP = 10;

    private static final String ANSI_CARRIAGE_RETURN = "\r";
    private static final String ANSI_ERASE_LINE      = "\u001B[2K";
    private static final String PROGRESS_FORMAT      = "Progress: %d%%";

    private final PrintStream console;
    private final StatusFile statusFile;
    private int lastReported = -1;
    private boolean lineOpen;

    // console may be null when console output is suppressed
    public ProgressBridge(PrintStream console, StatusFile statusFile) {
        this.console = console;
        this.statusFile = statusFile;
    }

    @Override
    public void onProgress(float percent) {
        int current = (int) Math.floor(percent);
        if (current < 0 || current > 100) return;
        if (current == lastReported || current % REPORT_STEP != 0) return;

        lastReported = current;
        if (console != null) {
            console.print(ANSI_CARRIAGE_RETURN + ANSI_ERASE_LINE + String.format(PROGRESS_FORMAT, current));
            console.flush();
            lineOpen = true;
        }
        statusFile.progress(current);
    }

    public int lastReported() {
        return lastReported;
    }

    // Shows the final 100% and ends the in-place line.
    public void complete() {
        onProgress(100f);
        endLine();
    }

    public void endLine() {
        if (console != null && lineOpen) {
            console.println();
            lineOpen = false;
        }
    }
}
