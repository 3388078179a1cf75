package colorbatch.models;

import java.util.*;

// Results in job order, plus totals. Built once after the last job.
public record BatchSummary(
        List<ProcessResult> results,
        double totalSeconds,
        int successful,
        int failed
) {
    public BatchSummary {
        results = List.copyOf(results);
    }

    public static BatchSummary of(List<ProcessResult> results, double totalSeconds) {
        int ok = (int) results.stream().filter(ProcessResult::success).count();
        return new BatchSummary(results, totalSeconds, ok, results.size() - ok);
    }

    public int total() {
        return results.size();
    }

    public boolean success() {
        return failed == 0;
    }
}
