package colorbatch.commands;

import colorbatch.models.*;

import java.util.*;

public record Invocation(
        Options options,
        List<Job> jobs
) {
    public Invocation {
        jobs = List.copyOf(jobs);
    }
}
