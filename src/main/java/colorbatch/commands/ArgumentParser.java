package colorbatch.commands;

import colorbatch.models.*;
import picocli.*;
import picocli.CommandLine.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.stream.*;

/**
 * Turns command-line tokens into {@link Options} and an ordered job list.
 * <p>
 * picocli binds the flags; everything it does not recognise is an input candidate. Two
 * candidates without {@code --output-dir} are ambiguous: when the second one does not exist
 * on disk it is read as the output file of a single-file run, otherwise both are inputs.
 */
public final class ArgumentParser {
    public static final Set<String> HELP_FLAGS = Set.of("-h", "--help");

    private ArgumentParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // Help is only honoured as the very first token.
    public static boolean isHelpRequest(String... tokens) {
        return tokens.length > 0 && HELP_FLAGS.contains(tokens[0]);
    }

    public static CommandLine configure(CommandLine cli) {
        cli.setUnmatchedOptionsArePositionalParams(true);
        return cli;
    }

    // Standalone parse, without executing anything.
    public static Invocation parse(String... tokens) {
        ColorizeOptions raw = new ColorizeOptions();
        CommandLine cli = configure(new CommandLine(raw));
        cli.parseArgs(tokens);
        return interpret(raw, cli);
    }

    public static Invocation interpret(ColorizeOptions raw, CommandLine cli) {
        Path outputDir = toPath(cli, raw.outputDir());
        List<Path> candidates = new ArrayList<>();
        for (String token : raw.inputs()) {
            candidates.add(toPath(cli, token));
        }

        Path explicitOutput = null;
        if (candidates.size() == 2 && outputDir == null && !Files.exists(candidates.get(1))) {
            explicitOutput = candidates.remove(1);
        }

        Options options = new Options(raw.quiet(), raw.json(), toPath(cli, raw.statusFile()), outputDir);
        List<Job> jobs = explicitOutput != null
                ? List.of(new Job(candidates.get(0), explicitOutput))
                : candidates.stream().map(Job::of).collect(Collectors.toList());
        return new Invocation(options, jobs);
    }

    // Fatal for the whole run: a requested output directory that cannot be made.
    public static void prepareOutputDirectory(Options options) throws SetupException {
        Optional<Path> requested = options.outputDirectory();
        if (requested.isEmpty() || Files.isDirectory(requested.get())) return;
        Path dir = requested.get();
        try {
            Files.createDirectories(dir);
        } catch (IOException | SecurityException e) {
            throw new SetupException("Cannot create output directory: " + dir, e);
        }
    }

    private static Path toPath(CommandLine cli, String token) {
        if (token == null) return null;
        try {
            return Path.of(token);
        } catch (InvalidPathException e) {
            throw new ParameterException(cli, "Invalid path: " + e.getMessage(), e, null, token);
        }
    }
}
