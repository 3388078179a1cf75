package colorbatch.commands;

import picocli.CommandLine.*;

import java.util.*;

// Raw command-line tokens as picocli binds them; see ArgumentParser for how they are interpreted.
public class ColorizeOptions {

    @Parameters(arity = "1..*",
            paramLabel = "INPUT",
            description = "Black and white images to colorize. With exactly two arguments and no --output-dir, "
                    + "a second argument that does not exist yet is taken as the output file.")
    private List<String> inputs = new ArrayList<>();

    @Option(names = {"-o", "--output-dir"},
            paramLabel = "DIR",
            description = "Write results into DIR (created if missing) instead of next to each input")
    private String outputDir;

    @Option(names = {"-q", "--quiet"},
            description = "Only print output paths and errors")
    private boolean quiet;

    @Option(names = {"-j", "--json"},
            description = "Print a single JSON result object to stdout (implies --quiet)")
    private boolean json;

    @Option(names = "--status",
            paramLabel = "FILE",
            description = "Keep FILE updated with the current status (loading, processing:<percent>, saving, complete)")
    private String statusFile;

    public List<String> inputs() {
        return inputs != null ? inputs : Collections.emptyList();
    }

    public String outputDir() {
        return outputDir;
    }

    public boolean quiet() {
        return quiet;
    }

    public boolean json() {
        return json;
    }

    public String statusFile() {
        return statusFile;
    }
}
