package colorbatch;

import colorbatch.commands.*;
import colorbatch.engine.*;
import colorbatch.models.*;
import colorbatch.processors.*;
import colorbatch.reporters.*;
import colorbatch.utils.*;
import picocli.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.concurrent.*;

@Command(
    name = "colorbatch",
    description = "Colorizes black and white images, one file after another.",
    versionProvider = VersionProvider.class,
    defaultValueProvider = PropertiesDefaultProvider.class,
    exitCodeOnInvalidInput = ExitCode.ERROR,
    exitCodeOnExecutionException = ExitCode.ERROR,
    usageHelpAutoWidth = true,
    footerHeading = "%nNotes:%n",
    footer = {
        "  -h, --help must be the first argument; it prints this help and exits.",
        "  Default output is <input>-colorized.<ext>, numbered -1, -2, ... if that file exists.",
        "  Supported formats: " + ImageFormat.SUPPORTED_LIST,
        "  Exit status is 0 only when every file succeeded.",
    }
)
public class MainCli implements Callable<Integer> {

    @Mixin
    private ColorizeOptions options = new ColorizeOptions();

    @Option(names = {"-V", "--version"}, versionHelp = true, description = "Print version information and exit.")
    private boolean versionRequested;

    @Spec
    private Model.CommandSpec spec;

    private final PrintStream out;
    private final PrintStream err;
    private final ImageCodec codec;
    private final Colorizer colorizer;

    public MainCli() {
        this(System.out, System.err, new ImageIoCodec(), new ToneMapColorizer());
    }

    public MainCli(PrintStream out, PrintStream err, ImageCodec codec, Colorizer colorizer) {
        this.out = out;
        this.err = err;
        this.codec = codec;
        this.colorizer = colorizer;
    }

    @Override
    public Integer call() throws Exception {
        Invocation invocation = ArgumentParser.interpret(options, spec.commandLine());
        Options opts = invocation.options();
        ResultReporter reporter = new ResultReporter(out);

        try {
            ArgumentParser.prepareOutputDirectory(opts);
        } catch (SetupException e) {
            if (opts.jsonOutput()) {
                reporter.renderSetupError(e.getMessage());
            } else {
                err.printf("ERROR: %s%n", e.getMessage());
            }
            return ExitCode.ERROR;
        }

        FileProcessor processor = new FileProcessor(codec, colorizer, out, err);
        BatchSummary summary = new BatchRunner(processor, out, err).run(invocation.jobs(), opts);
        return reporter.render(summary, opts);
    }

    public static void main(String[] args) {
        System.exit(execute(new MainCli(), args));
    }

    static int execute(MainCli command, String... args) {
        CommandLine cli = ArgumentParser.configure(new CommandLine(command));

        cli.setOut(new PrintWriter(command.out, true));
        cli.setErr(new PrintWriter(command.err, true));
        cli.setExecutionExceptionHandler(new ShortErrorHandler());
        cli.setColorScheme(Help.defaultColorScheme(Help.Ansi.AUTO));

        if (ArgumentParser.isHelpRequest(args)) {
            cli.usage(command.out);
            return ExitCode.OK;
        }

        return cli.execute(args);
    }

    static class ShortErrorHandler implements IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
            cmd.getErr().println(cmd.getColorScheme().errorText("ERROR: " + ex.getMessage()));
            return cmd.getCommandSpec().exitCodeOnExecutionException();
        }
    }

}
