package colorbatch.processors;

import colorbatch.engine.*;
import colorbatch.models.*;
import colorbatch.utils.*;
import org.slf4j.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Runs one file through validate, decode, colorize and encode.
 * <p>
 * {@link #process} never throws: every failure is recorded in the returned {@link ProcessResult}
 * with one {@link ErrorCategory}, checked in a fixed order so the first problem found wins.
 * Both pictures are released on every exit path.
 */
public class FileProcessor {
    private static final Logger log = LoggerFactory.getLogger(FileProcessor.class);

    public static final int MIN_RECOMMENDED_DIMENSION = 10;
    public static final int MAX_RECOMMENDED_DIMENSION = 4096;

    private static final String LOADING_FORMAT  = "Loading input image: %s%n";
    private static final String SIZE_FORMAT     = "Image size: %dx%d%n";
    private static final String SMALL_FORMAT    = "Warning: Image is very small (%dx%d)%nResults may not be optimal for very small images.%n";
    private static final String LARGE_FORMAT    = "Warning: Image is very large (%dx%d)%nProcessing may take a long time and require significant memory.%n";
    private static final String SAVING_FORMAT   = "Saving output image: %s%n";
    private static final String DONE_FORMAT     = "Done! Output saved to: %s%n";
    private static final String ERROR_FORMAT    = "Error: %s%n";

    private final ImageCodec codec;
    private final Colorizer colorizer;
    private final PrintStream out;
    private final PrintStream err;

    public FileProcessor(ImageCodec codec, Colorizer colorizer, PrintStream out, PrintStream err) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.colorizer = Objects.requireNonNull(colorizer, "colorizer");
        this.out = out;
        this.err = err;
    }

    public ProcessResult process(Path inputPath, Path outputPath, Options options) {
        long start = System.nanoTime();
        ProcessResult.Draft result = ProcessResult.start(inputPath, outputPath);
        boolean verbose = !options.quiet();
        StatusFile status = StatusFile.of(options);

        Picture input = null;
        Picture output = null;
        ProgressBridge progress = null;
        try {
            Optional<ProcessError> invalid = validate(inputPath, outputPath);
            if (invalid.isPresent()) {
                return failed(result, invalid.get(), verbose, start);
            }
            ImageFormat format = outputFormat(outputPath).orElseThrow();

            // decode
            status.write(StatusFile.LOADING);
            if (verbose) out.printf(LOADING_FORMAT, inputPath);
            try {
                input = codec.decode(inputPath);
            } catch (OutOfMemoryError e) {
                return failed(result, ProcessError.of(ErrorCategory.RESOURCE_EXHAUSTED,
                        "Image is too large or corrupted: %s", inputPath), verbose, start);
            } catch (IOException e) {
                log.debug("Decode failed for {}", inputPath, e);
                return failed(result, new ProcessError(ErrorCategory.INVALID_IMAGE,
                        describe(e, "File is not a valid image: " + inputPath)), verbose, start);
            }

            int width = input.width();
            int height = input.height();
            result.dimensions(width, height);
            if (verbose) {
                out.printf(SIZE_FORMAT, width, height);
                warnAboutDimensions(width, height);
            }

            // colorize
            status.write(StatusFile.PROCESSING);
            if (verbose) out.println("Starting colorization...");
            progress = new ProgressBridge(verbose ? out : null, status);
            try {
                output = colorizer.colorize(input, progress);
            } catch (OutOfMemoryError e) {
                progress.endLine();
                return failed(result, new ProcessError(ErrorCategory.RESOURCE_EXHAUSTED,
                        "Out of memory during colorization. The image may be too large."), verbose, start);
            }
            progress.complete();
            if (verbose) out.println("Colorization complete!");

            // encode
            status.write(StatusFile.SAVING);
            if (verbose) out.printf(SAVING_FORMAT, outputPath);
            try {
                codec.encode(output, outputPath, format);
            } catch (OutOfMemoryError e) {
                return failed(result, ProcessError.of(ErrorCategory.RESOURCE_EXHAUSTED,
                        "Out of memory while saving image: %s", outputPath), verbose, start);
            } catch (FileSystemException e) {
                log.debug("Save failed for {}", outputPath, e);
                return failed(result, ProcessError.of(ErrorCategory.IO_ERROR,
                        "Failed to save image. The file may be in use or you may lack write permissions: %s",
                        outputPath), verbose, start);
            } catch (IOException e) {
                log.debug("Save failed for {}", outputPath, e);
                return failed(result, new ProcessError(ErrorCategory.IO_ERROR,
                        "Failed to save image: " + describe(e, outputPath.toString())), verbose, start);
            }

            status.write(StatusFile.COMPLETE);
            if (verbose) out.printf(DONE_FORMAT, outputPath);
            result.completed();
            return result.finish(TimeUtils.secondsSince(start));

        } catch (OutOfMemoryError e) {
            if (progress != null) progress.endLine();
            return failed(result, ProcessError.of(ErrorCategory.RESOURCE_EXHAUSTED,
                    "Out of memory while processing %s", inputPath), verbose, start);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            if (progress != null) progress.endLine();
            log.debug("Unexpected failure processing {}", inputPath, e);
            return failed(result, new ProcessError(ErrorCategory.UNEXPECTED_ERROR,
                    "Unexpected error: " + describe(e, e.getClass().getSimpleName())), verbose, start);
        } finally {
            release(input);
            release(output);
        }
    }

    // Checks that need no decoding, in order: input exists, input has an extension,
    // output format is known, output directory exists or can be made.
    Optional<ProcessError> validate(Path inputPath, Path outputPath) {
        if (!Files.isRegularFile(inputPath) || !Files.isReadable(inputPath)) {
            return Optional.of(ProcessError.of(ErrorCategory.NOT_FOUND, "Input file not found: %s", inputPath));
        }
        if (!FileNameUtils.hasExtension(inputPath)) {
            return Optional.of(ProcessError.of(ErrorCategory.UNSUPPORTED_FORMAT,
                    "Input file has no extension: %s (supported formats: %s)", inputPath, ImageFormat.SUPPORTED_LIST));
        }
        if (outputFormat(outputPath).isEmpty()) {
            String ext = FileNameUtils.extension(outputPath);
            return Optional.of(ProcessError.of(ErrorCategory.UNSUPPORTED_FORMAT,
                    "Unsupported output format: %s (supported formats: %s)",
                    ext.isEmpty() ? "(none)" : ext, ImageFormat.SUPPORTED_LIST));
        }
        Path outputDir = outputPath.getParent();
        if (outputDir != null && !Files.isDirectory(outputDir)) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                log.debug("Cannot create output directory {}", outputDir, e);
                return Optional.of(ProcessError.of(ErrorCategory.IO_ERROR,
                        "Output directory does not exist and cannot be created: %s", outputDir));
            }
        }
        return Optional.empty();
    }

    private static Optional<ImageFormat> outputFormat(Path outputPath) {
        return ImageFormat.fromExtension(FileNameUtils.extension(outputPath));
    }

    private void warnAboutDimensions(int width, int height) {
        if (width < MIN_RECOMMENDED_DIMENSION || height < MIN_RECOMMENDED_DIMENSION) {
            out.printf(SMALL_FORMAT, width, height);
        } else if (width > MAX_RECOMMENDED_DIMENSION || height > MAX_RECOMMENDED_DIMENSION) {
            out.printf(LARGE_FORMAT, width, height);
        }
    }

    private ProcessResult failed(ProcessResult.Draft result, ProcessError error, boolean verbose, long start) {
        result.fail(error);
        if (verbose) err.printf(ERROR_FORMAT, error.describe());
        return result.finish(TimeUtils.secondsSince(start));
    }

    private static String describe(Throwable e, String fallback) {
        String message = StringUtils.firstLine(e.getMessage());
        return message.isEmpty() ? fallback : message;
    }

    private static void release(Picture picture) {
        if (picture != null) {
            picture.close();
        }
    }
}
