package colorbatch.reporters;

import colorbatch.*;
import colorbatch.models.*;
import com.fasterxml.jackson.databind.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ResultReporterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ResultReporter reporter;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        reporter = new ResultReporter(new PrintStream(out, true));
    }

    @Test
    void jsonForAnAllSuccessBatch() throws IOException {
        BatchSummary summary = BatchSummary.of(List.of(
                success("a.jpg", "a-colorized.jpg", 640, 480, 1.23456),
                success("b.png", "b-colorized.png", 32, 32, 0.5)), 1.9);

        int exit = reporter.render(summary, new Options(false, true, null, null));

        assertEquals(0, exit);
        String printed = out.toString();
        assertEquals(1, printed.lines().count());
        JsonNode json = MAPPER.readTree(printed);
        assertTrue(json.get("success").asBoolean());
        assertEquals(2, json.get("total").asInt());
        assertEquals(2, json.get("successful").asInt());
        assertEquals(0, json.get("failed").asInt());
        assertEquals(1.9, json.get("processing_time_seconds").asDouble(), 1e-9);

        JsonNode first = json.get("results").get(0);
        assertEquals("a.jpg", first.get("input").asText());
        assertEquals("a-colorized.jpg", first.get("output").asText());
        assertTrue(first.get("success").asBoolean());
        assertEquals(640, first.get("width").asInt());
        assertEquals(480, first.get("height").asInt());
        assertEquals(1.235, first.get("processing_time_seconds").asDouble(), 1e-9);
        assertFalse(first.has("error"));
    }

    @Test
    void jsonForAnAllFailureBatch() throws IOException {
        BatchSummary summary = BatchSummary.of(List.of(
                failure("missing.jpg", ErrorCategory.NOT_FOUND, "Input file not found: missing.jpg"),
                failure("scan", ErrorCategory.UNSUPPORTED_FORMAT, "Input file has no extension: scan")), 0.01);

        int exit = reporter.render(summary, new Options(true, true, null, null));

        assertEquals(1, exit);
        JsonNode json = MAPPER.readTree(out.toString());
        assertFalse(json.get("success").asBoolean());
        assertEquals(2, json.get("failed").asInt());
        assertEquals(0, json.get("successful").asInt());
        for (JsonNode result : json.get("results")) {
            assertFalse(result.get("success").asBoolean());
            assertTrue(result.has("error"));
            assertFalse(result.has("width"));
            assertFalse(result.has("height"));
        }
        assertEquals("Input file not found: missing.jpg", json.get("results").get(0).get("error").asText());
    }

    @Test
    void quotesAndBackslashesInMessagesAreEscaped() throws IOException {
        String message = "Failed to save image: C:\\out\\\"quoted\" name.png";
        BatchSummary summary = BatchSummary.of(List.of(failure("a.jpg", ErrorCategory.IO_ERROR, message)), 0);

        reporter.render(summary, new Options(false, true, null, null));

        String printed = out.toString();
        assertEquals(1, printed.lines().count());
        assertEquals(message, MAPPER.readTree(printed).get("results").get(0).get("error").asText());
    }

    @Test
    void bannerShowsCountsTimeAndFailures() {
        BatchSummary summary = BatchSummary.of(List.of(
                success("a.jpg", "a-colorized.jpg", 10, 10, 1),
                failure("b.jpg", ErrorCategory.INVALID_IMAGE, "File is not a valid image: b.jpg")), 3725.4);

        int exit = reporter.render(summary, Options.defaults());

        assertEquals(1, exit);
        String printed = out.toString();
        assertTrue(printed.contains("Batch complete: 1 succeeded, 1 failed (2 total)"));
        assertTrue(printed.contains("Total time: 01:02:05"));
        assertTrue(printed.contains("  - b.jpg: [InvalidImage] File is not a valid image: b.jpg"));
    }

    @Test
    void quietModeRendersNothing() {
        BatchSummary summary = BatchSummary.of(List.of(success("a.jpg", "o.jpg", 10, 10, 1)), 1);

        int exit = reporter.render(summary, new Options(true, false, null, null));

        assertEquals(0, exit);
        assertEquals("", out.toString());
    }

    @Test
    void statusFileIsDeletedInEveryMode() throws IOException {
        BatchSummary summary = BatchSummary.of(List.of(success("a.jpg", "o.jpg", 10, 10, 1)), 1);
        for (Options base : List.of(Options.defaults(), new Options(true, false, null, null), new Options(false, true, null, null))) {
            Path status = Files.writeString(dir.resolve("status"), "complete");

            reporter.render(summary, new Options(base.quiet(), base.jsonOutput(), status, null));

            assertFalse(Files.exists(status));
        }
    }

    @Test
    void setupErrorIsASingleErrorObject() throws IOException {
        reporter.renderSetupError("Cannot create output directory: /nope");

        JsonNode json = MAPPER.readTree(out.toString());
        assertEquals(1, json.size());
        assertEquals("Cannot create output directory: /nope", json.get("error").asText());
    }

    @Test
    void exitStatusIsOneIffSomethingFailed() {
        assertEquals(ExitCode.OK, ResultReporter.exitStatus(BatchSummary.of(List.of(), 0)));
        assertEquals(ExitCode.OK, ResultReporter.exitStatus(BatchSummary.of(List.of(success("a", "b", 1, 1, 0)), 0)));
        assertEquals(ExitCode.ERROR, ResultReporter.exitStatus(BatchSummary.of(
                List.of(failure("a", ErrorCategory.UNEXPECTED_ERROR, "boom")), 0)));
    }

    private static ProcessResult success(String in, String out, int w, int h, double seconds) {
        return new ProcessResult(Path.of(in), Path.of(out), true, null, w, h, seconds);
    }

    private static ProcessResult failure(String in, ErrorCategory category, String message) {
        return new ProcessResult(Path.of(in), Path.of(in + "-colorized"), false,
                new ProcessError(category, message), null, null, 0.002);
    }
}
