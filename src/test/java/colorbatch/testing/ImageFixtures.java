package colorbatch.testing;

import colorbatch.engine.*;

import javax.imageio.*;
import java.awt.image.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;

// Shared fakes and image files for the tests.
public final class ImageFixtures {

    private ImageFixtures() {}

    // Horizontal gray ramp.
    public static BufferedImage gray(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                raster.setSample(x, y, 0, width > 1 ? x * 255 / (width - 1) : 128);
            }
        }
        return image;
    }

    public static Path writeImage(Path file, int width, int height, String formatName) throws IOException {
        if (!ImageIO.write(gray(width, height), formatName, file.toFile())) {
            throw new IOException("No writer for " + formatName);
        }
        return file;
    }

    /**
     * Colorizer that emits a scripted progress sequence and can be told to fail.
     */
    public static class RecordingColorizer implements Colorizer {
        public final List<Picture> inputs = new ArrayList<>();
        public final List<Picture> outputs = new ArrayList<>();
        public float[] progressSteps = {0f, 25f, 50f, 75f, 100f};
        public int outputWidth = -1;
        public int outputHeight = -1;
        public RuntimeException failWith;
        public boolean outOfMemory;

        @Override
        public Picture colorize(Picture input, ProgressListener progress) {
            inputs.add(input);
            for (float step : progressSteps) {
                progress.onProgress(step);
            }
            if (outOfMemory) {
                throw new OutOfMemoryError("Java heap space");
            }
            if (failWith != null) {
                throw failWith;
            }
            int w = outputWidth > 0 ? outputWidth : input.width();
            int h = outputHeight > 0 ? outputHeight : input.height();
            Picture output = new Picture(new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB));
            outputs.add(output);
            return output;
        }
    }

    /**
     * Codec that hands out in-memory pictures and writes a marker file on encode.
     */
    public static class StubCodec implements ImageCodec {
        public final List<Path> decoded = new ArrayList<>();
        public final List<Picture> pictures = new ArrayList<>();
        public final List<Path> encoded = new ArrayList<>();
        public int width = 64;
        public int height = 48;
        public IOException decodeFailure;
        public boolean decodeOutOfMemory;
        public IOException encodeFailure;
        public Error encodeCrash;
        // Number of upcoming encodes that run out of memory.
        public int encodeOutOfMemory;

        @Override
        public Picture decode(Path path) throws IOException {
            decoded.add(path);
            if (decodeOutOfMemory) {
                throw new OutOfMemoryError("Java heap space");
            }
            if (decodeFailure != null) {
                throw decodeFailure;
            }
            Picture picture = new Picture(gray(width, height));
            pictures.add(picture);
            return picture;
        }

        @Override
        public void encode(Picture picture, Path path, ImageFormat format) throws IOException {
            if (encodeOutOfMemory > 0) {
                encodeOutOfMemory--;
                throw new OutOfMemoryError("Java heap space");
            }
            if (encodeCrash != null) {
                throw encodeCrash;
            }
            if (encodeFailure != null) {
                throw encodeFailure;
            }
            encoded.add(path);
            Files.writeString(path, "encoded as " + format);
        }
    }

    public static PrintStream printStream(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true);
    }
}
