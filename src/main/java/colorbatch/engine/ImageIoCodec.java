package colorbatch.engine;

import org.apache.tika.*;
import org.slf4j.*;

import javax.imageio.*;
import javax.imageio.stream.*;
import java.awt.*;
import java.awt.image.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Reads and writes pictures through {@code javax.imageio}.
 * <p>
 * Writers are looked up by the MIME type of the requested {@link ImageFormat}. Formats the
 * running JDK has no writer for fail with an {@link IOException}. When a file cannot be decoded,
 * Tika is asked what the content actually is so the error message can say so.
 */
public class ImageIoCodec implements ImageCodec {
    private static final Logger log = LoggerFactory.getLogger(ImageIoCodec.class);

    private static final String PARTIAL_SUFFIX = ".part";
    private static final String UNKNOWN_MIME_TYPE = "application/octet-stream";
    private static final Set<ImageFormat> OPAQUE_FORMATS = EnumSet.of(ImageFormat.JPEG, ImageFormat.EXIF, ImageFormat.BMP);

    private final Tika tika = new Tika();

    @Override
    public Picture decode(Path path) throws IOException {
        BufferedImage image;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            image = ImageIO.read(in);
        } catch (IIOException e) {
            throw new InvalidImageException(invalidImageMessage(path), e);
        }
        if (image == null) {
            throw new InvalidImageException(invalidImageMessage(path));
        }
        return new Picture(image);
    }

    @Override
    public void encode(Picture picture, Path path, ImageFormat format) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByMIMEType(format.mimeType());
        if (!writers.hasNext()) {
            throw new IOException(String.format("No encoder available for %s output: %s", format, path));
        }
        ImageWriter writer = writers.next();
        BufferedImage image = OPAQUE_FORMATS.contains(format) ? withoutAlpha(picture.image()) : picture.image();

        // Encoded into a sibling file first so a failed save never truncates an existing target.
        Path partial = partialFileFor(path);
        try {
            try (OutputStream os = Files.newOutputStream(partial);
                 ImageOutputStream out = ImageIO.createImageOutputStream(os)) {
                if (out == null) {
                    throw new IOException("Unable to open image output stream: " + path);
                }
                writeImage(writer, image, out);
            }
            moveIntoPlace(partial, path);
        } finally {
            writer.dispose();
            Files.deleteIfExists(partial);
        }
    }

    protected void writeImage(ImageWriter writer, BufferedImage image, ImageOutputStream out) throws IOException {
        writer.setOutput(out);
        writer.write(image);
    }

    static Path partialFileFor(Path target) {
        return target.resolveSibling("." + target.getFileName() + PARTIAL_SUFFIX);
    }

    private static void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private String invalidImageMessage(Path path) {
        return String.format("File is not a valid image: %s (detected %s)", path, detectMimeType(path));
    }

    private String detectMimeType(Path file) {
        try {
            String full = tika.detect(file);
            return full != null ? full.split(";")[0].trim() : UNKNOWN_MIME_TYPE;
        } catch (IOException e) {
            log.debug("Unable to detect MIME type for {}", file, e);
            return UNKNOWN_MIME_TYPE;
        }
    }

    private static BufferedImage withoutAlpha(BufferedImage source) {
        if (!source.getColorModel().hasAlpha()) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
