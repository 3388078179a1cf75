package colorbatch.engine;

import java.awt.image.*;
import java.util.*;

/**
 * Owns a decoded raster for the duration of one pipeline step.
 * Closing releases the pixel buffer; it is safe to close more than once.
 */
public final class Picture implements AutoCloseable {
    private final BufferedImage image;
    private boolean released;

    public Picture(BufferedImage image) {
        this.image = Objects.requireNonNull(image, "image");
    }

    public BufferedImage image() {
        if (released) {
            throw new IllegalStateException("Picture already released");
        }
        return image;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            image.flush();
        }
    }
}
