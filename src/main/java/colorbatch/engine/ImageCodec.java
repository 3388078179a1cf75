package colorbatch.engine;

import java.io.*;
import java.nio.file.*;

public interface ImageCodec {

    // Throws InvalidImageException for unreadable content, OutOfMemoryError when the image does not fit.
    Picture decode(Path path) throws IOException;

    void encode(Picture picture, Path path, ImageFormat format) throws IOException;
}
