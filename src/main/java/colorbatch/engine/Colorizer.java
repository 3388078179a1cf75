package colorbatch.engine;

/**
 * Turns a monochrome picture into a colored one.
 * <p>
 * Progress is reported to {@code progress} from inside the call. Implementations may throw
 * {@link OutOfMemoryError} when the picture is too large; nothing else is expected to escape.
 */
public interface Colorizer {
    Picture colorize(Picture input, ProgressListener progress);
}
