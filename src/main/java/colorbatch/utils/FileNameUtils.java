package colorbatch.utils;

import java.nio.file.*;

public final class FileNameUtils {

    private FileNameUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ".jpg" for "photo.jpg", "" for "README", ".profile" or "name."
    public static String extension(Path path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot);
    }

    // File name with the last extension removed.
    public static String stem(Path path) {
        String name = fileName(path);
        String ext = extension(path);
        return ext.isEmpty() ? name : name.substring(0, name.length() - ext.length());
    }

    public static boolean hasExtension(Path path) {
        return !extension(path).isEmpty();
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }
}
