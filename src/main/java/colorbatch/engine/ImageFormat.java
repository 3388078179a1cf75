package colorbatch.engine;

import java.util.*;

/**
 * The raster container formats the tool can be asked to write.
 * A format is chosen from the file extension only, never from file content.
 */
public enum ImageFormat {
    BMP("image/bmp", "bmp"),
    EMF("image/emf", "emf"),
    EXIF("image/jpeg", "exif"),
    GIF("image/gif", "gif"),
    ICON("image/vnd.microsoft.icon", "ico"),
    JPEG("image/jpeg", "jpg", "jpeg"),
    PNG("image/png", "png"),
    TIFF("image/tiff", "tif", "tiff"),
    WMF("image/wmf", "wmf");

    public static final String SUPPORTED_LIST = "BMP, EMF, EXIF, GIF, ICO, JPG, PNG, TIFF, WMF";

    private static final Map<String, ImageFormat> BY_EXTENSION = new HashMap<>();

    static {
        for (ImageFormat format : values()) {
            for (String ext : format.extensions) {
                BY_EXTENSION.put(ext, format);
            }
        }
    }

    private final String mimeType;
    private final List<String> extensions;

    ImageFormat(String mimeType, String... extensions) {
        this.mimeType = mimeType;
        this.extensions = List.of(extensions);
    }

    public String mimeType() {
        return mimeType;
    }

    // Accepts "png", ".PNG", "Jpeg"...
    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null || extension.isBlank()) return Optional.empty();
        String key = extension.startsWith(".") ? extension.substring(1) : extension;
        return Optional.ofNullable(BY_EXTENSION.get(key.toLowerCase(Locale.ROOT)));
    }
}
