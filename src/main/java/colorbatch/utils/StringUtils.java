package colorbatch.utils;

public class StringUtils {
    private StringUtils() {}

    public static String getOrDefault(String value, String def) {
        return value != null && !value.isBlank() ? value : def;
    }

    // First line of a possibly multi-line exception message; never null.
    public static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return (nl < 0 ? message : message.substring(0, nl)).trim();
    }
}
