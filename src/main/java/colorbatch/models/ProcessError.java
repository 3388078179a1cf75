package colorbatch.models;

import java.util.*;

public record ProcessError(
        ErrorCategory category,
        String message
) {
    public ProcessError {
        Objects.requireNonNull(category, "category");
        message = message != null ? message : category.label();
    }

    public static ProcessError of(ErrorCategory category, String format, Object... args) {
        return new ProcessError(category, String.format(format, args));
    }

    public String describe() {
        return String.format("[%s] %s", category.label(), message);
    }
}
