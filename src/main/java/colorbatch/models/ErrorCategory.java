package colorbatch.models;

public enum ErrorCategory {
    NOT_FOUND("NotFound"),
    UNSUPPORTED_FORMAT("UnsupportedFormat"),
    IO_ERROR("IOError"),
    INVALID_IMAGE("InvalidImage"),
    RESOURCE_EXHAUSTED("ResourceExhausted"),
    UNEXPECTED_ERROR("UnexpectedError");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
