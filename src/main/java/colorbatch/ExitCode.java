package colorbatch;

public final class ExitCode {
    public static final int OK = 0;
    public static final int ERROR = 1;

    private ExitCode() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", ExitCode.class.getName()));
    }

}
