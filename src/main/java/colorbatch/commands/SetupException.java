package colorbatch.commands;

// A problem that stops the whole run before any file is processed.
public class SetupException extends Exception {
    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
