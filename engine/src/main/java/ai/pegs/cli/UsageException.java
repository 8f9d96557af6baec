package ai.pegs.cli;

/**
 * Thrown when the command line cannot be understood. Nothing is simulated.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
