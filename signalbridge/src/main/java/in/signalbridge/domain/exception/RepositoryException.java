package in.signalbridge.domain.exception;

/**
 * Persistence failure (wraps SQLException and mapping errors).
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(String message) {
        super(message);
    }
}
