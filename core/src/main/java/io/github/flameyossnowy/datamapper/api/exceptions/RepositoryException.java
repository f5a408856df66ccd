package io.github.flameyossnowy.datamapper.api.exceptions;

/**
 * Raised when the underlying store or connection fails while executing a statement.
 * The driver exception is always kept as the cause.
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
