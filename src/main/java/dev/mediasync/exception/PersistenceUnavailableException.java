package dev.mediasync.exception;

/**
 * The content store cannot be reached. This is the only failure allowed to end a sync run.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
