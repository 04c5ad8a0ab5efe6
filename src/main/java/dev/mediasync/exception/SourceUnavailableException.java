package dev.mediasync.exception;

import lombok.Getter;

/**
 * The feed source for one subscription could not be read. The orchestrator logs it and
 * moves on to the next subscription.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final String sourceId;

    public SourceUnavailableException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }
}
