package dev.jobtracker.service;

import dev.jobtracker.model.SourceId;
import lombok.Getter;

/**
 * A parser could not read the content it was given. Other sources in the same
 * batch are unaffected.
 */
@Getter
public class SourceParseFailureException extends RuntimeException {

    private final SourceId sourceId;
    private final String origin;

    public SourceParseFailureException(SourceId sourceId, String origin, Throwable cause) {
        super("Failed to parse " + sourceId + " content from " + origin + ": " + cause.getMessage(), cause);
        this.sourceId = sourceId;
        this.origin = origin;
    }
}
