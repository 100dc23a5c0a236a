package dev.jobtracker.parser;

import dev.jobtracker.model.SourceId;
import lombok.Getter;

/**
 * The content handed to a parser could not be traversed at all.
 * Distinct from a successful parse that found nothing.
 */
@Getter
public class SourceParseException extends Exception {

    private final SourceId sourceId;

    public SourceParseException(SourceId sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public SourceParseException(SourceId sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }
}
