package dev.jobtracker.service;

import lombok.Getter;

/**
 * Neither the source hint nor content detection identified a registered parser.
 */
@Getter
public class UnrecognizedSourceException extends RuntimeException {

    private final String origin;

    public UnrecognizedSourceException(String origin) {
        super("Could not determine source of content from " + origin);
        this.origin = origin;
    }
}
