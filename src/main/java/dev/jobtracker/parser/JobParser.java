package dev.jobtracker.parser;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;

import java.time.Instant;
import java.util.List;

/**
 * Extracts canonical job listings from the raw content of one source.
 * Implementations are stateless and safe to share between threads.
 */
public interface JobParser {

    /**
     * The source this parser understands.
     */
    SourceId sourceId();

    /**
     * Parse raw content into jobs. Unusable individual listings are skipped; an
     * empty list means nothing recognizable was found.
     *
     * @param rawContent HTML email body or feed document
     * @param receivedAt when the content was obtained
     * @throws SourceParseException if the document cannot be read at all
     */
    List<CanonicalJob> parse(String rawContent, Instant receivedAt) throws SourceParseException;
}
