package dev.jobtracker.model;

import java.time.Instant;

/**
 * Already-fetched content handed to the ingestion pipeline.
 *
 * @param content    raw HTML email body or RSS document
 * @param receivedAt when the content was obtained, now when not known
 * @param sourceHint optional source id overriding detection, may be null
 * @param origin     where the content came from (feed URL, file name), used in reports
 */
public record RawContent(String content, Instant receivedAt, String sourceHint, String origin) {

    public RawContent {
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }

    public static RawContent of(String content, Instant receivedAt) {
        return new RawContent(content, receivedAt, null, "inline");
    }

    public String label() {
        if (sourceHint != null && !sourceHint.isBlank()) {
            return sourceHint + " (" + origin + ")";
        }
        return origin;
    }
}
