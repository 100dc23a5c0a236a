package dev.jobtracker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Normalized job listing produced by a parser or the capture endpoint.
 * Storage bookkeeping (status, score, timestamps) lives on
 * {@link dev.jobtracker.entity.JobRecord}.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalJob {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_COMPANY_LENGTH = 100;
    public static final int MAX_LOCATION_LENGTH = 100;
    public static final int MAX_RAW_TEXT_LENGTH = 1000;
    public static final String UNKNOWN_COMPANY = "Unknown";

    String id;
    String title;
    String company;
    String location;
    String url;
    SourceId source;
    String rawText;
    String description; // only RSS feeds and captures carry one
    Instant receivedAt;
}
