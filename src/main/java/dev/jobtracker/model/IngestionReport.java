package dev.jobtracker.model;

import dev.jobtracker.entity.JobRecord;

import java.util.List;

/**
 * Outcome of a batch ingestion: how many listings were parsed, how many were new,
 * and which sources could not be read.
 */
public record IngestionReport(
        int found,
        List<JobRecord> inserted,
        List<SourceFailure> failedSources) {

    public static IngestionReport empty() {
        return new IngestionReport(0, List.of(), List.of());
    }

    public int newJobs() {
        return inserted.size();
    }

    public boolean hasFailures() {
        return !failedSources.isEmpty();
    }

    /**
     * A source that produced nothing because it could not be recognized or read.
     */
    public record SourceFailure(String source, String reason) {
    }
}
