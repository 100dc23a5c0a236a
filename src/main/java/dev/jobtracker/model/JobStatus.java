package dev.jobtracker.model;

/**
 * Lifecycle of a tracked job. New records always start at {@link #NEW}.
 */
public enum JobStatus {
    NEW,
    INTERESTED,
    APPLIED,
    INTERVIEWING,
    PASSED,
    REJECTED
}
