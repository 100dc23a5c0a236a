package dev.jobtracker.model;

public record CaptureResult(Outcome outcome, String jobId) {

    public enum Outcome {
        CREATED,
        UPDATED,
        UNCHANGED
    }
}
