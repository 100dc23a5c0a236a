package dev.jobtracker.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Partial update of the fields owned by users and downstream stages.
 * Null fields are left untouched.
 */
@Value
@Builder
public class JobFieldUpdate {
    JobStatus status;
    Integer score;
    Map<String, Object> analysis;
    String coverLetter;
    String notes;

    public boolean isEmpty() {
        return status == null && score == null && analysis == null && coverLetter == null && notes == null;
    }
}
