package dev.jobtracker.store;

import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.model.JobFieldUpdate;

import java.util.Optional;

/**
 * Persistent job storage with insert-if-absent semantics. Listing fields are
 * never overwritten once stored; user and downstream fields change only through
 * {@link #updateFields}.
 */
public interface JobStore {

    Optional<JobRecord> get(String id);

    /**
     * Store the record unless one with the same id exists. Atomic per id: when two
     * writers race, exactly one sees {@code true}.
     *
     * @return true if this call stored the record
     */
    boolean insertIfAbsent(JobRecord record);

    /**
     * Apply the non-null fields of the update.
     *
     * @return false if no job has the id
     */
    boolean updateFields(String id, JobFieldUpdate update);

    /**
     * Fill description, raw text and location where they are still blank. Never
     * touches status, score, analysis, cover letter or notes.
     *
     * @return true if any field was filled
     */
    boolean enrichBlankFields(String id, String description, String rawText, String location);
}
