package dev.jobtracker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.model.JobFieldUpdate;
import dev.jobtracker.repository.JobRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * {@link JobStore} backed by the SQLite jobs table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final JobRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<JobRecord> get(String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(JobRecord record) {
        boolean inserted = repository.insertIfAbsent(record) > 0;
        if (!inserted) {
            log.debug("Job {} already stored, keeping existing record", record.getId());
        }
        return inserted;
    }

    @Override
    @Transactional
    public boolean updateFields(String id, JobFieldUpdate update) {
        Optional<JobRecord> existing = repository.findById(id);
        if (existing.isEmpty()) {
            log.warn("Cannot update unknown job {}", id);
            return false;
        }
        if (update.isEmpty()) {
            return true;
        }

        JobRecord job = existing.get();
        if (update.getStatus() != null) {
            job.setStatus(update.getStatus());
        }
        if (update.getScore() != null) {
            job.setScore(update.getScore());
        }
        if (update.getAnalysis() != null) {
            job.setAnalysis(toJson(update));
        }
        if (update.getCoverLetter() != null) {
            job.setCoverLetter(update.getCoverLetter());
        }
        if (update.getNotes() != null) {
            job.setNotes(update.getNotes());
        }
        job.setUpdatedAt(now());
        repository.save(job);
        return true;
    }

    @Override
    @Transactional
    public boolean enrichBlankFields(String id, String description, String rawText, String location) {
        LocalDateTime now = now();
        int filled = 0;
        if (description != null && !description.isBlank()) {
            filled += repository.fillBlankDescription(id, description, rawText, now);
        }
        if (location != null && !location.isBlank()) {
            filled += repository.fillBlankLocation(id, location, now);
        }
        return filled > 0;
    }

    private String toJson(JobFieldUpdate update) {
        try {
            return objectMapper.writeValueAsString(update.getAnalysis());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Analysis is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
