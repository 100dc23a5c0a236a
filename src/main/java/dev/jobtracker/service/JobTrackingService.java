package dev.jobtracker.service;

import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.model.JobFieldUpdate;
import dev.jobtracker.model.JobStats;
import dev.jobtracker.model.JobStatus;
import dev.jobtracker.repository.JobRecordRepository;
import dev.jobtracker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes made after ingestion: user status changes, scoring results and cover
 * letters, plus the listing queries that feed them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobTrackingService {

    private static final int UNSCORED = 0;

    private final JobStore jobStore;
    private final JobRecordRepository jobRecordRepository;

    public Optional<JobRecord> getJob(String id) {
        return jobStore.get(id);
    }

    public boolean updateStatus(String id, JobStatus status) {
        log.info("Job {} -> {}", id, status);
        return jobStore.updateFields(id, JobFieldUpdate.builder().status(status).build());
    }

    /**
     * Store the result of the scoring stage.
     *
     * @param analysis structured analysis, stored as JSON
     */
    public boolean recordAnalysis(String id, int score, Map<String, Object> analysis) {
        return jobStore.updateFields(id, JobFieldUpdate.builder()
                .score(score)
                .analysis(analysis)
                .build());
    }

    public boolean saveCoverLetter(String id, String coverLetter) {
        return jobStore.updateFields(id, JobFieldUpdate.builder().coverLetter(coverLetter).build());
    }

    public boolean updateNotes(String id, String notes) {
        return jobStore.updateFields(id, JobFieldUpdate.builder().notes(notes).build());
    }

    /**
     * Jobs with the given status (all when null) scoring at least {@code minScore}, best first.
     */
    @Transactional(readOnly = true)
    public List<JobRecord> findJobs(JobStatus status, int minScore) {
        return jobRecordRepository.search(status, minScore);
    }

    /**
     * Jobs still waiting for the scoring stage.
     */
    @Transactional(readOnly = true)
    public List<JobRecord> findUnscored() {
        return jobRecordRepository.findByScoreOrderByCreatedAtDesc(UNSCORED);
    }

    @Transactional(readOnly = true)
    public JobStats stats() {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            byStatus.put(status, jobRecordRepository.countByStatus(status));
        }
        Double average = jobRecordRepository.averageScore();
        return new JobStats(jobRecordRepository.count(), byStatus, average != null ? average : 0.0);
    }
}
