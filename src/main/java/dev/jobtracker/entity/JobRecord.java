package dev.jobtracker.entity;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.JobStatus;
import dev.jobtracker.model.SourceId;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Stored job. Listing fields are written once on insert; status, score, analysis,
 * cover letter and notes belong to users and downstream stages.
 * Timestamps are UTC.
 */
@Data
@Entity
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_status", columnList = "status"),
        @Index(name = "idx_jobs_score", columnList = "score")
})
public class JobRecord {

    @Id
    @Column(name = "job_id", length = 16)
    private String id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 100)
    private String company;

    @Column(length = 100)
    private String location;

    @Column(nullable = false, length = 2048)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SourceId source;

    @Column(length = 2000)
    private String rawText;

    @Column(length = 5000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status;

    @Column(nullable = false)
    private int score;

    @Column(columnDefinition = "TEXT")
    private String analysis;

    @Column(columnDefinition = "TEXT")
    private String coverLetter;

    @Column(columnDefinition = "TEXT")
    private String notes;

    private LocalDateTime receivedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /**
     * First-insert record for a parsed or captured job: status new, score 0, both
     * timestamps set to {@code now}.
     */
    public static JobRecord newFrom(CanonicalJob job, LocalDateTime now) {
        return JobRecord.builder()
                .id(job.getId())
                .title(job.getTitle())
                .company(job.getCompany())
                .location(job.getLocation())
                .url(job.getUrl())
                .source(job.getSource())
                .rawText(job.getRawText())
                .description(job.getDescription())
                .status(JobStatus.NEW)
                .score(0)
                .receivedAt(job.getReceivedAt() != null
                        ? LocalDateTime.ofInstant(job.getReceivedAt(), ZoneOffset.UTC)
                        : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
