package dev.jobtracker.model;

import java.util.Map;

public record JobStats(long total, Map<JobStatus, Long> byStatus, double averageScore) {

    public long count(JobStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}
