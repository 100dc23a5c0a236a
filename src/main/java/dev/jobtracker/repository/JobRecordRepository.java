package dev.jobtracker.repository;

import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for stored jobs, keyed by content-addressed job id.
 */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    /**
     * Insert the job unless a row with the same id exists, as one statement.
     *
     * @return 1 if inserted, 0 if the id was already taken
     */
    @Modifying
    @Query(value = """
            INSERT INTO jobs (job_id, title, company, location, url, source, raw_text, description,
                              status, score, received_at, created_at, updated_at)
            VALUES (:#{#job.id}, :#{#job.title}, :#{#job.company}, :#{#job.location}, :#{#job.url},
                    :#{#job.source.name()}, :#{#job.rawText}, :#{#job.description},
                    :#{#job.status.name()}, :#{#job.score}, :#{#job.receivedAt}, :#{#job.createdAt},
                    :#{#job.updatedAt})
            ON CONFLICT (job_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("job") JobRecord job);

    /**
     * Fill description and raw text only when no description is stored yet.
     */
    @Modifying
    @Query("""
            UPDATE JobRecord j SET j.description = :description, j.rawText = :rawText, j.updatedAt = :now
            WHERE j.id = :id AND (j.description IS NULL OR j.description = '')
            """)
    int fillBlankDescription(@Param("id") String id, @Param("description") String description,
                             @Param("rawText") String rawText, @Param("now") LocalDateTime now);

    @Modifying
    @Query("""
            UPDATE JobRecord j SET j.location = :location, j.updatedAt = :now
            WHERE j.id = :id AND (j.location IS NULL OR j.location = '')
            """)
    int fillBlankLocation(@Param("id") String id, @Param("location") String location,
                          @Param("now") LocalDateTime now);

    /**
     * Jobs with the given status (any status when null) and at least the given score, best first.
     */
    @Query("""
            SELECT j FROM JobRecord j
            WHERE (:status IS NULL OR j.status = :status) AND j.score >= :minScore
            ORDER BY j.score DESC, j.createdAt DESC
            """)
    List<JobRecord> search(@Param("status") JobStatus status, @Param("minScore") int minScore);

    /**
     * Jobs the scoring stage has not reached yet, newest first.
     */
    List<JobRecord> findByScoreOrderByCreatedAtDesc(int score);

    long countByStatus(JobStatus status);

    @Query("SELECT AVG(j.score) FROM JobRecord j")
    Double averageScore();
}
