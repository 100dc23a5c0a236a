package dev.jobtracker.service;

import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.model.JobFieldUpdate;
import dev.jobtracker.model.JobStats;
import dev.jobtracker.model.JobStatus;
import dev.jobtracker.repository.JobRecordRepository;
import dev.jobtracker.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobTrackingServiceTest {

    @Mock
    private JobStore jobStore;

    @Mock
    private JobRecordRepository jobRecordRepository;

    @Captor
    private ArgumentCaptor<JobFieldUpdate> updateCaptor;

    private JobTrackingService service;

    @BeforeEach
    void setUp() {
        service = new JobTrackingService(jobStore, jobRecordRepository);
    }

    private static JobRecord job(String id, int score) {
        return JobRecord.builder().id(id).title("Engineer").company("Acme").score(score).status(JobStatus.NEW).build();
    }

    @Nested
    @DisplayName("Updates")
    class UpdateTests {

        @Test
        @DisplayName("Should change only the status")
        void shouldUpdateStatus() {
            when(jobStore.updateFields(eq("abc"), any())).thenReturn(true);

            assertThat(service.updateStatus("abc", JobStatus.APPLIED)).isTrue();

            verify(jobStore).updateFields(eq("abc"), updateCaptor.capture());
            JobFieldUpdate update = updateCaptor.getValue();
            assertThat(update.getStatus()).isEqualTo(JobStatus.APPLIED);
            assertThat(update.getScore()).isNull();
            assertThat(update.getCoverLetter()).isNull();
        }

        @Test
        @DisplayName("Should store score and analysis together")
        void shouldRecordAnalysis() {
            when(jobStore.updateFields(eq("abc"), any())).thenReturn(true);

            service.recordAnalysis("abc", 82, Map.of("fit", "strong"));

            verify(jobStore).updateFields(eq("abc"), updateCaptor.capture());
            assertThat(updateCaptor.getValue().getScore()).isEqualTo(82);
            assertThat(updateCaptor.getValue().getAnalysis()).containsEntry("fit", "strong");
            assertThat(updateCaptor.getValue().getStatus()).isNull();
        }

        @Test
        @DisplayName("Should report unknown jobs")
        void shouldReturnFalseForUnknownJob() {
            when(jobStore.updateFields(eq("missing"), any())).thenReturn(false);

            assertThat(service.saveCoverLetter("missing", "Dear team")).isFalse();
        }

        @Test
        @DisplayName("Should store notes")
        void shouldUpdateNotes() {
            when(jobStore.updateFields(eq("abc"), any())).thenReturn(true);

            service.updateNotes("abc", "Recruiter call on Friday");

            verify(jobStore).updateFields(eq("abc"), updateCaptor.capture());
            assertThat(updateCaptor.getValue().getNotes()).isEqualTo("Recruiter call on Friday");
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Should return only jobs with score zero as unscored")
        void shouldFindUnscored() {
            when(jobRecordRepository.findByScoreOrderByCreatedAtDesc(0)).thenReturn(List.of(job("b", 0)));

            assertThat(service.findUnscored()).extracting(JobRecord::getId).containsExactly("b");
            verify(jobRecordRepository, never()).search(any(), anyInt());
        }

        @Test
        @DisplayName("Should pass filters through to the repository")
        void shouldFindJobs() {
            when(jobRecordRepository.search(JobStatus.NEW, 50)).thenReturn(List.of(job("a", 90)));

            assertThat(service.findJobs(JobStatus.NEW, 50)).hasSize(1);
        }

        @Test
        @DisplayName("Should count jobs by status")
        void shouldComputeStats() {
            when(jobRecordRepository.countByStatus(any())).thenReturn(0L);
            when(jobRecordRepository.countByStatus(JobStatus.NEW)).thenReturn(3L);
            when(jobRecordRepository.countByStatus(JobStatus.APPLIED)).thenReturn(1L);
            when(jobRecordRepository.count()).thenReturn(4L);
            when(jobRecordRepository.averageScore()).thenReturn(42.5);

            JobStats stats = service.stats();

            assertThat(stats.total()).isEqualTo(4);
            assertThat(stats.count(JobStatus.NEW)).isEqualTo(3);
            assertThat(stats.count(JobStatus.APPLIED)).isEqualTo(1);
            assertThat(stats.count(JobStatus.REJECTED)).isZero();
            assertThat(stats.averageScore()).isEqualTo(42.5);
        }

        @Test
        @DisplayName("Should report zero average on an empty store")
        void shouldHandleEmptyStore() {
            when(jobRecordRepository.averageScore()).thenReturn(null);

            assertThat(service.stats().averageScore()).isZero();
        }
    }
}
