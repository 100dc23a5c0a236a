package dev.jobtracker.service;

import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.metrics.IngestionMetrics;
import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.CaptureRequest;
import dev.jobtracker.model.CaptureResult;
import dev.jobtracker.model.CaptureResult.Outcome;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.parser.SourceDetector;
import dev.jobtracker.store.JobStore;
import dev.jobtracker.util.FieldNormalizer;
import dev.jobtracker.util.JobIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Stores a single listing captured from a job page by the browser extension.
 * Skips the parsers but shares identity and insert-if-absent with ingestion; a
 * repeat capture may only fill fields that are still blank.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaptureService {

    static final String DEFAULT_LOCATION = "Remote";
    static final int MAX_DESCRIPTION_LENGTH = 5000;
    static final int MAX_CAPTURED_RAW_TEXT_LENGTH = 2000;

    private final SourceDetector sourceDetector;
    private final JobStore jobStore;
    private final IngestionMetrics metrics;

    /**
     * @throws IllegalArgumentException if url or title is missing
     */
    public CaptureResult capture(CaptureRequest request) {
        CanonicalJob job = toCanonicalJob(request);

        CaptureResult result;
        if (jobStore.insertIfAbsent(JobRecord.newFrom(job, LocalDateTime.now(ZoneOffset.UTC)))) {
            log.info("Captured new job {} '{}' @ {}", job.getId(), job.getTitle(), job.getCompany());
            result = new CaptureResult(Outcome.CREATED, job.getId());
        } else if (jobStore.enrichBlankFields(job.getId(), job.getDescription(), job.getRawText(), job.getLocation())) {
            log.info("Filled blank fields of job {} from capture", job.getId());
            result = new CaptureResult(Outcome.UPDATED, job.getId());
        } else {
            log.debug("Capture of job {} added nothing new", job.getId());
            result = new CaptureResult(Outcome.UNCHANGED, job.getId());
        }

        metrics.recordCapture(result.outcome().name().toLowerCase());
        return result;
    }

    CanonicalJob toCanonicalJob(CaptureRequest request) {
        String url = FieldNormalizer.cleanUrl(request.getUrl());
        String title = FieldNormalizer.cleanAndTruncate(request.getTitle(), CanonicalJob.MAX_TITLE_LENGTH);
        if (url.isEmpty() || title.isEmpty()) {
            throw new IllegalArgumentException("url and title required");
        }

        String company = FieldNormalizer.cleanAndTruncate(request.getCompany(), CanonicalJob.MAX_COMPANY_LENGTH);
        if (company.isEmpty()) {
            company = CanonicalJob.UNKNOWN_COMPANY;
        }
        String location = FieldNormalizer.cleanAndTruncate(request.getLocation(), CanonicalJob.MAX_LOCATION_LENGTH);
        if (location.isEmpty()) {
            location = DEFAULT_LOCATION;
        }
        String description = FieldNormalizer.truncate(
                request.getDescription() != null ? request.getDescription().trim() : "", MAX_DESCRIPTION_LENGTH);

        return CanonicalJob.builder()
                .id(JobIdGenerator.generateId(url, title, company))
                .title(title)
                .company(company)
                .location(location)
                .url(url)
                .source(resolveSource(url, request.getSource()))
                .description(description)
                .rawText(FieldNormalizer.cleanAndTruncate(description, MAX_CAPTURED_RAW_TEXT_LENGTH))
                .receivedAt(Instant.now())
                .build();
    }

    private SourceId resolveSource(String url, String declaredSource) {
        SourceId detected = sourceDetector.detectFromUrl(url);
        if (detected != SourceId.EXTENSION) {
            return detected;
        }
        return SourceId.fromId(declaredSource).orElse(SourceId.EXTENSION);
    }
}
