package dev.jobtracker.service;

import dev.jobtracker.entity.JobRecord;
import dev.jobtracker.metrics.IngestionMetrics;
import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.IngestionReport;
import dev.jobtracker.model.IngestionReport.SourceFailure;
import dev.jobtracker.model.RawContent;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.parser.JobParser;
import dev.jobtracker.parser.ParserRegistry;
import dev.jobtracker.parser.SourceDetector;
import dev.jobtracker.parser.SourceParseException;
import dev.jobtracker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw content into stored jobs: resolve the source, parse, drop in-batch
 * duplicates, then insert whatever the store does not hold yet.
 * <p>
 * Existing records are never modified here, so re-running ingestion over the same
 * content keeps every status, score, analysis and cover letter as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final SourceDetector sourceDetector;
    private final ParserRegistry parserRegistry;
    private final JobStore jobStore;
    private final IngestionMetrics metrics;

    /**
     * Ingest one piece of content.
     *
     * @return the records stored by this call
     * @throws UnrecognizedSourceException  if no parser could be selected
     * @throws SourceParseFailureException if the selected parser could not read the content
     */
    public List<JobRecord> ingest(RawContent content) {
        List<CanonicalJob> jobs = parse(content);
        metrics.recordJobsFound(jobs.size());
        return merge(dedupById(jobs));
    }

    /**
     * Ingest a batch. Content that cannot be recognized or parsed is reported in
     * {@link IngestionReport#failedSources()} and never stops the rest of the batch.
     */
    public IngestionReport ingestAll(List<RawContent> contents) {
        List<SourceFailure> failures = new ArrayList<>();
        List<CanonicalJob> parsed = parseAll(contents, failures);

        List<CanonicalJob> unique = dedupById(parsed);
        List<JobRecord> inserted = merge(unique);

        metrics.recordJobsFound(parsed.size());
        log.info("Ingestion: {} jobs found, {} unique, {} new, {} failed sources",
                parsed.size(), unique.size(), inserted.size(), failures.size());
        return new IngestionReport(parsed.size(), inserted, failures);
    }

    /**
     * Parse a batch without touching the store.
     */
    public IngestionReport preview(List<RawContent> contents) {
        List<SourceFailure> failures = new ArrayList<>();
        List<CanonicalJob> parsed = parseAll(contents, failures);
        List<CanonicalJob> unique = dedupById(parsed);
        unique.forEach(job -> log.info("  - [{}] {} @ {} ({})",
                job.getSource(), job.getTitle(), job.getCompany(), job.getUrl()));
        return new IngestionReport(parsed.size(), List.of(), failures);
    }

    /**
     * Resolve the parser for the content and run it. Any failure inside the parser
     * surfaces as {@link SourceParseFailureException}.
     */
    public List<CanonicalJob> parse(RawContent content) {
        JobParser parser = resolveParser(content);
        try {
            return parser.parse(content.content(), content.receivedAt());
        } catch (SourceParseException e) {
            throw new SourceParseFailureException(parser.sourceId(), content.origin(), e);
        } catch (RuntimeException e) {
            log.debug("{} parser failed unexpectedly on {}", parser.sourceId(), content.origin(), e);
            throw new SourceParseFailureException(parser.sourceId(), content.origin(), e);
        }
    }

    JobParser resolveParser(RawContent content) {
        String hint = content.sourceHint();
        if (hint != null && !hint.isBlank()) {
            Optional<JobParser> hinted = parserRegistry.get(hint);
            if (hinted.isPresent()) {
                return hinted.get();
            }
            log.debug("Source hint '{}' is not registered, falling back to detection", hint);
        }

        Optional<SourceId> detected = sourceDetector.detect(content.content());
        if (detected.isPresent()) {
            Optional<JobParser> parser = parserRegistry.get(detected.get());
            if (parser.isPresent()) {
                return parser.get();
            }
        }
        throw new UnrecognizedSourceException(content.origin());
    }

    private List<CanonicalJob> parseAll(List<RawContent> contents, List<SourceFailure> failures) {
        List<CanonicalJob> parsed = new ArrayList<>();
        for (RawContent content : contents) {
            try {
                parsed.addAll(parse(content));
            } catch (UnrecognizedSourceException e) {
                log.warn("Skipping content from {}: {}", content.label(), e.getMessage());
                failures.add(new SourceFailure(content.label(), "unrecognized source"));
                metrics.recordSourceFailure("unknown");
            } catch (SourceParseFailureException e) {
                log.warn("{}", e.getMessage());
                failures.add(new SourceFailure(content.label(), failureReason(e.getCause())));
                metrics.recordSourceFailure(e.getSourceId().id());
            }
        }
        return parsed;
    }

    private static String failureReason(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    /**
     * Collapse jobs sharing an id. The last occurrence wins; order of first appearance is kept.
     */
    static List<CanonicalJob> dedupById(List<CanonicalJob> jobs) {
        Map<String, CanonicalJob> byId = new LinkedHashMap<>();
        for (CanonicalJob job : jobs) {
            byId.put(job.getId(), job);
        }
        return new ArrayList<>(byId.values());
    }

    private List<JobRecord> merge(List<CanonicalJob> jobs) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        List<JobRecord> inserted = new ArrayList<>();
        for (CanonicalJob job : jobs) {
            JobRecord record = JobRecord.newFrom(job, now);
            if (jobStore.insertIfAbsent(record)) {
                inserted.add(record);
            }
        }
        metrics.recordJobsInserted(inserted.size());
        metrics.recordDuplicates(jobs.size() - inserted.size());
        return inserted;
    }
}
