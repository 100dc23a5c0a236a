package dev.jobtracker.service;

import dev.jobtracker.metrics.IngestionMetrics;
import dev.jobtracker.model.IngestionReport;
import dev.jobtracker.model.RawContent;
import dev.jobtracker.source.RawContentSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * One scan cycle: fetch every enabled content source concurrently, then ingest
 * everything that arrived.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanService {

    private static final String SEPARATOR = "========================================";

    private final List<RawContentSource> contentSources;
    private final IngestionPipeline ingestionPipeline;
    private final IngestionMetrics metrics;

    @Value("${scanner.dry-run:false}")
    private boolean dryRun;

    /**
     * Execute a full scan.
     *
     * @return counts of found and new jobs plus the sources that failed
     */
    public Mono<IngestionReport> runScan() {
        log.info(SEPARATOR);
        log.info("Job Ingest Scan Starting");
        log.info(SEPARATOR);
        log.info("Content sources configured: {}", contentSources.size());
        log.info("Dry run mode: {}", dryRun);

        return fetchAll()
                .collectList()
                .publishOn(Schedulers.boundedElastic())
                .map(contents -> {
                    log.info("Fetched {} documents", contents.size());
                    if (contents.isEmpty()) {
                        log.info("Nothing to ingest");
                        metrics.updateLastRunStats(0, 0, 0);
                        return IngestionReport.empty();
                    }

                    IngestionReport report = dryRun
                            ? ingestionPipeline.preview(contents)
                            : ingestionPipeline.ingestAll(contents);
                    logSummary(report);
                    metrics.updateLastRunStats(report.found(), report.newJobs(), report.failedSources().size());
                    return report;
                });
    }

    private Flux<RawContent> fetchAll() {
        return Flux.fromIterable(contentSources)
                .filter(RawContentSource::isEnabled)
                .flatMap(source -> {
                    log.info("Fetching from source: {}", source.getName());
                    return source.fetch()
                            .filter(content -> content.content() != null && !content.content().isBlank());
                });
    }

    private void logSummary(IngestionReport report) {
        log.info(SEPARATOR);
        log.info("SCAN SUMMARY: {} found, {} new", report.found(), report.newJobs());
        report.inserted().forEach(job -> log.info("  + [{}] {} @ {}",
                job.getSource(), job.getTitle(), job.getCompany()));
        if (report.hasFailures()) {
            log.warn("Failed sources: {}", report.failedSources().size());
            report.failedSources().forEach(failure -> log.warn("  ! {} - {}", failure.source(), failure.reason()));
        }
        log.info(SEPARATOR);
    }
}
