package dev.jobtracker.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for ingestion runs.
 */
@Component
public class IngestionMetrics {

    private static final String TAG_SOURCE = "source";
    private final MeterRegistry registry;

    private final Counter jobsFoundCounter;
    private final Counter jobsInsertedCounter;
    private final Counter duplicatesCounter;
    private final Counter sourceFailuresCounter;
    private final Counter fetchFailuresCounter;

    private final ConcurrentHashMap<String, Timer> fetchTimers = new ConcurrentHashMap<>();

    private final AtomicInteger lastRunJobsFound = new AtomicInteger(0);
    private final AtomicInteger lastRunJobsNew = new AtomicInteger(0);
    private final AtomicInteger lastRunFailedSources = new AtomicInteger(0);

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.jobsFoundCounter = Counter.builder("ingest_jobs_found_total")
                .description("Jobs parsed from all sources")
                .register(registry);

        this.jobsInsertedCounter = Counter.builder("ingest_jobs_inserted_total")
                .description("Jobs stored for the first time")
                .register(registry);

        this.duplicatesCounter = Counter.builder("ingest_jobs_duplicate_total")
                .description("Parsed jobs that were already stored")
                .register(registry);

        this.sourceFailuresCounter = Counter.builder("ingest_source_failures_total")
                .description("Content that could not be recognized or parsed")
                .register(registry);

        this.fetchFailuresCounter = Counter.builder("ingest_fetch_failures_total")
                .description("Feed or mailbox fetches that failed")
                .register(registry);

        Gauge.builder("ingest_last_run_jobs_found", lastRunJobsFound, AtomicInteger::get)
                .description("Jobs found in last run")
                .register(registry);

        Gauge.builder("ingest_last_run_jobs_new", lastRunJobsNew, AtomicInteger::get)
                .description("New jobs stored in last run")
                .register(registry);

        Gauge.builder("ingest_last_run_failed_sources", lastRunFailedSources, AtomicInteger::get)
                .description("Sources that failed in last run")
                .register(registry);
    }

    public Timer getFetchTimer(String sourceName) {
        return fetchTimers.computeIfAbsent(sourceName, name ->
                Timer.builder("ingest_fetch_duration")
                        .description("Time to fetch raw content from a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    public void recordJobsFound(int count) {
        jobsFoundCounter.increment(count);
    }

    public void recordJobsInserted(int count) {
        jobsInsertedCounter.increment(count);
    }

    public void recordDuplicates(int count) {
        duplicatesCounter.increment(count);
    }

    /**
     * Record content from a source that could not be recognized or parsed.
     */
    public void recordSourceFailure(String source) {
        sourceFailuresCounter.increment();
        Counter.builder("ingest_source_failures_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    public void recordFetchFailure(String source) {
        fetchFailuresCounter.increment();
        Counter.builder("ingest_fetch_failures_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    public void recordCapture(String outcome) {
        Counter.builder("ingest_captures_total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordFetchLatency(String source, long latencyMs) {
        getFetchTimer(source).record(Duration.ofMillis(latencyMs));
    }

    public void updateLastRunStats(int found, int inserted, int failedSources) {
        lastRunJobsFound.set(found);
        lastRunJobsNew.set(inserted);
        lastRunFailedSources.set(failedSources);
    }
}
