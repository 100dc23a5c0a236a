package dev.jobtracker;

import dev.jobtracker.model.IngestionReport;
import dev.jobtracker.service.ScanService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs one scan cycle and blocks until it finishes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanRunner {

  private static final String SEPARATOR = "========================================";

  private final ScanService scanService;

  @Value("${scanner.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes the scan and handles the post-execution wait.
   *
   * @return the scan report, empty when the scan produced nothing
   */
  public IngestionReport execute() {
    log.info(SEPARATOR);
    log.info("Job Tracker Starting");
    log.info(SEPARATOR);

    try {
      IngestionReport report = scanService.runScan().block();
      if (report == null) {
        report = IngestionReport.empty();
      }

      log.info(SEPARATOR);
      log.info("Job Tracker Completed");
      log.info("Jobs found: {}, new: {}, failed sources: {}",
          report.found(), report.newJobs(), report.failedSources().size());
      log.info(SEPARATOR);

      handleMetricsWait();

      return report;
    } catch (Exception e) {
      log.error("Job Tracker scan failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Scan execution failed", e);
    }
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
