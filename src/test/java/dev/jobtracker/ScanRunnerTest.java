package dev.jobtracker;

import dev.jobtracker.model.IngestionReport;
import dev.jobtracker.model.IngestionReport.SourceFailure;
import dev.jobtracker.service.ScanService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScanRunnerTest {

  @Mock
  private ScanService scanService;

  @InjectMocks
  private ScanRunner scanRunner;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(scanRunner, "metricsWaitSeconds", 0);
  }

  @Test
  void execute_successfulRun_returnsReport() {
    // Arrange
    IngestionReport report = new IngestionReport(5, List.of(), List.of(new SourceFailure("feed", "timeout")));
    when(scanService.runScan()).thenReturn(Mono.just(report));

    // Act
    IngestionReport result = scanRunner.execute();

    // Assert
    assertSame(report, result);
    verify(scanService).runScan();
  }

  @Test
  void execute_emptyMono_returnsEmptyReport() {
    // Arrange
    when(scanService.runScan()).thenReturn(Mono.empty());

    // Act
    IngestionReport result = scanRunner.execute();

    // Assert
    assertEquals(0, result.found());
    assertEquals(0, result.newJobs());
  }

  @Test
  void execute_serviceFails_throwsIllegalState() {
    // Arrange
    when(scanService.runScan()).thenReturn(Mono.error(new RuntimeException("disk full")));

    // Act & Assert
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> scanRunner.execute());
    assertEquals("Scan execution failed", e.getMessage());
  }

  @Test
  void execute_withWait_completes() {
    ReflectionTestUtils.setField(scanRunner, "metricsWaitSeconds", 1);
    when(scanService.runScan()).thenReturn(Mono.just(IngestionReport.empty()));

    scanRunner.execute();

    verify(scanService).runScan();
  }
}
