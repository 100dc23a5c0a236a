package dev.jobtracker;

import org.springframework.stereotype.Component;

/**
 * Ends the process once the scan is done. Skipped under a test runner so a
 * finished scan cannot kill the JVM running the tests.
 */
@Component
public class ExitManager {

  private static final String[] TEST_RUNNER_MARKERS = {"junit", "surefire", "intellij"};

  public void exit(int status) {
    if (!isTest()) {
      System.exit(status);
    }
  }

  protected boolean isTest() {
    String classPath = System.getProperty("java.class.path", "");
    for (String marker : TEST_RUNNER_MARKERS) {
      if (classPath.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
