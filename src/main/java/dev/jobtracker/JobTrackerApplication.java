package dev.jobtracker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobTrackerApplication implements CommandLineRunner {

    private final ScanRunner scanRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobTrackerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            scanRunner.execute();
            log.info("Job Tracker exiting...");
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Job Tracker failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
