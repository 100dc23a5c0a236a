package dev.jobtracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for raw-content sources and parsing.
 * Loaded from application.yml under 'ingestion' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    /**
     * Maximum number of feeds or files fetched at the same time.
     */
    private int concurrency = 3;

    private Feeds feeds = new Feeds();
    private Mailbox mailbox = new Mailbox();

    @Data
    public static class Feeds {
        private boolean enabled = true;
        private List<String> urls = new ArrayList<>();
        private int lookbackDays = 7;
        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * Directory of saved alert emails ({@code .html} bodies). A file named
     * {@code linkedin__2026-10-01.html} is parsed as LinkedIn without detection.
     */
    @Data
    public static class Mailbox {
        private boolean enabled = false;
        private String directory = "mailbox";
    }
}
