package dev.jobtracker.parser;

import dev.jobtracker.model.SourceId;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses which source produced a piece of content. Advisory only: an explicit
 * source hint always wins over detection.
 */
@Component
public class SourceDetector {

    /**
     * Markers checked in order against lower-cased content; first match wins.
     */
    private static final List<Map.Entry<String, SourceId>> CONTENT_MARKERS = List.of(
            Map.entry("linkedin.com/jobs/view", SourceId.LINKEDIN),
            Map.entry("linkedin.com/comm/jobs", SourceId.LINKEDIN),
            Map.entry("indeed.com/viewjob", SourceId.INDEED),
            Map.entry("indeed.com/rc/clk", SourceId.INDEED),
            Map.entry("greenhouse.io", SourceId.GREENHOUSE),
            Map.entry("wellfound.com", SourceId.WELLFOUND),
            Map.entry("angel.co", SourceId.WELLFOUND),
            Map.entry("weworkremotely.com", SourceId.WEWORKREMOTELY));

    private static final List<Map.Entry<String, SourceId>> URL_MARKERS = List.of(
            Map.entry("linkedin.com", SourceId.LINKEDIN),
            Map.entry("indeed.com", SourceId.INDEED),
            Map.entry("weworkremotely.com", SourceId.WEWORKREMOTELY),
            Map.entry("greenhouse.io", SourceId.GREENHOUSE),
            Map.entry("wellfound.com", SourceId.WELLFOUND),
            Map.entry("angel.co", SourceId.WELLFOUND));

    public Optional<SourceId> detect(String rawContent) {
        return firstMatch(rawContent, CONTENT_MARKERS);
    }

    /**
     * Source of a single captured page, {@link SourceId#EXTENSION} when the host is not a known board.
     */
    public SourceId detectFromUrl(String url) {
        return firstMatch(url, URL_MARKERS).orElse(SourceId.EXTENSION);
    }

    private Optional<SourceId> firstMatch(String text, List<Map.Entry<String, SourceId>> markers) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, SourceId> marker : markers) {
            if (lower.contains(marker.getKey())) {
                return Optional.of(marker.getValue());
            }
        }
        return Optional.empty();
    }
}
