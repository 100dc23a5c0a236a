package dev.jobtracker.parser.impl;

import dev.jobtracker.config.IngestionProperties;
import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.parser.JobParser;
import dev.jobtracker.parser.SourceParseException;
import dev.jobtracker.util.FieldNormalizer;
import dev.jobtracker.util.JobIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * WeWorkRemotely RSS feeds. Item titles read {@code Company: Job Title}; every
 * listing is remote. Items published before the lookback window are dropped.
 */
@Slf4j
@Component
public class WeWorkRemotelyParser implements JobParser {

    public static final String DEFAULT_LOCATION = "Remote";
    static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final IngestionProperties properties;

    public WeWorkRemotelyParser(IngestionProperties properties) {
        this.properties = properties;
    }

    @Override
    public SourceId sourceId() {
        return SourceId.WEWORKREMOTELY;
    }

    @Override
    public List<CanonicalJob> parse(String rawContent, Instant receivedAt) throws SourceParseException {
        Document feed = parseFeed(rawContent);
        Instant cutoff = receivedAt.minus(Duration.ofDays(properties.getFeeds().getLookbackDays()));

        List<CanonicalJob> jobs = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        int stale = 0;

        for (Element item : feed.select("item")) {
            try {
                Optional<Instant> published = publishedAt(item);
                if (published.isPresent() && published.get().isBefore(cutoff)) {
                    stale++;
                    continue;
                }
                Optional<CanonicalJob> job = toJob(item, published.orElse(receivedAt));
                if (job.isPresent() && seenUrls.add(job.get().getUrl())) {
                    jobs.add(job.get());
                }
            } catch (RuntimeException e) {
                log.debug("{} - skipping malformed item: {}", sourceId(), e.getMessage());
            }
        }

        log.debug("{} - extracted {} jobs, {} older than {} days", sourceId(), jobs.size(), stale,
                properties.getFeeds().getLookbackDays());
        return jobs;
    }

    private Document parseFeed(String rawContent) throws SourceParseException {
        if (rawContent == null || rawContent.isBlank()) {
            throw new SourceParseException(sourceId(), "Empty feed document");
        }
        Document feed;
        try {
            feed = Jsoup.parse(rawContent, "", Parser.xmlParser());
        } catch (RuntimeException e) {
            throw new SourceParseException(sourceId(), "Unreadable feed: " + e.getMessage(), e);
        }
        if (feed.selectFirst("rss, channel, item") == null) {
            throw new SourceParseException(sourceId(), "Not an RSS document");
        }
        return feed;
    }

    private Optional<CanonicalJob> toJob(Element item, Instant publishedAt) {
        String rawTitle = childText(item, "title");
        String url = FieldNormalizer.cleanUrl(childText(item, "link"));
        if (rawTitle.isEmpty() || url.isEmpty()) {
            return Optional.empty();
        }

        String company = "";
        String title = rawTitle;
        int colon = rawTitle.indexOf(':');
        if (colon >= 0) {
            company = rawTitle.substring(0, colon);
            title = rawTitle.substring(colon + 1);
        }
        title = FieldNormalizer.cleanAndTruncate(title, CanonicalJob.MAX_TITLE_LENGTH);
        company = FieldNormalizer.cleanAndTruncate(company, CanonicalJob.MAX_COMPANY_LENGTH);
        if (title.isEmpty()) {
            return Optional.empty();
        }

        String description = FieldNormalizer.cleanAndTruncate(
                FieldNormalizer.stripHtml(childText(item, "description")), MAX_DESCRIPTION_LENGTH);
        String rawText = description.isEmpty() ? rawTitle : description;

        return Optional.of(CanonicalJob.builder()
                .id(JobIdGenerator.generateId(url, title, company))
                .title(title)
                .company(company)
                .location(DEFAULT_LOCATION)
                .url(url)
                .source(sourceId())
                .rawText(FieldNormalizer.cleanAndTruncate(rawText, CanonicalJob.MAX_RAW_TEXT_LENGTH))
                .description(description)
                .receivedAt(publishedAt)
                .build());
    }

    private Optional<Instant> publishedAt(Element item) {
        String pubDate = childText(item, "pubDate");
        if (pubDate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZonedDateTime.parse(pubDate, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("{} - unparseable pubDate '{}'", sourceId(), pubDate);
            return Optional.empty();
        }
    }

    private String childText(Element item, String tagName) {
        Element child = item.selectFirst(tagName);
        return child != null ? child.text().trim() : "";
    }
}
