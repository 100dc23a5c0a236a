package dev.jobtracker.parser.impl;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.parser.JobParser;
import dev.jobtracker.parser.SourceParseException;
import dev.jobtracker.util.FieldNormalizer;
import dev.jobtracker.util.JobIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared traversal for job alert emails: find anchors pointing at a job posting,
 * drop boilerplate links and repeats, and hand each remaining anchor to the
 * source-specific extraction.
 */
@Slf4j
public abstract class AbstractEmailParser implements JobParser {

    protected static final int MIN_TITLE_LENGTH = 3;

    /**
     * Link text that never names a job. Matched as plain substrings of the lower-cased text.
     */
    protected static final List<String> EXCLUDED_LINK_TEXT = List.of(
            "unsubscribe", "view all", "see all", "see more jobs", "view more jobs", "homepage",
            "messages", "notifications", "easily apply", "responsive employer", "manage alerts",
            "job alert settings", "privacy policy", "help center", "view in browser");

    protected static final Pattern RATING_LINE = Pattern.compile("^\\d+\\.?\\d*\\s*\\d");

    private static final Pattern STATE_CODE = Pattern.compile(
            "\\b(AL|AZ|CA|CO|CT|DC|FL|GA|IL|MA|MD|MI|MN|NC|NJ|NY|OH|OR|PA|TX|UT|VA|WA|WI)\\b");

    private static final Pattern CURRENCY = Pattern.compile("[$€£]");

    /**
     * Pattern an anchor's href must match to be considered a job link.
     */
    protected abstract Pattern jobLinkPattern();

    /**
     * Build a job from one accepted anchor, or empty if the anchor turns out not to describe a job.
     *
     * @param link       the job anchor
     * @param url        cleaned posting URL
     * @param linkText   cleaned anchor text
     * @param receivedAt when the email was received
     */
    protected abstract Optional<CanonicalJob> extractJob(Element link, String url, String linkText, Instant receivedAt);

    @Override
    public List<CanonicalJob> parse(String rawContent, Instant receivedAt) throws SourceParseException {
        Document document = parseDocument(rawContent);

        List<CanonicalJob> jobs = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();

        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            if (!jobLinkPattern().matcher(href).find()) {
                continue;
            }

            String url = FieldNormalizer.cleanUrl(href);
            if (url.isEmpty() || seenUrls.contains(url)) {
                continue;
            }

            String linkText = FieldNormalizer.cleanText(link.text());
            if (isExcluded(linkText)) {
                log.debug("{} - skipping boilerplate link '{}'", sourceId(), linkText);
                continue;
            }

            try {
                Optional<CanonicalJob> job = extractJob(link, url, linkText, receivedAt);
                if (job.isPresent()) {
                    seenUrls.add(url);
                    jobs.add(job.get());
                }
            } catch (RuntimeException e) {
                log.debug("{} - skipping malformed listing {}: {}", sourceId(), url, e.getMessage());
            }
        }

        log.debug("{} - extracted {} jobs", sourceId(), jobs.size());
        return jobs;
    }

    protected Document parseDocument(String rawContent) throws SourceParseException {
        if (rawContent == null) {
            throw new SourceParseException(sourceId(), "No content to parse");
        }
        try {
            return Jsoup.parse(rawContent);
        } catch (RuntimeException e) {
            throw new SourceParseException(sourceId(), "Unreadable HTML: " + e.getMessage(), e);
        }
    }

    protected boolean isExcluded(String linkText) {
        String lower = linkText.toLowerCase(Locale.ROOT);
        return EXCLUDED_LINK_TEXT.stream().anyMatch(lower::contains);
    }

    /**
     * Title from the first heading-like descendant, falling back to the whole anchor text.
     */
    protected String extractTitle(Element link, String linkText) {
        Element heading = link.selectFirst("h1, h2, h3, h4, strong, span");
        if (heading != null) {
            String headingText = FieldNormalizer.cleanText(heading.text());
            if (!headingText.isEmpty()) {
                return headingText;
            }
        }
        return linkText;
    }

    /**
     * Nearest ancestor with one of the given tag names.
     */
    protected Optional<Element> findContainer(Element link, Set<String> tagNames) {
        for (Element parent : link.parents()) {
            if (tagNames.contains(parent.normalName())) {
                return Optional.of(parent);
            }
        }
        return Optional.empty();
    }

    /**
     * One cleaned line per text node in the container, skipping fragments of two characters or fewer.
     */
    protected List<String> textLines(Element container) {
        List<String> lines = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                String line = FieldNormalizer.cleanText(((TextNode) node).getWholeText());
                if (line.length() > 2) {
                    lines.add(line);
                }
            }
        }, container);
        return lines;
    }

    protected boolean isRatingLine(String line) {
        return RATING_LINE.matcher(line).find();
    }

    protected boolean isSalaryLine(String line) {
        return CURRENCY.matcher(line).find();
    }

    protected boolean looksLikeLocation(String line) {
        return line.toLowerCase(Locale.ROOT).contains("remote")
                || line.contains(",")
                || STATE_CODE.matcher(line).find();
    }

    /**
     * Build the job with every text field cleaned, clamped and the identity assigned.
     */
    protected CanonicalJob buildJob(String url, String title, String company, String location,
                                    String rawText, Instant receivedAt) {
        String cleanTitle = FieldNormalizer.cleanAndTruncate(title, CanonicalJob.MAX_TITLE_LENGTH);
        String cleanCompany = FieldNormalizer.cleanAndTruncate(company, CanonicalJob.MAX_COMPANY_LENGTH);
        if (cleanCompany.isEmpty()) {
            cleanCompany = CanonicalJob.UNKNOWN_COMPANY;
        }

        return CanonicalJob.builder()
                .id(JobIdGenerator.generateId(url, cleanTitle, cleanCompany))
                .title(cleanTitle)
                .company(cleanCompany)
                .location(FieldNormalizer.cleanAndTruncate(location, CanonicalJob.MAX_LOCATION_LENGTH))
                .url(url)
                .source(sourceId())
                .rawText(FieldNormalizer.cleanAndTruncate(rawText, CanonicalJob.MAX_RAW_TEXT_LENGTH))
                .receivedAt(receivedAt)
                .build();
    }
}
