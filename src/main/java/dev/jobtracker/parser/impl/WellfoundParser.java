package dev.jobtracker.parser.impl;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.util.FieldNormalizer;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wellfound (formerly AngelList Talent) emails. Cards put the title on its own
 * line followed by {@code Company} and {@code Location · Salary · Equity} lines.
 */
@Component
public class WellfoundParser extends AbstractEmailParser {

    private static final Pattern JOB_LINK = Pattern.compile(
            "(wellfound\\.com|angel\\.co)/(company/[^/\\s]+/)?jobs/[^/?#\\s]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPANY_SLUG = Pattern.compile(
            "(?:wellfound\\.com|angel\\.co)/company/([^/?#\\s]+)/", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\s*[·•|]\\s*");
    private static final Set<String> CONTAINER_TAGS = Set.of("td", "div", "li", "tr");
    private static final int RAW_TEXT_LINES = 6;

    @Override
    public SourceId sourceId() {
        return SourceId.WELLFOUND;
    }

    @Override
    protected Pattern jobLinkPattern() {
        return JOB_LINK;
    }

    @Override
    protected Optional<CanonicalJob> extractJob(Element link, String url, String linkText, Instant receivedAt) {
        String title = extractTitle(link, linkText);
        if (title.length() < MIN_TITLE_LENGTH) {
            return Optional.empty();
        }

        String company = "";
        String location = "";
        String rawText = title;

        Optional<Element> container = findContainer(link, CONTAINER_TAGS);
        if (container.isPresent()) {
            List<String> lines = textLines(container.get());
            List<String> segments = segmentsAfterTitle(lines, title);
            company = segments.stream()
                    .filter(this::isCompanyCandidate)
                    .findFirst()
                    .orElse("");
            location = segments.stream()
                    .filter(this::looksLikeLocation)
                    .filter(segment -> !segment.equals(title))
                    .findFirst()
                    .orElse("");
            rawText = String.join(" ", lines.subList(0, Math.min(RAW_TEXT_LINES, lines.size())));
        }

        if (company.isEmpty()) {
            company = companyFromSlug(url);
        }

        return Optional.of(buildJob(url, title, company, location, rawText, receivedAt));
    }

    private List<String> segmentsAfterTitle(List<String> lines, String title) {
        List<String> segments = new ArrayList<>();
        boolean afterTitle = false;
        for (String line : lines) {
            if (afterTitle) {
                for (String segment : SEGMENT_SEPARATOR.split(line)) {
                    if (!segment.isBlank()) {
                        segments.add(segment.trim());
                    }
                }
            } else if (line.contains(title)) {
                afterTitle = true;
            }
        }
        return segments;
    }

    private boolean isCompanyCandidate(String segment) {
        String lower = segment.toLowerCase(Locale.ROOT);
        return segment.length() >= 2
                && !looksLikeLocation(segment)
                && !isSalaryLine(segment)
                && !isRatingLine(segment)
                && !lower.contains("equity")
                && !isExcluded(segment);
    }

    private String companyFromSlug(String url) {
        Matcher matcher = COMPANY_SLUG.matcher(url);
        if (matcher.find()) {
            return FieldNormalizer.formatCompanySlug(matcher.group(1));
        }
        return "";
    }
}
