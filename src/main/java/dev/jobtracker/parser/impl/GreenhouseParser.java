package dev.jobtracker.parser.impl;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.util.FieldNormalizer;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greenhouse job board notification emails. The company is taken from the board
 * slug in the posting URL when present, otherwise from a "... at Company" line.
 */
@Component
public class GreenhouseParser extends AbstractEmailParser {

    private static final Pattern JOB_LINK = Pattern.compile(
            "greenhouse\\.io/\\S*jobs/\\d+|[?&]gh_jid=\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern BOARD_SLUG = Pattern.compile(
            "(?:job-)?boards\\.greenhouse\\.io/([A-Za-z0-9_-]+)/jobs/", Pattern.CASE_INSENSITIVE);
    private static final Pattern AT_COMPANY = Pattern.compile("\\bat\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Set<String> CONTAINER_TAGS = Set.of("td", "div", "li", "tr");
    private static final int RAW_TEXT_LINES = 6;

    @Override
    public SourceId sourceId() {
        return SourceId.GREENHOUSE;
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

        String company = companyFromBoardSlug(url);
        String location = "";
        String rawText = title;

        Optional<Element> container = findContainer(link, CONTAINER_TAGS);
        if (container.isPresent()) {
            List<String> lines = textLines(container.get());
            if (company.isEmpty()) {
                company = companyFromAtLine(lines);
            }
            location = locationAfterTitle(lines, title);
            rawText = String.join(" ", lines.subList(0, Math.min(RAW_TEXT_LINES, lines.size())));
        }

        return Optional.of(buildJob(url, title, company, location, rawText, receivedAt));
    }

    private String companyFromBoardSlug(String url) {
        Matcher matcher = BOARD_SLUG.matcher(url);
        if (matcher.find()) {
            return FieldNormalizer.formatCompanySlug(matcher.group(1));
        }
        return "";
    }

    private String companyFromAtLine(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = AT_COMPANY.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return "";
    }

    private String locationAfterTitle(List<String> lines, String title) {
        boolean afterTitle = false;
        for (String line : lines) {
            if (afterTitle && looksLikeLocation(line)) {
                return line;
            }
            if (line.contains(title)) {
                afterTitle = true;
            }
        }
        return "";
    }
}
