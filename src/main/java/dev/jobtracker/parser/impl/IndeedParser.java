package dev.jobtracker.parser.impl;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Indeed job alert emails. Cards list title, rating, company, location and salary
 * on separate lines in no guaranteed order, so company and location are found by
 * scanning the lines that follow the title.
 */
@Component
public class IndeedParser extends AbstractEmailParser {

    private static final Pattern JOB_LINK = Pattern.compile("indeed\\.com.*(jk=|vjk=)[a-f0-9]+", Pattern.CASE_INSENSITIVE);
    private static final Set<String> CONTAINER_TAGS = Set.of("td", "div", "li");
    private static final int MIN_LINK_TEXT_LENGTH = 5;
    private static final int COMPANY_SCAN_LINES = 3;
    private static final int LOCATION_SCAN_LINES = 2;
    private static final int RAW_TEXT_LINES = 6;

    @Override
    public SourceId sourceId() {
        return SourceId.INDEED;
    }

    @Override
    protected Pattern jobLinkPattern() {
        return JOB_LINK;
    }

    @Override
    protected Optional<CanonicalJob> extractJob(Element link, String url, String linkText, Instant receivedAt) {
        if (linkText.length() < MIN_LINK_TEXT_LENGTH) {
            return Optional.empty();
        }

        String title = linkText;
        String company = "";
        String location = "";
        String rawText = linkText;

        Optional<Element> container = findContainer(link, CONTAINER_TAGS);
        if (container.isPresent()) {
            List<String> lines = textLines(container.get());
            int titleLine = findTitleLine(lines, title);
            if (titleLine >= 0) {
                int companyLine = findCompanyLine(lines, titleLine);
                if (companyLine >= 0) {
                    company = lines.get(companyLine);
                    location = findLocation(lines, companyLine);
                }
            }
            rawText = String.join(" ", lines.subList(0, Math.min(RAW_TEXT_LINES, lines.size())));
        }

        return Optional.of(buildJob(url, title, company, location, rawText, receivedAt));
    }

    private int findTitleLine(List<String> lines, String title) {
        for (int i = 0; i < lines.size() - 1; i++) {
            String line = lines.get(i);
            if (!isRatingLine(line) && line.contains(title)) {
                return i;
            }
        }
        return -1;
    }

    private int findCompanyLine(List<String> lines, int titleLine) {
        int end = Math.min(titleLine + 1 + COMPANY_SCAN_LINES, lines.size());
        for (int j = titleLine + 1; j < end; j++) {
            String candidate = lines.get(j);
            if (!isRatingLine(candidate) && !candidate.contains("$")) {
                return j;
            }
        }
        return -1;
    }

    private String findLocation(List<String> lines, int companyLine) {
        int end = Math.min(companyLine + 1 + LOCATION_SCAN_LINES, lines.size());
        for (int k = companyLine + 1; k < end; k++) {
            String candidate = lines.get(k);
            if (!isSalaryLine(candidate) && looksLikeLocation(candidate)) {
                return candidate;
            }
        }
        return "";
    }
}
