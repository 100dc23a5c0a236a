package dev.jobtracker.parser.impl;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;
import dev.jobtracker.util.FieldNormalizer;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * LinkedIn job alert emails. Each card renders as
 * {@code Title · Company · Location} inside the cell holding the job link.
 */
@Component
public class LinkedInParser extends AbstractEmailParser {

    private static final Pattern JOB_LINK = Pattern.compile("linkedin\\.com/(comm/)?jobs/view", Pattern.CASE_INSENSITIVE);
    private static final Set<String> CONTAINER_TAGS = Set.of("td", "div", "tr");
    private static final String SEGMENT_SEPARATOR = "·";

    @Override
    public SourceId sourceId() {
        return SourceId.LINKEDIN;
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
            rawText = FieldNormalizer.cleanText(container.get().text());
            String[] segments = rawText.split(SEGMENT_SEPARATOR);
            if (segments.length > 1) {
                company = segments[1];
            }
            if (segments.length > 2) {
                location = segments[2];
            }
        }

        return Optional.of(buildJob(url, title, company, location, rawText, receivedAt));
    }
}
