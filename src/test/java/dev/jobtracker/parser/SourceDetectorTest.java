package dev.jobtracker.parser;

import dev.jobtracker.model.SourceId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SourceDetectorTest {

    private final SourceDetector detector = new SourceDetector();

    @ParameterizedTest
    @CsvSource({
            "'<a href=\"https://www.linkedin.com/jobs/view/1\">x</a>', LINKEDIN",
            "'<a href=\"https://www.LinkedIn.com/comm/jobs/view/1\">x</a>', LINKEDIN",
            "'<a href=\"https://www.indeed.com/viewjob?jk=abc\">x</a>', INDEED",
            "'<a href=\"https://www.indeed.com/rc/clk?jk=abc\">x</a>', INDEED",
            "'<a href=\"https://boards.greenhouse.io/acme/jobs/1\">x</a>', GREENHOUSE",
            "'<a href=\"https://wellfound.com/jobs/1-x\">x</a>', WELLFOUND",
            "'<a href=\"https://angel.co/company/x/jobs/1\">x</a>', WELLFOUND",
            "'<rss><channel><link>https://weworkremotely.com/</link></channel></rss>', WEWORKREMOTELY"
    })
    void shouldDetectSourceFromMarkers(String content, SourceId expected) {
        assertThat(detector.detect(content)).contains(expected);
    }

    @Test
    void shouldReturnFirstMatchInTableOrder() {
        String content = "<a href=\"https://boards.greenhouse.io/acme/jobs/1\">a</a>"
                + "<a href=\"https://www.linkedin.com/jobs/view/2\">b</a>";

        assertThat(detector.detect(content)).contains(SourceId.LINKEDIN);
    }

    @Test
    void shouldReturnEmptyWhenNoMarkerMatches() {
        assertThat(detector.detect("<p>Your order has shipped</p>")).isEmpty();
        assertThat(detector.detect("")).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }

    @Test
    void shouldDetectCaptureSourceFromUrl() {
        assertThat(detector.detectFromUrl("https://www.linkedin.com/jobs/view/1/")).isEqualTo(SourceId.LINKEDIN);
        assertThat(detector.detectFromUrl("https://job-boards.greenhouse.io/acme/jobs/1")).isEqualTo(SourceId.GREENHOUSE);
        assertThat(detector.detectFromUrl("https://jobs.lever.co/acme/123")).isEqualTo(SourceId.EXTENSION);
        assertThat(detector.detectFromUrl(null)).isEqualTo(SourceId.EXTENSION);
    }
}
