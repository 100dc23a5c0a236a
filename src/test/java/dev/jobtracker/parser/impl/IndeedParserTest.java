package dev.jobtracker.parser.impl;

import dev.jobtracker.model.CanonicalJob;
import dev.jobtracker.model.SourceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class IndeedParserTest {

    private static final Instant RECEIVED_AT = Instant.parse("2026-10-19T08:00:00Z");

    private final IndeedParser parser = new IndeedParser();

    @Nested
    @DisplayName("Alert digest")
    class DigestTests {

        @Test
        @DisplayName("Should extract title, company and location for each job")
        void shouldExtractJobsFromAlertDigest() throws Exception {
            List<CanonicalJob> jobs = parser.parse(Samples.load("indeed-alert.html"), RECEIVED_AT);

            assertThat(jobs)
                    .extracting(CanonicalJob::getTitle, CanonicalJob::getCompany, CanonicalJob::getLocation, CanonicalJob::getUrl)
                    .containsExactly(
                            tuple("Java Developer", "Initech", "Remote in Dallas, TX",
                                    "https://www.indeed.com/rc/clk?jk=5f3a9b2c1d0e7f68"),
                            tuple("Site Reliability Engineer", "Umbrella Labs", "New York, NY",
                                    "https://www.indeed.com/viewjob?jk=0a1b2c3d4e5f6789"));
            assertThat(jobs).extracting(CanonicalJob::getSource).containsOnly(SourceId.INDEED);
        }

        @Test
        @DisplayName("Should never use a salary line as location")
        void shouldNeverUseSalaryLineAsLocation() throws Exception {
            List<CanonicalJob> jobs = parser.parse(Samples.load("indeed-alert.html"), RECEIVED_AT);

            assertThat(jobs).extracting(CanonicalJob::getLocation).noneMatch(location -> location.contains("$"));
        }

        @Test
        @DisplayName("Should keep raw text bounded")
        void shouldKeepRawTextBounded() throws Exception {
            List<CanonicalJob> jobs = parser.parse(Samples.load("indeed-alert.html"), RECEIVED_AT);

            assertThat(jobs).allSatisfy(job -> {
                assertThat(job.getRawText()).isNotBlank();
                assertThat(job.getRawText().length()).isLessThanOrEqualTo(CanonicalJob.MAX_RAW_TEXT_LENGTH);
            });
        }
    }

    @Nested
    @DisplayName("Link filtering")
    class LinkFilteringTests {

        @Test
        @DisplayName("Should ignore links without a job key")
        void shouldIgnoreLinksWithoutJobKey() throws Exception {
            String html = "<div><a href=\"https://www.indeed.com/jobs?q=java\">More Java jobs near you</a></div>";

            assertThat(parser.parse(html, RECEIVED_AT)).isEmpty();
        }
    }
}
