package dev.jobtracker.source.impl;

import dev.jobtracker.config.IngestionProperties;
import dev.jobtracker.metrics.IngestionMetrics;
import dev.jobtracker.model.RawContent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;

class MailboxExportSourceTest {

  @TempDir
  Path mailbox;

  private IngestionProperties properties;
  private MailboxExportSource source;

  @BeforeEach
  void setUp() {
    properties = new IngestionProperties();
    properties.getMailbox().setEnabled(true);
    properties.getMailbox().setDirectory(mailbox.toString());
    source = new MailboxExportSource(properties, new IngestionMetrics(new SimpleMeterRegistry()));
  }

  @Test
  void shouldReadSavedHtmlEmails() throws IOException {
    Path linkedin = Files.writeString(mailbox.resolve("linkedin__2026-10-18.html"), "<p>alert</p>");
    Files.setLastModifiedTime(linkedin, FileTime.from(Instant.parse("2026-10-18T07:30:00Z")));
    Files.writeString(mailbox.resolve("digest.htm"), "<p>digest</p>");
    Files.writeString(mailbox.resolve("notes.txt"), "ignored");

    StepVerifier.create(source.fetch().collectSortedList(Comparator.comparing(RawContent::origin)))
        .assertNext(contents -> {
          assertThat(contents).extracting(RawContent::origin)
              .containsExactly("digest.htm", "linkedin__2026-10-18.html");
          assertThat(contents.get(0).sourceHint()).isNull();
          assertThat(contents.get(1).sourceHint()).isEqualTo("linkedin");
          assertThat(contents.get(1).receivedAt()).isEqualTo(Instant.parse("2026-10-18T07:30:00Z"));
          assertThat(contents.get(1).content()).isEqualTo("<p>alert</p>");
        })
        .verifyComplete();
  }

  @Test
  void shouldCompleteEmptyWhenDirectoryIsMissing() {
    properties.getMailbox().setDirectory(mailbox.resolve("absent").toString());

    StepVerifier.create(source.fetch()).verifyComplete();
  }

  @Test
  void shouldOnlyHintRegisteredSourcePrefixes() {
    assertThat(MailboxExportSource.sourceHint(Path.of("Indeed__42.html"))).isEqualTo("indeed");
    assertThat(MailboxExportSource.sourceHint(Path.of("glassdoor__42.html"))).isNull();
    assertThat(MailboxExportSource.sourceHint(Path.of("__42.html"))).isNull();
    assertThat(MailboxExportSource.sourceHint(Path.of("alert.html"))).isNull();
    assertThat(source.getName()).isEqualTo("Mailbox");
  }
}
