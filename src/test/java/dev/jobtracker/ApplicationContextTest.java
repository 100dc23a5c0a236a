package dev.jobtracker;

import dev.jobtracker.model.SourceId;
import dev.jobtracker.parser.ParserRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private ScanRunner scanRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ParserRegistry parserRegistry;

  @Test
  void contextLoads() {
    assertThat(parserRegistry.listSources()).containsExactlyInAnyOrder(
        SourceId.LINKEDIN, SourceId.INDEED, SourceId.GREENHOUSE, SourceId.WELLFOUND, SourceId.WEWORKREMOTELY);
  }
}
