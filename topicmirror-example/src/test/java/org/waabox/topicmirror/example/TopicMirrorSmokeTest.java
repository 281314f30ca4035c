package org.waabox.topicmirror.example;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import org.waabox.topicmirror.TopicMirror;
import org.waabox.topicmirror.example.application.TopicController;
import org.waabox.topicmirror.example.application.TopicSubscriberRunner;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/** Smoke test that boots the example application over a temporary data
 * directory.
 *
 * <p>At startup the subscriber runner connects a trader session that
 * selects {@code cdn/prices.json}, and the role subscriber puts the same
 * session on {@code cdn/trader-news.json}. Neither topic exists before,
 * so both must be created on demand from their files.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class TopicMirrorSmokeTest {

  @TempDir
  static Path dataDirectory;

  @Autowired
  private LocalMessagingServer server;

  @Autowired
  private TopicMirror mirror;

  @Autowired
  private TopicController controller;

  @Autowired
  private TopicSubscriberRunner runner;

  @DynamicPropertySource
  static void topicMirrorProperties(final DynamicPropertyRegistry registry) {
    try {
      final Path cdn = Files.createDirectories(dataDirectory.resolve("cdn"));
      Files.writeString(cdn.resolve("prices.json"), "{\"EURUSD\":1.08}",
          StandardCharsets.UTF_8);
      Files.writeString(cdn.resolve("trader-news.json"),
          "{\"headline\":\"markets open\"}", StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
    registry.add("topicmirror.base-directory", dataDirectory::toString);
  }

  @Test
  void whenApplicationStarts_givenTraderSession_shouldCreateTopicsOnDemand() {
    server.awaitIdle();

    assertNotNull(runner.session());
    assertEquals(1, server.subscriberCount("cdn/prices.json"));
    assertEquals(1, server.subscriberCount("cdn/trader-news.json"));
    assertEquals("markets open", server.value("cdn/trader-news.json")
        .orElseThrow().get("headline").asText());

    final Map<String, Object> topics = controller.topics();
    assertEquals("cdn", topics.get("root"));
    assertEquals(Set.of("cdn/prices.json", "cdn/trader-news.json"),
        topics.get("topics"));
    assertEquals(dataDirectory.toAbsolutePath().normalize(),
        mirror.config().baseDirectory());
  }
}
