package org.waabox.topicmirror.example.application;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import org.waabox.topicmirror.TopicMirror;
import org.waabox.topicmirror.TopicMirrorConfig;
import org.waabox.topicmirror.TopicPath;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/** Unit tests for {@link TopicController}.
 *
 * <p>Uses a real {@link LocalMessagingServer} and a started
 * {@link TopicMirror} over a temporary directory.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TopicControllerTest {

  @TempDir
  Path baseDirectory;

  /** Creates a started mirror on the cdn branch of the given server.
   *
   * @param server the server, never null
   * @return the started mirror, never null
   */
  private TopicMirror createMirror(final LocalMessagingServer server) {
    final TopicMirror mirror = TopicMirror.builder()
        .session(server.connect("control"))
        .config(TopicMirrorConfig.builder()
            .root("cdn")
            .baseDirectory(baseDirectory)
            .watchFileSystem(false)
            .build())
        .build();
    mirror.start();
    return mirror;
  }

  @Test
  void whenListing_givenPublishedTopic_shouldReturnRootAndTopics()
      throws Exception {
    Files.createDirectories(baseDirectory.resolve("cdn"));
    Files.writeString(baseDirectory.resolve("cdn/prices.json"),
        "{\"EURUSD\":1.08}", StandardCharsets.UTF_8);

    final LocalMessagingServer server = new LocalMessagingServer();
    try {
      final TopicMirror mirror = createMirror(server);
      mirror.onFileCreated(TopicPath.of("cdn/prices.json")).join();

      final TopicController controller = new TopicController(mirror, server);
      final Map<String, Object> result = controller.topics();

      assertEquals("cdn", result.get("root"));
      assertEquals(Set.of("cdn/prices.json"), result.get("topics"));
      mirror.stop();
    } finally {
      server.close();
    }
  }

  @Test
  void whenGettingValue_givenExistingTopic_shouldReturnIt()
      throws Exception {
    Files.createDirectories(baseDirectory.resolve("cdn"));
    Files.writeString(baseDirectory.resolve("cdn/prices.json"),
        "{\"EURUSD\":1.08}", StandardCharsets.UTF_8);

    final LocalMessagingServer server = new LocalMessagingServer();
    try {
      final TopicMirror mirror = createMirror(server);
      mirror.onFileCreated(TopicPath.of("cdn/prices.json")).join();

      final ResponseEntity<JsonNode> response =
          new TopicController(mirror, server).value("cdn/prices.json");

      assertEquals(HttpStatus.OK, response.getStatusCode());
      assertEquals(1.08, response.getBody().get("EURUSD").asDouble());
      mirror.stop();
    } finally {
      server.close();
    }
  }

  @Test
  void whenGettingValue_givenUnknownTopic_shouldReturnNotFound() {
    final LocalMessagingServer server = new LocalMessagingServer();
    try {
      final TopicMirror mirror = createMirror(server);

      final ResponseEntity<JsonNode> response =
          new TopicController(mirror, server).value("cdn/unknown.json");

      assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
      mirror.stop();
    } finally {
      server.close();
    }
  }

  @Test
  void whenCreating_givenNullArguments_shouldThrow() {
    final LocalMessagingServer server = new LocalMessagingServer();
    try {
      assertThrows(NullPointerException.class,
          () -> new TopicController(null, server));
    } finally {
      server.close();
    }
  }
}
