package org.waabox.topicmirror;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.BooleanSupplier;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.TopicSpecification;
import org.waabox.topicmirror.session.TopicType;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

/**
 * Tests for {@link TopicMirror} driven by real file system events.
 *
 * <p>Files are mostly written next to the watched directory and moved in,
 * so the watcher never sees a half written file.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TopicMirrorWatchTest {

  /** How long to wait for the watcher, generous for polling watchers. */
  private static final long TIMEOUT_MILLIS = 30_000;

  @TempDir
  Path baseDirectory;

  private LocalMessagingServer server;

  private TopicMirror mirror;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(baseDirectory.resolve("cdn"));
    Files.createDirectories(baseDirectory.resolve("staging"));
    server = new LocalMessagingServer();
    final MessagingSession control = server.connect("control");
    control.set("cdn/a.json", JsonNodeFactory.instance.objectNode()
        .put("a", 1), TopicSpecification.of(TopicType.JSON)).join();
    Files.writeString(baseDirectory.resolve("cdn/a.json"), "{\"a\":1}",
        StandardCharsets.UTF_8);

    mirror = TopicMirror.builder()
        .session(control)
        .config(TopicMirrorConfig.builder()
            .root("cdn")
            .baseDirectory(baseDirectory)
            .build())
        .build();
    mirror.start();
  }

  @AfterEach
  void tearDown() {
    mirror.stop();
    server.close();
  }

  @Test
  void whenFileAppears_givenWatchedRoot_shouldCreateTopic() throws Exception {
    moveIn("b.json", "cdn/b.json", "{\"x\":1}");

    awaitTrue(() -> server.value("cdn/b.json").isPresent());

    assertEquals(1, server.value("cdn/b.json").get().get("x").asInt());
    awaitTrue(() -> mirror.trackedTopics().snapshot().contains("cdn/b.json"));
    assertTrue(mirror.trackedTopics().snapshot().contains("cdn/a.json"));
  }

  @Test
  void whenFileReplaced_givenTrackedTopic_shouldUpdateTopic()
      throws Exception {
    moveIn("a.json", "cdn/a.json", "{\"a\":2}");

    awaitTrue(() -> server.value("cdn/a.json")
        .map(value -> value.path("a").asInt() == 2)
        .orElse(false));
  }

  @Test
  void whenFileDeleted_givenTrackedTopic_shouldRemoveTopic()
      throws Exception {
    Files.delete(baseDirectory.resolve("cdn/a.json"));

    awaitTrue(() -> !server.value("cdn/a.json").isPresent());
    awaitTrue(() -> mirror.trackedTopics().size() == 0);
  }

  @Test
  void whenFileAppears_givenNewSubdirectory_shouldCreateNestedTopic()
      throws Exception {
    Files.createDirectories(baseDirectory.resolve("cdn/news"));
    moveIn("n.json", "cdn/news/n.json", "{\"n\":1}");

    awaitTrue(() -> server.value("cdn/news/n.json").isPresent());
  }

  @Test
  void whenFileWrittenInPlace_givenEmptyOnCreation_shouldCreateTopic()
      throws Exception {
    final Path file = baseDirectory.resolve("cdn/b.json");
    Files.createFile(file);
    // Lets the watcher see the empty file before it gets content.
    Thread.sleep(1500);
    Files.writeString(file, "{\"x\":1}", StandardCharsets.UTF_8);

    awaitTrue(() -> server.value("cdn/b.json").isPresent());

    assertEquals(1, server.value("cdn/b.json").get().get("x").asInt());
    awaitTrue(() -> mirror.trackedTopics().snapshot().contains("cdn/b.json"));
  }

  private void moveIn(final String name, final String target,
      final String content) throws Exception {
    final Path staged = baseDirectory.resolve("staging").resolve(name);
    Files.writeString(staged, content, StandardCharsets.UTF_8);
    Files.move(staged, baseDirectory.resolve(target),
        StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
  }

  private static void awaitTrue(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("Condition not met within "
            + TIMEOUT_MILLIS + "ms");
      }
      Thread.sleep(50);
    }
  }
}
