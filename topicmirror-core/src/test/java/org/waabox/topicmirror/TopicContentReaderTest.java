package org.waabox.topicmirror;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link TopicContentReader}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TopicContentReaderTest {

  @Test
  void whenReading_givenJsonFile_shouldReturnDocument(
      @TempDir final Path tempDir) throws Exception {
    Files.createDirectories(tempDir.resolve("cdn"));
    Files.writeString(tempDir.resolve("cdn/a.json"), "{\"x\":1}",
        StandardCharsets.UTF_8);

    final JsonNode node = new TopicContentReader(tempDir)
        .read(TopicPath.of("cdn/a.json"));

    assertEquals(1, node.get("x").asInt());
  }

  @Test
  void whenReading_givenMissingFile_shouldThrowNoSuchFile(
      @TempDir final Path tempDir) {
    final TopicContentReader reader = new TopicContentReader(tempDir);

    assertThrows(NoSuchFileException.class,
        () -> reader.read(TopicPath.of("cdn/missing.json")));
  }

  @Test
  void whenReading_givenDirectory_shouldThrowNoSuchFile(
      @TempDir final Path tempDir) throws Exception {
    Files.createDirectories(tempDir.resolve("cdn"));
    final TopicContentReader reader = new TopicContentReader(tempDir);

    assertThrows(NoSuchFileException.class,
        () -> reader.read(TopicPath.of("cdn")));
  }

  @Test
  void whenReading_givenInvalidJson_shouldThrowMalformedContent(
      @TempDir final Path tempDir) throws Exception {
    Files.createDirectories(tempDir.resolve("cdn"));
    Files.writeString(tempDir.resolve("cdn/bad.json"), "{\"x\":",
        StandardCharsets.UTF_8);
    final TopicContentReader reader = new TopicContentReader(tempDir);

    final MalformedTopicContentException e = assertThrows(
        MalformedTopicContentException.class,
        () -> reader.read(TopicPath.of("cdn/bad.json")));
    assertEquals("Content of cdn/bad.json is not valid JSON",
        e.getMessage());
  }

  @Test
  void whenReading_givenEmptyFile_shouldThrowMalformedContent(
      @TempDir final Path tempDir) throws Exception {
    Files.createDirectories(tempDir.resolve("cdn"));
    Files.createFile(tempDir.resolve("cdn/empty.json"));
    final TopicContentReader reader = new TopicContentReader(tempDir);

    assertThrows(MalformedTopicContentException.class,
        () -> reader.read(TopicPath.of("cdn/empty.json")));
  }

  @Test
  void whenReading_givenTrailingContent_shouldThrowMalformedContent(
      @TempDir final Path tempDir) throws Exception {
    Files.createDirectories(tempDir.resolve("cdn"));
    Files.writeString(tempDir.resolve("cdn/t.json"), "{\"x\":1} not json",
        StandardCharsets.UTF_8);
    Files.writeString(tempDir.resolve("cdn/two.json"), "{\"x\":1} {}",
        StandardCharsets.UTF_8);
    final TopicContentReader reader = new TopicContentReader(tempDir);

    assertThrows(MalformedTopicContentException.class,
        () -> reader.read(TopicPath.of("cdn/t.json")));
    assertThrows(MalformedTopicContentException.class,
        () -> reader.read(TopicPath.of("cdn/two.json")));
  }

  @Test
  void whenCheckingExistence_givenFileAndDirectory_shouldOnlyAcceptFile(
      @TempDir final Path tempDir) throws Exception {
    Files.createDirectories(tempDir.resolve("cdn"));
    Files.writeString(tempDir.resolve("cdn/a.json"), "{}",
        StandardCharsets.UTF_8);
    final TopicContentReader reader = new TopicContentReader(tempDir);

    assertTrue(reader.exists(TopicPath.of("cdn/a.json")));
    assertFalse(reader.exists(TopicPath.of("cdn")));
    assertFalse(reader.exists(TopicPath.of("cdn/missing.json")));
  }
}
