package org.waabox.topicmirror;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the JSON document backing a topic from the file system.
 *
 * <p>The file of topic {@code a/b.json} is {@code <baseDirectory>/a/b.json}.
 * The content is taken verbatim; no schema is enforced beyond being a
 * single JSON document. Anything after the document is rejected.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicContentReader {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  /** The directory topic paths are resolved against, never null. */
  private final Path baseDirectory;

  /**
   * Creates a new reader.
   *
   * @param theBaseDirectory the directory topic paths are resolved against,
   *                         never null
   */
  public TopicContentReader(final Path theBaseDirectory) {
    baseDirectory = Objects.requireNonNull(theBaseDirectory,
        "baseDirectory must not be null");
  }

  /**
   * Reads and parses the file backing a topic.
   *
   * @param path the topic path, never null
   *
   * @return the parsed document, never null
   *
   * @throws NoSuchFileException            if there is no file for the topic,
   *                                        or the path is a directory
   * @throws IOException                    if the file cannot be read
   * @throws MalformedTopicContentException if the file is not a JSON
   *                                        document
   */
  public JsonNode read(final TopicPath path) throws IOException {
    Objects.requireNonNull(path, "path must not be null");

    final Path file = path.resolveAgainst(baseDirectory);
    if (Files.isDirectory(file)) {
      throw new NoSuchFileException(file.toString(), null,
          "Not a regular file");
    }
    final byte[] content = Files.readAllBytes(file);
    try {
      final JsonNode node = MAPPER.readTree(content);
      if (node == null || node.isMissingNode()) {
        throw new MalformedTopicContentException(path, null);
      }
      return node;
    } catch (final JsonProcessingException e) {
      throw new MalformedTopicContentException(path, e);
    }
  }

  /**
   * Checks whether the file backing a topic exists.
   *
   * @param path the topic path, never null
   *
   * @return true if there is a regular file for the topic
   */
  public boolean exists(final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    return Files.isRegularFile(path.resolveAgainst(baseDirectory));
  }

  /**
   * Returns the directory topic paths are resolved against.
   *
   * @return the base directory, never null
   */
  public Path baseDirectory() {
    return baseDirectory;
  }
}
