package org.waabox.topicmirror.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.topicmirror.TopicMirrorException;

/**
 * Static utility class that reads and writes {@link ServerConfig}
 * descriptors as JSON.
 *
 * <p>The document has the shape:
 * <pre>
 * {
 *   "host": "localhost",
 *   "port": 8080,
 *   "secure": false,
 *   "principal": "control",
 *   "credentials": "password"
 * }
 * </pre>
 * Only {@code host} is required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ServerConfigCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ServerConfigCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a descriptor into a JSON string.
   *
   * <p>Absent principal and credentials are left out.
   *
   * @param config the descriptor, never null.
   * @return the JSON representation, never null.
   */
  public static String serialize(final ServerConfig config) {
    Objects.requireNonNull(config, "config cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("host", config.host());
    node.put("port", config.port());
    node.put("secure", config.secure());
    config.principal().ifPresent(p -> node.put("principal", p));
    config.credentials().ifPresent(c -> node.put("credentials", c));
    return node.toString();
  }

  /**
   * Deserializes a JSON string into a descriptor.
   *
   * @param json the JSON string, never null.
   * @return the descriptor, never null.
   * @throws IllegalArgumentException if the JSON is malformed or has no
   *     host.
   */
  public static ServerConfig deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      return fromTree(MAPPER.readTree(json));
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize ServerConfig from JSON", e);
    }
  }

  /**
   * Reads a descriptor from a JSON file.
   *
   * @param file the file, never null.
   * @return the descriptor, never null.
   * @throws TopicMirrorException if the file cannot be read or is invalid.
   */
  public static ServerConfig read(final Path file) {
    Objects.requireNonNull(file, "file cannot be null");

    try (InputStream in = Files.newInputStream(file)) {
      return read(in);
    } catch (final IOException e) {
      throw new TopicMirrorException(
          "Failed to read server configuration from " + file, e);
    }
  }

  /**
   * Reads a descriptor from a stream holding a JSON document.
   *
   * @param in the stream, never null. Not closed by this method.
   * @return the descriptor, never null.
   * @throws TopicMirrorException if the stream cannot be read or holds an
   *     invalid document.
   */
  public static ServerConfig read(final InputStream in) {
    Objects.requireNonNull(in, "in cannot be null");

    try {
      return fromTree(MAPPER.readTree(in));
    } catch (final IOException | IllegalArgumentException e) {
      throw new TopicMirrorException(
          "Invalid server configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Builds a descriptor from a parsed document.
   *
   * @param node the root node, may be null for an empty document.
   * @return the descriptor, never null.
   * @throws IllegalArgumentException if the host is missing.
   */
  private static ServerConfig fromTree(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException(
          "Server configuration must be a JSON object");
    }
    final JsonNode host = node.get("host");
    if (host == null || host.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: host in JSON: " + node);
    }
    return ServerConfig.create(
        host.asText(),
        node.path("port").asInt(ServerConfig.DEFAULT_PORT),
        node.path("secure").asBoolean(false),
        textOrNull(node, "principal"),
        textOrNull(node, "credentials"));
  }

  /** Returns the text of an optional field.
   *
   * @param node the parent node.
   * @param field the field name.
   * @return the text, or null if the field is missing or null.
   */
  private static String textOrNull(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
