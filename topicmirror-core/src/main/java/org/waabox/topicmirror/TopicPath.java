package org.waabox.topicmirror;

import java.nio.file.Path;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * A slash-delimited path identifying a topic in the server's topic tree.
 *
 * <p>A topic path doubles as a file path relative to the mirror's base
 * directory: {@code cdn/a.json} is backed by {@code <base>/cdn/a.json}.
 * Leading and trailing slashes are dropped on creation. Empty segments and
 * the segments {@code .} and {@code ..} are rejected, so a path can never
 * point outside the base directory.
 *
 * @param value the normalized path, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TopicPath(String value) {

  /**
   * Creates a new topic path.
   *
   * @param value the path, never null
   *
   * @throws IllegalArgumentException if the path is empty or holds an
   *         empty, {@code .} or {@code ..} segment
   */
  public TopicPath {
    Objects.requireNonNull(value, "value must not be null");
    value = value.replaceAll("^/+|/+$", "");
    if (value.isEmpty()) {
      throw new IllegalArgumentException("Topic path must not be empty");
    }
    for (final String segment : value.split("/", -1)) {
      if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
        throw new IllegalArgumentException(
            "Invalid topic path: '" + value + "'");
      }
    }
  }

  /**
   * Creates a topic path.
   *
   * @param value the path, never null
   *
   * @return the topic path, never null
   */
  public static TopicPath of(final String value) {
    return new TopicPath(value);
  }

  /**
   * Derives the topic path of a file below a directory.
   *
   * @param directory the base directory, never null
   * @param file      the file, never null
   *
   * @return the topic path, never null
   *
   * @throws IllegalArgumentException if the file is not below the directory
   */
  public static TopicPath fromFile(final Path directory, final Path file) {
    Objects.requireNonNull(directory, "directory must not be null");
    Objects.requireNonNull(file, "file must not be null");

    final Path base = directory.toAbsolutePath().normalize();
    final Path target = file.toAbsolutePath().normalize();
    if (!target.startsWith(base) || target.equals(base)) {
      throw new IllegalArgumentException(
          "File " + file + " is not below " + directory);
    }
    final StringJoiner joiner = new StringJoiner("/");
    for (final Path name : base.relativize(target)) {
      joiner.add(name.toString());
    }
    return new TopicPath(joiner.toString());
  }

  /**
   * Checks whether this path is the given root or one of its descendants.
   *
   * @param root the root path, never null
   *
   * @return true if this path is at or below the root
   */
  public boolean isUnder(final TopicPath root) {
    Objects.requireNonNull(root, "root must not be null");
    return value.equals(root.value) || value.startsWith(root.value + "/");
  }

  /**
   * Resolves the file backing this topic below a directory.
   *
   * @param directory the base directory, never null
   *
   * @return the file path, never null
   */
  public Path resolveAgainst(final Path directory) {
    Objects.requireNonNull(directory, "directory must not be null");
    Path result = directory;
    for (final String segment : value.split("/")) {
      result = result.resolve(segment);
    }
    return result;
  }

  /**
   * Returns the selector for this path and all of its descendants.
   *
   * @return the selector expression, never null
   */
  public String descendantsSelector() {
    return "?" + value + "//";
  }

  /**
   * Returns the selector for exactly this path.
   *
   * @return the selector expression, never null
   */
  public String pathSelector() {
    return ">" + value;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return value;
  }
}
