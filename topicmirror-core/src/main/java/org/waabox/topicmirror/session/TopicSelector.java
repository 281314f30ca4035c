package org.waabox.topicmirror.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A parsed topic selector expression.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code >a/b} or {@code a/b} - the topic at exactly that path</li>
 *   <li>{@code ?regex} - every topic whose full path matches the regular
 *       expression</li>
 *   <li>{@code *r1/r2} - every topic whose path segments match the
 *       segment expressions one by one</li>
 * </ul>
 * Any form may end in {@code //}, meaning the selected topics and all of
 * their descendants.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicSelector {

  /** The qualifier that extends a selector to all descendants. */
  private static final String DESCENDANTS = "//";

  /** Characters that make a segment a pattern rather than a literal. */
  private static final Pattern LITERAL_SEGMENT =
      Pattern.compile("[A-Za-z0-9_\\-]+");

  /** The selector kinds. */
  private enum Kind { PATH, FULL_PATH_PATTERN, SPLIT_PATH_PATTERN }

  /** The original expression, never null. */
  private final String expression;

  /** The selector kind, never null. */
  private final Kind kind;

  /** The path, or the pattern source, without prefix and qualifier. */
  private final String body;

  /** Whether descendants of matching topics are selected too. */
  private final boolean descendants;

  /** The compiled full path pattern, null unless FULL_PATH_PATTERN. */
  private final Pattern fullPathPattern;

  /** The compiled segment patterns, empty unless SPLIT_PATH_PATTERN. */
  private final List<Pattern> segmentPatterns;

  /**
   * Creates a new selector.
   *
   * @param theExpression  the original expression
   * @param theKind        the kind
   * @param theBody        the path or pattern source
   * @param theDescendants whether descendants are included
   */
  private TopicSelector(final String theExpression, final Kind theKind,
      final String theBody, final boolean theDescendants) {
    expression = theExpression;
    kind = theKind;
    body = theBody;
    descendants = theDescendants;
    fullPathPattern = kind == Kind.FULL_PATH_PATTERN
        ? Pattern.compile(body) : null;
    final List<Pattern> segments = new ArrayList<>();
    if (kind == Kind.SPLIT_PATH_PATTERN) {
      for (final String segment : body.split("/")) {
        segments.add(Pattern.compile(segment));
      }
    }
    segmentPatterns = List.copyOf(segments);
  }

  /**
   * Parses a selector expression.
   *
   * @param expression the expression, never null
   *
   * @return the selector, never null
   *
   * @throws IllegalArgumentException if the expression is empty or holds an
   *         invalid pattern
   */
  public static TopicSelector parse(final String expression) {
    Objects.requireNonNull(expression, "expression must not be null");

    String rest = expression.trim();
    boolean descendants = false;
    if (rest.endsWith(DESCENDANTS)) {
      descendants = true;
      rest = rest.substring(0, rest.length() - DESCENDANTS.length());
    }

    Kind kind = Kind.PATH;
    if (rest.startsWith(">")) {
      rest = rest.substring(1);
    } else if (rest.startsWith("?")) {
      kind = Kind.FULL_PATH_PATTERN;
      rest = rest.substring(1);
    } else if (rest.startsWith("*")) {
      kind = Kind.SPLIT_PATH_PATTERN;
      rest = rest.substring(1);
    }
    if (kind == Kind.PATH) {
      rest = stripSlashes(rest);
    }
    if (rest.isEmpty()) {
      throw new IllegalArgumentException(
          "Invalid topic selector: '" + expression + "'");
    }

    try {
      return new TopicSelector(expression, kind, rest, descendants);
    } catch (final PatternSyntaxException e) {
      throw new IllegalArgumentException(
          "Invalid topic selector: '" + expression + "'", e);
    }
  }

  /**
   * Checks whether this selector selects the given topic path.
   *
   * @param path the topic path, never null
   *
   * @return true if the topic is selected
   */
  public boolean matches(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    if (matchesExactly(path)) {
      return true;
    }
    if (!descendants) {
      return false;
    }
    int slash = path.lastIndexOf('/');
    while (slash > 0) {
      if (matchesExactly(path.substring(0, slash))) {
        return true;
      }
      slash = path.lastIndexOf('/', slash - 1);
    }
    return false;
  }

  /**
   * Returns the longest literal path every selected topic starts with.
   *
   * <p>For {@code >cdn/a.json} this is {@code cdn/a.json}, for
   * {@code ?cdn/.*} it is {@code cdn}.
   *
   * @return the path prefix, empty if the selector starts with a pattern,
   *         never null
   */
  public String pathPrefix() {
    if (kind == Kind.PATH) {
      return body;
    }
    final StringBuilder prefix = new StringBuilder();
    for (final String segment : body.split("/")) {
      if (!LITERAL_SEGMENT.matcher(segment).matches()) {
        break;
      }
      if (prefix.length() > 0) {
        prefix.append('/');
      }
      prefix.append(segment);
    }
    return prefix.toString();
  }

  /**
   * Returns the expression this selector was parsed from.
   *
   * @return the expression, never null
   */
  public String expression() {
    return expression;
  }

  /**
   * Checks the path itself against the selector, ignoring descendants.
   *
   * @param path the topic path, never null
   *
   * @return true on a match
   */
  private boolean matchesExactly(final String path) {
    return switch (kind) {
      case PATH -> body.equals(path);
      case FULL_PATH_PATTERN -> fullPathPattern.matcher(path).matches();
      case SPLIT_PATH_PATTERN -> matchesSegments(path);
    };
  }

  /**
   * Matches each path segment against the segment pattern in the same
   * position.
   *
   * @param path the topic path, never null
   *
   * @return true if the segment counts agree and every segment matches
   */
  private boolean matchesSegments(final String path) {
    final String[] segments = path.split("/");
    if (segments.length != segmentPatterns.size()) {
      return false;
    }
    for (int i = 0; i < segments.length; i++) {
      if (!segmentPatterns.get(i).matcher(segments[i]).matches()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Removes leading and trailing slashes from a path.
   *
   * @param path the path, never null
   *
   * @return the stripped path, never null
   */
  private static String stripSlashes(final String path) {
    int start = 0;
    int end = path.length();
    while (start < end && path.charAt(start) == '/') {
      start++;
    }
    while (end > start && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(start, end);
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TopicSelector)) {
      return false;
    }
    final TopicSelector that = (TopicSelector) other;
    return descendants == that.descendants && kind == that.kind
        && body.equals(that.body);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(kind, body, descendants);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return expression;
  }
}
