package org.waabox.topicmirror.roles;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Static utility class that converts the {@code $Roles} session property
 * to and from a set of role names.
 *
 * <p>The property holds a comma separated list of double quoted roles, for
 * example {@code "TRADER","AUTHENTICATED"}. Inside quotes a backslash
 * escapes the next character. Unquoted roles are accepted as well and are
 * trimmed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Roles {

  /** Private constructor to prevent instantiation. */
  private Roles() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses a role string.
   *
   * @param roles the role string, may be null
   *
   * @return the roles in order of appearance, never null, immutable
   *
   * @throws IllegalArgumentException if a quoted role is not terminated
   */
  public static Set<String> parse(final String roles) {
    if (roles == null || roles.isBlank()) {
      return Set.of();
    }

    final Set<String> result = new LinkedHashSet<>();
    final int length = roles.length();
    int i = 0;
    while (i < length) {
      while (i < length && (roles.charAt(i) == ','
          || Character.isWhitespace(roles.charAt(i)))) {
        i++;
      }
      if (i >= length) {
        break;
      }

      final StringBuilder role = new StringBuilder();
      if (roles.charAt(i) == '"') {
        i++;
        boolean closed = false;
        while (i < length) {
          final char c = roles.charAt(i++);
          if (c == '\\' && i < length) {
            role.append(roles.charAt(i++));
          } else if (c == '"') {
            closed = true;
            break;
          } else {
            role.append(c);
          }
        }
        if (!closed) {
          throw new IllegalArgumentException(
              "Unterminated role in: " + roles);
        }
        result.add(role.toString());
      } else {
        while (i < length && roles.charAt(i) != ',') {
          role.append(roles.charAt(i++));
        }
        final String trimmed = role.toString().trim();
        if (!trimmed.isEmpty()) {
          result.add(trimmed);
        }
      }
    }
    return Collections.unmodifiableSet(result);
  }

  /**
   * Formats roles as a role string.
   *
   * @param roles the roles, never null
   *
   * @return the role string, empty if there are no roles, never null
   */
  public static String format(final Collection<String> roles) {
    Objects.requireNonNull(roles, "roles must not be null");

    final StringBuilder result = new StringBuilder();
    for (final String role : roles) {
      if (result.length() > 0) {
        result.append(',');
      }
      result.append('"');
      for (final char c : role.toCharArray()) {
        if (c == '"' || c == '\\') {
          result.append('\\');
        }
        result.append(c);
      }
      result.append('"');
    }
    return result.toString();
  }
}
