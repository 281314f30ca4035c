package org.waabox.topicmirror.session;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes the type and the properties of a topic.
 *
 * @param type       the topic type, never null
 * @param properties the topic properties, never null, immutable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TopicSpecification(
    TopicType type,
    Map<String, String> properties
) {

  /** The property holding the topic removal policy expression. */
  public static final String REMOVAL = "REMOVAL";

  /**
   * Creates a new specification.
   *
   * @param type       the topic type, never null
   * @param properties the topic properties, never null
   */
  public TopicSpecification {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(properties, "properties must not be null");
    properties = Map.copyOf(properties);
  }

  /**
   * Creates a specification of the given type without properties.
   *
   * @param type the topic type, never null
   *
   * @return the specification, never null
   */
  public static TopicSpecification of(final TopicType type) {
    return new TopicSpecification(type, Map.of());
  }

  /**
   * Returns a copy of this specification with an extra property.
   *
   * @param key   the property key, never null
   * @param value the property value, never null
   *
   * @return the new specification, never null
   */
  public TopicSpecification withProperty(final String key,
      final String value) {
    final Map<String, String> copy = new HashMap<>(properties);
    copy.put(key, value);
    return new TopicSpecification(type, copy);
  }

  /**
   * Returns the value of a property.
   *
   * @param key the property key, never null
   *
   * @return the value, or null if the property is not set
   */
  public String property(final String key) {
    return properties.get(key);
  }
}
