package org.waabox.topicmirror;

/**
 * Thrown when the file backing a topic exists but does not hold a JSON
 * document.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MalformedTopicContentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given topic.
   *
   * @param path  the topic path, never null
   * @param cause the parse failure, may be null
   */
  public MalformedTopicContentException(final TopicPath path,
      final Throwable cause) {
    super("Content of " + path + " is not valid JSON", cause);
  }
}
