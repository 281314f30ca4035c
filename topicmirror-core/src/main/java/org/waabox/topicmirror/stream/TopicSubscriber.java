package org.waabox.topicmirror.stream;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.ValueStream;

/**
 * Static utility class that subscribes a session to a selector and routes
 * the values to a stream.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicSubscriber {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TopicSubscriber.class);

  /** Private constructor to prevent instantiation. */
  private TopicSubscriber() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Subscribes a session to a selector, logging every value received.
   *
   * @param session  the session, never null
   * @param selector the topic selector, never null
   *
   * @return a future that completes once the selection is applied,
   *         never null
   */
  public static CompletableFuture<Void> subscribe(
      final MessagingSession session, final String selector) {
    return subscribe(session, selector, new LoggingValueStream());
  }

  /**
   * Subscribes a session to a selector, feeding the given stream.
   *
   * @param session  the session, never null
   * @param selector the topic selector, never null
   * @param stream   the stream receiving the values, never null
   *
   * @return a future that completes once the selection is applied,
   *         never null
   */
  public static CompletableFuture<Void> subscribe(
      final MessagingSession session, final String selector,
      final ValueStream stream) {
    Objects.requireNonNull(session, "session must not be null");
    Objects.requireNonNull(selector, "selector must not be null");
    Objects.requireNonNull(stream, "stream must not be null");

    session.addStream(selector, stream);
    return session.select(selector).whenComplete((ignored, error) -> {
      if (error != null) {
        log.error("Failed to select {}: {}", selector, error.getMessage(),
            error);
      } else {
        log.info("Selected: {}", selector);
      }
    });
  }
}
