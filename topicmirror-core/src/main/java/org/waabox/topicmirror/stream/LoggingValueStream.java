package org.waabox.topicmirror.stream;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.session.TopicSpecification;
import org.waabox.topicmirror.session.ValueStream;

/**
 * A {@link ValueStream} that logs every subscription, value and
 * unsubscription it receives.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LoggingValueStream implements ValueStream {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      LoggingValueStream.class);

  @Override
  public void onSubscription(final String path,
      final TopicSpecification specification) {
    log.info("Subscribed to {}, type {}", path, specification.type());
  }

  @Override
  public void onValue(final String path,
      final TopicSpecification specification, final JsonNode oldValue,
      final JsonNode newValue) {
    log.info("Topic update for {}: {}", path, newValue);
  }

  @Override
  public void onUnsubscription(final String path,
      final TopicSpecification specification,
      final UnsubscribeReason reason) {
    log.info("Unsubscribed from {}: {}", path, reason);
  }

  @Override
  public void onError(final Throwable error) {
    log.error("Value stream error: {}", error.getMessage(), error);
  }
}
