package org.waabox.topicmirror.session;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the values of the topics a session is subscribed to.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ValueStream {

  /** The reasons a subscription ends. */
  enum UnsubscribeReason {

    /** The session unselected the topic. */
    REQUESTED,

    /** Another session unsubscribed this one. */
    CONTROL,

    /** The topic was removed. */
    REMOVAL,

    /** The stream or its session was closed. */
    STREAM_CHANGE
  }

  /**
   * Called when the session subscribes to a topic.
   *
   * @param path          the topic path, never null
   * @param specification the topic specification, never null
   */
  default void onSubscription(final String path,
      final TopicSpecification specification) {
  }

  /**
   * Called for every value of a subscribed topic.
   *
   * @param path          the topic path, never null
   * @param specification the topic specification, never null
   * @param oldValue      the previous value, null for the first value
   * @param newValue      the new value, never null
   */
  void onValue(String path, TopicSpecification specification,
      JsonNode oldValue, JsonNode newValue);

  /**
   * Called when the session unsubscribes from a topic.
   *
   * @param path          the topic path, never null
   * @param specification the topic specification, never null
   * @param reason        why the subscription ended, never null
   */
  default void onUnsubscription(final String path,
      final TopicSpecification specification,
      final UnsubscribeReason reason) {
  }

  /** Called when the stream is closed. */
  default void onClose() {
  }

  /**
   * Called when the stream failed.
   *
   * @param error the failure, never null
   */
  default void onError(final Throwable error) {
  }
}
