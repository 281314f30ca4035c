package org.waabox.topicmirror.session;

/**
 * A request from the server for a topic that a session tried to select but
 * that does not exist.
 *
 * <p>The session that made the selection is blocked until
 * {@link #proceed()} or {@link #cancel()} is called, so every handler must
 * eventually call one of them.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MissingTopicNotification {

  /**
   * Returns the topic path derived from the selector.
   *
   * @return the missing topic path, never null
   */
  String path();

  /**
   * Returns the selector the requesting session used.
   *
   * @return the selector expression, never null
   */
  String selector();

  /**
   * Returns the identifier of the requesting session.
   *
   * @return the session id, never null
   */
  String sessionId();

  /** Lets the selection continue, picking up any topic created since. */
  void proceed();

  /** Abandons the selection. */
  void cancel();
}
