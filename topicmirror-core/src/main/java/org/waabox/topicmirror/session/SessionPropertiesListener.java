package org.waabox.topicmirror.session;

import java.util.Map;

/**
 * A listener notified when other sessions open, change or close.
 *
 * <p>Property maps only contain the keys requested when the listener was
 * registered.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SessionPropertiesListener {

  /** The kinds of event reported by {@link #onSessionEvent}. */
  enum EventType {

    /** One or more properties changed. */
    PROPERTIES,

    /** The session reconnected. */
    RECONNECTED,

    /** The session failed over to another server. */
    FAILED_OVER,

    /** The session was disconnected. */
    DISCONNECTED
  }

  /** The reasons reported by {@link #onSessionClose}. */
  enum CloseReason {

    /** The client closed the session. */
    CLOSED_BY_CLIENT,

    /** The server closed the session. */
    CLOSED_BY_SERVER,

    /** The connection was lost. */
    CONNECTION_LOST
  }

  /** Called once the listener is registered. */
  default void onActive() {
  }

  /**
   * Called when a session opens, or for every open session when the
   * listener is registered.
   *
   * @param sessionId  the session id, never null
   * @param properties the session properties, never null
   */
  void onSessionOpen(String sessionId, Map<String, String> properties);

  /**
   * Called when a session changes.
   *
   * @param sessionId  the session id, never null
   * @param type       the event type, never null
   * @param properties the current properties, never null
   * @param previous   the properties before the change, never null
   */
  default void onSessionEvent(final String sessionId, final EventType type,
      final Map<String, String> properties,
      final Map<String, String> previous) {
  }

  /**
   * Called when a session closes.
   *
   * @param sessionId  the session id, never null
   * @param properties the properties of the closed session, never null
   * @param reason     why the session closed, never null
   */
  default void onSessionClose(final String sessionId,
      final Map<String, String> properties, final CloseReason reason) {
  }

  /** Called when the listener is closed. */
  default void onClose() {
  }

  /**
   * Called when the listener failed.
   *
   * @param error the failure, never null
   */
  default void onError(final Throwable error) {
  }
}
