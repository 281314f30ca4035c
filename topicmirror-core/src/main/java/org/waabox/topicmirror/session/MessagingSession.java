package org.waabox.topicmirror.session;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A session connected to a publish/subscribe messaging server.
 *
 * <p>This is the only seam through which topicmirror talks to the server.
 * Every operation that crosses the process boundary is asynchronous and
 * returns a {@link CompletableFuture} that completes once the server has
 * acknowledged the request. Callbacks registered through this interface
 * are delivered by the session's own dispatching thread, one at a time.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Obtain a session from the client library (or from the
 *       in-process server of the topicmirror-local-server module)</li>
 *   <li>Register listeners, handlers and streams</li>
 *   <li>Update, remove and select topics</li>
 *   <li>Call {@link #close()} to release the session</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MessagingSession extends AutoCloseable {

  /** The session property holding the authenticated principal. */
  String PRINCIPAL = "$Principal";

  /** The session property holding the session roles. */
  String ROLES = "$Roles";

  /** The session property holding the session identifier. */
  String SESSION_ID = "$SessionId";

  /**
   * Returns the server-assigned identifier of this session.
   *
   * @return the session id, never null
   */
  String sessionId();

  /**
   * Returns the fixed properties of this session.
   *
   * @return an immutable view of the properties, never null
   */
  Map<String, String> properties();

  /**
   * Sets the value of a topic, creating it with the given specification
   * if it does not exist yet.
   *
   * @param path the topic path, never null
   * @param value the new value, never null
   * @param specification the specification used if the topic has to be
   *        created, never null
   *
   * @return a future that completes when the server applied the update,
   *         never null
   */
  CompletableFuture<Void> set(String path, JsonNode value,
      TopicSpecification specification);

  /**
   * Removes all topics matching the given selector.
   *
   * <p>Removing a topic that does not exist is not an error: the future
   * completes with zero.
   *
   * @param selector the topic selector expression, never null
   *
   * @return a future with the number of removed topics, never null
   */
  CompletableFuture<Integer> remove(String selector);

  /**
   * Registers a listener for topic notifications.
   *
   * <p>The listener receives nothing until a selector is registered via
   * {@link NotificationRegistration#select(String)}.
   *
   * @param listener the listener, never null
   *
   * @return a future with the registration, never null
   */
  CompletableFuture<NotificationRegistration> addNotificationListener(
      TopicNotificationListener listener);

  /**
   * Registers a handler for missing-topic requests at or below a branch of
   * the topic tree.
   *
   * <p>Only one handler can be registered per branch. Closing the returned
   * registration frees the branch.
   *
   * @param branch the topic path of the branch, never null
   * @param handler the handler, never null
   *
   * @return a future with the registration, failed if the branch already
   *         has a handler, never null
   */
  CompletableFuture<HandlerRegistration> addMissingTopicHandler(
      String branch,
      MissingTopicHandler handler);

  /**
   * Registers a listener notified about other sessions opening, changing
   * and closing.
   *
   * @param propertyKeys the session properties the listener wants to
   *        receive, never null
   * @param listener the listener, never null
   *
   * @return a future that completes when the listener is active, never null
   */
  CompletableFuture<Void> setSessionPropertiesListener(
      Set<String> propertyKeys, SessionPropertiesListener listener);

  /**
   * Subscribes another session to the topics matching a selector.
   *
   * @param sessionId the session to subscribe, never null
   * @param selector the topic selector expression, never null
   *
   * @return a future that completes when the subscription has been
   *         applied, never null
   */
  CompletableFuture<Void> subscribe(String sessionId, String selector);

  /**
   * Adds a value stream receiving the subscriptions of this session that
   * match the given selector.
   *
   * @param selector the topic selector expression, never null
   * @param stream the stream, never null
   */
  void addStream(String selector, ValueStream stream);

  /**
   * Subscribes this session to the topics matching a selector.
   *
   * @param selector the topic selector expression, never null
   *
   * @return a future that completes when the selection has been applied,
   *         never null
   */
  CompletableFuture<Void> select(String selector);

  /**
   * Unsubscribes this session from the topics matching a selector.
   *
   * @param selector the topic selector expression, never null
   *
   * @return a future that completes when the selection has been removed,
   *         never null
   */
  CompletableFuture<Void> unselect(String selector);

  /** Closes the session, releasing every listener and handler. */
  @Override
  void close();
}
