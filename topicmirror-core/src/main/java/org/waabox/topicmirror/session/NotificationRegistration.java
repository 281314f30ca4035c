package org.waabox.topicmirror.session;

import java.util.concurrent.CompletableFuture;

/**
 * The registration of a {@link TopicNotificationListener}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface NotificationRegistration {

  /**
   * Starts receiving notifications for the topics matching a selector.
   *
   * <p>Topics that already match are reported as
   * {@link TopicNotificationType#SELECTED} before the future completes.
   *
   * @param selector the topic selector expression, never null
   *
   * @return a future that completes when the selector is registered,
   *         never null
   */
  CompletableFuture<Void> select(String selector);

  /**
   * Stops receiving notifications for a selector previously registered.
   *
   * <p>Topics that no longer match any selector are reported as
   * {@link TopicNotificationType#DESELECTED}.
   *
   * @param selector the topic selector expression, never null
   *
   * @return a future that completes when the selector is removed,
   *         never null
   */
  CompletableFuture<Void> deselect(String selector);

  /**
   * Closes the registration.
   *
   * @return a future that completes when the listener has been closed,
   *         never null
   */
  CompletableFuture<Void> close();
}
