package org.waabox.topicmirror.session;

/**
 * A listener notified about topics being added to, or removed from, the
 * part of the topic tree selected through a
 * {@link NotificationRegistration}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TopicNotificationListener {

  /**
   * Called for every notification about a selected topic.
   *
   * @param path          the topic path, never null
   * @param specification the topic specification, never null
   * @param type          the notification type, never null
   */
  void onTopicNotification(String path, TopicSpecification specification,
      TopicNotificationType type);

  /**
   * Called for notifications about unselected descendants of a selected
   * topic. Ignored by default.
   *
   * @param path the descendant topic path, never null
   * @param type the notification type, never null
   */
  default void onDescendantNotification(final String path,
      final TopicNotificationType type) {
  }

  /** Called when the registration is closed. */
  default void onClose() {
  }

  /**
   * Called when the registration failed.
   *
   * @param error the failure, never null
   */
  void onError(Throwable error);
}
