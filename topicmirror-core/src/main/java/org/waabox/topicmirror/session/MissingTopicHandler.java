package org.waabox.topicmirror.session;

/**
 * Handles requests for topics that do not exist under a branch of the
 * topic tree.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MissingTopicHandler {

  /**
   * Called when a session selects a topic that does not exist.
   *
   * @param notification the request, never null
   */
  void onMissingTopic(MissingTopicNotification notification);

  /**
   * Called once the handler is registered.
   *
   * @param branch the branch the handler is registered for, never null
   */
  default void onRegister(final String branch) {
  }

  /**
   * Called when the handler is closed.
   *
   * @param branch the branch the handler was registered for, never null
   */
  default void onClose(final String branch) {
  }

  /**
   * Called when the handler failed.
   *
   * @param branch the branch the handler is registered for, never null
   * @param error  the failure, never null
   */
  default void onError(final String branch, final Throwable error) {
  }
}
