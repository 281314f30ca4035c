package org.waabox.topicmirror.session;

/**
 * The kinds of topic notification a {@link TopicNotificationListener}
 * receives.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum TopicNotificationType {

  /** The topic was added after the selector was registered. */
  ADDED,

  /** The topic existed when the selector was registered. */
  SELECTED,

  /** The topic was removed. */
  REMOVED,

  /** The topic no longer matches a registered selector. */
  DESELECTED
}
