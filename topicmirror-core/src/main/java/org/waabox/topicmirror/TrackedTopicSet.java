package org.waabox.topicmirror;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.NotificationRegistration;
import org.waabox.topicmirror.session.TopicNotificationListener;
import org.waabox.topicmirror.session.TopicNotificationType;
import org.waabox.topicmirror.session.TopicSpecification;

/**
 * The set of topic paths below a root that are believed to exist on the
 * server.
 *
 * <p>The set is kept current by topic notifications: topics reported as
 * {@link TopicNotificationType#ADDED added} or
 * {@link TopicNotificationType#SELECTED selected} are inserted, topics
 * reported as {@link TopicNotificationType#REMOVED removed} or
 * {@link TopicNotificationType#DESELECTED deselected} are dropped. The
 * mirror also adds and removes paths itself when it creates or removes
 * topics. Every mutation is idempotent, so a notification about a change
 * the mirror already applied is harmless.
 *
 * <p>Nothing is persisted: on restart the set is rebuilt from the topics
 * the server reports when the selector is registered.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TrackedTopicSet implements TopicNotificationListener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TrackedTopicSet.class);

  /** The root every tracked path is at or below, never null. */
  private final TopicPath root;

  /** The tracked paths. */
  private final Set<TopicPath> paths = ConcurrentHashMap.newKeySet();

  /** The notification registration, null until initialized. */
  private volatile NotificationRegistration registration;

  /**
   * Creates an empty set for a root.
   *
   * @param theRoot the root, never null
   */
  TrackedTopicSet(final TopicPath theRoot) {
    root = Objects.requireNonNull(theRoot, "root must not be null");
  }

  /**
   * Creates a set kept in sync with the topics at or below a root.
   *
   * <p>Registers the set as a topic notification listener and selects the
   * root and all of its descendants. Blocks until the server acknowledged
   * the selector; by then every topic that already existed has been
   * reported and added.
   *
   * @param session the session to register with, never null
   * @param root    the root of the topic subtree, never null
   *
   * @return the populated set, never null
   *
   * @throws TopicMirrorException if the registration fails or the calling
   *         thread is interrupted
   */
  public static TrackedTopicSet initialize(final MessagingSession session,
      final TopicPath root) {
    Objects.requireNonNull(session, "session must not be null");

    final TrackedTopicSet set = new TrackedTopicSet(root);
    final String selector = root.descendantsSelector();
    try {
      final NotificationRegistration registration =
          session.addNotificationListener(set).get();
      set.registration = registration;
      registration.select(selector).get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TopicMirrorException(
          "Interrupted while registering topic notifications for "
              + selector, e);
    } catch (final ExecutionException e) {
      throw new TopicMirrorException(
          "Failed to register topic notifications for " + selector,
          e.getCause());
    }
    log.info("Watching for topics that match {}", selector);
    return set;
  }

  /** {@inheritDoc} */
  @Override
  public void onTopicNotification(final String path,
      final TopicSpecification specification,
      final TopicNotificationType type) {

    final TopicPath topic;
    try {
      topic = TopicPath.of(path);
    } catch (final IllegalArgumentException e) {
      log.warn("Ignoring notification for invalid topic path '{}'", path);
      return;
    }
    if (!topic.isUnder(root)) {
      return;
    }

    switch (type) {
      case ADDED -> {
        log.info("Topic {} has been added", topic);
        add(topic);
      }
      case SELECTED -> {
        log.info("Topic {} existed at the time of the selector registration",
            topic);
        add(topic);
      }
      case REMOVED -> {
        log.warn("Topic {} has been removed", topic);
        remove(topic);
      }
      case DESELECTED -> {
        log.warn("Topic {} has been deselected", topic);
        remove(topic);
      }
      default -> { /* no other notification types */ }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void onClose() {
    log.warn("Topic notification listener for {} closed", root);
  }

  /** {@inheritDoc} */
  @Override
  public void onError(final Throwable error) {
    log.error("Topic notification listener for {} failed: {}", root,
        error.getMessage(), error);
  }

  /**
   * Adds a path.
   *
   * @param path the path, never null
   *
   * @return true if the path was not tracked before
   */
  public boolean add(final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    return paths.add(path);
  }

  /**
   * Removes a path.
   *
   * @param path the path, never null
   *
   * @return true if the path was tracked
   */
  public boolean remove(final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    return paths.remove(path);
  }

  /**
   * Checks whether a path is tracked.
   *
   * @param path the path, never null
   *
   * @return true if the path is tracked
   */
  public boolean contains(final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    return paths.contains(path);
  }

  /**
   * Returns the number of tracked paths.
   *
   * @return the size
   */
  public int size() {
    return paths.size();
  }

  /**
   * Returns a sorted snapshot of the tracked paths.
   *
   * @return the paths, never null, immutable
   */
  public Set<String> snapshot() {
    final Set<String> result = new TreeSet<>();
    for (final TopicPath path : paths) {
      result.add(path.value());
    }
    return Collections.unmodifiableSet(result);
  }

  /**
   * Returns the root of this set.
   *
   * @return the root, never null
   */
  public TopicPath root() {
    return root;
  }

  /** Closes the notification registration, if any. */
  public void close() {
    final NotificationRegistration current = registration;
    registration = null;
    if (current != null) {
      current.close().exceptionally(error -> {
        log.warn("Failed to close topic notifications for {}: {}", root,
            error.getMessage());
        return null;
      });
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "TrackedTopicSet[root=" + root + ", paths=" + snapshot() + "]";
  }
}
