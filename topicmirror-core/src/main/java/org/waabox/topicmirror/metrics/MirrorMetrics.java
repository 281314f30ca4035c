package org.waabox.topicmirror.metrics;

/**
 * An abstraction for recording operational metrics of a topic mirror.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopMirrorMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MirrorMetrics {

  /**
   * Records a topic created or updated from a file.
   *
   * @param path the topic path, never null
   */
  void topicPublished(String path);

  /**
   * Records a topic removed because its file was removed.
   *
   * @param path the topic path, never null
   */
  void topicRemoved(String path);

  /**
   * Records a missing-topic request that had no backing file.
   *
   * @param path the requested topic path, never null
   */
  void missingTopicUnsatisfied(String path);

  /**
   * Records a mirroring operation that failed.
   *
   * @param path  the topic path, never null
   * @param cause the throwable that caused the failure, never null
   */
  void mirrorFailed(String path, Throwable cause);
}
