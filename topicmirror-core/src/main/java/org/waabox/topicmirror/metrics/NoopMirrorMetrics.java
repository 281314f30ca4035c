package org.waabox.topicmirror.metrics;

/**
 * A no-operation implementation of {@link MirrorMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopMirrorMetrics implements MirrorMetrics {

  /** {@inheritDoc} */
  @Override
  public void topicPublished(final String path) {
  }

  /** {@inheritDoc} */
  @Override
  public void topicRemoved(final String path) {
  }

  /** {@inheritDoc} */
  @Override
  public void missingTopicUnsatisfied(final String path) {
  }

  /** {@inheritDoc} */
  @Override
  public void mirrorFailed(final String path, final Throwable cause) {
  }
}
