package org.waabox.topicmirror;

/**
 * Raised when the mirror cannot set itself up against the server or the
 * file system.
 *
 * <p>Thrown by {@link TopicMirror#start()} when the topic notification or
 * missing-topic registration is refused, by the directory watcher when the
 * root directory cannot be watched, and when a server connection
 * descriptor cannot be read. Mirroring operations never throw it, they
 * report a {@link MirrorOutcome} instead.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicMirrorException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   * @param cause the failure that prevented the setup, cannot be null.
   */
  public TopicMirrorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
