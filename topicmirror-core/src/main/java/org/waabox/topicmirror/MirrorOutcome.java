package org.waabox.topicmirror;

/**
 * The result of a single mirroring operation.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MirrorOutcome {

  /** The topic was created or updated from its file. */
  PUBLISHED,

  /** The topic was removed. */
  REMOVED,

  /** Nothing to do: the path is outside the root or not tracked. */
  IGNORED,

  /** The file backing the topic does not exist. */
  FILE_NOT_FOUND,

  /** The file backing the topic is not a JSON document. */
  MALFORMED_CONTENT,

  /** Reading the file or calling the server failed. */
  FAILED
}
