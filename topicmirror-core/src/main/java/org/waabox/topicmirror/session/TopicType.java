package org.waabox.topicmirror.session;

/**
 * The value types a topic can hold.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum TopicType {

  /** A JSON document. */
  JSON,

  /** A single string. */
  STRING,

  /** A 64-bit integer. */
  INT64,

  /** A double precision number. */
  DOUBLE
}
