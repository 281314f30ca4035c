package org.waabox.topicmirror.session;

import java.util.concurrent.CompletableFuture;

/**
 * The registration of a {@link MissingTopicHandler} on a branch of the
 * topic tree.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface HandlerRegistration {

  /**
   * Returns the branch the handler is registered for.
   *
   * @return the branch, never null
   */
  String branch();

  /**
   * Removes the handler from its branch.
   *
   * <p>Once the future completes the handler receives no further
   * requests, and the branch can be handled again. Closing twice has no
   * further effect.
   *
   * @return a future that completes when the handler has been removed,
   *         never null
   */
  CompletableFuture<Void> close();
}
