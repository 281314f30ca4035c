package org.waabox.topicmirror.example.application;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.local.LocalMessagingServer;
import org.waabox.topicmirror.stream.TopicSubscriber;

/** Connects a client session once the application is ready and logs every
 * value of the topics it selects.
 *
 * <p>The selector comes from {@code example.subscriber.selector}, or from
 * the first command-line argument when the property is not set. Nothing
 * is subscribed when neither is given.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Component
public class TopicSubscriberRunner implements ApplicationRunner,
    DisposableBean {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TopicSubscriberRunner.class);

  /** The server to connect to, never null. */
  private final LocalMessagingServer server;

  /** The principal of the client session, never null. */
  private final String principal;

  /** The configured selector, may be empty. */
  private final String selector;

  /** The client session, null until connected. */
  private volatile MessagingSession session;

  /** Creates a new TopicSubscriberRunner.
   *
   * @param theServer the messaging server, never null
   * @param thePrincipal the principal to connect as, never null
   * @param theSelector the selector, may be empty
   */
  public TopicSubscriberRunner(final LocalMessagingServer theServer,
      @Value("${example.subscriber.principal:trader}")
          final String thePrincipal,
      @Value("${example.subscriber.selector:}") final String theSelector) {
    server = Objects.requireNonNull(theServer, "server cannot be null");
    principal = Objects.requireNonNull(thePrincipal,
        "principal cannot be null");
    selector = theSelector;
  }

  @Override
  public void run(final ApplicationArguments args) {
    String path = selector;
    if ((path == null || path.isBlank())
        && !args.getNonOptionArgs().isEmpty()) {
      path = args.getNonOptionArgs().get(0);
    }
    if (path == null || path.isBlank()) {
      log.info("No subscriber selector configured, try "
          + "--example.subscriber.selector=<topic-selector>");
      return;
    }

    session = server.connect(principal);
    log.info("Connected session {} as {}", session.sessionId(), principal);
    TopicSubscriber.subscribe(session, path);
  }

  /** Returns the client session.
   *
   * @return the session, or null if nothing was subscribed
   */
  public MessagingSession session() {
    return session;
  }

  @Override
  public void destroy() {
    final MessagingSession current = session;
    if (current != null) {
      current.close();
    }
  }
}
