package org.waabox.topicmirror.roles;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.SessionPropertiesListener;

/**
 * Subscribes every session that opens with a given role to a topic
 * selector.
 *
 * <p>Sessions without both a {@code $Principal} and a {@code $Roles}
 * property are left alone.
 *
 * <p>Typical usage:
 * <pre>{@code
 * RoleSubscriber subscriber = new RoleSubscriber(session, "TRADER",
 *     "cdn/trader-news.json");
 * subscriber.register().join();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RoleSubscriber implements SessionPropertiesListener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RoleSubscriber.class);

  /** The session properties this listener needs. */
  static final Set<String> PROPERTIES = Set.of(MessagingSession.PRINCIPAL,
      MessagingSession.ROLES);

  /** The session used to subscribe other sessions, never null. */
  private final MessagingSession session;

  /** The role that triggers the subscription, never null. */
  private final String role;

  /** The selector sessions with the role are subscribed to, never null. */
  private final String selector;

  /**
   * Creates a new RoleSubscriber.
   *
   * @param theSession  the session used for client control, never null
   * @param theRole     the role to look for, never null
   * @param theSelector the topic selector to subscribe to, never null
   */
  public RoleSubscriber(final MessagingSession theSession,
      final String theRole, final String theSelector) {
    session = Objects.requireNonNull(theSession, "session must not be null");
    role = Objects.requireNonNull(theRole, "role must not be null");
    selector = Objects.requireNonNull(theSelector,
        "selector must not be null");
  }

  /**
   * Registers this listener with its session.
   *
   * @return a future that completes once the listener is active, never null
   */
  public CompletableFuture<Void> register() {
    return session.setSessionPropertiesListener(PROPERTIES, this);
  }

  /** Returns the role this subscriber looks for.
   *
   * @return the role, never null
   */
  public String role() {
    return role;
  }

  /** Returns the selector sessions are subscribed to.
   *
   * @return the selector, never null
   */
  public String selector() {
    return selector;
  }

  @Override
  public void onActive() {
    log.info("Session properties listener for role {} is active", role);
  }

  @Override
  public void onSessionOpen(final String sessionId,
      final Map<String, String> properties) {
    log.info("Session opened {} {}", sessionId, properties);

    final String roles = properties.get(MessagingSession.ROLES);
    final String principal = properties.get(MessagingSession.PRINCIPAL);
    if (roles == null || roles.isEmpty()
        || principal == null || principal.isEmpty()) {
      return;
    }

    final Set<String> sessionRoles;
    try {
      sessionRoles = Roles.parse(roles);
    } catch (final IllegalArgumentException e) {
      log.warn("Ignoring session {} with malformed roles '{}'", sessionId,
          roles);
      return;
    }

    if (sessionRoles.contains(role)) {
      session.subscribe(sessionId, selector).whenComplete((ignored, error) -> {
        if (error != null) {
          log.error("Failed to subscribe {} at {} to {}: {}", principal,
              sessionId, selector, error.getMessage(), error);
        } else {
          log.info("Subscribed {} at {} to {}", principal, sessionId,
              selector);
        }
      });
    }
  }

  @Override
  public void onSessionEvent(final String sessionId, final EventType type,
      final Map<String, String> properties,
      final Map<String, String> previous) {
    log.info("Session {} changed ({}) {}", sessionId, type, properties);
  }

  @Override
  public void onSessionClose(final String sessionId,
      final Map<String, String> properties, final CloseReason reason) {
    log.info("Session closed {}: {} {}", sessionId, reason, properties);
  }

  @Override
  public void onClose() {
    log.info("Session properties listener for role {} is closed", role);
  }

  @Override
  public void onError(final Throwable error) {
    log.error("Session properties listener error: {}", error.getMessage(),
        error);
  }
}
