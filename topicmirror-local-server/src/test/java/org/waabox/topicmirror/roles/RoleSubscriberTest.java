package org.waabox.topicmirror.roles;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.same;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.junit.jupiter.api.Test;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.TopicSpecification;
import org.waabox.topicmirror.session.TopicType;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

/**
 * Tests for {@link RoleSubscriber}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RoleSubscriberTest {

  private static final String SELECTOR = "cdn/trader-news.json";

  @Test
  void whenRegistering_givenSession_shouldAskForPrincipalAndRoles() {
    final MessagingSession session = createMock(MessagingSession.class);
    final RoleSubscriber subscriber = new RoleSubscriber(session, "TRADER",
        SELECTOR);
    expect(session.setSessionPropertiesListener(
        same(RoleSubscriber.PROPERTIES), same(subscriber)))
        .andReturn(CompletableFuture.completedFuture(null));
    replay(session);

    subscriber.register().join();

    verify(session);
    assertEquals(Set.of(MessagingSession.PRINCIPAL, MessagingSession.ROLES),
        RoleSubscriber.PROPERTIES);
  }

  @Test
  void whenSessionOpens_givenMatchingRole_shouldSubscribeIt() {
    final MessagingSession session = createMock(MessagingSession.class);
    expect(session.subscribe("s1", SELECTOR))
        .andReturn(CompletableFuture.completedFuture(null));
    replay(session);

    new RoleSubscriber(session, "TRADER", SELECTOR).onSessionOpen("s1",
        properties("trader", "\"CLIENT\",\"TRADER\""));

    verify(session);
  }

  @Test
  void whenSessionOpens_givenOtherRoles_shouldNotSubscribe() {
    final MessagingSession session = createMock(MessagingSession.class);
    replay(session);

    new RoleSubscriber(session, "TRADER", SELECTOR).onSessionOpen("s1",
        properties("viewer", "\"CLIENT\""));

    verify(session);
  }

  @Test
  void whenSessionOpens_givenMissingPrincipalOrRoles_shouldNotSubscribe() {
    final MessagingSession session = createMock(MessagingSession.class);
    replay(session);
    final RoleSubscriber subscriber = new RoleSubscriber(session, "TRADER",
        SELECTOR);

    subscriber.onSessionOpen("s1", properties("", "\"TRADER\""));
    subscriber.onSessionOpen("s2", properties("trader", ""));
    subscriber.onSessionOpen("s3", Map.of());

    verify(session);
  }

  @Test
  void whenSessionOpens_givenMalformedRoles_shouldIgnoreSession() {
    final MessagingSession session = createMock(MessagingSession.class);
    replay(session);

    assertDoesNotThrow(() -> new RoleSubscriber(session, "TRADER", SELECTOR)
        .onSessionOpen("s1", properties("trader", "\"TRADER")));

    verify(session);
  }

  @Test
  void whenSubscribing_givenServerFailure_shouldNotThrow() {
    final MessagingSession session = createMock(MessagingSession.class);
    expect(session.subscribe("s1", SELECTOR)).andReturn(
        CompletableFuture.failedFuture(new IllegalStateException("down")));
    replay(session);

    assertDoesNotThrow(() -> new RoleSubscriber(session, "TRADER", SELECTOR)
        .onSessionOpen("s1", properties("trader", "\"TRADER\"")));

    verify(session);
  }

  @Test
  void whenCreating_givenNullArguments_shouldThrow() {
    final MessagingSession session = createMock(MessagingSession.class);

    assertThrows(NullPointerException.class,
        () -> new RoleSubscriber(null, "TRADER", SELECTOR));
    assertThrows(NullPointerException.class,
        () -> new RoleSubscriber(session, null, SELECTOR));
    assertThrows(NullPointerException.class,
        () -> new RoleSubscriber(session, "TRADER", null));
  }

  @Test
  void whenTraderConnects_givenLocalServer_shouldBeSubscribedToTopic() {
    try (LocalMessagingServer server = new LocalMessagingServer()) {
      server.addPrincipal("trader", Set.of("CLIENT", "TRADER"));
      server.addPrincipal("viewer", Set.of("CLIENT"));
      final MessagingSession control = server.connect("control");
      control.set(SELECTOR, JsonNodeFactory.instance.objectNode()
          .put("headline", "markets open"),
          TopicSpecification.of(TopicType.JSON)).join();

      final RoleSubscriber subscriber = new RoleSubscriber(control, "TRADER",
          SELECTOR);
      subscriber.register().join();
      server.connect("viewer");
      server.connect("trader");
      server.awaitIdle();

      assertEquals(1, server.subscriberCount(SELECTOR));
      assertEquals("TRADER", subscriber.role());
      assertEquals(SELECTOR, subscriber.selector());
    }
  }

  private static Map<String, String> properties(final String principal,
      final String roles) {
    return Map.of(MessagingSession.PRINCIPAL, principal,
        MessagingSession.ROLES, roles);
  }
}
