package org.waabox.topicmirror.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.topicmirror.TopicMirror;
import org.waabox.topicmirror.metrics.MirrorMetrics;
import org.waabox.topicmirror.roles.RoleSubscriber;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.TopicSpecification;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

/**
 * Tests for {@link TopicMirrorAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} against an in-process
 * {@link LocalMessagingServer}, so the mirror really starts and serves
 * topics from a temporary directory.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TopicMirrorAutoConfigurationTest {

  @TempDir
  Path baseDirectory;

  /** The application context runner configured with the auto-configuration. */
  private ApplicationContextRunner runner;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(baseDirectory.resolve("cdn"));
    Files.writeString(baseDirectory.resolve("cdn/trader-news.json"),
        "{\"headline\":\"markets open\"}", StandardCharsets.UTF_8);

    runner = new ApplicationContextRunner()
        .withConfiguration(
            AutoConfigurations.of(TopicMirrorAutoConfiguration.class))
        .withPropertyValues(
            "topicmirror.base-directory=" + baseDirectory,
            "topicmirror.watch-file-system=false");
  }

  /**
   * Verifies that the mirror is created with defaults and started by the
   * lifecycle bean.
   */
  @Test
  void whenContextLoads_givenSession_shouldCreateAndStartMirror() {
    runner.withUserConfiguration(LocalServerConfig.class)
        .run(context -> {
          final TopicMirror mirror = context.getBean(TopicMirror.class);

          assertNotNull(mirror.trackedTopics());
          assertEquals("cdn", mirror.config().root().value());
          assertEquals(baseDirectory.toAbsolutePath().normalize(),
              mirror.config().baseDirectory());
          assertEquals("when subscriptions < 1 for 1m", mirror.specification()
              .property(TopicSpecification.REMOVAL));
          assertFalse(context.containsBean("roleSubscriber"));
        });
  }

  /**
   * Verifies that a client selecting a missing topic gets it created from
   * the backing file.
   */
  @Test
  void whenClientSelectsMissingTopic_givenBackingFile_shouldCreateTopic() {
    runner.withUserConfiguration(LocalServerConfig.class)
        .run(context -> {
          final LocalMessagingServer server =
              context.getBean(LocalMessagingServer.class);
          final MessagingSession client = server.connect("viewer");

          client.select(">cdn/trader-news.json").get(5, TimeUnit.SECONDS);

          assertTrue(server.value("cdn/trader-news.json").isPresent());
          assertEquals(1, server.subscriberCount("cdn/trader-news.json"));
          assertEquals(Set.of("cdn/trader-news.json"), context
              .getBean(TopicMirror.class).trackedTopics().snapshot());
        });
  }

  /**
   * Verifies that the mirror properties are bound into its configuration.
   */
  @Test
  void whenContextLoads_givenCustomProperties_shouldApplyThem() {
    runner.withUserConfiguration(LocalServerConfig.class)
        .withPropertyValues(
            "topicmirror.root=/cdn/news/",
            "topicmirror.removal-policy=when subscriptions < 2 for 30s",
            "topicmirror.handle-missing-topics=false",
            "topicmirror.publish-new-files=false")
        .run(context -> {
          final TopicMirror mirror = context.getBean(TopicMirror.class);

          assertEquals("cdn/news", mirror.config().root().value());
          assertFalse(mirror.config().handleMissingTopics());
          assertFalse(mirror.config().publishNewFiles());
          assertEquals("when subscriptions < 2 for 30s", mirror
              .specification().property(TopicSpecification.REMOVAL));
        });
  }

  /**
   * Verifies that a custom MirrorMetrics bean receives the mirror events.
   */
  @Test
  void whenContextLoads_givenCustomMetrics_shouldUseThem() {
    runner.withUserConfiguration(LocalServerConfig.class,
        RecordingMetricsConfig.class)
        .run(context -> {
          final LocalMessagingServer server =
              context.getBean(LocalMessagingServer.class);

          server.connect("viewer").select(">cdn/trader-news.json")
              .get(5, TimeUnit.SECONDS);
          server.connect("viewer").select(">cdn/missing.json")
              .get(5, TimeUnit.SECONDS);

          final RecordingMetrics metrics =
              context.getBean(RecordingMetrics.class);
          assertEquals(List.of("published cdn/trader-news.json",
              "unsatisfied cdn/missing.json"), metrics.events);
        });
  }

  /**
   * Verifies that sessions with the configured role are subscribed once
   * they connect.
   */
  @Test
  void whenContextLoads_givenRoleSubscription_shouldSubscribeTraders() {
    runner.withUserConfiguration(LocalServerConfig.class)
        .withPropertyValues(
            "topicmirror.role-subscription.role=TRADER",
            "topicmirror.role-subscription.selector=cdn/trader-news.json")
        .run(context -> {
          final RoleSubscriber subscriber =
              context.getBean(RoleSubscriber.class);
          assertEquals("TRADER", subscriber.role());

          final LocalMessagingServer server =
              context.getBean(LocalMessagingServer.class);
          server.connect("viewer");
          server.connect("trader");
          server.awaitIdle();

          assertEquals(1, server.subscriberCount("cdn/trader-news.json"));
          assertEquals("markets open", server.value("cdn/trader-news.json")
              .get().get("headline").asText());
        });
  }

  /**
   * Verifies that a role without a selector fails the context.
   */
  @Test
  void whenContextLoads_givenRoleWithoutSelector_shouldFail() {
    runner.withUserConfiguration(LocalServerConfig.class)
        .withPropertyValues("topicmirror.role-subscription.role=TRADER")
        .run(context -> {
          assertNotNull(context.getStartupFailure());
          assertInstanceOf(BeanCreationException.class,
              context.getStartupFailure());
        });
  }

  /**
   * Verifies that the mirror cannot be created without a session.
   */
  @Test
  void whenContextLoads_givenNoSession_shouldFail() {
    runner.run(context -> assertNotNull(context.getStartupFailure()));
  }

  /** Provides an in-process server and the control session. */
  @Configuration(proxyBeanMethods = false)
  static class LocalServerConfig {

    /**
     * Creates the server with a trader and a viewer principal.
     *
     * @return the server, never null
     */
    @Bean(destroyMethod = "close")
    LocalMessagingServer localMessagingServer() {
      final LocalMessagingServer server = new LocalMessagingServer();
      server.addPrincipal("trader", Set.of("CLIENT", "TRADER"));
      server.addPrincipal("viewer", Set.of("CLIENT"));
      return server;
    }

    /**
     * Connects the control session.
     *
     * @param server the server, never null
     *
     * @return the session, never null
     */
    @Bean(destroyMethod = "close")
    MessagingSession controlSession(final LocalMessagingServer server) {
      return server.connect("control");
    }
  }

  /** Provides a recording MirrorMetrics. */
  @Configuration(proxyBeanMethods = false)
  static class RecordingMetricsConfig {

    /**
     * Creates the metrics bean.
     *
     * @return the metrics, never null
     */
    @Bean
    RecordingMetrics recordingMetrics() {
      return new RecordingMetrics();
    }
  }

  /** A MirrorMetrics that records every event. */
  static class RecordingMetrics implements MirrorMetrics {

    /** The recorded events. */
    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void topicPublished(final String path) {
      events.add("published " + path);
    }

    @Override
    public void topicRemoved(final String path) {
      events.add("removed " + path);
    }

    @Override
    public void missingTopicUnsatisfied(final String path) {
      events.add("unsatisfied " + path);
    }

    @Override
    public void mirrorFailed(final String path, final Throwable cause) {
      events.add("failed " + path);
    }
  }
}
