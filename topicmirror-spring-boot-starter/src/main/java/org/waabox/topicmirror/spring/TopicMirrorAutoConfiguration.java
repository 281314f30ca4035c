package org.waabox.topicmirror.spring;

import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.topicmirror.RemovalPolicy;
import org.waabox.topicmirror.TopicMirror;
import org.waabox.topicmirror.TopicMirrorConfig;
import org.waabox.topicmirror.metrics.MirrorMetrics;
import org.waabox.topicmirror.roles.RoleSubscriber;
import org.waabox.topicmirror.session.MessagingSession;

/**
 * Spring Boot auto-configuration for the topic mirror.
 *
 * <p>Creates a {@link TopicMirror} on the application's
 * {@link MessagingSession} bean, configured from
 * {@link TopicMirrorProperties}. An optional {@link MirrorMetrics} bean is
 * wired when present. When {@code topicmirror.role-subscription.role} is
 * set, a {@link RoleSubscriber} is created as well.
 *
 * <p>The mirror lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}, so it starts after every other bean is ready.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(TopicMirrorProperties.class)
public class TopicMirrorAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TopicMirrorAutoConfiguration.class);

  /**
   * Creates the {@link TopicMirror} bean.
   *
   * @param properties      the configuration properties, never null
   * @param session         the messaging session, never null
   * @param metricsProvider provider for an optional MirrorMetrics bean
   *
   * @return the configured mirror, never null
   */
  @Bean
  public TopicMirror topicMirror(
      final TopicMirrorProperties properties,
      final MessagingSession session,
      final ObjectProvider<MirrorMetrics> metricsProvider) {

    final TopicMirrorConfig.Builder config = TopicMirrorConfig.builder()
        .root(properties.getRoot())
        .handleMissingTopics(properties.isHandleMissingTopics())
        .watchFileSystem(properties.isWatchFileSystem())
        .publishNewFiles(properties.isPublishNewFiles());

    final String baseDirectory = properties.getBaseDirectory();
    if (baseDirectory != null && !baseDirectory.isBlank()) {
      config.baseDirectory(Paths.get(baseDirectory));
    }

    final String removalPolicy = properties.getRemovalPolicy();
    if (removalPolicy != null && !removalPolicy.isBlank()) {
      config.removalPolicy(RemovalPolicy.parse(removalPolicy));
    }

    final TopicMirror.Builder builder = TopicMirror.builder()
        .session(session)
        .config(config.build());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("TopicMirror using custom MirrorMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final TopicMirror mirror = builder.build();
    log.info("TopicMirror created with {}", mirror.config());
    return mirror;
  }

  /**
   * Creates the {@link RoleSubscriber} bean.
   *
   * @param properties the configuration properties, never null
   * @param session    the messaging session, never null
   *
   * @return the subscriber, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "topicmirror.role-subscription",
      name = "role")
  public RoleSubscriber roleSubscriber(
      final TopicMirrorProperties properties,
      final MessagingSession session) {

    final TopicMirrorProperties.RoleSubscription settings =
        properties.getRoleSubscription();
    if (settings.getSelector() == null || settings.getSelector().isBlank()) {
      throw new IllegalStateException(
          "topicmirror.role-subscription.selector is required when "
              + "topicmirror.role-subscription.role is set");
    }
    log.info("Subscribing sessions with role {} to {}", settings.getRole(),
        settings.getSelector());
    return new RoleSubscriber(session, settings.getRole(),
        settings.getSelector());
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the mirror
   * and registers the role subscriber, if any.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param mirror             the mirror to manage, never null
   * @param subscriberProvider provider for the optional RoleSubscriber
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle topicMirrorLifecycle(final TopicMirror mirror,
      final ObjectProvider<RoleSubscriber> subscriberProvider) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting TopicMirror lifecycle...");
        mirror.start();
        subscriberProvider.ifAvailable(subscriber -> subscriber.register()
            .join());
        running = true;
        log.info("TopicMirror lifecycle started successfully.");
      }

      @Override
      public void stop() {
        log.info("Stopping TopicMirror lifecycle...");
        mirror.stop();
        running = false;
        log.info("TopicMirror lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
