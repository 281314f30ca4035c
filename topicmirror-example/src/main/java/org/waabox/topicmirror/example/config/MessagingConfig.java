package org.waabox.topicmirror.example.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import org.waabox.topicmirror.TopicMirrorException;
import org.waabox.topicmirror.config.ServerConfig;
import org.waabox.topicmirror.config.ServerConfigCodec;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

/** Spring configuration that defines the messaging beans of the example
 * application.
 *
 * <p>This configuration provides:
 * <ul>
 *   <li>{@link LocalMessagingServer}, an in-process server that knows the
 *       {@code control} and {@code trader} principals</li>
 *   <li>{@link ServerConfig}, the connection descriptor read from
 *       {@code serverConfig.json}</li>
 *   <li>{@link MessagingSession}, the control session picked up by the
 *       topicmirror-spring-boot-starter auto-configuration</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
public class MessagingConfig {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MessagingConfig.class);

  /** The principal that manages topics and other sessions. */
  public static final String CONTROL_PRINCIPAL = "control";

  /** The principal subscribing as a trader. */
  public static final String TRADER_PRINCIPAL = "trader";

  /** Creates the in-process messaging server.
   *
   * @return the server, never null
   */
  @Bean(destroyMethod = "close")
  public LocalMessagingServer messagingServer() {
    final LocalMessagingServer server = new LocalMessagingServer();
    server.addPrincipal(CONTROL_PRINCIPAL,
        Set.of("CLIENT_CONTROL", "TOPIC_CONTROL"));
    server.addPrincipal(TRADER_PRINCIPAL, Set.of("CLIENT", "TRADER"));
    return server;
  }

  /** Reads the connection descriptor.
   *
   * @param resource the JSON descriptor, never null
   *
   * @return the descriptor, never null
   */
  @Bean
  public ServerConfig serverConfig(
      @Value("${example.server-config:classpath:serverConfig.json}")
          final Resource resource) {
    try (InputStream in = resource.getInputStream()) {
      return ServerConfigCodec.read(in);
    } catch (final IOException e) {
      throw new TopicMirrorException(
          "Failed to read server configuration from " + resource, e);
    }
  }

  /** Connects the control session.
   *
   * @param server the messaging server, never null
   * @param config the connection descriptor, never null
   *
   * @return the open session, never null
   */
  @Bean(destroyMethod = "close")
  public MessagingSession controlSession(final LocalMessagingServer server,
      final ServerConfig config) {
    final MessagingSession session = server.connect(config);
    log.info("Connected session {} to {}", session.sessionId(),
        config.host());
    return session;
  }
}
