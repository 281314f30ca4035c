package org.waabox.topicmirror.config;

import java.util.Objects;
import java.util.Optional;

/** The static descriptor of the messaging server connection, loaded once
 * at startup.
 *
 * <p>Instances are immutable. Use {@link #create(String)} for an anonymous
 * connection on the default port, or
 * {@link #create(String, int, boolean, String, String)} for full control.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ServerConfig {

  /** The default server port. */
  public static final int DEFAULT_PORT = 8080;

  /** The server host name, never null. */
  private final String host;

  /** The server port. */
  private final int port;

  /** Whether the connection uses TLS. */
  private final boolean secure;

  /** The principal to authenticate as, null when anonymous. */
  private final String principal;

  /** The password of the principal, may be null. */
  private final String credentials;

  /** Creates a new ServerConfig.
   *
   * @param theHost the server host name, never null
   * @param thePort the server port, between 1 and 65535
   * @param isSecure whether the connection uses TLS
   * @param thePrincipal the principal, may be null
   * @param theCredentials the credentials, may be null
   */
  private ServerConfig(final String theHost, final int thePort,
      final boolean isSecure, final String thePrincipal,
      final String theCredentials) {
    host = Objects.requireNonNull(theHost, "host must not be null");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (thePort < 1 || thePort > 65535) {
      throw new IllegalArgumentException("Invalid port: " + thePort);
    }
    port = thePort;
    secure = isSecure;
    principal = thePrincipal;
    credentials = theCredentials;
  }

  /** Creates an anonymous, plain text descriptor on the default port.
   *
   * @param host the server host name, never null
   *
   * @return a new ServerConfig, never null
   */
  public static ServerConfig create(final String host) {
    return new ServerConfig(host, DEFAULT_PORT, false, null, null);
  }

  /** Creates a descriptor.
   *
   * @param host the server host name, never null
   * @param port the server port, between 1 and 65535
   * @param secure whether the connection uses TLS
   * @param principal the principal, null for an anonymous connection
   * @param credentials the credentials, may be null
   *
   * @return a new ServerConfig, never null
   */
  public static ServerConfig create(final String host, final int port,
      final boolean secure, final String principal,
      final String credentials) {
    return new ServerConfig(host, port, secure, principal, credentials);
  }

  /** Returns the server host name.
   *
   * @return the host, never null
   */
  public String host() {
    return host;
  }

  /** Returns the server port.
   *
   * @return the port
   */
  public int port() {
    return port;
  }

  /** Returns whether the connection uses TLS.
   *
   * @return true for a secure connection
   */
  public boolean secure() {
    return secure;
  }

  /** Returns the principal to authenticate as.
   *
   * @return the principal, empty for an anonymous connection
   */
  public Optional<String> principal() {
    return Optional.ofNullable(principal);
  }

  /** Returns the credentials of the principal.
   *
   * @return the credentials, empty if none are configured
   */
  public Optional<String> credentials() {
    return Optional.ofNullable(credentials);
  }

  /** Returns the connection URL, without credentials.
   *
   * @return the URL, never null
   */
  public String url() {
    return (secure ? "wss://" : "ws://") + host + ":" + port;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "ServerConfig[url=" + url() + ", principal="
        + (principal == null ? "<anonymous>" : principal) + "]";
  }
}
