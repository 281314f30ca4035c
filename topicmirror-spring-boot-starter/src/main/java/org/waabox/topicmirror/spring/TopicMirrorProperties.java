package org.waabox.topicmirror.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the topic mirror, mapped from the
 * {@code topicmirror.*} prefix in application.yml or
 * application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code topicmirror.root} - the topic root to mirror, defaults to
 *       {@code cdn}.</li>
 *   <li>{@code topicmirror.base-directory} - the directory topic paths are
 *       relative to, defaults to the working directory.</li>
 *   <li>{@code topicmirror.removal-policy} - the removal policy of created
 *       topics, such as {@code when subscriptions < 1 for 1m}.</li>
 *   <li>{@code topicmirror.handle-missing-topics},
 *       {@code topicmirror.watch-file-system} and
 *       {@code topicmirror.publish-new-files} - feature switches, all on
 *       by default.</li>
 *   <li>{@code topicmirror.role-subscription.role} and
 *       {@code topicmirror.role-subscription.selector} - subscribe every
 *       session with the role to the selector.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "topicmirror")
public class TopicMirrorProperties {

  /** The topic root to mirror. */
  private String root = "cdn";

  /** The base directory, null means the working directory. */
  private String baseDirectory;

  /** The removal policy expression, null means the default policy. */
  private String removalPolicy;

  /** Whether a missing-topic handler is registered on the root. */
  private boolean handleMissingTopics = true;

  /** Whether the root directory is watched. */
  private boolean watchFileSystem = true;

  /** Whether new files are published as soon as they appear. */
  private boolean publishNewFiles = true;

  /** The role based subscription, never null. */
  private final RoleSubscription roleSubscription = new RoleSubscription();

  /**
   * Returns the topic root.
   *
   * @return the root, never null
   */
  public String getRoot() {
    return root;
  }

  /**
   * Sets the topic root.
   *
   * @param root the root, never null
   */
  public void setRoot(final String root) {
    this.root = root;
  }

  /**
   * Returns the base directory.
   *
   * @return the directory, or null for the working directory
   */
  public String getBaseDirectory() {
    return baseDirectory;
  }

  /**
   * Sets the base directory.
   *
   * @param baseDirectory the directory, may be null
   */
  public void setBaseDirectory(final String baseDirectory) {
    this.baseDirectory = baseDirectory;
  }

  /**
   * Returns the removal policy expression.
   *
   * @return the expression, or null for the default policy
   */
  public String getRemovalPolicy() {
    return removalPolicy;
  }

  /**
   * Sets the removal policy expression.
   *
   * @param removalPolicy the expression, may be null
   */
  public void setRemovalPolicy(final String removalPolicy) {
    this.removalPolicy = removalPolicy;
  }

  public boolean isHandleMissingTopics() {
    return handleMissingTopics;
  }

  public void setHandleMissingTopics(final boolean handleMissingTopics) {
    this.handleMissingTopics = handleMissingTopics;
  }

  public boolean isWatchFileSystem() {
    return watchFileSystem;
  }

  public void setWatchFileSystem(final boolean watchFileSystem) {
    this.watchFileSystem = watchFileSystem;
  }

  public boolean isPublishNewFiles() {
    return publishNewFiles;
  }

  public void setPublishNewFiles(final boolean publishNewFiles) {
    this.publishNewFiles = publishNewFiles;
  }

  /**
   * Returns the role based subscription settings.
   *
   * @return the settings, never null
   */
  public RoleSubscription getRoleSubscription() {
    return roleSubscription;
  }

  /** Settings of the role based subscription. */
  public static class RoleSubscription {

    /** The role to look for, null disables the subscription. */
    private String role;

    /** The selector sessions with the role are subscribed to. */
    private String selector;

    public String getRole() {
      return role;
    }

    public void setRole(final String role) {
      this.role = role;
    }

    public String getSelector() {
      return selector;
    }

    public void setSelector(final String selector) {
      this.selector = selector;
    }
  }
}
