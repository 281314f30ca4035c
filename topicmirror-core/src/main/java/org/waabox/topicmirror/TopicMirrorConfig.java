package org.waabox.topicmirror;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Immutable configuration of a {@link TopicMirror}.
 *
 * <p>Holds the topic root being mirrored, the directory the topic paths are
 * resolved against, the removal policy attached to every created topic and
 * the switches for the optional behaviors. Only the root is required.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicMirrorConfig {

  /** The root of the mirrored topic subtree, never null. */
  private final TopicPath root;

  /** The directory topic paths are relative to, never null. */
  private final Path baseDirectory;

  /** The removal policy of created topics, never null. */
  private final RemovalPolicy removalPolicy;

  /** Whether a missing-topic handler is registered on the root. */
  private final boolean handleMissingTopics;

  /** Whether the root directory is watched for changes. */
  private final boolean watchFileSystem;

  /** Whether files created below the root are published right away. */
  private final boolean publishNewFiles;

  /** Creates a config from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private TopicMirrorConfig(final Builder builder) {
    this.root = Objects.requireNonNull(builder.root,
        "root must not be null");
    this.baseDirectory = builder.baseDirectory != null
        ? builder.baseDirectory.toAbsolutePath().normalize()
        : Paths.get("").toAbsolutePath();
    this.removalPolicy = builder.removalPolicy != null
        ? builder.removalPolicy
        : RemovalPolicy.defaultPolicy();
    this.handleMissingTopics = builder.handleMissingTopics;
    this.watchFileSystem = builder.watchFileSystem;
    this.publishNewFiles = builder.publishNewFiles;
  }

  /**
   * Returns the root of the mirrored topic subtree.
   *
   * @return the root, never null
   */
  public TopicPath root() {
    return root;
  }

  /**
   * Returns the directory topic paths are resolved against.
   *
   * <p>Defaults to the working directory of the process.
   *
   * @return the absolute base directory, never null
   */
  public Path baseDirectory() {
    return baseDirectory;
  }

  /**
   * Returns the directory backing the root topic.
   *
   * @return the absolute root directory, never null
   */
  public Path rootDirectory() {
    return root.resolveAgainst(baseDirectory);
  }

  /**
   * Returns the removal policy attached to created topics.
   *
   * @return the policy, never null
   */
  public RemovalPolicy removalPolicy() {
    return removalPolicy;
  }

  /**
   * Returns whether a missing-topic handler is registered on the root.
   *
   * @return true by default
   */
  public boolean handleMissingTopics() {
    return handleMissingTopics;
  }

  /**
   * Returns whether the root directory is watched for changes.
   *
   * @return true by default
   */
  public boolean watchFileSystem() {
    return watchFileSystem;
  }

  /**
   * Returns whether files created below the root are published when they
   * appear, instead of waiting for a subscriber to ask for them.
   *
   * @return true by default
   */
  public boolean publishNewFiles() {
    return publishNewFiles;
  }

  /**
   * Creates a new builder for constructing a {@link TopicMirrorConfig}.
   *
   * @return a new builder instance, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "TopicMirrorConfig[root=" + root
        + ", baseDirectory=" + baseDirectory
        + ", removalPolicy=" + removalPolicy.toExpression()
        + ", handleMissingTopics=" + handleMissingTopics
        + ", watchFileSystem=" + watchFileSystem
        + ", publishNewFiles=" + publishNewFiles + "]";
  }

  /**
   * A builder for constructing {@link TopicMirrorConfig} instances.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The topic root. */
    private TopicPath root;

    /** The base directory. */
    private Path baseDirectory;

    /** The removal policy. */
    private RemovalPolicy removalPolicy;

    /** The missing-topic switch. */
    private boolean handleMissingTopics = true;

    /** The file system watch switch. */
    private boolean watchFileSystem = true;

    /** The new file switch. */
    private boolean publishNewFiles = true;

    /** Private constructor to enforce usage via
     * {@link TopicMirrorConfig#builder()}.
     */
    private Builder() {
    }

    /**
     * Sets the root of the mirrored topic subtree.
     *
     * @param theRoot the root, such as {@code "cdn"}, never null
     * @return this builder for chaining, never null
     */
    public Builder root(final String theRoot) {
      this.root = TopicPath.of(theRoot);
      return this;
    }

    /**
     * Sets the root of the mirrored topic subtree.
     *
     * @param theRoot the root, never null
     * @return this builder for chaining, never null
     */
    public Builder root(final TopicPath theRoot) {
      this.root = theRoot;
      return this;
    }

    /**
     * Sets the directory topic paths are resolved against.
     *
     * <p>If not set, defaults to the working directory.
     *
     * @param theBaseDirectory the directory, may be null for default
     * @return this builder for chaining, never null
     */
    public Builder baseDirectory(final Path theBaseDirectory) {
      this.baseDirectory = theBaseDirectory;
      return this;
    }

    /**
     * Sets the removal policy attached to created topics.
     *
     * @param thePolicy the policy, may be null for the default
     * @return this builder for chaining, never null
     */
    public Builder removalPolicy(final RemovalPolicy thePolicy) {
      this.removalPolicy = thePolicy;
      return this;
    }

    /**
     * Enables or disables the missing-topic handler.
     *
     * @param enabled whether to register the handler
     * @return this builder for chaining, never null
     */
    public Builder handleMissingTopics(final boolean enabled) {
      this.handleMissingTopics = enabled;
      return this;
    }

    /**
     * Enables or disables the directory watcher.
     *
     * @param enabled whether to watch the root directory
     * @return this builder for chaining, never null
     */
    public Builder watchFileSystem(final boolean enabled) {
      this.watchFileSystem = enabled;
      return this;
    }

    /**
     * Enables or disables publishing files as soon as they are created.
     *
     * @param enabled whether to publish new files
     * @return this builder for chaining, never null
     */
    public Builder publishNewFiles(final boolean enabled) {
      this.publishNewFiles = enabled;
      return this;
    }

    /**
     * Builds the {@link TopicMirrorConfig} instance.
     *
     * @return a new immutable config instance, never null
     *
     * @throws NullPointerException if the root is not set
     */
    public TopicMirrorConfig build() {
      return new TopicMirrorConfig(this);
    }
  }
}
