package org.waabox.topicmirror;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.metrics.MirrorMetrics;
import org.waabox.topicmirror.metrics.NoopMirrorMetrics;
import org.waabox.topicmirror.session.HandlerRegistration;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.MissingTopicHandler;
import org.waabox.topicmirror.session.MissingTopicNotification;
import org.waabox.topicmirror.session.TopicSpecification;
import org.waabox.topicmirror.session.TopicType;
import org.waabox.topicmirror.watch.DirectoryWatcher;
import org.waabox.topicmirror.watch.FileChangeListener;

/**
 * Keeps a subtree of server topics consistent with a directory of JSON
 * files.
 *
 * <p>Each topic below the root is backed by the file with the same relative
 * path below the base directory, so topic {@code cdn/a.json} holds the
 * content of {@code <base>/cdn/a.json}. The mirror reacts to three sources:
 * <ul>
 *   <li>the server asks for a topic it lacks: the topic is created from its
 *   file, if there is one;</li>
 *   <li>a file is created or changed: the topic is created or updated;</li>
 *   <li>a file is removed: the topic is removed.</li>
 * </ul>
 * Topics added or removed on the server by someone else only update the
 * {@link TrackedTopicSet}.
 *
 * <p>Every operation returns a future that always completes normally with
 * the {@link MirrorOutcome}; failures are logged and recorded in the
 * {@link MirrorMetrics}, never propagated. Topics outside the root are
 * never read, written or removed.
 *
 * <p>Typical usage:
 * <pre>{@code
 * TopicMirror mirror = TopicMirror.builder()
 *     .session(session)
 *     .config(TopicMirrorConfig.builder().root("cdn").build())
 *     .build();
 * mirror.start();
 * // ... on shutdown ...
 * mirror.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopicMirror {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TopicMirror.class);

  /** The session topics are managed through, never null. */
  private final MessagingSession session;

  /** The mirror configuration, never null. */
  private final TopicMirrorConfig config;

  /** The metrics sink, never null. */
  private final MirrorMetrics metrics;

  /** Reads the files backing the topics, never null. */
  private final TopicContentReader reader;

  /** The specification of every topic the mirror creates, never null. */
  private final TopicSpecification specification;

  /** Whether {@link #start()} was called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** The tracked topics, null until started. */
  private volatile TrackedTopicSet topics;

  /** The directory watcher, null when not watching. */
  private volatile DirectoryWatcher watcher;

  /** The missing topic handler registration, null when not handling. */
  private volatile HandlerRegistration missingTopicRegistration;

  /** Creates a mirror from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private TopicMirror(final Builder builder) {
    session = Objects.requireNonNull(builder.session,
        "session must not be null");
    config = Objects.requireNonNull(builder.config,
        "config must not be null");
    metrics = builder.metrics != null
        ? builder.metrics
        : new NoopMirrorMetrics();
    reader = new TopicContentReader(config.baseDirectory());
    specification = TopicSpecification.of(TopicType.JSON).withProperty(
        TopicSpecification.REMOVAL, config.removalPolicy().toExpression());
  }

  /**
   * Creates a new builder for constructing a {@link TopicMirror}.
   *
   * @return a new builder instance, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the mirror.
   *
   * <p>Builds the tracked set from the topics that already exist below the
   * root, then registers the missing-topic handler and starts watching the
   * root directory, as enabled in the configuration. If any step fails,
   * whatever was registered before it is closed again.
   *
   * @return the tracked topic set, never null
   *
   * @throws IllegalStateException if the mirror was already started
   * @throws TopicMirrorException if a registration fails
   */
  public TrackedTopicSet start() {
    if (started.getAndSet(true)) {
      throw new IllegalStateException("TopicMirror already started");
    }

    final TopicPath root = config.root();
    log.info("Starting TopicMirror with {}", config);

    topics = TrackedTopicSet.initialize(session, root);

    try {
      if (config.handleMissingTopics()) {
        missingTopicRegistration = registerMissingTopics(root);
      }
      if (config.watchFileSystem()) {
        final DirectoryWatcher directoryWatcher = new DirectoryWatcher(
            config.rootDirectory(), new FileEvents());
        directoryWatcher.start();
        watcher = directoryWatcher;
      }
    } catch (final RuntimeException e) {
      log.error("Failed to start TopicMirror on {}, releasing registrations",
          root);
      release();
      throw e;
    }

    log.info("TopicMirror started on {} with {} existing topics", root,
        topics.size());
    return topics;
  }

  /** Stops watching the file system, removes the missing topic handler and
   * closes the topic notifications.
   *
   * <p>In-flight operations are not waited for.
   */
  public void stop() {
    if (!started.get()) {
      log.warn("TopicMirror is not running");
      return;
    }
    release();
    log.info("TopicMirror on {} stopped", config.root());
  }

  /** Registers the missing topic handler for the root.
   *
   * @param root the root, never null
   *
   * @return the registration, never null
   *
   * @throws TopicMirrorException if the registration fails
   */
  private HandlerRegistration registerMissingTopics(final TopicPath root) {
    try {
      return session.addMissingTopicHandler(root.value(), new MissingTopics())
          .get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TopicMirrorException(
          "Interrupted while registering missing topic handler on "
              + root, e);
    } catch (final ExecutionException e) {
      throw new TopicMirrorException(
          "Failed to register missing topic handler on " + root,
          e.getCause());
    }
  }

  /** Stops the watcher and closes every registration made by start. */
  private void release() {
    final DirectoryWatcher current = watcher;
    watcher = null;
    if (current != null) {
      current.stop();
    }

    final HandlerRegistration handler = missingTopicRegistration;
    missingTopicRegistration = null;
    if (handler != null) {
      try {
        call(handler::close).join();
      } catch (final CompletionException e) {
        final Throwable cause = unwrap(e);
        log.error("Failed to remove missing topic handler on {}: {}",
            handler.branch(), cause.getMessage(), cause);
      }
    }

    final TrackedTopicSet set = topics;
    if (set != null) {
      set.close();
    }
  }

  /**
   * Mirrors the creation of a file.
   *
   * <p>The file is published as a topic when new files are published or
   * when its topic is already tracked.
   *
   * @param path the topic path of the file, never null
   *
   * @return the outcome, never null, never completes exceptionally
   */
  public CompletableFuture<MirrorOutcome> onFileCreated(
      final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    final TrackedTopicSet set = trackedTopics();

    if (!isMirrored(path)) {
      return done(MirrorOutcome.IGNORED);
    }
    if (!config.publishNewFiles() && !set.contains(path)) {
      log.debug("Ignoring new file for untracked topic {}", path);
      return done(MirrorOutcome.IGNORED);
    }
    log.info("File for topic {} created", path);
    return publish(path, false);
  }

  /**
   * Mirrors a change of a file into its topic.
   *
   * <p>Only tracked topics are updated. A file that vanished before it
   * could be read is skipped; malformed content leaves the topic as is.
   *
   * @param path the topic path of the file, never null
   *
   * @return the outcome, never null, never completes exceptionally
   */
  public CompletableFuture<MirrorOutcome> onFileChanged(
      final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    final TrackedTopicSet set = trackedTopics();

    if (!isMirrored(path) || !set.contains(path)) {
      return done(MirrorOutcome.IGNORED);
    }
    log.info("Updating topic {}", path);
    return publish(path, false);
  }

  /**
   * Mirrors the removal of a file by removing its topic.
   *
   * <p>The path leaves the tracked set before the server confirms the
   * removal, so a second call for the same path is ignored.
   *
   * @param path the topic path of the file, never null
   *
   * @return the outcome, never null, never completes exceptionally
   */
  public CompletableFuture<MirrorOutcome> onFileRemoved(
      final TopicPath path) {
    Objects.requireNonNull(path, "path must not be null");
    final TrackedTopicSet set = trackedTopics();

    if (!isMirrored(path) || !set.remove(path)) {
      return done(MirrorOutcome.IGNORED);
    }

    log.info("File for topic {} removed", path);
    return removeTopic(path);
  }

  /**
   * Satisfies a request for a topic that does not exist.
   *
   * <p>Creates the topic from its file when there is one. The notification
   * is told to proceed once the attempt settled, whatever its outcome.
   *
   * @param notification the missing topic request, never null
   *
   * @return the outcome, never null, never completes exceptionally
   */
  public CompletableFuture<MirrorOutcome> onMissingTopicRequested(
      final MissingTopicNotification notification) {
    Objects.requireNonNull(notification, "notification must not be null");
    trackedTopics();

    CompletableFuture<MirrorOutcome> outcome;
    try {
      final TopicPath path = TopicPath.of(notification.path());
      if (isMirrored(path)) {
        outcome = publish(path, true);
      } else {
        log.warn("Ignoring missing topic {} outside of {}", path,
            config.root());
        outcome = done(MirrorOutcome.IGNORED);
      }
    } catch (final IllegalArgumentException e) {
      log.warn("Ignoring missing topic request for invalid path '{}'",
          notification.path());
      outcome = done(MirrorOutcome.IGNORED);
    }

    return outcome.whenComplete((result, error) -> proceed(notification));
  }

  /**
   * Returns the tracked topic set.
   *
   * @return the set, never null
   *
   * @throws IllegalStateException if the mirror was not started
   */
  public TrackedTopicSet trackedTopics() {
    final TrackedTopicSet set = topics;
    if (set == null) {
      throw new IllegalStateException("TopicMirror not started");
    }
    return set;
  }

  /**
   * Returns the mirror configuration.
   *
   * @return the configuration, never null
   */
  public TopicMirrorConfig config() {
    return config;
  }

  /**
   * Returns the specification attached to every topic the mirror creates.
   *
   * @return the specification, never null
   */
  public TopicSpecification specification() {
    return specification;
  }

  /**
   * Reads a file and writes it as the value of its topic.
   *
   * @param path the topic path, never null
   * @param requested whether a subscriber asked for the topic
   *
   * @return the outcome, never null, never completes exceptionally
   */
  private CompletableFuture<MirrorOutcome> publish(final TopicPath path,
      final boolean requested) {
    final JsonNode content;
    try {
      content = reader.read(path);
    } catch (final NoSuchFileException e) {
      if (requested) {
        log.warn("Cannot satisfy missing topic {}, no existing file", path);
        metrics.missingTopicUnsatisfied(path.value());
      } else {
        log.warn("File for topic {} no longer exists, skipping", path);
      }
      return done(MirrorOutcome.FILE_NOT_FOUND);
    } catch (final MalformedTopicContentException e) {
      log.error(e.getMessage(), e);
      metrics.mirrorFailed(path.value(), e);
      return done(MirrorOutcome.MALFORMED_CONTENT);
    } catch (final IOException e) {
      log.error("Failed to read file for topic {}: {}", path,
          e.getMessage(), e);
      metrics.mirrorFailed(path.value(), e);
      return done(MirrorOutcome.FAILED);
    }

    return call(() -> session.set(path.value(), content, specification))
        .handle((ignored, error) -> {
          if (error != null) {
            final Throwable cause = unwrap(error);
            log.error("Failed to set topic {}: {}", path,
                cause.getMessage(), cause);
            metrics.mirrorFailed(path.value(), cause);
            return done(MirrorOutcome.FAILED);
          }
          // A removal event seen while the set was in flight was ignored,
          // as the path was not tracked yet.
          if (!reader.exists(path)) {
            log.warn("File for topic {} was removed while publishing", path);
            topics.remove(path);
            return removeTopic(path);
          }
          topics.add(path);
          log.info("Published topic {}", path);
          metrics.topicPublished(path.value());
          return done(MirrorOutcome.PUBLISHED);
        })
        .thenCompose(Function.identity());
  }

  /**
   * Removes a topic from the server.
   *
   * @param path the topic path, never null
   *
   * @return the outcome, never null, never completes exceptionally
   */
  private CompletableFuture<MirrorOutcome> removeTopic(final TopicPath path) {
    return call(() -> session.remove(path.pathSelector()))
        .handle((removed, error) -> {
          if (error != null) {
            final Throwable cause = unwrap(error);
            log.error("Failed to remove topic {}: {}", path,
                cause.getMessage(), cause);
            metrics.mirrorFailed(path.value(), cause);
            return MirrorOutcome.FAILED;
          }
          log.info("Removed topic {}", path);
          metrics.topicRemoved(path.value());
          return MirrorOutcome.REMOVED;
        });
  }

  /** Checks whether a path belongs to the mirrored subtree.
   *
   * @param path the path, never null
   *
   * @return true if the path is at or below the root
   */
  private boolean isMirrored(final TopicPath path) {
    return path.isUnder(config.root());
  }

  /** Tells a missing topic request to proceed, logging a failure.
   *
   * @param notification the request, never null
   */
  private static void proceed(final MissingTopicNotification notification) {
    try {
      notification.proceed();
    } catch (final RuntimeException e) {
      log.error("Failed to proceed missing topic request for {}: {}",
          notification.path(), e.getMessage(), e);
    }
  }

  /** Invokes a session call, turning a synchronous failure into a failed
   * future.
   *
   * @param <T> the result type
   * @param action the call, never null
   *
   * @return the future of the call, never null
   */
  private static <T> CompletableFuture<T> call(
      final SessionCall<T> action) {
    try {
      return action.invoke();
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Removes the completion wrapper of an asynchronous failure.
   *
   * @param error the failure, never null
   *
   * @return the underlying cause, never null
   */
  private static Throwable unwrap(final Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  /** Returns an already completed outcome.
   *
   * @param outcome the outcome, never null
   *
   * @return the completed future, never null
   */
  private static CompletableFuture<MirrorOutcome> done(
      final MirrorOutcome outcome) {
    return CompletableFuture.completedFuture(outcome);
  }

  /** An asynchronous call into the session.
   *
   * @param <T> the result type
   */
  @FunctionalInterface
  private interface SessionCall<T> {

    /** Performs the call.
     *
     * @return the future of the call, never null
     */
    CompletableFuture<T> invoke();
  }

  /** Routes missing topic requests for the root into the mirror. */
  private final class MissingTopics implements MissingTopicHandler {

    @Override
    public void onMissingTopic(final MissingTopicNotification notification) {
      log.info("Missing topic notification: path={}, selector={}, "
          + "session={}", notification.path(), notification.selector(),
          notification.sessionId());
      onMissingTopicRequested(notification);
    }

    @Override
    public void onRegister(final String branch) {
      log.info("Registered missing topic handler on path {}", branch);
    }

    @Override
    public void onClose(final String branch) {
      log.info("Missing topic handler closed for path {}", branch);
    }

    @Override
    public void onError(final String branch, final Throwable error) {
      log.error("Missing topic handler for path {} failed: {}", branch,
          error.getMessage(), error);
    }
  }

  /** Routes file events from the directory watcher into the mirror. */
  private final class FileEvents implements FileChangeListener {

    @Override
    public void onFileCreated(final Path file) {
      final TopicPath path = toTopicPath(file);
      if (path != null) {
        TopicMirror.this.onFileCreated(path);
      }
    }

    @Override
    public void onFileModified(final Path file) {
      final TopicPath path = toTopicPath(file);
      if (path == null) {
        return;
      }
      // A file written in place may have been unreadable when created.
      if (config.publishNewFiles() && !trackedTopics().contains(path)) {
        TopicMirror.this.onFileCreated(path);
      } else {
        onFileChanged(path);
      }
    }

    @Override
    public void onFileDeleted(final Path file) {
      final TopicPath path = toTopicPath(file);
      if (path != null) {
        onFileRemoved(path);
      }
    }

    /** Maps a file to its topic path.
     *
     * @param file the file, never null
     *
     * @return the topic path, null if the file has none
     */
    private TopicPath toTopicPath(final Path file) {
      try {
        return TopicPath.fromFile(config.baseDirectory(), file);
      } catch (final IllegalArgumentException e) {
        log.debug("Ignoring file {}: {}", file, e.getMessage());
        return null;
      }
    }
  }

  /**
   * A builder for constructing {@link TopicMirror} instances.
   *
   * <p>Required fields: {@code session} and {@code config}. Optional:
   * {@code metrics} (defaults to {@link NoopMirrorMetrics}).
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The session. */
    private MessagingSession session;

    /** The configuration. */
    private TopicMirrorConfig config;

    /** The metrics sink. */
    private MirrorMetrics metrics;

    /** Private constructor to enforce usage via
     * {@link TopicMirror#builder()}.
     */
    private Builder() {
    }

    /**
     * Sets the session topics are managed through.
     *
     * @param theSession the session, never null
     * @return this builder for chaining, never null
     */
    public Builder session(final MessagingSession theSession) {
      this.session = theSession;
      return this;
    }

    /**
     * Sets the mirror configuration.
     *
     * @param theConfig the configuration, never null
     * @return this builder for chaining, never null
     */
    public Builder config(final TopicMirrorConfig theConfig) {
      this.config = theConfig;
      return this;
    }

    /**
     * Sets the metrics sink.
     *
     * @param theMetrics the metrics, may be null for no metrics
     * @return this builder for chaining, never null
     */
    public Builder metrics(final MirrorMetrics theMetrics) {
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the {@link TopicMirror} instance.
     *
     * @return a new mirror, never null
     *
     * @throws NullPointerException if the session or config is not set
     */
    public TopicMirror build() {
      return new TopicMirror(this);
    }
  }
}
