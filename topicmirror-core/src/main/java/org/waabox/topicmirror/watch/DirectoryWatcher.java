package org.waabox.topicmirror.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.TopicMirrorException;

/** Watches a directory tree and reports file creations, modifications and
 * deletions to a {@link FileChangeListener}.
 *
 * <p>Every directory below the watched one is registered, including the
 * ones created while the watcher runs. Files that already exist when the
 * watcher starts are not reported. Events are delivered on a single daemon
 * thread, in the order the platform reports them.
 *
 * <p>Typical usage:
 * <pre>
 *   DirectoryWatcher watcher = new DirectoryWatcher(dir, listener);
 *   watcher.start();
 *   // ... on shutdown ...
 *   watcher.stop();
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DirectoryWatcher {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      DirectoryWatcher.class);

  /** The watched directory, never null. */
  private final Path directory;

  /** The listener receiving the events, never null. */
  private final FileChangeListener listener;

  /** The registered directories by watch key. */
  private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();

  /** Flag indicating whether the watch loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The watch service, created on {@link #start()}. */
  private volatile WatchService watchService;

  /** The daemon thread running the watch loop. */
  private volatile Thread watchThread;

  /** Creates a new DirectoryWatcher.
   *
   * @param theDirectory the directory to watch, never null
   * @param theListener the listener to notify, never null
   */
  public DirectoryWatcher(final Path theDirectory,
      final FileChangeListener theListener) {
    directory = Objects.requireNonNull(theDirectory,
        "directory must not be null").toAbsolutePath().normalize();
    listener = Objects.requireNonNull(theListener,
        "listener must not be null");
  }

  /** Starts watching. The directory is created if it does not exist.
   *
   * @throws TopicMirrorException if the directory cannot be registered
   */
  public void start() {
    if (running.getAndSet(true)) {
      log.warn("DirectoryWatcher on {} is already running", directory);
      return;
    }

    try {
      Files.createDirectories(directory);
      watchService = directory.getFileSystem().newWatchService();
      registerTree(directory, false);
    } catch (final IOException e) {
      running.set(false);
      closeQuietly(watchService);
      watchService = null;
      throw new TopicMirrorException("Failed to watch directory "
          + directory, e);
    }

    watchThread = new Thread(this::watchLoop, "topicmirror-directory-watcher");
    watchThread.setDaemon(true);
    watchThread.start();

    log.info("Watching directory {}", directory);
  }

  /** Stops watching and waits for the watch thread to finish. */
  public void stop() {
    if (!running.getAndSet(false)) {
      log.warn("DirectoryWatcher on {} is not running", directory);
      return;
    }

    closeQuietly(watchService);

    final Thread thread = watchThread;
    if (thread != null && thread != Thread.currentThread()) {
      try {
        thread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for watch thread to stop");
      }
    }

    keys.clear();
    watchService = null;
    watchThread = null;

    log.info("Stopped watching directory {}", directory);
  }

  /** Returns whether the watcher is running.
   *
   * @return true between start and stop
   */
  public boolean isRunning() {
    return running.get();
  }

  /** Returns the watched directory.
   *
   * @return the absolute directory, never null
   */
  public Path directory() {
    return directory;
  }

  /** The watch loop. Runs in a daemon thread until {@link #stop()} is
   * called.
   */
  private void watchLoop() {
    while (running.get()) {
      final WatchKey key;
      try {
        key = watchService.take();
      } catch (final ClosedWatchServiceException e) {
        break;
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }

      final Path dir = keys.get(key);
      if (dir != null) {
        for (final WatchEvent<?> event : key.pollEvents()) {
          handle(dir, event);
        }
      }
      if (!key.reset()) {
        keys.remove(key);
      }
    }
  }

  /** Translates a single watch event into listener calls.
   *
   * @param dir the directory the event belongs to, never null
   * @param event the event, never null
   */
  private void handle(final Path dir, final WatchEvent<?> event) {
    final WatchEvent.Kind<?> kind = event.kind();
    if (kind == OVERFLOW) {
      log.warn("File events were lost while watching {}", dir);
      return;
    }

    final Path child = dir.resolve((Path) event.context());
    if (kind == ENTRY_CREATE) {
      if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
        // Files may land in the new directory before it is registered.
        try {
          registerTree(child, true);
        } catch (final IOException e) {
          log.error("Failed to watch directory {}: {}", child,
              e.getMessage(), e);
        }
      } else {
        notifyCreated(child);
      }
    } else if (kind == ENTRY_MODIFY) {
      if (Files.isRegularFile(child)) {
        notifyModified(child);
      }
    } else if (kind == ENTRY_DELETE) {
      notifyDeleted(child);
    }
  }

  /** Registers a directory and all directories below it.
   *
   * @param start the top directory, never null
   * @param reportFiles whether files found along the way are reported as
   *     created
   *
   * @throws IOException if a directory cannot be registered
   */
  private void registerTree(final Path start, final boolean reportFiles)
      throws IOException {
    Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(final Path dir,
          final BasicFileAttributes attrs) throws IOException {
        final WatchKey key = dir.register(watchService, ENTRY_CREATE,
            ENTRY_MODIFY, ENTRY_DELETE);
        keys.put(key, dir);
        log.debug("Registered directory {}", dir);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(final Path file,
          final BasicFileAttributes attrs) {
        if (reportFiles && attrs.isRegularFile()) {
          notifyCreated(file);
        }
        return FileVisitResult.CONTINUE;
      }
    });
  }

  /** Reports a created file.
   *
   * <p>Package-private for testability.
   *
   * @param file the file, never null
   */
  void notifyCreated(final Path file) {
    try {
      listener.onFileCreated(file);
    } catch (final Exception e) {
      log.error("Listener failed processing creation of {}: {}", file,
          e.getMessage(), e);
    }
  }

  /** Reports a modified file.
   *
   * @param file the file, never null
   */
  void notifyModified(final Path file) {
    try {
      listener.onFileModified(file);
    } catch (final Exception e) {
      log.error("Listener failed processing change of {}: {}", file,
          e.getMessage(), e);
    }
  }

  /** Reports a deleted file.
   *
   * @param file the file, never null
   */
  void notifyDeleted(final Path file) {
    try {
      listener.onFileDeleted(file);
    } catch (final Exception e) {
      log.error("Listener failed processing removal of {}: {}", file,
          e.getMessage(), e);
    }
  }

  /** Closes a watch service quietly, logging any errors.
   *
   * @param service the service to close, may be null
   */
  private static void closeQuietly(final WatchService service) {
    if (service != null) {
      try {
        service.close();
      } catch (final IOException e) {
        log.warn("Error closing watch service: {}", e.getMessage(), e);
      }
    }
  }
}
