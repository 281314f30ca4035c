package org.waabox.topicmirror.watch;

import java.nio.file.Path;

/**
 * Receives the file events reported by a {@link DirectoryWatcher}.
 *
 * <p>Callbacks run on the watcher thread, one at a time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FileChangeListener {

  /**
   * Called when a regular file appears below the watched directory.
   *
   * @param file the absolute path of the file, never null
   */
  void onFileCreated(Path file);

  /**
   * Called when the content of a file below the watched directory changes.
   *
   * @param file the absolute path of the file, never null
   */
  void onFileModified(Path file);

  /**
   * Called when a file below the watched directory disappears.
   *
   * <p>Directories are reported too, since a deleted entry can no longer be
   * told apart from a file.
   *
   * @param file the absolute path of the removed entry, never null
   */
  void onFileDeleted(Path file);
}
