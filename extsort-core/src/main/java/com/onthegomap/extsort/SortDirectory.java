package com.onthegomap.extsort;

import com.onthegomap.extsort.util.FileUtils;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The directory that segment files for one sort get written to.
 * <p>
 * Nothing touches the filesystem until the first segment path is requested, so sorts that fit in memory never create a
 * directory. When no directory is configured, a new temporary directory is created and owned by this instance: closing
 * it deletes the directory along with every segment inside. A directory supplied by the caller is never deleted.
 * <p>
 * Owned directories that are still open when the JVM exits get deleted by a single shutdown hook, which forgets about
 * each directory once it is closed.
 */
@NotThreadSafe
class SortDirectory implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SortDirectory.class);
  private static final String TEMP_DIR_PREFIX = "extsort";

  private final Path configured;
  private Path path = null;
  private boolean closed = false;

  private SortDirectory(Path configured) {
    this.configured = configured;
  }

  /** Returns a directory that resolves to {@code sortDir}, or a new temp directory if {@code sortDir} is null. */
  static SortDirectory of(Path sortDir) {
    return new SortDirectory(sortDir);
  }

  /** Returns true if this instance created the directory and is responsible for deleting it. */
  boolean owned() {
    return configured == null;
  }

  /** Returns true if the directory has been resolved, which happens on the first spill. */
  boolean created() {
    return path != null;
  }

  /** Returns the resolved directory, or {@code null} if no segment has been written yet. */
  Path path() {
    return path;
  }

  /** Returns the path to the file for segment number {@code index}, creating the directory if this is the first. */
  Path segmentPath(int index) throws IOException {
    return get().resolve(Integer.toString(index));
  }

  private Path get() throws IOException {
    if (closed) {
      throw new IllegalStateException("Sort directory already closed");
    }
    if (path == null) {
      if (configured != null) {
        FileUtils.createDirectory(configured);
        path = configured;
      } else {
        path = Files.createTempDirectory(TEMP_DIR_PREFIX);
        ExitCleanup.OPEN.add(path);
      }
      LOGGER.info("Sort buffer full, writing segments to {}", path);
    }
    return path;
  }

  /** Deletes the directory and all segments in it if this instance owns it, otherwise leaves everything in place. */
  @Override
  public void close() {
    if (!closed) {
      closed = true;
      if (path != null && owned()) {
        LOGGER.debug("Deleting sort directory {}", path);
        FileUtils.deleteDirectory(path);
        ExitCleanup.OPEN.remove(path);
      }
    }
  }

  /** Returns the owned directories that would be deleted if the JVM exited now. */
  static Set<Path> pendingExitCleanup() {
    return Collections.unmodifiableSet(ExitCleanup.OPEN);
  }

  @Override
  public String toString() {
    return "SortDirectory[" + (path != null ? path : configured) + (owned() ? ", owned" : "") + "]";
  }

  // holder so the shutdown hook only gets registered once a temp directory is created
  private static final class ExitCleanup {

    private static final Set<Path> OPEN = ConcurrentHashMap.newKeySet();

    static {
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        for (Path dir : OPEN) {
          FileUtils.deleteDirectory(dir);
        }
      }, "extsort-cleanup"));
    }
  }
}
