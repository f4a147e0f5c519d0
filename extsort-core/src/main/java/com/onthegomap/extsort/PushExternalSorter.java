package com.onthegomap.extsort;

import com.onthegomap.extsort.config.SortOptions;
import com.onthegomap.extsort.util.DiskBacked;
import com.onthegomap.extsort.util.Format;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts items one at a time in any order, spilling sorted segments to disk whenever the in-memory buffer grows past
 * {@link SortOptions#segmentSize()}, then hands everything off to a {@link SortedIterator} when {@link #done()} is
 * called.
 * <p>
 * The sort directory is only created on the first spill, so data sets that fit in the buffer never touch disk.
 * <p>
 * Only supports single-threaded writes. After {@link #done()} or a failed spill the sorter can't be used again. Call
 * {@link #close()} to abandon a sort before it is done and delete any segments it wrote to a temp directory.
 *
 * @param <T> type of item being sorted
 */
@NotThreadSafe
public class PushExternalSorter<T> implements Closeable, DiskBacked {

  private static final Logger LOGGER = LoggerFactory.getLogger(PushExternalSorter.class);
  private static final Format FORMAT = Format.defaultInstance();

  private final SortOptions options;
  private final ItemCodec<T> codec;
  private final Comparator<? super T> comparator;
  private final SortDirectory sortDir;
  private final List<Segment<T>> segments = new ArrayList<>();
  private List<T> buffer = new ArrayList<>();
  private long count = 0;
  private boolean finished = false;

  PushExternalSorter(SortOptions options, ItemCodec<T> codec, Comparator<? super T> comparator) {
    this.options = Objects.requireNonNull(options);
    this.codec = Objects.requireNonNull(codec);
    this.comparator = Objects.requireNonNull(comparator);
    this.sortDir = SortDirectory.of(options.sortDir());
  }

  /**
   * Adds {@code item} to the buffer, sorting and writing the buffer to a new segment if it is full.
   *
   * @throws IOException           if the segment could not be written, after which this sorter is unusable
   * @throws IllegalStateException if the sorter is already done or failed
   */
  public void push(T item) throws IOException {
    Objects.requireNonNull(item, "item");
    ensureOpen();
    buffer.add(item);
    count++;
    if (buffer.size() > options.segmentSize()) {
      try {
        sortAndWriteSegment();
      } catch (IOException | RuntimeException e) {
        abort();
        throw e;
      }
    }
  }

  /** Calls {@link #push(Object)} on every item from {@code items}. */
  public void pushAll(Iterator<? extends T> items) throws IOException {
    while (items.hasNext()) {
      push(items.next());
    }
  }

  /** Calls {@link #push(Object)} on every item from {@code items}. */
  public void pushAll(Iterable<? extends T> items) throws IOException {
    pushAll(items.iterator());
  }

  /**
   * Finishes the sort and returns an iterator over every item pushed so far in ascending order.
   * <p>
   * If anything was already spilled, the rest of the buffer gets written as one last segment so that the merge only
   * reads from disk. Otherwise the buffer is sorted in place and returned directly from memory.
   * <p>
   * The returned iterator takes over the sort directory and must be closed (or exhausted) to release it.
   *
   * @throws IOException if the last segment can't be written or segments can't be opened for reading
   */
  public SortedIterator<T> done() throws IOException {
    ensureOpen();
    finished = true;
    try {
      ArrayDeque<T> inMemory = null;
      if (segments.isEmpty()) {
        sortBuffer();
        inMemory = new ArrayDeque<>(buffer);
      } else if (!buffer.isEmpty()) {
        sortAndWriteSegment();
      }
      buffer = null;
      return new SortedIterator<>(sortDir, inMemory, segments, count, comparator, options.heapMergeThreshold());
    } catch (IOException | RuntimeException e) {
      abort();
      throw e;
    }
  }

  /** Returns the number of items pushed so far. */
  public long count() {
    return count;
  }

  /** Returns the number of segments written to disk so far. */
  public int segmentCount() {
    return segments.size();
  }

  /** Returns the directory segments are written to, or {@code null} before the first spill. */
  Path sortDirectory() {
    return sortDir.path();
  }

  @Override
  public long diskUsageBytes() {
    long result = 0;
    for (var segment : segments) {
      result += segment.diskUsageBytes();
    }
    return result;
  }

  /** Abandons this sort if {@link #done()} hasn't been called yet, deleting segments from an owned temp directory. */
  @Override
  public void close() {
    if (!finished) {
      abort();
    }
  }

  private void ensureOpen() {
    if (finished) {
      throw new IllegalStateException("Sorter is already done or failed");
    }
  }

  private void abort() {
    finished = true;
    buffer = null;
    sortDir.close();
  }

  /** Sorts {@link #buffer} in place. */
  private void sortBuffer() {
    if (options.parallelSort()) {
      @SuppressWarnings("unchecked") T[] array = (T[]) buffer.toArray();
      Arrays.parallelSort(array, comparator);
      for (int i = 0; i < array.length; i++) {
        buffer.set(i, array[i]);
      }
    } else {
      buffer.sort(comparator);
    }
  }

  private void sortAndWriteSegment() throws IOException {
    long start = System.nanoTime();
    sortBuffer();
    long sortNanos = System.nanoTime() - start;

    int index = segments.size();
    var segment = Segment.write(index, sortDir.segmentPath(index), buffer, codec, options.compressTempStorage());
    segments.add(segment);
    buffer.clear();

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Wrote segment {}: {} items {}B sort:{} total:{}",
        index,
        FORMAT.integer(segment.itemCount()),
        FORMAT.storage(segment.diskUsageBytes()),
        FORMAT.seconds(Duration.ofNanos(sortNanos)),
        FORMAT.seconds(Duration.ofNanos(System.nanoTime() - start)));
    }
  }
}
