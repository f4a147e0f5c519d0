package com.onthegomap.extsort;

import com.onthegomap.extsort.util.CloseableIterator;
import com.onthegomap.extsort.util.DiskBacked;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.Queue;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iterates through every item that was pushed into a {@link PushExternalSorter} in ascending order, merging the sorted
 * segments on disk lazily as items are requested.
 * <p>
 * The merge strategy is picked once based on how many segments were written:
 * <ul>
 * <li>{@link Mode#PASSTHROUGH}: everything fit in memory, so items come straight out of the sorted buffer</li>
 * <li>{@link Mode#LINEAR_SCAN}: fewer segments than the heap merge threshold, so each step compares the current head
 * of every segment</li>
 * <li>{@link Mode#HEAP}: many segments, so candidates go through a priority queue that gets refilled in batches of
 * {@value #HEAP_REFILL_BATCH_SIZE} items per segment</li>
 * </ul>
 * Items that compare equal come out in no particular order.
 * <p>
 * If a segment can't be decoded, {@link #next()} throws an {@link UncheckedIOException} at the position of the failure
 * and that segment is dropped from the merge.
 * <p>
 * This iterator owns the segment files and (if the sorter created it) the temp directory they live in. Both get
 * released when it is closed or when the last item is returned.
 *
 * @param <T> type of item being sorted
 */
@NotThreadSafe
public class SortedIterator<T> implements CloseableIterator<T>, DiskBacked {

  /** Items read from a segment each time it runs out of candidates in {@link Mode#HEAP} mode. */
  public static final int HEAP_REFILL_BATCH_SIZE = 20;
  private static final Logger LOGGER = LoggerFactory.getLogger(SortedIterator.class);

  /** How items are merged, fixed for the lifetime of the iterator. */
  public enum Mode {
    PASSTHROUGH,
    LINEAR_SCAN,
    HEAP
  }

  private final SortDirectory sortDir;
  private final List<Segment<T>> segments;
  private final long count;
  private final Merger<T> merger;
  private boolean closed = false;

  SortedIterator(SortDirectory sortDir, Queue<T> inMemory, List<Segment<T>> segments, long count,
    Comparator<? super T> comparator, int heapMergeThreshold) throws IOException {
    this.sortDir = sortDir;
    this.segments = List.copyOf(segments);
    this.count = count;
    if (this.segments.isEmpty()) {
      merger = new Passthrough<>(inMemory == null ? new ArrayDeque<T>() : inMemory);
    } else {
      List<Segment.Reader<T>> readers = new ArrayList<>(this.segments.size());
      try {
        for (var segment : this.segments) {
          readers.add(segment.newReader());
        }
        merger = this.segments.size() < heapMergeThreshold ?
          new LinearScanMerge<>(readers, comparator) :
          new HeapMerge<>(readers, comparator);
      } catch (IOException | RuntimeException e) {
        closeReaders(readers);
        throw e;
      }
    }
    LOGGER.debug("Merging {} items from {} segments using {}", count, this.segments.size(), merger.mode());
  }

  /** Returns the total number of items this iterator returns from start to end. */
  public long sortedCount() {
    return count;
  }

  /** Returns the number of segments written to disk, or 0 if everything fit in memory. */
  public int diskSegmentCount() {
    return segments.size();
  }

  /** Returns the strategy used to merge segments. */
  public Mode mode() {
    return merger.mode();
  }

  /** Returns the directory that segments were written to, or {@code null} if nothing was written. */
  Path sortDirectory() {
    return sortDir.path();
  }

  @Override
  public long diskUsageBytes() {
    long result = 0;
    if (!closed) {
      for (var segment : segments) {
        result += segment.diskUsageBytes();
      }
    }
    return result;
  }

  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    boolean result = merger.hasNext();
    if (!result) {
      close();
    }
    return result;
  }

  /**
   * Returns the next smallest item.
   *
   * @throws UncheckedIOException   if a segment failed to decode at this position
   * @throws NoSuchElementException if there are no items left
   */
  @Override
  public T next() {
    if (closed || !merger.hasNext()) {
      close();
      throw new NoSuchElementException();
    }
    T result = merger.next();
    if (!merger.hasNext()) {
      close();
    }
    return result;
  }

  /** Closes open segment files and deletes the temp directory if the sorter created it. Safe to call repeatedly. */
  @Override
  public void close() {
    if (!closed) {
      closed = true;
      merger.close();
      sortDir.close();
    }
  }

  private static <T> void closeReaders(List<Segment.Reader<T>> readers) {
    for (var reader : readers) {
      try {
        reader.close();
      } catch (IOException e) {
        LOGGER.warn("Error closing {}", reader.segment(), e);
      }
    }
  }

  /** One of the merge strategies. */
  private interface Merger<T> {

    Mode mode();

    boolean hasNext();

    T next();

    default void close() {}
  }

  /** Returns items from the in-memory buffer that was already sorted. */
  private static class Passthrough<T> implements Merger<T> {

    private final Queue<T> queue;

    Passthrough(Queue<T> queue) {
      this.queue = queue;
    }

    @Override
    public Mode mode() {
      return Mode.PASSTHROUGH;
    }

    @Override
    public boolean hasNext() {
      return !queue.isEmpty();
    }

    @Override
    public T next() {
      return queue.remove();
    }

    @Override
    public void close() {
      queue.clear();
    }
  }

  /** Common functionality between {@link LinearScanMerge} and {@link HeapMerge}. */
  private abstract static class DiskMerger<T> implements Merger<T> {

    final List<Segment.Reader<T>> readers;
    final Comparator<? super T> comparator;
    // decode failures waiting to be thrown from next()
    private final Queue<UncheckedIOException> errors = new ArrayDeque<>();

    DiskMerger(List<Segment.Reader<T>> readers, Comparator<? super T> comparator) {
      this.readers = readers;
      this.comparator = comparator;
    }

    /**
     * Returns the next item from segment {@code idx}, or {@code null} once it is exhausted.
     *
     * @throws IOException if the item can't be decoded, including unchecked exceptions thrown by the codec
     */
    final T read(int idx) throws IOException {
      var reader = readers.get(idx);
      try {
        return reader.read();
      } catch (IOException | RuntimeException e) {
        IOException error = e instanceof IOException ioException ? ioException :
          new IOException("Failed to decode item", e);
        try {
          reader.close();
        } catch (IOException closeException) {
          error.addSuppressed(closeException);
        }
        throw error;
      }
    }

    final void addError(int idx, IOException e) {
      Path path = readers.get(idx).segment().path();
      errors.add(new UncheckedIOException("Failed to decode item from segment " + path, e));
    }

    final boolean hasError() {
      return !errors.isEmpty();
    }

    final void throwPendingError() {
      var error = errors.poll();
      if (error != null) {
        throw error;
      }
    }

    @Override
    public void close() {
      closeReaders(readers);
    }
  }

  /** Keeps the current head of each segment, and scans all of them for the smallest one to return next. */
  private static class LinearScanMerge<T> extends DiskMerger<T> {

    private final List<T> heads;
    private int live = 0;

    LinearScanMerge(List<Segment.Reader<T>> readers, Comparator<? super T> comparator) {
      super(readers, comparator);
      this.heads = new ArrayList<>(Collections.nCopies(readers.size(), null));
      for (int i = 0; i < readers.size(); i++) {
        advance(i);
      }
    }

    private void advance(int idx) {
      T next;
      try {
        next = read(idx);
      } catch (IOException e) {
        addError(idx, e);
        next = null;
      }
      T previous = heads.set(idx, next);
      if (previous == null && next != null) {
        live++;
      } else if (previous != null && next == null) {
        live--;
      }
    }

    @Override
    public Mode mode() {
      return Mode.LINEAR_SCAN;
    }

    @Override
    public boolean hasNext() {
      return live > 0 || hasError();
    }

    @Override
    public T next() {
      throwPendingError();
      int smallestIdx = -1;
      T smallest = null;
      for (int i = 0; i < heads.size(); i++) {
        T head = heads.get(i);
        // strictly less than, so the first segment wins ties
        if (head != null && (smallest == null || comparator.compare(head, smallest) < 0)) {
          smallest = head;
          smallestIdx = i;
        }
      }
      if (smallestIdx < 0) {
        throw new NoSuchElementException();
      }
      advance(smallestIdx);
      return smallest;
    }
  }

  /**
   * Merges segments through a priority queue of candidate items, refilling a segment with up to
   * {@value SortedIterator#HEAP_REFILL_BATCH_SIZE} items whenever its last candidate leaves the queue.
   */
  private static class HeapMerge<T> extends DiskMerger<T> {

    private final PriorityQueue<HeapItem<T>> queue;
    private final int[] live;
    private final boolean[] done;
    private final IOException[] failures;

    HeapMerge(List<Segment.Reader<T>> readers, Comparator<? super T> comparator) {
      super(readers, comparator);
      int segments = readers.size();
      this.queue = new PriorityQueue<>(segments * HEAP_REFILL_BATCH_SIZE,
        (a, b) -> comparator.compare(a.item(), b.item()));
      this.live = new int[segments];
      this.done = new boolean[segments];
      this.failures = new IOException[segments];
      for (int i = 0; i < segments; i++) {
        refill(i);
      }
    }

    private void refill(int idx) {
      for (int i = 0; i < HEAP_REFILL_BATCH_SIZE && !done[idx]; i++) {
        try {
          T item = read(idx);
          if (item == null) {
            done[idx] = true;
          } else {
            queue.add(new HeapItem<>(item, idx));
            live[idx]++;
          }
        } catch (IOException e) {
          done[idx] = true;
          failures[idx] = e;
        }
      }
      // only report a failure after every item decoded before it has been returned
      if (live[idx] == 0 && failures[idx] != null) {
        addError(idx, failures[idx]);
        failures[idx] = null;
      }
    }

    @Override
    public Mode mode() {
      return Mode.HEAP;
    }

    @Override
    public boolean hasNext() {
      return !queue.isEmpty() || hasError();
    }

    @Override
    public T next() {
      throwPendingError();
      HeapItem<T> smallest = queue.poll();
      if (smallest == null) {
        throw new NoSuchElementException();
      }
      int idx = smallest.segment();
      if (--live[idx] == 0) {
        refill(idx);
      }
      return smallest.item();
    }
  }

  /** A candidate item in the {@link HeapMerge} priority queue tagged with the segment it came from. */
  private record HeapItem<T>(T item, int segment) {}
}
