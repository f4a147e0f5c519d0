package com.onthegomap.extsort;

import com.onthegomap.extsort.config.Arguments;
import com.onthegomap.extsort.config.SortOptions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.concurrent.Immutable;

/**
 * Entry point for sorting more items than fit in memory.
 * <p>
 * Items get buffered in memory, and every time the buffer grows past {@link SortOptions#segmentSize()} it is sorted
 * and written to a segment file on disk. The result is a {@link SortedIterator} that lazily merges the segments (or
 * just returns the buffer when nothing was spilled). Callers provide an {@link ItemCodec} to serialize items to
 * segment files.
 * <p>
 * For example:
 *
 * <pre>{@code
 * var sorter = ExternalSorter.create().withSegmentSize(100_000);
 * try (SortedIterator<Long> sorted = sorter.sort(input, ItemCodec.ofLong())) {
 *   while (sorted.hasNext()) {
 *     process(sorted.next());
 *   }
 * }
 * }</pre>
 * <p>
 * Instances are immutable, each {@code with*} method returns a copy with one option changed.
 */
@Immutable
public final class ExternalSorter {

  private final SortOptions options;

  private ExternalSorter(SortOptions options) {
    this.options = Objects.requireNonNull(options);
  }

  /** Returns a sorter with default options: 10,000 item segments in a temp directory, sequential in-memory sort. */
  public static ExternalSorter create() {
    return new ExternalSorter(SortOptions.defaults());
  }

  public static ExternalSorter create(SortOptions options) {
    return new ExternalSorter(options);
  }

  /** Returns a sorter configured from {@code arguments}, see {@link SortOptions#from(Arguments)} for the keys. */
  public static ExternalSorter fromArguments(Arguments arguments) {
    return new ExternalSorter(SortOptions.from(arguments));
  }

  public SortOptions options() {
    return options;
  }

  /** Returns a copy that spills to disk once more than {@code segmentSize} items are buffered in memory. */
  public ExternalSorter withSegmentSize(int segmentSize) {
    return new ExternalSorter(options.withSegmentSize(segmentSize));
  }

  /**
   * Returns a copy that writes segments to {@code sortDir} instead of a new temp directory.
   * <p>
   * The caller is responsible for cleaning up this directory, and it must not be shared by sorts running at the same
   * time since segment file names are reused.
   */
  public ExternalSorter withSortDir(Path sortDir) {
    return new ExternalSorter(options.withSortDir(sortDir));
  }

  /** Returns a copy that sorts each in-memory buffer using all available cores before writing it to disk. */
  public ExternalSorter withParallelSort() {
    return withParallelSort(true);
  }

  public ExternalSorter withParallelSort(boolean parallelSort) {
    return new ExternalSorter(options.withParallelSort(parallelSort));
  }

  /** Returns a copy that merges with a priority queue once there are at least {@code threshold} segments. */
  public ExternalSorter withHeapMergeThreshold(int threshold) {
    return new ExternalSorter(options.withHeapMergeThreshold(threshold));
  }

  /** Returns a copy that compresses segment files with snappy. */
  public ExternalSorter withCompression(boolean compress) {
    return new ExternalSorter(options.withCompressTempStorage(compress));
  }

  /** Returns a new push-style sorter ordered by {@code comparator}. */
  public <T> PushExternalSorter<T> pushSorterBy(ItemCodec<T> codec, Comparator<? super T> comparator) {
    return new PushExternalSorter<>(options, codec, comparator);
  }

  /** Returns a new push-style sorter ordered by the natural order of items. */
  public <T extends Comparable<? super T>> PushExternalSorter<T> pushSorter(ItemCodec<T> codec) {
    return pushSorterBy(codec, Comparator.naturalOrder());
  }

  /** Returns a new push-style sorter ordered by the key that {@code keyExtractor} returns for each item. */
  public <T, K extends Comparable<? super K>> PushExternalSorter<T> pushSorterByKey(ItemCodec<T> codec,
    Function<? super T, ? extends K> keyExtractor) {
    return pushSorterBy(codec, Comparator.comparing(keyExtractor));
  }

  /**
   * Reads every item from {@code input} and returns them ordered by {@code comparator}.
   *
   * @throws IOException if a segment could not be written to disk
   */
  public <T> SortedIterator<T> sortBy(Iterator<? extends T> input, ItemCodec<T> codec,
    Comparator<? super T> comparator) throws IOException {
    PushExternalSorter<T> sorter = pushSorterBy(codec, comparator);
    try {
      sorter.pushAll(input);
      return sorter.done();
    } catch (IOException | RuntimeException e) {
      sorter.close();
      throw e;
    }
  }

  /** Alias for {@link #sortBy(Iterator, ItemCodec, Comparator)} that reads from an {@link Iterable}. */
  public <T> SortedIterator<T> sortBy(Iterable<? extends T> input, ItemCodec<T> codec,
    Comparator<? super T> comparator) throws IOException {
    return sortBy(input.iterator(), codec, comparator);
  }

  /**
   * Reads every item from {@code input} and returns them in their natural order.
   *
   * @throws IOException if a segment could not be written to disk
   */
  public <T extends Comparable<? super T>> SortedIterator<T> sort(Iterator<? extends T> input, ItemCodec<T> codec)
    throws IOException {
    return sortBy(input, codec, Comparator.naturalOrder());
  }

  /** Alias for {@link #sort(Iterator, ItemCodec)} that reads from an {@link Iterable}. */
  public <T extends Comparable<? super T>> SortedIterator<T> sort(Iterable<? extends T> input, ItemCodec<T> codec)
    throws IOException {
    return sort(input.iterator(), codec);
  }

  /**
   * Reads every item from {@code input} and returns them ordered by the key that {@code keyExtractor} returns.
   *
   * @throws IOException if a segment could not be written to disk
   */
  public <T, K extends Comparable<? super K>> SortedIterator<T> sortByKey(Iterator<? extends T> input,
    ItemCodec<T> codec, Function<? super T, ? extends K> keyExtractor) throws IOException {
    return sortBy(input, codec, Comparator.comparing(keyExtractor));
  }

  /** Alias for {@link #sortByKey(Iterator, ItemCodec, Function)} that reads from an {@link Iterable}. */
  public <T, K extends Comparable<? super K>> SortedIterator<T> sortByKey(Iterable<? extends T> input,
    ItemCodec<T> codec, Function<? super T, ? extends K> keyExtractor) throws IOException {
    return sortByKey(input.iterator(), codec, keyExtractor);
  }

  @Override
  public String toString() {
    return "ExternalSorter[" + options + "]";
  }
}
