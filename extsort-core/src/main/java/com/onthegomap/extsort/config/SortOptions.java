package com.onthegomap.extsort.config;

import java.nio.file.Path;

/**
 * Holder for the parameters that control how an external sort buffers, spills and merges items.
 *
 * @param segmentSize         maximum number of items held in memory before the buffer is sorted and spilled to a new
 *                            segment file
 * @param sortDir             directory to write segment files into, or {@code null} to create a temporary directory
 *                            that gets deleted once the sorted output is closed
 * @param parallelSort        sort each buffer across all cores before spilling it
 * @param heapMergeThreshold  minimum number of segments at which the merge switches from scanning every segment head
 *                            to a priority queue
 * @param compressTempStorage compress segment files with snappy
 */
public record SortOptions(
  int segmentSize,
  Path sortDir,
  boolean parallelSort,
  int heapMergeThreshold,
  boolean compressTempStorage
) {

  public static final int DEFAULT_SEGMENT_SIZE = 10_000;
  public static final int DEFAULT_HEAP_MERGE_THRESHOLD = 20;

  public SortOptions {
    if (segmentSize < 0) {
      throw new IllegalArgumentException("Segment size must be >= 0, was " + segmentSize);
    }
    if (heapMergeThreshold < 0) {
      throw new IllegalArgumentException("Heap merge threshold must be >= 0, was " + heapMergeThreshold);
    }
  }

  public static SortOptions defaults() {
    return new SortOptions(DEFAULT_SEGMENT_SIZE, null, false, DEFAULT_HEAP_MERGE_THRESHOLD, false);
  }

  public static SortOptions from(Arguments arguments) {
    return new SortOptions(
      arguments.getInteger("segment_size", "max number of items to buffer in memory before spilling to disk",
        DEFAULT_SEGMENT_SIZE),
      arguments.file("sort_dir", "directory for sorted segment files, defaults to a new temp directory", null),
      arguments.getBoolean("parallel_sort", "sort in-memory buffers using all available cores", false),
      arguments.getInteger("heap_merge_threshold",
        "minimum number of segments to merge with a priority queue instead of a linear scan",
        DEFAULT_HEAP_MERGE_THRESHOLD),
      arguments.getBoolean("compress_temp", "compress segment files with snappy", false)
    );
  }

  public SortOptions withSegmentSize(int newSegmentSize) {
    return new SortOptions(newSegmentSize, sortDir, parallelSort, heapMergeThreshold, compressTempStorage);
  }

  public SortOptions withSortDir(Path newSortDir) {
    return new SortOptions(segmentSize, newSortDir, parallelSort, heapMergeThreshold, compressTempStorage);
  }

  public SortOptions withParallelSort(boolean newParallelSort) {
    return new SortOptions(segmentSize, sortDir, newParallelSort, heapMergeThreshold, compressTempStorage);
  }

  public SortOptions withHeapMergeThreshold(int newHeapMergeThreshold) {
    return new SortOptions(segmentSize, sortDir, parallelSort, newHeapMergeThreshold, compressTempStorage);
  }

  public SortOptions withCompressTempStorage(boolean newCompressTempStorage) {
    return new SortOptions(segmentSize, sortDir, parallelSort, heapMergeThreshold, newCompressTempStorage);
  }
}
