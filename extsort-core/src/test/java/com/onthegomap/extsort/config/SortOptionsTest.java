package com.onthegomap.extsort.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SortOptionsTest {

  @Test
  void testDefaults() {
    var options = SortOptions.defaults();
    assertEquals(10_000, options.segmentSize());
    assertNull(options.sortDir());
    assertFalse(options.parallelSort());
    assertEquals(20, options.heapMergeThreshold());
    assertFalse(options.compressTempStorage());
    assertEquals(options, SortOptions.from(Arguments.of()));
  }

  @Test
  void testFromArguments() {
    var options = SortOptions.from(Arguments.fromArgs(
      "--segment-size=500",
      "--sort-dir", "/tmp/sort",
      "--parallel-sort",
      "--heap-merge-threshold=8",
      "--compress-temp=true"
    ));
    assertEquals(new SortOptions(500, Path.of("/tmp/sort"), true, 8, true), options);
  }

  @Test
  void testFromEnvironment() {
    var env = Map.of("EXTSORT_SEGMENT_SIZE", "42", "EXTSORT_HEAP_MERGE_THRESHOLD", "3");
    var options = SortOptions.from(Arguments.fromEnvironment(env::get));
    assertEquals(42, options.segmentSize());
    assertEquals(3, options.heapMergeThreshold());
  }

  @Test
  void testRejectsNegativeValues() {
    assertThrows(IllegalArgumentException.class, () -> new SortOptions(-1, null, false, 20, false));
    assertThrows(IllegalArgumentException.class, () -> new SortOptions(10, null, false, -1, false));
    var args = Arguments.of("segment_size", "-5");
    assertThrows(IllegalArgumentException.class, () -> SortOptions.from(args));
  }

  @Test
  void testZeroIsAllowed() {
    var options = SortOptions.defaults().withSegmentSize(0).withHeapMergeThreshold(0);
    assertEquals(0, options.segmentSize());
    assertEquals(0, options.heapMergeThreshold());
  }
}
