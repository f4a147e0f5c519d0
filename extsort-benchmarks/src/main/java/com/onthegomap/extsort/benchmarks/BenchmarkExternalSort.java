package com.onthegomap.extsort.benchmarks;

import com.onthegomap.extsort.ExternalSorter;
import com.onthegomap.extsort.ItemCodec;
import com.onthegomap.extsort.SortedIterator;
import com.onthegomap.extsort.config.Arguments;
import com.onthegomap.extsort.util.FileUtils;
import com.onthegomap.extsort.util.Format;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performance tests for {@link ExternalSorter}. Times how long it takes to sort then read back integers in different
 * input orders, compared to sorting the same list in memory.
 * <p>
 * Usage: {@code BenchmarkExternalSort [--iterations=3] [--sort_dir=./sorttest] [--compress_temp]}
 */
public class BenchmarkExternalSort {

  private static final Logger LOGGER = LoggerFactory.getLogger(BenchmarkExternalSort.class);
  private static final Format FORMAT = Format.defaultInstance();
  private static final long NANOSECONDS_PER_SECOND = Duration.ofSeconds(1).toNanos();

  private enum Order {
    SORTED,
    REVERSED,
    RANDOM
  }

  private record Scenario(int items, int segmentSize) {}

  private record Results(
    String name, Order order, int items, int segmentSize, boolean parallelSort, int segments,
    SortedIterator.Mode mode, Duration elapsed
  ) {}

  public static void main(String[] args) throws IOException {
    Arguments arguments = Arguments.fromEnvOrArgs(args);
    int iterations = arguments.getInteger("iterations", "number of times to run each scenario", 3);
    Path sortDir = arguments.file("sort_dir", "directory for segment files", Path.of("./sorttest"));
    boolean compress = arguments.getBoolean("compress_temp", "compress segment files", false);
    List<Scenario> scenarios = List.of(
      new Scenario(1_000, 10_000),
      new Scenario(100_000, 10_000),
      new Scenario(100_000, 1_000_000),
      new Scenario(1_000_000, 10_000),
      new Scenario(1_000_000, 100_000)
    );

    FileUtils.delete(sortDir);
    try {
      List<Results> results = new ArrayList<>();
      for (int i = 0; i < iterations; i++) {
        for (var scenario : scenarios) {
          for (var order : Order.values()) {
            var input = input(scenario.items, order);
            results.add(runListSort(input, order));
            for (boolean parallelSort : List.of(false, true)) {
              var sorter = ExternalSorter.create()
                .withSegmentSize(scenario.segmentSize)
                .withSortDir(sortDir)
                .withParallelSort(parallelSort)
                .withCompression(compress);
              results.add(runExternalSort(sorter, input, order));
            }
          }
        }
      }
      for (var result : results) {
        System.err.println(String.join("\t",
          result.name,
          result.order.toString(),
          Integer.toString(result.items),
          Integer.toString(result.segmentSize),
          Boolean.toString(result.parallelSort),
          Integer.toString(result.segments),
          String.valueOf(result.mode),
          FORMAT.duration(result.elapsed),
          FORMAT.numeric(result.items * NANOSECONDS_PER_SECOND / Math.max(1, result.elapsed.toNanos())) + "/s"
        ));
      }
    } finally {
      FileUtils.delete(sortDir);
    }
  }

  private static List<Integer> input(int items, Order order) {
    List<Integer> result = new ArrayList<>(items);
    for (int i = 0; i < items; i++) {
      result.add(i);
    }
    switch (order) {
      case REVERSED -> Collections.reverse(result);
      case RANDOM -> Collections.shuffle(result, new Random(0));
      default -> {
      }
    }
    return result;
  }

  private static Results runListSort(List<Integer> input, Order order) {
    long start = System.nanoTime();
    List<Integer> copy = new ArrayList<>(input);
    Collections.sort(copy);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    LOGGER.info("list sort {} {} items took {}", order, FORMAT.integer(input.size()), FORMAT.duration(elapsed));
    return new Results("list", order, input.size(), input.size(), false, 0, null, elapsed);
  }

  private static Results runExternalSort(ExternalSorter sorter, List<Integer> input, Order order) throws IOException {
    var options = sorter.options();
    long start = System.nanoTime();
    long count = 0;
    int segments;
    SortedIterator.Mode mode;
    try (var sorted = sorter.sort(input, ItemCodec.ofInt())) {
      segments = sorted.diskSegmentCount();
      mode = sorted.mode();
      while (sorted.hasNext()) {
        sorted.next();
        count++;
      }
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    if (count != input.size()) {
      throw new IllegalStateException("Expected " + input.size() + " items but got " + count);
    }
    LOGGER.info("external sort {} {} items segment size {} parallel {} took {} ({} segments)",
      order, FORMAT.integer(input.size()), FORMAT.integer(options.segmentSize()), options.parallelSort(),
      FORMAT.duration(elapsed), segments);
    FileUtils.delete(options.sortDir());
    return new Results("external", order, input.size(), options.segmentSize(), options.parallelSort(), segments, mode,
      elapsed);
  }
}
