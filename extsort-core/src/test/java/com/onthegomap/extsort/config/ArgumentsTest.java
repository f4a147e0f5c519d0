package com.onthegomap.extsort.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ArgumentsTest {

  @Test
  void testEmpty() {
    var args = Arguments.of();
    assertEquals(7, args.getInteger("segment_size", "segment size", 7));
    assertTrue(args.getBoolean("parallel_sort", "parallel", true));
    assertNull(args.file("sort_dir", "sort dir", null));
  }

  @Test
  void testMapBased() {
    var args = Arguments.of(Map.of("segment_size", "12", "sort_dir", "/tmp/x"));
    assertEquals(12, args.getInteger("segment_size", "segment size", 7));
    assertEquals(Path.of("/tmp/x"), args.file("sort_dir", "sort dir", null));
  }

  @Test
  void testValuesAreTrimmed() {
    assertEquals(3, Arguments.of("key", " 3 ").getInteger("key", "key", 0));
  }

  @Test
  void testInvalidInteger() {
    var args = Arguments.of("segment_size", "lots");
    assertThrows(NumberFormatException.class, () -> args.getInteger("segment_size", "segment size", 1));
  }

  @ParameterizedTest
  @CsvSource({
    "true, true",
    "TRUE, true",
    "false, false",
    "yes, false",
  })
  void testBoolean(String value, boolean expected) {
    assertEquals(expected, Arguments.of("flag", value).getBoolean("flag", "flag", !expected));
  }

  @Test
  void testOrElse() {
    var args = Arguments.of("a", "1", "b", "2").orElse(Arguments.of("b", "3", "c", "4"));
    assertEquals(1, args.getInteger("a", "a", 0));
    assertEquals(2, args.getInteger("b", "b", 0));
    assertEquals(4, args.getInteger("c", "c", 0));
    assertEquals(5, args.getInteger("d", "d", 5));
  }

  @ParameterizedTest
  @CsvSource({
    "segment_size, segment_size",
    "segment-size, segment_size",
    "SEGMENT.SIZE, segment-size",
    "Segment_Size, SEGMENT_SIZE",
  })
  void testKeysIgnoreCaseAndSeparator(String given, String requested) {
    assertEquals(9, Arguments.of(given, "9").getInteger(requested, "segment size", 0));
  }

  @Test
  void testFromArgs() {
    var args = Arguments.fromArgs(
      "heap_merge_threshold=8",
      "--segment-size=5",
      "--sort-dir", "/tmp/sort",
      "--parallel-sort",
      "--compress-temp"
    );
    assertEquals(5, args.getInteger("segment_size", "", 0));
    assertEquals(Path.of("/tmp/sort"), args.file("sort_dir", "", null));
    assertTrue(args.getBoolean("parallel_sort", "", false));
    assertEquals(8, args.getInteger("heap_merge_threshold", "", 0));
    assertTrue(args.getBoolean("compress_temp", "", false));
    assertFalse(args.getBoolean("missing", "", false));
  }

  @Test
  void testFromEnvironment() {
    var env = Map.of("EXTSORT_SEGMENT_SIZE", "42", "SEGMENT_SIZE", "1");
    var args = Arguments.fromEnvironment(env::get);
    assertEquals(42, args.getInteger("segment-size", "", 0));
    assertEquals(0, args.getInteger("other", "", 0));
  }

  @Test
  void testFromJvmProperties() {
    var properties = Map.of("extsort.segment.size", "43", "segment_size", "1");
    var args = Arguments.fromJvmProperties(properties::get);
    assertEquals(43, args.getInteger("segment_size", "", 0));
  }

  @Test
  void testArgsTakePriorityOverJvmPropertiesAndEnvironment() {
    var env = Map.of("EXTSORT_A", "env", "EXTSORT_B", "env", "EXTSORT_C", "env");
    var properties = Map.of("extsort.a", "jvm", "extsort.b", "jvm");
    var args = Arguments.fromArgs("--a=arg")
      .orElse(Arguments.fromJvmProperties(properties::get))
      .orElse(Arguments.fromEnvironment(env::get));
    assertEquals(Path.of("arg"), args.file("a", "", null));
    assertEquals(Path.of("jvm"), args.file("b", "", null));
    assertEquals(Path.of("env"), args.file("c", "", null));
  }

  @Test
  void testDeprecatedAlias() {
    assertEquals(1, Arguments.of("old_name", "1").getInteger("new_name|old_name", "", 0));
    assertEquals(2, Arguments.of("old_name", "1", "new_name", "2").getInteger("new_name|old_name", "", 0));
    assertEquals(3, Arguments.of().getInteger("new_name|old_name", "", 3));
  }
}
