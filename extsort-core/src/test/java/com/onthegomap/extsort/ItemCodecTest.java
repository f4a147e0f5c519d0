package com.onthegomap.extsort;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ItemCodecTest {

  private static <T> T roundTrip(ItemCodec<T> codec, T item) throws IOException {
    var bytes = new ByteArrayOutputStream();
    try (var out = new DataOutputStream(bytes)) {
      codec.encode(item, out);
    }
    try (var in = new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      return codec.decode(in);
    }
  }

  @Test
  void testBuiltInCodecs() throws IOException {
    assertEquals(Integer.MIN_VALUE, roundTrip(ItemCodec.ofInt(), Integer.MIN_VALUE));
    assertEquals(Long.MAX_VALUE, roundTrip(ItemCodec.ofLong(), Long.MAX_VALUE));
    assertEquals("", roundTrip(ItemCodec.ofString(), ""));
    assertEquals("grüße 日本", roundTrip(ItemCodec.ofString(), "grüße 日本"));
    assertArrayEquals(new byte[0], roundTrip(ItemCodec.ofBytes(), new byte[0]));
    assertArrayEquals(new byte[]{1, -2, 3}, roundTrip(ItemCodec.ofBytes(), new byte[]{1, -2, 3}));
  }

  @Test
  void testNegativeByteArrayLengthIsAnError() {
    var in = new DataInputStream(new ByteArrayInputStream(new byte[]{-1, -1, -1, -1}));
    var error = assertThrows(IOException.class, () -> ItemCodec.ofBytes().decode(in));
    assertEquals("Invalid byte array length: -1", error.getMessage());
  }

  @Test
  void testShortByteArrayIsAnError() {
    var in = new DataInputStream(new ByteArrayInputStream(new byte[]{0, 0, 0, 5, 1, 2}));
    assertThrows(EOFException.class, () -> ItemCodec.ofBytes().decode(in));
  }

  @Test
  void testSortByteArraysThroughDisk() throws IOException {
    List<byte[]> input = List.of(
      new byte[]{3},
      new byte[]{1, 2},
      new byte[]{},
      new byte[]{1},
      new byte[]{2, 0, 0}
    );
    var sorter = ExternalSorter.create().withSegmentSize(1);
    try (var sorted = sorter.sortBy(input, ItemCodec.ofBytes(), Arrays::compare)) {
      var result = sorted.toList();
      assertEquals(5, result.size());
      assertArrayEquals(new byte[]{}, result.get(0));
      assertArrayEquals(new byte[]{1}, result.get(1));
      assertArrayEquals(new byte[]{1, 2}, result.get(2));
      assertArrayEquals(new byte[]{2, 0, 0}, result.get(3));
      assertArrayEquals(new byte[]{3}, result.get(4));
    }
  }
}
