package com.onthegomap.extsort;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Converts items to and from the bytes stored in sorted segment files.
 * <p>
 * Segment files are a flat concatenation of encoded items with no header or framing added by the sorter, so the codec
 * alone decides where one item ends and the next begins (a length prefix, a fixed width, etc.).
 * <p>
 * {@link #decode(DataInput)} is only called when at least one more byte is available, so running out of input while
 * decoding means the segment is truncated or corrupt: throw (an {@link java.io.EOFException} from {@link DataInput} is
 * fine) and the failure surfaces to whoever is reading the sorted output. A codec that can tell the stream is over
 * from its own framing (a terminator record, for example) may instead return {@code null}, which retires the segment
 * as if it ended cleanly.
 *
 * @param <T> type of item being sorted
 */
public interface ItemCodec<T> {

  /** Writes the bytes of {@code item} to {@code out}. */
  void encode(T item, DataOutput out) throws IOException;

  /** Reads the next item from {@code in}, or returns {@code null} if the codec detects a clean end of the stream. */
  T decode(DataInput in) throws IOException;

  /** Returns a codec that stores each {@link Integer} as 4 big-endian bytes. */
  static ItemCodec<Integer> ofInt() {
    return new ItemCodec<>() {
      @Override
      public void encode(Integer item, DataOutput out) throws IOException {
        out.writeInt(item);
      }

      @Override
      public Integer decode(DataInput in) throws IOException {
        return in.readInt();
      }
    };
  }

  /** Returns a codec that stores each {@link Long} as 8 big-endian bytes. */
  static ItemCodec<Long> ofLong() {
    return new ItemCodec<>() {
      @Override
      public void encode(Long item, DataOutput out) throws IOException {
        out.writeLong(item);
      }

      @Override
      public Long decode(DataInput in) throws IOException {
        return in.readLong();
      }
    };
  }

  /** Returns a codec that stores each {@link String} as length-prefixed modified UTF-8, up to 65535 encoded bytes. */
  static ItemCodec<String> ofString() {
    return new ItemCodec<>() {
      @Override
      public void encode(String item, DataOutput out) throws IOException {
        out.writeUTF(item);
      }

      @Override
      public String decode(DataInput in) throws IOException {
        return in.readUTF();
      }
    };
  }

  /** Returns a codec that stores each {@code byte[]} prefixed by its length. */
  static ItemCodec<byte[]> ofBytes() {
    return new ItemCodec<>() {
      @Override
      public void encode(byte[] item, DataOutput out) throws IOException {
        out.writeInt(item.length);
        out.write(item);
      }

      @Override
      public byte[] decode(DataInput in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
          throw new IOException("Invalid byte array length: " + length);
        }
        byte[] result = new byte[length];
        in.readFully(result);
        return result;
      }
    };
  }
}
