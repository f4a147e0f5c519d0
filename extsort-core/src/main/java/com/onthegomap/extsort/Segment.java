package com.onthegomap.extsort;

import com.onthegomap.extsort.util.FileUtils;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;
import org.xerial.snappy.SnappyInputStream;
import org.xerial.snappy.SnappyOutputStream;

/**
 * A sorted run of items written to a single file, which is never modified after it is written.
 * <p>
 * The file holds the encoded items back to back with no header, index or checksum, optionally wrapped in snappy
 * stream framing.
 */
final class Segment<T> {

  private final int index;
  private final Path path;
  private final ItemCodec<T> codec;
  private final boolean compress;
  private final long itemCount;

  private Segment(int index, Path path, ItemCodec<T> codec, boolean compress, long itemCount) {
    this.index = index;
    this.path = path;
    this.codec = codec;
    this.compress = compress;
    this.itemCount = itemCount;
  }

  /**
   * Encodes {@code sorted} items in order to a new file at {@code path}, replacing anything that was there.
   *
   * @throws IOException if the file can't be created or an item can't be encoded
   */
  static <T> Segment<T> write(int index, Path path, List<? extends T> sorted, ItemCodec<T> codec, boolean compress)
    throws IOException {
    OutputStream rawOutputStream = new BufferedOutputStream(Files.newOutputStream(path,
      StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
    if (compress) {
      rawOutputStream = new SnappyOutputStream(rawOutputStream);
    }
    try (var out = new DataOutputStream(rawOutputStream)) {
      for (T item : sorted) {
        codec.encode(item, out);
      }
    }
    return new Segment<>(index, path, codec, compress, sorted.size());
  }

  int index() {
    return index;
  }

  Path path() {
    return path;
  }

  long itemCount() {
    return itemCount;
  }

  long diskUsageBytes() {
    return FileUtils.fileSize(path);
  }

  /** Opens a new cursor positioned at the first item in this segment. */
  Reader<T> newReader() throws IOException {
    return new Reader<>(this);
  }

  @Override
  public String toString() {
    return "Segment[" + index + ", " + path + ", items=" + itemCount + "]";
  }

  /** Sequential cursor over the items in a segment file. */
  @NotThreadSafe
  static final class Reader<T> implements Closeable {

    private final Segment<T> segment;
    private final BufferedInputStream buffered;
    private final DataInputStream input;
    private boolean closed = false;

    private Reader(Segment<T> segment) throws IOException {
      this.segment = segment;
      InputStream inputStream = new BufferedInputStream(Files.newInputStream(segment.path));
      if (segment.compress) {
        inputStream = new SnappyInputStream(inputStream);
      }
      // re-buffer on top of snappy so we can peek for end of file at a record boundary
      this.buffered = segment.compress ? new BufferedInputStream(inputStream) : (BufferedInputStream) inputStream;
      this.input = new DataInputStream(buffered);
    }

    Segment<T> segment() {
      return segment;
    }

    /**
     * Returns the next item or {@code null} once the segment ends cleanly at a record boundary, closing the file.
     *
     * @throws IOException if the item is truncated or can't be decoded
     */
    T read() throws IOException {
      if (closed) {
        return null;
      }
      T item = atEnd() ? null : segment.codec.decode(input);
      if (item == null) {
        close();
      }
      return item;
    }

    private boolean atEnd() throws IOException {
      buffered.mark(1);
      if (buffered.read() < 0) {
        return true;
      }
      buffered.reset();
      return false;
    }

    @Override
    public void close() throws IOException {
      if (!closed) {
        closed = true;
        input.close();
      }
    }
  }
}
