package com.onthegomap.extsort.util;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An {@link Iterator} that holds on to resources until it is closed.
 */
public interface CloseableIterator<T> extends Closeable, Iterator<T> {

  @Override
  void close();

  /** Returns a sequential stream over the remaining items that closes this iterator when the stream is closed. */
  default Stream<T> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, 0), false).onClose(this::close);
  }

  /** Returns all remaining items in a list and closes this iterator. WARNING: materializes every item in-memory. */
  default List<T> toList() {
    try {
      List<T> result = new ArrayList<>();
      forEachRemaining(result::add);
      return result;
    } finally {
      close();
    }
  }
}
