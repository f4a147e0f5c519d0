package com.onthegomap.extsort.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Formats item counts, segment sizes and elapsed times for sort log messages.
 */
public class Format {

  private static final Format DEFAULT = new Format(Locale.getDefault(Locale.Category.FORMAT));
  private static final long NANOS_PER_SECOND = Duration.ofSeconds(1).toNanos();
  private static final NavigableMap<Long, String> BYTE_SUFFIXES = new TreeMap<>(Map.of(
    1_000L, "k",
    1_000_000L, "M",
    1_000_000_000L, "G",
    1_000_000_000_000L, "T",
    1_000_000_000_000_000L, "P"
  ));
  private static final NavigableMap<Long, String> COUNT_SUFFIXES = new TreeMap<>(Map.of(
    1_000L, "k",
    1_000_000L, "M",
    1_000_000_000L, "B",
    1_000_000_000_000L, "T",
    1_000_000_000_000_000L, "Q"
  ));

  // NumberFormat is not thread safe
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> oneDecimal;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> noDecimals;

  Format(Locale locale) {
    oneDecimal = ThreadLocal.withInitial(() -> numberFormat(locale, 1));
    noDecimals = ThreadLocal.withInitial(() -> numberFormat(locale, 0));
  }

  private static NumberFormat numberFormat(Locale locale, int fractionDigits) {
    var result = NumberFormat.getNumberInstance(locale);
    result.setMaximumFractionDigits(fractionDigits);
    return result;
  }

  /** Returns the instance for the default formatting locale of this JVM. */
  public static Format defaultInstance() {
    return DEFAULT;
  }

  /** Returns a number of bytes abbreviated like "123" "1.2k" "240M". */
  public String storage(Number bytes) {
    return abbreviate(bytes, BYTE_SUFFIXES);
  }

  /** Returns a count abbreviated like "123" "1.2k" "2.5B". */
  public String numeric(Number count) {
    return abbreviate(count, COUNT_SUFFIXES);
  }

  private String abbreviate(Number num, NavigableMap<Long, String> suffixes) {
    long value = num.longValue();
    double doubleValue = num.doubleValue();
    if (value < 0) {
      return "-";
    } else if (doubleValue > 0 && doubleValue < 1) {
      return "<1";
    } else if (value < 1_000) {
      return Long.toString(value);
    }
    var unit = suffixes.floorEntry(value);
    // value in tenths of the unit, truncated
    long tenths = value / (unit.getKey() / 10);
    if (tenths < 100 && tenths % 10 != 0) {
      return decimal(tenths / 10d) + unit.getValue();
    }
    return (tenths / 10) + unit.getValue();
  }

  private String decimal(double value) {
    return oneDecimal.get().format(value);
  }

  /** Returns {@code value} with digit grouping and no decimal point, like "1,234,567". */
  public String integer(Number value) {
    return noDecimals.get().format(value);
  }

  /** Returns a duration in seconds, with one decimal point under a second, like "0.3s" or "12s". */
  public String seconds(Duration duration) {
    double seconds = (double) duration.toNanos() / NANOS_PER_SECOND;
    return decimal(seconds < 1 ? seconds : Math.round(seconds)) + "s";
  }

  /** Returns a duration like "1h2m" or "2m3s". */
  public String duration(Duration duration) {
    double seconds = (double) duration.toNanos() / NANOS_PER_SECOND;
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    return Duration.ofSeconds(Math.round(seconds)).toString().replace("PT", "").toLowerCase(Locale.ROOT);
  }
}
