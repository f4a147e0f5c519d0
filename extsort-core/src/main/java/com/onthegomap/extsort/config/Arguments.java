package com.onthegomap.extsort.config;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value options for a sort, read from command-line arguments, JVM properties or environmental variables.
 * <p>
 * Keys are case-and-separator-insensitive, for example {@code "SEGMENT_SIZE"} matches {@code "segment-size"} and
 * {@code "segment_size"}.
 * <p>
 * A renamed option can be read as {@code "new_flag|old_flag"} to fall back to the old name.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final UnaryOperator<String> provider;

  private Arguments(UnaryOperator<String> provider) {
    this.provider = provider;
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code extsort.}
   * <p>
   * Separators in the key become dots, so to set {@code segment_size=5000}:
   * {@code java -Dextsort.segment.size=5000 ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return fromPrefixed(getter, "extsort", ".", false);
  }

  /**
   * Returns arguments from environmental variables prefixed with {@code EXTSORT_}
   * <p>
   * For example to set {@code segment_size=5000}: {@code EXTSORT_SEGMENT_SIZE=5000 java ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return fromPrefixed(getter, "EXTSORT", "_", true);
  }

  /**
   * Returns arguments parsed from command-line arguments.
   * <p>
   * For example to set {@code key=value}: {@code java ... key=value} or {@code java ... --key value}
   * <p>
   * Or to set {@code key=true}: {@code java ... --key}
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      String[] kv = arg.split("=", 2);
      String key = kv[0].replaceAll("^[\\s-]+", "");
      if (kv.length == 2) {
        parsed.put(key, kv[1]);
      } else if (arg.startsWith("-") && i < args.length - 1 && !args[i + 1].strip().startsWith("-")) {
        parsed.put(key, args[++i].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /**
   * Returns arguments from command-line arguments, then JVM properties, then environmental variables, in that priority
   * order.
   */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} with alternating keys and values. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private static String normalize(String key, String separator, boolean upperCase) {
    String result = key.replaceAll("[._-]", separator);
    return upperCase ? result.toUpperCase(Locale.ROOT) : result.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String key) {
    return normalize(key, "_", false);
  }

  private static Arguments fromPrefixed(UnaryOperator<String> getter, String prefix, String separator,
    boolean upperCase) {
    return new Arguments(key -> getter.apply(normalize(prefix + separator + key, separator, upperCase)));
  }

  private String get(String key) {
    String[] options = key.split("\\|");
    for (int i = 0; i < options.length; i++) {
      String option = options[i].strip();
      String value = provider.apply(normalize(option));
      if (value != null) {
        if (i != 0) {
          LOGGER.warn("Argument '{}' is deprecated", option);
        }
        return value.trim();
      }
    }
    return null;
  }

  /** Returns arguments that check {@code this} first, then {@code other} for keys that are missing here. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String ours = get(key);
      return ours != null ? ours : other.get(key);
    });
  }

  private String get(String key, String defaultValue) {
    String value = get(key);
    return value == null ? defaultValue : value;
  }

  private static void logArgValue(String key, String description, Object result) {
    LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
  }

  /** Returns a {@link Path} parsed from {@code key}, or {@code defaultValue} if it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = get(key);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /** Returns true if {@code key} is {@code "true"} (ignoring case), false if it is anything else. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = "true".equalsIgnoreCase(get(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns {@code key} parsed as an integer.
   *
   * @throws NumberFormatException if the value isn't an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    int value = Integer.parseInt(get(key, Integer.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }
}
