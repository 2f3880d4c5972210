package com.onthegomap.wdosm.config;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run parameters gathered from the command line, {@code wdosm.*} JVM properties, {@code WDOSM_*} environment variables
 * and a {@code config=} properties file.
 * <p>
 * Keys match regardless of case and of whether words are joined by {@code _}, {@code -} or {@code .}, so
 * {@code --max-depth 3}, {@code -Dwdosm.max.depth=3} and {@code WDOSM_MAX_DEPTH=3} all set {@code max_depth}.
 * <p>
 * A key of the form {@code "max_depth|stop_level"} reads {@code max_depth} and falls back to the legacy
 * {@code stop_level}, logging a warning when only the legacy name is set.
 */
public final class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String PREFIX = "wdosm_";
  private static final Splitter ALIASES = Splitter.on('|').trimResults().omitEmptyStrings();

  /** One place values came from, with keys already in canonical form. */
  private record Source(String origin, Map<String, String> values) {}

  private final List<Source> sources;

  private Arguments(List<Source> sources) {
    this.sources = List.copyOf(sources);
  }

  private static Arguments single(String origin, Map<String, String> values) {
    return new Arguments(List.of(new Source(origin, values)));
  }

  /** Lower-cases {@code key} and joins its words with {@code _}. */
  static String canonical(String key) {
    return key.strip().toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
  }

  /** Keeps the entries of {@code raw} whose canonical key starts with {@code wdosm_}, with that prefix removed. */
  private static Map<String, String> withoutPrefix(Map<?, ?> raw) {
    Map<String, String> values = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      String name = canonical(key.toString());
      if (name.startsWith(PREFIX) && name.length() > PREFIX.length() && value != null) {
        values.put(name.substring(PREFIX.length()), value.toString());
      }
    });
    return values;
  }

  /** Returns parameters from {@code key=value}, {@code --key=value}, {@code --key value} and bare {@code --flag}. */
  public static Arguments fromArgs(String... args) {
    Map<String, String> values = new LinkedHashMap<>();
    PeekingIterator<String> words = Iterators.peekingIterator(Arrays.stream(args).map(String::strip).iterator());
    while (words.hasNext()) {
      String word = words.next();
      boolean dashed = word.startsWith("-");
      String body = CharMatcher.is('-').trimLeadingFrom(word);
      int equals = body.indexOf('=');
      if (equals >= 0) {
        values.put(canonical(body.substring(0, equals)), body.substring(equals + 1));
      } else if (dashed && words.hasNext() && !words.peek().startsWith("-")) {
        values.put(canonical(body), words.next());
      } else {
        values.put(canonical(body), "true");
      }
    }
    return single("command line", values);
  }

  /** Returns parameters from JVM system properties such as {@code -Dwdosm.max_depth=3}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System.getProperties());
  }

  static Arguments fromJvmProperties(Properties properties) {
    Map<String, String> raw = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      raw.put(name, properties.getProperty(name));
    }
    return single("jvm properties", withoutPrefix(raw));
  }

  /** Returns parameters from environment variables such as {@code WDOSM_MAX_DEPTH=3}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static Arguments fromEnvironment(Map<String, String> environment) {
    return single("environment", withoutPrefix(environment));
  }

  /**
   * Returns parameters from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot read config file " + path, e);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      values.put(canonical(name), properties.getProperty(name));
    }
    return single("config file " + path, values);
  }

  /**
   * Returns parameters from the command line, then JVM properties, then the environment, then the properties file
   * named by {@code config} in any of those.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments direct = fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
    Path configFile = direct.file("config", "properties file with more parameters", null);
    return configFile == null ? direct : direct.orElse(fromConfigFile(configFile));
  }

  /** Returns parameters from alternating keys and values, mostly for tests and defaults. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " items");
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      values.put(canonical(keysAndValues[i].toString()), keysAndValues[i + 1].toString());
    }
    return single("inline", values);
  }

  /** Returns parameters that consult {@code this} first and {@code fallback} for keys {@code this} lacks. */
  public Arguments orElse(Arguments fallback) {
    List<Source> chain = new ArrayList<>(sources);
    chain.addAll(fallback.sources);
    return new Arguments(chain);
  }

  private String lookup(String key, String description, Object defaultValue) {
    List<String> aliases = ALIASES.splitToList(key);
    for (Source source : sources) {
      for (int i = 0; i < aliases.size(); i++) {
        String value = source.values().get(canonical(aliases.get(i)));
        if (value != null) {
          if (i > 0) {
            LOGGER.warn("'{}' is deprecated, use '{}' instead", aliases.get(i), aliases.get(0));
          }
          LOGGER.debug("{}={} ({}, from {})", aliases.get(0), value.strip(), description, source.origin());
          return value.strip();
        }
      }
    }
    LOGGER.debug("{}={} ({}, default)", aliases.get(0), defaultValue, description);
    return null;
  }

  public String getString(String key, String description, String defaultValue) {
    String value = lookup(key, description, defaultValue);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns {@code key} as an int.
   *
   * @throws NumberFormatException if the value is set but is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    String value = lookup(key, description, defaultValue);
    return value == null ? defaultValue : Integer.parseInt(value);
  }

  /** Returns true when {@code key} is set to {@code true} in any case, false when set to anything else. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    String value = lookup(key, description, defaultValue);
    return value == null ? defaultValue : Boolean.parseBoolean(value);
  }

  public Path file(String key, String description, Path defaultValue) {
    String value = lookup(key, description, defaultValue);
    return value == null ? defaultValue : Path.of(value);
  }

  /**
   * Returns the {@code threads} parameter, or the number of available processors when it is not set.
   *
   * @throws NumberFormatException if the value is set but is not an integer
   */
  public int threads() {
    return getInteger("threads", "worker threads per stage", Runtime.getRuntime().availableProcessors());
  }
}
