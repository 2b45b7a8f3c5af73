package com.onthegomap.rastertiler.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options for the command-line tools, read from the command line, {@code -Drastertiler.*} JVM properties,
 * {@code RASTERTILER_*} environment variables or a properties file named by {@code --config}.
 * <p>
 * Keys ignore case and treat {@code -}, {@code .} and {@code _} alike, so {@code --zoom-levels},
 * {@code -Drastertiler.zoom_levels} and {@code RASTERTILER_ZOOM_LEVELS} all set {@code zoom_levels}.
 * <p>
 * A key of the form {@code "new_name|old_name"} reads {@code new_name} and falls back to the deprecated
 * {@code old_name}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final UnaryOperator<String> provider;

  private Arguments(UnaryOperator<String> provider) {
    this.provider = provider;
  }

  /** Returns arguments from JVM system properties prefixed with {@code rastertiler.} */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("rastertiler." + key.replace('_', '.')))
      .orElse(new Arguments(key -> getter.apply("rastertiler." + key)));
  }

  /** Returns arguments from environment variables prefixed with {@code RASTERTILER_} */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("RASTERTILER_" + key.toUpperCase(Locale.ROOT)));
  }

  /**
   * Returns arguments parsed from command-line arguments.
   * <p>
   * Accepts {@code --key=value}, {@code --key value} and {@code key=value}. A {@code --flag} that is not followed by
   * a value means {@code true}. Values that start with a dash, like relative zoom levels, need the
   * {@code --key=-1} form.
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
   * Returns arguments from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> map = new HashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Returns arguments from the command line, then JVM properties, then environment variables, then the properties
   * file that any of those name with {@code config}.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments fromArgsOrEnv = fromEnvOrArgs(args);
    Path configFile = fromArgsOrEnv.file("config", "path to a .properties file with more arguments", null);
    return configFile == null ? fromArgsOrEnv : fromArgsOrEnv.orElse(fromConfigFile(configFile));
  }

  /** Returns arguments from the command line, then JVM properties, then environment variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new HashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} with alternating keys and values. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  /** Returns arguments that check {@code this} first and {@code other} for keys {@code this} does not have. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = provider.apply(key);
      return value != null ? value : other.provider.apply(key);
    });
  }

  private String getArg(String key) {
    String[] options = key.split("\\|");
    for (int i = 0; i < options.length; i++) {
      String value = provider.apply(normalize(options[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", options[i].strip(), options[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  private String getRequiredArg(String key, String description) {
    String value = getArg(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return value;
  }

  private static void logArgValue(String key, String description, Object value) {
    LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), value, description);
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key);
    String result = value == null ? defaultValue : value;
    logArgValue(key, description, result);
    return result;
  }

  /** @throws IllegalArgumentException if {@code key} is not set */
  public String getString(String key, String description) {
    String value = getRequiredArg(key, description);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns {@code true} if {@code key} is {@code "true"} ignoring case, {@code defaultValue} if it is not set. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    String value = getArg(key);
    boolean result = value == null ? defaultValue : "true".equalsIgnoreCase(value);
    logArgValue(key, description, result);
    return result;
  }

  /** Returns the comma-separated values of {@code key} without blank entries. */
  public List<String> getList(String key, String description, List<String> defaultValue) {
    String value = getArg(key);
    List<String> result = value == null ? defaultValue : Stream.of(value.split(","))
      .map(String::strip)
      .filter(item -> !item.isEmpty())
      .toList();
    logArgValue(key, description, result);
    return result;
  }

  public Path file(String key, String description, Path defaultValue) {
    String value = getArg(key);
    Path result = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, result);
    return result;
  }

  /** @throws IllegalArgumentException if {@code key} is not set */
  public Path file(String key, String description) {
    Path result = Path.of(getRequiredArg(key, description));
    logArgValue(key, description, result);
    return result;
  }

  /** @throws IllegalArgumentException if {@code key} is not set or the path does not exist */
  public Path inputFile(String key, String description) {
    Path path = file(key, description);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }
}
