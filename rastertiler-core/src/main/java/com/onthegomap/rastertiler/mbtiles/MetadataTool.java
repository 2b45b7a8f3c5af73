package com.onthegomap.rastertiler.mbtiles;

import com.onthegomap.rastertiler.config.Arguments;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line utility to list, read and write the metadata table of an mbtiles file.
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar metadata list --input=tiles.mbtiles
 * java -jar rastertiler.jar metadata get --input=tiles.mbtiles --key=name
 * java -jar rastertiler.jar metadata set --input=tiles.mbtiles --key=name --value="My tiles" [--no-overwrite]
 * }
 * </pre>
 */
public class MetadataTool {

  private MetadataTool() {}

  public static void main(String... args) {
    if (args.length == 0 || args[0].startsWith("-")) {
      throw new IllegalArgumentException("Expected a metadata command: list, get or set");
    }
    String command = args[0].strip().toLowerCase(Locale.ROOT);
    Arguments arguments = Arguments.fromArgsOrConfigFile(Arrays.copyOfRange(args, 1, args.length));
    Path input = arguments.inputFile("input", "mbtiles file");
    run(command, input, arguments, System.out);
  }

  static void run(String command, Path input, Arguments arguments, PrintStream out) {
    switch (command) {
      case "list" -> {
        for (var entry : list(input).entrySet()) {
          out.println(entry.getKey() + "=" + entry.getValue());
        }
      }
      case "get" -> out.println(get(input, arguments.getString("key", "metadata key to read")));
      case "set" -> set(
        input,
        arguments.getString("key", "metadata key to write"),
        arguments.getString("value", "value to write"),
        !arguments.getBoolean("no_overwrite", "fail if the key already exists", false)
      );
      default -> throw new IllegalArgumentException(
        "Unknown metadata command '" + command + "', expected list, get or set");
    }
  }

  /** Returns every metadata entry of {@code input} ordered by key. */
  public static Map<String, String> list(Path input) {
    try (Mbtiles mbtiles = Mbtiles.newReadOnlyDatabase(input)) {
      return mbtiles.metadata();
    }
  }

  /**
   * Returns the metadata value of {@code key}.
   *
   * @throws IllegalArgumentException if there is no such key
   */
  public static String get(Path input, String key) {
    try (Mbtiles mbtiles = Mbtiles.newReadOnlyDatabase(input)) {
      return mbtiles.metadataValue(key)
        .orElseThrow(() -> new IllegalArgumentException("Metadata key '" + key + "' not found in " + input));
    }
  }

  /**
   * Writes {@code key=value} to the metadata table of {@code input}.
   *
   * @throws MetadataKeyExistsException if {@code overwrite} is false and the key already exists
   */
  public static void set(Path input, String key, String value, boolean overwrite) {
    try (Mbtiles mbtiles = Mbtiles.newReadWriteDatabase(input)) {
      mbtiles.setMetadata(Map.of(key, value), overwrite);
    }
  }
}
