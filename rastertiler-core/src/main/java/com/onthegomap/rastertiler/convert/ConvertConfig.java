package com.onthegomap.rastertiler.convert;

import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.files.TilePathPattern;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Options for {@link TileConverter}.
 *
 * @param zoomLevels   zoom level tokens resolved by {@link ZoomLevelSpec}
 * @param grayscale    convert every output tile to grayscale
 * @param outputFormat format to re-encode tiles with, or empty to keep the source format
 * @param pattern      file layout used for directory output and for {@code extractDir}
 * @param extractDir   directory to extract the converted tileset into afterwards, if any
 */
public record ConvertConfig(
  List<String> zoomLevels,
  boolean grayscale,
  Optional<TileFormat> outputFormat,
  TilePathPattern pattern,
  Optional<Path> extractDir
) {

  public ConvertConfig {
    zoomLevels = List.copyOf(zoomLevels);
  }

  public static ConvertConfig defaults() {
    return new ConvertConfig(List.of(), false, Optional.empty(), TilePathPattern.defaultPattern(), Optional.empty());
  }

  public static ConvertConfig from(Arguments arguments) {
    return new ConvertConfig(
      arguments.getList("zoom_levels", "zoom levels to output: N, -N below min, +N above max, or all",
        List.of()),
      arguments.getBoolean("grayscale", "convert tiles to grayscale", false),
      parseOutputFormat(arguments.getString("format", "output format: default, png or jpg", "default")),
      TilePathPattern.parse(arguments.getString("pattern", "file layout for directory output",
        TilePathPattern.DEFAULT_PATTERN)),
      Optional.ofNullable(arguments.file("extract", "directory to extract the converted tiles into", null))
    );
  }

  /**
   * Parses {@code default}, {@code png}, {@code jpg} or {@code jpeg}.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static Optional<TileFormat> parseOutputFormat(String value) {
    String normalized = value == null ? "default" : value.strip().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "default" -> Optional.empty();
      case "png" -> Optional.of(TileFormat.PNG);
      case "jpg", "jpeg" -> Optional.of(TileFormat.JPEG);
      default -> throw new IllegalArgumentException("Unsupported output format '" + value +
        "', expected default, png or jpg");
    };
  }

  public ConvertConfig withZoomLevels(String... tokens) {
    return new ConvertConfig(List.of(tokens), grayscale, outputFormat, pattern, extractDir);
  }

  public ConvertConfig withGrayscale(boolean grayscale) {
    return new ConvertConfig(zoomLevels, grayscale, outputFormat, pattern, extractDir);
  }

  public ConvertConfig withOutputFormat(TileFormat format) {
    return new ConvertConfig(zoomLevels, grayscale, Optional.ofNullable(format), pattern, extractDir);
  }
}
