package com.onthegomap.rastertiler.mbtiles;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.onthegomap.rastertiler.archive.ReadableTileArchive;
import com.onthegomap.rastertiler.archive.TileArchives;
import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.files.TilePathPattern;
import com.onthegomap.rastertiler.util.JsonUtils;
import java.nio.file.Path;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Name, size, zoom range and metadata of a tileset, serialized as JSON for viewers and scripts.
 * <p>
 * To run from the command line:
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar summary --input=tiles.mbtiles [--output=summary.json]
 * }
 * </pre>
 *
 * @param name      file or directory name of the tileset
 * @param tileCount number of tiles
 * @param minZoom   lowest zoom level with tiles, absent for an empty tileset
 * @param maxZoom   highest zoom level with tiles, absent for an empty tileset
 * @param metadata  key/value metadata ordered by key
 */
public record TilesetSummary(
  @JsonProperty("name") String name,
  @JsonProperty("tile_count") long tileCount,
  @JsonProperty("minzoom") Optional<Integer> minZoom,
  @JsonProperty("maxzoom") Optional<Integer> maxZoom,
  @JsonProperty("metadata") SortedMap<String, String> metadata
) {

  public TilesetSummary {
    metadata = new TreeMap<>(metadata);
  }

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Path input = arguments.inputFile("input", "mbtiles file or tile directory to summarize");
    Path output = arguments.file("output", "file to write the JSON summary to", null);
    TilePathPattern pattern = TilePathPattern.parse(
      arguments.getString("input_pattern", "file layout of a directory input", TilePathPattern.DEFAULT_PATTERN));
    TilesetSummary summary;
    try (ReadableTileArchive archive = TileArchives.newReader(input, pattern)) {
      summary = of(archive);
    }
    if (output == null) {
      System.out.println(summary.toJson());
    } else {
      JsonUtils.writePretty(output, summary);
    }
  }

  /** Returns the summary of {@code archive}, counting tiles with one aggregate query for mbtiles files. */
  public static TilesetSummary of(ReadableTileArchive archive) {
    SortedSet<Integer> levels = archive.zoomLevels();
    long count;
    if (archive instanceof Mbtiles mbtiles) {
      count = mbtiles.tileCount();
    } else {
      count = 0;
      try (var tiles = archive.getAllTiles()) {
        while (tiles.hasNext()) {
          tiles.next();
          count++;
        }
      }
    }
    return new TilesetSummary(
      archive.name(),
      count,
      levels.isEmpty() ? Optional.empty() : Optional.of(levels.first()),
      levels.isEmpty() ? Optional.empty() : Optional.of(levels.last()),
      archive.metadata()
    );
  }

  public String toJson() {
    return JsonUtils.toPrettyJsonString(this);
  }
}
