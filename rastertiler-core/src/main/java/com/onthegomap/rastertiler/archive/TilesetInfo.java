package com.onthegomap.rastertiler.archive;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Describes a finished tileset to a {@link TileSink}.
 *
 * @param metadata      metadata copied from the source archive
 * @param minZoom       lowest zoom level that was requested
 * @param maxZoom       highest zoom level that was requested
 * @param encodedFormat format every tile was re-encoded to, or empty if source payloads were kept
 */
public record TilesetInfo(SortedMap<String, String> metadata, int minZoom, int maxZoom,
  Optional<TileFormat> encodedFormat) {

  public TilesetInfo {
    metadata = new TreeMap<>(metadata);
  }

  /** Returns the metadata entries to persist with {@code minzoom}, {@code maxzoom} and {@code format} updated. */
  public SortedMap<String, String> updatedMetadata() {
    SortedMap<String, String> result = new TreeMap<>(metadata);
    result.putAll(Map.of(
      "minzoom", Integer.toString(minZoom),
      "maxzoom", Integer.toString(maxZoom)
    ));
    encodedFormat.ifPresent(format -> result.put("format", format.extension()));
    return result;
  }
}
