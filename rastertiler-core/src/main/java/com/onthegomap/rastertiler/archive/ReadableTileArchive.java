package com.onthegomap.rastertiler.archive;

import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.util.CloseableIterator;
import java.io.Closeable;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Read API for a tileset: an MBTiles sqlite file or a directory tree of tile images.
 * <p>
 * All coordinates use XYZ row numbering. Implementations are not thread-safe.
 */
public interface ReadableTileArchive extends Closeable {

  /** Returns the tile at {@code coord} or empty if there is none. */
  default Optional<Tile> getTile(TileCoord coord) {
    return getTile(coord.x(), coord.y(), coord.z());
  }

  /** Returns the tile at column {@code x}, XYZ row {@code y} and zoom {@code z} or empty if there is none. */
  Optional<Tile> getTile(int x, int y, int z);

  /**
   * Returns an iterator over every tile in this archive in storage order.
   * <p>
   * Each call starts a new pass. Clients should be sure to close the iterator after iterating through it, for example:
   *
   * <pre>
   * {@code
   * try (var iter = archive.getAllTiles()) {
   *   while (iter.hasNext()) {
   *     var tile = iter.next();
   *     ...
   *   }
   * }
   * }
   * </pre>
   */
  CloseableIterator<Tile> getAllTiles();

  /** Returns an iterator over the tiles at zoom level {@code z}. */
  default CloseableIterator<Tile> getTilesAtZoom(int z) {
    return getAllTiles().filter(tile -> tile.coord().z() == z);
  }

  /** Returns the distinct zoom levels that hold at least one tile, computed fresh on each call. */
  SortedSet<Integer> zoomLevels();

  /** Returns the key/value metadata of this archive ordered by key. */
  SortedMap<String, String> metadata();

  /** Returns a human-readable name for this archive, like its file name. */
  String name();

  @Override
  void close();
}
