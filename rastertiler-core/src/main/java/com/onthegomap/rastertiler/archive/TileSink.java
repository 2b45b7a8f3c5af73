package com.onthegomap.rastertiler.archive;

import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.RasterImage;
import java.io.Closeable;

/**
 * Write API for a destination of tiles: a directory tree or a new MBTiles file.
 * <p>
 * Callers write every tile, call {@link #finish(TilesetInfo)} once and then {@link #close()}. Closing without
 * finishing discards whatever the sink could not make durable yet.
 */
public interface TileSink extends Closeable {

  /** Persists the compressed bytes of {@code tile} unchanged. */
  void writeTile(Tile tile);

  /**
   * Encodes {@code image} and persists it at {@code coord}.
   *
   * @param sourceFormat format of the tiles the image was derived from, used when no output format is configured
   */
  void writeImage(TileCoord coord, RasterImage image, TileFormat sourceFormat);

  /** Completes the tileset and writes its metadata. */
  void finish(TilesetInfo info);

  /** Returns the number of tiles written so far. */
  long tilesWritten();

  @Override
  void close();
}
