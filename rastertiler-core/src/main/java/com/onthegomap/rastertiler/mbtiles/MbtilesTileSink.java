package com.onthegomap.rastertiler.mbtiles;

import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.archive.TileSink;
import com.onthegomap.rastertiler.archive.TilesetInfo;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.ImageCodec;
import com.onthegomap.rastertiler.image.RasterImage;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.Format;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes tiles into an mbtiles file inside one transaction.
 * <p>
 * Tables and the unique tile index are created if absent. Every tile is written with {@code INSERT OR REPLACE}, the
 * transaction is committed once by {@link #finish(TilesetInfo)}, then {@code minzoom}, {@code maxzoom} and
 * {@code format} metadata are updated. Any failure before that, or closing without finishing, rolls back every tile
 * written through this sink.
 */
public class MbtilesTileSink implements TileSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(MbtilesTileSink.class);

  private final Mbtiles mbtiles;
  private final ImageCodec codec;
  private final Optional<TileFormat> outputFormat;
  private final Mbtiles.TileWriter writer;
  private boolean finished = false;

  /**
   * Wraps {@code mbtiles} which this sink then owns and closes.
   *
   * @param outputFormat format to encode synthesized images with, or empty to follow the source format
   */
  public MbtilesTileSink(Mbtiles mbtiles, ImageCodec codec, Optional<TileFormat> outputFormat) {
    this.mbtiles = mbtiles;
    this.codec = codec;
    this.outputFormat = outputFormat;
    mbtiles.createTablesWithIndexes();
    mbtiles.beginTransaction();
    this.writer = mbtiles.newTileWriter();
  }

  /** Opens or creates the mbtiles file at {@code path} and returns a sink writing to it. */
  public static MbtilesTileSink open(Path path, ImageCodec codec, Optional<TileFormat> outputFormat) {
    FileUtils.createParentDirectories(path);
    LOGGER.info("Writing tiles to {}", path);
    return new MbtilesTileSink(Mbtiles.newWriteToFileDatabase(path), codec, outputFormat);
  }

  @Override
  public void writeTile(Tile tile) {
    writer.write(tile.coord(), tile.bytes());
  }

  @Override
  public void writeImage(TileCoord coord, RasterImage image, TileFormat sourceFormat) {
    TileFormat format = TileFormat.chooseEncoding(outputFormat, sourceFormat);
    writer.write(coord, codec.encode(image, format));
  }

  @Override
  public void finish(TilesetInfo info) {
    writer.close();
    mbtiles.commitTransaction();
    finished = true;
    mbtiles.setMetadata(info.updatedMetadata(), true);
    LOGGER.info("Committed {} tiles to {} (zoom {}-{})", Format.defaultInstance().integer(writer.count()),
      mbtiles.name(), info.minZoom(), info.maxZoom());
  }

  @Override
  public long tilesWritten() {
    return writer.count();
  }

  @Override
  public void close() {
    try {
      if (!finished) {
        LOGGER.warn("Rolling back {} uncommitted tiles in {}", writer.count(), mbtiles.name());
        mbtiles.rollbackTransaction();
      }
    } finally {
      mbtiles.close();
    }
  }
}
