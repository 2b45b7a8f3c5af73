package com.onthegomap.rastertiler.extract;

import com.onthegomap.rastertiler.archive.ReadableTileArchive;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileArchives;
import com.onthegomap.rastertiler.archive.TilesetInfo;
import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.files.TilePathPattern;
import com.onthegomap.rastertiler.files.WriteableFilesArchive;
import com.onthegomap.rastertiler.image.ImageIoCodec;
import com.onthegomap.rastertiler.stats.Timer;
import com.onthegomap.rastertiler.util.Format;
import com.onthegomap.rastertiler.util.LogUtil;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every tile of an archive to its own file under a directory, keeping the compressed bytes as they are.
 * <p>
 * To run from the command line:
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar extract --input=tiles.mbtiles --output=tiles [--pattern={z}/{x}/{y}.{ext}]
 * }
 * </pre>
 */
public class TileExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileExtractor.class);
  private static final long LOG_INTERVAL = 1_000;

  private TileExtractor() {}

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Path input = arguments.inputFile("input", "mbtiles file or tile directory to extract");
    Path output = arguments.file("output", "directory to write tiles to", Path.of("."));
    TilePathPattern pattern = TilePathPattern.parse(
      arguments.getString("pattern", "file layout under the output directory", TilePathPattern.DEFAULT_PATTERN));
    TilePathPattern inputPattern = TilePathPattern.parse(
      arguments.getString("input_pattern", "file layout of a directory input", TilePathPattern.DEFAULT_PATTERN));
    try (ReadableTileArchive archive = TileArchives.newReader(input, inputPattern)) {
      extract(archive, output, pattern);
    }
  }

  /**
   * Writes every tile of {@code source} to {@code outputDir} at the path {@code pattern} expands to.
   * <p>
   * Files written before a failure are left in place.
   *
   * @return the number of tiles written
   */
  public static long extract(ReadableTileArchive source, Path outputDir, TilePathPattern pattern) {
    LogUtil.setStage("extract");
    Timer timer = Timer.start();
    int minZoom = Integer.MAX_VALUE;
    int maxZoom = Integer.MIN_VALUE;
    try (
      var sink = WriteableFilesArchive.newWriter(outputDir, pattern, ImageIoCodec.getInstance());
      var tiles = source.getAllTiles()
    ) {
      while (tiles.hasNext()) {
        Tile tile = tiles.next();
        sink.writeTile(tile);
        minZoom = Math.min(minZoom, tile.coord().z());
        maxZoom = Math.max(maxZoom, tile.coord().z());
        if (sink.tilesWritten() % LOG_INTERVAL == 0) {
          LOGGER.info("Extracted {} tiles from {}", Format.defaultInstance().integer(sink.tilesWritten()),
            source.name());
        }
      }
      if (sink.tilesWritten() > 0) {
        sink.finish(new TilesetInfo(source.metadata(), minZoom, maxZoom, Optional.empty()));
      }
      LOGGER.info("Extracted {} tiles from {} to {} in {}", Format.defaultInstance().integer(sink.tilesWritten()),
        source.name(), outputDir, timer.stop());
      return sink.tilesWritten();
    } finally {
      LogUtil.clearStage();
    }
  }
}
