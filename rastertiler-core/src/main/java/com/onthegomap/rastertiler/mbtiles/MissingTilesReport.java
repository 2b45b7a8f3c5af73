package com.onthegomap.rastertiler.mbtiles;

import com.carrotsearch.hppc.LongHashSet;
import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.stats.Timer;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.Format;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the tiles missing from each zoom level of an mbtiles file, inside the rectangle of columns and rows that the
 * level covers.
 * <p>
 * The report lists one {@code /z/x/y} per line with TMS rows, or XYZ rows when {@code inverse} is set. With
 * {@code upperZoom} each missing tile is replaced by its four children one zoom level down, which is what a downloader
 * needs to fetch to fill the gap from a finer level.
 * <p>
 * To run from the command line:
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar missing-report --input=tiles.mbtiles --output=missing.txt [--inverse] [--upper-zoom]
 * }
 * </pre>
 */
public class MissingTilesReport {

  private static final Logger LOGGER = LoggerFactory.getLogger(MissingTilesReport.class);

  private MissingTilesReport() {}

  /**
   * Tiles of one zoom level.
   *
   * @param stats   count and column/row range of the level
   * @param missing absent tiles inside that range, ordered by column then TMS row
   */
  public record LevelReport(Mbtiles.LevelStats stats, List<TileCoord> missing) {

    public int zoom() {
      return stats.z();
    }

    public long expected() {
      return stats.rangeSize();
    }
  }

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Path input = arguments.inputFile("input", "mbtiles file to analyze");
    Path output = arguments.file("output", "text file to write missing tiles to");
    boolean inverse = arguments.getBoolean("inverse", "write XYZ rows instead of TMS rows", false);
    boolean upperZoom = arguments.getBoolean("upper_zoom", "write the 4 children of each missing tile", false);
    try (Mbtiles mbtiles = Mbtiles.newReadOnlyDatabase(input)) {
      write(analyze(mbtiles), output, inverse, upperZoom);
    }
  }

  /** Returns the tiles missing from every zoom level of {@code mbtiles}, ordered by zoom. */
  public static List<LevelReport> analyze(Mbtiles mbtiles) {
    Timer timer = Timer.start();
    List<LevelReport> result = new ArrayList<>();
    for (Mbtiles.LevelStats stats : mbtiles.levelStats()) {
      int z = stats.z();
      LongHashSet present = new LongHashSet();
      try (var coords = mbtiles.getTileCoordsAtZoom(z)) {
        while (coords.hasNext()) {
          TileCoord coord = coords.next();
          present.add(pack(coord.x(), coord.tmsY()));
        }
      }
      List<TileCoord> missing = new ArrayList<>();
      for (int x = stats.minX(); x <= stats.maxX(); x++) {
        for (int y = stats.minTmsY(); y <= stats.maxTmsY(); y++) {
          if (!present.contains(pack(x, y))) {
            missing.add(TileCoord.ofTMS(x, y, z));
          }
        }
      }
      LOGGER.info("Zoom {}: columns {}-{}, TMS rows {}-{}, {} of {} tiles present, {} missing", z, stats.minX(),
        stats.maxX(), stats.minTmsY(), stats.maxTmsY(), Format.defaultInstance().integer(stats.count()),
        Format.defaultInstance().integer(stats.rangeSize()), Format.defaultInstance().integer(missing.size()));
      result.add(new LevelReport(stats, missing));
    }
    LOGGER.info("Analyzed {} in {}", mbtiles.name(), timer.stop());
    return result;
  }

  private static long pack(int x, int y) {
    return ((long) x << 32) | (y & 0xffffffffL);
  }

  /** Returns the report lines for {@code level}. */
  public static List<String> lines(LevelReport level, boolean inverse, boolean upperZoom) {
    List<String> result = new ArrayList<>();
    for (TileCoord coord : level.missing()) {
      if (upperZoom) {
        int z = coord.z() + 1;
        for (int dx = 0; dx <= 1; dx++) {
          for (int dy = 0; dy <= 1; dy++) {
            result.add(line(TileCoord.ofTMS(coord.x() * 2 + dx, coord.tmsY() * 2 + dy, z), inverse));
          }
        }
      } else {
        result.add(line(coord, inverse));
      }
    }
    return result;
  }

  private static String line(TileCoord coord, boolean inverse) {
    return "/" + coord.z() + "/" + coord.x() + "/" + (inverse ? coord.y() : coord.tmsY());
  }

  /**
   * Writes the report lines of every level to {@code output}.
   *
   * @return the number of lines written
   */
  public static long write(List<LevelReport> levels, Path output, boolean inverse, boolean upperZoom) {
    FileUtils.createParentDirectories(output);
    long count = 0;
    try (Writer writer = Files.newBufferedWriter(output)) {
      for (LevelReport level : levels) {
        for (String line : lines(level, inverse, upperZoom)) {
          writer.write(line);
          writer.write('\n');
          count++;
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + output, e);
    }
    LOGGER.info("Wrote {} missing tiles ({} rows) to {}", Format.defaultInstance().integer(count),
      inverse ? "XYZ" : "TMS", output);
    return count;
  }
}
