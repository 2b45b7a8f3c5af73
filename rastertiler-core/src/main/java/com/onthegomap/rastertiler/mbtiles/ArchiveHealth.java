package com.onthegomap.rastertiler.mbtiles;

import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.Format;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks how completely the highest zoom level of an mbtiles file covers the rectangle of columns and rows it spans,
 * and optionally deletes files that are too sparse to be useful.
 * <p>
 * To run from the command line:
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar health --input=tiles.mbtiles [--delete-if-corrupt]
 * }
 * </pre>
 */
public class ArchiveHealth {

  /** Lowest ratio of present to expected tiles that counts as healthy. */
  public static final double MIN_HEALTHY_RATIO = 0.25;

  private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveHealth.class);

  private ArchiveHealth() {}

  /**
   * Health of one archive.
   *
   * @param zoom     highest zoom level, or -1 if the archive has no tiles
   * @param tiles    tiles present at that zoom
   * @param expected tiles in the column/row range of that zoom
   */
  public record Result(int zoom, long tiles, long expected) {

    public double ratio() {
      return expected == 0 ? 0 : (double) tiles / expected;
    }

    public boolean healthy() {
      return expected > 0 && ratio() >= MIN_HEALTHY_RATIO;
    }
  }

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Path input = arguments.inputFile("input", "mbtiles file to check");
    boolean delete = arguments.getBoolean("delete_if_corrupt", "delete the file if it is unhealthy", false);
    Result result = checkFile(input, delete);
    System.out.println((result.healthy() ? "healthy " : "unhealthy ") + input + " ratio=" +
      Format.defaultInstance().decimal(result.ratio()));
  }

  /** Returns the health of {@code mbtiles} computed from its highest zoom level. */
  public static Result check(Mbtiles mbtiles) {
    List<Mbtiles.LevelStats> stats = mbtiles.levelStats();
    if (stats.isEmpty()) {
      LOGGER.warn("{} has no tiles", mbtiles.name());
      return new Result(-1, 0, 0);
    }
    Mbtiles.LevelStats highest = stats.get(stats.size() - 1);
    Result result = new Result(highest.z(), highest.count(), highest.rangeSize());
    LOGGER.info("{} zoom {}: {} of {} tiles present in columns {}-{}, TMS rows {}-{}, ratio {}", mbtiles.name(),
      highest.z(), Format.defaultInstance().integer(highest.count()),
      Format.defaultInstance().integer(highest.rangeSize()), highest.minX(), highest.maxX(), highest.minTmsY(),
      highest.maxTmsY(), Format.defaultInstance().percent(result.ratio()));
    return result;
  }

  /**
   * Checks the mbtiles file at {@code path} and deletes it when unhealthy and {@code deleteIfCorrupt} is set.
   *
   * @throws java.io.UncheckedIOException if the file should be deleted but cannot be
   */
  public static Result checkFile(Path path, boolean deleteIfCorrupt) {
    Result result;
    try (Mbtiles mbtiles = Mbtiles.newReadOnlyDatabase(path)) {
      result = check(mbtiles);
    }
    if (!result.healthy()) {
      LOGGER.warn("{} is unhealthy (ratio below {})", path, MIN_HEALTHY_RATIO);
      if (deleteIfCorrupt) {
        FileUtils.deleteFile(path);
        LOGGER.info("Deleted {}", path);
      }
    }
    return result;
  }
}
