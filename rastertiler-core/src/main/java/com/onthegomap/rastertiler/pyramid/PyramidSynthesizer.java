package com.onthegomap.rastertiler.pyramid;

import com.onthegomap.rastertiler.archive.ReadableTileArchive;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.ImageCodec;
import com.onthegomap.rastertiler.image.RasterImage;
import com.onthegomap.rastertiler.stats.Timer;
import com.onthegomap.rastertiler.util.Format;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes zoom levels of a tile pyramid, loading them from a source archive or deriving them from an adjacent
 * level.
 * <p>
 * A level that exists in the source is decoded from it. A missing level is downsampled from the next finer level when
 * the source has any finer level, else upsampled from the next coarser one. Each level is computed at most once per
 * instance, derived levels are built from their neighbors recursively.
 * <p>
 * Downsampling combines every complete 2x2 block of child tiles into a parent tile. Blocks with a missing child or
 * children of different sizes are skipped: gaps in the finer level become gaps in the coarser one. Upsampling
 * magnifies each tile to twice its size and cuts the result into four children.
 * <p>
 * Closing the synthesizer releases every cached level but does not close the source.
 */
@NotThreadSafe
public class PyramidSynthesizer implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PyramidSynthesizer.class);

  private final ReadableTileArchive source;
  private final ImageCodec codec;
  private final boolean grayscale;
  private final SortedSet<Integer> available;
  private final Map<Integer, LevelTiles> cache = new HashMap<>();
  private TileFormat sourceFormat = null;

  /**
   * @param grayscale convert every generated level to grayscale, levels loaded from {@code source} are left as-is
   */
  public PyramidSynthesizer(ReadableTileArchive source, ImageCodec codec, boolean grayscale) {
    this.source = source;
    this.codec = codec;
    this.grayscale = grayscale;
    this.available = new TreeSet<>(source.zoomLevels());
  }

  /** Returns the zoom levels present in the source when this synthesizer was created. */
  public SortedSet<Integer> availableLevels() {
    return available;
  }

  /** Returns a plan that copies the requested levels present in the source and generates the rest. */
  public ZoomLevelPlan plan(List<Integer> requested) {
    ZoomLevelPlan plan = ZoomLevelPlan.of(requested, available);
    if (!available.isEmpty()) {
      int max = available.last();
      for (int level : plan.requested()) {
        if (level > max) {
          LOGGER.warn("Requested zoom {} is above the highest source zoom {}, tiles will be upsampled", level, max);
        }
      }
    }
    return plan;
  }

  /**
   * Returns the format of the source tiles: the format of the first tile decoded, or PNG if no tile was decoded yet.
   */
  public TileFormat sourceFormat() {
    return sourceFormat == null ? TileFormat.PNG : sourceFormat;
  }

  /**
   * Returns the decoded tiles of {@code level}, computing it and every level it depends on if needed.
   *
   * @throws UnresolvableZoomLevelException if the level is not in the source and no adjacent level can produce it
   */
  public LevelTiles materialize(int level) {
    LevelTiles cached = cache.get(level);
    if (cached != null) {
      return cached;
    }
    if (level < 0 || level > TileCoord.MAX_ZOOM) {
      throw new UnresolvableZoomLevelException(level, "Zoom level " + level + " is outside [0, " +
        TileCoord.MAX_ZOOM + "]");
    }
    LevelTiles result;
    if (available.contains(level)) {
      result = load(level);
    } else if (!available.isEmpty() && available.last() > level) {
      result = downsample(materialize(level + 1));
      applyGrayscale(result);
    } else if (level > 0 && !available.isEmpty() && available.first() < level) {
      result = upsample(materialize(level - 1));
      applyGrayscale(result);
    } else {
      throw new UnresolvableZoomLevelException(level,
        "Cannot generate zoom " + level + " from " + source.name() + ", available levels: " + available);
    }
    cache.put(level, result);
    return result;
  }

  private void applyGrayscale(LevelTiles level) {
    if (grayscale) {
      level.forEachSorted((coord, image) -> image.toGrayscale());
    }
  }

  private LevelTiles load(int level) {
    Timer timer = Timer.start();
    LevelTiles result = new LevelTiles(level);
    try (var tiles = source.getTilesAtZoom(level)) {
      while (tiles.hasNext()) {
        Tile tile = tiles.next();
        if (sourceFormat == null) {
          sourceFormat = tile.format();
        }
        result.put(new TileKey(tile.coord().x(), tile.coord().y()), codec.decode(tile.bytes()));
      }
    }
    LOGGER.info("Loaded {} tiles at zoom {} in {}", Format.defaultInstance().integer(result.size()), level, timer);
    return result;
  }

  /** Combines each complete 2x2 block of {@code children} into one tile of the same size one level up. */
  LevelTiles downsample(LevelTiles children) {
    Timer timer = Timer.start();
    int level = children.zoom() - 1;
    Map<TileKey, RasterImage[]> buckets = new HashMap<>();
    for (TileKey key : children.sortedKeys()) {
      buckets.computeIfAbsent(key.parent(), k -> new RasterImage[4])[key.indexInParent()] = children.get(key);
    }
    LevelTiles result = new LevelTiles(level);
    int incomplete = 0;
    int inconsistent = 0;
    for (var entry : buckets.entrySet()) {
      RasterImage[] group = entry.getValue();
      List<RasterImage> quad = new ArrayList<>(4);
      for (RasterImage image : group) {
        if (image != null) {
          quad.add(image);
        }
      }
      if (quad.size() < 4) {
        incomplete++;
        LOGGER.debug("Skipping {} at zoom {}: only {} of 4 children", entry.getKey(), level, quad.size());
        continue;
      }
      RasterImage first = quad.get(0);
      if (quad.stream().anyMatch(child -> child.width() != first.width() || child.height() != first.height())) {
        inconsistent++;
        LOGGER.debug("Skipping {} at zoom {}: children have different sizes", entry.getKey(), level);
        continue;
      }
      result.put(entry.getKey(), RasterImage.mosaic2x2(quad).resize(first.width(), first.height()));
    }
    if (incomplete > 0 || inconsistent > 0) {
      LOGGER.info("Zoom {}: skipped {} incomplete and {} inconsistent blocks of zoom {} tiles", level, incomplete,
        inconsistent, children.zoom());
    }
    LOGGER.info("Generated {} tiles at zoom {} from zoom {} in {}", Format.defaultInstance().integer(result.size()),
      level, children.zoom(), timer);
    return result;
  }

  /** Splits each tile of {@code parents} into four magnified tiles of the same size one level down. */
  LevelTiles upsample(LevelTiles parents) {
    Timer timer = Timer.start();
    int level = parents.zoom() + 1;
    LevelTiles result = new LevelTiles(level);
    for (TileKey key : parents.sortedKeys()) {
      RasterImage parent = parents.get(key);
      RasterImage magnified = parent.resize(parent.width() * 2, parent.height() * 2);
      for (int i = 0; i < 4; i++) {
        TileKey child = new TileKey(key.x() * 2 + i % 2, key.y() * 2 + i / 2);
        result.put(child, magnified.quadrant(i));
      }
    }
    LOGGER.info("Generated {} tiles at zoom {} from zoom {} in {}", Format.defaultInstance().integer(result.size()),
      level, parents.zoom(), timer);
    return result;
  }

  @Override
  public void close() {
    cache.clear();
  }
}
