package com.onthegomap.rastertiler.pyramid;

import com.carrotsearch.hppc.LongObjectHashMap;
import com.carrotsearch.hppc.cursors.LongCursor;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.RasterImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Decoded tile images of one zoom level keyed by {@link TileKey} (XYZ rows only).
 */
@NotThreadSafe
public class LevelTiles {

  private final int zoom;
  private final LongObjectHashMap<RasterImage> images = new LongObjectHashMap<>(10, 0.75);

  public LevelTiles(int zoom) {
    this.zoom = zoom;
  }

  public int zoom() {
    return zoom;
  }

  public void put(TileKey key, RasterImage image) {
    images.put(key.encoded(), image);
  }

  /** Returns the image at {@code key} or {@code null} if there is none. */
  public RasterImage get(TileKey key) {
    return images.get(key.encoded());
  }

  public boolean contains(TileKey key) {
    return images.containsKey(key.encoded());
  }

  public int size() {
    return images.size();
  }

  public boolean isEmpty() {
    return images.isEmpty();
  }

  /** Returns every key in ascending {@code (x, y)} order. */
  public List<TileKey> sortedKeys() {
    List<TileKey> result = new ArrayList<>(images.size());
    for (LongCursor cursor : images.keys()) {
      result.add(TileKey.decode(cursor.value));
    }
    Collections.sort(result);
    return result;
  }

  /** Invokes {@code consumer} for every tile in ascending {@code (x, y)} order. */
  public void forEachSorted(BiConsumer<TileCoord, RasterImage> consumer) {
    for (TileKey key : sortedKeys()) {
      consumer.accept(TileCoord.ofXYZ(key.x(), key.y(), zoom), get(key));
    }
  }

  @Override
  public String toString() {
    return "LevelTiles{zoom=" + zoom + ", tiles=" + images.size() + "}";
  }
}
