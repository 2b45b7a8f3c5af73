package com.onthegomap.rastertiler.pyramid;

import java.util.Comparator;

/**
 * Column and XYZ row of a tile within a single zoom level, packed into a {@code long} for primitive-keyed maps.
 */
public record TileKey(int x, int y) implements Comparable<TileKey> {

  private static final Comparator<TileKey> ORDER = Comparator.comparingInt(TileKey::x).thenComparingInt(TileKey::y);

  public static TileKey decode(long encoded) {
    return new TileKey((int) (encoded >>> 32), (int) encoded);
  }

  public long encoded() {
    return ((long) x << 32) | (y & 0xffffffffL);
  }

  /** Returns the key of the tile one zoom level up that contains this one. */
  public TileKey parent() {
    return new TileKey(x / 2, y / 2);
  }

  /** Returns the position of this tile inside its parent: 0=NW, 1=NE, 2=SW, 3=SE. */
  public int indexInParent() {
    return (y % 2) * 2 + (x % 2);
  }

  @Override
  public int compareTo(TileKey o) {
    return ORDER.compare(this, o);
  }
}
