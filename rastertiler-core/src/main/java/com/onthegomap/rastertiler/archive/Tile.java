package com.onthegomap.rastertiler.archive;

import com.onthegomap.rastertiler.geo.TileCoord;
import java.util.Arrays;
import java.util.Objects;

/**
 * A tile stored in an archive with coordinate {@code coord} (XYZ row numbering), compressed {@code bytes} and the
 * file {@code extension} those bytes should be written with.
 */
public record Tile(TileCoord coord, byte[] bytes, String extension) implements Comparable<Tile> {

  public Tile {
    Objects.requireNonNull(coord, "coord");
    Objects.requireNonNull(bytes, "bytes");
    Objects.requireNonNull(extension, "extension");
  }

  /** Returns a tile whose extension is sniffed from {@code bytes}. */
  public static Tile of(TileCoord coord, byte[] bytes) {
    return new Tile(coord, bytes, TileFormat.sniff(bytes).extension());
  }

  /** Row of this tile in TMS numbering, as stored in MBTiles. */
  public int tmsY() {
    return coord.tmsY();
  }

  /** Image format of this tile according to its extension. */
  public TileFormat format() {
    return TileFormat.fromExtension(extension);
  }

  @Override
  public boolean equals(Object o) {
    return (this == o) ||
      (o instanceof Tile other && Objects.equals(coord, other.coord) && Arrays.equals(bytes, other.bytes) &&
        extension.equals(other.extension));
  }

  @Override
  public int hashCode() {
    int result = coord.hashCode();
    result = 31 * result + Arrays.hashCode(bytes);
    result = 31 * result + extension.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "Tile{coord=" + coord + ", data=byte[" + bytes.length + "], extension=" + extension + "}";
  }

  @Override
  public int compareTo(Tile o) {
    return coord.compareTo(o.coord);
  }
}
