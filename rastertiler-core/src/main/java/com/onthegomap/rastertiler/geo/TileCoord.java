package com.onthegomap.rastertiler.geo;

import java.util.Comparator;
import javax.annotation.concurrent.Immutable;
import org.locationtech.jts.geom.Envelope;

/**
 * The coordinate of a <a href="https://wiki.openstreetmap.org/wiki/Slippy_map_tilenames">slippy map tile</a>.
 * <p>
 * Rows are always in XYZ numbering (0 is the northern-most row). MBTiles archives store rows in TMS numbering (0 is
 * the southern-most row); use {@link #ofTMS(int, int, int)} and {@link #tmsY()} to cross that boundary.
 *
 * @param x column of the tile where 0 is the western-most tile just to the east the international date line and
 *          2^z-1 is the eastern-most tile
 * @param y XYZ row of the tile where 0 is the northern-most tile and 2^z-1 is the southern-most tile
 * @param z zoom level
 */
@Immutable
public record TileCoord(int x, int y, int z) implements Comparable<TileCoord> {

  /** Highest zoom level where {@code 2^z} still fits in a signed 64-bit row computation. */
  public static final int MAX_ZOOM = 62;

  private static final Comparator<TileCoord> ORDER = Comparator
    .comparingInt(TileCoord::z)
    .thenComparingInt(TileCoord::x)
    .thenComparingInt(TileCoord::y);

  public static TileCoord ofXYZ(int x, int y, int z) {
    return new TileCoord(x, y, z);
  }

  /** Returns the tile at column {@code x} and TMS row {@code tmsRow}. */
  public static TileCoord ofTMS(int x, int tmsRow, int z) {
    return new TileCoord(x, tmsToXyz(tmsRow, z), z);
  }

  /**
   * Converts a TMS row to an XYZ row at {@code zoom}.
   *
   * @throws CoordinateOverflowException if {@code zoom} is outside {@code [0, 62]} or the result does not fit in an
   *                                     {@code int}
   */
  public static int tmsToXyz(long row, int zoom) {
    return flipRow(row, zoom);
  }

  /**
   * Converts an XYZ row to a TMS row at {@code zoom}.
   *
   * @throws CoordinateOverflowException if {@code zoom} is outside {@code [0, 62]} or the result does not fit in an
   *                                     {@code int}
   */
  public static int xyzToTms(long row, int zoom) {
    return flipRow(row, zoom);
  }

  private static int flipRow(long row, int zoom) {
    if (zoom < 0 || zoom > MAX_ZOOM) {
      throw new CoordinateOverflowException("zoom level " + zoom + " is outside [0, " + MAX_ZOOM + "]");
    }
    long flipped = (1L << zoom) - 1 - row;
    if (flipped < 0 || flipped > Integer.MAX_VALUE) {
      throw new CoordinateOverflowException("row " + row + " does not map to a valid row at zoom " + zoom);
    }
    return (int) flipped;
  }

  /** Returns the latitude/longitude bounds of the tile at {@code x} and XYZ row {@code y}. */
  public static Envelope tileBounds(int z, int x, int y) {
    return ofXYZ(x, y, z).bounds();
  }

  /** Returns the row of this tile in TMS numbering. */
  public int tmsY() {
    return xyzToTms(y, z);
  }

  /** Returns {@code true} if column and row are both within {@code [0, 2^z)}. */
  public boolean isValid() {
    if (z < 0 || z > MAX_ZOOM) {
      return false;
    }
    long dim = 1L << z;
    return x >= 0 && y >= 0 && x < dim && y < dim;
  }

  /** Returns the tile one zoom level up that contains this tile. */
  public TileCoord parent() {
    return ofXYZ(x / 2, y / 2, z - 1);
  }

  /** Returns the 4 tiles one zoom level down in NW, NE, SW, SE order. */
  public TileCoord[] children() {
    return new TileCoord[]{
      ofXYZ(x * 2, y * 2, z + 1),
      ofXYZ(x * 2 + 1, y * 2, z + 1),
      ofXYZ(x * 2, y * 2 + 1, z + 1),
      ofXYZ(x * 2 + 1, y * 2 + 1, z + 1)
    };
  }

  /**
   * Returns the latitude/longitude bounds of this tile where {@code minX/maxX} are the west/east longitudes and
   * {@code minY/maxY} are the south/north latitudes.
   */
  public Envelope bounds() {
    double worldWidthAtZoom = Math.pow(2, z);
    return new Envelope(
      GeoUtils.getWorldLon(x / worldWidthAtZoom),
      GeoUtils.getWorldLon((x + 1) / worldWidthAtZoom),
      GeoUtils.getWorldLat((y + 1) / worldWidthAtZoom),
      GeoUtils.getWorldLat(y / worldWidthAtZoom)
    );
  }

  /** Returns {@code /z/x/y} with the row in XYZ numbering. */
  public String toPathString() {
    return "/" + z + "/" + x + "/" + y;
  }

  @Override
  public String toString() {
    return "{x=" + x + " y=" + y + " z=" + z + '}';
  }

  @Override
  public int compareTo(TileCoord o) {
    return ORDER.compare(this, o);
  }
}
