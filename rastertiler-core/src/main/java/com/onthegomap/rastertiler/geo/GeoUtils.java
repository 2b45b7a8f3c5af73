package com.onthegomap.rastertiler.geo;

/**
 * Web mercator projection helpers where the top-left corner of the planet is (0,0) and the bottom-right is (1,1).
 */
public class GeoUtils {

  private static final double DEGREES_PER_RADIAN = 180 / Math.PI;

  private GeoUtils() {}

  /**
   * Returns the longitude for a web mercator coordinate {@code x} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldLon(double x) {
    return x * 360 - 180;
  }

  /**
   * Returns the latitude for a web mercator {@code y} coordinate where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldLat(double y) {
    double n = Math.PI - 2 * Math.PI * y;
    return DEGREES_PER_RADIAN * Math.atan(0.5 * (Math.exp(n) - Math.exp(-n)));
  }
}
