package com.onthegomap.rastertiler.geo;

/** Thrown when a zoom level or tile row falls outside the range that a tile coordinate can represent. */
public class CoordinateOverflowException extends ArithmeticException {

  public CoordinateOverflowException(String message) {
    super(message);
  }
}
