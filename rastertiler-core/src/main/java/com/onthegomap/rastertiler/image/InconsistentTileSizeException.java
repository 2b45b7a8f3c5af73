package com.onthegomap.rastertiler.image;

/** Thrown when images that must share dimensions to be combined do not. */
public class InconsistentTileSizeException extends IllegalArgumentException {

  public InconsistentTileSizeException(String message) {
    super(message);
  }
}
