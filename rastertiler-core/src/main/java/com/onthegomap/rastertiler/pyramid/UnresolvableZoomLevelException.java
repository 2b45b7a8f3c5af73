package com.onthegomap.rastertiler.pyramid;

/** Thrown when a zoom level is neither in the source nor derivable from an adjacent level. */
public class UnresolvableZoomLevelException extends IllegalStateException {

  private final int zoom;

  public UnresolvableZoomLevelException(int zoom, String message) {
    super(message);
    this.zoom = zoom;
  }

  public int zoom() {
    return zoom;
  }
}
