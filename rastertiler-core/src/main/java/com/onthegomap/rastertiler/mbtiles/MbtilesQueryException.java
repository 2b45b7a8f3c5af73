package com.onthegomap.rastertiler.mbtiles;

/** A SQL statement against an mbtiles file failed. */
public class MbtilesQueryException extends IllegalStateException {

  public MbtilesQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
