package com.onthegomap.rastertiler.archive;

/**
 * Error encountered while opening or parsing a tile archive.
 */
public class FileFormatException extends RuntimeException {
  public FileFormatException(String message) {
    super(message);
  }

  public FileFormatException(String message, Throwable throwable) {
    super(message, throwable);
  }
}
