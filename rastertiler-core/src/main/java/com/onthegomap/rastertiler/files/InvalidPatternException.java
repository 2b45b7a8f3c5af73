package com.onthegomap.rastertiler.files;

/** A tile path pattern is malformed or uses a placeholder that is not supported where it is used. */
public class InvalidPatternException extends IllegalArgumentException {

  public InvalidPatternException(String message) {
    super(message);
  }
}
