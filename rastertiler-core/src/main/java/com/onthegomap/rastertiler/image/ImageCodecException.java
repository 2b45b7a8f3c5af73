package com.onthegomap.rastertiler.image;

/** Error decoding compressed tile bytes into pixels, or encoding pixels back into a compressed format. */
public class ImageCodecException extends RuntimeException {

  public enum Kind {
    DECODE,
    ENCODE
  }

  private final Kind kind;

  private ImageCodecException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static ImageCodecException decode(String message) {
    return new ImageCodecException(Kind.DECODE, message, null);
  }

  public static ImageCodecException decode(String message, Throwable cause) {
    return new ImageCodecException(Kind.DECODE, message, cause);
  }

  public static ImageCodecException encode(String message) {
    return new ImageCodecException(Kind.ENCODE, message, null);
  }

  public static ImageCodecException encode(String message, Throwable cause) {
    return new ImageCodecException(Kind.ENCODE, message, cause);
  }

  public Kind kind() {
    return kind;
  }
}
