package com.onthegomap.rastertiler.archive;

import java.util.Locale;
import java.util.Optional;

/** Compressed image formats a raster tile payload can be stored in. */
public enum TileFormat {

  PNG("png", "image/png"),
  JPEG("jpg", "image/jpeg"),
  WEBP("webp", "image/webp"),
  UNKNOWN("bin", "application/octet-stream");

  private static final int MIN_SNIFF_LENGTH = 8;
  private static final int WEBP_HEADER_LENGTH = 12;

  private final String extension;
  private final String contentType;

  TileFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  /**
   * Classifies {@code bytes} by their leading magic number.
   * <p>
   * Payloads shorter than 8 bytes or without a known signature are {@link #UNKNOWN}.
   */
  public static TileFormat sniff(byte[] bytes) {
    if (bytes == null || bytes.length < MIN_SNIFF_LENGTH) {
      return UNKNOWN;
    }
    if ((bytes[0] & 0xff) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
      return PNG;
    }
    if ((bytes[0] & 0xff) == 0xff && (bytes[1] & 0xff) == 0xd8 && (bytes[2] & 0xff) == 0xff) {
      return JPEG;
    }
    if (bytes.length >= WEBP_HEADER_LENGTH &&
      bytes[0] == 'R' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == 'F' &&
      bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
      return WEBP;
    }
    return UNKNOWN;
  }

  /**
   * Returns a file extension token as it should appear on disk: trimmed, without a leading dot, lower-case, with
   * {@code jpeg} shortened to {@code jpg}.
   */
  public static String normalizeExtension(String token) {
    String result = token.strip();
    if (result.startsWith(".")) {
      result = result.substring(1);
    }
    result = result.toLowerCase(Locale.ROOT);
    return "jpeg".equals(result) ? "jpg" : result;
  }

  /** Returns the format that files ending with {@code extension} hold, or {@link #UNKNOWN}. */
  public static TileFormat fromExtension(String extension) {
    return findByExtension(extension).orElse(UNKNOWN);
  }

  public static Optional<TileFormat> findByExtension(String extension) {
    if (extension == null) {
      return Optional.empty();
    }
    String normalized = normalizeExtension(extension);
    for (TileFormat format : values()) {
      if (format != UNKNOWN && format.extension.equals(normalized)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the format to encode a synthesized image with: {@code configured} if present, else {@code source} when
   * the codec can write it, else {@link #PNG}.
   */
  public static TileFormat chooseEncoding(Optional<TileFormat> configured, TileFormat source) {
    if (configured.isPresent()) {
      return configured.get();
    }
    return source.isEncodable() ? source : PNG;
  }

  /** File extension without the dot. */
  public String extension() {
    return extension;
  }

  /** Value to use in a {@code Content-Type} header. */
  public String contentType() {
    return contentType;
  }

  /** Returns {@code true} for formats the image codec can write. */
  public boolean isEncodable() {
    return this == PNG || this == JPEG;
  }
}
