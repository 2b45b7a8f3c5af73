package com.onthegomap.rastertiler.image;

import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.util.FileUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts between compressed tile payloads and {@link RasterImage} pixels.
 */
public interface ImageCodec {

  float DEFAULT_JPEG_QUALITY = 0.9f;

  /**
   * Decodes a PNG or JPEG payload into RGBA pixels, whatever the channel count of the source.
   *
   * @throws ImageCodecException of kind {@code DECODE} if the bytes are malformed or of an unsupported format
   */
  RasterImage decode(byte[] bytes);

  /**
   * Encodes {@code image} as a PNG with an alpha channel.
   *
   * @throws ImageCodecException of kind {@code ENCODE} on failure
   */
  byte[] encodePng(RasterImage image);

  /**
   * Encodes {@code image} as a JPEG at {@code quality} between 0 and 1, dropping alpha.
   *
   * @throws ImageCodecException of kind {@code ENCODE} on failure
   */
  byte[] encodeJpeg(RasterImage image, float quality);

  default byte[] encodeJpeg(RasterImage image) {
    return encodeJpeg(image, DEFAULT_JPEG_QUALITY);
  }

  /**
   * Encodes {@code image} in {@code format}.
   *
   * @throws ImageCodecException if {@code format} cannot be written
   */
  default byte[] encode(RasterImage image, TileFormat format) {
    return switch (format) {
      case PNG -> encodePng(image);
      case JPEG -> encodeJpeg(image);
      default -> throw ImageCodecException.encode("Cannot encode images as " + format);
    };
  }

  /**
   * Writes {@code image} as a JPEG if {@code path} ends with {@code .jpg} or {@code .jpeg}, as a PNG if it ends with
   * {@code .png}, and otherwise as a PNG with the extension of {@code path} replaced by {@code .png}. Parent
   * directories are created when missing.
   *
   * @return the file that was written
   */
  default Path save(Path path, RasterImage image) {
    TileFormat format = TileFormat.fromExtension(FileUtils.extension(path));
    Path target = path;
    if (!format.isEncodable()) {
      format = TileFormat.PNG;
      target = FileUtils.withExtension(path, TileFormat.PNG.extension());
    }
    byte[] bytes = encode(image, format);
    FileUtils.createParentDirectories(target);
    try {
      Files.write(target, bytes);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + target, e);
    }
    return target;
  }
}
