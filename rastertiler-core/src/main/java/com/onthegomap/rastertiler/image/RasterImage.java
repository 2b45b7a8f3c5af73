package com.onthegomap.rastertiler.image;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An uncompressed image with 4 bytes per pixel in {@code R, G, B, A} order, rows top to bottom.
 * <p>
 * The pixel buffer always holds exactly {@code width * height * 4} bytes. Operations that produce a new size return a
 * new instance, {@link #toGrayscale()} mutates this one.
 */
@NotThreadSafe
public final class RasterImage {

  public static final int CHANNELS = 4;

  private final int width;
  private final int height;
  private final byte[] pixels;

  /**
   * Wraps an existing RGBA buffer without copying it.
   *
   * @throws IllegalArgumentException if the dimensions are not positive or the buffer length does not match them
   */
  public RasterImage(int width, int height, byte[] pixels) {
    Preconditions.checkArgument(width > 0 && height > 0, "image dimensions must be positive, got %sx%s", width,
      height);
    long expected = (long) width * height * CHANNELS;
    if (pixels.length != expected) {
      throw new IllegalArgumentException(
        "expected " + expected + " bytes for a " + width + "x" + height + " RGBA image but got " + pixels.length);
    }
    this.width = width;
    this.height = height;
    this.pixels = pixels;
  }

  /** Returns a fully transparent image. */
  public static RasterImage blank(int width, int height) {
    return new RasterImage(width, height, new byte[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS)]);
  }

  /** Returns an image where every pixel is {@code rgba} packed as {@code 0xRRGGBBAA}. */
  public static RasterImage filled(int width, int height, int rgba) {
    RasterImage result = blank(width, height);
    for (int i = 0; i < width * height; i++) {
      result.setPixel(i, rgba);
    }
    return result;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /** Returns the backing RGBA buffer, changes write through to this image. */
  public byte[] pixels() {
    return pixels;
  }

  /** Returns the pixel at {@code (x, y)} packed as {@code 0xRRGGBBAA}. */
  public int getPixel(int x, int y) {
    Preconditions.checkElementIndex(x, width, "x");
    Preconditions.checkElementIndex(y, height, "y");
    int i = (y * width + x) * CHANNELS;
    return ((pixels[i] & 0xff) << 24) | ((pixels[i + 1] & 0xff) << 16) | ((pixels[i + 2] & 0xff) << 8) |
      (pixels[i + 3] & 0xff);
  }

  /** Sets the pixel at {@code (x, y)} from {@code rgba} packed as {@code 0xRRGGBBAA}. */
  public void setPixel(int x, int y, int rgba) {
    Preconditions.checkElementIndex(x, width, "x");
    Preconditions.checkElementIndex(y, height, "y");
    setPixel(y * width + x, rgba);
  }

  private void setPixel(int index, int rgba) {
    int i = index * CHANNELS;
    pixels[i] = (byte) (rgba >>> 24);
    pixels[i + 1] = (byte) (rgba >>> 16);
    pixels[i + 2] = (byte) (rgba >>> 8);
    pixels[i + 3] = (byte) rgba;
  }

  public RasterImage copy() {
    return new RasterImage(width, height, pixels.clone());
  }

  /**
   * Replaces red, green and blue of every pixel with its luma {@code 0.299R + 0.587G + 0.114B} rounded down, leaving
   * alpha as-is.
   * <p>
   * Mutates this image in place and returns it. Applying it twice gives the same result as applying it once.
   */
  public RasterImage toGrayscale() {
    for (int i = 0; i < pixels.length; i += CHANNELS) {
      int r = pixels[i] & 0xff;
      int g = pixels[i + 1] & 0xff;
      int b = pixels[i + 2] & 0xff;
      byte luma = (byte) ((299 * r + 587 * g + 114 * b) / 1000);
      pixels[i] = luma;
      pixels[i + 1] = luma;
      pixels[i + 2] = luma;
    }
    return this;
  }

  /**
   * Combines four equally-sized images into one with twice the width and height.
   * <p>
   * Child {@code i} goes to offset {@code (i % 2 * w, i / 2 * h)}: 0 is top-left, 1 top-right, 2 bottom-left and 3
   * bottom-right.
   *
   * @throws InconsistentTileSizeException if the children do not all have the same dimensions
   */
  public static RasterImage mosaic2x2(List<RasterImage> children) {
    Preconditions.checkArgument(children.size() == 4, "expected 4 children but got %s", children.size());
    RasterImage first = children.get(0);
    int w = first.width;
    int h = first.height;
    for (RasterImage child : children) {
      if (child.width != w || child.height != h) {
        throw new InconsistentTileSizeException(
          "cannot combine a " + child.width + "x" + child.height + " tile with a " + w + "x" + h + " tile");
      }
    }
    RasterImage canvas = blank(w * 2, h * 2);
    for (int i = 0; i < 4; i++) {
      canvas.paste(children.get(i), (i % 2) * w, (i / 2) * h);
    }
    return canvas;
  }

  private void paste(RasterImage source, int offsetX, int offsetY) {
    int rowBytes = source.width * CHANNELS;
    for (int row = 0; row < source.height; row++) {
      System.arraycopy(source.pixels, row * rowBytes, pixels, ((offsetY + row) * width + offsetX) * CHANNELS,
        rowBytes);
    }
  }

  /**
   * Returns a copy of the {@code w x h} region starting at {@code (x, y)}.
   *
   * @throws IllegalArgumentException if the region is not inside this image
   */
  public RasterImage crop(int x, int y, int w, int h) {
    Preconditions.checkArgument(x >= 0 && y >= 0 && w > 0 && h > 0 && x + w <= width && y + h <= height,
      "region %sx%s at (%s, %s) is outside of %sx%s image", w, h, x, y, width, height);
    byte[] result = new byte[w * h * CHANNELS];
    int rowBytes = w * CHANNELS;
    for (int row = 0; row < h; row++) {
      System.arraycopy(pixels, ((y + row) * width + x) * CHANNELS, result, row * rowBytes, rowBytes);
    }
    return new RasterImage(w, h, result);
  }

  /** Returns one quarter of this image in NW, NE, SW, SE order by {@code index}. */
  public RasterImage quadrant(int index) {
    Preconditions.checkElementIndex(index, 4, "quadrant");
    Preconditions.checkArgument(width % 2 == 0 && height % 2 == 0, "cannot split %sx%s image into quadrants", width,
      height);
    int w = width / 2;
    int h = height / 2;
    return crop((index % 2) * w, (index / 2) * h, w, h);
  }

  /**
   * Returns a linear-filtered resample of this image at {@code newWidth x newHeight}.
   * <p>
   * Shrinking by a whole-number factor averages each block of source pixels, any other size uses bilinear
   * interpolation between pixel centers.
   */
  public RasterImage resize(int newWidth, int newHeight) {
    Preconditions.checkArgument(newWidth > 0 && newHeight > 0, "invalid target size %sx%s", newWidth, newHeight);
    if (newWidth == width && newHeight == height) {
      return copy();
    }
    if (width % newWidth == 0 && height % newHeight == 0) {
      return boxDownsample(width / newWidth, height / newHeight);
    }
    return bilinear(newWidth, newHeight);
  }

  private RasterImage boxDownsample(int factorX, int factorY) {
    int newWidth = width / factorX;
    int newHeight = height / factorY;
    int area = factorX * factorY;
    byte[] result = new byte[newWidth * newHeight * CHANNELS];
    int[] sums = new int[CHANNELS];
    for (int y = 0; y < newHeight; y++) {
      for (int x = 0; x < newWidth; x++) {
        Arrays.fill(sums, 0);
        for (int dy = 0; dy < factorY; dy++) {
          int rowStart = ((y * factorY + dy) * width + x * factorX) * CHANNELS;
          for (int i = 0; i < factorX * CHANNELS; i++) {
            sums[i % CHANNELS] += pixels[rowStart + i] & 0xff;
          }
        }
        int out = (y * newWidth + x) * CHANNELS;
        for (int c = 0; c < CHANNELS; c++) {
          result[out + c] = (byte) ((sums[c] + area / 2) / area);
        }
      }
    }
    return new RasterImage(newWidth, newHeight, result);
  }

  private RasterImage bilinear(int newWidth, int newHeight) {
    byte[] result = new byte[newWidth * newHeight * CHANNELS];
    double scaleX = (double) width / newWidth;
    double scaleY = (double) height / newHeight;
    for (int y = 0; y < newHeight; y++) {
      double srcY = clamp((y + 0.5) * scaleY - 0.5, height - 1);
      int y0 = (int) srcY;
      int y1 = Math.min(y0 + 1, height - 1);
      double fy = srcY - y0;
      for (int x = 0; x < newWidth; x++) {
        double srcX = clamp((x + 0.5) * scaleX - 0.5, width - 1);
        int x0 = (int) srcX;
        int x1 = Math.min(x0 + 1, width - 1);
        double fx = srcX - x0;
        int out = (y * newWidth + x) * CHANNELS;
        for (int c = 0; c < CHANNELS; c++) {
          double top = channel(x0, y0, c) * (1 - fx) + channel(x1, y0, c) * fx;
          double bottom = channel(x0, y1, c) * (1 - fx) + channel(x1, y1, c) * fx;
          long value = Math.round(top * (1 - fy) + bottom * fy);
          result[out + c] = (byte) Math.max(0, Math.min(255, value));
        }
      }
    }
    return new RasterImage(newWidth, newHeight, result);
  }

  private int channel(int x, int y, int c) {
    return pixels[(y * width + x) * CHANNELS + c] & 0xff;
  }

  private static double clamp(double value, int max) {
    return Math.max(0, Math.min(max, value));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RasterImage other && width == other.width && height == other.height &&
      Arrays.equals(pixels, other.pixels));
  }

  @Override
  public int hashCode() {
    int result = 31 * width + height;
    result = 31 * result + Arrays.hashCode(pixels);
    return result;
  }

  @Override
  public String toString() {
    return "RasterImage{" + width + "x" + height + "}";
  }
}
