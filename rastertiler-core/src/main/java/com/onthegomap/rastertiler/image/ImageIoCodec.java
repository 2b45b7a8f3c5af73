package com.onthegomap.rastertiler.image;

import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;
import ar.com.hjg.pngj.PngjException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.MemoryCacheImageOutputStream;

/**
 * {@link ImageCodec} that decodes with {@link ImageIO}, writes PNGs with PNGJ and JPEGs with the built-in ImageIO
 * JPEG writer.
 */
public class ImageIoCodec implements ImageCodec {

  private static final ImageIoCodec INSTANCE = new ImageIoCodec();

  static {
    // tiles are small, keep ImageIO from creating temp files for every stream
    ImageIO.setUseCache(false);
  }

  public static ImageIoCodec getInstance() {
    return INSTANCE;
  }

  @Override
  public RasterImage decode(byte[] bytes) {
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(bytes));
    } catch (IOException | RuntimeException e) {
      throw ImageCodecException.decode("Unable to decode " + bytes.length + " byte image: " + e.getMessage(), e);
    }
    if (image == null) {
      throw ImageCodecException.decode("Unsupported image format for " + bytes.length + " byte payload");
    }
    int width = image.getWidth();
    int height = image.getHeight();
    int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
    byte[] pixels = new byte[argb.length * RasterImage.CHANNELS];
    for (int i = 0, j = 0; i < argb.length; i++) {
      int value = argb[i];
      pixels[j++] = (byte) (value >>> 16);
      pixels[j++] = (byte) (value >>> 8);
      pixels[j++] = (byte) value;
      pixels[j++] = (byte) (value >>> 24);
    }
    return new RasterImage(width, height, pixels);
  }

  @Override
  public byte[] encodePng(RasterImage image) {
    ImageInfo info = new ImageInfo(image.width(), image.height(), 8, true);
    var baos = new ByteArrayOutputStream();
    try {
      PngWriter writer = new PngWriter(baos, info);
      ImageLineInt line = new ImageLineInt(info);
      int[] scanline = line.getScanline();
      byte[] pixels = image.pixels();
      int rowLength = image.width() * RasterImage.CHANNELS;
      for (int row = 0; row < image.height(); row++) {
        int offset = row * rowLength;
        for (int i = 0; i < rowLength; i++) {
          scanline[i] = pixels[offset + i] & 0xff;
        }
        writer.writeRow(line);
      }
      writer.end();
    } catch (PngjException e) {
      throw ImageCodecException.encode("Unable to encode " + image + " as png", e);
    }
    return baos.toByteArray();
  }

  @Override
  public byte[] encodeJpeg(RasterImage image, float quality) {
    BufferedImage rgb = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_INT_RGB);
    byte[] pixels = image.pixels();
    int[] row = new int[image.width()];
    for (int y = 0; y < image.height(); y++) {
      for (int x = 0; x < image.width(); x++) {
        int i = (y * image.width() + x) * RasterImage.CHANNELS;
        row[x] = ((pixels[i] & 0xff) << 16) | ((pixels[i + 1] & 0xff) << 8) | (pixels[i + 2] & 0xff);
      }
      rgb.setRGB(0, y, image.width(), 1, row, 0, image.width());
    }
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw ImageCodecException.encode("No jpeg writer available");
    }
    ImageWriter writer = writers.next();
    ImageWriteParam writeParam = writer.getDefaultWriteParam();
    writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    writeParam.setCompressionQuality(quality);
    var baos = new ByteArrayOutputStream();
    try (var output = new MemoryCacheImageOutputStream(baos)) {
      writer.setOutput(output);
      writer.write(null, new IIOImage(rgb, null, null), writeParam);
    } catch (IOException e) {
      throw ImageCodecException.encode("Unable to encode " + image + " as jpeg", e);
    } finally {
      writer.dispose();
    }
    return baos.toByteArray();
  }
}
