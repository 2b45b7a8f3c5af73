package com.onthegomap.rastertiler.image;

import static com.onthegomap.rastertiler.TestUtils.assertSolid;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.rastertiler.archive.TileFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageIoCodecTest {

  private final ImageCodec codec = ImageIoCodec.getInstance();

  @TempDir
  Path tempDir;

  @Test
  void testPngRoundTripKeepsPixelsAndAlpha() {
    RasterImage image = RasterImage.filled(3, 2, 0x11223344);
    image.setPixel(2, 1, 0xfedcba98);
    byte[] png = codec.encodePng(image);
    assertEquals(TileFormat.PNG, TileFormat.sniff(png));
    RasterImage decoded = codec.decode(png);
    assertEquals(image, decoded);
  }

  @Test
  void testJpegRoundTripIsClose() {
    RasterImage image = RasterImage.filled(16, 16, 0x4080c0ff);
    byte[] jpeg = codec.encodeJpeg(image);
    assertEquals(TileFormat.JPEG, TileFormat.sniff(jpeg));
    RasterImage decoded = codec.decode(jpeg);
    assertEquals(16, decoded.width());
    assertEquals(16, decoded.height());
    int pixel = decoded.getPixel(8, 8);
    assertEquals(0x40, pixel >>> 24, 3);
    assertEquals(0x80, (pixel >>> 16) & 0xff, 3);
    assertEquals(0xc0, (pixel >>> 8) & 0xff, 3);
    assertEquals(0xff, pixel & 0xff);
  }

  @Test
  void testEncodeByFormat() {
    RasterImage image = RasterImage.filled(2, 2, 0xffffffff);
    assertEquals(TileFormat.PNG, TileFormat.sniff(codec.encode(image, TileFormat.PNG)));
    assertEquals(TileFormat.JPEG, TileFormat.sniff(codec.encode(image, TileFormat.JPEG)));
    var error = assertThrows(ImageCodecException.class, () -> codec.encode(image, TileFormat.WEBP));
    assertEquals(ImageCodecException.Kind.ENCODE, error.kind());
  }

  @Test
  void testDecodeGarbage() {
    var error = assertThrows(ImageCodecException.class, () -> codec.decode(new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9}));
    assertEquals(ImageCodecException.Kind.DECODE, error.kind());
  }

  @Test
  void testDecodeTruncatedPng() {
    byte[] png = codec.encodePng(RasterImage.filled(8, 8, 0x123456ff));
    byte[] truncated = Arrays.copyOf(png, 20);
    var error = assertThrows(ImageCodecException.class, () -> codec.decode(truncated));
    assertEquals(ImageCodecException.Kind.DECODE, error.kind());
  }

  @Test
  void testSaveChoosesFormatFromExtension() throws Exception {
    RasterImage image = RasterImage.filled(4, 4, 0x00ff00ff);
    Path png = tempDir.resolve("a/b/tile.png");
    Path jpg = tempDir.resolve("tile.JPEG");
    codec.save(png, image);
    codec.save(jpg, image);
    assertEquals(TileFormat.PNG, TileFormat.sniff(Files.readAllBytes(png)));
    assertEquals(TileFormat.JPEG, TileFormat.sniff(Files.readAllBytes(jpg)));
    assertSolid(0x00ff00ff, codec.decode(Files.readAllBytes(png)));
  }

  @Test
  void testSaveReplacesUnknownExtensionWithPng() throws IOException {
    RasterImage image = RasterImage.filled(4, 4, 0x0000ffff);
    assertEquals(tempDir.resolve("out.png"), codec.save(tempDir.resolve("out.bmp"), image));
    assertFalse(Files.exists(tempDir.resolve("out.bmp")));
    assertEquals(tempDir.resolve("dir/out.png"), codec.save(tempDir.resolve("dir/out"), image));
    assertFalse(Files.exists(tempDir.resolve("dir/out")));
    for (Path written : List.of(tempDir.resolve("out.png"), tempDir.resolve("dir/out.png"))) {
      assertEquals(TileFormat.PNG, TileFormat.sniff(Files.readAllBytes(written)));
      assertSolid(0x0000ffff, codec.decode(Files.readAllBytes(written)));
    }
  }
}
