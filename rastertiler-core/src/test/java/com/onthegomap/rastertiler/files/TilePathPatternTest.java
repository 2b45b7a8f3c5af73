package com.onthegomap.rastertiler.files;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.rastertiler.geo.TileCoord;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TilePathPatternTest {

  @TempDir
  Path tempDir;

  @ParameterizedTest
  @CsvSource(textBlock = """
    {z}/{x}/{y}.{ext}, 5/3/10.png
    {z}/{y}/{x}.{ext}, 5/10/3.png
    {z}-{x}-{y}.{ext}, 5-3-10.png
    tiles/{z}/{x}/{y}, tiles/5/3/10
    {ZZ}/{XXX}/{YYYY}.{ext}, 05/003/0010.png
    {Z}/{XX}/{Y}.{ext}, 5/03/10.png
    """)
  void testFormat(String pattern, String expected) {
    assertEquals(expected, TilePathPattern.parse(pattern).format(TileCoord.ofXYZ(3, 10, 5), "png"));
  }

  @Test
  void testPaddingDoesNotTruncate() {
    assertEquals("1234", TilePathPattern.parse("{XX}").format(TileCoord.ofXYZ(1234, 0, 11), "png"));
    assertEquals("180", TilePathPattern.parse("{OO}").format(TileCoord.ofXYZ(0, 0, 0), "png"));
  }

  @Test
  void testWidePaddedValuesStayDistinctAndDecode() {
    var pattern = TilePathPattern.parse("{ZZ}/{XX}/{YY}.{ext}");
    var first = TileCoord.ofXYZ(123, 5, 10);
    var second = TileCoord.ofXYZ(124, 5, 10);
    assertEquals("10/123/05.png", pattern.format(first, "png"));
    assertEquals("10/124/05.png", pattern.format(second, "png"));
    var decoder = pattern.decoder(tempDir);
    assertEquals(Optional.of(new TilePathPattern.Decoded(second, "png")),
      decoder.apply(tempDir.resolve(pattern.format(second, "png"))));
  }

  @Test
  void testLatitudeLongitude() {
    var pattern = TilePathPattern.parse("{a}_{o}/{AA}_{OOO}.{ext}");
    assertEquals("85.051129_-180.000000/85_180.png", pattern.format(TileCoord.ofXYZ(0, 0, 0), "png"));
    assertEquals("0.000000_0.000000/00_000.jpg", pattern.format(TileCoord.ofXYZ(1, 1, 1), "jpg"));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "{z}/{x}/{y",
    "{z}/{}/{y}",
    "{z}/{x}/{q}",
    "{z}/{xx}/{y}",
    "/{z}/{x}/{y}",
    "",
    "  ",
  })
  void testInvalidPatterns(String pattern) {
    assertThrows(InvalidPatternException.class, () -> TilePathPattern.parse(pattern));
  }

  @Test
  void testResolveAppendsExtensionWhenMissing() {
    TileCoord coord = TileCoord.ofXYZ(3, 10, 5);
    assertEquals(tempDir.resolve("5/3/10.png"), TilePathPattern.parse("{z}/{x}/{y}").resolve(tempDir, coord, "png"));
    assertEquals(tempDir.resolve("5/3/10.png"),
      TilePathPattern.parse("{z}/{x}/{y}.{ext}").resolve(tempDir, coord, "png"));
    assertEquals(tempDir.resolve("5/3/10.jpg"),
      TilePathPattern.parse("{z}/{x}/{y}.jpg").resolve(tempDir, coord, "png"));
    assertEquals(tempDir.resolve("5/3/10"), TilePathPattern.parse("{z}/{x}/{y}").resolve(tempDir, coord, ""));
  }

  @Test
  void testHasExtensionPlaceholder() {
    assertTrue(TilePathPattern.defaultPattern().hasExtensionPlaceholder());
    assertFalse(TilePathPattern.parse("{z}/{x}/{y}.png").hasExtensionPlaceholder());
  }

  @Test
  void testSearchDepth() {
    assertEquals(3, TilePathPattern.defaultPattern().searchDepth());
    assertEquals(1, TilePathPattern.parse("{z}-{x}-{y}.{ext}").searchDepth());
  }

  @ParameterizedTest
  @CsvSource(textBlock = """
    {z}/{x}/{y}.{ext}, 5/3/10.png, 5, 3, 10, png
    {z}/{x}/{y}.{ext}, 5/3/10.JPEG, 5, 3, 10, jpg
    {z}/{x}/{y}, 5/3/10.webp, 5, 3, 10, webp
    {z}/{x}/{y}, 5/3/10, 5, 3, 10, ''
    {ZZ}/{XXX}/{YYYY}.{ext}, 05/003/0010.png, 5, 3, 10, png
    {z}-{y}-{x}.{ext}, 5-10-3.png, 5, 3, 10, png
    """)
  void testDecode(String pattern, String path, int z, int x, int y, String extension) {
    var decoder = TilePathPattern.parse(pattern).decoder(tempDir);
    assertEquals(Optional.of(new TilePathPattern.Decoded(TileCoord.ofXYZ(x, y, z), extension)),
      decoder.apply(tempDir.resolve(path)));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "5/3/x.png",
    "5/3/10/11.png",
    "metadata.json",
    "5/3",
  })
  void testDecodeNonMatching(String path) {
    var decoder = TilePathPattern.defaultPattern().decoder(tempDir);
    assertEquals(Optional.empty(), decoder.apply(tempDir.resolve(path)));
  }

  @Test
  void testDecodeOutsideBaseDirectory() {
    var decoder = TilePathPattern.defaultPattern().decoder(tempDir.resolve("a"));
    assertEquals(Optional.empty(), decoder.apply(tempDir.resolve("b/5/3/10.png")));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "{z}/{x}.{ext}",
    "{z}/{x}/{y}/{y}.{ext}",
    "{z}/{a}/{o}/{x}/{y}.{ext}",
  })
  void testCannotDecode(String pattern) {
    var parsed = TilePathPattern.parse(pattern);
    assertThrows(InvalidPatternException.class, () -> parsed.decoder(tempDir));
  }
}
