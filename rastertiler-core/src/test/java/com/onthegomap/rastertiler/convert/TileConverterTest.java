package com.onthegomap.rastertiler.convert;

import static com.onthegomap.rastertiler.TestUtils.assertSolid;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.rastertiler.TestUtils;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.files.ReadableFilesArchive;
import com.onthegomap.rastertiler.files.TilePathPattern;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.ImageIoCodec;
import com.onthegomap.rastertiler.image.RasterImage;
import com.onthegomap.rastertiler.mbtiles.Mbtiles;
import com.onthegomap.rastertiler.mbtiles.MbtilesTileSink;
import com.onthegomap.rastertiler.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TileConverterTest {

  private static final int RED = 0xff0000ff;
  private static final int GRAY = 0x4c4c4cff;
  private final ImageIoCodec codec = ImageIoCodec.getInstance();

  @TempDir
  Path tempDir;

  private Mbtiles source;

  @BeforeEach
  void setup() {
    source = TestUtils.newMbtiles();
    TestUtils.fillSquare(source, 1, 0, 1, RED);
    source.setMetadata(Map.of("name", "source", "minzoom", "1", "maxzoom", "1"), false);
  }

  @AfterEach
  void teardown() {
    source.close();
  }

  private ConvertResult convert(ConvertConfig config, Path output) {
    try (var sink = MbtilesTileSink.open(output, codec, config.outputFormat())) {
      return TileConverter.convert(source, config, sink, codec);
    }
  }

  private Path writeSourceFile(String name) {
    Path path = tempDir.resolve(name);
    try (var db = Mbtiles.newWriteToFileDatabase(path)) {
      db.createTablesWithIndexes();
      TestUtils.fillSquare(db, 1, 0, 1, RED);
      db.setMetadata(Map.of("name", "file source"), false);
    }
    return path;
  }

  @Test
  void testCopiesExistingLevelsByDefault() {
    Path output = tempDir.resolve("out.mbtiles");
    var result = convert(ConvertConfig.defaults(), output);
    assertEquals(List.of(1), result.requestedLevels());
    assertEquals(Set.of(1), result.copiedLevels());
    assertEquals(Set.of(), result.generatedLevels());
    assertEquals(4, result.tilesWritten());

    try (var db = Mbtiles.newReadOnlyDatabase(output)) {
      assertEquals(TestUtils.getTiles(source), TestUtils.getTiles(db));
      assertEquals(Map.of("name", "source", "minzoom", "1", "maxzoom", "1"), db.metadata());
    }
  }

  @Test
  void testGeneratesLevelsAboveAndBelow() {
    Path output = tempDir.resolve("out.mbtiles");
    var result = convert(ConvertConfig.defaults().withZoomLevels("-1", "all", "+1"), output);
    assertEquals(List.of(0, 1, 2), result.requestedLevels());
    assertEquals(Set.of(1), result.copiedLevels());
    assertEquals(Set.of(0, 2), result.generatedLevels());
    assertEquals(1 + 4 + 16, result.tilesWritten());

    try (var db = Mbtiles.newReadOnlyDatabase(output)) {
      assertEquals(Set.of(0, 1, 2), db.zoomLevels());
      assertEquals(16, db.getTilesAtZoom(2).stream().count());
      Tile world = db.getTile(0, 0, 0).orElseThrow();
      assertEquals(TileFormat.PNG, world.format());
      RasterImage image = codec.decode(world.bytes());
      assertEquals(TestUtils.TILE_SIZE, image.width());
      assertSolid(RED, image);
      assertSolid(RED, codec.decode(db.getTile(3, 3, 2).orElseThrow().bytes()));
      assertEquals(Optional.of("0"), db.metadataValue("minzoom"));
      assertEquals(Optional.of("2"), db.metadataValue("maxzoom"));
      assertEquals(Optional.empty(), db.metadataValue("format"));
    }
  }

  @Test
  void testOnlyGeneratedLevels() {
    Path output = tempDir.resolve("out.mbtiles");
    var result = convert(ConvertConfig.defaults().withZoomLevels("+1"), output);
    assertEquals(Set.of(), result.copiedLevels());
    assertEquals(16, result.tilesWritten());
    try (var db = Mbtiles.newReadOnlyDatabase(output)) {
      assertEquals(Set.of(2), db.zoomLevels());
    }
  }

  @Test
  void testGrayscaleReencodesEveryLevel() {
    Path output = tempDir.resolve("out.mbtiles");
    convert(ConvertConfig.defaults().withZoomLevels("all", "-1").withGrayscale(true), output);
    try (var db = Mbtiles.newReadOnlyDatabase(output)) {
      var tiles = TestUtils.getTiles(db);
      assertEquals(5, tiles.size());
      for (Tile tile : tiles.values()) {
        assertEquals(TileFormat.PNG, TileFormat.sniff(tile.bytes()));
        assertSolid(GRAY, codec.decode(tile.bytes()));
      }
      assertEquals(Optional.of("png"), db.metadataValue("format"));
    }
  }

  @Test
  void testOutputFormatReencodesCopiedTiles() {
    Path output = tempDir.resolve("out.mbtiles");
    convert(ConvertConfig.defaults().withOutputFormat(TileFormat.JPEG), output);
    try (var db = Mbtiles.newReadOnlyDatabase(output)) {
      for (Tile tile : TestUtils.getTiles(db).values()) {
        assertEquals(TileFormat.JPEG, TileFormat.sniff(tile.bytes()));
        assertEquals("jpg", tile.extension());
      }
      assertEquals(Optional.of("jpg"), db.metadataValue("format"));
    }
  }

  @Test
  void testJpegSourceGeneratesJpegTiles() {
    try (var jpegSource = TestUtils.newMbtiles()) {
      byte[] jpeg = codec.encodeJpeg(RasterImage.filled(4, 4, RED));
      TestUtils.insertTile(jpegSource, TileCoord.ofXYZ(0, 0, 0), jpeg);
      Path output = tempDir.resolve("out.mbtiles");
      try (var sink = MbtilesTileSink.open(output, codec, Optional.empty())) {
        TileConverter.convert(jpegSource, ConvertConfig.defaults().withZoomLevels("+1"), sink, codec);
      }
      try (var db = Mbtiles.newReadOnlyDatabase(output)) {
        for (Tile tile : TestUtils.getTiles(db).values()) {
          assertEquals(TileFormat.JPEG, TileFormat.sniff(tile.bytes()));
        }
        assertEquals(4, db.tileCount());
      }
    }
  }

  @Test
  void testGrayscaleJpegSourceWritesPng() {
    try (var jpegSource = TestUtils.newMbtiles()) {
      TestUtils.insertTile(jpegSource, TileCoord.ofXYZ(0, 0, 0), codec.encodeJpeg(RasterImage.filled(4, 4, RED)));
      jpegSource.setMetadata(Map.of("format", "jpg"), true);
      Path output = tempDir.resolve("out.mbtiles");
      try (var sink = MbtilesTileSink.open(output, codec, Optional.empty())) {
        TileConverter.convert(jpegSource, ConvertConfig.defaults().withZoomLevels("all", "+1").withGrayscale(true),
          sink, codec);
      }
      try (var db = Mbtiles.newReadOnlyDatabase(output)) {
        var tiles = TestUtils.getTiles(db);
        assertEquals(5, tiles.size());
        for (Tile tile : tiles.values()) {
          assertEquals(TileFormat.PNG, TileFormat.sniff(tile.bytes()));
          int pixel = codec.decode(tile.bytes()).getPixel(1, 1);
          assertEquals(pixel >>> 24, (pixel >>> 16) & 0xff);
          assertEquals(pixel >>> 24, (pixel >>> 8) & 0xff);
        }
        assertEquals(Optional.of("png"), db.metadataValue("format"));
      }
    }
  }

  @Test
  void testEmptySourceFails() {
    try (var empty = TestUtils.newMbtiles()) {
      Path output = tempDir.resolve("out.mbtiles");
      try (var sink = MbtilesTileSink.open(output, codec, Optional.empty())) {
        var config = ConvertConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> TileConverter.convert(empty, config, sink, codec));
      }
    }
  }

  @Test
  void testRunToDirectory() {
    Path input = writeSourceFile("input.mbtiles");
    Path output = tempDir.resolve("tiles");
    var result = TileConverter.run(input, TilePathPattern.defaultPattern(), output,
      ConvertConfig.defaults().withZoomLevels("0"), codec);
    assertEquals(Set.of(0), result.generatedLevels());
    assertTrue(Files.isRegularFile(output.resolve("0/0/0.png")));
    assertEquals(Map.of("name", "file source", "minzoom", "0", "maxzoom", "0"),
      JsonUtils.readStringMap(output.resolve(ReadableFilesArchive.METADATA_FILE)));
  }

  @Test
  void testRunFromDirectoryToMbtilesWithExtract() throws IOException {
    Path inputDir = tempDir.resolve("input");
    for (int x = 0; x < 2; x++) {
      for (int y = 0; y < 2; y++) {
        Path file = inputDir.resolve("1/" + x + "/" + y + ".png");
        Files.createDirectories(file.getParent());
        Files.write(file, TestUtils.png(RED));
      }
    }
    Path output = tempDir.resolve("out.mbtiles");
    Path extractDir = tempDir.resolve("extracted");
    var config = new ConvertConfig(List.of("all", "-1"), false, Optional.empty(), TilePathPattern.defaultPattern(),
      Optional.of(extractDir));
    var result = TileConverter.run(inputDir, TilePathPattern.defaultPattern(), output, config, codec);
    assertEquals(5, result.tilesWritten());
    try (var db = Mbtiles.newReadOnlyDatabase(output)) {
      assertEquals(5, db.tileCount());
    }
    try (var extracted = ReadableFilesArchive.newReader(extractDir)) {
      assertEquals(Set.of(0, 1), extracted.zoomLevels());
      assertEquals(5, TestUtils.getTiles(extracted).size());
    }
  }

  @Test
  void testRunRejectsOutputEqualToInput() {
    Path input = writeSourceFile("input.mbtiles");
    var pattern = TilePathPattern.defaultPattern();
    var config = ConvertConfig.defaults();
    assertThrows(IllegalArgumentException.class, () -> TileConverter.run(input, pattern, input, config, codec));
  }

  @Test
  void testRunRejectsUnsupportedOutput() {
    Path input = writeSourceFile("input.mbtiles");
    Path output = tempDir.resolve("out.pmtiles");
    var pattern = TilePathPattern.defaultPattern();
    var config = ConvertConfig.defaults();
    assertThrows(IllegalArgumentException.class, () -> TileConverter.run(input, pattern, output, config, codec));
  }

  @Test
  void testDefaultOutput() throws IOException {
    Path input = tempDir.resolve("world.mbtiles");
    Path first = TileConverter.defaultOutput(input);
    assertEquals(tempDir.resolve("world_converted.mbtiles").toAbsolutePath(), first);
    Files.createFile(first);
    Path second = TileConverter.defaultOutput(input);
    assertEquals(tempDir.resolve("world_converted_1.mbtiles").toAbsolutePath(), second);
    Files.createFile(second);
    assertEquals(tempDir.resolve("world_converted_2.mbtiles").toAbsolutePath(), TileConverter.defaultOutput(input));
  }
}
