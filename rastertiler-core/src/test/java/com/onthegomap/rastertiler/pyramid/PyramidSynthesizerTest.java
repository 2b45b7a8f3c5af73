package com.onthegomap.rastertiler.pyramid;

import static com.onthegomap.rastertiler.TestUtils.assertSolid;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.rastertiler.TestUtils;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.ImageIoCodec;
import com.onthegomap.rastertiler.image.RasterImage;
import com.onthegomap.rastertiler.mbtiles.Mbtiles;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PyramidSynthesizerTest {

  private static final int RED = 0xff0000ff;
  private final ImageIoCodec codec = ImageIoCodec.getInstance();
  private Mbtiles source;

  @BeforeEach
  void setup() {
    source = TestUtils.newMbtiles();
    // 4x4 block at zoom 10 with the south-east corner missing
    TestUtils.fillSquare(source, 10, 0, 3, RED);
    removeTile(TileCoord.ofXYZ(3, 3, 10));
  }

  @AfterEach
  void teardown() {
    source.close();
  }

  private void removeTile(TileCoord coord) {
    try (var statement = source.connection().prepareStatement(
      "DELETE FROM tiles WHERE zoom_level=? AND tile_column=? AND tile_row=?")) {
      statement.setInt(1, coord.z());
      statement.setInt(2, coord.x());
      statement.setInt(3, coord.tmsY());
      statement.execute();
    } catch (SQLException e) {
      throw new AssertionError(e);
    }
  }

  private static List<TileCoord> coords(LevelTiles level) {
    List<TileCoord> result = new ArrayList<>();
    level.forEachSorted((coord, image) -> result.add(coord));
    return result;
  }

  @Test
  void testLoadExistingLevel() {
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      assertEquals(Set.of(10), synthesizer.availableLevels());
      LevelTiles level = synthesizer.materialize(10);
      assertEquals(15, level.size());
      assertFalse(level.contains(new TileKey(3, 3)));
      assertSolid(RED, level.get(new TileKey(0, 0)));
      assertEquals(TileFormat.PNG, synthesizer.sourceFormat());
    }
  }

  @Test
  void testDownsampleSkipsIncompleteBlocks() {
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      LevelTiles level9 = synthesizer.materialize(9);
      assertEquals(List.of(
        TileCoord.ofXYZ(0, 0, 9),
        TileCoord.ofXYZ(0, 1, 9),
        TileCoord.ofXYZ(1, 0, 9)
      ), coords(level9));
      level9.forEachSorted((coord, image) -> {
        assertEquals(TestUtils.TILE_SIZE, image.width());
        assertEquals(TestUtils.TILE_SIZE, image.height());
        assertSolid(RED, image);
      });

      // zoom 9 has no complete block left
      assertTrue(synthesizer.materialize(8).isEmpty());
      assertTrue(synthesizer.materialize(0).isEmpty());
    }
  }

  @Test
  void testUpsampleSplitsEveryTile() {
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      LevelTiles level11 = synthesizer.materialize(11);
      assertEquals(60, level11.size());
      assertTrue(level11.contains(new TileKey(7, 5)));
      assertFalse(level11.contains(new TileKey(6, 6)));
      level11.forEachSorted((coord, image) -> {
        assertEquals(TestUtils.TILE_SIZE, image.width());
        assertSolid(RED, image);
      });
      assertEquals(240, synthesizer.materialize(12).size());
    }
  }

  @Test
  void testLevelsAreCached() {
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      assertSame(synthesizer.materialize(9), synthesizer.materialize(9));
      assertSame(synthesizer.materialize(10), synthesizer.materialize(10));
    }
  }

  @Test
  void testGrayscaleAppliesToGeneratedLevelsOnly() {
    try (var synthesizer = new PyramidSynthesizer(source, codec, true)) {
      int gray = 0x4c4c4cff;
      synthesizer.materialize(9).forEachSorted((coord, image) -> assertSolid(gray, image));
      synthesizer.materialize(11).forEachSorted((coord, image) -> assertSolid(gray, image));
      synthesizer.materialize(10).forEachSorted((coord, image) -> assertSolid(RED, image));
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, 63})
  void testOutOfRangeLevel(int level) {
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      var error = assertThrows(UnresolvableZoomLevelException.class, () -> synthesizer.materialize(level));
      assertEquals(level, error.zoom());
    }
  }

  @Test
  void testEmptySourceCannotResolveAnything() {
    try (
      var empty = TestUtils.newMbtiles();
      var synthesizer = new PyramidSynthesizer(empty, codec, false)
    ) {
      assertThrows(UnresolvableZoomLevelException.class, () -> synthesizer.materialize(0));
      assertThrows(UnresolvableZoomLevelException.class, () -> synthesizer.materialize(5));
      assertEquals(TileFormat.PNG, synthesizer.sourceFormat());
    }
  }

  @Test
  void testPlan() {
    TestUtils.fillSquare(source, 12, 0, 0, RED);
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      var plan = synthesizer.plan(List.of(12, 9, 10, 9, 14));
      assertEquals(List.of(12, 9, 10, 14), plan.requested());
      assertEquals(new TreeSet<>(List.of(10, 12)), plan.copyLevels());
      assertEquals(new TreeSet<>(List.of(9, 14)), plan.generateLevels());
      assertEquals(9, plan.minZoom());
      assertEquals(14, plan.maxZoom());
    }
  }

  @Test
  void testDownsampleKeepsQuadrantLayout() {
    LevelTiles children = new LevelTiles(3);
    children.put(new TileKey(2, 4), RasterImage.filled(4, 4, 0x110000ff));
    children.put(new TileKey(3, 4), RasterImage.filled(4, 4, 0x220000ff));
    children.put(new TileKey(2, 5), RasterImage.filled(4, 4, 0x330000ff));
    children.put(new TileKey(3, 5), RasterImage.filled(4, 4, 0x440000ff));
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      LevelTiles parents = synthesizer.downsample(children);
      assertEquals(2, parents.zoom());
      assertEquals(List.of(new TileKey(1, 2)), parents.sortedKeys());
      RasterImage parent = parents.get(new TileKey(1, 2));
      assertEquals(0x110000ff, parent.getPixel(0, 0));
      assertEquals(0x220000ff, parent.getPixel(3, 0));
      assertEquals(0x330000ff, parent.getPixel(0, 3));
      assertEquals(0x440000ff, parent.getPixel(3, 3));
    }
  }

  @Test
  void testDownsampleSkipsMixedSizes() {
    LevelTiles children = new LevelTiles(1);
    children.put(new TileKey(0, 0), RasterImage.filled(4, 4, RED));
    children.put(new TileKey(1, 0), RasterImage.filled(4, 4, RED));
    children.put(new TileKey(0, 1), RasterImage.filled(4, 4, RED));
    children.put(new TileKey(1, 1), RasterImage.filled(8, 8, RED));
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      assertTrue(synthesizer.downsample(children).isEmpty());
    }
  }

  @Test
  void testUpsampleChildPositions() {
    RasterImage parent = RasterImage.blank(4, 4);
    parent.setPixel(0, 0, 0x110000ff);
    parent.setPixel(3, 0, 0x220000ff);
    parent.setPixel(0, 3, 0x330000ff);
    parent.setPixel(3, 3, 0x440000ff);
    LevelTiles parents = new LevelTiles(4);
    parents.put(new TileKey(5, 6), parent);
    try (var synthesizer = new PyramidSynthesizer(source, codec, false)) {
      LevelTiles children = synthesizer.upsample(parents);
      assertEquals(5, children.zoom());
      assertEquals(List.of(new TileKey(10, 12), new TileKey(10, 13), new TileKey(11, 12), new TileKey(11, 13)),
        children.sortedKeys());
      assertEquals(0x110000ff, children.get(new TileKey(10, 12)).getPixel(0, 0));
      assertEquals(0x220000ff, children.get(new TileKey(11, 12)).getPixel(3, 0));
      assertEquals(0x330000ff, children.get(new TileKey(10, 13)).getPixel(0, 3));
      assertEquals(0x440000ff, children.get(new TileKey(11, 13)).getPixel(3, 3));
    }
  }
}
