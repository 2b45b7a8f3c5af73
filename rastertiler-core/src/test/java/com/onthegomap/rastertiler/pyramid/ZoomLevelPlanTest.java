package com.onthegomap.rastertiler.pyramid;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.rastertiler.image.RasterImage;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ZoomLevelPlanTest {

  @Test
  void testSplitsCopyAndGenerate() {
    var plan = ZoomLevelPlan.of(List.of(5, 3, 7, 3), Set.of(3, 4, 5));
    assertEquals(List.of(5, 3, 7), plan.requested());
    assertEquals(Set.of(3, 5), plan.copyLevels());
    assertEquals(Set.of(7), plan.generateLevels());
    assertEquals(3, plan.minZoom());
    assertEquals(7, plan.maxZoom());
    assertFalse(plan.isEmpty());
  }

  @Test
  void testEmpty() {
    var plan = ZoomLevelPlan.of(List.of(), Set.of(1));
    assertTrue(plan.isEmpty());
    assertTrue(plan.copyLevels().isEmpty());
    assertThrows(NoSuchElementException.class, plan::minZoom);
  }

  @Test
  void testTileKey() {
    TileKey key = new TileKey(5, 6);
    assertEquals(key, TileKey.decode(key.encoded()));
    assertEquals(new TileKey(2, 3), key.parent());
    assertEquals(1, key.indexInParent());
    assertEquals(2, new TileKey(4, 7).indexInParent());
    assertEquals(3, new TileKey(5, 7).indexInParent());
    assertEquals(0, new TileKey(4, 6).indexInParent());
    assertTrue(new TileKey(1, 9).compareTo(new TileKey(2, 0)) < 0);
    assertTrue(new TileKey(1, 2).compareTo(new TileKey(1, 1)) > 0);
  }

  @Test
  void testLevelTilesSortedIteration() {
    LevelTiles level = new LevelTiles(3);
    var image = RasterImage.blank(1, 1);
    level.put(new TileKey(7, 0), image);
    level.put(new TileKey(0, 7), image);
    level.put(new TileKey(0, 1), image);
    assertEquals(List.of(new TileKey(0, 1), new TileKey(0, 7), new TileKey(7, 0)), level.sortedKeys());
    assertNull(level.get(new TileKey(1, 1)));
    assertSame(image, level.get(new TileKey(7, 0)));
    assertEquals(3, level.size());
  }
}
