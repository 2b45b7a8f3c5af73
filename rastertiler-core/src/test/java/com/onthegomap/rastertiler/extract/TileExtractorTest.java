package com.onthegomap.rastertiler.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.rastertiler.TestUtils;
import com.onthegomap.rastertiler.files.TilePathPattern;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.mbtiles.Mbtiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TileExtractorTest {

  @TempDir
  Path tempDir;

  private List<String> listFiles(Path base) throws IOException {
    try (Stream<Path> s = Files.find(base, 10, (p, a) -> a.isRegularFile())) {
      return s.map(p -> base.relativize(p).toString().replace('\\', '/')).sorted().toList();
    }
  }

  @Test
  void testExtractUsesXyzRows() throws IOException {
    byte[] png = TestUtils.png(0xff0000ff);
    byte[] green = TestUtils.png(0x00ff00ff);
    try (Mbtiles db = TestUtils.newMbtiles()) {
      TestUtils.insertTile(db, TileCoord.ofXYZ(0, 0, 0), png);
      TestUtils.insertTile(db, TileCoord.ofXYZ(1, 0, 1), green);
      TestUtils.insertTile(db, TileCoord.ofXYZ(3, 5, 3), new byte[]{1, 2, 3});
      assertEquals(3, TileExtractor.extract(db, tempDir, TilePathPattern.defaultPattern()));
    }
    assertEquals(List.of("0/0/0.png", "1/1/0.png", "3/3/5.bin"), listFiles(tempDir));
    assertArrayEquals(png, Files.readAllBytes(tempDir.resolve("0/0/0.png")));
    assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(tempDir.resolve("3/3/5.bin")));
  }

  @Test
  void testExtractUsesFormatMetadata() throws IOException {
    try (Mbtiles db = TestUtils.newMbtiles()) {
      TestUtils.insertTile(db, TileCoord.ofXYZ(0, 0, 0), new byte[]{1});
      db.setMetadata(Map.of("format", "jpg"), false);
      TileExtractor.extract(db, tempDir.resolve("out"), TilePathPattern.parse("{z}-{x}-{y}"));
    }
    assertEquals(List.of("0-0-0.jpg"), listFiles(tempDir.resolve("out")));
  }

  @Test
  void testExtractEmptyArchive() throws IOException {
    Path output = tempDir.resolve("out");
    try (Mbtiles db = TestUtils.newMbtiles()) {
      assertEquals(0, TileExtractor.extract(db, output, TilePathPattern.defaultPattern()));
    }
    assertTrue(Files.isDirectory(output));
    assertEquals(List.of(), listFiles(output));
  }

  @Test
  void testMainWithFileArguments() throws IOException {
    Path input = tempDir.resolve("input.mbtiles");
    try (Mbtiles db = Mbtiles.newWriteToFileDatabase(input)) {
      db.createTablesWithIndexes();
      TestUtils.insertTile(db, TileCoord.ofXYZ(2, 1, 2), TestUtils.png(0));
    }
    Path output = tempDir.resolve("out");
    TileExtractor.main("--input=" + input, "--output=" + output, "--pattern={ZZ}/{XX}/{YY}.{ext}");
    assertEquals(List.of("02/02/01.png"), listFiles(output));
  }
}
