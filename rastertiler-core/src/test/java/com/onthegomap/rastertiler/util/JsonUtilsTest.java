package com.onthegomap.rastertiler.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonUtilsTest {

  @TempDir
  Path tmpDir;

  record Value(String name, Optional<Integer> zoom) {}

  @Test
  void testOmitsAbsentValues() {
    assertEquals("{\"name\":\"a\",\"zoom\":3}", JsonUtils.toJsonString(new Value("a", Optional.of(3))));
    assertEquals("{\"name\":\"a\"}", JsonUtils.toJsonString(new Value("a", Optional.empty())));
    assertEquals("{}", JsonUtils.toJsonString(new Value(null, Optional.empty())));
  }

  @Test
  void testWriteAndReadStringMap() {
    Path path = tmpDir.resolve("dir/metadata.json");
    JsonUtils.writePretty(path, new TreeMap<>(Map.of("name", "roads", "minzoom", "2")));
    assertEquals(Map.of("name", "roads", "minzoom", "2"), JsonUtils.readStringMap(path));
  }

  @Test
  void testReadNestedValuesAsJson() throws IOException {
    Path path = tmpDir.resolve("metadata.json");
    Files.writeString(path, """
      {"name": "roads", "maxzoom": 4, "bounds": [1, 2], "json": {"a": true}}
      """);
    assertEquals(Map.of(
      "name", "roads",
      "maxzoom", "4",
      "bounds", "[1,2]",
      "json", "{\"a\":true}"
    ), JsonUtils.readStringMap(path));
  }

  @Test
  void testReadErrors() throws IOException {
    Path array = tmpDir.resolve("array.json");
    Files.writeString(array, "[1, 2]");
    assertThrows(IllegalArgumentException.class, () -> JsonUtils.readStringMap(array));
    assertThrows(UncheckedIOException.class, () -> JsonUtils.readStringMap(tmpDir.resolve("missing.json")));
  }
}
