package com.onthegomap.rastertiler.util;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Shared Jackson mapper for the JSON files and summaries this project reads and writes.
 */
public class JsonUtils {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
    .registerModules(new Jdk8Module())
    .setSerializationInclusion(NON_ABSENT);

  private static final ObjectWriter PRETTY_WRITER = OBJECT_MAPPER.writerWithDefaultPrettyPrinter();

  private JsonUtils() {}

  public static String toJsonString(Object o) {
    try {
      return OBJECT_MAPPER.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Error converting " + o.getClass().getSimpleName() + " to JSON", e);
    }
  }

  public static String toPrettyJsonString(Object o) {
    try {
      return PRETTY_WRITER.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Error converting " + o.getClass().getSimpleName() + " to JSON", e);
    }
  }

  /** Writes {@code o} as indented JSON to {@code path}, creating parent directories. */
  public static void writePretty(Path path, Object o) {
    FileUtils.createParentDirectories(path);
    try {
      PRETTY_WRITER.writeValue(path.toFile(), o);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write " + path, e);
    }
  }

  /**
   * Reads a JSON object of {@code path} into a key-ordered map, keeping scalar values as text and nested values as
   * JSON.
   */
  public static SortedMap<String, String> readStringMap(Path path) {
    JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(path.toFile());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + path, e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(path + " does not contain a JSON object");
    }
    SortedMap<String, String> result = new TreeMap<>();
    root.fields().forEachRemaining(field -> {
      JsonNode value = field.getValue();
      result.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
    });
    return result;
  }
}
