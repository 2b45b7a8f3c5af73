package com.onthegomap.rastertiler.convert;

import java.time.Duration;
import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of {@link TileConverter#convert}.
 *
 * @param requestedLevels zoom levels written, in order of first mention
 * @param copiedLevels    levels copied from the source
 * @param generatedLevels levels synthesized from adjacent levels
 * @param tilesWritten    tiles written to the sink
 * @param elapsed         wall-clock time of the conversion
 */
public record ConvertResult(
  List<Integer> requestedLevels,
  SortedSet<Integer> copiedLevels,
  SortedSet<Integer> generatedLevels,
  long tilesWritten,
  Duration elapsed
) {}
