package com.onthegomap.rastertiler.convert;

import com.onthegomap.rastertiler.geo.TileCoord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Resolves zoom level tokens against the levels available in a source archive.
 * <ul>
 * <li>{@code N}: absolute zoom level {@code N}</li>
 * <li>{@code -N}: {@code N} levels below the lowest available level</li>
 * <li>{@code +N}: {@code N} levels above the highest available level</li>
 * <li>{@code all}: every available level</li>
 * </ul>
 * No tokens at all means every available level.
 */
public class ZoomLevelSpec {

  public static final String ALL = "all";

  private ZoomLevelSpec() {}

  /**
   * Returns the requested levels without duplicates, in order of first mention.
   *
   * @throws IllegalArgumentException if a token is malformed, a relative token is used without available levels, or a
   *                                  level falls outside {@code [0, 62]}
   */
  public static List<Integer> resolve(Collection<String> tokens, Collection<Integer> available) {
    SortedSet<Integer> levels = new TreeSet<>(available);
    if (tokens.isEmpty()) {
      return List.copyOf(levels);
    }
    Set<Integer> result = new LinkedHashSet<>();
    for (String raw : tokens) {
      String token = raw.strip().toLowerCase(Locale.ROOT);
      if (token.equals(ALL)) {
        result.addAll(levels);
        continue;
      }
      int value = parse(token);
      int level;
      if (token.startsWith("-") || token.startsWith("+")) {
        if (levels.isEmpty()) {
          throw new IllegalArgumentException("Relative zoom level '" + raw + "' needs a source with tiles");
        }
        level = token.startsWith("-") ? levels.first() + value : levels.last() + value;
      } else {
        level = value;
      }
      if (level < 0 || level > TileCoord.MAX_ZOOM) {
        throw new IllegalArgumentException(
          "Zoom level '" + raw + "' resolves to " + level + " which is outside [0, " + TileCoord.MAX_ZOOM + "]");
      }
      result.add(level);
    }
    return new ArrayList<>(result);
  }

  private static int parse(String token) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid zoom level '" + token + "', expected N, -N, +N or all", e);
    }
  }
}
