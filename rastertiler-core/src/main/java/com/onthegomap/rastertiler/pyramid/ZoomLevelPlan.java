package com.onthegomap.rastertiler.pyramid;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Splits requested zoom levels into those that exist in the source and get copied, and those that have to be
 * generated.
 *
 * @param requested      requested levels without duplicates, in order of first mention
 * @param copyLevels     requested levels present in the source
 * @param generateLevels requested levels absent from the source
 */
public record ZoomLevelPlan(List<Integer> requested, SortedSet<Integer> copyLevels,
  SortedSet<Integer> generateLevels) {

  public static ZoomLevelPlan of(Collection<Integer> requested, Collection<Integer> available) {
    List<Integer> deduped = List.copyOf(new LinkedHashSet<>(requested));
    SortedSet<Integer> copy = new TreeSet<>();
    SortedSet<Integer> generate = new TreeSet<>();
    for (int level : deduped) {
      (available.contains(level) ? copy : generate).add(level);
    }
    return new ZoomLevelPlan(deduped, copy, generate);
  }

  public boolean isEmpty() {
    return requested.isEmpty();
  }

  public int minZoom() {
    return requested.stream().mapToInt(Integer::intValue).min().orElseThrow();
  }

  public int maxZoom() {
    return requested.stream().mapToInt(Integer::intValue).max().orElseThrow();
  }
}
