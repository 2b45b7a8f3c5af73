package com.onthegomap.rastertiler;

import static java.util.Map.entry;

import com.onthegomap.rastertiler.convert.TileConverter;
import com.onthegomap.rastertiler.extract.TileExtractor;
import com.onthegomap.rastertiler.files.GrayscaleDirectoryConverter;
import com.onthegomap.rastertiler.mbtiles.ArchiveHealth;
import com.onthegomap.rastertiler.mbtiles.MetadataTool;
import com.onthegomap.rastertiler.mbtiles.MissingTilesReport;
import com.onthegomap.rastertiler.mbtiles.TilesetSummary;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Main entry-point for the executable jar of rastertiler, which delegates to individual {@code public static void
 * main(String[] args)} methods of runnable classes.
 * <p>
 * Any failure is reported as a single line on standard error with exit code 1. Pass {@code --verbose} to log debug
 * output and print stack traces, or {@code --log-level=warn} to log less. Every task also reads arguments it was not
 * given on the command line from a properties file passed as {@code --config=file.properties}.
 */
public class Main {

  private static final String LOG_LEVEL_PROPERTY = "rastertiler.loglevel";

  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("extract", TileExtractor::main),

    entry("convert", TileConverter::main),
    entry("resize", TileConverter::main),
    entry("decrease-zoom", TileConverter::main),

    entry("metadata", MetadataTool::main),

    entry("missing-report", MissingTilesReport::main),
    entry("health", ArchiveHealth::main),
    entry("summary", TilesetSummary::main),

    entry("grayscale", GrayscaleDirectoryConverter::main)
  );

  public static void main(String[] args) {
    List<String> remaining = new ArrayList<>();
    boolean verbose = false;
    String logLevel = null;
    for (String arg : args) {
      String stripped = arg.strip();
      if (stripped.equals("-v") || stripped.equals("--verbose")) {
        verbose = true;
        logLevel = "debug";
      } else if (stripped.startsWith("--log-level=") || stripped.startsWith("--log_level=")) {
        logLevel = stripped.substring(stripped.indexOf('=') + 1);
      } else {
        remaining.add(arg);
      }
    }
    if (logLevel != null) {
      // must happen before the first logger gets created
      System.setProperty(LOG_LEVEL_PROPERTY, logLevel);
    }

    if (remaining.isEmpty()) {
      System.err.println("Usage: rastertiler <task> [--key=value ...]");
      System.err.println("possibilities: " + new TreeSet<>(ENTRY_POINTS.keySet()));
      System.exit(1);
    }
    String maybeTask = remaining.get(0).trim().toLowerCase(Locale.ROOT);
    EntryPoint task = ENTRY_POINTS.get(maybeTask);
    if (task == null) {
      System.err.println("Unrecognized task: " + maybeTask);
      System.err.println("possibilities: " + new TreeSet<>(ENTRY_POINTS.keySet()));
      System.exit(1);
    }

    String[] taskArgs = remaining.subList(1, remaining.size()).toArray(String[]::new);
    try {
      task.main(taskArgs);
    } catch (Exception e) {
      System.err.println("Error: " + describe(e));
      if (verbose) {
        e.printStackTrace();
      }
      System.exit(1);
    }
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    if (message == null || message.isBlank()) {
      return e.getClass().getSimpleName();
    }
    // keep the output to one line
    return Arrays.stream(message.split("\\R")).map(String::strip).filter(line -> !line.isEmpty())
      .findFirst().orElse(message);
  }

  @FunctionalInterface
  private interface EntryPoint {

    void main(String[] args) throws Exception;
  }
}
