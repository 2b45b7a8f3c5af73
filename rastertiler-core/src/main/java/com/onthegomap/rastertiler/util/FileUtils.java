package com.onthegomap.rastertiler.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Convenience methods for working with files on disk.
 */
public class FileUtils {

  private FileUtils() {}

  /** Returns {@code true} if the file name of {@code path} ends with {@code .extension}, ignoring case. */
  public static boolean hasExtension(Path path, String extension) {
    return path.toString().toLowerCase(Locale.ROOT).endsWith("." + extension.toLowerCase(Locale.ROOT));
  }

  /** Returns the lower-case extension of the file name of {@code path} without the dot, or an empty string. */
  public static String extension(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return "";
    }
    String name = fileName.toString();
    int idx = name.lastIndexOf('.');
    return idx <= 0 || idx == name.length() - 1 ? "" : name.substring(idx + 1).toLowerCase(Locale.ROOT);
  }

  /** Returns the file name of {@code path} without its extension. */
  public static String stem(Path path) {
    String name = path.getFileName().toString();
    int idx = name.lastIndexOf('.');
    return idx <= 0 ? name : name.substring(0, idx);
  }

  /** Returns {@code path} with its file extension replaced by {@code extension}, or added if it had none. */
  public static Path withExtension(Path path, String extension) {
    String name = path.getFileName().toString();
    String newName = extension(path).isEmpty() ? name : name.substring(0, name.lastIndexOf('.'));
    return path.resolveSibling(newName + "." + extension);
  }

  /** Returns the size of {@code path} as a file, or 0 if missing/inaccessible. */
  public static long fileSize(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      return 0;
    }
  }

  /**
   * Deletes a file if it exists.
   *
   * @throws UncheckedIOException if the file exists and cannot be deleted
   */
  public static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to delete " + path, e);
    }
  }

  /**
   * Ensures a directory and all parent directories exist.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createDirectory(Path path) {
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new IllegalStateException("Unable to create directories " + path, e);
    }
  }

  /**
   * Ensures all parent directories of each path in {@code paths} exist.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createParentDirectories(Path... paths) {
    for (var path : paths) {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null && !Files.isDirectory(parent)) {
        createDirectory(parent);
      }
    }
  }
}
