package com.onthegomap.rastertiler.archive;

import com.onthegomap.rastertiler.files.ReadableFilesArchive;
import com.onthegomap.rastertiler.files.TilePathPattern;
import com.onthegomap.rastertiler.files.WriteableFilesArchive;
import com.onthegomap.rastertiler.image.ImageCodec;
import com.onthegomap.rastertiler.mbtiles.Mbtiles;
import com.onthegomap.rastertiler.mbtiles.MbtilesTileSink;
import com.onthegomap.rastertiler.util.FileUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Utilities for creating {@link ReadableTileArchive} and {@link TileSink} instances from a path. */
public class TileArchives {

  private TileArchives() {}

  /** Storage formats a tileset can be read from or written to. */
  public enum Kind {
    /** A sqlite file with a {@code .mbtiles} extension. */
    MBTILES,
    /** A directory with one file per tile. */
    FILES
  }

  /**
   * Returns how {@code path} should be written: an existing directory or a path without an extension is a directory,
   * a {@code .mbtiles} path is a database.
   *
   * @throws IllegalArgumentException for any other path
   */
  public static Kind kindOf(Path path) {
    if (Files.isDirectory(path)) {
      return Kind.FILES;
    }
    String extension = FileUtils.extension(path);
    if (extension.isEmpty()) {
      return Kind.FILES;
    } else if (extension.equals("mbtiles")) {
      return Kind.MBTILES;
    }
    throw new IllegalArgumentException(
      "Unsupported output " + path + ": expected a directory or a file ending with .mbtiles");
  }

  /**
   * Opens an existing directory of tiles laid out by {@code pattern}, or an existing mbtiles file.
   *
   * @throws FileFormatException if {@code path} is a file that cannot be read as an mbtiles archive
   */
  public static ReadableTileArchive newReader(Path path, TilePathPattern pattern) {
    return Files.isDirectory(path) ?
      ReadableFilesArchive.newReader(path, pattern) :
      Mbtiles.newReadOnlyDatabase(path);
  }

  /** Returns a sink that writes to {@code path}, as a directory tree or an mbtiles file per {@link #kindOf(Path)}. */
  public static TileSink newWriter(Path path, TilePathPattern pattern, ImageCodec codec,
    Optional<TileFormat> outputFormat) {
    return switch (kindOf(path)) {
      case MBTILES -> MbtilesTileSink.open(path, codec, outputFormat);
      case FILES -> WriteableFilesArchive.newWriter(path, pattern, codec, outputFormat,
        path.resolve(ReadableFilesArchive.METADATA_FILE));
    };
  }
}
