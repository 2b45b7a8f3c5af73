package com.onthegomap.rastertiler.files;

import com.google.common.base.Preconditions;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.archive.TileSink;
import com.onthegomap.rastertiler.archive.TilesetInfo;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.image.ImageCodec;
import com.onthegomap.rastertiler.image.RasterImage;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.Format;
import com.onthegomap.rastertiler.util.JsonUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes tiles as separate files under a base directory, laid out by a {@link TilePathPattern} ({@code
 * {z}/{x}/{y}.{ext}} by default).
 * <p>
 * Directories are created on demand and creating one that already exists is not an error. Any failure to write a file
 * aborts with an {@link UncheckedIOException}, files written before it stay on disk.
 *
 * @see ReadableFilesArchive
 * @see TilePathPattern
 */
public class WriteableFilesArchive implements TileSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(WriteableFilesArchive.class);

  private final Path basePath;
  private final TilePathPattern pattern;
  private final ImageCodec codec;
  private final Optional<TileFormat> outputFormat;
  private final Path metadataPath;
  private Path lastCheckedFolder;
  private long tilesWritten = 0;

  private WriteableFilesArchive(Path basePath, TilePathPattern pattern, ImageCodec codec,
    Optional<TileFormat> outputFormat, Path metadataPath) {
    LOGGER.atInfo().log("using {} as base files archive path", basePath);
    this.basePath = createValidateDirectory(basePath);
    this.pattern = pattern;
    this.codec = codec;
    this.outputFormat = outputFormat;
    this.metadataPath = metadataPath;
    this.lastCheckedFolder = basePath;
  }

  /**
   * Returns a writer for tiles under {@code basePath}.
   *
   * @param outputFormat format to encode images with, or empty to follow the source format
   * @param metadataPath where {@link #finish(TilesetInfo)} writes metadata as JSON, or {@code null} to skip it
   */
  public static WriteableFilesArchive newWriter(Path basePath, TilePathPattern pattern, ImageCodec codec,
    Optional<TileFormat> outputFormat, Path metadataPath) {
    return new WriteableFilesArchive(basePath, pattern, codec, outputFormat, metadataPath);
  }

  /** Returns a writer that keeps payloads as-is, encodes images in their source format and writes no metadata. */
  public static WriteableFilesArchive newWriter(Path basePath, TilePathPattern pattern, ImageCodec codec) {
    return newWriter(basePath, pattern, codec, Optional.empty(), null);
  }

  private static Path createValidateDirectory(Path p) {
    if (!Files.exists(p)) {
      FileUtils.createDirectory(p);
    }
    Preconditions.checkArgument(
      Files.isDirectory(p),
      "require \"" + p + "\" to be a directory"
    );
    return p;
  }

  /** Returns the file {@code tile} is written to. */
  public Path pathFor(TileCoord coord, String extension) {
    return pattern.resolve(basePath, coord, extension);
  }

  @Override
  public void writeTile(Tile tile) {
    write(pathFor(tile.coord(), tile.extension()), tile.bytes());
  }

  @Override
  public void writeImage(TileCoord coord, RasterImage image, TileFormat sourceFormat) {
    TileFormat format = TileFormat.chooseEncoding(outputFormat, sourceFormat);
    Path file = pathFor(coord, format.extension());
    // a pattern with a hard-coded extension decides the encoding
    TileFormat fromName = TileFormat.fromExtension(FileUtils.extension(file));
    if (fromName.isEncodable()) {
      format = fromName;
    }
    write(file, codec.encode(image, format));
  }

  private void write(Path file, byte[] data) {
    final Path folder = file.getParent();

    // avoid a "folder-exists-check" for every tile in the same folder
    if (folder != null && !lastCheckedFolder.equals(folder) && !Files.isDirectory(folder)) {
      FileUtils.createDirectory(folder);
    }
    lastCheckedFolder = folder;
    try {
      Files.write(file, data);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write tile to " + file, e);
    }
    tilesWritten++;
    if (tilesWritten % 1_000 == 0) {
      LOGGER.debug("Wrote {} tiles", Format.defaultInstance().integer(tilesWritten));
    }
  }

  @Override
  public void finish(TilesetInfo info) {
    if (metadataPath != null) {
      JsonUtils.writePretty(metadataPath, info.updatedMetadata());
    }
    LOGGER.info("Wrote {} tiles to {}", Format.defaultInstance().integer(tilesWritten), basePath);
  }

  @Override
  public long tilesWritten() {
    return tilesWritten;
  }

  @Override
  public void close() {
    // nothing to do here
  }
}
