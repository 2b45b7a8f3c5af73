package com.onthegomap.rastertiler.files;

import com.google.common.base.Preconditions;
import com.onthegomap.rastertiler.archive.ReadableTileArchive;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.util.CloseableIterator;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.JsonUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads tiles from a folder structure (e.g. BASEPATH/{z}/{x}/{y}.png) like the one a tile downloader produces.
 * Counterpart to {@link WriteableFilesArchive}.
 * <p>
 * Metadata is read from {@code BASEPATH/metadata.json} when that file exists. The extension of each tile comes from
 * the {@code format} metadata entry if there is one, else from the file name, else from the tile bytes.
 *
 * @see WriteableFilesArchive
 * @see TilePathPattern
 */
public class ReadableFilesArchive implements ReadableTileArchive {

  public static final String METADATA_FILE = "metadata.json";

  private static final Logger LOGGER = LoggerFactory.getLogger(ReadableFilesArchive.class);
  private static final List<String> CANDIDATE_EXTENSIONS = List.of("png", "jpg", "jpeg", "webp");

  private final Path basePath;
  private final Path metadataPath;
  private final TilePathPattern pattern;
  private final Function<Path, Optional<TilePathPattern.Decoded>> decoder;
  private final int searchDepth;
  private Optional<String> formatOverride = null;

  private record Entry(Path path, TilePathPattern.Decoded decoded) {}

  private ReadableFilesArchive(Path basePath, TilePathPattern pattern) {
    LOGGER.atInfo().log(() -> "using " + basePath + " as base files archive path");
    Preconditions.checkArgument(
      Files.isDirectory(basePath),
      "require \"" + basePath + "\" to be an existing directory"
    );
    this.basePath = basePath;
    this.metadataPath = basePath.resolve(METADATA_FILE);
    this.pattern = pattern;
    this.decoder = pattern.decoder(basePath);
    this.searchDepth = pattern.searchDepth();
  }

  public static ReadableFilesArchive newReader(Path basePath, TilePathPattern pattern) {
    return new ReadableFilesArchive(basePath, pattern);
  }

  public static ReadableFilesArchive newReader(Path basePath) {
    return newReader(basePath, TilePathPattern.defaultPattern());
  }

  private Optional<String> formatOverride() {
    if (formatOverride == null) {
      formatOverride = Optional.ofNullable(metadata().get("format"))
        .map(TileFormat::normalizeExtension)
        .filter(value -> !value.isEmpty());
    }
    return formatOverride;
  }

  private static Tile readTile(Path path, TileCoord coord, String fileExtension, Optional<String> override) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read tile " + path, e);
    }
    if (override.isPresent()) {
      return new Tile(coord, bytes, override.get());
    }
    return fileExtension.isEmpty() ? Tile.of(coord, bytes) : new Tile(coord, bytes, fileExtension);
  }

  @Override
  public Optional<Tile> getTile(int x, int y, int z) {
    TileCoord coord = TileCoord.ofXYZ(x, y, z);
    if (!coord.isValid()) {
      return Optional.empty();
    }
    Optional<String> override = formatOverride();
    Set<String> extensions = new LinkedHashSet<>();
    override.ifPresent(extensions::add);
    extensions.addAll(CANDIDATE_EXTENSIONS);
    if (!pattern.hasExtensionPlaceholder()) {
      extensions.add("");
    }
    for (String extension : extensions) {
      Path path = pattern.resolve(basePath, coord, extension);
      if (Files.isRegularFile(path)) {
        return Optional.of(readTile(path, coord, TileFormat.normalizeExtension(FileUtils.extension(path)), override));
      }
    }
    return Optional.empty();
  }

  private List<Entry> listEntries() {
    try (Stream<Path> paths = Files.find(basePath, searchDepth, (p, a) -> a.isRegularFile())) {
      List<Entry> result = new ArrayList<>();
      paths.forEach(path -> decoder.apply(path)
        .filter(decoded -> decoded.coord().isValid())
        .ifPresent(decoded -> result.add(new Entry(path, decoded))));
      result.sort(Comparator.comparing((Entry e) -> e.decoded().coord()).thenComparing(e -> e.path().toString()));
      return result;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to list tiles in " + basePath, e);
    }
  }

  @Override
  public CloseableIterator<Tile> getAllTiles() {
    Optional<String> override = formatOverride();
    return CloseableIterator.of(listEntries().stream()
      .map(entry -> readTile(entry.path(), entry.decoded().coord(), extensionOf(entry), override)));
  }

  private static String extensionOf(Entry entry) {
    String decoded = entry.decoded().extension();
    return decoded.isEmpty() ? FileUtils.extension(entry.path()) : decoded;
  }

  @Override
  public SortedSet<Integer> zoomLevels() {
    SortedSet<Integer> result = new TreeSet<>();
    for (Entry entry : listEntries()) {
      result.add(entry.decoded().coord().z());
    }
    return result;
  }

  @Override
  public SortedMap<String, String> metadata() {
    return Files.isRegularFile(metadataPath) ? JsonUtils.readStringMap(metadataPath) : new TreeMap<>();
  }

  @Override
  public String name() {
    Path fileName = basePath.toAbsolutePath().normalize().getFileName();
    return fileName == null ? basePath.toString() : fileName.toString();
  }

  @Override
  public void close() {
    // nothing to do here
  }
}
