package com.onthegomap.rastertiler.convert;

import com.onthegomap.rastertiler.archive.ReadableTileArchive;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileArchives;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.archive.TileSink;
import com.onthegomap.rastertiler.archive.TilesetInfo;
import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.extract.TileExtractor;
import com.onthegomap.rastertiler.files.TilePathPattern;
import com.onthegomap.rastertiler.image.ImageCodec;
import com.onthegomap.rastertiler.image.ImageIoCodec;
import com.onthegomap.rastertiler.image.RasterImage;
import com.onthegomap.rastertiler.pyramid.LevelTiles;
import com.onthegomap.rastertiler.pyramid.PyramidSynthesizer;
import com.onthegomap.rastertiler.pyramid.UnresolvableZoomLevelException;
import com.onthegomap.rastertiler.pyramid.ZoomLevelPlan;
import com.onthegomap.rastertiler.stats.Timer;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.Format;
import com.onthegomap.rastertiler.util.LogUtil;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies a tileset into a new directory tree or mbtiles file, adding zoom levels that the source does not have.
 * <p>
 * Requested levels present in the source are copied byte-for-byte unless tiles have to be re-encoded for grayscale
 * or a different output format. Missing levels are synthesized by {@link PyramidSynthesizer}.
 * <p>
 * To run from the command line:
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar convert --input=tiles.mbtiles [--output=out.mbtiles] [--zoom-levels=-1,all,+1]
 *   [--grayscale] [--format=default|png|jpg] [--extract=dir] [--pattern={z}/{x}/{y}.{ext}]
 * }
 * </pre>
 */
public class TileConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileConverter.class);
  private static final long LOG_INTERVAL = 1_000;

  private final ReadableTileArchive source;
  private final ConvertConfig config;
  private final ImageCodec codec;

  private TileConverter(ReadableTileArchive source, ConvertConfig config, ImageCodec codec) {
    this.source = source;
    this.config = config;
    this.codec = codec;
  }

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Path input = arguments.inputFile("input", "mbtiles file or tile directory to convert");
    Path output = arguments.file("output", "directory or .mbtiles file to write", null);
    TilePathPattern inputPattern = TilePathPattern.parse(
      arguments.getString("input_pattern", "file layout of a directory input", TilePathPattern.DEFAULT_PATTERN));
    ConvertConfig config = ConvertConfig.from(arguments);
    if (output == null) {
      output = defaultOutput(input);
    }
    run(input, inputPattern, output, config, ImageIoCodec.getInstance());
  }

  /** Converts {@code input} into {@code output} and extracts the result if {@code config} asks for it. */
  public static ConvertResult run(Path input, TilePathPattern inputPattern, Path output, ConvertConfig config,
    ImageCodec codec) {
    if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
      throw new IllegalArgumentException("Output " + output + " must be different from the input");
    }
    ConvertResult result;
    try (
      ReadableTileArchive archive = TileArchives.newReader(input, inputPattern);
      TileSink sink = TileArchives.newWriter(output, config.pattern(), codec, config.outputFormat())
    ) {
      result = convert(archive, config, sink, codec);
    }
    LOGGER.info("Converted tiles written to {}", output);
    if (config.extractDir().isPresent()) {
      Path extractDir = config.extractDir().get();
      try (ReadableTileArchive converted = TileArchives.newReader(output, config.pattern())) {
        TileExtractor.extract(converted, extractDir, config.pattern());
      }
    }
    return result;
  }

  /**
   * Returns {@code <stem>_converted.mbtiles} next to {@code input}, or {@code <stem>_converted_N.mbtiles} with the
   * lowest {@code N} that does not exist yet.
   */
  public static Path defaultOutput(Path input) {
    Path absolute = input.toAbsolutePath().normalize();
    Path dir = absolute.getParent() == null ? Path.of("").toAbsolutePath() : absolute.getParent();
    String stem = absolute.getFileName() == null ? "" : FileUtils.stem(absolute);
    if (stem.isBlank()) {
      stem = "converted";
    }
    Path candidate = dir.resolve(stem + "_converted.mbtiles");
    for (int suffix = 1; Files.exists(candidate); suffix++) {
      candidate = dir.resolve(stem + "_converted_" + suffix + ".mbtiles");
    }
    return candidate;
  }

  /**
   * Writes the zoom levels {@code config} requests from {@code source} to {@code sink} and finishes the sink.
   *
   * @throws IllegalArgumentException if the source has no tiles or a zoom token is invalid
   * @throws UnresolvableZoomLevelException if a requested level cannot be generated
   */
  public static ConvertResult convert(ReadableTileArchive source, ConvertConfig config, TileSink sink,
    ImageCodec codec) {
    return new TileConverter(source, config, codec).convertInto(sink);
  }

  private ConvertResult convertInto(TileSink sink) {
    LogUtil.setStage("convert");
    Timer timer = Timer.start();
    try (PyramidSynthesizer synthesizer = new PyramidSynthesizer(source, codec, config.grayscale())) {
      SortedSet<Integer> available = synthesizer.availableLevels();
      if (available.isEmpty()) {
        throw new IllegalArgumentException(source.name() + " does not contain any tiles");
      }
      List<Integer> levels = ZoomLevelSpec.resolve(config.zoomLevels(), available);
      ZoomLevelPlan plan = synthesizer.plan(levels);
      LOGGER.info("Converting {}: copy zoom {}, generate zoom {}", source.name(), plan.copyLevels(),
        plan.generateLevels());

      TileFormat archiveFormat = null;
      for (int level : plan.copyLevels()) {
        archiveFormat = copyLevel(level, sink, archiveFormat);
      }
      for (int level : plan.generateLevels()) {
        LevelTiles tiles = synthesizer.materialize(level);
        TileFormat generatedFrom = synthesizer.sourceFormat();
        TileFormat fallback = fallbackEncoding(generatedFrom);
        long before = sink.tilesWritten();
        tiles.forEachSorted((coord, image) -> {
          sink.writeImage(coord, image, fallback);
          logProgress(sink);
        });
        LOGGER.info("Wrote {} generated tiles at zoom {}",
          Format.defaultInstance().integer(sink.tilesWritten() - before), level);
        if (archiveFormat == null) {
          archiveFormat = generatedFrom;
        }
      }

      Optional<TileFormat> encodedFormat = config.grayscale() || config.outputFormat().isPresent() ?
        Optional.of(TileFormat.chooseEncoding(config.outputFormat(),
          archiveFormat == null ? TileFormat.PNG : fallbackEncoding(archiveFormat))) :
        Optional.empty();
      sink.finish(new TilesetInfo(source.metadata(), plan.minZoom(), plan.maxZoom(), encodedFormat));
      timer.stop();
      LOGGER.info("Converted {} tiles from {} in {}", Format.defaultInstance().integer(sink.tilesWritten()),
        source.name(), timer);
      return new ConvertResult(plan.requested(), plan.copyLevels(), plan.generateLevels(), sink.tilesWritten(),
        timer.elapsed());
    } finally {
      LogUtil.clearStage();
    }
  }

  private TileFormat copyLevel(int level, TileSink sink, TileFormat archiveFormat) {
    long before = sink.tilesWritten();
    try (var tiles = source.getTilesAtZoom(level)) {
      while (tiles.hasNext()) {
        Tile tile = tiles.next();
        if (archiveFormat == null) {
          archiveFormat = tile.format();
        }
        if (needsReencoding(tile)) {
          RasterImage image = codec.decode(tile.bytes());
          if (config.grayscale()) {
            image.toGrayscale();
          }
          sink.writeImage(tile.coord(), image, fallbackEncoding(tile.format()));
        } else {
          sink.writeTile(tile);
        }
        logProgress(sink);
      }
    }
    LOGGER.info("Copied {} tiles at zoom {}", Format.defaultInstance().integer(sink.tilesWritten() - before), level);
    return archiveFormat;
  }

  /** Grayscale output without an explicit format is always PNG, otherwise re-encoded tiles keep their format. */
  private TileFormat fallbackEncoding(TileFormat sourceFormat) {
    return config.grayscale() ? TileFormat.PNG : sourceFormat;
  }

  private boolean needsReencoding(Tile tile) {
    return config.grayscale() ||
      config.outputFormat().map(format -> format != tile.format()).orElse(false);
  }

  private static void logProgress(TileSink sink) {
    if (sink.tilesWritten() % LOG_INTERVAL == 0) {
      LOGGER.info("Wrote {} tiles", Format.defaultInstance().integer(sink.tilesWritten()));
    }
  }
}
