package com.onthegomap.rastertiler.files;

import com.google.common.base.Preconditions;
import com.onthegomap.rastertiler.config.Arguments;
import com.onthegomap.rastertiler.image.ImageCodec;
import com.onthegomap.rastertiler.image.ImageIoCodec;
import com.onthegomap.rastertiler.stats.Timer;
import com.onthegomap.rastertiler.util.FileUtils;
import com.onthegomap.rastertiler.util.Format;
import com.onthegomap.rastertiler.util.LogUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts every PNG and JPEG image under a directory to grayscale, writing the results to the same relative paths
 * under an output directory.
 * <p>
 * To run from the command line:
 *
 * <pre>
 * {@code
 * java -jar rastertiler.jar grayscale --input=tiles --output=tiles_gray [--recursive=false]
 * }
 * </pre>
 */
public class GrayscaleDirectoryConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(GrayscaleDirectoryConverter.class);
  private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg");

  private GrayscaleDirectoryConverter() {}

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    Path input = arguments.inputFile("input", "directory of images to convert");
    Path output = arguments.file("output", "directory to write grayscale images to");
    boolean recursive = arguments.getBoolean("recursive", "include images in subdirectories", true);
    convert(input, output, recursive, ImageIoCodec.getInstance());
  }

  /**
   * Writes a grayscale copy of each image file in {@code input} to {@code output}.
   *
   * @param recursive also convert images in subdirectories, keeping their relative paths
   * @return the number of images converted
   */
  public static long convert(Path input, Path output, boolean recursive, ImageCodec codec) {
    Preconditions.checkArgument(Files.isDirectory(input), "require \"" + input + "\" to be a directory");
    LogUtil.setStage("grayscale");
    Timer timer = Timer.start();
    try {
      FileUtils.createDirectory(output);
      long count = 0;
      for (Path file : listImages(input, recursive)) {
        Path target = output.resolve(input.relativize(file).toString());
        byte[] bytes;
        try {
          bytes = Files.readAllBytes(file);
        } catch (IOException e) {
          throw new UncheckedIOException("Unable to read " + file, e);
        }
        codec.save(target, codec.decode(bytes).toGrayscale());
        count++;
        if (count % 1_000 == 0) {
          LOGGER.info("Converted {} images", Format.defaultInstance().integer(count));
        }
      }
      LOGGER.info("Converted {} images from {} to {} in {}", Format.defaultInstance().integer(count), input, output,
        timer.stop());
      return count;
    } finally {
      LogUtil.clearStage();
    }
  }

  private static List<Path> listImages(Path input, boolean recursive) {
    try (
      Stream<Path> paths = Files.find(input, recursive ? Integer.MAX_VALUE : 1,
        (path, attrs) -> attrs.isRegularFile() && IMAGE_EXTENSIONS.contains(FileUtils.extension(path)))
    ) {
      return paths.sorted().toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to list images in " + input, e);
    }
  }
}
