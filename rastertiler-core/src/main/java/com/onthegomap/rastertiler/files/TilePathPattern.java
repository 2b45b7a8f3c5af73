package com.onthegomap.rastertiler.files;

import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.geo.TileCoord;
import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.locationtech.jts.geom.Envelope;

/**
 * Template that maps a tile coordinate to a path relative to an output directory.
 * <p>
 * Supported placeholders:
 * <table>
 * <tr>
 * <th>Placeholder</th>
 * <th>Value</th>
 * </tr>
 * <tr>
 * <td>{z} {x} {y}</td>
 * <td>zoom, column, XYZ row</td>
 * </tr>
 * <tr>
 * <td>{ZZ} {XXX} {YYYY}</td>
 * <td>zoom, column, row zero-padded to as many digits as the letter is repeated, wider values keep every digit</td>
 * </tr>
 * <tr>
 * <td>{a} {o}</td>
 * <td>latitude of the top edge, longitude of the left edge with 6 decimals</td>
 * </tr>
 * <tr>
 * <td>{AA} {OOO}</td>
 * <td>whole degrees of the absolute latitude/longitude, zero-padded the same way</td>
 * </tr>
 * <tr>
 * <td>{ext}</td>
 * <td>file extension without the dot</td>
 * </tr>
 * </table>
 * For example {@code {z}/{x}/{y}.{ext}} maps zoom 5, column 3, row 10 of a png tile to {@code 5/3/10.png}.
 */
public class TilePathPattern {

  public static final String DEFAULT_PATTERN = "{z}/{x}/{y}.{ext}";

  private enum Kind {
    LITERAL,
    ZOOM,
    COLUMN,
    ROW,
    LATITUDE,
    LONGITUDE,
    EXTENSION
  }

  /** One piece of a parsed pattern, {@code width} is the zero-padding for repeated upper-case placeholders. */
  private record Token(Kind kind, String text, int width) {}

  /** A tile coordinate and extension read back from a path. */
  public record Decoded(TileCoord coord, String extension) {}

  private final String pattern;
  private final List<Token> tokens;

  private TilePathPattern(String pattern, List<Token> tokens) {
    this.pattern = pattern;
    this.tokens = tokens;
  }

  public static TilePathPattern defaultPattern() {
    return parse(DEFAULT_PATTERN);
  }

  /**
   * Parses {@code pattern}.
   *
   * @throws InvalidPatternException if a placeholder is unclosed, empty or unknown, or the pattern is absolute
   */
  public static TilePathPattern parse(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    if (pattern.isBlank()) {
      throw new InvalidPatternException("Pattern is empty");
    }
    if (pattern.startsWith("/") || Paths.get(pattern).isAbsolute()) {
      throw new InvalidPatternException("Pattern must be a relative path: " + pattern);
    }
    List<Token> tokens = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c != '{') {
        literal.append(c);
        i++;
        continue;
      }
      int close = pattern.indexOf('}', i + 1);
      if (close < 0) {
        throw new InvalidPatternException("Unclosed placeholder in pattern: " + pattern);
      }
      String name = pattern.substring(i + 1, close);
      if (name.isEmpty()) {
        throw new InvalidPatternException("Empty placeholder in pattern: " + pattern);
      }
      if (!literal.isEmpty()) {
        tokens.add(new Token(Kind.LITERAL, literal.toString(), 0));
        literal.setLength(0);
      }
      tokens.add(placeholder(name, pattern));
      i = close + 1;
    }
    if (!literal.isEmpty()) {
      tokens.add(new Token(Kind.LITERAL, literal.toString(), 0));
    }
    return new TilePathPattern(pattern, List.copyOf(tokens));
  }

  private static Token placeholder(String name, String pattern) {
    switch (name) {
      case "z":
        return new Token(Kind.ZOOM, name, 0);
      case "x":
        return new Token(Kind.COLUMN, name, 0);
      case "y":
        return new Token(Kind.ROW, name, 0);
      case "a":
        return new Token(Kind.LATITUDE, name, 0);
      case "o":
        return new Token(Kind.LONGITUDE, name, 0);
      case "ext":
        return new Token(Kind.EXTENSION, name, 0);
      default:
        break;
    }
    char first = name.charAt(0);
    if (StringUtils.containsOnly(name, first)) {
      Kind kind = switch (first) {
        case 'Z' -> Kind.ZOOM;
        case 'X' -> Kind.COLUMN;
        case 'Y' -> Kind.ROW;
        case 'A' -> Kind.LATITUDE;
        case 'O' -> Kind.LONGITUDE;
        default -> null;
      };
      if (kind != null) {
        return new Token(kind, name, name.length());
      }
    }
    throw new InvalidPatternException("Unknown placeholder '{" + name + "}' in pattern: " + pattern);
  }

  /** Returns the relative path for {@code coord} with {@code extension} substituted for {@code {ext}}. */
  public String format(TileCoord coord, String extension) {
    Envelope bounds = null;
    StringBuilder result = new StringBuilder();
    for (Token token : tokens) {
      switch (token.kind) {
        case LITERAL -> result.append(token.text);
        case ZOOM -> result.append(number(coord.z(), token.width));
        case COLUMN -> result.append(number(coord.x(), token.width));
        case ROW -> result.append(number(coord.y(), token.width));
        case EXTENSION -> result.append(extension);
        case LATITUDE, LONGITUDE -> {
          if (bounds == null) {
            bounds = coord.bounds();
          }
          double degrees = token.kind == Kind.LATITUDE ? bounds.getMaxY() : bounds.getMinX();
          result.append(token.width == 0 ?
            String.format(Locale.US, "%.6f", degrees) :
            number((long) Math.floor(Math.abs(degrees)), token.width));
        }
      }
    }
    return result.toString();
  }

  /** Never cuts digits, so two tiles can't share a path and paths can be decoded back. */
  private static String number(long value, int width) {
    String digits = Long.toString(value);
    return width == 0 ? digits : StringUtils.leftPad(digits, width, '0');
  }

  /**
   * Returns the file for {@code coord} under {@code basePath}, appending {@code .extension} when the expanded file
   * name has no extension of its own.
   */
  public Path resolve(Path basePath, TileCoord coord, String extension) {
    String relative = format(coord, extension);
    String fileName = StringUtils.substringAfterLast("/" + relative, "/");
    if (!fileName.contains(".") && extension != null && !extension.isEmpty()) {
      relative = relative + "." + extension;
    }
    return basePath.resolve(relative);
  }

  /** Returns {@code true} if the pattern contains {@code {ext}}. */
  public boolean hasExtensionPlaceholder() {
    return tokens.stream().anyMatch(token -> token.kind == Kind.EXTENSION);
  }

  /**
   * Returns a function that reads a tile coordinate and extension back from a file under {@code basePath}, or empty
   * for files that do not match this pattern.
   *
   * @throws InvalidPatternException if the pattern uses latitude/longitude placeholders or does not contain exactly
   *                                 one zoom, column and row placeholder
   */
  public Function<Path, Optional<Decoded>> decoder(Path basePath) {
    for (Kind kind : List.of(Kind.ZOOM, Kind.COLUMN, Kind.ROW)) {
      long count = tokens.stream().filter(token -> token.kind == kind).count();
      if (count != 1) {
        throw new InvalidPatternException("Pattern must contain exactly one " + kind.name().toLowerCase(Locale.ROOT) +
          " placeholder to read tiles back: " + pattern);
      }
    }
    StringBuilder regex = new StringBuilder();
    boolean hasExtension = false;
    for (Token token : tokens) {
      switch (token.kind) {
        case LITERAL -> regex.append(Pattern.quote(token.text));
        case ZOOM -> regex.append("(?<z>\\d+)");
        case COLUMN -> regex.append("(?<x>\\d+)");
        case ROW -> regex.append("(?<y>\\d+)");
        case EXTENSION -> {
          regex.append(hasExtension ? "\\k<ext>" : "(?<ext>[A-Za-z0-9]+)");
          hasExtension = true;
        }
        case LATITUDE, LONGITUDE -> throw new InvalidPatternException(
          "Pattern with '{" + token.text + "}' cannot be read back: " + pattern);
      }
    }
    if (!hasExtensionPlaceholder()) {
      regex.append("(?:\\.(?<ext>[A-Za-z0-9]+))?");
    }
    final Pattern pathPattern = Pattern.compile(regex.toString());
    final Path base = basePath.toAbsolutePath().normalize();
    return path -> {
      Path absolute = path.toAbsolutePath().normalize();
      if (!absolute.startsWith(base)) {
        return Optional.empty();
      }
      String relative = base.relativize(absolute).toString().replace(File.separatorChar, '/');
      final Matcher m = pathPattern.matcher(relative);
      if (!m.matches()) {
        return Optional.empty();
      }
      try {
        TileCoord coord = TileCoord.ofXYZ(
          Integer.parseInt(m.group("x")),
          Integer.parseInt(m.group("y")),
          Integer.parseInt(m.group("z"))
        );
        String extension = m.group("ext");
        return Optional.of(new Decoded(coord, extension == null ? "" : TileFormat.normalizeExtension(extension)));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    };
  }

  /** Returns how many directory levels below the base directory tiles can be found. */
  public int searchDepth() {
    return StringUtils.countMatches(pattern, '/') + 1;
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TilePathPattern that && Objects.equals(pattern, that.pattern));
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return "TilePathPattern[" + pattern + ']';
  }
}
