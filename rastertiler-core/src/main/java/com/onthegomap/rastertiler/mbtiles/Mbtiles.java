package com.onthegomap.rastertiler.mbtiles;

import com.onthegomap.rastertiler.archive.FileFormatException;
import com.onthegomap.rastertiler.archive.ReadableTileArchive;
import com.onthegomap.rastertiler.archive.Tile;
import com.onthegomap.rastertiler.archive.TileFormat;
import com.onthegomap.rastertiler.geo.TileCoord;
import com.onthegomap.rastertiler.util.CloseableIterator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Interface into an mbtiles sqlite file containing raster tiles and metadata about the tileset.
 * <p>
 * Rows are stored with TMS row numbering, every method here takes and returns XYZ rows. One instance owns one
 * connection and must not be shared between threads.
 *
 * @see <a href="https://github.com/mapbox/mbtiles-spec/blob/master/1.3/spec.md">MBTiles Specification</a>
 */
@NotThreadSafe
public final class Mbtiles implements ReadableTileArchive {

  // https://www.sqlite.org/src/artifact?ci=trunk&filename=magic.txt
  private static final int MBTILES_APPLICATION_ID = 0x4d504258;

  private static final String TILES_TABLE = "tiles";
  private static final String TILES_COL_X = "tile_column";
  private static final String TILES_COL_Y = "tile_row";
  private static final String TILES_COL_Z = "zoom_level";
  private static final String TILES_COL_DATA = "tile_data";

  private static final String METADATA_TABLE = "metadata";
  private static final String METADATA_COL_NAME = "name";
  private static final String METADATA_COL_VALUE = "value";

  static final String FORMAT_KEY = "format";

  private static final Logger LOGGER = LoggerFactory.getLogger(Mbtiles.class);

  // load the sqlite driver
  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found");
    }
  }

  private final Connection connection;
  private final String name;
  private PreparedStatement getTileStatement = null;
  private boolean formatResolved = false;
  private String formatFromMetadata = null;

  private Mbtiles(Connection connection, String name) {
    this.connection = connection;
    this.name = name;
  }

  /** Returns a new mbtiles file that won't get written to disk. Useful for toy use-cases like unit tests. */
  public static Mbtiles newInMemoryDatabase() {
    SQLiteConfig config = new SQLiteConfig();
    config.setApplicationId(MBTILES_APPLICATION_ID);
    return new Mbtiles(newConnection("jdbc:sqlite::memory:", config), ":memory:");
  }

  /**
   * Returns a new connection to an mbtiles file that may not exist yet, set up for writing tiles in one large
   * transaction. Call {@link #createTablesWithIndexes()} before writing to a new file.
   */
  public static Mbtiles newWriteToFileDatabase(Path path) {
    Objects.requireNonNull(path);
    SQLiteConfig sqliteConfig = new SQLiteConfig();
    sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    sqliteConfig.setCacheSize(100_000);
    sqliteConfig.setLockingMode(SQLiteConfig.LockingMode.EXCLUSIVE);
    sqliteConfig.setTempStore(SQLiteConfig.TempStore.MEMORY);
    sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    sqliteConfig.setApplicationId(MBTILES_APPLICATION_ID);
    return new Mbtiles(newConnection("jdbc:sqlite:" + path.toAbsolutePath(), sqliteConfig), fileName(path));
  }

  /**
   * Returns a new connection to an existing mbtiles file optimized for reads.
   *
   * @throws FileFormatException if the file is missing, is not a sqlite database, or has no tiles table
   */
  public static Mbtiles newReadOnlyDatabase(Path path) {
    requireExistingFile(path);
    SQLiteConfig config = new SQLiteConfig();
    config.setReadOnly(true);
    config.setCacheSize(100_000);
    return new Mbtiles(newConnection("jdbc:sqlite:" + path.toAbsolutePath(), config), fileName(path))
      .validate();
  }

  /**
   * Returns a new connection to an existing mbtiles file that allows reading tiles and updating metadata.
   *
   * @throws FileFormatException if the file is missing, is not a sqlite database, or has no tiles table
   */
  public static Mbtiles newReadWriteDatabase(Path path) {
    requireExistingFile(path);
    SQLiteConfig config = new SQLiteConfig();
    config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    return new Mbtiles(newConnection("jdbc:sqlite:" + path.toAbsolutePath(), config), fileName(path))
      .validate();
  }

  private static void requireExistingFile(Path path) {
    Objects.requireNonNull(path);
    if (!Files.isRegularFile(path)) {
      throw new FileFormatException("Unable to open " + path + ": file does not exist");
    }
  }

  private static String fileName(Path path) {
    Path fileName = path.getFileName();
    return fileName == null ? path.toString() : fileName.toString();
  }

  private static Connection newConnection(String url, SQLiteConfig config) {
    try {
      return DriverManager.getConnection(url, config.toProperties());
    } catch (SQLException throwables) {
      throw new FileFormatException("Unable to open " + url, throwables);
    }
  }

  private Mbtiles validate() {
    boolean hasTiles;
    try {
      hasTiles = tableExists(TILES_TABLE);
    } catch (SQLException e) {
      closeQuietly();
      throw new FileFormatException("Unable to read " + name + ", is it a sqlite database?", e);
    }
    if (!hasTiles) {
      closeQuietly();
      throw new FileFormatException(name + " is not an mbtiles file: missing " + TILES_TABLE + " table");
    }
    return this;
  }

  private void closeQuietly() {
    try {
      connection.close();
    } catch (SQLException e) {
      LOGGER.warn("Error closing {}: {}", name, e.toString());
    }
  }

  private boolean tableExists(String table) throws SQLException {
    try (
      var statement = connection.prepareStatement(
        "SELECT 1 FROM sqlite_master WHERE type IN ('table', 'view') AND name = ?")
    ) {
      statement.setString(1, table);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static TileCoord getResultCoord(ResultSet rs) throws SQLException {
    int z = rs.getInt(TILES_COL_Z);
    int rawy = rs.getInt(TILES_COL_Y);
    int x = rs.getInt(TILES_COL_X);
    return TileCoord.ofTMS(x, rawy, z);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void close() {
    try {
      if (getTileStatement != null) {
        getTileStatement.close();
      }
      connection.close();
    } catch (SQLException throwables) {
      throw new MbtilesQueryException("Unable to close " + name, throwables);
    }
  }

  private Mbtiles execute(Collection<String> queries) {
    for (String query : queries) {
      try (var statement = connection.createStatement()) {
        LOGGER.debug("Execute mbtiles: {}", query);
        statement.execute(query);
      } catch (SQLException throwables) {
        throw new MbtilesQueryException("Error executing queries " + String.join(",", queries), throwables);
      }
    }
    return this;
  }

  private Mbtiles execute(String... queries) {
    return execute(Arrays.asList(queries));
  }

  /** Creates the metadata and tiles tables with their unique indexes if they do not exist yet. */
  public Mbtiles createTablesWithIndexes() {
    List<String> ddlStatements = new ArrayList<>();
    ddlStatements.add(metadataTableDdl());
    ddlStatements.add(metadataIndexDdl());
    ddlStatements.add("""
      create table if not exists %s (
        %s integer,
        %s integer,
        %s integer,
        %s blob
      )
      """.formatted(TILES_TABLE, TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_COL_DATA));
    ddlStatements.add("create unique index if not exists tile_index on %s (%s, %s, %s)"
      .formatted(TILES_TABLE, TILES_COL_Z, TILES_COL_X, TILES_COL_Y));
    return execute(ddlStatements);
  }

  private static String metadataTableDdl() {
    return "create table if not exists " + METADATA_TABLE + " (" + METADATA_COL_NAME + " text, " +
      METADATA_COL_VALUE + " text)";
  }

  private static String metadataIndexDdl() {
    return "create unique index if not exists name on " + METADATA_TABLE + " (" + METADATA_COL_NAME + ")";
  }

  /** Starts a transaction that lasts until {@link #commitTransaction()} or {@link #rollbackTransaction()}. */
  void beginTransaction() {
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      throw new MbtilesQueryException("Unable to start transaction on " + name, e);
    }
  }

  void commitTransaction() {
    try {
      connection.commit();
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      throw new MbtilesQueryException("Unable to commit transaction on " + name, e);
    }
  }

  void rollbackTransaction() {
    try {
      if (!connection.getAutoCommit()) {
        connection.rollback();
        connection.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new MbtilesQueryException("Unable to roll back transaction on " + name, e);
    }
  }

  /** Returns all key/value pairs from the metadata table ordered by key, or an empty map if there is no table. */
  @Override
  public SortedMap<String, String> metadata() {
    SortedMap<String, String> result = new TreeMap<>();
    try {
      if (!tableExists(METADATA_TABLE)) {
        return result;
      }
      try (
        Statement statement = connection.createStatement();
        ResultSet resultSet = statement.executeQuery(
          "SELECT " + METADATA_COL_NAME + ", " + METADATA_COL_VALUE + " FROM " + METADATA_TABLE + " ORDER BY " +
            METADATA_COL_NAME)
      ) {
        while (resultSet.next()) {
          result.put(
            resultSet.getString(METADATA_COL_NAME),
            resultSet.getString(METADATA_COL_VALUE)
          );
        }
      }
    } catch (SQLException throwables) {
      throw new MbtilesQueryException("Error retrieving metadata from " + name, throwables);
    }
    return result;
  }

  /** Returns the metadata keys in ascending order. */
  public SortedSet<String> metadataKeys() {
    return new TreeSet<>(metadata().keySet());
  }

  /** Returns the metadata value for {@code key} if present. */
  public Optional<String> metadataValue(String key) {
    return Optional.ofNullable(metadata().get(key));
  }

  /**
   * Writes every entry of {@code entries} to the metadata table in a single transaction.
   * <p>
   * With {@code overwrite} existing keys get their value replaced. Without it, if any key is already present nothing
   * is written and a {@link MetadataKeyExistsException} is thrown.
   *
   * @throws MetadataKeyExistsException if {@code overwrite} is false and a key already exists
   * @throws MbtilesQueryException      if the database rejects the write
   */
  public Mbtiles setMetadata(Map<String, String> entries, boolean overwrite) {
    if (entries.isEmpty()) {
      return this;
    }
    try {
      connection.setAutoCommit(false);
      try (Statement ddl = connection.createStatement()) {
        ddl.execute(metadataTableDdl());
      }
      try (
        var select = connection.prepareStatement(
          "SELECT 1 FROM " + METADATA_TABLE + " WHERE " + METADATA_COL_NAME + " = ?");
        var update = connection.prepareStatement(
          "UPDATE " + METADATA_TABLE + " SET " + METADATA_COL_VALUE + " = ? WHERE " + METADATA_COL_NAME + " = ?");
        var insert = connection.prepareStatement(
          "INSERT INTO " + METADATA_TABLE + " (" + METADATA_COL_NAME + ", " + METADATA_COL_VALUE + ") VALUES (?, ?)")
      ) {
        for (var entry : new TreeMap<>(entries).entrySet()) {
          String key = entry.getKey();
          String value = entry.getValue();
          select.setString(1, key);
          boolean exists;
          try (ResultSet rs = select.executeQuery()) {
            exists = rs.next();
          }
          if (exists && !overwrite) {
            throw new MetadataKeyExistsException(key);
          }
          LOGGER.debug("Set mbtiles metadata: {}={}", key,
            value.length() > 1_000 ?
              (value.substring(0, 1_000) + "... " + (value.length() - 1_000) + " more characters") :
              value);
          var statement = exists ? update : insert;
          statement.setString(exists ? 2 : 1, key);
          statement.setString(exists ? 1 : 2, value);
          statement.executeUpdate();
        }
      }
      connection.commit();
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      rollbackAfterFailure(e);
      throw new MbtilesQueryException("Unable to set metadata on " + name, e);
    } catch (RuntimeException e) {
      rollbackAfterFailure(e);
      throw e;
    }
    formatResolved = false;
    return this;
  }

  private void rollbackAfterFailure(Exception cause) {
    try {
      connection.rollback();
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  /** Returns the distinct zoom levels present in the tiles table. */
  @Override
  public SortedSet<Integer> zoomLevels() {
    SortedSet<Integer> result = new TreeSet<>();
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery(
        "SELECT DISTINCT %s FROM %s ORDER BY %s".formatted(TILES_COL_Z, TILES_TABLE, TILES_COL_Z))
    ) {
      while (rs.next()) {
        result.add(rs.getInt(1));
      }
    } catch (SQLException e) {
      throw new MbtilesQueryException("Unable to read zoom levels from " + name, e);
    }
    return result;
  }

  /** Returns per zoom level tile counts and column/row ranges, ordered by zoom. */
  public List<LevelStats> levelStats() {
    List<LevelStats> result = new ArrayList<>();
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery("""
        SELECT %1$s, MIN(%2$s), MAX(%2$s), MIN(%3$s), MAX(%3$s), COUNT(*) FROM %4$s GROUP BY %1$s ORDER BY %1$s
        """.formatted(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_TABLE))
    ) {
      while (rs.next()) {
        result.add(new LevelStats(rs.getInt(1), rs.getInt(2), rs.getInt(3), rs.getInt(4), rs.getInt(5),
          rs.getLong(6)));
      }
    } catch (SQLException e) {
      throw new MbtilesQueryException("Unable to read tile statistics from " + name, e);
    }
    return result;
  }

  /** Returns the total number of rows in the tiles table. */
  public long tileCount() {
    return levelStats().stream().mapToLong(LevelStats::count).sum();
  }

  /**
   * Returns the extension every tile in this archive should use if the metadata table has a {@code format} entry, or
   * empty if each tile's extension has to be sniffed from its bytes.
   */
  public Optional<String> formatOverride() {
    if (!formatResolved) {
      formatFromMetadata = metadataValue(FORMAT_KEY)
        .map(TileFormat::normalizeExtension)
        .filter(value -> !value.isEmpty())
        .orElse(null);
      formatResolved = true;
    }
    return Optional.ofNullable(formatFromMetadata);
  }

  private Tile toTile(TileCoord coord, byte[] bytes, String override) {
    return override != null ? new Tile(coord, bytes, override) : Tile.of(coord, bytes);
  }

  private PreparedStatement getTileStatement() {
    if (getTileStatement == null) {
      try {
        getTileStatement = connection.prepareStatement("""
          SELECT tile_data FROM %s
          WHERE %s=? AND %s=? AND %s=?
          """.formatted(TILES_TABLE, TILES_COL_X, TILES_COL_Y, TILES_COL_Z));
      } catch (SQLException throwables) {
        throw new MbtilesQueryException("Unable to prepare tile lookup on " + name, throwables);
      }
    }
    return getTileStatement;
  }

  @Override
  public Optional<Tile> getTile(int x, int y, int z) {
    TileCoord coord = TileCoord.ofXYZ(x, y, z);
    if (!coord.isValid()) {
      return Optional.empty();
    }
    String override = formatOverride().orElse(null);
    try {
      PreparedStatement stmt = getTileStatement();
      stmt.setInt(1, x);
      stmt.setInt(2, coord.tmsY());
      stmt.setInt(3, z);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? Optional.of(toTile(coord, rs.getBytes(TILES_COL_DATA), override)) : Optional.empty();
      }
    } catch (SQLException throwables) {
      throw new MbtilesQueryException("Could not get tile " + coord + " from " + name, throwables);
    }
  }

  @Override
  public CloseableIterator<Tile> getAllTiles() {
    String override = formatOverride().orElse(null);
    return new QueryIterator<>(
      conn -> conn.prepareStatement(
        "select %s, %s, %s, %s from %s".formatted(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_COL_DATA, TILES_TABLE)
      ),
      rs -> toTile(getResultCoord(rs), rs.getBytes(TILES_COL_DATA), override)
    );
  }

  @Override
  public CloseableIterator<Tile> getTilesAtZoom(int z) {
    String override = formatOverride().orElse(null);
    return new QueryIterator<>(
      conn -> {
        var statement = conn.prepareStatement("select %s, %s, %s, %s from %s where %s=?"
          .formatted(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_COL_DATA, TILES_TABLE, TILES_COL_Z));
        statement.setInt(1, z);
        return statement;
      },
      rs -> toTile(getResultCoord(rs), rs.getBytes(TILES_COL_DATA), override)
    );
  }

  /** Returns the coordinates of every tile at zoom {@code z} without loading tile data. */
  public CloseableIterator<TileCoord> getTileCoordsAtZoom(int z) {
    return new QueryIterator<>(
      conn -> {
        var statement = conn.prepareStatement("select %s, %s, %s from %s where %s=?"
          .formatted(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_TABLE, TILES_COL_Z));
        statement.setInt(1, z);
        return statement;
      },
      Mbtiles::getResultCoord
    );
  }

  /** Returns a writer that queues up {@code INSERT OR REPLACE} statements into large batches before executing them. */
  TileWriter newTileWriter() {
    return new TileWriter();
  }

  public Connection connection() {
    return connection;
  }

  @Override
  public String toString() {
    return "Mbtiles[" + name + "]";
  }

  /**
   * Tile count and column/TMS row range of one zoom level.
   */
  public record LevelStats(int z, int minX, int maxX, int minTmsY, int maxTmsY, long count) {

    /** Number of tiles in the bounding range of columns and rows. */
    public long rangeSize() {
      return ((long) maxX - minX + 1) * ((long) maxTmsY - minTmsY + 1);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<I, O> {
    O apply(I t) throws SQLException;
  }

  /** Iterates through the results of a query one at a time without materializing the entire list in memory. */
  private class QueryIterator<T> implements CloseableIterator<T> {
    private final PreparedStatement statement;
    private final ResultSet rs;
    private final SqlFunction<ResultSet, T> rowMapper;
    private boolean hasNext = false;
    private boolean closed = false;

    private QueryIterator(
      SqlFunction<Connection, PreparedStatement> query,
      SqlFunction<ResultSet, T> rowMapper
    ) {
      this.rowMapper = rowMapper;
      try {
        this.statement = query.apply(connection);
        this.rs = statement.executeQuery();
        hasNext = rs.next();
      } catch (SQLException e) {
        throw new MbtilesQueryException("Could not read tiles from " + name, e);
      } finally {
        if (!hasNext) {
          close();
        }
      }
    }

    @Override
    public void close() {
      if (closed || statement == null) {
        return;
      }
      closed = true;
      try {
        statement.close();
      } catch (SQLException e) {
        throw new MbtilesQueryException("Could not close query on " + name, e);
      }
    }

    @Override
    public boolean hasNext() {
      return hasNext;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      try {
        T result = rowMapper.apply(rs);
        hasNext = rs.next();
        if (!hasNext) {
          close();
        }
        return result;
      } catch (SQLException | RuntimeException e) {
        // a corrupt row fails the iteration but must not leave the cursor open
        hasNext = false;
        close();
        throw new MbtilesQueryException("Could not read tiles from " + name, e);
      }
    }
  }

  /** Writes tiles as multi-row {@code INSERT OR REPLACE} statements, flipping rows to TMS numbering. */
  class TileWriter implements AutoCloseable {

    private static final int MAX_PARAMETERS_IN_PREPARED_STATEMENT = 999;
    private static final List<String> COLUMNS = List.of(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_COL_DATA);

    private final List<Tile> batch;
    private final PreparedStatement batchStatement;
    private final int batchLimit;
    private final String insertStmtValuesPlaceHolder;
    private long count = 0;

    private TileWriter() {
      batchLimit = MAX_PARAMETERS_IN_PREPARED_STATEMENT / COLUMNS.size();
      batch = new ArrayList<>(batchLimit);
      insertStmtValuesPlaceHolder = COLUMNS.stream().map(c -> "?").collect(Collectors.joining(",", "(", ")"));
      batchStatement = createBatchInsertPreparedStatement(batchLimit);
    }

    /** Queue-up a write or flush to the database if enough are waiting. */
    void write(TileCoord coord, byte[] data) {
      count++;
      batch.add(new Tile(coord, data, ""));
      if (batch.size() >= batchLimit) {
        flush(batchStatement);
      }
    }

    private PreparedStatement createBatchInsertPreparedStatement(int size) {
      final String sql = "INSERT OR REPLACE INTO %s (%s) VALUES %s;".formatted(
        TILES_TABLE,
        String.join(",", COLUMNS),
        IntStream.range(0, size).mapToObj(i -> insertStmtValuesPlaceHolder).collect(Collectors.joining(", "))
      );
      try {
        return connection.prepareStatement(sql);
      } catch (SQLException throwables) {
        throw new MbtilesQueryException("Could not create prepared statement", throwables);
      }
    }

    private void flush(PreparedStatement statement) {
      try {
        int pos = 1;
        for (Tile tile : batch) {
          TileCoord coord = tile.coord();
          statement.setInt(pos++, coord.z());
          statement.setInt(pos++, coord.x());
          // flip Y
          statement.setInt(pos++, coord.tmsY());
          statement.setBytes(pos++, tile.bytes());
        }
        statement.execute();
        batch.clear();
      } catch (SQLException throwables) {
        throw new MbtilesQueryException("Error flushing batch of " + batch.size() + " tiles to " + name, throwables);
      }
    }

    long count() {
      return count;
    }

    @Override
    public void close() {
      try {
        if (!batch.isEmpty()) {
          try (var lastBatch = createBatchInsertPreparedStatement(batch.size())) {
            flush(lastBatch);
          } catch (SQLException throwables) {
            throw new MbtilesQueryException("Error flushing batch", throwables);
          }
        }
      } finally {
        try {
          batchStatement.close();
        } catch (SQLException throwables) {
          LOGGER.warn("Error closing prepared statement", throwables);
        }
      }
    }
  }
}
