/*
 * Copyright 2024 The Contrail Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package contrail.sqlite;

import contrail.SpanId;
import contrail.SpanStoreException;
import contrail.internal.Nullable;
import contrail.internal.Platform;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Spans in a single-file SQLite database, shared by every thread and process that opens the same
 * path.
 *
 * <p>Each call runs one statement on its own connection, so updates to different spans never
 * interfere. The database uses write-ahead logging and waits for locks held by other processes
 * instead of failing immediately.
 *
 * <p>Methods that look up a span throw {@link IllegalArgumentException} when there is no span
 * with that ID. Database errors are rethrown as {@link SpanStoreException}.
 */
public final class SpanDatabase {
  static final String TABLE = "trace_spans";
  static final int BUSY_TIMEOUT_MILLIS = 30_000;
  // seconds since the unix epoch, as a real number
  static final String NOW = "(julianday('now') - 2440587.5) * 86400.0";

  static final String[] SCHEMA = {
    "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
      + "id BLOB PRIMARY KEY, "
      + "parent_id BLOB, "
      + "name TEXT NOT NULL, "
      + "data_json TEXT NOT NULL, "
      + "last_updated REAL"
      + ") WITHOUT ROWID",
    "CREATE INDEX IF NOT EXISTS " + TABLE + "_parent_id ON " + TABLE + " (parent_id)",
    "CREATE TRIGGER IF NOT EXISTS " + TABLE + "_inserted AFTER INSERT ON " + TABLE
      + " BEGIN UPDATE " + TABLE + " SET last_updated = " + NOW + " WHERE id = NEW.id; END",
    "CREATE TRIGGER IF NOT EXISTS " + TABLE + "_updated"
      + " AFTER UPDATE OF data_json, name, parent_id ON " + TABLE
      + " BEGIN UPDATE " + TABLE + " SET last_updated = " + NOW + " WHERE id = NEW.id; END"
  };

  /**
   * Opens the database at the path, creating the file, its parent directories and the schema as
   * needed.
   */
  public static SpanDatabase open(Path path) {
    if (path == null) throw new NullPointerException("path == null");
    SpanDatabase result = new SpanDatabase(path.toAbsolutePath());
    result.createSchema();
    return result;
  }

  final Path path;
  final String url;
  final SQLiteConfig config;

  SpanDatabase(Path path) {
    this.path = path;
    this.url = "jdbc:sqlite:" + path;
    this.config = new SQLiteConfig();
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
  }

  /** The absolute path of the database file. */
  public Path path() {
    return path;
  }

  void createSchema() {
    try {
      Path parent = path.getParent();
      if (parent != null) Files.createDirectories(parent);
    } catch (IOException e) {
      throw new SpanStoreException("could not create the directory of " + path, e);
    }
    try (Connection connection = connect(); Statement statement = connection.createStatement()) {
      for (String sql : SCHEMA) statement.executeUpdate(sql);
    } catch (SQLException e) {
      throw new SpanStoreException("could not create the schema of " + path, e);
    }
    Platform.get().log("opened span database {0}", path, null);
  }

  /**
   * Adds a span.
   *
   * @throws IllegalStateException if a span with that ID already exists
   */
  public void insert(SpanId id, @Nullable SpanId parentId, String name, String dataJson) {
    String sql = "INSERT INTO " + TABLE + " (id, parent_id, name, data_json) VALUES (?, ?, ?, ?)";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      bindRow(statement, id, parentId, name, dataJson);
      statement.executeUpdate();
    } catch (SQLException e) {
      if (isConstraintViolation(e)) {
        throw new IllegalStateException("span " + id + " already exists in " + path, e);
      }
      throw new SpanStoreException("could not insert span " + id + " into " + path, e);
    }
  }

  /**
   * Adds a span, or replaces the name and data of an existing one. The parent of an existing span
   * is kept.
   */
  public void insertOrUpdate(SpanId id, @Nullable SpanId parentId, String name, String dataJson) {
    String sql = "INSERT INTO " + TABLE + " (id, parent_id, name, data_json) VALUES (?, ?, ?, ?)"
      + " ON CONFLICT (id) DO UPDATE SET name = excluded.name, data_json = excluded.data_json";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      bindRow(statement, id, parentId, name, dataJson);
      statement.executeUpdate();
    } catch (SQLException e) {
      throw new SpanStoreException("could not upsert span " + id + " into " + path, e);
    }
  }

  /**
   * Adds a span unless one with that ID exists, in which case the existing span is left as is.
   *
   * @return false if the span already existed
   */
  public boolean insertIfAbsent(SpanId id, @Nullable SpanId parentId, String name,
    String dataJson) {
    String sql = "INSERT INTO " + TABLE + " (id, parent_id, name, data_json) VALUES (?, ?, ?, ?)"
      + " ON CONFLICT (id) DO NOTHING";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      bindRow(statement, id, parentId, name, dataJson);
      return statement.executeUpdate() == 1;
    } catch (SQLException e) {
      throw new SpanStoreException("could not insert span " + id + " into " + path, e);
    }
  }

  public boolean contains(SpanId id) {
    String sql = "SELECT 1 FROM " + TABLE + " WHERE id = ?";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setBytes(1, id.toBytes());
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next();
      }
    } catch (SQLException e) {
      throw new SpanStoreException("could not look up span " + id + " in " + path, e);
    }
  }

  public SpanRow getSpan(SpanId id) {
    String sql = "SELECT parent_id, name, data_json FROM " + TABLE + " WHERE id = ?";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setBytes(1, id.toBytes());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) throw missing(id);
        return new SpanRow(id, toSpanId(rs.getBytes(1)), rs.getString(2), rs.getString(3));
      }
    } catch (SQLException e) {
      throw new SpanStoreException("could not read span " + id + " from " + path, e);
    }
  }

  public String getName(SpanId id) {
    return (String) getColumn(id, "name");
  }

  public String getDataJson(SpanId id) {
    return (String) getColumn(id, "data_json");
  }

  /** Returns the parent of the span, or null if it is a root. */
  @Nullable public SpanId getParentId(SpanId id) {
    return toSpanId((byte[]) getColumn(id, "parent_id"));
  }

  /** Returns the IDs of spans without a parent, oldest first. */
  public List<SpanId> getRootIds() {
    return getIds("SELECT id FROM " + TABLE + " WHERE parent_id IS NULL ORDER BY id", null);
  }

  /** Returns the IDs of the span's children, oldest first. */
  public List<SpanId> getChildrenIds(SpanId parentId) {
    return getIds("SELECT id FROM " + TABLE + " WHERE parent_id = ? ORDER BY id",
      parentId.toBytes());
  }

  /** Returns the IDs of spans with the given name, oldest first. */
  public List<SpanId> getSpanIdsByName(String name) {
    return getIds("SELECT id FROM " + TABLE + " WHERE name = ? ORDER BY id", name);
  }

  /**
   * Merges a JSON object into the data of the span, as a JSON merge patch. The merge happens in
   * the database, so concurrent updates to different keys all survive.
   */
  public void updateDataJson(SpanId id, String patchJson) {
    String sql = "UPDATE " + TABLE + " SET data_json = json_patch(data_json, ?) WHERE id = ?";
    int updated;
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, patchJson);
      statement.setBytes(2, id.toBytes());
      updated = statement.executeUpdate();
    } catch (SQLException e) {
      throw new SpanStoreException("could not update span " + id + " in " + path, e);
    }
    if (updated == 0) throw missing(id);
  }

  /** Returns the span written most recently, or null if the database is empty. */
  @Nullable public LastUpdated getLastUpdated() {
    String sql = "SELECT id, last_updated FROM " + TABLE
      + " ORDER BY last_updated DESC, id DESC LIMIT 1";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql);
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next()) return null;
      return new LastUpdated(SpanId.fromBytes(rs.getBytes(1)), rs.getDouble(2));
    } catch (SQLException e) {
      throw new SpanStoreException("could not read the last update of " + path, e);
    }
  }

  /** Moves the write-ahead log into the database file, so that the file alone is complete. */
  public void checkpoint() {
    try (Connection connection = connect(); Statement statement = connection.createStatement()) {
      statement.execute("PRAGMA wal_checkpoint(TRUNCATE)");
    } catch (SQLException e) {
      throw new SpanStoreException("could not checkpoint " + path, e);
    }
  }

  Object getColumn(SpanId id, String column) {
    String sql = "SELECT " + column + " FROM " + TABLE + " WHERE id = ?";
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setBytes(1, id.toBytes());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) throw missing(id);
        return rs.getObject(1);
      }
    } catch (SQLException e) {
      throw new SpanStoreException("could not read " + column + " of span " + id, e);
    }
  }

  List<SpanId> getIds(String sql, @Nullable Object parameter) {
    try (Connection connection = connect();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      if (parameter != null) statement.setObject(1, parameter);
      try (ResultSet rs = statement.executeQuery()) {
        List<SpanId> result = new ArrayList<>();
        while (rs.next()) result.add(SpanId.fromBytes(rs.getBytes(1)));
        return result;
      }
    } catch (SQLException e) {
      throw new SpanStoreException("could not list spans in " + path, e);
    }
  }

  Connection connect() throws SQLException {
    return config.createConnection(url);
  }

  IllegalArgumentException missing(SpanId id) {
    return new IllegalArgumentException("span " + id + " is not in " + path);
  }

  static void bindRow(PreparedStatement statement, SpanId id, @Nullable SpanId parentId,
    String name, String dataJson) throws SQLException {
    if (name == null) throw new NullPointerException("name == null");
    if (dataJson == null) throw new NullPointerException("dataJson == null");
    statement.setBytes(1, id.toBytes());
    if (parentId != null) {
      statement.setBytes(2, parentId.toBytes());
    } else {
      statement.setNull(2, Types.BLOB);
    }
    statement.setString(3, name);
    statement.setString(4, dataJson);
  }

  static boolean isConstraintViolation(SQLException e) {
    return e instanceof SQLiteException
      && (e.getErrorCode() & 0xff) == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
  }

  @Nullable static SpanId toSpanId(@Nullable byte[] bytes) {
    return bytes != null ? SpanId.fromBytes(bytes) : null;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanDatabase)) return false;
    return path.equals(((SpanDatabase) o).path);
  }

  @Override public int hashCode() {
    return path.hashCode();
  }

  @Override public String toString() {
    return "SpanDatabase{path=" + path + "}";
  }
}
