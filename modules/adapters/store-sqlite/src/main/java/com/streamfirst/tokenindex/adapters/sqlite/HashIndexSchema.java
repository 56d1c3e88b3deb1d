package com.streamfirst.tokenindex.adapters.sqlite;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema of the reverse hash index.
 *
 * <pre>
 * CREATE TABLE token_hashes
 *  (hash TEXT PRIMARY KEY,
 *   token_level INTEGER NOT NULL,
 *   token_number INTEGER NOT NULL,
 *   cid TEXT,
 *   content TEXT)
 * </pre>
 *
 * <p>{@code cid} and {@code content} are kept for databases built by earlier tooling and are
 * written as NULL. {@code token_level} is the canonical level of the number.
 */
public final class HashIndexSchema {

  public static final String TABLE = "token_hashes";

  public static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS " + TABLE + " (\n"
          + "  hash TEXT PRIMARY KEY,\n"
          + "  token_level INTEGER NOT NULL,\n"
          + "  token_number INTEGER NOT NULL,\n"
          + "  cid TEXT,\n"
          + "  content TEXT)";

  public static final String CREATE_LEVEL_NUMBER_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_token_level_number ON " + TABLE + " (token_level, token_number)";

  public static final String INSERT_IF_ABSENT =
      "INSERT OR IGNORE INTO " + TABLE + " (hash, token_level, token_number) VALUES (?, ?, ?)";

  public static final String SELECT_BY_HASH =
      "SELECT token_level, token_number FROM " + TABLE + " WHERE hash = ?";

  public static final String COUNT = "SELECT COUNT(*) FROM " + TABLE;

  public static final String COUNT_NUMBERS_BETWEEN =
      "SELECT COUNT(*) FROM " + TABLE + " WHERE token_number BETWEEN ? AND ?";

  public static final String DELETE_ALL = "DELETE FROM " + TABLE;

  private HashIndexSchema() {
  }

  static void create(Connection con) throws SQLException {
    try (Statement stmt = con.createStatement()) {
      stmt.execute(CREATE_TABLE);
      stmt.execute(CREATE_LEVEL_NUMBER_INDEX);
    }
  }
}
