package com.streamfirst.tokenindex.adapters.sqlite;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema of the CID cache.
 *
 * <pre>
 * CREATE TABLE cid_tokens
 *  (cid TEXT PRIMARY KEY,
 *   content TEXT NOT NULL,
 *   token_level INTEGER,
 *   token_number INTEGER)
 * </pre>
 */
public final class CidCacheSchema {

  public static final String TABLE = "cid_tokens";

  /** Stays below SQLite's default limit on bound parameters per statement. */
  public static final int MAX_PARAMETERS = 900;

  public static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS " + TABLE + " (\n"
          + "  cid TEXT PRIMARY KEY,\n"
          + "  content TEXT NOT NULL,\n"
          + "  token_level INTEGER,\n"
          + "  token_number INTEGER)";

  public static final String CREATE_LEVEL_NUMBER_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_cid_tokens_level_number ON " + TABLE + " (token_level, token_number)";

  public static final String INSERT_IF_ABSENT =
      "INSERT OR IGNORE INTO " + TABLE + " (cid, content, token_level, token_number) VALUES (?, ?, ?, ?)";

  public static final String SELECT_COLUMNS = "SELECT cid, content, token_level, token_number FROM " + TABLE;

  public static final String SELECT_BY_CID = SELECT_COLUMNS + " WHERE cid = ?";

  public static final String COUNT = "SELECT COUNT(*) FROM " + TABLE;

  private CidCacheSchema() {
  }

  /** {@code SELECT ... WHERE cid IN (?, ?, ...)} with {@code n} placeholders. */
  static String selectByCids(int n) {
    StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE cid IN (");
    for (int i = 0; i < n; i++) {
      sql.append(i == 0 ? "?" : ", ?");
    }
    return sql.append(')').toString();
  }

  static void create(Connection con) throws SQLException {
    try (Statement stmt = con.createStatement()) {
      stmt.execute(CREATE_TABLE);
      stmt.execute(CREATE_LEVEL_NUMBER_INDEX);
    }
  }
}
