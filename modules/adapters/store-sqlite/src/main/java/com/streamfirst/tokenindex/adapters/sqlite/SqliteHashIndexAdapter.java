package com.streamfirst.tokenindex.adapters.sqlite;

import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.ports.HashIndexPort;
import lombok.extern.slf4j.Slf4j;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

/**
 * SQLite implementation of HashIndexPort over {@link HashIndexSchema}.
 */
@Slf4j
public class SqliteHashIndexAdapter implements HashIndexPort {

  private final SqliteConnections connections;

  public SqliteHashIndexAdapter(SqliteConnections connections) {
    this.connections = connections;
    connections.inTransaction("create hash index schema", con -> {
      HashIndexSchema.create(con);
      return null;
    });
    log.info("Hash index ready at {}", connections.getDatabase());
  }

  @Override
  public int putAll(List<HashIndexEntry> entries) {
    if (entries.isEmpty()) {
      return 0;
    }
    return connections.inTransaction("insert " + entries.size() + " hash entries", con -> {
      try (PreparedStatement stmt = con.prepareStatement(HashIndexSchema.INSERT_IF_ABSENT)) {
        for (HashIndexEntry entry : entries) {
          stmt.setString(1, entry.hash().hex());
          stmt.setInt(2, entry.key().level().code());
          stmt.setLong(3, entry.key().number());
          stmt.addBatch();
        }
        return sumUpdates(stmt.executeBatch());
      }
    });
  }

  @Override
  public Optional<TokenKey> find(TokenHash hash) {
    return connections.read("lookup " + hash, con -> {
      try (PreparedStatement stmt = con.prepareStatement(HashIndexSchema.SELECT_BY_HASH)) {
        stmt.setString(1, hash.hex());
        try (ResultSet rs = stmt.executeQuery()) {
          if (!rs.next()) {
            return Optional.empty();
          }
          return Optional.of(TokenKey.of(rs.getInt(1), rs.getLong(2)));
        }
      }
    });
  }

  @Override
  public long count() {
    return connections.read("count hash entries", con -> {
      try (Statement stmt = con.createStatement();
        ResultSet rs = stmt.executeQuery(HashIndexSchema.COUNT)) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    });
  }

  @Override
  public long countNumbersBetween(long start, long end) {
    return connections.read("count numbers " + start + ".." + end, con -> {
      try (PreparedStatement stmt = con.prepareStatement(HashIndexSchema.COUNT_NUMBERS_BETWEEN)) {
        stmt.setLong(1, start);
        stmt.setLong(2, end);
        try (ResultSet rs = stmt.executeQuery()) {
          return rs.next() ? rs.getLong(1) : 0L;
        }
      }
    });
  }

  @Override
  public void clear() {
    int removed = connections.inTransaction("clear hash index", con -> {
      try (Statement stmt = con.createStatement()) {
        return stmt.executeUpdate(HashIndexSchema.DELETE_ALL);
      }
    });
    log.info("Cleared {} hash entries", removed);
  }

  static int sumUpdates(int[] counts) {
    int total = 0;
    for (int c : counts) {
      if (c > 0) {
        total += c;
      }
    }
    return total;
  }
}
