package com.streamfirst.tokenindex.adapters.sqlite;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.ports.CidCachePort;
import lombok.extern.slf4j.Slf4j;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite implementation of CidCachePort over {@link CidCacheSchema}.
 * Multi-key reads are split into statements of at most {@link CidCacheSchema#MAX_PARAMETERS} keys.
 */
@Slf4j
public class SqliteCidCacheAdapter implements CidCachePort {

  private final SqliteConnections connections;

  public SqliteCidCacheAdapter(SqliteConnections connections) {
    this.connections = connections;
    connections.inTransaction("create cid cache schema", con -> {
      CidCacheSchema.create(con);
      return null;
    });
    log.info("CID cache ready at {}", connections.getDatabase());
  }

  @Override
  public int insertIfAbsent(List<CidCacheEntry> entries) {
    if (entries.isEmpty()) {
      return 0;
    }
    return connections.inTransaction("insert " + entries.size() + " cache entries", con -> {
      try (PreparedStatement stmt = con.prepareStatement(CidCacheSchema.INSERT_IF_ABSENT)) {
        for (CidCacheEntry entry : entries) {
          stmt.setString(1, entry.cid().value());
          stmt.setString(2, entry.content());
          stmt.setInt(3, entry.level());
          stmt.setLong(4, entry.number());
          stmt.addBatch();
        }
        return SqliteHashIndexAdapter.sumUpdates(stmt.executeBatch());
      }
    });
  }

  @Override
  public Optional<CidCacheEntry> find(Cid cid) {
    return connections.read("lookup " + cid, con -> {
      try (PreparedStatement stmt = con.prepareStatement(CidCacheSchema.SELECT_BY_CID)) {
        stmt.setString(1, cid.value());
        try (ResultSet rs = stmt.executeQuery()) {
          return rs.next() ? Optional.of(toEntry(rs)) : Optional.empty();
        }
      }
    });
  }

  @Override
  public Map<Cid, CidCacheEntry> findAll(Collection<Cid> cids) {
    List<Cid> keys = new ArrayList<>(new LinkedHashSet<>(cids));
    Map<Cid, CidCacheEntry> found = new HashMap<>();
    if (keys.isEmpty()) {
      return found;
    }
    return connections.read("lookup " + keys.size() + " cids", con -> {
      for (int from = 0; from < keys.size(); from += CidCacheSchema.MAX_PARAMETERS) {
        List<Cid> chunk = keys.subList(from, Math.min(keys.size(), from + CidCacheSchema.MAX_PARAMETERS));
        try (PreparedStatement stmt = con.prepareStatement(CidCacheSchema.selectByCids(chunk.size()))) {
          for (int i = 0; i < chunk.size(); i++) {
            stmt.setString(i + 1, chunk.get(i).value());
          }
          try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
              CidCacheEntry entry = toEntry(rs);
              found.put(entry.cid(), entry);
            }
          }
        }
      }
      return found;
    });
  }

  @Override
  public long count() {
    return connections.read("count cache entries", con -> {
      try (Statement stmt = con.createStatement();
        ResultSet rs = stmt.executeQuery(CidCacheSchema.COUNT)) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    });
  }

  private static CidCacheEntry toEntry(ResultSet rs) throws SQLException {
    return new CidCacheEntry(Cid.of(rs.getString(1)), rs.getString(2), rs.getInt(3), rs.getLong(4));
  }
}
