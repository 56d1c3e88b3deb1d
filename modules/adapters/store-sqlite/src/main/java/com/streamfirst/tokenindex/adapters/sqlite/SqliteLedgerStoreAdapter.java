package com.streamfirst.tokenindex.adapters.sqlite;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.LedgerToken;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.TokenStatus;
import com.streamfirst.tokenindex.ports.LedgerStorePort;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and updates the {@code TokensTable} of one node's ledger database. The table belongs to
 * the ledger; this adapter never creates or alters it.
 */
@Slf4j
public class SqliteLedgerStoreAdapter implements LedgerStorePort {

  static final String SELECT_BY_STATUS =
      "SELECT token_id, token_status FROM TokensTable WHERE token_status = ?";

  static final String UPDATE_STATUS =
      "UPDATE TokensTable SET token_status = ? WHERE TRIM(token_id) = ?";

  private final SqliteConnections connections;

  public SqliteLedgerStoreAdapter(Path ledgerDatabase) {
    if (!Files.isRegularFile(ledgerDatabase)) {
      throw new PersistenceException("Ledger database not found: " + ledgerDatabase);
    }
    this.connections = new SqliteConnections(ledgerDatabase, false);
  }

  @Override
  public List<LedgerToken> pendingTokens() {
    return connections.read("select pending tokens", con -> {
      List<LedgerToken> tokens = new ArrayList<>();
      try (PreparedStatement stmt = con.prepareStatement(SELECT_BY_STATUS)) {
        stmt.setInt(1, TokenStatus.PENDING);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            String tokenId = rs.getString(1);
            if (tokenId == null || tokenId.isBlank()) {
              log.warn("Skipping ledger row with empty token_id in {}", connections.getDatabase());
              continue;
            }
            tokens.add(new LedgerToken(Cid.of(tokenId), rs.getInt(2)));
          }
        }
      }
      return tokens;
    });
  }

  @Override
  public boolean updateStatus(Cid cid, int status) {
    return connections.inTransaction("update status of " + cid, con -> {
      try (PreparedStatement stmt = con.prepareStatement(UPDATE_STATUS)) {
        stmt.setInt(1, status);
        stmt.setString(2, cid.value());
        return stmt.executeUpdate() > 0;
      }
    });
  }

  @Override
  public void close() {
    connections.close();
  }
}
