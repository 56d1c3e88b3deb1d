package com.streamfirst.tokenindex.adapters.sqlite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.LedgerToken;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.TokenStatus;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteLedgerStoreAdapterTest {

  @TempDir Path dir;

  private Path ledgerFile;

  @BeforeEach
  void setUp() throws Exception {
    ledgerFile = dir.resolve("rubix.db");
    try (Connection con = DriverManager.getConnection("jdbc:sqlite:" + ledgerFile);
        Statement stmt = con.createStatement()) {
      stmt.execute("CREATE TABLE TokensTable (token_id TEXT, token_status INTEGER, token_value REAL)");
      stmt.execute("INSERT INTO TokensTable VALUES ('QmPendingA', 0, 1.0)");
      stmt.execute("INSERT INTO TokensTable VALUES (' QmPendingB ', 0, 1.0)");
      stmt.execute("INSERT INTO TokensTable VALUES ('QmSettled', 1, 1.0)");
    }
  }

  @Test
  void lists_only_pending_tokens() {
    try (var ledger = new SqliteLedgerStoreAdapter(ledgerFile)) {
      assertThat(ledger.pendingTokens())
          .extracting(LedgerToken::cid)
          .containsExactlyInAnyOrder(Cid.of("QmPendingA"), Cid.of("QmPendingB"));
    }
  }

  @Test
  void updates_status_even_when_stored_id_has_whitespace() {
    try (var ledger = new SqliteLedgerStoreAdapter(ledgerFile)) {
      assertThat(ledger.updateStatus(Cid.of("QmPendingB"), TokenStatus.REJECTED)).isTrue();
      assertThat(ledger.updateStatus(Cid.of("QmUnknown"), TokenStatus.REJECTED)).isFalse();

      assertThat(ledger.pendingTokens())
          .extracting(LedgerToken::cid)
          .containsExactly(Cid.of("QmPendingA"));
    }
  }

  @Test
  void refuses_missing_ledger_file() {
    assertThatThrownBy(() -> new SqliteLedgerStoreAdapter(dir.resolve("absent.db")))
        .isInstanceOf(PersistenceException.class);
  }
}
