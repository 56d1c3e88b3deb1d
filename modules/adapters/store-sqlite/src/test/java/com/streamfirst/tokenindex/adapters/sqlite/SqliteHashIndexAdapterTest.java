package com.streamfirst.tokenindex.adapters.sqlite;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteHashIndexAdapterTest {

  @TempDir Path dir;

  private SqliteConnections connections;
  private SqliteHashIndexAdapter index;

  @BeforeEach
  void setUp() {
    connections = new SqliteConnections(dir.resolve("token_hashes.db"));
    index = new SqliteHashIndexAdapter(connections);
  }

  @AfterEach
  void tearDown() {
    connections.close();
  }

  @Test
  void stores_and_resolves_by_hash() {
    index.putAll(List.of(HashIndexEntry.derive(1_423_543)));

    assertThat(index.find(TokenHash.of(1_423_543)))
        .contains(new TokenKey(TokenLevel.LEVEL_4, 1_423_543));
    assertThat(index.find(TokenHash.of(7))).isEmpty();
  }

  @Test
  void insert_is_idempotent_and_counts_only_new_rows() {
    List<HashIndexEntry> first = entries(1, 100);
    List<HashIndexEntry> overlapping = entries(51, 150);

    assertThat(index.putAll(first)).isEqualTo(100);
    assertThat(index.putAll(overlapping)).isEqualTo(50);
    assertThat(index.count()).isEqualTo(150);
    assertThat(index.countNumbersBetween(40, 60)).isEqualTo(21);
  }

  @Test
  void clear_removes_everything() {
    index.putAll(entries(1, 10));

    index.clear();

    assertThat(index.count()).isZero();
  }

  @Test
  void data_survives_reopen() {
    index.putAll(entries(1, 5));
    connections.close();

    try (SqliteConnections reopened = new SqliteConnections(dir.resolve("token_hashes.db"))) {
      assertThat(new SqliteHashIndexAdapter(reopened).count()).isEqualTo(5);
    }
  }

  private static List<HashIndexEntry> entries(long from, long to) {
    return LongStream.rangeClosed(from, to)
        .mapToObj(HashIndexEntry::derive)
        .collect(Collectors.toList());
  }
}
