package com.streamfirst.tokenindex.perf;

import com.streamfirst.tokenindex.adapters.InMemoryCidCacheAdapter;
import com.streamfirst.tokenindex.adapters.InMemoryContentNetworkAdapter;
import com.streamfirst.tokenindex.application.BatchLookupResult;
import com.streamfirst.tokenindex.application.TokenLookupService;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.TokenContent;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
public class TokenLookupBenchmark {

  private static final int TOKENS = 100_000;

  private TokenLookupService lookup;
  private Cid hot;
  private Cid missing;
  private List<String> batch;

  @Setup
  public void setup() {
    InMemoryCidCacheAdapter store = new InMemoryCidCacheAdapter();
    List<CidCacheEntry> entries = new ArrayList<>(TOKENS);
    for (long n = 1; n <= TOKENS; n++) {
      TokenKey key = new TokenKey(TokenLevel.LEVEL_1, n);
      entries.add(CidCacheEntry.of(InMemoryContentNetworkAdapter.cidOf(TokenContent.of(key).encoded()), key));
    }
    store.insertIfAbsent(entries);
    lookup = new TokenLookupService(store, 10_000, 10_000);
    hot = entries.get(4242).cid();
    missing = Cid.of("QmMissingMissingMissingMissingMissingMissingMis");
    batch = new ArrayList<>();
    for (int i = 0; i < 1_000; i++) {
      batch.add(entries.get(i * 97).cid().value());
    }
  }

  @Benchmark
  public Optional<CidCacheEntry> get_one_hit() {
    return lookup.getOne(hot);
  }

  @Benchmark
  public Optional<CidCacheEntry> get_one_miss() {
    return lookup.getOne(missing);
  }

  @Benchmark
  public BatchLookupResult get_batch_1000() {
    return lookup.getBatch(batch);
  }
}
