package com.streamfirst.tokenindex.perf;

import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.TokenContent;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
public class TokenHashBenchmark {

  private long number;
  private String content;

  @Setup
  public void setup() {
    number = 1_423_543L;
    content = TokenContent.of(new TokenKey(TokenLevel.LEVEL_2, number)).encoded();
  }

  @Benchmark
  public HashIndexEntry derive_entry() {
    return HashIndexEntry.derive(number++ % TokenLevel.maxLimit() + 1);
  }

  @Benchmark
  public TokenContent decode_content() {
    return TokenContent.decode(content);
  }
}
