package com.streamfirst.tokenindex.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.tokenindex.adapters.InMemoryCidCacheAdapter;
import com.streamfirst.tokenindex.adapters.InMemoryContentNetworkAdapter;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.TokenContent;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CidCacheBuilderTest {

    private InMemoryContentNetworkAdapter network;
    private InMemoryCidCacheAdapter cache;
    private CidCacheBuilder builder;

    @BeforeEach
    void setUp() {
        network = new InMemoryContentNetworkAdapter();
        cache = new InMemoryCidCacheAdapter();
        builder = new CidCacheBuilder(network, cache, 64, true);
    }

    @Test
    void caches_cid_and_content_of_every_number_in_range() {
        var report = builder.build(TokenLevel.LEVEL_2, 1, 1_000, 4, 100);

        assertThat(report.getRequested()).isEqualTo(1_000);
        assertThat(report.getAdded()).isEqualTo(1_000);
        assertThat(report.getWritten()).isEqualTo(1_000);
        assertThat(report.getInserted()).isEqualTo(1_000);
        assertThat(report.isSuccessful()).isTrue();
        assertThat(cache.count()).isEqualTo(1_000);
        assertThat(cache.getAllEntries())
                .allSatisfy(
                        entry -> {
                            assertThat(entry.isConsistent()).isTrue();
                            assertThat(entry.level()).isEqualTo(2);
                            assertThat(entry.cid())
                                    .isEqualTo(InMemoryContentNetworkAdapter.cidOf(entry.content()));
                        });
    }

    @Test
    void only_hash_mode_leaves_network_untouched() {
        builder.build(TokenLevel.LEVEL_1, 1, 10, 2, 5);

        assertThat(network.getPins()).isEmpty();
    }

    @Test
    void end_is_clamped_to_level_limit() {
        long limit = TokenLevel.LEVEL_4.limit();

        var report = builder.build(TokenLevel.LEVEL_4, limit - 9, limit + 1_000, 3, 4);

        assertThat(report.getEnd()).isEqualTo(limit);
        assertThat(report.getRequested()).isEqualTo(10);
        assertThat(cache.count()).isEqualTo(10);
    }

    @Test
    void rejects_invalid_ranges() {
        long limit = TokenLevel.LEVEL_3.limit();

        assertThatThrownBy(() -> builder.build(TokenLevel.LEVEL_3, 0, 10, 1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(TokenLevel.LEVEL_3, 20, 10, 1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(TokenLevel.LEVEL_3, limit + 1, limit + 10, 1, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void add_failures_skip_the_token_and_are_counted() {
        String bad = TokenContent.of(new TokenKey(TokenLevel.LEVEL_1, 7)).encoded();
        network.failAddsWhere(bad::equals);

        var report = builder.build(TokenLevel.LEVEL_1, 1, 50, 2, 10);

        assertThat(report.getAddFailures()).isEqualTo(1);
        assertThat(report.getAdded()).isEqualTo(49);
        assertThat(report.getWritten()).isEqualTo(49);
        assertThat(cache.getAllEntries()).extracting(CidCacheEntry::number).doesNotContain(7L);
    }

    @Test
    void failed_batch_is_reported_and_rerun_fills_the_gap() {
        cache.failCommitsContaining(entry -> entry.number() == 250);

        var first = builder.build(TokenLevel.LEVEL_1, 1, 500, 1, 100);

        assertThat(first.isSuccessful()).isFalse();
        var failed = first.getFailedBatches().get(0);
        assertThat(failed.firstKey()).isLessThanOrEqualTo(250);
        assertThat(failed.lastKey()).isGreaterThanOrEqualTo(250);
        assertThat(first.getWritten()).isEqualTo(500 - failed.size());

        cache.failCommitsContaining(entry -> false);
        var rerun = builder.build(TokenLevel.LEVEL_1, failed.firstKey(), failed.lastKey(), 1, 100);

        assertThat(rerun.getInserted()).isEqualTo(failed.size());
        assertThat(cache.count()).isEqualTo(500);
    }

    @Test
    void crashing_worker_fails_the_build_and_stops_the_writer() {
        String poison = TokenContent.of(new TokenKey(TokenLevel.LEVEL_1, 5)).encoded();
        InMemoryContentNetworkAdapter crashing =
                new InMemoryContentNetworkAdapter() {
                    @Override
                    public Cid add(String content, boolean onlyHash) {
                        if (content.equals(poison)) {
                            throw new IllegalStateException("malformed add response");
                        }
                        return super.add(content, onlyHash);
                    }
                };
        var crashingBuilder = new CidCacheBuilder(crashing, cache, 64, true);

        assertThatThrownBy(() -> crashingBuilder.build(TokenLevel.LEVEL_1, 1, 10, 1, 100))
                .isInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("malformed add response");
        assertThat(BatchingWriterTest.liveThreadsNamed("cid-cache-writer")).isZero();
    }
}
