package com.streamfirst.tokenindex.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.tokenindex.adapters.InMemoryHashIndexAdapter;
import com.streamfirst.tokenindex.domain.HashIndexEntry;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HashIndexServiceTest {

    private InMemoryHashIndexAdapter index;
    private HashIndexService service;

    @BeforeEach
    void setUp() {
        index = new InMemoryHashIndexAdapter();
        service = new HashIndexService(index, 500, 3);
    }

    @Test
    void range_build_indexes_every_number_under_its_canonical_level() {
        var report = service.buildRange(TokenLevel.LEVEL_1, 2_425_000, 2_426_000);

        assertThat(report.getHashed()).isEqualTo(1_001);
        assertThat(report.getInserted()).isEqualTo(1_001);
        assertThat(report.isSuccessful()).isTrue();
        assertThat(service.lookup(TokenHash.of(2_425_000)))
                .contains(new TokenKey(TokenLevel.LEVEL_2, 2_425_000));
        assertThat(service.lookup(TokenHash.of(2_425_001)))
                .contains(new TokenKey(TokenLevel.LEVEL_1, 2_425_001));
    }

    @Test
    void rerun_completes_a_partial_range_without_duplicates() {
        service.buildRange(TokenLevel.LEVEL_4, 1, 1_000);

        var report = service.buildRange(TokenLevel.LEVEL_4, 1, 3_000);

        assertThat(report.getInserted()).isEqualTo(2_000);
        assertThat(index.count()).isEqualTo(3_000);
    }

    @Test
    void range_end_is_clamped_and_bad_starts_are_rejected() {
        long limit = TokenLevel.LEVEL_4.limit();

        var report = service.buildRange(TokenLevel.LEVEL_4, limit - 4, limit + 100);

        assertThat(report.getHashed()).isEqualTo(5);
        assertThatThrownBy(() -> service.buildRange(TokenLevel.LEVEL_4, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.buildRange(TokenLevel.LEVEL_4, limit + 1, limit + 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failed_batches_are_reported() {
        index.failNextCommits(1);

        var report = service.buildRange(TokenLevel.LEVEL_3, 1, 1_200);

        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.getFailedBatches()).hasSize(1);
        assertThat(report.getWritten()).isEqualTo(1_200 - report.getFailedBatches().get(0).size());
    }

    @Test
    void failing_hash_worker_does_not_leave_the_writer_running() {
        InMemoryHashIndexAdapter broken =
                new InMemoryHashIndexAdapter() {
                    @Override
                    public long countNumbersBetween(long start, long end) {
                        throw new PersistenceException("disk I/O error");
                    }
                };
        var failing = new HashIndexService(broken, 500, 2);

        assertThatThrownBy(() -> failing.buildRange(TokenLevel.LEVEL_3, 1, 1_200))
                .isInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("disk I/O error");
        assertThat(BatchingWriterTest.liveThreadsNamed("hash-index-writer")).isZero();
    }

    @Test
    void complete_levels_are_skipped() {
        var complete =
                new InMemoryHashIndexAdapter() {
                    @Override
                    public long countNumbersBetween(long start, long end) {
                        return end - start + 1;
                    }
                };

        var report = new HashIndexService(complete, 500, 2).build(Set.of(), false);

        assertThat(report.getSkippedLevels()).containsExactlyInAnyOrder(TokenLevel.values());
        assertThat(report.getBuiltLevels()).isEmpty();
        assertThat(report.getHashed()).isZero();
    }

    @Test
    void verify_reports_missing_and_mismatched_entries() {
        index.putRaw(TokenHash.of(1), new TokenKey(TokenLevel.LEVEL_1, 1));

        var verification = service.verify(10);

        assertThat(verification.getMismatched()).isEqualTo(1);
        assertThat(verification.getMissing()).isEqualTo(verification.getChecked() - 1);
        assertThat(verification.getExamples()).contains(1L);
        assertThat(verification.isHealthy()).isFalse();
    }

    @Test
    void verify_sample_is_deterministic_and_healthy_on_correct_index() {
        long[] sample = HashIndexService.numbersToVerify(25).toArray();
        for (long n : sample) {
            index.putAll(List.of(HashIndexEntry.derive(n)));
        }

        var verification = service.verify(25);

        assertThat(HashIndexService.numbersToVerify(25).toArray()).containsExactly(sample);
        assertThat(sample).contains(1L, 2_188_563L, 2_303_750L, 2_425_000L, 4_300_000L);
        assertThat(verification.getChecked()).isEqualTo(sample.length);
        assertThat(verification.isHealthy()).isTrue();
    }
}
