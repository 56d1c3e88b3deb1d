package com.streamfirst.tokenindex.boot.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.tokenindex.adapters.InMemoryHashIndexAdapter;
import com.streamfirst.tokenindex.application.HashIndexService;
import com.streamfirst.tokenindex.domain.TokenHash;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import picocli.CommandLine;

class HashIndexCommandTest {

    private InMemoryHashIndexAdapter index;
    private CommandLine cli;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        index = new InMemoryHashIndexAdapter();
        HashIndexService service = new HashIndexService(index, 50, 2);
        StaticListableBeanFactory beans = new StaticListableBeanFactory(Map.of("hashIndexService", service));
        cli = new CommandLine(new HashIndexCommand(beans.getBeanProvider(HashIndexService.class)));
        out = new StringWriter();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(new StringWriter()));
    }

    @Test
    void build_range_indexes_requested_numbers() {
        int exit = cli.execute("build", "--level", "1", "--start", "1", "--end", "120");

        assertThat(exit).isZero();
        assertThat(index.count()).isEqualTo(120);
        assertThat(index.find(TokenHash.of(77))).contains(new TokenKey(TokenLevel.LEVEL_4, 77));
        assertThat(out.toString()).contains("inserted: 120");
    }

    @Test
    void range_needs_exactly_one_level() {
        assertThat(cli.execute("build", "--start", "1", "--end", "10")).isEqualTo(2);
        assertThat(cli.execute("build", "--level", "1", "--level", "2", "--start", "1", "--end", "10"))
                .isEqualTo(2);
        assertThat(index.count()).isZero();
    }

    @Test
    void unknown_level_is_a_usage_error() {
        assertThat(cli.execute("build", "--level", "5")).isEqualTo(2);
    }

    @Test
    void verify_fails_on_missing_numbers() {
        int exit = cli.execute("verify", "--sample", "10");

        assertThat(exit).isEqualTo(1);
        assertThat(out.toString()).contains("missing:");
    }

    @Test
    void sample_and_full_are_exclusive() {
        assertThat(cli.execute("verify", "--sample", "10", "--full")).isEqualTo(2);
    }

    @Test
    void bare_group_command_is_a_usage_error() {
        assertThat(cli.execute()).isEqualTo(2);
    }
}
