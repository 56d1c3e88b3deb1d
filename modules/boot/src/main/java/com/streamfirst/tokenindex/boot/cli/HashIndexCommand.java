package com.streamfirst.tokenindex.boot.cli;

import com.streamfirst.tokenindex.application.HashIndexBuildReport;
import com.streamfirst.tokenindex.application.HashIndexService;
import com.streamfirst.tokenindex.application.HashIndexVerification;
import com.streamfirst.tokenindex.domain.TokenLevel;
import java.io.PrintWriter;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Component
@RequiredArgsConstructor
@Command(
        name = "hash-index",
        mixinStandardHelpOptions = true,
        description = "Builds or verifies the SHA-256 reverse index of token numbers.")
public class HashIndexCommand implements Runnable {

    private final ObjectProvider<HashIndexService> service;

    @Spec CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    @Command(name = "build", mixinStandardHelpOptions = true, description = "Index every number of the given levels.")
    int build(
            @Option(
                            names = "--level",
                            paramLabel = "N",
                            converter = LevelConverter.class,
                            description = "Level to index (1-4); repeatable. Default: all levels.")
                    List<TokenLevel> levels,
            @Option(names = "--force", description = "Clear the index first instead of resuming.")
                    boolean force,
            @Option(names = "--start", paramLabel = "N", description = "First number; requires one --level and --end.")
                    Long start,
            @Option(names = "--end", paramLabel = "N", description = "Last number; clamped to the level limit.")
                    Long end) {
        PrintWriter out = spec.commandLine().getOut();
        List<TokenLevel> requested = levels == null ? List.of() : levels;

        HashIndexBuildReport report;
        if (start != null || end != null) {
            if (start == null || end == null || requested.size() != 1) {
                throw new ParameterException(
                        spec.commandLine(), "--start and --end must be given together with exactly one --level");
            }
            if (force) {
                throw new ParameterException(spec.commandLine(), "--force cannot be combined with a range");
            }
            try {
                report = service.getObject().buildRange(requested.get(0), start, end);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage());
            }
        } else {
            report = service.getObject().build(Set.copyOf(requested), force);
        }

        out.printf(
                "levels built: %s, skipped: %s%nhashed: %d, written: %d, inserted: %d, elapsed: %s%n",
                report.getBuiltLevels(),
                report.getSkippedLevels(),
                report.getHashed(),
                report.getWritten(),
                report.getInserted(),
                report.getElapsed());
        report.getFailedBatches()
                .forEach(b -> out.printf("FAILED batch %d..%d (%d rows): %s%n", b.firstKey(), b.lastKey(), b.size(), b.error()));
        out.flush();
        return report.isSuccessful() ? 0 : 1;
    }

    @Command(name = "verify", mixinStandardHelpOptions = true, description = "Compare the index with freshly derived hashes.")
    int verify(@ArgGroup(exclusive = true) SampleOptions sampleOptions) {
        int sampleSize = sampleOptions == null ? SampleOptions.DEFAULT_SAMPLE : sampleOptions.sampleSize();
        HashIndexVerification result = service.getObject().verify(sampleSize);

        PrintWriter out = spec.commandLine().getOut();
        out.printf(
                "checked: %d, missing: %d, mismatched: %d, indexed rows: %d of %d%n",
                result.getChecked(),
                result.getMissing(),
                result.getMismatched(),
                result.getIndexedCount(),
                result.getExpectedCount());
        if (!result.getExamples().isEmpty()) {
            out.println("examples: " + result.getExamples());
        }
        out.flush();
        return result.isHealthy() ? 0 : 1;
    }

    static class SampleOptions {
        static final int DEFAULT_SAMPLE = 1000;

        @Option(names = "--sample", paramLabel = "N", description = "Random numbers to check besides the level bounds (default 1000).")
        Integer sample;

        @Option(names = "--full", description = "Check every number.")
        boolean full;

        int sampleSize() {
            if (full) {
                return 0;
            }
            return sample == null ? DEFAULT_SAMPLE : Math.max(1, sample);
        }
    }
}
