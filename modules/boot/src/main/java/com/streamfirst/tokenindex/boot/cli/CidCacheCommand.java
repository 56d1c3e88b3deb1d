package com.streamfirst.tokenindex.boot.cli;

import com.streamfirst.tokenindex.adapters.ipfs.IpfsContentNetworkFactory;
import com.streamfirst.tokenindex.adapters.ipfs.IpfsPathResolver;
import com.streamfirst.tokenindex.application.CidCacheBuildReport;
import com.streamfirst.tokenindex.application.CidCacheBuilder;
import com.streamfirst.tokenindex.boot.TokenIndexProperties;
import com.streamfirst.tokenindex.domain.TokenIndexException;
import com.streamfirst.tokenindex.domain.TokenLevel;
import com.streamfirst.tokenindex.ports.CidCachePort;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Slf4j
@Component
@Command(
        name = "cid-cache",
        mixinStandardHelpOptions = true,
        description = "Maintains the CID to token cache.",
        subcommands = CidCacheCommand.Build.class)
public class CidCacheCommand implements Runnable {

    @Spec CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    @Component
    @RequiredArgsConstructor
    @Command(
            name = "build",
            mixinStandardHelpOptions = true,
            description = "Compute the CID of every token in a range and record it in the cache.")
    public static class Build implements Callable<Integer> {

        private final TokenIndexProperties props;
        private final ObjectProvider<CidCachePort> cache;
        private final ObjectProvider<IpfsContentNetworkFactory> networks;
        private final ObjectProvider<IpfsPathResolver> pathResolver;

        @Spec CommandSpec spec;

        @Option(names = "--level", required = true, paramLabel = "N", converter = LevelConverter.class, description = "Token level (1-4).")
        TokenLevel level;

        @Option(names = "--start", required = true, paramLabel = "N", description = "First token number.")
        long start;

        @Option(names = "--end", required = true, paramLabel = "N", description = "Last token number; clamped to the level limit.")
        long end;

        @Option(names = "--workers", paramLabel = "N", description = "Producer threads (default: processors - 1).")
        Integer workers;

        @Option(names = "--batch-size", paramLabel = "N", description = "Rows per commit.")
        Integer batchSize;

        @Option(names = "--ipfs-path", paramLabel = "DIR", description = "IPFS repository; overrides IPFS_PATH.")
        String ipfsPath;

        @Option(names = "--config", paramLabel = "FILE", description = "File with an IPFS_PATH= line, used when nothing else sets it.")
        Path configFile;

        @Option(names = "--api-url", paramLabel = "URL", description = "IPFS API base URL; skips the repository lookup.")
        String apiUrl;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            ContentNetworkPort network;
            try {
                network = connect();
            } catch (TokenIndexException e) {
                log.error("Cannot reach the storage network: {}", e.getMessage());
                err.println(e.getMessage());
                err.flush();
                return 1;
            }

            TokenIndexProperties.CidCache cfg = props.getCidCache();
            int workerCount = workers != null ? workers : (cfg.getWorkers() > 0 ? cfg.getWorkers() : CidCacheBuilder.defaultWorkers());
            int rowsPerBatch = batchSize != null ? batchSize : cfg.getBatchSize();
            CidCacheBuilder builder =
                    new CidCacheBuilder(network, cache.getObject(), cfg.getQueueCapacity(), cfg.isOnlyHash());

            CidCacheBuildReport report;
            try {
                report = builder.build(level, start, end, workerCount, rowsPerBatch);
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                err.flush();
                return 2;
            }

            PrintWriter out = spec.commandLine().getOut();
            out.printf(
                    "level %s, numbers %d..%d: requested %d, added %d, add failures %d, inserted %d, %.1f tokens/s%n",
                    report.getLevel(),
                    report.getStart(),
                    report.getEnd(),
                    report.getRequested(),
                    report.getAdded(),
                    report.getAddFailures(),
                    report.getInserted(),
                    report.tokensPerSecond());
            report.getFailedBatches()
                    .forEach(b -> out.printf("FAILED batch %d..%d (%d rows): %s%n", b.firstKey(), b.lastKey(), b.size(), b.error()));
            out.flush();
            return report.isSuccessful() ? 0 : 1;
        }

        private ContentNetworkPort connect() {
            String url = apiUrl != null ? apiUrl : props.getIpfs().getApiUrl();
            if (url != null && !url.isBlank()) {
                return networks.getObject().forEndpoint(URI.create(url));
            }
            String explicit = ipfsPath != null ? ipfsPath : props.getIpfs().getPath();
            Path config = configFile != null ? configFile : props.getIpfs().getConfigFile();
            Path repository = pathResolver.getObject().resolve(explicit, config);
            log.info("Using IPFS repository {}", repository);
            return networks.getObject().forRepository(repository);
        }
    }
}
