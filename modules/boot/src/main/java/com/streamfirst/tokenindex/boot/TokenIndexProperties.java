package com.streamfirst.tokenindex.boot;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Settings under {@code tokenindex.*}. Command line options override them per run. */
@Data
@Validated
@ConfigurationProperties(prefix = "tokenindex")
public class TokenIndexProperties {

    @Valid private HashIndex hashIndex = new HashIndex();
    @Valid private CidCache cidCache = new CidCache();
    @Valid private Ipfs ipfs = new Ipfs();
    @Valid private Lookup lookup = new Lookup();
    @Valid private Validator validator = new Validator();

    @Data
    public static class HashIndex {
        @NotNull private Path database = Path.of("token_hashes.db");

        @Min(1)
        private int batchSize = 10_000;

        /** Hashing threads; 0 means one less than the available processors. */
        @Min(0)
        private int workers = 0;
    }

    @Data
    public static class CidCache {
        @NotNull private Path database = Path.of("cid_tokens.db");

        @Min(1)
        private int batchSize = 5_000;

        @Min(1)
        private int queueCapacity = 10_000;

        /** Producer threads; 0 means one less than the available processors. */
        @Min(0)
        private int workers = 0;

        /** Ask the network for CIDs without storing content. */
        private boolean onlyHash = true;
    }

    @Data
    public static class Ipfs {
        /** Repository to use when no node context applies; falls back to IPFS_PATH. */
        private String path;

        private Path configFile = Path.of("ipfs_config.txt");

        /** Explicit API base URI, e.g. {@code http://127.0.0.1:5001}; overrides {@code $IPFS_PATH/api}. */
        private String apiUrl;

        @NotNull private Duration fetchTimeout = Duration.ofSeconds(10);

        @NotNull private Duration writeTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Lookup {
        @Min(1)
        private int cacheCapacity = 10_000;

        @Min(1)
        private int maxBatchSize = 10_000;
    }

    @Data
    public static class Validator {
        @NotNull private Path walletsPath = Path.of("/home/cherryrubix/wallets");

        /** Status written after a successful pin; unset leaves the status untouched. */
        private Integer admittedStatus;

        @Min(1)
        private int nodeParallelism = 1;
    }

    static int workersOrDefault(int configured) {
        return configured > 0 ? configured : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }
}
