package com.streamfirst.tokenindex.boot;

import com.streamfirst.tokenindex.adapters.ipfs.IpfsContentNetworkFactory;
import com.streamfirst.tokenindex.adapters.ipfs.IpfsPathResolver;
import com.streamfirst.tokenindex.adapters.sqlite.SqliteCidCacheAdapter;
import com.streamfirst.tokenindex.adapters.sqlite.SqliteConnections;
import com.streamfirst.tokenindex.adapters.sqlite.SqliteHashIndexAdapter;
import com.streamfirst.tokenindex.adapters.sqlite.SqliteLedgerStoreFactory;
import com.streamfirst.tokenindex.application.HashIndexService;
import com.streamfirst.tokenindex.application.TokenLookupService;
import com.streamfirst.tokenindex.application.TokenValidator;
import com.streamfirst.tokenindex.ports.CidCachePort;
import com.streamfirst.tokenindex.ports.HashIndexPort;
import com.streamfirst.tokenindex.ports.LedgerStoreFactory;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Wires stores, network clients and services. Every bean is lazy so a command only opens the
 * databases it uses.
 */
@Slf4j
@Lazy
@Configuration
@EnableConfigurationProperties(TokenIndexProperties.class)
public class TokenIndexConfiguration {

    // --- Stores ---

    @Bean(destroyMethod = "close")
    public SqliteConnections hashIndexConnections(TokenIndexProperties props) {
        return new SqliteConnections(props.getHashIndex().getDatabase());
    }

    @Bean
    public HashIndexPort hashIndexPort(@Qualifier("hashIndexConnections") SqliteConnections connections) {
        return new SqliteHashIndexAdapter(connections);
    }

    @Bean(destroyMethod = "close")
    public SqliteConnections cidCacheConnections(TokenIndexProperties props) {
        return new SqliteConnections(props.getCidCache().getDatabase());
    }

    @Bean
    public CidCachePort cidCachePort(@Qualifier("cidCacheConnections") SqliteConnections connections) {
        return new SqliteCidCacheAdapter(connections);
    }

    @Bean
    public LedgerStoreFactory ledgerStoreFactory() {
        return new SqliteLedgerStoreFactory();
    }

    // --- Storage network ---

    @Bean
    public IpfsContentNetworkFactory ipfsContentNetworkFactory(TokenIndexProperties props) {
        return new IpfsContentNetworkFactory(props.getIpfs().getFetchTimeout(), props.getIpfs().getWriteTimeout());
    }

    @Bean
    public IpfsPathResolver ipfsPathResolver() {
        return new IpfsPathResolver();
    }

    // --- Application services ---

    @Bean
    public HashIndexService hashIndexService(HashIndexPort hashIndexPort, TokenIndexProperties props) {
        TokenIndexProperties.HashIndex cfg = props.getHashIndex();
        return new HashIndexService(
                hashIndexPort, cfg.getBatchSize(), TokenIndexProperties.workersOrDefault(cfg.getWorkers()));
    }

    @Bean
    public TokenLookupService tokenLookupService(CidCachePort cidCachePort, TokenIndexProperties props) {
        return new TokenLookupService(
                cidCachePort, props.getLookup().getCacheCapacity(), props.getLookup().getMaxBatchSize());
    }

    @Bean
    public TokenValidator tokenValidator(
            HashIndexPort hashIndexPort,
            IpfsContentNetworkFactory networks,
            LedgerStoreFactory ledgers,
            TokenIndexProperties props) {
        Integer admitted = props.getValidator().getAdmittedStatus();
        if (admitted == null) {
            log.info("No admitted status configured; admitted tokens keep their status after pinning");
        }
        return new TokenValidator(
                hashIndexPort, networks, ledgers, admitted == null ? OptionalInt.empty() : OptionalInt.of(admitted));
    }
}
