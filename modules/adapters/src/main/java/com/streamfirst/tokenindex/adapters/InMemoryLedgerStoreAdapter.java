package com.streamfirst.tokenindex.adapters;

import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.LedgerToken;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.TokenStatus;
import com.streamfirst.tokenindex.ports.LedgerStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of LedgerStorePort for testing and development.
 * Tokens keep insertion order so pending scans are deterministic.
 */
@Slf4j
public class InMemoryLedgerStoreAdapter implements LedgerStorePort {

    private final Map<Cid, Integer> statuses = new LinkedHashMap<>();

    private volatile boolean failUpdates;
    private volatile boolean closed;

    public synchronized void addToken(Cid cid, int status) {
        statuses.put(cid, status);
    }

    public void addPending(Cid cid) {
        addToken(cid, TokenStatus.PENDING);
    }

    @Override
    public synchronized List<LedgerToken> pendingTokens() {
        return statuses.entrySet().stream()
                .filter(e -> TokenStatus.isPending(e.getValue()))
                .map(e -> new LedgerToken(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean updateStatus(Cid cid, int status) {
        if (failUpdates) {
            throw new PersistenceException("Injected ledger update failure for " + cid);
        }
        if (!statuses.containsKey(cid)) {
            return false;
        }
        log.debug("Token {} status {} -> {}", cid, statuses.get(cid), status);
        statuses.put(cid, status);
        return true;
    }

    public synchronized Optional<Integer> statusOf(Cid cid) {
        return Optional.ofNullable(statuses.get(cid));
    }

    public void setFailUpdates(boolean failUpdates) {
        this.failUpdates = failUpdates;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
