package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.AddException;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.DecodeException;
import com.streamfirst.tokenindex.domain.FetchException;
import com.streamfirst.tokenindex.domain.LedgerToken;
import com.streamfirst.tokenindex.domain.NodeContext;
import com.streamfirst.tokenindex.domain.OperationInterruptedException;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.PinException;
import com.streamfirst.tokenindex.domain.RejectionReason;
import com.streamfirst.tokenindex.domain.TokenContent;
import com.streamfirst.tokenindex.domain.TokenKey;
import com.streamfirst.tokenindex.domain.TokenLevel;
import com.streamfirst.tokenindex.domain.TokenStatus;
import com.streamfirst.tokenindex.ports.ContentNetworkFactory;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import com.streamfirst.tokenindex.ports.HashIndexPort;
import com.streamfirst.tokenindex.ports.LedgerStoreFactory;
import com.streamfirst.tokenindex.ports.LedgerStorePort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates the pending tokens of ledger nodes and admits (pins) or rejects them.
 *
 * <p>Each node run binds its own network client and ledger store from the factories and uses them
 * for that node only. Failures of one token never stop the node; failures of one node never stop
 * the others. A dry run decides every token but neither pins nor writes a status.
 */
@Slf4j
public class TokenValidator {

    static final int PROGRESS_EVERY = 100;

    private final HashIndexPort hashIndex;
    private final ContentNetworkFactory networks;
    private final LedgerStoreFactory ledgers;
    private final OptionalInt admittedStatus;

    /**
     * @param admittedStatus status written after a successful pin; empty leaves the status as is
     */
    public TokenValidator(
            HashIndexPort hashIndex,
            ContentNetworkFactory networks,
            LedgerStoreFactory ledgers,
            OptionalInt admittedStatus) {
        this.hashIndex = hashIndex;
        this.networks = networks;
        this.ledgers = ledgers;
        this.admittedStatus = admittedStatus;
    }

    /**
     * Validates one node. Never throws for per-token problems: an unexpected exception while deciding
     * a token becomes an error verdict for that token. An interrupt stops the run and returns a report
     * whose failure is set, covering only the tokens decided so far.
     */
    public NodeValidationReport process(NodeContext node, boolean dryRun) {
        Instant started = Instant.now();
        log.info("Processing node {}{}", node, dryRun ? " (dry run)" : "");

        ContentNetworkPort network = networks.forNode(node);
        try (LedgerStorePort ledger = ledgers.open(node)) {
            List<LedgerToken> pending = ledger.pendingTokens();
            log.info("Node {}: {} pending token(s) via {}", node, pending.size(), network.endpoint());

            List<TokenVerdict> verdicts = new ArrayList<>(pending.size());
            long ledgerFailures = 0;
            for (LedgerToken token : pending) {
                if (Thread.currentThread().isInterrupted()) {
                    return interrupted(node, dryRun, verdicts, ledgerFailures, pending.size(), started);
                }
                TokenVerdict verdict;
                try {
                    verdict = decide(token.cid(), network, dryRun);
                } catch (OperationInterruptedException e) {
                    log.warn("Node {}: interrupted while validating {}", node, token.cid());
                    return interrupted(node, dryRun, verdicts, ledgerFailures, pending.size(), started);
                } catch (RuntimeException e) {
                    log.error("Node {}: unexpected failure validating {}", node, token.cid(), e);
                    verdict = TokenVerdict.error(token.cid(), null, "unexpected failure: " + e);
                }
                if (!dryRun && !applyStatus(node, ledger, verdict)) {
                    ledgerFailures++;
                    verdict = TokenVerdict.error(
                            token.cid(), verdict.key(), "ledger update failed after: " + verdict.detail());
                }
                verdicts.add(verdict);
                if (verdicts.size() % PROGRESS_EVERY == 0) {
                    log.info("Node {}: {}/{} tokens processed", node, verdicts.size(), pending.size());
                }
            }

            NodeValidationReport report =
                    new NodeValidationReport(
                            node.nodeName(),
                            dryRun,
                            verdicts,
                            ledgerFailures,
                            null,
                            Duration.between(started, Instant.now()));
            log.info(
                    "Node {} done: {} processed, {} admitted, {} rejected {}, {} errors",
                    node,
                    report.getProcessed(),
                    report.getAdmitted(),
                    report.getRejected(),
                    report.getRejectionsByReason(),
                    report.getErrors());
            return report;
        }
    }

    /**
     * Report for a node run stopped by an interrupt. The token being decided gets no verdict and keeps
     * its status.
     */
    private static NodeValidationReport interrupted(
            NodeContext node,
            boolean dryRun,
            List<TokenVerdict> verdicts,
            long ledgerFailures,
            int pending,
            Instant started) {
        String failure = "interrupted after " + verdicts.size() + " of " + pending + " tokens";
        log.warn("Node {}: {}", node, failure);
        return new NodeValidationReport(
                node.nodeName(), dryRun, verdicts, ledgerFailures, failure, Duration.between(started, Instant.now()));
    }

    /**
     * Validates several nodes concurrently, at most {@code parallelism} at a time. A node that fails
     * as a whole yields a report with {@link NodeValidationReport#getFailure()} set.
     */
    public List<NodeValidationReport> processAll(
            List<NodeContext> nodes, boolean dryRun, int parallelism) {
        if (nodes.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(parallelism, nodes.size())));
        try {
            List<Future<NodeValidationReport>> futures = new ArrayList<>();
            for (NodeContext node : nodes) {
                futures.add(pool.submit(() -> process(node, dryRun)));
            }
            List<NodeValidationReport> reports = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                NodeContext node = nodes.get(i);
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("Failed to process node {}", node, e.getCause());
                    reports.add(NodeValidationReport.failed(
                            node.nodeName(), dryRun, String.valueOf(e.getCause()), Duration.ZERO));
                }
            }
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Validation interrupted", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private TokenVerdict decide(Cid cid, ContentNetworkPort network, boolean dryRun) {
        String raw;
        try {
            raw = network.fetch(cid);
        } catch (FetchException e) {
            log.warn("CID {} not retrievable: {}", cid, e.getMessage());
            return TokenVerdict.rejected(cid, RejectionReason.FETCH_FAILED, null, e.getMessage());
        }

        TokenContent content;
        try {
            content = TokenContent.decode(raw);
        } catch (DecodeException e) {
            log.warn("Cannot decode content of {}: {}", cid, e.getMessage());
            return TokenVerdict.rejected(cid, RejectionReason.DECODE_FAILED, null, e.getMessage());
        }
        if (!content.hasValidLevel()) {
            return TokenVerdict.rejected(
                    cid, RejectionReason.OUT_OF_RANGE, null, "unknown level code " + content.levelCode());
        }
        TokenLevel level = content.level();

        Optional<TokenKey> indexed = hashIndex.find(content.hash());
        if (indexed.isEmpty()) {
            log.warn("Hash of {} not in index", cid);
            return TokenVerdict.rejected(
                    cid, RejectionReason.HASH_NOT_INDEXED, null, "hash " + content.hash() + " not indexed");
        }
        TokenKey key = new TokenKey(level, indexed.get().number());
        if (!key.isValid()) {
            log.warn("Token {} out of range: {} > {}", cid, key.number(), level.limit());
            return TokenVerdict.rejected(
                    cid,
                    RejectionReason.OUT_OF_RANGE,
                    key,
                    "number " + key.number() + " beyond limit " + level.limit());
        }

        String canonical = content.encoded();
        if (!canonical.equals(raw.strip())) {
            log.warn("Content of {} is not canonical, re-adding", cid);
            Cid readded;
            try {
                readded = network.add(canonical, dryRun);
            } catch (AddException e) {
                log.error("Failed to re-add canonical content of {}", cid, e);
                return TokenVerdict.error(cid, key, "re-add failed: " + e.getMessage());
            }
            if (!readded.equals(cid)) {
                log.warn("CID mismatch for {}: canonical content has CID {}", cid, readded);
                return TokenVerdict.rejected(
                        cid, RejectionReason.CONTENT_MISMATCH, key, "canonical content has CID " + readded);
            }
        }

        if (!dryRun) {
            try {
                network.pin(cid);
            } catch (PinException e) {
                log.error("Failed to pin {}", cid, e);
                return TokenVerdict.error(cid, key, "pin failed: " + e.getMessage());
            }
        }
        log.debug("Token {} admitted as {}", cid, key);
        return TokenVerdict.admitted(cid, key);
    }

    /** Writes the status a verdict calls for. Returns false if the ledger update failed. */
    private boolean applyStatus(NodeContext node, LedgerStorePort ledger, TokenVerdict verdict) {
        OptionalInt status =
                switch (verdict.outcome()) {
                    case REJECTED -> OptionalInt.of(TokenStatus.REJECTED);
                    case ADMITTED -> admittedStatus;
                    case ERROR -> OptionalInt.empty();
                };
        if (status.isEmpty()) {
            return true;
        }
        try {
            if (!ledger.updateStatus(verdict.cid(), status.getAsInt())) {
                log.warn("Node {}: token {} vanished from ledger before status update", node, verdict.cid());
            }
            return true;
        } catch (PersistenceException e) {
            log.error("Node {}: failed to set status {} on {}", node, status.getAsInt(), verdict.cid(), e);
            return false;
        }
    }
}
