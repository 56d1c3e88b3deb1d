package com.streamfirst.tokenindex.application;

import com.streamfirst.tokenindex.domain.RejectionReason;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;

/** Outcome of validating the pending tokens of one node. */
@Value
public class NodeValidationReport {

    @NonNull String nodeName;

    boolean dryRun;

    @NonNull List<TokenVerdict> verdicts;

    /** Ledger status updates that failed; the tokens keep their previous status. */
    long ledgerUpdateFailures;

    /** Set when the node could not be processed at all. */
    String failure;

    @NonNull Duration elapsed;

    static NodeValidationReport failed(String nodeName, boolean dryRun, String failure, Duration elapsed) {
        return new NodeValidationReport(nodeName, dryRun, List.of(), 0, failure, elapsed);
    }

    public long getProcessed() {
        return verdicts.size();
    }

    public long getAdmitted() {
        return count(TokenVerdict.Outcome.ADMITTED);
    }

    public long getRejected() {
        return count(TokenVerdict.Outcome.REJECTED);
    }

    public long getErrors() {
        return count(TokenVerdict.Outcome.ERROR);
    }

    public Map<RejectionReason, Long> getRejectionsByReason() {
        Map<RejectionReason, Long> byReason = new EnumMap<>(RejectionReason.class);
        for (TokenVerdict verdict : verdicts) {
            if (verdict.reason() != null) {
                byReason.merge(verdict.reason(), 1L, Long::sum);
            }
        }
        return byReason;
    }

    public boolean isNodeFailed() {
        return failure != null;
    }

    private long count(TokenVerdict.Outcome outcome) {
        return verdicts.stream().filter(v -> v.outcome() == outcome).count();
    }
}
