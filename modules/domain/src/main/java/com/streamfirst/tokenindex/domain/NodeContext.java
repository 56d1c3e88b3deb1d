package com.streamfirst.tokenindex.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything that is specific to one ledger node. A validation run binds exactly one context and
 * passes it explicitly to every network and ledger operation, so concurrent runs for different
 * nodes never see each other's endpoints.
 *
 * @param nodeName the node's directory name (e.g. {@code node002})
 * @param ipfsPath the node's storage-network repository ({@code IPFS_PATH})
 * @param ledgerDatabase the node's ledger store file
 */
public record NodeContext(String nodeName, Path ipfsPath, Path ledgerDatabase) {
    public NodeContext {
        Objects.requireNonNull(nodeName, "Node name cannot be null");
        Objects.requireNonNull(ipfsPath, "IPFS path cannot be null");
        Objects.requireNonNull(ledgerDatabase, "Ledger database cannot be null");
        if (nodeName.isBlank()) {
            throw new IllegalArgumentException("Node name cannot be blank");
        }
    }

    @Override
    public String toString() {
        return nodeName;
    }
}
