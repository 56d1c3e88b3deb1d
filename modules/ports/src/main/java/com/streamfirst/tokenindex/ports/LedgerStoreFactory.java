package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.NodeContext;

/**
 * Opens the ledger store of one node. The caller closes the returned store.
 */
@FunctionalInterface
public interface LedgerStoreFactory {

    LedgerStorePort open(NodeContext node);
}
