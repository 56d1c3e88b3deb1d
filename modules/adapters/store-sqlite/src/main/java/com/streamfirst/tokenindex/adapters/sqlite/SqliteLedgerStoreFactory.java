package com.streamfirst.tokenindex.adapters.sqlite;

import com.streamfirst.tokenindex.domain.NodeContext;
import com.streamfirst.tokenindex.ports.LedgerStoreFactory;
import com.streamfirst.tokenindex.ports.LedgerStorePort;

/**
 * Opens {@link SqliteLedgerStoreAdapter}s on each node's own ledger file.
 */
public class SqliteLedgerStoreFactory implements LedgerStoreFactory {

  @Override
  public LedgerStorePort open(NodeContext node) {
    return new SqliteLedgerStoreAdapter(node.ledgerDatabase());
  }
}
