package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.NodeContext;

import java.util.List;
import java.util.Optional;

/**
 * Port for discovering the ledger nodes to validate.
 */
public interface NodeRegistryPort {

    /**
     * Lists every node that has both a storage-network repository and a ledger store,
     * ordered by node name.
     */
    List<NodeContext> listNodes();

    /**
     * Resolves one node by name.
     *
     * @return the node, or empty if it does not exist or is incomplete
     */
    Optional<NodeContext> findNode(String nodeName);
}
