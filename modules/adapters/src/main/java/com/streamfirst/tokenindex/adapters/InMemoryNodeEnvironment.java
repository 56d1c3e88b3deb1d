package com.streamfirst.tokenindex.adapters;

import com.streamfirst.tokenindex.domain.NodeContext;
import com.streamfirst.tokenindex.ports.ContentNetworkFactory;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import com.streamfirst.tokenindex.ports.LedgerStoreFactory;
import com.streamfirst.tokenindex.ports.LedgerStorePort;
import com.streamfirst.tokenindex.ports.NodeRegistryPort;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A set of simulated ledger nodes, each with its own network adapter and ledger store.
 * Serves as node registry and as both per-node factories, so tests can check that a run only
 * touched the node it was bound to.
 */
@Slf4j
public class InMemoryNodeEnvironment implements NodeRegistryPort, ContentNetworkFactory, LedgerStoreFactory {

    private final Map<String, NodeContext> nodes = new ConcurrentHashMap<>();
    private final Map<String, InMemoryContentNetworkAdapter> networks = new ConcurrentHashMap<>();
    private final Map<String, InMemoryLedgerStoreAdapter> ledgers = new ConcurrentHashMap<>();

    /**
     * Registers a node with fresh, empty network and ledger.
     */
    public NodeContext addNode(String nodeName) {
        Path home = Path.of("/memory", nodeName, nodeName);
        NodeContext node = new NodeContext(nodeName, home.resolve(".ipfs"), home.resolve("Rubix/rubix.db"));
        nodes.put(nodeName, node);
        networks.put(nodeName, new InMemoryContentNetworkAdapter(nodeName));
        ledgers.put(nodeName, new InMemoryLedgerStoreAdapter());
        log.debug("Registered in-memory node {}", nodeName);
        return node;
    }

    public InMemoryContentNetworkAdapter network(String nodeName) {
        return require(networks, nodeName);
    }

    public InMemoryLedgerStoreAdapter ledger(String nodeName) {
        return require(ledgers, nodeName);
    }

    @Override
    public List<NodeContext> listNodes() {
        List<NodeContext> all = new ArrayList<>(nodes.values());
        all.sort(Comparator.comparing(NodeContext::nodeName));
        return all;
    }

    @Override
    public Optional<NodeContext> findNode(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    @Override
    public ContentNetworkPort forNode(NodeContext node) {
        return network(node.nodeName());
    }

    @Override
    public LedgerStorePort open(NodeContext node) {
        return ledger(node.nodeName());
    }

    private static <T> T require(Map<String, T> map, String nodeName) {
        T value = map.get(nodeName);
        if (value == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        }
        return value;
    }
}
