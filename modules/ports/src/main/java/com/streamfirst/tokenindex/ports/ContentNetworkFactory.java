package com.streamfirst.tokenindex.ports;

import com.streamfirst.tokenindex.domain.NodeContext;

/**
 * Creates a {@link ContentNetworkPort} bound to one node's storage-network repository.
 */
@FunctionalInterface
public interface ContentNetworkFactory {

    /**
     * @param node the node whose endpoint the client must use
     * @throws com.streamfirst.tokenindex.domain.ContentNetworkException if the node's endpoint
     *         cannot be resolved
     */
    ContentNetworkPort forNode(NodeContext node);
}
