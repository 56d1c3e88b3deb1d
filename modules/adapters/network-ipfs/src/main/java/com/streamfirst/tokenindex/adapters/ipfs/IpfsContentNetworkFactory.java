package com.streamfirst.tokenindex.adapters.ipfs;

import com.streamfirst.tokenindex.domain.NodeContext;
import com.streamfirst.tokenindex.ports.ContentNetworkFactory;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Creates clients bound to the daemon of one repository, found through its {@code api} file.
 */
@Slf4j
@RequiredArgsConstructor
public class IpfsContentNetworkFactory implements ContentNetworkFactory {

  private final Duration fetchTimeout;
  private final Duration writeTimeout;

  @Override
  public ContentNetworkPort forNode(NodeContext node) {
    ContentNetworkPort network = forRepository(node.ipfsPath());
    log.debug("Node {} uses {}", node, network.endpoint());
    return network;
  }

  /** A client for the daemon serving {@code ipfsPath}. */
  public ContentNetworkPort forRepository(Path ipfsPath) {
    return forEndpoint(IpfsApiEndpoint.fromRepository(ipfsPath));
  }

  /** A client for an explicit API base URI such as {@code http://127.0.0.1:5001}. */
  public ContentNetworkPort forEndpoint(URI apiUri) {
    return new IpfsHttpContentNetwork(apiUri, fetchTimeout, writeTimeout);
  }
}
