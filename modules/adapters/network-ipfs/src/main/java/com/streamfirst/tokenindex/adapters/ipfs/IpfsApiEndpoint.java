package com.streamfirst.tokenindex.adapters.ipfs;

import com.streamfirst.tokenindex.domain.EndpointException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base URI of a node's RPC API, derived from the multiaddr a running daemon writes to
 * {@code $IPFS_PATH/api}, for example {@code /ip4/127.0.0.1/tcp/5001}.
 */
public final class IpfsApiEndpoint {

  static final String API_FILE = "api";

  private IpfsApiEndpoint() {
  }

  /**
   * Reads the endpoint of the daemon serving {@code ipfsPath}.
   *
   * @throws EndpointException if the api file is missing (daemon not running) or malformed
   */
  public static URI fromRepository(Path ipfsPath) {
    Path apiFile = ipfsPath.resolve(API_FILE);
    if (!Files.isRegularFile(apiFile)) {
      throw new EndpointException("No API file at " + apiFile + "; is the daemon for " + ipfsPath + " running?");
    }
    try {
      return fromMultiaddr(Files.readString(apiFile).strip());
    } catch (IOException e) {
      throw new EndpointException("Cannot read " + apiFile, e);
    }
  }

  /**
   * Converts {@code /ip4|ip6|dns|dns4|dns6/<host>/tcp/<port>[/http]} to {@code http://host:port}.
   *
   * @throws EndpointException if the multiaddr has another shape
   */
  public static URI fromMultiaddr(String multiaddr) {
    String[] parts = multiaddr.split("/");
    // leading slash yields an empty first element
    if (parts.length < 5 || !parts[0].isEmpty() || !"tcp".equals(parts[3])) {
      throw new EndpointException("Unsupported API multiaddr: " + multiaddr);
    }
    if (parts.length > 5 && !(parts.length == 6 && "http".equals(parts[5]))) {
      throw new EndpointException("Unsupported API multiaddr: " + multiaddr);
    }
    String host = switch (parts[1]) {
      case "ip4", "dns", "dns4", "dns6" -> parts[2];
      case "ip6" -> "[" + parts[2] + "]";
      default -> throw new EndpointException("Unsupported address protocol in " + multiaddr);
    };
    int port;
    try {
      port = Integer.parseInt(parts[4]);
    } catch (NumberFormatException e) {
      throw new EndpointException("Invalid port in " + multiaddr, e);
    }
    if (host.isEmpty() || port < 1 || port > 65_535) {
      throw new EndpointException("Invalid host or port in " + multiaddr);
    }
    return URI.create("http://" + host + ":" + port);
  }
}
