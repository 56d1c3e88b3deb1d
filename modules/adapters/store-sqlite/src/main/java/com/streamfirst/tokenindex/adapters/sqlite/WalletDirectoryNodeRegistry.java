package com.streamfirst.tokenindex.adapters.sqlite;

import com.streamfirst.tokenindex.domain.NodeContext;
import com.streamfirst.tokenindex.ports.NodeRegistryPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers ledger nodes laid out under a wallets directory as
 * {@code nodeNNN/nodeNNN/.ipfs} and {@code nodeNNN/nodeNNN/Rubix/rubix.db}.
 * A node directory missing either part is ignored.
 */
@Slf4j
public class WalletDirectoryNodeRegistry implements NodeRegistryPort {

  private static final Pattern NODE_NAME = Pattern.compile("node\\d+");

  private final Path walletsPath;

  public WalletDirectoryNodeRegistry(Path walletsPath) {
    this.walletsPath = walletsPath;
  }

  @Override
  public List<NodeContext> listNodes() {
    if (!Files.isDirectory(walletsPath)) {
      log.warn("Wallets path {} does not exist", walletsPath);
      return List.of();
    }
    try (Stream<Path> children = Files.list(walletsPath)) {
      List<NodeContext> nodes = children
          .filter(Files::isDirectory)
          .map(dir -> dir.getFileName().toString())
          .filter(name -> NODE_NAME.matcher(name).matches())
          .map(this::findNode)
          .flatMap(Optional::stream)
          .sorted(Comparator.comparing(NodeContext::nodeName))
          .collect(Collectors.toList());
      log.info("Found {} node(s) under {}", nodes.size(), walletsPath);
      return nodes;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list " + walletsPath, e);
    }
  }

  @Override
  public Optional<NodeContext> findNode(String nodeName) {
    Path inner = walletsPath.resolve(nodeName).resolve(nodeName);
    Path ipfs = inner.resolve(".ipfs");
    Path ledger = inner.resolve("Rubix").resolve("rubix.db");
    if (!Files.isDirectory(ipfs) || !Files.isRegularFile(ledger)) {
      log.debug("Skipping {}: missing {} or {}", nodeName, ipfs, ledger);
      return Optional.empty();
    }
    return Optional.of(new NodeContext(nodeName, ipfs, ledger));
  }
}
