package com.streamfirst.tokenindex.adapters.ipfs;

import com.streamfirst.tokenindex.domain.TokenIndexException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the storage-network repository to use when no node context supplies one.
 *
 * <p>Resolution order: the explicit option, then the {@code IPFS_PATH} environment variable, then
 * the first {@code IPFS_PATH=} line of the config file. The resolved directory must exist.
 */
@Slf4j
public class IpfsPathResolver {

  public static final String ENV_VARIABLE = "IPFS_PATH";

  private static final String CONFIG_PREFIX = ENV_VARIABLE + "=";

  private final Map<String, String> environment;

  public IpfsPathResolver() {
    this(System.getenv());
  }

  public IpfsPathResolver(Map<String, String> environment) {
    this.environment = environment;
  }

  /**
   * @param explicit path given on the command line or in configuration, may be null or blank
   * @param configFile the {@code KEY=value} file to consult last, may be null
   * @throws TokenIndexException if no source names a path, or the named path does not exist
   */
  public Path resolve(String explicit, Path configFile) {
    String source;
    String value;
    if (explicit != null && !explicit.isBlank()) {
      source = "option";
      value = explicit;
    } else if (environment.getOrDefault(ENV_VARIABLE, "").isBlank()) {
      source = "config file " + configFile;
      value = readConfigFile(configFile).orElseThrow(() -> new TokenIndexException(
          "IPFS_PATH not configured. Set it as an option, as environment variable or as "
              + "an IPFS_PATH= line in " + configFile));
    } else {
      source = "environment";
      value = environment.get(ENV_VARIABLE);
    }
    Path path = Path.of(value.strip());
    if (!Files.isDirectory(path)) {
      throw new TokenIndexException("IPFS_PATH from " + source + " does not exist: " + path);
    }
    log.info("Using IPFS_PATH {} (from {})", path, source);
    return path;
  }

  static Optional<String> readConfigFile(Path configFile) {
    if (configFile == null || !Files.isRegularFile(configFile)) {
      return Optional.empty();
    }
    try {
      return Files.readAllLines(configFile).stream()
          .map(String::strip)
          .filter(line -> line.startsWith(CONFIG_PREFIX))
          .map(line -> line.substring(CONFIG_PREFIX.length()).strip())
          .filter(v -> !v.isEmpty())
          .findFirst();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + configFile, e);
    }
  }
}
