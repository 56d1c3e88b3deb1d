package com.streamfirst.tokenindex.adapters.ipfs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.tokenindex.domain.TokenIndexException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IpfsPathResolverTest {

  @TempDir Path dir;

  private Path fromOption;
  private Path fromEnv;
  private Path fromFile;
  private Path configFile;

  @BeforeEach
  void setUp() throws IOException {
    fromOption = Files.createDirectories(dir.resolve("option/.ipfs"));
    fromEnv = Files.createDirectories(dir.resolve("env/.ipfs"));
    fromFile = Files.createDirectories(dir.resolve("file/.ipfs"));
    configFile = dir.resolve("ipfs_config.txt");
    Files.writeString(configFile, "# node settings\nIPFS_PATH=" + fromFile + "\n");
  }

  @Test
  void explicit_option_wins() {
    var resolver = new IpfsPathResolver(Map.of("IPFS_PATH", fromEnv.toString()));

    assertThat(resolver.resolve(fromOption.toString(), configFile)).isEqualTo(fromOption);
  }

  @Test
  void environment_beats_config_file() {
    var resolver = new IpfsPathResolver(Map.of("IPFS_PATH", fromEnv.toString()));

    assertThat(resolver.resolve(null, configFile)).isEqualTo(fromEnv);
  }

  @Test
  void config_file_is_last_resort() {
    var resolver = new IpfsPathResolver(Map.of());

    assertThat(resolver.resolve("  ", configFile)).isEqualTo(fromFile);
  }

  @Test
  void fails_when_nothing_configured_or_path_missing() {
    var resolver = new IpfsPathResolver(Map.of());

    assertThatThrownBy(() -> resolver.resolve(null, dir.resolve("absent.txt")))
        .isInstanceOf(TokenIndexException.class)
        .hasMessageContaining("IPFS_PATH not configured");
    assertThatThrownBy(() -> resolver.resolve(dir.resolve("nope").toString(), null))
        .isInstanceOf(TokenIndexException.class)
        .hasMessageContaining("does not exist");
  }
}
