package com.streamfirst.tokenindex.adapters.ipfs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.tokenindex.domain.EndpointException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IpfsApiEndpointTest {

  @TempDir Path repo;

  @Test
  void converts_tcp_multiaddrs() {
    assertThat(IpfsApiEndpoint.fromMultiaddr("/ip4/127.0.0.1/tcp/5001"))
        .isEqualTo(URI.create("http://127.0.0.1:5001"));
    assertThat(IpfsApiEndpoint.fromMultiaddr("/ip6/::1/tcp/5002"))
        .isEqualTo(URI.create("http://[::1]:5002"));
    assertThat(IpfsApiEndpoint.fromMultiaddr("/dns4/ipfs.local/tcp/5001/http"))
        .isEqualTo(URI.create("http://ipfs.local:5001"));
  }

  @Test
  void rejects_other_shapes() {
    assertThatThrownBy(() -> IpfsApiEndpoint.fromMultiaddr("/ip4/127.0.0.1/udp/5001"))
        .isInstanceOf(EndpointException.class);
    assertThatThrownBy(() -> IpfsApiEndpoint.fromMultiaddr("/unix/tmp/api.sock/tcp/1"))
        .isInstanceOf(EndpointException.class);
    assertThatThrownBy(() -> IpfsApiEndpoint.fromMultiaddr("/ip4/127.0.0.1/tcp/notaport"))
        .isInstanceOf(EndpointException.class);
  }

  @Test
  void reads_api_file_of_repository() throws IOException {
    Files.writeString(repo.resolve("api"), "/ip4/127.0.0.1/tcp/5011\n");

    assertThat(IpfsApiEndpoint.fromRepository(repo)).isEqualTo(URI.create("http://127.0.0.1:5011"));
  }

  @Test
  void missing_api_file_means_daemon_not_running() {
    assertThatThrownBy(() -> IpfsApiEndpoint.fromRepository(repo))
        .isInstanceOf(EndpointException.class)
        .hasMessageContaining("running");
  }
}
