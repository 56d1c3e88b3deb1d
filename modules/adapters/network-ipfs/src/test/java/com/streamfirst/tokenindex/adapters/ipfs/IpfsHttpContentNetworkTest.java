package com.streamfirst.tokenindex.adapters.ipfs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.tokenindex.domain.AddException;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.FetchException;
import com.streamfirst.tokenindex.domain.OperationInterruptedException;
import com.streamfirst.tokenindex.domain.PinException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the client against a stub of the Kubo RPC API. */
class IpfsHttpContentNetworkTest {

  private static final String CID = "QmVaPTddRyjLjMoZnYufWc5M5CjyGNPmFEpp5HtPKEqZFG";

  private HttpServer server;
  private IpfsHttpContentNetwork network;

  private final Map<String, String> blocks = new ConcurrentHashMap<>();
  private final Map<String, Boolean> pins = new ConcurrentHashMap<>();
  private final List<String> requests = new CopyOnWriteArrayList<>();
  private volatile String lastUpload = "";
  private volatile boolean refusePins;

  @BeforeEach
  void startStub() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/api/v0/cat", this::cat);
    server.createContext("/api/v0/add", this::add);
    server.createContext("/api/v0/pin/add", this::pinAdd);
    server.createContext("/api/v0/pin/ls", this::pinLs);
    server.start();
    URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    network = new IpfsHttpContentNetwork(base, Duration.ofSeconds(2), Duration.ofSeconds(2));
  }

  @AfterEach
  void stopStub() {
    server.stop(0);
  }

  @Test
  void fetches_text_by_cid() {
    blocks.put(CID, "003abc\n");

    assertThat(network.fetch(Cid.of(CID))).isEqualTo("003abc\n");
    assertThat(requests).containsExactly("POST /api/v0/cat?arg=" + CID);
  }

  @Test
  void missing_content_is_a_fetch_failure() {
    assertThatThrownBy(() -> network.fetch(Cid.of(CID)))
        .isInstanceOf(FetchException.class)
        .hasMessageContaining("HTTP 500")
        .hasMessageContaining("block not found");
  }

  @Test
  void only_hash_add_sends_content_and_reads_root_hash() {
    Cid cid = network.add("001" + "a".repeat(64), true);

    assertThat(cid.value()).isEqualTo("QmRoot");
    assertThat(lastUpload).contains("001" + "a".repeat(64));
    assertThat(requests.get(0)).contains("only-hash=true").contains("pin=false");
  }

  @Test
  void unreachable_endpoint_is_an_add_failure() {
    var offline =
        new IpfsHttpContentNetwork(
            URI.create("http://127.0.0.1:1"), Duration.ofSeconds(1), Duration.ofSeconds(1));

    assertThatThrownBy(() -> offline.add("x", true)).isInstanceOf(AddException.class);
  }

  @Test
  void pins_and_reports_pin_state() {
    blocks.put(CID, "content");

    assertThat(network.isPinned(Cid.of(CID))).isFalse();
    network.pin(Cid.of(CID));

    assertThat(network.isPinned(Cid.of(CID))).isTrue();
  }

  @Test
  void refused_pin_of_already_pinned_cid_succeeds() {
    pins.put(CID, true);
    refusePins = true;

    network.pin(Cid.of(CID));

    assertThat(requests).anyMatch(r -> r.startsWith("POST /api/v0/pin/ls"));
  }

  @Test
  void refused_pin_fails() {
    refusePins = true;

    assertThatThrownBy(() -> network.pin(Cid.of(CID))).isInstanceOf(PinException.class);
  }

  @Test
  void interrupted_fetch_is_not_reported_as_fetch_failure() {
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> network.fetch(Cid.of(CID)))
          .isInstanceOf(OperationInterruptedException.class)
          .isNotInstanceOf(FetchException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void interrupted_pin_is_not_reported_as_pin_failure() {
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> network.pin(Cid.of(CID)))
          .isInstanceOf(OperationInterruptedException.class);
    } finally {
      Thread.interrupted();
    }
    assertThat(requests).isEmpty();
  }

  private void cat(HttpExchange exchange) throws IOException {
    record(exchange);
    String cid = arg(exchange);
    String content = blocks.get(cid);
    if (content == null) {
      respond(exchange, 500, "{\"Message\":\"block not found\",\"Code\":0,\"Type\":\"error\"}");
    } else {
      respond(exchange, 200, content);
    }
  }

  private void add(HttpExchange exchange) throws IOException {
    record(exchange);
    lastUpload = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    respond(exchange, 200, "{\"Name\":\"token\",\"Hash\":\"QmRoot\",\"Size\":\"75\"}\n");
  }

  private void pinAdd(HttpExchange exchange) throws IOException {
    record(exchange);
    String cid = arg(exchange);
    if (refusePins || !blocks.containsKey(cid)) {
      respond(exchange, 500, "{\"Message\":\"pin refused\",\"Code\":0,\"Type\":\"error\"}");
      return;
    }
    pins.put(cid, true);
    respond(exchange, 200, "{\"Pins\":[\"" + cid + "\"]}");
  }

  private void pinLs(HttpExchange exchange) throws IOException {
    record(exchange);
    String cid = arg(exchange);
    if (!pins.containsKey(cid)) {
      respond(exchange, 500, "{\"Message\":\"path '" + cid + "' is not pinned\",\"Type\":\"error\"}");
      return;
    }
    respond(exchange, 200, "{\"Keys\":{\"" + cid + "\":{\"Type\":\"recursive\"}}}");
  }

  private void record(HttpExchange exchange) {
    requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI());
  }

  private static String arg(HttpExchange exchange) {
    String query = exchange.getRequestURI().getQuery();
    for (String pair : query.split("&")) {
      if (pair.startsWith("arg=")) {
        return pair.substring(4);
      }
    }
    return "";
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    exchange.getResponseBody().write(bytes);
    exchange.close();
  }
}
