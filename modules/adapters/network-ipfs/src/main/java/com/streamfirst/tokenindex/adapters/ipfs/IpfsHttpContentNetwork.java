package com.streamfirst.tokenindex.adapters.ipfs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.tokenindex.domain.AddException;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.FetchException;
import com.streamfirst.tokenindex.domain.OperationInterruptedException;
import com.streamfirst.tokenindex.domain.PinException;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * ContentNetworkPort over the Kubo RPC API ({@code /api/v0/...}).
 *
 * <p>Bound to one endpoint for its whole life. Reads ({@code cat}, {@code pin/ls}) use the fetch
 * timeout; writes ({@code add}, {@code pin/add}) use the write timeout. Thread-safe.
 */
@Slf4j
public class IpfsHttpContentNetwork implements ContentNetworkPort {

  private static final ObjectMapper JSON = new ObjectMapper();

  private final URI baseUri;
  private final HttpClient client;
  private final Duration fetchTimeout;
  private final Duration writeTimeout;

  public IpfsHttpContentNetwork(URI baseUri, Duration fetchTimeout, Duration writeTimeout) {
    this(baseUri, HttpClient.newBuilder().connectTimeout(fetchTimeout).build(), fetchTimeout, writeTimeout);
  }

  IpfsHttpContentNetwork(URI baseUri, HttpClient client, Duration fetchTimeout, Duration writeTimeout) {
    this.baseUri = baseUri;
    this.client = client;
    this.fetchTimeout = fetchTimeout;
    this.writeTimeout = writeTimeout;
  }

  @Override
  public String fetch(Cid cid) {
    HttpResponse<String> response;
    try {
      response = send(post("cat?arg=" + encode(cid.value()), fetchTimeout));
    } catch (HttpTimeoutException e) {
      throw new FetchException("Timed out fetching " + cid + " after " + fetchTimeout, e);
    } catch (IOException e) {
      throw new FetchException("Cannot reach " + baseUri + " to fetch " + cid, e);
    }
    if (response.statusCode() != 200) {
      throw new FetchException("cat " + cid + " failed: " + errorMessage(response));
    }
    return response.body();
  }

  @Override
  public Cid add(String content, boolean onlyHash) {
    String boundary = "----token-index-" + UUID.randomUUID();
    String path = "add?quieter=true&pin=" + !onlyHash + "&only-hash=" + onlyHash;
    HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("/api/v0/" + path))
        .timeout(writeTimeout)
        .header("Content-Type", "multipart/form-data; boundary=" + boundary)
        .POST(HttpRequest.BodyPublishers.ofByteArray(multipart(boundary, content)))
        .build();
    HttpResponse<String> response;
    try {
      response = send(request);
    } catch (HttpTimeoutException e) {
      throw new AddException("Timed out adding content after " + writeTimeout, e);
    } catch (IOException e) {
      throw new AddException("Cannot reach " + baseUri + " to add content", e);
    }
    if (response.statusCode() != 200) {
      throw new AddException("add failed: " + errorMessage(response));
    }
    return lastHash(response.body());
  }

  @Override
  public void pin(Cid cid) {
    HttpResponse<String> response;
    try {
      response = send(post("pin/add?arg=" + encode(cid.value()), writeTimeout));
    } catch (HttpTimeoutException e) {
      throw new PinException("Timed out pinning " + cid + " after " + writeTimeout, e);
    } catch (IOException e) {
      throw new PinException("Cannot reach " + baseUri + " to pin " + cid, e);
    }
    if (response.statusCode() != 200) {
      // a refused pin of content that is already pinned still counts as pinned
      if (isPinned(cid)) {
        return;
      }
      throw new PinException("pin " + cid + " failed: " + errorMessage(response));
    }
    log.debug("Pinned {} on {}", cid, baseUri);
  }

  @Override
  public boolean isPinned(Cid cid) {
    try {
      HttpResponse<String> response =
          send(post("pin/ls?arg=" + encode(cid.value()) + "&type=recursive", fetchTimeout));
      if (response.statusCode() != 200) {
        log.debug("{} not pinned on {}: {}", cid, baseUri, errorMessage(response));
        return false;
      }
      JsonNode keys = JSON.readTree(response.body()).path("Keys");
      return keys.has(cid.value());
    } catch (IOException e) {
      throw new PinException("Cannot list pins of " + cid + " on " + baseUri, e);
    }
  }

  @Override
  public String endpoint() {
    return baseUri.toString();
  }

  private HttpRequest post(String pathAndQuery, Duration timeout) {
    return HttpRequest.newBuilder(baseUri.resolve("/api/v0/" + pathAndQuery))
        .timeout(timeout)
        .POST(HttpRequest.BodyPublishers.noBody())
        .build();
  }

  /**
   * Interruption is reported as {@link OperationInterruptedException}, never as an
   * {@link IOException}, so callers cannot mistake it for an unreachable or failing node.
   */
  private HttpResponse<String> send(HttpRequest request) throws IOException {
    if (Thread.currentThread().isInterrupted()) {
      throw new OperationInterruptedException("Interrupted before calling " + request.uri());
    }
    try {
      return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationInterruptedException("Interrupted calling " + request.uri(), e);
    } catch (IOException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw new OperationInterruptedException("Interrupted calling " + request.uri(), e);
      }
      throw e;
    }
  }

  /** Kubo streams one JSON object per added node; the last one is the root. */
  private static Cid lastHash(String body) {
    String last = null;
    for (String line : body.split("\n")) {
      if (!line.isBlank()) {
        last = line;
      }
    }
    if (last == null) {
      throw new AddException("add returned an empty response");
    }
    try {
      String hash = JSON.readTree(last).path("Hash").asText("");
      if (hash.isEmpty()) {
        throw new AddException("add response has no Hash: " + last);
      }
      return Cid.of(hash);
    } catch (IOException e) {
      throw new AddException("Unreadable add response: " + last, e);
    }
  }

  private static String errorMessage(HttpResponse<String> response) {
    String body = response.body();
    try {
      JsonNode message = JSON.readTree(body).path("Message");
      if (message.isTextual()) {
        return "HTTP " + response.statusCode() + " " + message.asText();
      }
    } catch (IOException e) {
      log.trace("Non-JSON error body", e);
    }
    return "HTTP " + response.statusCode() + " " + body;
  }

  private static byte[] multipart(String boundary, String content) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    String head = "--" + boundary + "\r\n"
        + "Content-Disposition: form-data; name=\"file\"; filename=\"token\"\r\n"
        + "Content-Type: application/octet-stream\r\n\r\n";
    out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
    out.writeBytes(content.getBytes(StandardCharsets.UTF_8));
    out.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return out.toByteArray();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
