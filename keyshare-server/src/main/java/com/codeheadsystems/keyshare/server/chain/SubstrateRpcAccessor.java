package com.codeheadsystems.keyshare.server.chain;

import com.codeheadsystems.keyshare.model.token.ValidityWindow;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChainHeightOracle} over a Substrate node's JSON-RPC 2.0 HTTP endpoint.
 * <p>
 * The height is read in two calls: {@code chain_getFinalizedHead} for the finalized block hash,
 * then {@code chain_getHeader} for that block's hex-encoded number. Each call is bounded by the
 * request timeout; the connect timeout belongs to the supplied {@link HttpClient}. Nothing is
 * retried or cached.
 */
public class SubstrateRpcAccessor implements ChainHeightOracle {

  private static final Logger log = LoggerFactory.getLogger(SubstrateRpcAccessor.class);

  private final URI endpoint;
  private final Duration requestTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final AtomicLong requestIds = new AtomicLong();

  /**
   * Instantiates a new Substrate rpc accessor.
   *
   * @param endpoint       the node's HTTP RPC endpoint
   * @param requestTimeout the per-call timeout
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   */
  public SubstrateRpcAccessor(final URI endpoint,
                              final Duration requestTimeout,
                              final HttpClient httpClient,
                              final ObjectMapper objectMapper) {
    log.info("SubstrateRpcAccessor({}, {})", endpoint, requestTimeout);
    this.endpoint = endpoint;
    this.requestTimeout = requestTimeout;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public long currentFinalizedBlock() {
    JsonNode head = call("chain_getFinalizedHead", List.of());
    if (!head.isTextual()) {
      throw new ChainQueryException("chain_getFinalizedHead returned a non-string hash", null);
    }
    JsonNode header = call("chain_getHeader", List.of(head.asText()));
    JsonNode number = header.get("number");
    if (number == null || !number.isTextual()) {
      throw new ChainQueryException("chain_getHeader reply has no block number", null);
    }
    long blockNumber = parseHexNumber(number.asText());
    log.trace("currentFinalizedBlock() = {}", blockNumber);
    return blockNumber;
  }

  private JsonNode call(final String method, final List<String> params) {
    final long id = requestIds.incrementAndGet();
    log.trace("call(method={}, id={})", method, id);
    try {
      final ObjectNode request = objectMapper.createObjectNode();
      request.put("jsonrpc", "2.0");
      request.put("id", id);
      request.put("method", method);
      final ArrayNode paramArray = request.putArray("params");
      params.forEach(paramArray::add);

      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(endpoint)
          .timeout(requestTimeout)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)))
          .build();

      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      if (httpResponse.statusCode() >= 400) {
        throw new ChainQueryException("Node returned HTTP " + httpResponse.statusCode() + " for " + method, null);
      }
      final JsonNode reply = objectMapper.readTree(httpResponse.body());
      final JsonNode error = reply.get("error");
      if (error != null && !error.isNull()) {
        throw new ChainQueryException("Node returned an error for " + method + ": " + error, null);
      }
      final JsonNode result = reply.get("result");
      if (result == null || result.isNull()) {
        throw new ChainQueryException("Node returned no result for " + method, null);
      }
      return result;
    } catch (IOException e) {
      log.warn("RPC call {} to {} failed: {}", method, endpoint, e.getMessage());
      throw new ChainQueryException("RPC call " + method + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChainQueryException("RPC call " + method + " interrupted", e);
    }
  }

  static long parseHexNumber(final String hex) {
    if (!hex.startsWith("0x") || hex.length() == 2) {
      throw new ChainQueryException("Block number is not 0x-prefixed hex: " + hex, null);
    }
    try {
      final long value = Long.parseLong(hex.substring(2), 16);
      return ValidityWindow.requireU32("block number", value);
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException
      throw new ChainQueryException("Block number is not a u32: " + hex, e);
    }
  }
}
