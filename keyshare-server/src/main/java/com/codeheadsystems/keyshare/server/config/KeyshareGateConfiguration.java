package com.codeheadsystems.keyshare.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the key-share gate.
 * <p>
 * {@code chainRpcEndpoint} must point at a node's JSON-RPC HTTP endpoint; the gate reads the
 * finalized height from it for every token check. {@code adminWhitelist} is per deployment and
 * lists the SS58 addresses allowed to issue admin requests.
 */
public class KeyshareGateConfiguration {

  /**
   * Identifier of this enclave, returned in every status payload.
   */
  @NotEmpty
  private String enclaveId = "keyshare-enclave";

  /**
   * JSON-RPC HTTP endpoint of the chain node.
   */
  @NotEmpty
  private String chainRpcEndpoint = "http://localhost:9933";

  @Min(1)
  private long connectTimeoutMillis = 5000;

  @Min(1)
  private long requestTimeoutMillis = 10000;

  /**
   * Blocks of grace on either side of a per-secret token window.
   */
  @Min(0)
  private long tokenGraceBlocks = 3;

  /**
   * Longest block_validation accepted on an admin token.
   */
  @Min(0)
  private long adminMaxValidationPeriod = 20;

  /**
   * Blocks of tolerance on either side of an admin token window.
   */
  @Min(0)
  private long adminMaxBlockVariation = 5;

  private List<String> adminWhitelist = new ArrayList<>();

  @NotEmpty
  private String attestationDevicePath = "/dev/attestation";

  @NotEmpty
  private String quoteOutputPath = "/quote/enclave.quote";

  /**
   * Gets enclave id.
   *
   * @return the enclave id
   */
  @JsonProperty
  public String getEnclaveId() {
    return enclaveId;
  }

  /**
   * Sets enclave id.
   *
   * @param enclaveId the enclave id
   */
  @JsonProperty
  public void setEnclaveId(String enclaveId) {
    this.enclaveId = enclaveId;
  }

  /**
   * Gets chain rpc endpoint.
   *
   * @return the chain rpc endpoint
   */
  @JsonProperty
  public String getChainRpcEndpoint() {
    return chainRpcEndpoint;
  }

  /**
   * Sets chain rpc endpoint.
   *
   * @param chainRpcEndpoint the chain rpc endpoint
   */
  @JsonProperty
  public void setChainRpcEndpoint(String chainRpcEndpoint) {
    this.chainRpcEndpoint = chainRpcEndpoint;
  }

  @JsonProperty
  public long getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  @JsonProperty
  public void setConnectTimeoutMillis(long connectTimeoutMillis) {
    this.connectTimeoutMillis = connectTimeoutMillis;
  }

  @JsonProperty
  public long getRequestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  @JsonProperty
  public void setRequestTimeoutMillis(long requestTimeoutMillis) {
    this.requestTimeoutMillis = requestTimeoutMillis;
  }

  /**
   * Gets token grace blocks.
   *
   * @return the token grace blocks
   */
  @JsonProperty
  public long getTokenGraceBlocks() {
    return tokenGraceBlocks;
  }

  /**
   * Sets token grace blocks.
   *
   * @param tokenGraceBlocks the token grace blocks
   */
  @JsonProperty
  public void setTokenGraceBlocks(long tokenGraceBlocks) {
    this.tokenGraceBlocks = tokenGraceBlocks;
  }

  @JsonProperty
  public long getAdminMaxValidationPeriod() {
    return adminMaxValidationPeriod;
  }

  @JsonProperty
  public void setAdminMaxValidationPeriod(long adminMaxValidationPeriod) {
    this.adminMaxValidationPeriod = adminMaxValidationPeriod;
  }

  @JsonProperty
  public long getAdminMaxBlockVariation() {
    return adminMaxBlockVariation;
  }

  @JsonProperty
  public void setAdminMaxBlockVariation(long adminMaxBlockVariation) {
    this.adminMaxBlockVariation = adminMaxBlockVariation;
  }

  /**
   * Gets admin whitelist.
   *
   * @return the admin whitelist
   */
  @JsonProperty
  public List<String> getAdminWhitelist() {
    return adminWhitelist;
  }

  /**
   * Sets admin whitelist.
   *
   * @param adminWhitelist the admin whitelist
   */
  @JsonProperty
  public void setAdminWhitelist(List<String> adminWhitelist) {
    this.adminWhitelist = adminWhitelist;
  }

  @JsonProperty
  public String getAttestationDevicePath() {
    return attestationDevicePath;
  }

  @JsonProperty
  public void setAttestationDevicePath(String attestationDevicePath) {
    this.attestationDevicePath = attestationDevicePath;
  }

  @JsonProperty
  public String getQuoteOutputPath() {
    return quoteOutputPath;
  }

  @JsonProperty
  public void setQuoteOutputPath(String quoteOutputPath) {
    this.quoteOutputPath = quoteOutputPath;
  }
}
