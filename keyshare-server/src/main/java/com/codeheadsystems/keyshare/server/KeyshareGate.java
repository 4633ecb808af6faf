package com.codeheadsystems.keyshare.server;

import com.codahale.metrics.health.HealthCheckRegistry;
import com.codeheadsystems.keyshare.crypto.sr25519.Sr25519;
import com.codeheadsystems.keyshare.model.NftType;
import com.codeheadsystems.keyshare.model.data.ParsedAdminPayload;
import com.codeheadsystems.keyshare.model.data.RetrieveKeyshareData;
import com.codeheadsystems.keyshare.model.data.StoreKeyshareData;
import com.codeheadsystems.keyshare.model.error.AdminAuthenticationException;
import com.codeheadsystems.keyshare.model.error.VerificationException;
import com.codeheadsystems.keyshare.model.packet.AdminFetchIdPacket;
import com.codeheadsystems.keyshare.model.packet.RetrieveKeysharePacket;
import com.codeheadsystems.keyshare.model.packet.StoreKeysharePacket;
import com.codeheadsystems.keyshare.model.status.ApiCall;
import com.codeheadsystems.keyshare.model.status.VerificationStatus;
import com.codeheadsystems.keyshare.server.admin.AdminAuthenticator;
import com.codeheadsystems.keyshare.server.admin.AdminWhitelist;
import com.codeheadsystems.keyshare.server.admin.MaintenanceStatus;
import com.codeheadsystems.keyshare.server.attestation.AttestationQuoteProvider;
import com.codeheadsystems.keyshare.server.authorization.RequesterAuthorizer;
import com.codeheadsystems.keyshare.server.chain.ChainHeightOracle;
import com.codeheadsystems.keyshare.server.chain.ChainQueryException;
import com.codeheadsystems.keyshare.server.chain.ChainStateOracle;
import com.codeheadsystems.keyshare.server.chain.SubstrateRpcAccessor;
import com.codeheadsystems.keyshare.server.config.KeyshareGateConfiguration;
import com.codeheadsystems.keyshare.server.delegation.DelegationChainVerifier;
import com.codeheadsystems.keyshare.server.health.MaintenanceHealthCheck;
import com.codeheadsystems.keyshare.server.signature.SignatureVerifier;
import com.codeheadsystems.keyshare.server.status.VerificationStatusMapper;
import com.codeheadsystems.keyshare.server.token.AdminTokenValidator;
import com.codeheadsystems.keyshare.server.token.TokenValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that wires the verifiers together and exposes the operations the storage and
 * backup executors call.
 * <p>
 * Build from configuration with a chain state oracle supplied by the host:
 * <pre>{@code
 *   KeyshareGate gate = KeyshareGate.create(configuration, chainStateOracle);
 *   StoreKeyshareData data = gate.verifyStoreRequest(packet, NftType.SECRET_NFT);
 * }</pre>
 * Rejections are thrown as {@link VerificationException} and turned into status payloads with
 * {@link #express(VerificationException, ApiCall, String, long)}. A failed chain query surfaces
 * as {@link ChainQueryException} and maps to {@link #expressInfrastructureFailure}.
 */
public class KeyshareGate {

  private static final Logger log = LoggerFactory.getLogger(KeyshareGate.class);

  private final String enclaveId;
  private final DelegationChainVerifier delegationChainVerifier;
  private final AdminAuthenticator adminAuthenticator;
  private final AdminWhitelist adminWhitelist;
  private final MaintenanceStatus maintenanceStatus;
  private final VerificationStatusMapper statusMapper;
  private final AttestationQuoteProvider attestationQuoteProvider;

  /**
   * Instantiates a new Keyshare gate from already built components.
   *
   * @param enclaveId                identifier returned in status payloads
   * @param delegationChainVerifier  the store and retrieve verifier
   * @param adminAuthenticator       the admin authenticator
   * @param adminWhitelist           the configured admin whitelist
   * @param maintenanceStatus        the maintenance status shared with the admin authenticator
   * @param statusMapper             the status mapper
   * @param attestationQuoteProvider the attestation quote provider
   */
  public KeyshareGate(final String enclaveId,
                      final DelegationChainVerifier delegationChainVerifier,
                      final AdminAuthenticator adminAuthenticator,
                      final AdminWhitelist adminWhitelist,
                      final MaintenanceStatus maintenanceStatus,
                      final VerificationStatusMapper statusMapper,
                      final AttestationQuoteProvider attestationQuoteProvider) {
    log.info("KeyshareGate({}, {})", enclaveId, adminWhitelist);
    this.enclaveId = enclaveId;
    this.delegationChainVerifier = delegationChainVerifier;
    this.adminAuthenticator = adminAuthenticator;
    this.adminWhitelist = adminWhitelist;
    this.maintenanceStatus = maintenanceStatus;
    this.statusMapper = statusMapper;
    this.attestationQuoteProvider = attestationQuoteProvider;
  }

  /**
   * Builds a gate that reads the chain height over JSON-RPC.
   *
   * @param configuration    the configuration
   * @param chainStateOracle the chain state oracle
   * @return the gate
   */
  public static KeyshareGate create(final KeyshareGateConfiguration configuration,
                                    final ChainStateOracle chainStateOracle) {
    final ObjectMapper objectMapper = new ObjectMapper();
    final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(configuration.getConnectTimeoutMillis()))
        .build();
    final ChainHeightOracle heightOracle = new SubstrateRpcAccessor(
        URI.create(configuration.getChainRpcEndpoint()),
        Duration.ofMillis(configuration.getRequestTimeoutMillis()),
        httpClient,
        objectMapper);
    return create(configuration, heightOracle, chainStateOracle, objectMapper);
  }

  /**
   * Builds a gate over the given oracles.
   *
   * @param configuration    the configuration
   * @param heightOracle     the chain height oracle
   * @param chainStateOracle the chain state oracle
   * @param objectMapper     the object mapper for admin tokens and payloads
   * @return the gate
   */
  public static KeyshareGate create(final KeyshareGateConfiguration configuration,
                                    final ChainHeightOracle heightOracle,
                                    final ChainStateOracle chainStateOracle,
                                    final ObjectMapper objectMapper) {
    final SignatureVerifier signatureVerifier = new SignatureVerifier(Sr25519.substrate());
    final TokenValidator tokenValidator = new TokenValidator(heightOracle, configuration.getTokenGraceBlocks());
    final AdminTokenValidator adminTokenValidator = new AdminTokenValidator(heightOracle,
        configuration.getAdminMaxValidationPeriod(), configuration.getAdminMaxBlockVariation());
    final RequesterAuthorizer requesterAuthorizer = new RequesterAuthorizer(chainStateOracle);
    final MaintenanceStatus maintenanceStatus = new MaintenanceStatus();

    if (configuration.getAdminWhitelist().isEmpty()) {
      log.warn("No admin whitelist configured; every admin request will be rejected.");
    }
    return new KeyshareGate(
        configuration.getEnclaveId(),
        new DelegationChainVerifier(signatureVerifier, tokenValidator, chainStateOracle, requesterAuthorizer),
        new AdminAuthenticator(maintenanceStatus, adminTokenValidator, signatureVerifier, objectMapper),
        AdminWhitelist.of(configuration.getAdminWhitelist()),
        maintenanceStatus,
        new VerificationStatusMapper(),
        new AttestationQuoteProvider(
            Path.of(configuration.getAttestationDevicePath()),
            Path.of(configuration.getQuoteOutputPath())));
  }

  public StoreKeyshareData verifyStoreRequest(final StoreKeysharePacket packet, final NftType nftType)
      throws VerificationException {
    return delegationChainVerifier.verifyStoreRequest(packet, nftType);
  }

  public RetrieveKeyshareData verifyRetrieveRequest(final RetrieveKeysharePacket packet, final NftType nftType)
      throws VerificationException {
    return delegationChainVerifier.verifyRetrieveRequest(packet, nftType);
  }

  public StoreKeyshareData verifyFreeStoreRequest(final StoreKeysharePacket packet) throws VerificationException {
    return delegationChainVerifier.verifyFreeStoreRequest(packet);
  }

  public RetrieveKeyshareData verifyFreeRetrieveRequest(final RetrieveKeysharePacket packet)
      throws VerificationException {
    return delegationChainVerifier.verifyFreeRetrieveRequest(packet);
  }

  /**
   * Authenticates an admin request against the configured whitelist.
   *
   * @param packet the packet
   * @return the authenticated payload
   * @throws AdminAuthenticationException if any check fails
   */
  public ParsedAdminPayload verifyAdminRequest(final AdminFetchIdPacket packet) throws AdminAuthenticationException {
    return adminAuthenticator.verifyAdminRequest(packet, adminWhitelist);
  }

  public VerificationStatus express(final VerificationException exception,
                                   final ApiCall call,
                                   final String caller,
                                   final long nftId) {
    return statusMapper.express(exception, call, caller, nftId, enclaveId);
  }

  public VerificationStatus expressInfrastructureFailure(final ChainQueryException exception,
                                                         final ApiCall call,
                                                         final String caller,
                                                         final long nftId) {
    return statusMapper.expressInfrastructureFailure(exception, call, caller, nftId, enclaveId);
  }

  public byte[] generateQuote() {
    return attestationQuoteProvider.generateQuote();
  }

  public MaintenanceStatus maintenanceStatus() {
    return maintenanceStatus;
  }

  /**
   * Registers the gate's health checks.
   *
   * @param registry the registry
   */
  public void registerHealthChecks(final HealthCheckRegistry registry) {
    registry.register("keyshare-maintenance", new MaintenanceHealthCheck(maintenanceStatus));
  }
}
