package com.codeheadsystems.keyshare.server;

import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.account;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.address;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.newKeyPair;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.retrieveData;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.retrievePacket;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.sign;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.signerField;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.storeData;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.storePacket;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.codahale.metrics.health.HealthCheckRegistry;
import com.codeheadsystems.keyshare.crypto.sr25519.Sr25519KeyPair;
import com.codeheadsystems.keyshare.model.NftRecord;
import com.codeheadsystems.keyshare.model.NftType;
import com.codeheadsystems.keyshare.model.RequesterType;
import com.codeheadsystems.keyshare.model.error.AdminAuthenticationException;
import com.codeheadsystems.keyshare.model.error.AdminError;
import com.codeheadsystems.keyshare.model.error.VerificationException;
import com.codeheadsystems.keyshare.model.packet.AdminFetchIdPacket;
import com.codeheadsystems.keyshare.model.packet.RetrieveKeysharePacket;
import com.codeheadsystems.keyshare.model.status.ApiCall;
import com.codeheadsystems.keyshare.model.status.ReturnStatus;
import com.codeheadsystems.keyshare.model.status.VerificationStatus;
import com.codeheadsystems.keyshare.server.chain.ChainQueryException;
import com.codeheadsystems.keyshare.server.chain.InMemoryChainStateOracle;
import com.codeheadsystems.keyshare.server.config.KeyshareGateConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyshareGateTest {

  private static final long BLOCK = 2000;
  private static final long NFT_ID = 77;

  @TempDir Path tempDir;

  private AtomicLong height;
  private InMemoryChainStateOracle chainState;
  private Sr25519KeyPair owner;
  private Sr25519KeyPair admin;
  private KeyshareGate gate;

  @BeforeEach
  void setUp() {
    height = new AtomicLong(BLOCK);
    chainState = new InMemoryChainStateOracle();
    owner = newKeyPair();
    admin = newKeyPair();
    chainState.putAsset(NFT_ID, new NftRecord(account(owner), false, true));

    KeyshareGateConfiguration configuration = new KeyshareGateConfiguration();
    configuration.setEnclaveId("enclave-7");
    configuration.setAdminWhitelist(List.of(address(admin)));
    configuration.setAttestationDevicePath(tempDir.resolve("no-device").toString());
    configuration.setQuoteOutputPath(tempDir.resolve("enclave.quote").toString());

    gate = KeyshareGate.create(configuration, height::get, chainState, new ObjectMapper());
  }

  @Test
  void capsuleStoreThenRetrieve() throws Exception {
    Sr25519KeyPair signer = newKeyPair();
    String signer0 = signerField(signer, BLOCK, 100);
    String data = storeData(NFT_ID, "capsule-share", BLOCK, 10);

    assertThat(gate.verifyStoreRequest(storePacket(owner, signer, signer0, data), NftType.CAPSULE).nftId())
        .isEqualTo(NFT_ID);
    assertThat(gate.verifyFreeStoreRequest(storePacket(owner, signer, signer0, data)).nftId()).isEqualTo(NFT_ID);

    RetrieveKeysharePacket retrieve = retrievePacket(owner, RequesterType.OWNER, retrieveData(NFT_ID, BLOCK, 10));
    assertThat(gate.verifyRetrieveRequest(retrieve, NftType.CAPSULE).nftId()).isEqualTo(NFT_ID);
    assertThat(gate.verifyFreeRetrieveRequest(retrieve).nftId()).isEqualTo(NFT_ID);
  }

  @Test
  void rejection_isExpressedWithEnclaveId() {
    RetrieveKeysharePacket retrieve = retrievePacket(owner, RequesterType.OWNER, retrieveData(NFT_ID, BLOCK, 10));
    VerificationException e = catchThrowableOfType(
        () -> gate.verifyRetrieveRequest(retrieve, NftType.SECRET_NFT), VerificationException.class);

    VerificationStatus status = gate.express(e, ApiCall.forRetrieve(NftType.SECRET_NFT), address(owner), NFT_ID);

    assertThat(status.status()).isEqualTo(ReturnStatus.IDISNOTASECRETNFT);
    assertThat(status.enclaveId()).isEqualTo("enclave-7");
    assertThat(status.description()).startsWith("TEE Key-share NFTRETRIEVE: ");
  }

  @Test
  void infrastructureFailure_isExpressedAsOracleFailure() {
    VerificationStatus status = gate.expressInfrastructureFailure(new ChainQueryException("down", null),
        ApiCall.NFTSTORE, "caller", NFT_ID);

    assertThat(status.status()).isEqualTo(ReturnStatus.ORACLEFAILURE);
    assertThat(status.enclaveId()).isEqualTo("enclave-7");
  }

  @Test
  void verifyAdminRequest_usesConfiguredWhitelist() throws Exception {
    String ids = "[77]";
    String hash = Hex.toHexString(MessageDigest.getInstance("SHA-256").digest(ids.getBytes(StandardCharsets.UTF_8)));
    String token = "{\"block_number\":" + BLOCK + ",\"block_validation\":10,\"data_hash\":\"" + hash + "\"}";

    AdminFetchIdPacket fromAdmin = new AdminFetchIdPacket(address(admin), ids, token, sign(admin, token));
    assertThat(gate.verifyAdminRequest(fromAdmin).nftIds()).containsExactly(NFT_ID);

    AdminFetchIdPacket fromOwner = new AdminFetchIdPacket(address(owner), ids, token, sign(owner, token));
    AdminAuthenticationException e = catchThrowableOfType(() -> gate.verifyAdminRequest(fromOwner),
        AdminAuthenticationException.class);
    assertThat(e.error()).isEqualTo(AdminError.NOT_WHITELISTED);
    assertThat(gate.maintenanceStatus().inMaintenance()).isFalse();
  }

  @Test
  void healthChecks_areRegistered() {
    HealthCheckRegistry registry = new HealthCheckRegistry();
    gate.registerHealthChecks(registry);

    assertThat(registry.getNames()).contains("keyshare-maintenance");
    assertThat(registry.runHealthCheck("keyshare-maintenance").isHealthy()).isTrue();
  }

  @Test
  void generateQuote_outsideEnclave_isSentinel() {
    assertThat(new String(gate.generateQuote(), StandardCharsets.UTF_8)).isEqualTo("This is NOT inside an Enclave!");
  }

  @Test
  void create_withRpcEndpoint_buildsWithoutContactingNode() {
    KeyshareGateConfiguration configuration = new KeyshareGateConfiguration();
    configuration.setChainRpcEndpoint("http://127.0.0.1:1");

    assertThat(KeyshareGate.create(configuration, chainState)).isNotNull();
  }
}
