package com.codeheadsystems.keyshare.server.admin;

import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.account;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.address;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.newKeyPair;
import static com.codeheadsystems.keyshare.server.testing.RequestFixtures.sign;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.verifyNoInteractions;

import com.codeheadsystems.keyshare.crypto.sr25519.Sr25519;
import com.codeheadsystems.keyshare.crypto.sr25519.Sr25519KeyPair;
import com.codeheadsystems.keyshare.model.data.ParsedAdminPayload;
import com.codeheadsystems.keyshare.model.error.AdminAuthenticationException;
import com.codeheadsystems.keyshare.model.error.AdminError;
import com.codeheadsystems.keyshare.model.packet.AdminFetchIdPacket;
import com.codeheadsystems.keyshare.model.token.ValidationResult;
import com.codeheadsystems.keyshare.server.codec.PacketCodec;
import com.codeheadsystems.keyshare.server.signature.SignatureVerifier;
import com.codeheadsystems.keyshare.server.token.AdminTokenValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AdminAuthenticatorTest {

  private static final long BLOCK = 5000;
  private static final String IDS = "[12,7,4294967295]";

  @Mock private SignatureVerifier mockSignatureVerifier;
  @Mock private AdminTokenValidator mockTokenValidator;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private AtomicLong height;
  private MaintenanceStatus maintenanceStatus;
  private AdminAuthenticator authenticator;
  private Sr25519KeyPair admin;
  private AdminWhitelist whitelist;

  @BeforeEach
  void setUp() {
    height = new AtomicLong(BLOCK);
    maintenanceStatus = new MaintenanceStatus();
    authenticator = new AdminAuthenticator(maintenanceStatus,
        new AdminTokenValidator(height::get, 20, 5),
        new SignatureVerifier(Sr25519.substrate()),
        objectMapper);
    admin = newKeyPair();
    whitelist = AdminWhitelist.of(address(admin));
  }

  private static String sha256Hex(String payload) throws Exception {
    return Hex.toHexString(MessageDigest.getInstance("SHA-256").digest(payload.getBytes(StandardCharsets.UTF_8)));
  }

  private static String token(long blockNumber, long blockValidation, String dataHash) {
    return "{\"block_number\":" + blockNumber + ",\"block_validation\":" + blockValidation
        + ",\"data_hash\":\"" + dataHash + "\"}";
  }

  private AdminFetchIdPacket packet(Sr25519KeyPair signer, String ids, String tokenField) {
    return new AdminFetchIdPacket(address(signer), ids, tokenField, sign(signer, tokenField));
  }

  private AdminFetchIdPacket validPacket() throws Exception {
    return packet(admin, IDS, token(BLOCK, 10, sha256Hex(IDS)));
  }

  private AdminAuthenticationException failure(AdminFetchIdPacket packet) {
    AdminAuthenticationException e = catchThrowableOfType(
        () -> authenticator.verifyAdminRequest(packet, whitelist), AdminAuthenticationException.class);
    assertThat(e).as("expected an admin rejection").isNotNull();
    assertThat(maintenanceStatus.inMaintenance()).isFalse();
    return e;
  }

  // ─── Success ──────────────────────────────────────────────────────────────

  @Test
  void verifyAdminRequest_valid_returnsPayload() throws Exception {
    ParsedAdminPayload payload = authenticator.verifyAdminRequest(validPacket(), whitelist);

    assertThat(payload.adminAccount()).isEqualTo(account(admin));
    assertThat(payload.nftIds()).containsExactly(12L, 7L, 4294967295L);
    assertThat(payload.authToken().blockNumber()).isEqualTo(BLOCK);
    assertThat(maintenanceStatus.inMaintenance()).isFalse();
  }

  @Test
  void verifyAdminRequest_wrappedToken_isSignedAsReceived() throws Exception {
    String wrapped = PacketCodec.wrap(token(BLOCK, 10, sha256Hex(IDS)));

    assertThat(authenticator.verifyAdminRequest(packet(admin, IDS, wrapped), whitelist).nftIds()).hasSize(3);
  }

  @Test
  void verifyAdminRequest_emptyIdList() throws Exception {
    AdminFetchIdPacket packet = packet(admin, "[]", token(BLOCK, 10, sha256Hex("[]")));

    assertThat(authenticator.verifyAdminRequest(packet, whitelist).nftIds()).isEqualTo(List.of());
  }

  // ─── Ordering ─────────────────────────────────────────────────────────────

  @Test
  void verifyAdminRequest_notWhitelisted_rejectedBeforeAnyCryptography() throws Exception {
    AdminAuthenticator guarded = new AdminAuthenticator(maintenanceStatus, mockTokenValidator,
        mockSignatureVerifier, objectMapper);
    AdminFetchIdPacket packet = validPacket();

    AdminAuthenticationException e = catchThrowableOfType(
        () -> guarded.verifyAdminRequest(packet, AdminWhitelist.of(address(newKeyPair()))),
        AdminAuthenticationException.class);

    assertThat(e.error()).isEqualTo(AdminError.NOT_WHITELISTED);
    verifyNoInteractions(mockSignatureVerifier, mockTokenValidator);
    assertThat(maintenanceStatus.inMaintenance()).isFalse();
  }

  @Test
  void verifyAdminRequest_emptyWhitelist_rejectsEveryone() throws Exception {
    AdminFetchIdPacket packet = validPacket();
    AdminAuthenticationException e = catchThrowableOfType(
        () -> authenticator.verifyAdminRequest(packet, AdminWhitelist.of(List.of())),
        AdminAuthenticationException.class);

    assertThat(e.error()).isEqualTo(AdminError.NOT_WHITELISTED);
  }

  // ─── Failures ─────────────────────────────────────────────────────────────

  @Test
  void verifyAdminRequest_halfWrappedToken_isMalformed() throws Exception {
    String tokenField = "<Bytes>" + token(BLOCK, 10, sha256Hex(IDS));
    assertThat(failure(packet(admin, IDS, tokenField)).error()).isEqualTo(AdminError.MALFORMED_TOKEN);
  }

  @Test
  void verifyAdminRequest_unparsableToken() {
    assertThat(failure(packet(admin, IDS, "{\"block_number\":\"soon\"}")).error())
        .isEqualTo(AdminError.TOKEN_NOT_PARSABLE);
    assertThat(failure(packet(admin, IDS, "{\"block_number\":1,\"block_validation\":1}")).error())
        .isEqualTo(AdminError.TOKEN_NOT_PARSABLE);
    assertThat(failure(packet(admin, IDS, "not json")).error()).isEqualTo(AdminError.TOKEN_NOT_PARSABLE);
  }

  @Test
  void verifyAdminRequest_signatureByAnotherKey_isInvalidSignature() throws Exception {
    String tokenField = token(BLOCK, 10, sha256Hex(IDS));
    AdminFetchIdPacket packet = new AdminFetchIdPacket(address(admin), IDS, tokenField, sign(newKeyPair(), tokenField));

    assertThat(failure(packet).error()).isEqualTo(AdminError.INVALID_SIGNATURE);
  }

  @Test
  void verifyAdminRequest_signatureWithoutPrefix_isInvalidSignature() throws Exception {
    AdminFetchIdPacket valid = validPacket();
    AdminFetchIdPacket packet = new AdminFetchIdPacket(valid.adminAddress(), valid.nftIdVec(), valid.authToken(),
        valid.signature().substring(2));

    assertThat(failure(packet).error()).isEqualTo(AdminError.INVALID_SIGNATURE);
  }

  @Test
  void verifyAdminRequest_whitelistedButUndecodableAddress_isInvalidAdminAddress() throws Exception {
    whitelist = AdminWhitelist.of("not-an-address");
    AdminFetchIdPacket valid = validPacket();
    AdminFetchIdPacket packet = new AdminFetchIdPacket("not-an-address", valid.nftIdVec(), valid.authToken(),
        valid.signature());

    assertThat(failure(packet).error()).isEqualTo(AdminError.INVALID_ADMIN_ADDRESS);
  }

  @Test
  void verifyAdminRequest_staleOrFutureOrLongToken_isNotValid() throws Exception {
    height.set(BLOCK + 10 + 6);
    AdminAuthenticationException expired = failure(validPacket());
    assertThat(expired.error()).isEqualTo(AdminError.TOKEN_NOT_VALID);
    assertThat(expired.validationResult()).contains(ValidationResult.EXPIRED_BLOCK_NUMBER);

    height.set(BLOCK - 6);
    assertThat(failure(validPacket()).validationResult()).contains(ValidationResult.FUTURE_BLOCK_NUMBER);

    height.set(BLOCK);
    AdminFetchIdPacket longLived = packet(admin, IDS, token(BLOCK, 21, sha256Hex(IDS)));
    assertThat(failure(longLived).validationResult()).contains(ValidationResult.INVALID_PERIOD);
  }

  @Test
  void verifyAdminRequest_hashOfOtherPayload_isMismatch() throws Exception {
    AdminFetchIdPacket packet = packet(admin, "[12,7]", token(BLOCK, 10, sha256Hex(IDS)));

    assertThat(failure(packet).error()).isEqualTo(AdminError.DATA_HASH_MISMATCH);
  }

  @Test
  void verifyAdminRequest_hashMatchesButPayloadIsNotIds_isNotParsable() throws Exception {
    for (String ids : List.of("[1,\"two\"]", "{\"ids\":[1]}", "[4294967296]", "[-1]", "[1.5]", "oops")) {
      AdminFetchIdPacket packet = packet(admin, ids, token(BLOCK, 10, sha256Hex(ids)));
      assertThat(failure(packet).error()).as(ids).isEqualTo(AdminError.PAYLOAD_NOT_PARSABLE);
    }
  }

  @Test
  void verifyAdminRequest_uppercaseHash_isMismatch() throws Exception {
    AdminFetchIdPacket packet = packet(admin, IDS, token(BLOCK, 10, sha256Hex(IDS).toUpperCase()));

    assertThat(failure(packet).error()).isEqualTo(AdminError.DATA_HASH_MISMATCH);
  }
}
