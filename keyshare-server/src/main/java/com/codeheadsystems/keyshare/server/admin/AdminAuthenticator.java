package com.codeheadsystems.keyshare.server.admin;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.data.ParsedAdminPayload;
import com.codeheadsystems.keyshare.model.error.AdminAuthenticationException;
import com.codeheadsystems.keyshare.model.error.AdminError;
import com.codeheadsystems.keyshare.model.error.SignatureFormatException;
import com.codeheadsystems.keyshare.model.packet.AdminFetchIdPacket;
import com.codeheadsystems.keyshare.model.token.AdminAuthenticationToken;
import com.codeheadsystems.keyshare.model.token.ValidationResult;
import com.codeheadsystems.keyshare.model.token.ValidityWindow;
import com.codeheadsystems.keyshare.server.codec.PacketCodec;
import com.codeheadsystems.keyshare.server.signature.SignatureVerifier;
import com.codeheadsystems.keyshare.server.token.AdminTokenValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates admin bulk requests.
 * <p>
 * Checks run in this order and the first failure ends authentication:
 * <ol>
 *   <li>whitelist membership, before any parsing or cryptography</li>
 *   <li>wrapper strip and JSON parse of {@code auth_token}</li>
 *   <li>admin address decode and signature over the raw {@code auth_token}</li>
 *   <li>token window</li>
 *   <li>{@code data_hash} equals the SHA-256 of {@code nftid_vec}</li>
 *   <li>{@code nftid_vec} parses as a JSON array of u32 ids</li>
 * </ol>
 * The maintenance message is raised for the duration of the call and cleared on every exit.
 */
public class AdminAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(AdminAuthenticator.class);

  private final MaintenanceStatus maintenanceStatus;
  private final AdminTokenValidator adminTokenValidator;
  private final SignatureVerifier signatureVerifier;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Admin authenticator.
   *
   * @param maintenanceStatus   the maintenance status
   * @param adminTokenValidator the admin token validator
   * @param signatureVerifier   the signature verifier
   * @param objectMapper        the object mapper used for the token and payload
   */
  public AdminAuthenticator(final MaintenanceStatus maintenanceStatus,
                            final AdminTokenValidator adminTokenValidator,
                            final SignatureVerifier signatureVerifier,
                            final ObjectMapper objectMapper) {
    log.info("AdminAuthenticator({}, {}, {})", maintenanceStatus, adminTokenValidator, signatureVerifier);
    this.maintenanceStatus = maintenanceStatus;
    this.adminTokenValidator = adminTokenValidator;
    this.signatureVerifier = signatureVerifier;
    this.objectMapper = objectMapper;
  }

  /**
   * Authenticates an admin request against a whitelist.
   *
   * @param packet    the packet
   * @param whitelist the admins allowed to issue the request
   * @return the authenticated payload
   * @throws AdminAuthenticationException if any check fails
   */
  public ParsedAdminPayload verifyAdminRequest(final AdminFetchIdPacket packet, final AdminWhitelist whitelist)
      throws AdminAuthenticationException {
    try (MaintenanceStatus.Scope ignored = maintenanceStatus.enter(MaintenanceStatus.BACKUP_MESSAGE)) {
      return authenticate(packet, whitelist);
    }
  }

  private ParsedAdminPayload authenticate(final AdminFetchIdPacket packet, final AdminWhitelist whitelist)
      throws AdminAuthenticationException {
    if (!whitelist.contains(packet.adminAddress())) {
      throw fail(AdminError.NOT_WHITELISTED, "Requester is not whitelisted: " + packet.adminAddress());
    }

    final AdminAuthenticationToken token = parseToken(packet.authToken());
    log.debug("admin token parsed: {}", token);

    final AccountId admin;
    try {
      admin = AccountId.fromSs58(packet.adminAddress());
    } catch (IllegalArgumentException e) {
      throw fail(AdminError.INVALID_ADMIN_ADDRESS, "Invalid admin address: " + e.getMessage());
    }
    final byte[] signature;
    try {
      signature = signatureVerifier.parse(packet.signature());
    } catch (SignatureFormatException e) {
      throw fail(AdminError.INVALID_SIGNATURE, "Invalid admin signature format: " + e.reason().tag());
    }
    if (!signatureVerifier.verify(signature, packet.authToken(), admin)) {
      throw fail(AdminError.INVALID_SIGNATURE, "Admin signature verification failed");
    }
    log.debug("admin signature verified for {}", admin);

    final ValidationResult result = adminTokenValidator.validate(token);
    if (result != ValidationResult.SUCCESS) {
      log.error("Admin token is not valid: {}", result);
      throw new AdminAuthenticationException(AdminError.TOKEN_NOT_VALID, result,
          "Authentication token is not valid: " + result, null);
    }

    final String payload = packet.nftIdVec() == null ? "" : packet.nftIdVec();
    final String hash = sha256Hex(payload);
    if (!hash.equals(token.dataHash())) {
      throw fail(AdminError.DATA_HASH_MISMATCH, "Mismatch data hash: expected " + token.dataHash()
          + ", computed " + hash);
    }

    final List<Long> nftIds = parsePayload(payload);
    log.info("Admin {} authenticated for {} ids", packet.adminAddress(), nftIds.size());
    return new ParsedAdminPayload(admin, token, nftIds);
  }

  private AdminAuthenticationToken parseToken(final String field) throws AdminAuthenticationException {
    final Optional<String> stripped = PacketCodec.stripWrapper(field);
    if (stripped.isEmpty()) {
      throw fail(AdminError.MALFORMED_TOKEN, "Authentication token has an unbalanced wrapper");
    }
    try {
      return objectMapper.readValue(stripped.get(), AdminAuthenticationToken.class);
    } catch (JsonProcessingException e) {
      log.error("Unable to parse admin token: {}", e.getOriginalMessage());
      throw new AdminAuthenticationException(AdminError.TOKEN_NOT_PARSABLE,
          "Unable to parse the authentication token", e);
    }
  }

  private List<Long> parsePayload(final String payload) throws AdminAuthenticationException {
    final JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      log.error("Unable to parse admin payload: {}", e.getOriginalMessage());
      throw new AdminAuthenticationException(AdminError.PAYLOAD_NOT_PARSABLE,
          "Unable to parse the nft id vector", e);
    }
    if (root == null || !root.isArray()) {
      throw fail(AdminError.PAYLOAD_NOT_PARSABLE, "The nft id vector is not a JSON array");
    }
    final List<Long> ids = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      if (!node.isIntegralNumber() || !node.canConvertToLong()
          || node.asLong() < 0 || node.asLong() > ValidityWindow.MAX_U32) {
        throw fail(AdminError.PAYLOAD_NOT_PARSABLE, "Not a u32 nft id: " + node);
      }
      ids.add(node.asLong());
    }
    return ids;
  }

  private static String sha256Hex(final String payload) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return Hex.toHexString(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static AdminAuthenticationException fail(final AdminError error, final String message) {
    log.error("Admin authentication failed ({}): {}", error, message);
    return new AdminAuthenticationException(error, message);
  }
}
