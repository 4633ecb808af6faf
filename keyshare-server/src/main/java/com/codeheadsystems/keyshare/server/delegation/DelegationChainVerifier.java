package com.codeheadsystems.keyshare.server.delegation;

import static com.codeheadsystems.keyshare.model.error.VerificationError.DATA_VERIFICATION_FAILED;
import static com.codeheadsystems.keyshare.model.error.VerificationError.EXPIRED_DATA;
import static com.codeheadsystems.keyshare.model.error.VerificationError.EXPIRED_SIGNER;
import static com.codeheadsystems.keyshare.model.error.VerificationError.ID_IS_NOT_CAPSULE;
import static com.codeheadsystems.keyshare.model.error.VerificationError.ID_IS_NOT_SECRET_NFT;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_DATA_SIG;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_NFT_ID;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_OWNER_ADDRESS;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_SIGNER_SIG;
import static com.codeheadsystems.keyshare.model.error.VerificationError.OWNERSHIP_VERIFICATION_FAILED;
import static com.codeheadsystems.keyshare.model.error.VerificationError.REQUESTER_VERIFICATION_FAILED;
import static com.codeheadsystems.keyshare.model.error.VerificationError.SIGNER_VERIFICATION_FAILED;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.NftRecord;
import com.codeheadsystems.keyshare.model.NftType;
import com.codeheadsystems.keyshare.model.RequesterType;
import com.codeheadsystems.keyshare.model.data.RetrieveKeyshareData;
import com.codeheadsystems.keyshare.model.data.Signer;
import com.codeheadsystems.keyshare.model.data.StoreKeyshareData;
import com.codeheadsystems.keyshare.model.error.SignatureFormatException;
import com.codeheadsystems.keyshare.model.error.VerificationError;
import com.codeheadsystems.keyshare.model.error.VerificationException;
import com.codeheadsystems.keyshare.model.packet.RetrieveKeysharePacket;
import com.codeheadsystems.keyshare.model.packet.StoreKeysharePacket;
import com.codeheadsystems.keyshare.model.token.ValidityWindow;
import com.codeheadsystems.keyshare.server.authorization.RequesterAuthorizer;
import com.codeheadsystems.keyshare.server.chain.ChainStateOracle;
import com.codeheadsystems.keyshare.server.codec.PacketCodec;
import com.codeheadsystems.keyshare.server.signature.SignatureVerifier;
import com.codeheadsystems.keyshare.server.token.TokenValidator;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the signature chains on store and retrieve requests.
 * <p>
 * A store request is a two-tier chain: the owner signs a delegation naming a signer and a
 * window, and the signer signs the data. The steps run in a fixed order and the first failure
 * ends verification:
 * <ol>
 *   <li>owner address, signer field, signer window</li>
 *   <li>owner's signature over the signer field ({@code signersig})</li>
 *   <li>data field, signer's signature over it ({@code signature})</li>
 *   <li>asset record and secret kind</li>
 *   <li>data window, then ownership</li>
 * </ol>
 * A retrieve request is one tier: the requester signs the data directly, and authorization
 * uses the relationship the requester claims.
 * <p>
 * The "free" variants authenticate without consulting chain state and are meant for callers
 * that need authenticity but decide authorization themselves.
 * <p>
 * Exception contract:
 * <ul>
 *   <li>{@link VerificationException} if the request is rejected, with the reason</li>
 *   <li>{@link com.codeheadsystems.keyshare.server.chain.ChainQueryException} if the chain could
 *       not be queried and the request was not judged</li>
 * </ul>
 */
@Singleton
public class DelegationChainVerifier {

  private static final Logger log = LoggerFactory.getLogger(DelegationChainVerifier.class);

  private final SignatureVerifier signatureVerifier;
  private final TokenValidator tokenValidator;
  private final ChainStateOracle chainStateOracle;
  private final RequesterAuthorizer requesterAuthorizer;

  /**
   * Instantiates a new Delegation chain verifier.
   *
   * @param signatureVerifier   the signature verifier
   * @param tokenValidator      the per-secret token validator
   * @param chainStateOracle    the chain state oracle
   * @param requesterAuthorizer the requester authorizer
   */
  @Inject
  public DelegationChainVerifier(final SignatureVerifier signatureVerifier,
                                 final TokenValidator tokenValidator,
                                 final ChainStateOracle chainStateOracle,
                                 final RequesterAuthorizer requesterAuthorizer) {
    log.info("DelegationChainVerifier({}, {}, {}, {})",
        signatureVerifier, tokenValidator, chainStateOracle, requesterAuthorizer);
    this.signatureVerifier = signatureVerifier;
    this.tokenValidator = tokenValidator;
    this.chainStateOracle = chainStateOracle;
    this.requesterAuthorizer = requesterAuthorizer;
  }

  private record AuthenticStore(AccountId owner, StoreKeyshareData data) {
  }

  private record AuthenticRetrieve(AccountId requester, RetrieveKeyshareData data) {
  }

  // ─── Store ────────────────────────────────────────────────────────────────

  /**
   * Verifies a store request end to end.
   *
   * @param packet  the packet
   * @param nftType the kind of secret being stored
   * @return the validated data
   * @throws VerificationException if any step rejects the request
   */
  public StoreKeyshareData verifyStoreRequest(final StoreKeysharePacket packet, final NftType nftType)
      throws VerificationException {
    final AuthenticStore store = authenticateStore(packet);
    final long nftId = store.data().nftId();

    final NftRecord record = requireAsset(nftId, nftType);
    requireFresh(store.data().authToken(), EXPIRED_DATA, nftId);
    log.debug("nft {}: data window valid", nftId);

    if (!requesterAuthorizer.authorize(store.owner(), nftId, record.owner(), RequesterType.OWNER)) {
      throw reject(OWNERSHIP_VERIFICATION_FAILED, nftId);
    }
    log.info("Store request for {} {} accepted", nftType.label(), nftId);
    return store.data();
  }

  /**
   * Authenticates a store request without consulting chain state: delegation, its window, and
   * both signatures.
   *
   * @param packet the packet
   * @return the authenticated data
   * @throws VerificationException if any step rejects the request
   */
  public StoreKeyshareData verifyFreeStoreRequest(final StoreKeysharePacket packet) throws VerificationException {
    return authenticateStore(packet).data();
  }

  private AuthenticStore authenticateStore(final StoreKeysharePacket packet) throws VerificationException {
    final AccountId owner = parseAccount(packet.ownerAddress());
    final Signer signer = PacketCodec.parseSigner(packet.signerAddress());
    log.debug("store: parsed signer {}", signer.account());

    requireFresh(signer.authToken(), EXPIRED_SIGNER, 0);
    log.debug("store: signer window valid");

    final byte[] signerSignature = parseSignature(packet, SignatureVerifier.SIGNER_SLOT, INVALID_SIGNER_SIG);
    if (!signatureVerifier.verify(signerSignature, packet.signerAddress(), owner)) {
      throw reject(SIGNER_VERIFICATION_FAILED, 0);
    }
    log.debug("store: owner signature over signer verified");

    final StoreKeyshareData data = PacketCodec.parseStoreData(packet.data());
    final byte[] dataSignature = parseSignature(packet, SignatureVerifier.OWNER_SLOT, INVALID_DATA_SIG);
    if (!signatureVerifier.verify(dataSignature, packet.data(), signer.account())) {
      throw reject(DATA_VERIFICATION_FAILED, data.nftId());
    }
    log.debug("nft {}: signer signature over data verified", data.nftId());
    return new AuthenticStore(owner, data);
  }

  // ─── Retrieve ─────────────────────────────────────────────────────────────

  /**
   * Verifies a retrieve request end to end.
   *
   * @param packet  the packet
   * @param nftType the kind of secret being retrieved
   * @return the validated data
   * @throws VerificationException if any step rejects the request
   */
  public RetrieveKeyshareData verifyRetrieveRequest(final RetrieveKeysharePacket packet, final NftType nftType)
      throws VerificationException {
    final AuthenticRetrieve retrieve = authenticateRetrieve(packet);
    final long nftId = retrieve.data().nftId();

    final NftRecord record = requireAsset(nftId, nftType);
    requireFresh(retrieve.data().authToken(), EXPIRED_DATA, nftId);
    log.debug("nft {}: data window valid", nftId);

    final RequesterType claimed = packet.requesterType();
    if (claimed == null
        || !requesterAuthorizer.authorize(retrieve.requester(), nftId, record.owner(), claimed)) {
      throw reject(REQUESTER_VERIFICATION_FAILED, nftId);
    }
    log.info("Retrieve request for {} {} accepted for {}", nftType.label(), nftId, claimed);
    return retrieve.data();
  }

  /**
   * Authenticates a retrieve request without consulting chain state: signature and data window.
   *
   * @param packet the packet
   * @return the authenticated data
   * @throws VerificationException if any step rejects the request
   */
  public RetrieveKeyshareData verifyFreeRetrieveRequest(final RetrieveKeysharePacket packet)
      throws VerificationException {
    final AuthenticRetrieve retrieve = authenticateRetrieve(packet);
    requireFresh(retrieve.data().authToken(), EXPIRED_DATA, retrieve.data().nftId());
    return retrieve.data();
  }

  private AuthenticRetrieve authenticateRetrieve(final RetrieveKeysharePacket packet) throws VerificationException {
    final AccountId requester = parseAccount(packet.requesterAddress());
    final RetrieveKeyshareData data = PacketCodec.parseRetrieveData(packet.data());

    final byte[] signature;
    try {
      signature = signatureVerifier.parse(packet.signature());
    } catch (SignatureFormatException e) {
      log.info("Rejected nft {}: {} ({})", data.nftId(), INVALID_DATA_SIG, e.reason());
      throw new VerificationException(INVALID_DATA_SIG, e.reason(), e);
    }
    if (!signatureVerifier.verify(signature, packet.data(), requester)) {
      throw reject(DATA_VERIFICATION_FAILED, data.nftId());
    }
    log.debug("nft {}: requester signature over data verified", data.nftId());
    return new AuthenticRetrieve(requester, data);
  }

  // ─── Shared steps ─────────────────────────────────────────────────────────

  private AccountId parseAccount(final String address) throws VerificationException {
    try {
      return AccountId.fromSs58(address);
    } catch (IllegalArgumentException e) {
      throw reject(INVALID_OWNER_ADDRESS, 0);
    }
  }

  private byte[] parseSignature(final StoreKeysharePacket packet, final String slot, final VerificationError error)
      throws VerificationException {
    try {
      return signatureVerifier.parseSlot(packet, slot);
    } catch (SignatureFormatException e) {
      log.info("Rejected: {} ({})", error, e.reason());
      throw new VerificationException(error, e.reason(), e);
    }
  }

  private void requireFresh(final ValidityWindow token, final VerificationError expired, final long nftId)
      throws VerificationException {
    if (!tokenValidator.isValid(token)) {
      throw reject(expired, nftId);
    }
  }

  private NftRecord requireAsset(final long nftId, final NftType nftType) throws VerificationException {
    final NftRecord record = chainStateOracle.assetRecord(nftId)
        .orElseThrow(() -> reject(INVALID_NFT_ID, nftId));
    if (!record.isOfType(nftType)) {
      throw reject(nftType == NftType.CAPSULE ? ID_IS_NOT_CAPSULE : ID_IS_NOT_SECRET_NFT, nftId);
    }
    log.debug("nft {}: asset record found, kind {} confirmed", nftId, nftType.label());
    return record;
  }

  private static VerificationException reject(final VerificationError error, final long nftId) {
    log.info("Rejected nft {}: {}", nftId, error);
    return new VerificationException(error);
  }
}
