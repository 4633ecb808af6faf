package com.codeheadsystems.keyshare.server.status;

import com.codeheadsystems.keyshare.model.error.SignatureError;
import com.codeheadsystems.keyshare.model.error.VerificationError;
import com.codeheadsystems.keyshare.model.error.VerificationException;
import com.codeheadsystems.keyshare.model.status.ApiCall;
import com.codeheadsystems.keyshare.model.status.ReturnStatus;
import com.codeheadsystems.keyshare.model.status.VerificationStatus;
import com.codeheadsystems.keyshare.server.chain.ChainQueryException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a rejection into the status payload returned to the client. Every
 * {@link VerificationError} has exactly one {@link ReturnStatus}; the tags are matched by
 * clients and never change.
 */
@Singleton
public class VerificationStatusMapper {

  private static final Logger log = LoggerFactory.getLogger(VerificationStatusMapper.class);

  /**
   * Instantiates a new Verification status mapper.
   */
  @Inject
  public VerificationStatusMapper() {
    log.info("VerificationStatusMapper()");
  }

  /**
   * Status tag for an error.
   *
   * @param error the error
   * @return the tag
   */
  public static ReturnStatus statusOf(final VerificationError error) {
    return switch (error) {
      case INVALID_SIGNER_SIG -> ReturnStatus.INVALIDSIGNERSIGNATURE;
      case INVALID_DATA_SIG -> ReturnStatus.INVALIDDATASIGNATURE;
      case INVALID_OWNER_ADDRESS -> ReturnStatus.INVALIDOWNERADDRESS;
      case INVALID_SIGNER_ADDRESS -> ReturnStatus.INVALIDSIGNERADDRESS;
      case SIGNER_VERIFICATION_FAILED -> ReturnStatus.SIGNERSIGVERIFICATIONFAILED;
      case DATA_VERIFICATION_FAILED -> ReturnStatus.DATASIGVERIFICATIONFAILED;
      case INVALID_AUTH_TOKEN -> ReturnStatus.INVALIDAUTHTOKEN;
      case INVALID_NFT_ID -> ReturnStatus.INVALIDNFTID;
      case INVALID_KEYSHARE -> ReturnStatus.INVALIDKEYSHARE;
      case OWNERSHIP_VERIFICATION_FAILED -> ReturnStatus.OWNERSHIPVERIFICATIONFAILED;
      case REQUESTER_VERIFICATION_FAILED -> ReturnStatus.REQUESTERVERIFICATIONFAILED;
      case EXPIRED_SIGNER -> ReturnStatus.EXPIREDSIGNER;
      case EXPIRED_DATA -> ReturnStatus.EXPIREDREQUEST;
      case ID_IS_NOT_SECRET_NFT -> ReturnStatus.IDISNOTASECRETNFT;
      case ID_IS_NOT_CAPSULE -> ReturnStatus.IDISNOTACAPSULE;
      case MALFORMED_DATA -> ReturnStatus.INVALIDDATAFORMAT;
      case MALFORMED_SIGNER -> ReturnStatus.INVALIDSIGNERFORMAT;
    };
  }

  /**
   * Expresses a rejection as a status payload.
   *
   * @param exception the rejection
   * @param call      the operation that was requested
   * @param caller    the caller, for the log line
   * @param nftId     the asset id, 0 when unknown
   * @param enclaveId the answering enclave
   * @return the status payload
   */
  public VerificationStatus express(final VerificationException exception,
                                    final ApiCall call,
                                    final String caller,
                                    final long nftId,
                                    final String enclaveId) {
    final String reason = exception.signatureError().map(SignatureError::tag).orElse("");
    final String description = "TEE Key-share " + call + ": " + describe(exception.error(), reason);
    log.info("{}, requester : {}", description, caller);
    return new VerificationStatus(statusOf(exception.error()), nftId, enclaveId, description);
  }

  /**
   * Expresses a failed chain query. The request was not judged, so the status is distinct from
   * every rejection.
   *
   * @param exception the failure
   * @param call      the operation that was requested
   * @param caller    the caller, for the log line
   * @param nftId     the asset id, 0 when unknown
   * @param enclaveId the answering enclave
   * @return the status payload
   */
  public VerificationStatus expressInfrastructureFailure(final ChainQueryException exception,
                                                         final ApiCall call,
                                                         final String caller,
                                                         final long nftId,
                                                         final String enclaveId) {
    final String description = "TEE Key-share " + call + ": Unable to query the blockchain, please retry.";
    log.error("{}, requester : {}, cause : {}", description, caller, exception.getMessage());
    return new VerificationStatus(ReturnStatus.ORACLEFAILURE, nftId, enclaveId, description);
  }

  private static String describe(final VerificationError error, final String reason) {
    return switch (error) {
      case INVALID_SIGNER_SIG -> "Invalid request signature format, " + reason;
      case INVALID_DATA_SIG -> "Invalid request data signature format, " + reason;
      case INVALID_OWNER_ADDRESS -> "Invalid owner address format";
      case INVALID_SIGNER_ADDRESS -> "Invalid signer address format";
      case SIGNER_VERIFICATION_FAILED ->
          "Signer signature verification failed, Signer is not approved by NFT owner";
      case DATA_VERIFICATION_FAILED -> "Data signature verification failed.";
      case INVALID_AUTH_TOKEN -> "Invalid authentication-token format.";
      case INVALID_NFT_ID -> "The nft-id is not a valid number or nft does not exist.";
      case INVALID_KEYSHARE -> "The key-share is empty or not a valid string.";
      case OWNERSHIP_VERIFICATION_FAILED -> "The nft-id is not owned by this owner.";
      case REQUESTER_VERIFICATION_FAILED -> "The requester is not either owner, delegatee or rentee.";
      case EXPIRED_SIGNER -> "The signer account has been expired or is not in valid range.";
      case EXPIRED_DATA -> "The request data field has been expired or is not in valid range.";
      case ID_IS_NOT_SECRET_NFT -> "The nft-id is not a secret-nft.";
      case ID_IS_NOT_CAPSULE -> "The nft-id is not a capsule.";
      case MALFORMED_DATA -> "Failed to parse data field.";
      case MALFORMED_SIGNER -> "Failed to parse Signer field.";
    };
  }
}
