package com.codeheadsystems.keyshare.model.error;

/**
 * Every terminal outcome of store and retrieve verification.
 */
public enum VerificationError {
  // format
  MALFORMED_DATA,
  MALFORMED_SIGNER,
  INVALID_SIGNER_ADDRESS,
  INVALID_OWNER_ADDRESS,
  INVALID_NFT_ID,
  INVALID_KEYSHARE,
  INVALID_AUTH_TOKEN,
  INVALID_SIGNER_SIG,
  INVALID_DATA_SIG,
  // authenticity
  SIGNER_VERIFICATION_FAILED,
  DATA_VERIFICATION_FAILED,
  // authorization
  OWNERSHIP_VERIFICATION_FAILED,
  REQUESTER_VERIFICATION_FAILED,
  // freshness
  EXPIRED_SIGNER,
  EXPIRED_DATA,
  // domain mismatch
  ID_IS_NOT_SECRET_NFT,
  ID_IS_NOT_CAPSULE;

  /**
   * Whether this outcome carries a {@link SignatureError} reason.
   *
   * @return true for the two signature-format outcomes
   */
  public boolean carriesSignatureReason() {
    return this == INVALID_SIGNER_SIG || this == INVALID_DATA_SIG;
  }
}
