package com.codeheadsystems.keyshare.model.error;

/**
 * Every rejection of admin authentication, in the order the checks run.
 */
public enum AdminError {
  NOT_WHITELISTED,
  /** Only one of the {@code <Bytes>} wrapper markers is present. */
  MALFORMED_TOKEN,
  TOKEN_NOT_PARSABLE,
  INVALID_ADMIN_ADDRESS,
  INVALID_SIGNATURE,
  TOKEN_NOT_VALID,
  DATA_HASH_MISMATCH,
  PAYLOAD_NOT_PARSABLE
}
