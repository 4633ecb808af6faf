package com.codeheadsystems.keyshare.model.token;

/**
 * Outcome of an admin token window check. Everything but {@link #SUCCESS} rejects; the values
 * exist so the rejection can be logged precisely.
 */
public enum ValidationResult {
  SUCCESS,
  /** The chain has moved past the window plus tolerance. */
  EXPIRED_BLOCK_NUMBER,
  /** The token claims a start block too far ahead of the chain. */
  FUTURE_BLOCK_NUMBER,
  /** block_validation exceeds the configured maximum period. */
  INVALID_PERIOD,
  /** The current chain height could not be obtained. */
  ERROR_RPC_CALL
}
