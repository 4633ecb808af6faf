package com.codeheadsystems.keyshare.model.token;

/**
 * The lightweight per-secret token, carried on the wire as {@code "{block_number}_{block_validation}"}
 * at the tail of signer and data fields.
 *
 * @param blockNumber     the block the claim starts near
 * @param blockValidation how many further blocks the claim lasts
 */
public record AuthenticationToken(long blockNumber, long blockValidation) implements ValidityWindow {

  public AuthenticationToken {
    ValidityWindow.requireU32("block_number", blockNumber);
    ValidityWindow.requireU32("block_validation", blockValidation);
  }

  /**
   * The wire form.
   *
   * @return {@code "{block_number}_{block_validation}"}
   */
  public String serialize() {
    return blockNumber + "_" + blockValidation;
  }
}
