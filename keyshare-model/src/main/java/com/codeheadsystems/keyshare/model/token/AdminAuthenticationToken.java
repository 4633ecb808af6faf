package com.codeheadsystems.keyshare.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The hash-bound admin token, carried as JSON in the admin packet's {@code auth_token} field.
 * {@code data_hash} is the lowercase hex SHA-256 of the packet's id payload, which binds the
 * admin's signature to that exact payload.
 *
 * @param blockNumber     the block the claim starts near
 * @param blockValidation how many further blocks the claim lasts, at most 255 on the wire
 * @param dataHash        lowercase hex SHA-256 of the accompanying payload
 */
public record AdminAuthenticationToken(
    @JsonProperty("block_number") long blockNumber,
    @JsonProperty("block_validation") long blockValidation,
    @JsonProperty("data_hash") String dataHash) implements ValidityWindow {

  /** block_validation is a single byte on the wire. */
  public static final long MAX_WIRE_VALIDATION = 0xFF;

  public AdminAuthenticationToken {
    ValidityWindow.requireU32("block_number", blockNumber);
    if (blockValidation < 0 || blockValidation > MAX_WIRE_VALIDATION) {
      throw new IllegalArgumentException("block_validation must fit in one byte: " + blockValidation);
    }
    if (dataHash == null) {
      throw new IllegalArgumentException("Missing required field: data_hash");
    }
  }
}
