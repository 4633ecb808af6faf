package com.codeheadsystems.keyshare.model.token;

/**
 * Anything carrying a block-height validity claim: "valid from near {@code blockNumber} for
 * {@code blockValidation} further blocks".
 */
public interface ValidityWindow {

  /** Largest value of an unsigned 32-bit chain number. */
  long MAX_U32 = 0xFFFFFFFFL;

  long blockNumber();

  long blockValidation();

  /**
   * Rejects values outside the unsigned 32-bit range chain numbers live in.
   *
   * @param field the field name, for the message
   * @param value the value
   * @return the value
   */
  static long requireU32(String field, long value) {
    if (value < 0 || value > MAX_U32) {
      throw new IllegalArgumentException(field + " is outside the unsigned 32-bit range: " + value);
    }
    return value;
  }
}
