package com.codeheadsystems.keyshare.model.error;

/**
 * Why a signature string could not be parsed.
 */
public enum SignatureError {
  /** The mandatory {@code 0x} prefix is missing. */
  PREFIX_ERROR("PREFIXERROR"),
  /** The hex does not decode to exactly 64 bytes. */
  LENGTH_ERROR("LENGTHERROR"),
  /** The signature slot name is not recognised. */
  TYPE_ERROR("TYPEERROR");

  private final String tag;

  SignatureError(String tag) {
    this.tag = tag;
  }

  /**
   * The tag used in external status descriptions.
   *
   * @return the tag
   */
  public String tag() {
    return tag;
  }
}
