package com.codeheadsystems.keyshare.crypto.ss58;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * A chain account: the 32-byte sr25519 public key. Equality is by key bytes.
 */
public final class AccountId {

  public static final int LENGTH = 32;

  private final byte[] publicKey;

  private AccountId(byte[] publicKey) {
    this.publicKey = publicKey;
  }

  /**
   * Wraps a public key.
   *
   * @param publicKey the 32 key bytes
   * @return the account
   */
  public static AccountId of(byte[] publicKey) {
    if (publicKey == null || publicKey.length != LENGTH) {
      throw new IllegalArgumentException("Account public key must be " + LENGTH + " bytes");
    }
    return new AccountId(publicKey.clone());
  }

  /**
   * Parses an SS58 address of any network prefix.
   *
   * @param address the address
   * @return the account
   * @throws IllegalArgumentException if the address is not valid SS58
   */
  public static AccountId fromSs58(String address) {
    return Ss58Codec.decode(address).accountId();
  }

  public byte[] publicKey() {
    return publicKey.clone();
  }

  /**
   * The generic Substrate (prefix 42) rendering.
   *
   * @return the address
   */
  public String toSs58() {
    return Ss58Codec.encode(this, Ss58Codec.SUBSTRATE_PREFIX);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof AccountId other && Arrays.equals(publicKey, other.publicKey);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(publicKey);
  }

  @Override
  public String toString() {
    return "AccountId[" + Hex.toHexString(publicKey) + "]";
  }
}
