package com.codeheadsystems.keyshare.crypto.ss58;

import com.codeheadsystems.keyshare.crypto.common.ByteUtils;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * SS58 account addresses: base58(prefix || public key || checksum), where the checksum is the
 * first two bytes of Blake2b-512("SS58PRE" || prefix || public key).
 * <p>
 * Network prefixes below 64 take one byte; 64..16383 take two.
 */
public final class Ss58Codec {

  public static final int SUBSTRATE_PREFIX = 42;

  private static final byte[] CHECKSUM_PREFIX = "SS58PRE".getBytes(StandardCharsets.US_ASCII);
  private static final int CHECKSUM_LENGTH = 2;
  private static final int MAX_PREFIX = 16383;
  // base58 of a two-byte prefix, a 32-byte key and the checksum
  static final int MAX_ADDRESS_LENGTH = 50;

  private Ss58Codec() {
  }

  /**
   * A decoded address.
   *
   * @param accountId the account
   * @param prefix    the network prefix
   */
  public record Decoded(AccountId accountId, int prefix) {
  }

  /**
   * Decodes and checksums an address.
   *
   * @param address the address
   * @return the account and its network prefix
   * @throws IllegalArgumentException if the address is not valid SS58 for a 32-byte key
   */
  public static Decoded decode(String address) {
    if (address == null || address.isEmpty()) {
      throw new IllegalArgumentException("Empty SS58 address");
    }
    if (address.length() > MAX_ADDRESS_LENGTH) {
      throw new IllegalArgumentException("SS58 address too long: " + address.length() + " characters");
    }
    byte[] data = Base58.decode(address);
    if (data.length < 2) {
      throw new IllegalArgumentException("SS58 address too short");
    }
    int prefixLength;
    int prefix;
    int first = data[0] & 0xFF;
    if (first < 64) {
      prefixLength = 1;
      prefix = first;
    } else if (first < 128) {
      int second = data[1] & 0xFF;
      int lower = ((first << 2) & 0xFF) | (second >> 6);
      int upper = second & 0x3F;
      prefixLength = 2;
      prefix = lower | (upper << 8);
    } else {
      throw new IllegalArgumentException("Invalid SS58 prefix byte");
    }
    if (data.length != prefixLength + AccountId.LENGTH + CHECKSUM_LENGTH) {
      throw new IllegalArgumentException("SS58 address has bad length for a 32-byte account");
    }
    int bodyEnd = prefixLength + AccountId.LENGTH;
    byte[] expected = checksum(Arrays.copyOfRange(data, 0, bodyEnd));
    byte[] actual = Arrays.copyOfRange(data, bodyEnd, data.length);
    if (!Arrays.equals(expected, actual)) {
      throw new IllegalArgumentException("SS58 checksum mismatch");
    }
    return new Decoded(AccountId.of(Arrays.copyOfRange(data, prefixLength, bodyEnd)), prefix);
  }

  /**
   * Encodes an account for a network prefix.
   *
   * @param accountId the account
   * @param prefix    the network prefix, 0..16383
   * @return the address
   */
  public static String encode(AccountId accountId, int prefix) {
    byte[] prefixBytes;
    if (prefix < 0 || prefix > MAX_PREFIX) {
      throw new IllegalArgumentException("SS58 prefix out of range: " + prefix);
    } else if (prefix < 64) {
      prefixBytes = new byte[]{(byte) prefix};
    } else {
      prefixBytes = new byte[]{
          (byte) (((prefix & 0xFC) >> 2) | 0x40),
          (byte) ((prefix >> 8) | ((prefix & 0x03) << 6))
      };
    }
    byte[] body = ByteUtils.concat(prefixBytes, accountId.publicKey());
    return Base58.encode(ByteUtils.concat(body, checksum(body)));
  }

  private static byte[] checksum(byte[] body) {
    Blake2bDigest digest = new Blake2bDigest(512);
    digest.update(CHECKSUM_PREFIX, 0, CHECKSUM_PREFIX.length);
    digest.update(body, 0, body.length);
    byte[] hash = new byte[64];
    digest.doFinal(hash, 0);
    return Arrays.copyOf(hash, CHECKSUM_LENGTH);
  }
}
