package com.codeheadsystems.keyshare.server.signature;

import com.codeheadsystems.keyshare.crypto.sr25519.Sr25519;
import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.error.SignatureError;
import com.codeheadsystems.keyshare.model.error.SignatureFormatException;
import com.codeheadsystems.keyshare.model.packet.StoreKeysharePacket;
import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses hex signature strings and checks sr25519 signatures over raw packet fields.
 * <p>
 * Parsing and verification fail separately: a string that is not {@code 0x} followed by exactly
 * 128 hex digits raises {@link SignatureFormatException}, while a well-formed signature that does
 * not verify is simply {@code false}. Fields are verified byte-for-byte as received, wrapper
 * markers included.
 */
@Singleton
public class SignatureVerifier {

  public static final String SIGNATURE_PREFIX = "0x";

  /** Store packet slot holding the owner's signature over the signer field. */
  public static final String SIGNER_SLOT = "signer";

  /** Store packet slot holding the signer's signature over the data field. */
  public static final String OWNER_SLOT = "owner";

  private static final int SIGNATURE_HEX_LENGTH = 2 * Sr25519.SIGNATURE_LENGTH;
  private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

  private final Sr25519 sr25519;

  /**
   * Instantiates a new Signature verifier.
   *
   * @param sr25519 the signature scheme, bound to the chain's signing context
   */
  @Inject
  public SignatureVerifier(final Sr25519 sr25519) {
    log.info("SignatureVerifier({})", sr25519);
    this.sr25519 = sr25519;
  }

  /**
   * Parses a {@code 0x}-prefixed hex signature.
   *
   * @param signatureHex the string
   * @return the 64 signature bytes
   * @throws SignatureFormatException PREFIX_ERROR without the prefix, LENGTH_ERROR unless the
   *                                  rest is exactly 64 bytes of hex
   */
  public byte[] parse(final String signatureHex) throws SignatureFormatException {
    if (signatureHex == null || !signatureHex.startsWith(SIGNATURE_PREFIX)) {
      throw new SignatureFormatException(SignatureError.PREFIX_ERROR, "signature is missing the 0x prefix");
    }
    final String hex = signatureHex.substring(SIGNATURE_PREFIX.length());
    if (hex.length() != SIGNATURE_HEX_LENGTH) {
      throw new SignatureFormatException(SignatureError.LENGTH_ERROR,
          "signature has " + hex.length() + " hex digits, expected " + SIGNATURE_HEX_LENGTH);
    }
    final byte[] signature;
    try {
      signature = Hex.decode(hex);
    } catch (DecoderException e) {
      throw new SignatureFormatException(SignatureError.LENGTH_ERROR, "signature is not valid hex");
    }
    if (signature.length != Sr25519.SIGNATURE_LENGTH) {
      throw new SignatureFormatException(SignatureError.LENGTH_ERROR, "signature is not valid hex");
    }
    return signature;
  }

  /**
   * Parses one of a store packet's two signatures by slot name.
   *
   * @param packet the packet
   * @param slot   {@link #SIGNER_SLOT} or {@link #OWNER_SLOT}
   * @return the 64 signature bytes
   * @throws SignatureFormatException TYPE_ERROR for an unknown slot, otherwise as {@link #parse(String)}
   */
  public byte[] parseSlot(final StoreKeysharePacket packet, final String slot) throws SignatureFormatException {
    final String signatureHex = switch (slot) {
      case SIGNER_SLOT -> packet.signerSignature();
      case OWNER_SLOT -> packet.signature();
      default -> throw new SignatureFormatException(SignatureError.TYPE_ERROR, "unknown signature slot: " + slot);
    };
    return parse(signatureHex);
  }

  /**
   * Verifies a signature over a raw field.
   *
   * @param signature the 64 signature bytes
   * @param field     the field exactly as received
   * @param account   the claimed signer
   * @return true only if the account signed the field
   */
  public boolean verify(final byte[] signature, final String field, final AccountId account) {
    if (field == null) {
      return false;
    }
    return verify(signature, field.getBytes(StandardCharsets.UTF_8), account);
  }

  /**
   * Verifies a signature over bytes.
   *
   * @param signature the 64 signature bytes
   * @param message   the signed bytes
   * @param account   the claimed signer
   * @return true only if the account signed the message
   */
  public boolean verify(final byte[] signature, final byte[] message, final AccountId account) {
    final boolean valid = sr25519.verify(signature, message, account.publicKey());
    log.trace("verify(account={}) = {}", account, valid);
    return valid;
  }
}
