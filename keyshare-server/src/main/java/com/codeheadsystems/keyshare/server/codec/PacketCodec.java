package com.codeheadsystems.keyshare.server.codec;

import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_AUTH_TOKEN;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_KEYSHARE;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_NFT_ID;
import static com.codeheadsystems.keyshare.model.error.VerificationError.INVALID_SIGNER_ADDRESS;
import static com.codeheadsystems.keyshare.model.error.VerificationError.MALFORMED_DATA;
import static com.codeheadsystems.keyshare.model.error.VerificationError.MALFORMED_SIGNER;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.data.RetrieveKeyshareData;
import com.codeheadsystems.keyshare.model.data.Signer;
import com.codeheadsystems.keyshare.model.data.StoreKeyshareData;
import com.codeheadsystems.keyshare.model.error.VerificationError;
import com.codeheadsystems.keyshare.model.error.VerificationException;
import com.codeheadsystems.keyshare.model.token.AuthenticationToken;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses and renders the flat {@code _}-delimited fields of store and retrieve packets.
 * <p>
 * Wire shapes:
 * <ul>
 *   <li>signer: {@code {ss58 account}_{block_number}_{block_validation}}; parts past the third
 *       are ignored</li>
 *   <li>store data: {@code {nft_id}_{keyshare}_{block_number}_{block_validation}}, exactly</li>
 *   <li>retrieve data: {@code {nft_id}_{block_number}_{block_validation}}, exactly</li>
 * </ul>
 * Some wallets wrap what they sign in {@code <Bytes>...</Bytes>}; one such pair is removed
 * before splitting. All numbers are unsigned 32-bit decimals. Content cannot contain the
 * delimiter: there is no escaping.
 */
public final class PacketCodec {

  public static final String WRAPPER_PREFIX = "<Bytes>";
  public static final String WRAPPER_SUFFIX = "</Bytes>";
  public static final String DELIMITER = "_";

  private static final Logger log = LoggerFactory.getLogger(PacketCodec.class);

  private PacketCodec() {
  }

  // ─── Wrapper ──────────────────────────────────────────────────────────────

  /**
   * Removes one {@code <Bytes>}/{@code </Bytes>} pair if the field carries both markers.
   *
   * @param field the raw field
   * @return the unwrapped field, the field itself when unwrapped, or empty when only one of
   *     the two markers is present
   */
  public static Optional<String> stripWrapper(final String field) {
    if (field == null) {
      return Optional.empty();
    }
    final boolean prefixed = field.startsWith(WRAPPER_PREFIX);
    final boolean suffixed = field.endsWith(WRAPPER_SUFFIX);
    if (prefixed && suffixed && field.length() >= WRAPPER_PREFIX.length() + WRAPPER_SUFFIX.length()) {
      return Optional.of(field.substring(WRAPPER_PREFIX.length(), field.length() - WRAPPER_SUFFIX.length()));
    }
    if (prefixed || suffixed) {
      log.debug("stripWrapper: field carries only one wrapper marker");
      return Optional.empty();
    }
    return Optional.of(field);
  }

  // ─── Parsing ──────────────────────────────────────────────────────────────

  /**
   * Parses a signer (delegation) field.
   *
   * @param field the raw field
   * @return the signer
   * @throws VerificationException MALFORMED_SIGNER, INVALID_SIGNER_ADDRESS or INVALID_AUTH_TOKEN
   */
  public static Signer parseSigner(final String field) throws VerificationException {
    final String[] parts = split(field, MALFORMED_SIGNER);
    if (parts.length < 3) {
      throw reject(MALFORMED_SIGNER, "signer field has " + parts.length + " parts");
    }
    final AccountId account;
    try {
      account = AccountId.fromSs58(parts[0]);
    } catch (IllegalArgumentException e) {
      throw reject(INVALID_SIGNER_ADDRESS, e.getMessage());
    }
    return new Signer(account, parseToken(parts[1], parts[2]));
  }

  /**
   * Parses a store data field.
   *
   * @param field the raw field
   * @return the store data
   * @throws VerificationException MALFORMED_DATA, INVALID_NFT_ID, INVALID_KEYSHARE or INVALID_AUTH_TOKEN
   */
  public static StoreKeyshareData parseStoreData(final String field) throws VerificationException {
    final String[] parts = split(field, MALFORMED_DATA);
    if (parts.length != 4) {
      throw reject(MALFORMED_DATA, "store data field has " + parts.length + " parts");
    }
    final long nftId = parseNftId(parts[0]);
    if (parts[1].isEmpty()) {
      throw reject(INVALID_KEYSHARE, "keyshare is empty");
    }
    final AuthenticationToken token = parseToken(parts[2], parts[3]);
    return new StoreKeyshareData(nftId, parts[1].getBytes(StandardCharsets.UTF_8), token);
  }

  /**
   * Parses a retrieve data field.
   *
   * @param field the raw field
   * @return the retrieve data
   * @throws VerificationException MALFORMED_DATA, INVALID_NFT_ID or INVALID_AUTH_TOKEN
   */
  public static RetrieveKeyshareData parseRetrieveData(final String field) throws VerificationException {
    final String[] parts = split(field, MALFORMED_DATA);
    if (parts.length != 3) {
      throw reject(MALFORMED_DATA, "retrieve data field has " + parts.length + " parts");
    }
    final long nftId = parseNftId(parts[0]);
    return new RetrieveKeyshareData(nftId, parseToken(parts[1], parts[2]));
  }

  /**
   * Parses an unsigned 32-bit decimal. A leading {@code +} is accepted, a sign of {@code -} is not.
   *
   * @param text the text
   * @return the value
   * @throws NumberFormatException when the text is not a u32
   */
  public static long parseU32(final String text) {
    return Integer.toUnsignedLong(Integer.parseUnsignedInt(text));
  }

  private static String[] split(final String field, final VerificationError malformed)
      throws VerificationException {
    final String body = stripWrapper(field)
        .orElseThrow(() -> reject(malformed, "unbalanced wrapper markers"));
    return body.split(DELIMITER, -1);
  }

  private static long parseNftId(final String text) throws VerificationException {
    try {
      return parseU32(text);
    } catch (NumberFormatException e) {
      throw reject(INVALID_NFT_ID, "nft id is not a u32");
    }
  }

  private static AuthenticationToken parseToken(final String blockNumber, final String blockValidation)
      throws VerificationException {
    try {
      return new AuthenticationToken(parseU32(blockNumber), parseU32(blockValidation));
    } catch (NumberFormatException e) {
      throw reject(INVALID_AUTH_TOKEN, "token part is not a u32");
    }
  }

  private static VerificationException reject(final VerificationError error, final String detail) {
    log.debug("parse rejected with {}: {}", error, detail);
    return new VerificationException(error);
  }

  // ─── Rendering ────────────────────────────────────────────────────────────

  public static String serializeSigner(final Signer signer) {
    return signer.account().toSs58() + DELIMITER + signer.authToken().serialize();
  }

  /**
   * Renders store data. The key-share is written as UTF-8 text.
   *
   * @param data the data
   * @return the field
   * @throws IllegalArgumentException if the key-share contains the delimiter, which would not parse back
   */
  public static String serializeStoreData(final StoreKeyshareData data) {
    final String keyshare = new String(data.keyshare(), StandardCharsets.UTF_8);
    if (keyshare.contains(DELIMITER)) {
      throw new IllegalArgumentException("keyshare must not contain the delimiter '" + DELIMITER + "'");
    }
    return data.nftId() + DELIMITER + keyshare + DELIMITER + data.authToken().serialize();
  }

  public static String serializeRetrieveData(final RetrieveKeyshareData data) {
    return data.nftId() + DELIMITER + data.authToken().serialize();
  }

  /**
   * Wraps a field the way browser wallets present it for signing.
   *
   * @param field the field
   * @return {@code <Bytes>field</Bytes>}
   */
  public static String wrap(final String field) {
    return WRAPPER_PREFIX + field + WRAPPER_SUFFIX;
  }
}
