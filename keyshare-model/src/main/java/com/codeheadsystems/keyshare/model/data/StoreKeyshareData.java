package com.codeheadsystems.keyshare.model.data;

import com.codeheadsystems.keyshare.model.token.AuthenticationToken;
import java.util.Arrays;
import java.util.Objects;

/**
 * Validated intent to store a key-share for an asset.
 * <p>
 * The key-share bytes are secret: {@link #toString()} never renders them.
 *
 * @param nftId     the asset id (u32)
 * @param keyshare  the non-empty key-share bytes
 * @param authToken the request window
 */
public record StoreKeyshareData(long nftId, byte[] keyshare, AuthenticationToken authToken) {

  public StoreKeyshareData {
    if (keyshare == null || keyshare.length == 0) {
      throw new IllegalArgumentException("keyshare must not be empty");
    }
    Objects.requireNonNull(authToken, "authToken");
    keyshare = keyshare.clone();
  }

  @Override
  public byte[] keyshare() {
    return keyshare.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof StoreKeyshareData other
        && nftId == other.nftId
        && Arrays.equals(keyshare, other.keyshare)
        && authToken.equals(other.authToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nftId, Arrays.hashCode(keyshare), authToken);
  }

  @Override
  public String toString() {
    return "StoreKeyshareData[nftId=" + nftId + ", keyshare=<" + keyshare.length
        + " bytes>, authToken=" + authToken + "]";
  }
}
