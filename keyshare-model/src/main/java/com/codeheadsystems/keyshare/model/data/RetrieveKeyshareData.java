package com.codeheadsystems.keyshare.model.data;

import com.codeheadsystems.keyshare.model.token.AuthenticationToken;
import java.util.Objects;

/**
 * Validated intent to retrieve an asset's key-share.
 *
 * @param nftId     the asset id (u32)
 * @param authToken the request window
 */
public record RetrieveKeyshareData(long nftId, AuthenticationToken authToken) {

  public RetrieveKeyshareData {
    Objects.requireNonNull(authToken, "authToken");
  }
}
