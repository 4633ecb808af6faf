package com.codeheadsystems.keyshare.model.status;

import com.codeheadsystems.keyshare.model.NftType;

/**
 * The external operation a status payload reports on.
 */
public enum ApiCall {
  NFTSTORE,
  NFTRETRIEVE,
  CAPSULESET,
  CAPSULERETRIEVE;

  public static ApiCall forStore(NftType nftType) {
    return nftType == NftType.CAPSULE ? CAPSULESET : NFTSTORE;
  }

  public static ApiCall forRetrieve(NftType nftType) {
    return nftType == NftType.CAPSULE ? CAPSULERETRIEVE : NFTRETRIEVE;
  }
}
