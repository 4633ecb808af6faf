package com.codeheadsystems.keyshare.model;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import java.util.Objects;

/**
 * The on-chain record of an asset as far as the gate cares: who owns it and which secret
 * kinds it carries.
 *
 * @param owner     the owning account
 * @param isSecret  whether the asset is a secret-nft
 * @param isCapsule whether the asset is a capsule
 */
public record NftRecord(AccountId owner, boolean isSecret, boolean isCapsule) {

  public NftRecord {
    Objects.requireNonNull(owner, "owner");
  }

  /**
   * Whether the asset carries the flag for the requested kind.
   *
   * @param nftType the requested kind
   * @return true when the flag is set
   */
  public boolean isOfType(NftType nftType) {
    return switch (nftType) {
      case SECRET_NFT -> isSecret;
      case CAPSULE -> isCapsule;
    };
  }
}
