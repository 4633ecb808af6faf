package com.codeheadsystems.keyshare.server.chain;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.NftRecord;
import java.util.Optional;

/**
 * Read access to the asset state the gate authorizes against.
 * <p>
 * Every method may throw {@link ChainQueryException}; an empty result means the chain answered
 * and the relation does not exist.
 */
public interface ChainStateOracle {

  /**
   * The on-chain record of an asset.
   *
   * @param nftId the asset id
   * @return the record, or empty when the asset does not exist
   */
  Optional<NftRecord> assetRecord(long nftId);

  /**
   * The account the asset is currently delegated to.
   *
   * @param nftId the asset id
   * @return the delegatee, or empty when not delegated
   */
  Optional<AccountId> delegateeOf(long nftId);

  /**
   * The rentee of the asset's active rent contract.
   *
   * @param nftId the asset id
   * @return the rentee, or empty when not rented
   */
  Optional<AccountId> renteeOf(long nftId);
}
