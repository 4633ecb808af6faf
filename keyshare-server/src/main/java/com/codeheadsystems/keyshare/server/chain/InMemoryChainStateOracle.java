package com.codeheadsystems.keyshare.server.chain;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.NftRecord;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link ChainStateOracle} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Holds whatever state it is given. Suitable for development and testing only; a deployment
 * reads asset state from the chain.
 */
public class InMemoryChainStateOracle implements ChainStateOracle {

  private static final Logger log = LoggerFactory.getLogger(InMemoryChainStateOracle.class);

  private final ConcurrentHashMap<Long, NftRecord> assets = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Long, AccountId> delegatees = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Long, AccountId> rentees = new ConcurrentHashMap<>();

  public InMemoryChainStateOracle() {
    log.warn("Using InMemoryChainStateOracle: asset state is local to this process and is NOT read from the chain.");
  }

  public void putAsset(long nftId, NftRecord record) {
    assets.put(nftId, record);
    log.debug("Recorded asset {} owned by {}", nftId, record.owner());
  }

  public void removeAsset(long nftId) {
    assets.remove(nftId);
    delegatees.remove(nftId);
    rentees.remove(nftId);
  }

  public void delegate(long nftId, AccountId delegatee) {
    delegatees.put(nftId, delegatee);
  }

  public void undelegate(long nftId) {
    delegatees.remove(nftId);
  }

  public void rent(long nftId, AccountId rentee) {
    rentees.put(nftId, rentee);
  }

  public void endRent(long nftId) {
    rentees.remove(nftId);
  }

  @Override
  public Optional<NftRecord> assetRecord(long nftId) {
    return Optional.ofNullable(assets.get(nftId));
  }

  @Override
  public Optional<AccountId> delegateeOf(long nftId) {
    return Optional.ofNullable(delegatees.get(nftId));
  }

  @Override
  public Optional<AccountId> renteeOf(long nftId) {
    return Optional.ofNullable(rentees.get(nftId));
  }
}
