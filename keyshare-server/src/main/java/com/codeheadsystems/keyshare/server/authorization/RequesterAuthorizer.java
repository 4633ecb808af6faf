package com.codeheadsystems.keyshare.server.authorization;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.KeyshareHolder;
import com.codeheadsystems.keyshare.model.RequesterType;
import com.codeheadsystems.keyshare.server.chain.ChainStateOracle;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a requester really stands in the relationship to an asset that they claim.
 * <p>
 * Owner claims are checked against the owner from the asset record the caller already holds.
 * Delegatee and rentee claims query the chain on every call; nothing is cached. A relation the
 * chain does not report never authorizes anyone.
 * <p>
 * Exception contract: {@link com.codeheadsystems.keyshare.server.chain.ChainQueryException}
 * propagates unchanged when the chain cannot be queried.
 */
@Singleton
public class RequesterAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(RequesterAuthorizer.class);

  private final ChainStateOracle chainStateOracle;

  /**
   * Instantiates a new Requester authorizer.
   *
   * @param chainStateOracle the chain state oracle
   */
  @Inject
  public RequesterAuthorizer(final ChainStateOracle chainStateOracle) {
    log.info("RequesterAuthorizer({})", chainStateOracle);
    this.chainStateOracle = chainStateOracle;
  }

  /**
   * Checks a claimed relationship. {@link RequesterType#NONE} is treated as {@link RequesterType#OWNER}.
   *
   * @param requester    the requesting account
   * @param nftId        the asset
   * @param onChainOwner the asset's owner according to its chain record
   * @param claimedType  the relationship the requester claims
   * @return true only when the chain confirms the claim
   */
  public boolean authorize(final AccountId requester,
                           final long nftId,
                           final AccountId onChainOwner,
                           final RequesterType claimedType) {
    final boolean authorized = switch (claimedType) {
      case OWNER, NONE -> requester.equals(onChainOwner);
      case DELEGATEE -> delegateeOf(nftId).isHeldBy(requester);
      case RENTEE -> renteeOf(nftId).isHeldBy(requester);
    };
    log.debug("authorize(nftId={}, claimedType={}) = {}", nftId, claimedType, authorized);
    return authorized;
  }

  /**
   * Works out which relationship, if any, the requester actually holds. Owner wins over
   * delegatee, which wins over rentee.
   *
   * @param requester    the requesting account
   * @param nftId        the asset
   * @param onChainOwner the asset's owner according to its chain record
   * @return the observed holder, or {@link KeyshareHolder#NOT_FOUND}
   */
  public KeyshareHolder classify(final AccountId requester, final long nftId, final AccountId onChainOwner) {
    if (requester.equals(onChainOwner)) {
      return KeyshareHolder.owner(requester);
    }
    final KeyshareHolder delegatee = delegateeOf(nftId);
    if (delegatee.isHeldBy(requester)) {
      return delegatee;
    }
    final KeyshareHolder rentee = renteeOf(nftId);
    if (rentee.isHeldBy(requester)) {
      return rentee;
    }
    return KeyshareHolder.NOT_FOUND;
  }

  /**
   * The asset's current delegatee.
   *
   * @param nftId the asset
   * @return the holder, or {@link KeyshareHolder#NOT_FOUND}
   */
  public KeyshareHolder delegateeOf(final long nftId) {
    return KeyshareHolder.of(KeyshareHolder.Kind.DELEGATEE, chainStateOracle.delegateeOf(nftId));
  }

  /**
   * The asset's current rentee.
   *
   * @param nftId the asset
   * @return the holder, or {@link KeyshareHolder#NOT_FOUND}
   */
  public KeyshareHolder renteeOf(final long nftId) {
    return KeyshareHolder.of(KeyshareHolder.Kind.RENTEE, chainStateOracle.renteeOf(nftId));
  }
}
