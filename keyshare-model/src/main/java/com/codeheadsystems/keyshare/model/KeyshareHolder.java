package com.codeheadsystems.keyshare.model;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import java.util.Optional;

/**
 * Who the chain says holds an asset in a given capacity. Compared against a requester's claim;
 * {@link #NOT_FOUND} never matches anyone.
 *
 * @param kind    the capacity
 * @param account the account, null only for {@link Kind#NOT_FOUND}
 */
public record KeyshareHolder(Kind kind, AccountId account) {

  public static final KeyshareHolder NOT_FOUND = new KeyshareHolder(Kind.NOT_FOUND, null);

  public enum Kind {
    OWNER,
    DELEGATEE,
    RENTEE,
    NOT_FOUND
  }

  public KeyshareHolder {
    if (kind == null) {
      throw new IllegalArgumentException("Missing required field: kind");
    }
    if ((kind == Kind.NOT_FOUND) != (account == null)) {
      throw new IllegalArgumentException("Only NOT_FOUND holders have no account");
    }
  }

  public static KeyshareHolder owner(AccountId account) {
    return new KeyshareHolder(Kind.OWNER, account);
  }

  public static KeyshareHolder delegatee(AccountId account) {
    return new KeyshareHolder(Kind.DELEGATEE, account);
  }

  public static KeyshareHolder rentee(AccountId account) {
    return new KeyshareHolder(Kind.RENTEE, account);
  }

  /**
   * Builds a holder of the given kind from an optional chain lookup.
   *
   * @param kind    the capacity
   * @param account the lookup result
   * @return the holder, or {@link #NOT_FOUND} when the lookup was empty
   */
  public static KeyshareHolder of(Kind kind, Optional<AccountId> account) {
    return account.map(a -> new KeyshareHolder(kind, a)).orElse(NOT_FOUND);
  }

  /**
   * Whether this holder is the given account.
   *
   * @param requester the account to compare
   * @return false for {@link #NOT_FOUND}
   */
  public boolean isHeldBy(AccountId requester) {
    return account != null && account.equals(requester);
  }
}
