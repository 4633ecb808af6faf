package com.codeheadsystems.keyshare.model.data;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.token.AuthenticationToken;
import java.util.Objects;

/**
 * A delegation: the account the owner authorized to sign a store request's data, and for how long.
 *
 * @param account   the delegated signer
 * @param authToken the delegation window
 */
public record Signer(AccountId account, AuthenticationToken authToken) {

  public Signer {
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(authToken, "authToken");
  }
}
