package com.codeheadsystems.keyshare.model.data;

import com.codeheadsystems.keyshare.crypto.ss58.AccountId;
import com.codeheadsystems.keyshare.model.token.AdminAuthenticationToken;
import java.util.List;
import java.util.Objects;

/**
 * An authenticated admin bulk request, handed to the backup executor.
 *
 * @param adminAccount the whitelisted admin
 * @param authToken    the hash-bound token the admin signed
 * @param nftIds       the asset ids the request covers, in payload order
 */
public record ParsedAdminPayload(AccountId adminAccount,
                                 AdminAuthenticationToken authToken,
                                 List<Long> nftIds) {

  public ParsedAdminPayload {
    Objects.requireNonNull(adminAccount, "adminAccount");
    Objects.requireNonNull(authToken, "authToken");
    nftIds = List.copyOf(nftIds);
  }
}
