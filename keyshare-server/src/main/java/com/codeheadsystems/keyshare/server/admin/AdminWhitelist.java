package com.codeheadsystems.keyshare.server.admin;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * The SS58 addresses allowed to issue admin requests. Membership is an exact string match on
 * the address as sent.
 */
public final class AdminWhitelist {

  private final Set<String> addresses;

  private AdminWhitelist(final Set<String> addresses) {
    this.addresses = addresses;
  }

  public static AdminWhitelist of(final Collection<String> addresses) {
    return new AdminWhitelist(Set.copyOf(addresses));
  }

  public static AdminWhitelist of(final String... addresses) {
    return of(Arrays.asList(addresses));
  }

  public boolean contains(final String address) {
    return address != null && addresses.contains(address);
  }

  public int size() {
    return addresses.size();
  }

  @Override
  public String toString() {
    return "AdminWhitelist" + addresses;
  }
}
