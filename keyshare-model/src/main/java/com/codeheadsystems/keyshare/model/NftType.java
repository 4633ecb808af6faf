package com.codeheadsystems.keyshare.model;

/**
 * The kind of secret a request targets. The on-chain record must carry the matching flag.
 */
public enum NftType {
  SECRET_NFT("secret-nft"),
  CAPSULE("capsule");

  private final String label;

  NftType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
