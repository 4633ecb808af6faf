package com.codeheadsystems.keyshare.model;

/**
 * The relationship a retrieve requester claims to the asset. {@link #NONE} is authorized
 * exactly like {@link #OWNER}.
 */
public enum RequesterType {
  OWNER,
  DELEGATEE,
  RENTEE,
  NONE
}
