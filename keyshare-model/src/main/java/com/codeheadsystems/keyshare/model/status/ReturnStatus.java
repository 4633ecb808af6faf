package com.codeheadsystems.keyshare.model.status;

/**
 * Status tags clients match on. The names are part of the wire contract and must not change.
 */
public enum ReturnStatus {
  SIGNERSIGVERIFICATIONFAILED,
  DATASIGVERIFICATIONFAILED,
  OWNERSHIPVERIFICATIONFAILED,
  REQUESTERVERIFICATIONFAILED,
  INVALIDDATAFORMAT,
  INVALIDSIGNERFORMAT,
  INVALIDSIGNERSIGNATURE,
  INVALIDDATASIGNATURE,
  INVALIDOWNERADDRESS,
  INVALIDSIGNERADDRESS,
  INVALIDAUTHTOKEN,
  INVALIDKEYSHARE,
  INVALIDNFTID,
  EXPIREDSIGNER,
  EXPIREDREQUEST,
  IDISNOTASECRETNFT,
  IDISNOTACAPSULE,
  ORACLEFAILURE
}
