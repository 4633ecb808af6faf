package com.codeheadsystems.keyshare.model.packet;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An admin bulk request: { admin_address, nftid_vec, auth_token, signature }.
 * {@code nftid_vec} is a JSON array of ids; {@code auth_token} is the JSON admin token whose
 * {@code data_hash} covers nftid_vec; {@code signature} covers auth_token as received.
 *
 * @param adminAddress SS58 address of the admin
 * @param nftIdVec     JSON array of asset ids
 * @param authToken    JSON admin token, optionally wrapped in {@code <Bytes>...</Bytes>}
 * @param signature    0x-prefixed hex signature of the admin over authToken
 */
public record AdminFetchIdPacket(
    @JsonProperty("admin_address") String adminAddress,
    @JsonProperty("nftid_vec") String nftIdVec,
    @JsonProperty("auth_token") String authToken,
    @JsonProperty("signature") String signature) {
}
