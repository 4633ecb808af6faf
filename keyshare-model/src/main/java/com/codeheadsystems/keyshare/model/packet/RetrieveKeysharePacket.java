package com.codeheadsystems.keyshare.model.packet;

import com.codeheadsystems.keyshare.model.RequesterType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A retrieve request as received: { requester_address, requester_type, data, signature }, with
 * {@code data} = {@code "{nft_id}_{block_number}_{block_validation}"} signed by the requester.
 *
 * @param requesterAddress SS58 address of the requester
 * @param requesterType    the relationship the requester claims
 * @param data             the data field
 * @param signature        0x-prefixed hex signature of the requester over data
 */
public record RetrieveKeysharePacket(
    @JsonProperty("requester_address") String requesterAddress,
    @JsonProperty("requester_type") RequesterType requesterType,
    @JsonProperty("data") String data,
    @JsonProperty("signature") String signature) {
}
