package com.codeheadsystems.keyshare.model.status;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The external response for a rejected request: { status, nft_id, enclave_id, description }.
 *
 * @param status      the stable status tag
 * @param nftId       the asset the request named, 0 when it could not be parsed
 * @param enclaveId   identifier of the answering enclave
 * @param description human-readable explanation
 */
public record VerificationStatus(
    @JsonProperty("status") ReturnStatus status,
    @JsonProperty("nft_id") long nftId,
    @JsonProperty("enclave_id") String enclaveId,
    @JsonProperty("description") String description) {
}
