package com.codeheadsystems.keyshare.model.packet;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A store request as received: { owner_address, signer_address, signersig, data, signature }.
 * <p>
 * {@code signer_address} is the delegation {@code "{signer}_{block_number}_{block_validation}"},
 * signed by the owner into {@code signersig}. {@code data} is
 * {@code "{nft_id}_{keyshare}_{block_number}_{block_validation}"}, signed by the delegated signer
 * into {@code signature}. Either signed field may arrive wrapped in {@code <Bytes>...</Bytes>}.
 *
 * @param ownerAddress    SS58 address of the asset owner
 * @param signerAddress   the delegation field
 * @param signerSignature 0x-prefixed hex signature of the owner over signerAddress
 * @param data            the data field
 * @param signature       0x-prefixed hex signature of the signer over data
 */
public record StoreKeysharePacket(
    @JsonProperty("owner_address") String ownerAddress,
    @JsonProperty("signer_address") String signerAddress,
    @JsonProperty("signersig") String signerSignature,
    @JsonProperty("data") String data,
    @JsonProperty("signature") String signature) {
}
