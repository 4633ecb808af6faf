package com.codeheadsystems.keyshare.model.status;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.keyshare.model.NftType;
import org.junit.jupiter.api.Test;

class ApiCallTest {

  @Test
  void store() {
    assertThat(ApiCall.forStore(NftType.SECRET_NFT)).isEqualTo(ApiCall.NFTSTORE);
    assertThat(ApiCall.forStore(NftType.CAPSULE)).isEqualTo(ApiCall.CAPSULESET);
  }

  @Test
  void retrieve() {
    assertThat(ApiCall.forRetrieve(NftType.SECRET_NFT)).isEqualTo(ApiCall.NFTRETRIEVE);
    assertThat(ApiCall.forRetrieve(NftType.CAPSULE)).isEqualTo(ApiCall.CAPSULERETRIEVE);
  }
}
