package com.codeheadsystems.keyshare.crypto.merlin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Checks the permutation by building SHA3-256 on top of it and comparing with BouncyCastle.
 */
class Keccak1600Test {

  private static final int SHA3_256_RATE = 136;

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 3, 135, 136, 137, 500})
  void sha3OverPermutation_matchesBouncyCastle(int length) {
    byte[] message = new byte[length];
    for (int i = 0; i < length; i++) {
      message[i] = (byte) (i * 31 + 7);
    }
    assertThat(sha3_256(message)).isEqualTo(bouncyCastleSha3_256(message));
  }

  @Test
  void sha3OverPermutation_matchesBouncyCastleForText() {
    byte[] message = "Merlin v1.0".getBytes(StandardCharsets.US_ASCII);
    assertThat(sha3_256(message)).isEqualTo(bouncyCastleSha3_256(message));
  }

  @Test
  void permute_rejectsWrongStateSize() {
    assertThatThrownBy(() -> Keccak1600.permute(new byte[199]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static byte[] sha3_256(byte[] message) {
    byte[] state = new byte[Keccak1600.STATE_BYTES];
    int blocks = message.length / SHA3_256_RATE;
    for (int b = 0; b < blocks; b++) {
      for (int i = 0; i < SHA3_256_RATE; i++) {
        state[i] ^= message[b * SHA3_256_RATE + i];
      }
      Keccak1600.permute(state);
    }
    int rem = message.length - blocks * SHA3_256_RATE;
    for (int i = 0; i < rem; i++) {
      state[i] ^= message[blocks * SHA3_256_RATE + i];
    }
    state[rem] ^= 0x06;
    state[SHA3_256_RATE - 1] ^= (byte) 0x80;
    Keccak1600.permute(state);
    return Arrays.copyOf(state, 32);
  }

  private static byte[] bouncyCastleSha3_256(byte[] message) {
    SHA3Digest digest = new SHA3Digest(256);
    digest.update(message, 0, message.length);
    byte[] out = new byte[32];
    digest.doFinal(out, 0);
    return out;
  }
}
