package com.codeheadsystems.keyshare.crypto.merlin;

import java.nio.charset.StandardCharsets;

/**
 * The subset of STROBE-128 (v1.0.2) that Merlin transcripts use: meta-AD, AD and PRF.
 * The state is a Keccak-f[1600] sponge with a 166-byte rate.
 */
final class Strobe128 {

  private static final int STROBE_R = 166;

  private static final int FLAG_I = 1;
  private static final int FLAG_A = 1 << 1;
  private static final int FLAG_C = 1 << 2;
  private static final int FLAG_T = 1 << 3;
  private static final int FLAG_M = 1 << 4;
  private static final int FLAG_K = 1 << 5;

  private final byte[] state;
  private int pos;
  private int posBegin;
  private int curFlags;

  Strobe128(byte[] protocolLabel) {
    state = new byte[Keccak1600.STATE_BYTES];
    byte[] header = {1, (byte) (STROBE_R + 2), 1, 0, 1, 96};
    System.arraycopy(header, 0, state, 0, header.length);
    byte[] version = "STROBEv1.0.2".getBytes(StandardCharsets.US_ASCII);
    System.arraycopy(version, 0, state, header.length, version.length);
    Keccak1600.permute(state);
    metaAd(protocolLabel, false);
  }

  private Strobe128(Strobe128 other) {
    this.state = other.state.clone();
    this.pos = other.pos;
    this.posBegin = other.posBegin;
    this.curFlags = other.curFlags;
  }

  Strobe128 copy() {
    return new Strobe128(this);
  }

  void metaAd(byte[] data, boolean more) {
    beginOp(FLAG_M | FLAG_A, more);
    absorb(data);
  }

  void ad(byte[] data, boolean more) {
    beginOp(FLAG_A, more);
    absorb(data);
  }

  void prf(byte[] dest, boolean more) {
    beginOp(FLAG_I | FLAG_A | FLAG_C, more);
    squeeze(dest);
  }

  private void runF() {
    state[pos] ^= (byte) posBegin;
    state[pos + 1] ^= 0x04;
    state[STROBE_R + 1] ^= (byte) 0x80;
    Keccak1600.permute(state);
    pos = 0;
    posBegin = 0;
  }

  private void absorb(byte[] data) {
    for (byte b : data) {
      state[pos] ^= b;
      pos++;
      if (pos == STROBE_R) {
        runF();
      }
    }
  }

  private void squeeze(byte[] dest) {
    for (int i = 0; i < dest.length; i++) {
      dest[i] = state[pos];
      state[pos] = 0;
      pos++;
      if (pos == STROBE_R) {
        runF();
      }
    }
  }

  private void beginOp(int flags, boolean more) {
    if (more) {
      if (curFlags != flags) {
        throw new IllegalStateException(
            "Continued op with flags " + flags + " but current op has flags " + curFlags);
      }
      return;
    }
    if ((flags & FLAG_T) != 0) {
      throw new IllegalStateException("Transport operations are not supported");
    }
    int oldBegin = posBegin;
    posBegin = pos + 1;
    curFlags = flags;
    absorb(new byte[]{(byte) oldBegin, (byte) flags});

    boolean forceF = (flags & (FLAG_C | FLAG_K)) != 0;
    if (forceF && pos != 0) {
      runF();
    }
  }
}
