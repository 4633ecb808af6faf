package com.codeheadsystems.keyshare.crypto.merlin;

import com.codeheadsystems.keyshare.crypto.common.ByteUtils;
import java.nio.charset.StandardCharsets;

/**
 * A Merlin transcript (merlin v1.0): a STROBE-128 sponge into which labelled messages are
 * absorbed and from which labelled challenges are squeezed. sr25519 derives its Fiat-Shamir
 * challenge from one of these.
 * <p>
 * Not thread safe. Each signature check builds its own transcript.
 */
public final class MerlinTranscript {

  private static final byte[] MERLIN_PROTOCOL_LABEL =
      "Merlin v1.0".getBytes(StandardCharsets.US_ASCII);

  private final Strobe128 strobe;

  private MerlinTranscript(Strobe128 strobe) {
    this.strobe = strobe;
  }

  /**
   * Starts a transcript with the given domain separation label.
   *
   * @param label the application label
   * @return the transcript
   */
  public static MerlinTranscript create(String label) {
    MerlinTranscript transcript = new MerlinTranscript(new Strobe128(MERLIN_PROTOCOL_LABEL));
    transcript.appendMessage("dom-sep", label.getBytes(StandardCharsets.UTF_8));
    return transcript;
  }

  /**
   * Absorbs a labelled message.
   *
   * @param label   the label
   * @param message the message bytes
   * @return this transcript
   */
  public MerlinTranscript appendMessage(String label, byte[] message) {
    strobe.metaAd(label.getBytes(StandardCharsets.UTF_8), false);
    strobe.metaAd(ByteUtils.le32(message.length), true);
    strobe.ad(message, false);
    return this;
  }

  /**
   * Squeezes {@code length} challenge bytes bound to everything absorbed so far.
   *
   * @param label  the label
   * @param length number of bytes
   * @return the challenge bytes
   */
  public byte[] challengeBytes(String label, int length) {
    byte[] dest = new byte[length];
    strobe.metaAd(label.getBytes(StandardCharsets.UTF_8), false);
    strobe.metaAd(ByteUtils.le32(length), true);
    strobe.prf(dest, false);
    return dest;
  }

  /**
   * An independent copy, so a shared prefix can be forked.
   *
   * @return the copy
   */
  public MerlinTranscript fork() {
    return new MerlinTranscript(strobe.copy());
  }
}
