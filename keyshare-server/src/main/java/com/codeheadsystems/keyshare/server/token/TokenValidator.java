package com.codeheadsystems.keyshare.server.token;

import com.codeheadsystems.keyshare.model.token.ValidityWindow;
import com.codeheadsystems.keyshare.server.chain.ChainHeightOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks per-secret tokens against the chain height.
 * <p>
 * A token is valid while {@code blockNumber - grace <= current < blockNumber + blockValidation + grace}.
 * The grace absorbs finalization lag between the client that built the token and the node we
 * ask. Arithmetic is done in {@code long}, so u32 inputs never wrap.
 */
public class TokenValidator {

  public static final long DEFAULT_GRACE_BLOCKS = 3;

  private static final Logger log = LoggerFactory.getLogger(TokenValidator.class);

  private final ChainHeightOracle chainHeightOracle;
  private final long graceBlocks;

  /**
   * Instantiates a new Token validator.
   *
   * @param chainHeightOracle the chain height oracle
   * @param graceBlocks       tolerance applied to both ends of the window
   */
  public TokenValidator(final ChainHeightOracle chainHeightOracle, final long graceBlocks) {
    log.info("TokenValidator({}, graceBlocks={})", chainHeightOracle, graceBlocks);
    if (graceBlocks < 0) {
      throw new IllegalArgumentException("graceBlocks must be non-negative");
    }
    this.chainHeightOracle = chainHeightOracle;
    this.graceBlocks = graceBlocks;
  }

  /**
   * Checks the token against the current finalized height.
   *
   * @param token the token
   * @return whether the chain is inside the token's window
   * @throws com.codeheadsystems.keyshare.server.chain.ChainQueryException if the height cannot be read
   */
  public boolean isValid(final ValidityWindow token) {
    return isValidAt(token, chainHeightOracle.currentFinalizedBlock());
  }

  /**
   * Checks the token against a given height.
   *
   * @param token        the token
   * @param currentBlock the height
   * @return whether the height is inside the token's window
   */
  public boolean isValidAt(final ValidityWindow token, final long currentBlock) {
    final long lower = token.blockNumber() - graceBlocks;
    final long upper = token.blockNumber() + token.blockValidation() + graceBlocks;
    final boolean valid = currentBlock >= lower && currentBlock < upper;
    log.trace("isValidAt(window=[{}, {}), current={}) = {}", lower, upper, currentBlock, valid);
    return valid;
  }
}
