package com.codeheadsystems.keyshare.server.chain;

/**
 * Source of the current finalized chain height.
 */
public interface ChainHeightOracle {

  /**
   * The number of the latest finalized block.
   *
   * @return the block number (u32)
   * @throws ChainQueryException if the height cannot be obtained
   */
  long currentFinalizedBlock();
}
