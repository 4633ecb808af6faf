package com.codeheadsystems.keyshare.server.token;

import com.codeheadsystems.keyshare.model.token.ValidationResult;
import com.codeheadsystems.keyshare.model.token.ValidityWindow;
import com.codeheadsystems.keyshare.server.chain.ChainHeightOracle;
import com.codeheadsystems.keyshare.server.chain.ChainQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks admin tokens, reporting why a token is rejected.
 * <p>
 * The period may not exceed {@code maxValidationPeriod}; the chain height must lie in
 * {@code [blockNumber - maxBlockVariation, blockNumber + blockValidation + maxBlockVariation]}.
 * A failed height query is reported as {@link ValidationResult#ERROR_RPC_CALL} rather than
 * thrown, so it is never mistaken for an expired token.
 */
public class AdminTokenValidator {

  public static final long DEFAULT_MAX_VALIDATION_PERIOD = 20;
  public static final long DEFAULT_MAX_BLOCK_VARIATION = 5;

  private static final Logger log = LoggerFactory.getLogger(AdminTokenValidator.class);

  private final ChainHeightOracle chainHeightOracle;
  private final long maxValidationPeriod;
  private final long maxBlockVariation;

  /**
   * Instantiates a new Admin token validator.
   *
   * @param chainHeightOracle   the chain height oracle
   * @param maxValidationPeriod the longest accepted block_validation
   * @param maxBlockVariation   tolerance applied to both ends of the window
   */
  public AdminTokenValidator(final ChainHeightOracle chainHeightOracle,
                             final long maxValidationPeriod,
                             final long maxBlockVariation) {
    log.info("AdminTokenValidator({}, maxValidationPeriod={}, maxBlockVariation={})",
        chainHeightOracle, maxValidationPeriod, maxBlockVariation);
    this.chainHeightOracle = chainHeightOracle;
    this.maxValidationPeriod = maxValidationPeriod;
    this.maxBlockVariation = maxBlockVariation;
  }

  /**
   * Validates against the current finalized height.
   *
   * @param token the token
   * @return the result
   */
  public ValidationResult validate(final ValidityWindow token) {
    if (token.blockValidation() > maxValidationPeriod) {
      log.error("Admin token period {} exceeds maximum {}", token.blockValidation(), maxValidationPeriod);
      return ValidationResult.INVALID_PERIOD;
    }
    final long currentBlock;
    try {
      currentBlock = chainHeightOracle.currentFinalizedBlock();
    } catch (ChainQueryException e) {
      log.error("Unable to read the chain height for admin token validation: {}", e.getMessage());
      return ValidationResult.ERROR_RPC_CALL;
    }
    return validateAt(token, currentBlock);
  }

  /**
   * Validates against a given height.
   *
   * @param token        the token
   * @param currentBlock the height
   * @return the result
   */
  public ValidationResult validateAt(final ValidityWindow token, final long currentBlock) {
    if (token.blockValidation() > maxValidationPeriod) {
      return ValidationResult.INVALID_PERIOD;
    }
    if (currentBlock < token.blockNumber() - maxBlockVariation) {
      log.error("Admin token starts at {} but the chain is at {}", token.blockNumber(), currentBlock);
      return ValidationResult.FUTURE_BLOCK_NUMBER;
    }
    if (currentBlock > token.blockNumber() + token.blockValidation() + maxBlockVariation) {
      log.error("Admin token ended at {} but the chain is at {}",
          token.blockNumber() + token.blockValidation(), currentBlock);
      return ValidationResult.EXPIRED_BLOCK_NUMBER;
    }
    return ValidationResult.SUCCESS;
  }
}
