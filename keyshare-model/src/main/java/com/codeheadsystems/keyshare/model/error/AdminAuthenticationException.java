package com.codeheadsystems.keyshare.model.error;

import com.codeheadsystems.keyshare.model.token.ValidationResult;
import java.util.Optional;

/**
 * A rejected admin request.
 */
public class AdminAuthenticationException extends Exception {

  private final AdminError error;
  private final ValidationResult validationResult;

  public AdminAuthenticationException(AdminError error, String message) {
    this(error, null, message, null);
  }

  public AdminAuthenticationException(AdminError error, String message, Throwable cause) {
    this(error, null, message, cause);
  }

  public AdminAuthenticationException(AdminError error, ValidationResult validationResult,
                                      String message, Throwable cause) {
    super(message, cause);
    this.error = error;
    this.validationResult = validationResult;
  }

  public AdminError error() {
    return error;
  }

  /**
   * The window check result, present for {@link AdminError#TOKEN_NOT_VALID}.
   *
   * @return the result
   */
  public Optional<ValidationResult> validationResult() {
    return Optional.ofNullable(validationResult);
  }
}
