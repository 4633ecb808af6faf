package com.codeheadsystems.keyshare.server.chain;

/**
 * A chain query could not be answered: network failure, timeout, RPC error or an unreadable
 * reply. This is an infrastructure failure, never a verdict on the request being checked.
 */
public class ChainQueryException extends RuntimeException {

  /**
   * Instantiates a new Chain query exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ChainQueryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
