package com.codeheadsystems.hashchain.exception;

/**
 * Base class of every failure the ledger raises to its callers.
 */
public class LedgerException extends RuntimeException {

  /**
   * Instantiates a new Ledger exception.
   *
   * @param message the message
   */
  public LedgerException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Ledger exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LedgerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
