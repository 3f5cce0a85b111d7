package com.codeheadsystems.hashchain.exception;

/**
 * The stream lock could not be acquired in time. Safe to retry with backoff.
 */
public class LockTimeoutException extends LedgerException {

  /**
   * Instantiates a new LockTimeout exception.
   *
   * @param message the message
   */
  public LockTimeoutException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new LockTimeout exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LockTimeoutException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
