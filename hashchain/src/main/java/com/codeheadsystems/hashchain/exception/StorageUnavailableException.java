package com.codeheadsystems.hashchain.exception;

/**
 * The backing store failed. Whether the failed write landed is unknown, so the tail is re-read next time.
 */
public class StorageUnavailableException extends LedgerException {

  /**
   * Instantiates a new StorageUnavailable exception.
   *
   * @param message the message
   */
  public StorageUnavailableException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new StorageUnavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StorageUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
