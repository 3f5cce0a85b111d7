package com.codeheadsystems.hashchain.exception;

/**
 * Content that cannot be canonicalized. A caller error; retrying the same input fails the same way.
 */
public class InvalidContentException extends LedgerException {

  /**
   * Instantiates a new InvalidContent exception.
   *
   * @param message the message
   */
  public InvalidContentException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new InvalidContent exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidContentException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
