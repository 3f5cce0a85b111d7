package com.codeheadsystems.hashchain.exception;

/**
 * A record already exists at the sequence number an append computed. Signals a writer that bypassed the
 * stream lock; never retried by re-numbering.
 */
public class SequenceConflictException extends LedgerException {

  /**
   * Instantiates a new SequenceConflict exception.
   *
   * @param message the message
   */
  public SequenceConflictException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new SequenceConflict exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SequenceConflictException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
