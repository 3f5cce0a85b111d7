package com.codeheadsystems.hashchain.model;

import org.immutables.value.Value;

/**
 * A single finding of a verification pass.
 */
@Value.Immutable
public interface ChainBreak {

  /**
   * Of chain break.
   *
   * @param sequenceNumber the sequence number
   * @param type           the type
   * @param detail         the detail
   * @return the chain break
   */
  static ChainBreak of(final long sequenceNumber, final BreakType type, final String detail) {
    return ImmutableChainBreak.builder().sequenceNumber(sequenceNumber).type(type).detail(detail).build();
  }

  /**
   * Where the chain breaks.
   *
   * @return the sequence number
   */
  long sequenceNumber();

  /**
   * Type break type.
   *
   * @return the break type
   */
  BreakType type();

  /**
   * Human readable detail for investigators.
   *
   * @return the string
   */
  String detail();

}
