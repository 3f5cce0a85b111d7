package com.codeheadsystems.hashchain.model;

import org.immutables.value.Value;

/**
 * Last link of a stream: what the next append chains onto.
 */
@Value.Immutable
public interface ChainTail {

  /**
   * Of chain tail.
   *
   * @param sequenceNumber the sequence number
   * @param contentHash    the content hash
   * @return the chain tail
   */
  static ChainTail of(final long sequenceNumber, final String contentHash) {
    return ImmutableChainTail.builder().sequenceNumber(sequenceNumber).contentHash(contentHash).build();
  }

  /**
   * Sequence number long.
   *
   * @return the long
   */
  long sequenceNumber();

  /**
   * Content hash string.
   *
   * @return the string
   */
  String contentHash();

}
