package com.codeheadsystems.hashchain.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * The part of a stream to verify. Without bounds the whole stream is checked.
 */
@Value.Immutable
public interface VerificationRange {

  /**
   * The whole stream.
   *
   * @return the verification range
   */
  static VerificationRange all() {
    return ImmutableVerificationRange.builder().build();
  }

  /**
   * Records {@code from..to} inclusive.
   *
   * @param from the from
   * @param to   the to
   * @return the verification range
   */
  static VerificationRange between(final long from, final long to) {
    return ImmutableVerificationRange.builder().from(from).to(to).build();
  }

  /**
   * Records from {@code from} to the end, the first one checked against a hash the caller already
   * trusts.
   *
   * @param from                the from
   * @param trustedPreviousHash content hash of record {@code from - 1}
   * @return the verification range
   */
  static VerificationRange after(final long from, final String trustedPreviousHash) {
    return ImmutableVerificationRange.builder().from(from).trustedPreviousHash(trustedPreviousHash).build();
  }

  /**
   * First sequence number, defaults to 1.
   *
   * @return the optional
   */
  Optional<Long> from();

  /**
   * Last sequence number, defaults to the end of the stream.
   *
   * @return the optional
   */
  Optional<Long> to();

  /**
   * Hash of the record immediately before {@code from}. Ignored when the range starts at 1, where
   * the genesis sentinel applies.
   *
   * @return the optional
   */
  Optional<String> trustedPreviousHash();

  /**
   * First sequence number to read.
   *
   * @return the long
   */
  @Value.Derived
  default long start() {
    return from().orElse(1L);
  }

  /**
   * Last sequence number to read.
   *
   * @return the long
   */
  @Value.Derived
  default long end() {
    return to().orElse(Long.MAX_VALUE);
  }

  /**
   * Bounds are 1-based and ordered.
   */
  @Value.Check
  default void check() {
    if (start() < 1) {
      throw new IllegalArgumentException("from must be >= 1: " + start());
    }
    if (end() < start()) {
      throw new IllegalArgumentException("to (" + end() + ") < from (" + start() + ")");
    }
  }

}
