package com.codeheadsystems.hashchain.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Outcome of verifying a stream or a range of it. A broken chain is reported here, never thrown.
 */
@Value.Immutable
public interface IntegrityReport {

  /**
   * Stream id.
   *
   * @return the stream id
   */
  StreamId streamId();

  /**
   * Number of stored records examined.
   *
   * @return the long
   */
  long recordsChecked();

  /**
   * Every break found, in scan order.
   *
   * @return the list
   */
  List<ChainBreak> breaks();

  /**
   * Recomputed hash of the last record examined. Seeds the verification of the following range.
   *
   * @return the optional
   */
  Optional<String> lastContentHash();

  /**
   * Valid boolean.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean valid() {
    return breaks().isEmpty();
  }

  /**
   * Lowest sequence number at which the chain breaks.
   *
   * @return the optional
   */
  @Value.Derived
  default Optional<Long> firstBreak() {
    return breaks().stream()
        .map(ChainBreak::sequenceNumber)
        .min(Comparator.naturalOrder());
  }

}
