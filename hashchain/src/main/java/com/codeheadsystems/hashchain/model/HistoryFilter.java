package com.codeheadsystems.hashchain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Read-side filter for history queries. Every present criterion must match.
 */
@Value.Immutable
public interface HistoryFilter {

  /**
   * No filtering.
   *
   * @return the history filter
   */
  static HistoryFilter all() {
    return ImmutableHistoryFilter.builder().build();
  }

  /**
   * Actor optional.
   *
   * @return the optional
   */
  Optional<String> actor();

  /**
   * Inclusive lower bound on capture time.
   *
   * @return the optional
   */
  Optional<Instant> recordedFrom();

  /**
   * Inclusive upper bound on capture time.
   *
   * @return the optional
   */
  Optional<Instant> recordedTo();

  /**
   * From sequence optional.
   *
   * @return the optional
   */
  Optional<Long> fromSequence();

  /**
   * To sequence optional.
   *
   * @return the optional
   */
  Optional<Long> toSequence();

  /**
   * Content fields that must be present with exactly this canonical value.
   *
   * @return the map
   */
  Map<String, String> fieldEquals();

  /**
   * Maximum number of records returned.
   *
   * @return the optional
   */
  Optional<Integer> limit();

  /**
   * Matches boolean.
   *
   * @param record the record
   * @return the boolean
   */
  default boolean matches(final LedgerRecord record) {
    if (actor().isPresent() && !actor().get().equals(record.actor())) {
      return false;
    }
    if (recordedFrom().isPresent() && record.recordedAt().isBefore(recordedFrom().get())) {
      return false;
    }
    if (recordedTo().isPresent() && record.recordedAt().isAfter(recordedTo().get())) {
      return false;
    }
    for (Map.Entry<String, String> entry : fieldEquals().entrySet()) {
      final boolean present = record.field(entry.getKey())
          .flatMap(ContentField::value)
          .filter(entry.getValue()::equals)
          .isPresent();
      if (!present) {
        return false;
      }
    }
    return true;
  }

  /**
   * Limit and sequence bounds must be positive.
   */
  @Value.Check
  default void check() {
    limit().filter(l -> l < 0).ifPresent(l -> {
      throw new IllegalArgumentException("limit must be >= 0: " + l);
    });
    fromSequence().filter(f -> f < 1).ifPresent(f -> {
      throw new IllegalArgumentException("fromSequence must be >= 1: " + f);
    });
  }

}
