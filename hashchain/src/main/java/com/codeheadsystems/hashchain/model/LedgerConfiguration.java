package com.codeheadsystems.hashchain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Tuning of the append and read paths.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLedgerConfiguration.class)
@JsonDeserialize(builder = ImmutableLedgerConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface LedgerConfiguration {

  /**
   * How long an append waits for its stream lock before failing.
   *
   * @return the long
   */
  @Value.Default
  default long lockTimeoutMillis() {
    return 5000L;
  }

  /**
   * Records fetched per page when reading a range.
   *
   * @return the int
   */
  @Value.Default
  default int readPageSize() {
    return 500;
  }

  /**
   * Whether stream tails are cached between appends instead of read from the store each time.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean cacheTail() {
    return true;
  }

  /**
   * Store type.
   *
   * @return the store type
   */
  @Value.Default
  default StoreType storeType() {
    return StoreType.JDBI;
  }

  /**
   * Timeouts and page sizes must be positive.
   */
  @Value.Check
  default void check() {
    if (lockTimeoutMillis() <= 0) {
      throw new IllegalArgumentException("lockTimeoutMillis must be > 0");
    }
    if (readPageSize() <= 0) {
      throw new IllegalArgumentException("readPageSize must be > 0");
    }
  }

}
