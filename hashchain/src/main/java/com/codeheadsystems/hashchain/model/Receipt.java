package com.codeheadsystems.hashchain.model;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * Proof of a successful append, handed back to the caller.
 */
@Value.Immutable
public interface Receipt {

  /**
   * Stream id.
   *
   * @return the stream id
   */
  StreamId streamId();

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

  /**
   * Recorded at instant.
   *
   * @return the instant
   */
  Instant recordedAt();

}
