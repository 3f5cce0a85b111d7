package com.codeheadsystems.hashchain.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One link of a chain. Never updated once stored; revocations and liftings are new records.
 */
@Value.Immutable
public interface LedgerRecord {

  /**
   * Owning stream.
   *
   * @return the stream id
   */
  StreamId streamId();

  /**
   * 1-based position in the stream.
   *
   * @return the sequence number
   */
  long sequenceNumber();

  /**
   * Opaque identity of whoever caused the record.
   *
   * @return the actor
   */
  String actor();

  /**
   * Capture time, millisecond precision.
   *
   * @return the instant
   */
  Instant recordedAt();

  /**
   * Ordered domain fields.
   *
   * @return the content
   */
  List<ContentField> content();

  /**
   * {@code GENESIS} for the first record, else the content hash of the record before.
   *
   * @return the previous hash
   */
  String previousHash();

  /**
   * Hex SHA-256 of the canonical content followed by the previous hash.
   *
   * @return the content hash
   */
  String contentHash();

  /**
   * Why the stored row could not be read back as written. Present only for damaged rows, whose
   * content is then empty.
   *
   * @return the damage
   */
  Optional<String> damage();

  /**
   * First content field with the given name.
   *
   * @param name the name
   * @return the field
   */
  default Optional<ContentField> field(final String name) {
    return content().stream().filter(f -> f.name().equals(name)).findFirst();
  }

}
