package com.codeheadsystems.hashchain.dao;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * A LEDGER_RECORD row as stored, before any of it is interpreted. Reading one never fails on the
 * row's contents.
 */
@Value.Immutable
public interface StoredRecord {

  /**
   * Stream name, the storage key.
   *
   * @return the stream name
   */
  String streamName();

  /**
   * Stream kind column.
   *
   * @return the stream kind
   */
  String streamKind();

  /**
   * Stream key column, empty for singleton streams.
   *
   * @return the stream key
   */
  Optional<String> streamKey();

  /**
   * Sequence number.
   *
   * @return the sequence number
   */
  long sequenceNumber();

  /**
   * Actor.
   *
   * @return the actor
   */
  String actor();

  /**
   * Capture time in epoch millis.
   *
   * @return the recorded at
   */
  long recordedAt();

  /**
   * Content json.
   *
   * @return the content json
   */
  String contentJson();

  /**
   * Previous hash.
   *
   * @return the previous hash
   */
  String previousHash();

  /**
   * Content hash.
   *
   * @return the content hash
   */
  String contentHash();

}
