package com.codeheadsystems.hashchain.store;

import com.codeheadsystems.hashchain.exception.SequenceConflictException;
import com.codeheadsystems.hashchain.exception.StorageUnavailableException;
import com.codeheadsystems.hashchain.model.ChainTail;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.model.StreamKind;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable, ordered storage of records per stream. Does no hashing and no validation: it stores
 * what the chain manager hands it and refuses to overwrite.
 *
 * <p>Every method may throw {@link StorageUnavailableException}.
 */
public interface LedgerStore {

  /**
   * Sequence number and content hash of the last record of a stream.
   *
   * @param streamId the stream id
   * @return empty for a stream with no records
   */
  Optional<ChainTail> readTail(StreamId streamId);

  /**
   * Stores a record atomically.
   *
   * @param record the record
   * @throws SequenceConflictException if the stream already has a record at that sequence number
   */
  void insert(LedgerRecord record);

  /**
   * Records {@code from..to} inclusive in sequence order. The stream is lazy and finite; calling
   * again reads from the start. Close it when done.
   *
   * @param streamId the stream id
   * @param from     the from
   * @param to       the to
   * @return the records
   */
  Stream<LedgerRecord> readRange(StreamId streamId, long from, long to);

  /**
   * Streams of a kind that hold at least one record, ordered by name.
   *
   * @param kind the kind
   * @return the stream ids
   */
  List<StreamId> listStreams(StreamKind kind);

}
