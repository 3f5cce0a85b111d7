package com.codeheadsystems.hashchain.dao;

import com.codeheadsystems.hashchain.model.ChainTail;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * SQL for the LEDGER_RECORD table. One row per record, keyed by (STREAM_NAME, SEQUENCE_NUMBER).
 */
public interface LedgerRecordDao {

  /**
   * Last record of a stream.
   *
   * @param streamName the stream name
   * @return the tail
   */
  @SqlQuery("select SEQUENCE_NUMBER, CONTENT_HASH from LEDGER_RECORD where STREAM_NAME = :streamName "
      + "order by SEQUENCE_NUMBER desc limit 1")
  Optional<ChainTail> tail(@Bind("streamName") String streamName);

  /**
   * Insert one record. Fails on the primary key if the sequence number is taken.
   *
   * @param streamName     the stream name
   * @param streamKind     the stream kind
   * @param streamKey      the stream key, null for singleton streams
   * @param sequenceNumber the sequence number
   * @param actor          the actor
   * @param recordedAt     capture time in epoch millis
   * @param contentJson    the content json
   * @param previousHash   the previous hash
   * @param contentHash    the content hash
   * @return rows inserted
   */
  @SqlUpdate("insert into LEDGER_RECORD (STREAM_NAME, STREAM_KIND, STREAM_KEY, SEQUENCE_NUMBER, ACTOR, "
      + "RECORDED_AT, CONTENT_JSON, PREVIOUS_HASH, CONTENT_HASH) values (:streamName, :streamKind, "
      + ":streamKey, :sequenceNumber, :actor, :recordedAt, :contentJson, :previousHash, :contentHash)")
  int insert(@Bind("streamName") String streamName,
             @Bind("streamKind") String streamKind,
             @Bind("streamKey") String streamKey,
             @Bind("sequenceNumber") long sequenceNumber,
             @Bind("actor") String actor,
             @Bind("recordedAt") long recordedAt,
             @Bind("contentJson") String contentJson,
             @Bind("previousHash") String previousHash,
             @Bind("contentHash") String contentHash);

  /**
   * One page of a range, ascending.
   *
   * @param streamName the stream name
   * @param from       first sequence number, inclusive
   * @param to         last sequence number, inclusive
   * @param limit      page size
   * @return the rows
   */
  @SqlQuery("select STREAM_NAME, STREAM_KIND, STREAM_KEY, SEQUENCE_NUMBER, ACTOR, RECORDED_AT, CONTENT_JSON, "
      + "PREVIOUS_HASH, CONTENT_HASH from LEDGER_RECORD where STREAM_NAME = :streamName "
      + "and SEQUENCE_NUMBER >= :from and SEQUENCE_NUMBER <= :to order by SEQUENCE_NUMBER asc limit :limit")
  List<StoredRecord> page(@Bind("streamName") String streamName,
                          @Bind("from") long from,
                          @Bind("to") long to,
                          @Bind("limit") int limit);

  /**
   * Names of the streams of one kind that hold at least one record.
   *
   * @param streamKind the stream kind
   * @return the stream names
   */
  @SqlQuery("select distinct STREAM_NAME from LEDGER_RECORD where STREAM_KIND = :streamKind order by STREAM_NAME asc")
  List<String> streamNames(@Bind("streamKind") String streamKind);

}
