package com.codeheadsystems.hashchain.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps a LEDGER_RECORD row column for column. Interpreting the columns is left to the store.
 */
@Singleton
public class StoredRecordMapper implements RowMapper<StoredRecord> {

  /**
   * Instantiates a new Stored record mapper.
   */
  @Inject
  public StoredRecordMapper() {
  }

  @Override
  public StoredRecord map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    return ImmutableStoredRecord.builder()
        .streamName(rs.getString("STREAM_NAME"))
        .streamKind(rs.getString("STREAM_KIND"))
        .streamKey(Optional.ofNullable(rs.getString("STREAM_KEY")))
        .sequenceNumber(rs.getLong("SEQUENCE_NUMBER"))
        .actor(rs.getString("ACTOR"))
        .recordedAt(rs.getLong("RECORDED_AT"))
        .contentJson(rs.getString("CONTENT_JSON"))
        .previousHash(rs.getString("PREVIOUS_HASH"))
        .contentHash(rs.getString("CONTENT_HASH"))
        .build();
  }
}
