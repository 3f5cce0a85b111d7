package com.codeheadsystems.hashchain.store;

import com.codeheadsystems.hashchain.converter.ContentFieldConverter;
import com.codeheadsystems.hashchain.dao.LedgerRecordDao;
import com.codeheadsystems.hashchain.dao.StoredRecord;
import com.codeheadsystems.hashchain.exception.SequenceConflictException;
import com.codeheadsystems.hashchain.exception.StorageUnavailableException;
import com.codeheadsystems.hashchain.model.ChainTail;
import com.codeheadsystems.hashchain.model.ImmutableLedgerRecord;
import com.codeheadsystems.hashchain.model.LedgerConfiguration;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.model.StreamKind;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger store over the LEDGER_RECORD table. Ranges are read a page at a time, each page on its
 * own handle, so a half-consumed stream holds no connection. Rows are interpreted against the
 * stream that was asked for. A row whose columns no longer read back as written comes out as a
 * damaged record rather than failing the read.
 */
@Singleton
public class JdbiLedgerStore implements LedgerStore {

  private static final Logger log = LoggerFactory.getLogger(JdbiLedgerStore.class);
  private static final String INTEGRITY_CONSTRAINT_CLASS = "23";

  private final LedgerRecordDao ledgerRecordDao;
  private final ContentFieldConverter contentFieldConverter;
  private final int pageSize;

  /**
   * Instantiates a new Jdbi ledger store.
   *
   * @param ledgerRecordDao       the ledger record dao
   * @param contentFieldConverter the content field converter
   * @param ledgerConfiguration   the ledger configuration
   */
  @Inject
  public JdbiLedgerStore(final LedgerRecordDao ledgerRecordDao,
                         final ContentFieldConverter contentFieldConverter,
                         final LedgerConfiguration ledgerConfiguration) {
    log.info("JdbiLedgerStore({}, {}, {})", ledgerRecordDao, contentFieldConverter, ledgerConfiguration);
    this.ledgerRecordDao = ledgerRecordDao;
    this.contentFieldConverter = contentFieldConverter;
    this.pageSize = ledgerConfiguration.readPageSize();
  }

  @Override
  public Optional<ChainTail> readTail(final StreamId streamId) {
    log.trace("readTail({})", streamId);
    return call("readTail " + streamId.name(), () -> ledgerRecordDao.tail(streamId.name()));
  }

  @Override
  public void insert(final LedgerRecord record) {
    log.trace("insert({})", record);
    final StreamId streamId = record.streamId();
    final String contentJson = contentFieldConverter.toJson(record.content());
    final int rows;
    try {
      rows = ledgerRecordDao.insert(
          streamId.name(),
          streamId.kind().name(),
          streamId.key().orElse(null),
          record.sequenceNumber(),
          record.actor(),
          record.recordedAt().toEpochMilli(),
          contentJson,
          record.previousHash(),
          record.contentHash());
    } catch (JdbiException e) {
      if (isIntegrityViolation(e)) {
        throw new SequenceConflictException("Record already exists at " + streamId.name() + "#" + record.sequenceNumber(), e);
      }
      log.error("insert({}#{}) failed", streamId.name(), record.sequenceNumber(), e);
      throw new StorageUnavailableException("Unable to insert into " + streamId.name(), e);
    }
    if (rows != 1) {
      throw new StorageUnavailableException("Insert into " + streamId.name() + " reported " + rows + " rows");
    }
  }

  @Override
  public Stream<LedgerRecord> readRange(final StreamId streamId, final long from, final long to) {
    log.trace("readRange({}, {}, {})", streamId, from, to);
    final Iterator<LedgerRecord> iterator = new PageIterator(streamId, from, to);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  @Override
  public List<StreamId> listStreams(final StreamKind kind) {
    log.trace("listStreams({})", kind);
    final List<String> names = call("listStreams " + kind, () -> ledgerRecordDao.streamNames(kind.name()));
    final List<StreamId> streams = new ArrayList<>(names.size());
    for (String name : names) {
      final Optional<StreamId> streamId = StreamId.parse(name).filter(id -> id.kind() == kind);
      if (streamId.isPresent()) {
        streams.add(streamId.get());
      } else {
        log.warn("listStreams({}): skipping {}, not a stream of this kind", kind, name);
      }
    }
    return streams;
  }

  private LedgerRecord toRecord(final StreamId streamId, final StoredRecord row) {
    final ImmutableLedgerRecord.Builder builder = ImmutableLedgerRecord.builder()
        .streamId(streamId)
        .sequenceNumber(row.sequenceNumber())
        .actor(row.actor())
        .recordedAt(Instant.ofEpochMilli(row.recordedAt()))
        .previousHash(row.previousHash())
        .contentHash(row.contentHash());
    if (!row.streamKind().equals(streamId.kind().name()) || !row.streamKey().equals(streamId.key())) {
      log.warn("toRecord({}, {}): stream columns {}/{} disagree", streamId.name(), row.sequenceNumber(),
          row.streamKind(), row.streamKey().orElse(null));
      return builder
          .damage("stream columns " + row.streamKind() + "/" + row.streamKey().orElse("") + " do not match " + streamId.name())
          .build();
    }
    try {
      return builder.content(contentFieldConverter.fromJson(row.contentJson())).build();
    } catch (IllegalArgumentException e) {
      log.warn("toRecord({}, {}): unreadable content: {}", streamId.name(), row.sequenceNumber(), e.getMessage());
      return builder.damage("unreadable content: " + row.contentJson()).build();
    }
  }

  private <T> T call(final String what, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (JdbiException e) {
      log.error("{} failed", what, e);
      throw new StorageUnavailableException("Storage failure on " + what, e);
    }
  }

  private boolean isIntegrityViolation(final Throwable throwable) {
    for (Throwable t = throwable; t != null; t = t.getCause()) {
      if (t instanceof SQLIntegrityConstraintViolationException) {
        return true;
      }
      if (t instanceof SQLException) {
        final String state = ((SQLException) t).getSQLState();
        if (state != null && state.startsWith(INTEGRITY_CONSTRAINT_CLASS)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Walks a range page by page. A short page means the range is exhausted.
   */
  private class PageIterator implements Iterator<LedgerRecord> {

    private final StreamId streamId;
    private final long to;
    private long nextFrom;
    private Iterator<LedgerRecord> page = List.<LedgerRecord>of().iterator();
    private boolean exhausted;

    PageIterator(final StreamId streamId, final long from, final long to) {
      this.streamId = streamId;
      this.nextFrom = from;
      this.to = to;
      this.exhausted = from > to;
    }

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      final List<StoredRecord> rows = call("readRange " + streamId.name(),
          () -> ledgerRecordDao.page(streamId.name(), nextFrom, to, pageSize));
      if (rows.size() < pageSize) {
        exhausted = true;
      }
      if (!rows.isEmpty()) {
        final long last = rows.get(rows.size() - 1).sequenceNumber();
        if (last >= to) {
          exhausted = true;
        } else {
          nextFrom = last + 1;
        }
      }
      page = rows.stream().map(row -> toRecord(streamId, row)).iterator();
      return page.hasNext();
    }

    @Override
    public LedgerRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return page.next();
    }
  }
}
