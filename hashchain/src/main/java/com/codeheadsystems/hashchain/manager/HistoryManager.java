package com.codeheadsystems.hashchain.manager;

import com.codeheadsystems.hashchain.model.HistoryFilter;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.store.LedgerStore;
import java.util.Objects;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only queries over a stream's records.
 */
@Singleton
public class HistoryManager {

  private static final Logger log = LoggerFactory.getLogger(HistoryManager.class);

  private final LedgerStore ledgerStore;

  /**
   * Instantiates a new History manager.
   *
   * @param ledgerStore the ledger store
   */
  @Inject
  public HistoryManager(final LedgerStore ledgerStore) {
    log.info("HistoryManager({})", ledgerStore);
    this.ledgerStore = ledgerStore;
  }

  /**
   * Records of a stream matching the filter, in sequence order. Lazy; close when done.
   *
   * @param streamId the stream id
   * @param filter   the filter
   * @return the stream
   */
  public Stream<LedgerRecord> history(final StreamId streamId, final HistoryFilter filter) {
    log.trace("history({}, {})", streamId, filter);
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(filter, "filter");
    final long from = filter.fromSequence().orElse(1L);
    final long to = filter.toSequence().orElse(Long.MAX_VALUE);
    if (to < from) {
      return Stream.empty();
    }
    final Stream<LedgerRecord> records = ledgerStore.readRange(streamId, from, to).filter(filter::matches);
    return filter.limit().map(limit -> records.limit(limit)).orElse(records);
  }

}
