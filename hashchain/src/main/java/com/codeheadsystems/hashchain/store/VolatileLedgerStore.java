package com.codeheadsystems.hashchain.store;

import com.codeheadsystems.hashchain.exception.SequenceConflictException;
import com.codeheadsystems.hashchain.model.ChainTail;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.model.StreamKind;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory ledger store. Same contract as the relational one, nothing survives the JVM.
 */
@Singleton
public class VolatileLedgerStore implements LedgerStore {

  private static final Logger log = LoggerFactory.getLogger(VolatileLedgerStore.class);

  private final Map<StreamId, ConcurrentSkipListMap<Long, LedgerRecord>> streams = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Volatile ledger store.
   */
  @Inject
  public VolatileLedgerStore() {
    log.info("VolatileLedgerStore()");
  }

  @Override
  public Optional<ChainTail> readTail(final StreamId streamId) {
    log.trace("readTail({})", streamId);
    final ConcurrentSkipListMap<Long, LedgerRecord> records = streams.get(streamId);
    if (records == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.lastEntry())
        .map(Map.Entry::getValue)
        .map(r -> ChainTail.of(r.sequenceNumber(), r.contentHash()));
  }

  @Override
  public void insert(final LedgerRecord record) {
    log.trace("insert({})", record);
    final ConcurrentSkipListMap<Long, LedgerRecord> records =
        streams.computeIfAbsent(record.streamId(), id -> new ConcurrentSkipListMap<>());
    if (records.putIfAbsent(record.sequenceNumber(), record) != null) {
      throw new SequenceConflictException(
          "Record already exists at " + record.streamId().name() + "#" + record.sequenceNumber());
    }
  }

  @Override
  public Stream<LedgerRecord> readRange(final StreamId streamId, final long from, final long to) {
    log.trace("readRange({}, {}, {})", streamId, from, to);
    final ConcurrentSkipListMap<Long, LedgerRecord> records = streams.get(streamId);
    if (records == null || from > to) {
      return Stream.empty();
    }
    final NavigableMap<Long, LedgerRecord> range = records.subMap(from, true, to, true);
    return range.values().stream();
  }

  @Override
  public List<StreamId> listStreams(final StreamKind kind) {
    log.trace("listStreams({})", kind);
    return streams.entrySet().stream()
        .filter(e -> e.getKey().kind() == kind && !e.getValue().isEmpty())
        .map(Map.Entry::getKey)
        .sorted(Comparator.comparing(StreamId::name))
        .collect(Collectors.toList());
  }
}
