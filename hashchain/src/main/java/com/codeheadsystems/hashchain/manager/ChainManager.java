package com.codeheadsystems.hashchain.manager;

import com.codeheadsystems.hashchain.canonical.ContentCanonicalizer;
import com.codeheadsystems.hashchain.digest.ChainDigester;
import com.codeheadsystems.hashchain.exception.LockTimeoutException;
import com.codeheadsystems.hashchain.exception.SequenceConflictException;
import com.codeheadsystems.hashchain.exception.StorageUnavailableException;
import com.codeheadsystems.hashchain.model.ChainTail;
import com.codeheadsystems.hashchain.model.ContentField;
import com.codeheadsystems.hashchain.model.ImmutableLedgerRecord;
import com.codeheadsystems.hashchain.model.ImmutableReceipt;
import com.codeheadsystems.hashchain.model.LedgerConfiguration;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.Receipt;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.store.LedgerStore;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the append protocol. For one stream at most one append is in flight: the tail is read, the
 * new link computed and the record stored while the stream lock is held, so two appends can never
 * chain onto the same predecessor.
 */
@Singleton
public class ChainManager {

  private static final Logger log = LoggerFactory.getLogger(ChainManager.class);

  private final LedgerStore ledgerStore;
  private final StreamRegistry streamRegistry;
  private final ContentCanonicalizer contentCanonicalizer;
  private final ChainDigester chainDigester;
  private final Clock clock;
  private final long lockTimeoutMillis;
  private final boolean cacheTail;

  /**
   * Instantiates a new Chain manager.
   *
   * @param ledgerStore          the ledger store
   * @param streamRegistry       the stream registry
   * @param contentCanonicalizer the content canonicalizer
   * @param chainDigester        the chain digester
   * @param clock                the clock
   * @param ledgerConfiguration  the ledger configuration
   */
  @Inject
  public ChainManager(final LedgerStore ledgerStore,
                      final StreamRegistry streamRegistry,
                      final ContentCanonicalizer contentCanonicalizer,
                      final ChainDigester chainDigester,
                      final Clock clock,
                      final LedgerConfiguration ledgerConfiguration) {
    log.info("ChainManager({}, {}, {}, {}, {}, {})",
        ledgerStore, streamRegistry, contentCanonicalizer, chainDigester, clock, ledgerConfiguration);
    this.ledgerStore = ledgerStore;
    this.streamRegistry = streamRegistry;
    this.contentCanonicalizer = contentCanonicalizer;
    this.chainDigester = chainDigester;
    this.clock = clock;
    this.lockTimeoutMillis = ledgerConfiguration.lockTimeoutMillis();
    this.cacheTail = ledgerConfiguration.cacheTail();
  }

  /**
   * Appends one record to a stream.
   *
   * @param streamId the stream id
   * @param content  the ordered content fields
   * @param actor    who caused the record
   * @return the receipt
   * @throws com.codeheadsystems.hashchain.exception.InvalidContentException if the content cannot be canonicalized
   * @throws LockTimeoutException if the stream lock is not acquired in time
   * @throws SequenceConflictException if another writer bypassed the lock
   * @throws StorageUnavailableException if the store fails
   */
  public Receipt append(final StreamId streamId,
                        final List<ContentField> content,
                        final String actor) {
    log.trace("append({}, {}, {})", streamId, content, actor);
    Objects.requireNonNull(streamId, "streamId");
    contentCanonicalizer.validate(actor, content);

    final StreamState state = streamRegistry.state(streamId);
    acquire(state);
    try {
      final ChainTail tail = currentTail(state).orElse(null);
      final long sequenceNumber = tail == null ? 1L : tail.sequenceNumber() + 1;
      final String previousHash = tail == null ? ChainDigester.GENESIS : tail.contentHash();
      final Instant recordedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
      final byte[] canonical = contentCanonicalizer.canonicalize(actor, recordedAt, content);
      final String contentHash = chainDigester.linkHash(canonical, previousHash);

      final LedgerRecord record = ImmutableLedgerRecord.builder()
          .streamId(streamId)
          .sequenceNumber(sequenceNumber)
          .actor(actor)
          .recordedAt(recordedAt)
          .content(content)
          .previousHash(previousHash)
          .contentHash(contentHash)
          .build();
      try {
        ledgerStore.insert(record);
      } catch (SequenceConflictException e) {
        log.error("append({}): sequence conflict at {}, another writer bypassed the lock", streamId.name(), sequenceNumber);
        state.invalidate();
        throw e;
      } catch (StorageUnavailableException e) {
        log.error("append({}): storage failure at {}", streamId.name(), sequenceNumber);
        state.invalidate();
        throw e;
      }
      state.advance(ChainTail.of(sequenceNumber, contentHash));
      log.debug("append({}): #{} {}", streamId.name(), sequenceNumber, contentHash);
      return ImmutableReceipt.builder()
          .streamId(streamId)
          .sequenceNumber(sequenceNumber)
          .contentHash(contentHash)
          .recordedAt(recordedAt)
          .build();
    } finally {
      state.lock().unlock();
    }
  }

  private Optional<ChainTail> currentTail(final StreamState state) {
    if (cacheTail && state.cachedTail().isPresent()) {
      return state.cachedTail();
    }
    return ledgerStore.readTail(state.streamId());
  }

  private void acquire(final StreamState state) {
    final boolean acquired;
    try {
      acquired = state.lock().tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockTimeoutException("Interrupted waiting for " + state.streamId().name(), e);
    }
    if (!acquired) {
      log.warn("acquire({}): no lock after {}ms", state.streamId().name(), lockTimeoutMillis);
      throw new LockTimeoutException("Timed out after " + lockTimeoutMillis + "ms waiting for " + state.streamId().name());
    }
  }
}
