package com.codeheadsystems.hashchain.manager;

import com.codeheadsystems.hashchain.canonical.ContentCanonicalizer;
import com.codeheadsystems.hashchain.digest.ChainDigester;
import com.codeheadsystems.hashchain.exception.InvalidContentException;
import com.codeheadsystems.hashchain.model.BreakType;
import com.codeheadsystems.hashchain.model.ChainBreak;
import com.codeheadsystems.hashchain.model.ImmutableIntegrityReport;
import com.codeheadsystems.hashchain.model.IntegrityReport;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.model.StreamKind;
import com.codeheadsystems.hashchain.model.VerificationRange;
import com.codeheadsystems.hashchain.store.LedgerStore;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a stream from the store and reports every place the chain does not hold. Never writes.
 */
@Singleton
public class ChainVerifier {

  private static final Logger log = LoggerFactory.getLogger(ChainVerifier.class);

  private final LedgerStore ledgerStore;
  private final StreamRegistry streamRegistry;
  private final ContentCanonicalizer contentCanonicalizer;
  private final ChainDigester chainDigester;

  /**
   * Instantiates a new Chain verifier.
   *
   * @param ledgerStore          the ledger store
   * @param streamRegistry       the stream registry
   * @param contentCanonicalizer the content canonicalizer
   * @param chainDigester        the chain digester
   */
  @Inject
  public ChainVerifier(final LedgerStore ledgerStore,
                       final StreamRegistry streamRegistry,
                       final ContentCanonicalizer contentCanonicalizer,
                       final ChainDigester chainDigester) {
    log.info("ChainVerifier({}, {}, {}, {})", ledgerStore, streamRegistry, contentCanonicalizer, chainDigester);
    this.ledgerStore = ledgerStore;
    this.streamRegistry = streamRegistry;
    this.contentCanonicalizer = contentCanonicalizer;
    this.chainDigester = chainDigester;
  }

  /**
   * Verifies the whole stream.
   *
   * @param streamId the stream id
   * @return the integrity report
   */
  public IntegrityReport verify(final StreamId streamId) {
    return verify(streamId, VerificationRange.all());
  }

  /**
   * Verifies part of a stream.
   *
   * <p>A record whose stored content no longer produces its stored hash is reported where the
   * damage becomes visible: at its successor as a link mismatch when the successor still points at
   * the original hash, otherwise at the record itself as a content mismatch.
   *
   * <p>An open-ended range that ends below the highest sequence number this process had committed
   * when the verification started is reported as truncated. Nothing is known about commits made
   * by other processes, or before a restart.
   *
   * @param streamId the stream id
   * @param range    the range
   * @return the integrity report
   */
  public IntegrityReport verify(final StreamId streamId, final VerificationRange range) {
    log.trace("verify({}, {})", streamId, range);
    Objects.requireNonNull(streamId, "streamId");
    Objects.requireNonNull(range, "range");

    // High-water mark as of the start of the read. Later commits are outside this report.
    final long committedBefore = range.to().isEmpty() ? streamRegistry.highestCommitted(streamId) : 0L;
    final Scan scan = new Scan(range);
    try (Stream<LedgerRecord> records = ledgerStore.readRange(streamId, range.start(), range.end())) {
      final Iterator<LedgerRecord> iterator = records.iterator();
      while (iterator.hasNext()) {
        scan.accept(iterator.next());
      }
    }
    scan.finish();

    if (committedBefore >= scan.expectedSequence) {
      scan.breaks.add(ChainBreak.of(scan.expectedSequence, BreakType.TRUNCATED,
          "store ends at " + (scan.expectedSequence - 1) + " but " + committedBefore + " were committed"));
    }

    final IntegrityReport report = ImmutableIntegrityReport.builder()
        .streamId(streamId)
        .recordsChecked(scan.recordsChecked)
        .breaks(scan.breaks)
        .lastContentHash(Optional.ofNullable(scan.lastContentHash))
        .build();
    if (report.valid()) {
      log.debug("verify({}): {} records valid", streamId.name(), report.recordsChecked());
    } else {
      log.warn("verify({}): first break at {}, {} breaks", streamId.name(), report.firstBreak().orElse(null),
          report.breaks().size());
    }
    return report;
  }

  /**
   * Verifies every stream of a kind.
   *
   * @param kind the kind
   * @return one report per stream, ordered by stream name
   */
  public List<IntegrityReport> verifyAll(final StreamKind kind) {
    log.trace("verifyAll({})", kind);
    Objects.requireNonNull(kind, "kind");
    return ledgerStore.listStreams(kind).stream()
        .map(this::verify)
        .collect(Collectors.toList());
  }

  /**
   * Running state of one pass over a range.
   */
  private class Scan {

    private final List<ChainBreak> breaks = new ArrayList<>();
    private long expectedSequence;
    private String expectedPrevious;
    private LedgerRecord pending;
    private String lastContentHash;
    private long recordsChecked;

    private Scan(final VerificationRange range) {
      this.expectedSequence = range.start();
      if (range.start() == 1L) {
        this.expectedPrevious = ChainDigester.GENESIS;
      } else {
        this.expectedPrevious = range.trustedPreviousHash().orElse(null);
      }
    }

    private void accept(final LedgerRecord record) {
      recordsChecked++;
      final long sequence = record.sequenceNumber();
      boolean brokenHere = false;
      if (sequence != expectedSequence) {
        flushPending();
        breaks.add(ChainBreak.of(expectedSequence, BreakType.GAP,
            "records " + expectedSequence + ".." + (sequence - 1) + " missing"));
        expectedPrevious = null;
      }
      if (expectedPrevious != null && !expectedPrevious.equals(record.previousHash())) {
        // The predecessor, if pending, is explained by this break.
        pending = null;
        breaks.add(ChainBreak.of(sequence, BreakType.LINK_MISMATCH,
            "previous hash " + record.previousHash() + " expected " + expectedPrevious));
        brokenHere = true;
      } else {
        flushPending();
      }

      final String recomputed = recompute(record);
      if (recomputed == null) {
        if (!brokenHere) {
          breaks.add(ChainBreak.of(sequence, BreakType.CONTENT_MISMATCH,
              record.damage().orElse("stored record cannot be rehashed")));
        }
        expectedPrevious = record.contentHash();
      } else {
        if (!recomputed.equals(record.contentHash())) {
          pending = record;
        }
        expectedPrevious = recomputed;
      }
      lastContentHash = expectedPrevious;
      expectedSequence = sequence + 1;
    }

    private void finish() {
      flushPending();
    }

    private void flushPending() {
      if (pending != null) {
        breaks.add(ChainBreak.of(pending.sequenceNumber(), BreakType.CONTENT_MISMATCH,
            "stored hash " + pending.contentHash() + " does not match content"));
        pending = null;
      }
    }

    private String recompute(final LedgerRecord record) {
      if (record.damage().isPresent()) {
        log.warn("recompute({}, {}): {}", record.streamId().name(), record.sequenceNumber(), record.damage().get());
        return null;
      }
      if (!chainDigester.isPreviousHash(record.previousHash())) {
        return null;
      }
      try {
        final byte[] canonical = contentCanonicalizer.canonicalize(record.actor(), record.recordedAt(), record.content());
        return chainDigester.linkHash(canonical, record.previousHash());
      } catch (InvalidContentException e) {
        log.warn("recompute({}, {}): {}", record.streamId().name(), record.sequenceNumber(), e.getMessage());
        return null;
      }
    }
  }
}
