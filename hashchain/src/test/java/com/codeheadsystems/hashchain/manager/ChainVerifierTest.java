package com.codeheadsystems.hashchain.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.hashchain.canonical.ContentCanonicalizer;
import com.codeheadsystems.hashchain.digest.ChainDigester;
import com.codeheadsystems.hashchain.model.BreakType;
import com.codeheadsystems.hashchain.model.ChainBreak;
import com.codeheadsystems.hashchain.model.ContentField;
import com.codeheadsystems.hashchain.model.ImmutableLedgerConfiguration;
import com.codeheadsystems.hashchain.model.ImmutableLedgerRecord;
import com.codeheadsystems.hashchain.model.IntegrityReport;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.model.StreamKind;
import com.codeheadsystems.hashchain.model.VerificationRange;
import com.codeheadsystems.hashchain.store.LedgerStore;
import com.codeheadsystems.hashchain.store.VolatileLedgerStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChainVerifierTest {

  private static final StreamId STREAM = StreamId.of(StreamKind.SECURITY_AUDIT);
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-05T08:00:00Z"), ZoneOffset.UTC);

  private final ContentCanonicalizer canonicalizer = new ContentCanonicalizer();
  private final ChainDigester digester = new ChainDigester();

  private StreamRegistry registry;
  private VolatileLedgerStore store;
  private ChainManager manager;

  @BeforeEach
  void setup() {
    registry = new StreamRegistry();
    store = new VolatileLedgerStore();
    manager = new ChainManager(store, registry, canonicalizer, digester, CLOCK,
        ImmutableLedgerConfiguration.builder().build());
  }

  private void append(final StreamId streamId, final String... events) {
    for (String event : events) {
      manager.append(streamId, List.of(ContentField.string("event", event)), "auditor");
    }
  }

  private List<LedgerRecord> records(final StreamId streamId) {
    try (Stream<LedgerRecord> records = store.readRange(streamId, 1, Long.MAX_VALUE)) {
      return records.collect(Collectors.toCollection(ArrayList::new));
    }
  }

  /** A verifier over a copy of the records, unaware of what this process committed. */
  private ChainVerifier verifierOver(final List<LedgerRecord> records) {
    return new ChainVerifier(copyOf(records), new StreamRegistry(), canonicalizer, digester);
  }

  private LedgerStore copyOf(final List<LedgerRecord> records) {
    final VolatileLedgerStore copy = new VolatileLedgerStore();
    records.forEach(copy::insert);
    return copy;
  }

  private ChainVerifier verifier() {
    return new ChainVerifier(store, registry, canonicalizer, digester);
  }

  private LedgerRecord withEvent(final LedgerRecord record, final String event) {
    return ImmutableLedgerRecord.copyOf(record).withContent(List.of(ContentField.string("event", event)));
  }

  @Test
  void testVerify_validChain() {
    append(STREAM, "CREATE", "APPROVE");

    final IntegrityReport report = verifier().verify(STREAM);

    assertThat(report.valid()).isTrue();
    assertThat(report.recordsChecked()).isEqualTo(2L);
    assertThat(report.firstBreak()).isEmpty();
    assertThat(report.lastContentHash()).contains(records(STREAM).get(1).contentHash());
  }

  @Test
  void testVerify_emptyStream() {
    final IntegrityReport report = verifier().verify(StreamId.of(StreamKind.ERASURE_HISTORY, "never-written"));

    assertThat(report.valid()).isTrue();
    assertThat(report.recordsChecked()).isZero();
    assertThat(report.lastContentHash()).isEmpty();
  }

  @Test
  void testVerify_alteredContentBreaksSuccessorLink() {
    append(STREAM, "CREATE", "APPROVE");
    final List<LedgerRecord> records = records(STREAM);
    records.set(0, withEvent(records.get(0), "DELETE"));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.valid()).isFalse();
    assertThat(report.firstBreak()).contains(2L);
    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.LINK_MISMATCH);
  }

  @Test
  void testVerify_deletedRecordIsGap() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.remove(1);

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.firstBreak()).contains(2L);
    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.GAP);
    assertThat(report.recordsChecked()).isEqualTo(2L);
  }

  @Test
  void testVerify_deletedFirstRecord() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.remove(0);

    assertThat(verifierOver(records).verify(STREAM).firstBreak()).contains(1L);
  }

  @Test
  void testVerify_alteredLastRecord() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.set(2, withEvent(records.get(2), "Z"));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.firstBreak()).contains(3L);
    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.CONTENT_MISMATCH);
  }

  @Test
  void testVerify_alteredStoredHashOnly() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.set(1, ImmutableLedgerRecord.copyOf(records.get(1)).withContentHash(DigestUtils.sha256Hex("forged")));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.firstBreak()).contains(2L);
    assertThat(report.breaks()).containsExactly(ChainBreak.of(2, BreakType.CONTENT_MISMATCH,
        report.breaks().get(0).detail()));
  }

  @Test
  void testVerify_genesisLink() {
    append(STREAM, "A", "B");
    final List<LedgerRecord> records = records(STREAM);
    records.set(0, ImmutableLedgerRecord.copyOf(records.get(0)).withPreviousHash(DigestUtils.sha256Hex("x")));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.firstBreak()).contains(1L);
    assertThat(report.breaks().get(0).type()).isEqualTo(BreakType.LINK_MISMATCH);
  }

  @Test
  void testVerify_malformedPreviousHash() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.set(1, ImmutableLedgerRecord.copyOf(records.get(1)).withPreviousHash("garbage"));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.breaks()).extracting(ChainBreak::sequenceNumber).containsExactly(2L);
    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.LINK_MISMATCH);
  }

  @Test
  void testVerify_damagedRecordIsContentMismatch() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.set(1, ImmutableLedgerRecord.copyOf(records.get(1)).withContent(List.of()).withDamage("unreadable content: {}"));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.breaks()).containsExactly(ChainBreak.of(2, BreakType.CONTENT_MISMATCH,
        report.breaks().get(0).detail()));
    assertThat(report.lastContentHash()).contains(records.get(2).contentHash());
  }

  @Test
  void testVerify_damagedRecordAfterLinkBreak() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.set(1, ImmutableLedgerRecord.copyOf(records.get(1))
        .withPreviousHash(DigestUtils.sha256Hex("x"))
        .withDamage("stream columns NOPE/ do not match SECURITY_AUDIT"));

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.LINK_MISMATCH);
    assertThat(report.firstBreak()).contains(2L);
  }

  @Test
  void testVerify_collectsEveryBreak() {
    append(STREAM, "A", "B", "C", "D", "E");
    final List<LedgerRecord> records = records(STREAM);
    records.set(4, withEvent(records.get(4), "Z"));
    records.remove(2);

    final IntegrityReport report = verifierOver(records).verify(STREAM);

    assertThat(report.breaks()).extracting(ChainBreak::sequenceNumber).containsExactly(3L, 5L);
    assertThat(report.firstBreak()).contains(3L);
  }

  @Test
  void testVerify_rangesCompose() {
    append(STREAM, "A", "B", "C", "D", "E");

    final IntegrityReport head = verifier().verify(STREAM, VerificationRange.between(1, 2));
    final IntegrityReport tail = verifier().verify(STREAM,
        VerificationRange.after(3, head.lastContentHash().orElseThrow()));

    assertThat(head.valid()).isTrue();
    assertThat(head.recordsChecked()).isEqualTo(2L);
    assertThat(tail.valid()).isTrue();
    assertThat(tail.recordsChecked()).isEqualTo(3L);
    assertThat(tail.lastContentHash()).isEqualTo(verifier().verify(STREAM).lastContentHash());
  }

  @Test
  void testVerify_rangeWithWrongTrustedHash() {
    append(STREAM, "A", "B", "C");

    final IntegrityReport report = verifier().verify(STREAM, VerificationRange.after(2, DigestUtils.sha256Hex("wrong")));

    assertThat(report.firstBreak()).contains(2L);
  }

  @Test
  void testVerify_rangeWithoutTrustedHash() {
    append(STREAM, "A", "B", "C", "D");

    final IntegrityReport report = verifier().verify(STREAM, VerificationRange.between(2, 3));

    assertThat(report.valid()).isTrue();
    assertThat(report.recordsChecked()).isEqualTo(2L);
  }

  @Test
  void testVerify_truncatedTail() {
    append(STREAM, "A", "B", "C");
    final List<LedgerRecord> records = records(STREAM);
    records.remove(2);
    final VolatileLedgerStore truncated = new VolatileLedgerStore();
    records.forEach(truncated::insert);
    final ChainVerifier verifier = new ChainVerifier(truncated, registry, canonicalizer, digester);

    final IntegrityReport report = verifier.verify(STREAM);

    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.TRUNCATED);
    assertThat(report.firstBreak()).contains(3L);
    assertThat(verifier.verify(STREAM, VerificationRange.between(1, 2)).valid()).isTrue();
  }

  @Test
  void testVerify_appendCommittedDuringScanIsNotTruncation() {
    append(STREAM, "A");
    final LedgerStore racing = mock(LedgerStore.class);
    when(racing.readRange(STREAM, 1L, Long.MAX_VALUE)).thenAnswer(invocation -> {
      final List<LedgerRecord> snapshot = records(STREAM);
      append(STREAM, "B");
      return snapshot.stream();
    });
    final ChainVerifier verifier = new ChainVerifier(racing, registry, canonicalizer, digester);

    final IntegrityReport report = verifier.verify(STREAM);

    assertThat(registry.highestCommitted(STREAM)).isEqualTo(2L);
    assertThat(report.valid()).isTrue();
    assertThat(report.recordsChecked()).isEqualTo(1L);
    assertThat(verifier().verify(STREAM).valid()).isTrue();
  }

  @Test
  void testVerify_truncationSeenAfterStateReclaimed() {
    final Cache<StreamId, StreamState> states = Caffeine.newBuilder().build();
    final StreamRegistry reclaiming = new StreamRegistry(states);
    final ChainManager reclaimingManager = new ChainManager(store, reclaiming, canonicalizer, digester, CLOCK,
        ImmutableLedgerConfiguration.builder().build());
    for (String event : List.of("A", "B", "C")) {
      reclaimingManager.append(STREAM, List.of(ContentField.string("event", event)), "auditor");
    }
    final List<LedgerRecord> records = records(STREAM);
    records.remove(2);
    states.invalidateAll();

    final IntegrityReport report = new ChainVerifier(copyOf(records), reclaiming, canonicalizer, digester)
        .verify(STREAM);

    assertThat(report.breaks()).extracting(ChainBreak::type).containsExactly(BreakType.TRUNCATED);
    assertThat(report.firstBreak()).contains(3L);
  }

  @Test
  void testVerify_readOnly() {
    append(STREAM, "A", "B");
    final List<LedgerRecord> records = records(STREAM);
    final LedgerStore readOnly = mock(LedgerStore.class);
    when(readOnly.readRange(STREAM, 1L, Long.MAX_VALUE)).thenAnswer(invocation -> records.stream());

    final ChainVerifier verifier = new ChainVerifier(readOnly, new StreamRegistry(), canonicalizer, digester);

    assertThat(verifier.verify(STREAM)).isEqualTo(verifier.verify(STREAM));
    verify(readOnly, never()).insert(any());
  }

  @Test
  void testVerifyAll() {
    final StreamId good = StreamId.of(StreamKind.REQUEST_HISTORY, "a");
    final StreamId bad = StreamId.of(StreamKind.REQUEST_HISTORY, "b");
    append(good, "OPEN", "CLOSE");
    append(bad, "OPEN", "CLOSE");
    append(STREAM, "LOGIN");
    final List<LedgerRecord> records = new ArrayList<>(records(good));
    final List<LedgerRecord> badRecords = records(bad);
    badRecords.set(0, withEvent(badRecords.get(0), "REOPEN"));
    records.addAll(badRecords);

    final List<IntegrityReport> reports = verifierOver(records).verifyAll(StreamKind.REQUEST_HISTORY);

    assertThat(reports).extracting(IntegrityReport::streamId).containsExactly(good, bad);
    assertThat(reports).extracting(IntegrityReport::valid).containsExactly(true, false);
  }

}
