package com.codeheadsystems.hashchain;

import com.codeheadsystems.hashchain.manager.ChainManager;
import com.codeheadsystems.hashchain.manager.ChainVerifier;
import com.codeheadsystems.hashchain.manager.HistoryManager;
import com.codeheadsystems.hashchain.model.ContentField;
import com.codeheadsystems.hashchain.model.HistoryFilter;
import com.codeheadsystems.hashchain.model.IntegrityReport;
import com.codeheadsystems.hashchain.model.LedgerRecord;
import com.codeheadsystems.hashchain.model.Receipt;
import com.codeheadsystems.hashchain.model.StreamId;
import com.codeheadsystems.hashchain.model.StreamKind;
import com.codeheadsystems.hashchain.model.VerificationRange;
import com.codeheadsystems.hashchain.store.LedgerStore;
import java.util.List;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the compliance subsystems. Streams are addressed by kind and key; the key is
 * null for singleton kinds. A stream comes into existence with its first append.
 */
@Singleton
public class HashChainLedger {

  private static final Logger log = LoggerFactory.getLogger(HashChainLedger.class);

  private final ChainManager chainManager;
  private final ChainVerifier chainVerifier;
  private final HistoryManager historyManager;
  private final LedgerStore ledgerStore;

  /**
   * Instantiates a new Hash chain ledger.
   *
   * @param chainManager   the chain manager
   * @param chainVerifier  the chain verifier
   * @param historyManager the history manager
   * @param ledgerStore    the ledger store
   */
  @Inject
  public HashChainLedger(final ChainManager chainManager,
                         final ChainVerifier chainVerifier,
                         final HistoryManager historyManager,
                         final LedgerStore ledgerStore) {
    log.info("HashChainLedger({}, {}, {}, {})", chainManager, chainVerifier, historyManager, ledgerStore);
    this.chainManager = chainManager;
    this.chainVerifier = chainVerifier;
    this.historyManager = historyManager;
    this.ledgerStore = ledgerStore;
  }

  /**
   * Append receipt.
   *
   * @param kind    the kind
   * @param key     the key, null for singleton kinds
   * @param content the content
   * @param actor   the actor
   * @return the receipt
   */
  public Receipt append(final StreamKind kind,
                        final String key,
                        final List<ContentField> content,
                        final String actor) {
    log.trace("append({}, {})", kind, key);
    return chainManager.append(StreamId.of(kind, key), content, actor);
  }

  /**
   * Verifies a whole stream.
   *
   * @param kind the kind
   * @param key  the key
   * @return the integrity report
   */
  public IntegrityReport verify(final StreamKind kind, final String key) {
    log.trace("verify({}, {})", kind, key);
    return chainVerifier.verify(StreamId.of(kind, key));
  }

  /**
   * Verifies part of a stream.
   *
   * @param kind  the kind
   * @param key   the key
   * @param range the range
   * @return the integrity report
   */
  public IntegrityReport verify(final StreamKind kind, final String key, final VerificationRange range) {
    log.trace("verify({}, {}, {})", kind, key, range);
    return chainVerifier.verify(StreamId.of(kind, key), range);
  }

  /**
   * History of a stream. The result is lazy and must be closed.
   *
   * @param kind   the kind
   * @param key    the key
   * @param filter the filter
   * @return the stream
   */
  public Stream<LedgerRecord> history(final StreamKind kind, final String key, final HistoryFilter filter) {
    log.trace("history({}, {}, {})", kind, key, filter);
    return historyManager.history(StreamId.of(kind, key), filter);
  }

  /**
   * Streams of a kind holding at least one record.
   *
   * @param kind the kind
   * @return the list
   */
  public List<StreamId> streams(final StreamKind kind) {
    log.trace("streams({})", kind);
    return ledgerStore.listStreams(kind);
  }

  /**
   * Verify all list.
   *
   * @param kind the kind
   * @return the list
   */
  public List<IntegrityReport> verifyAll(final StreamKind kind) {
    log.trace("verifyAll({})", kind);
    return chainVerifier.verifyAll(kind);
  }

}
