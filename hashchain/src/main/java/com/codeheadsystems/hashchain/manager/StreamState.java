package com.codeheadsystems.hashchain.manager;

import com.codeheadsystems.hashchain.model.ChainTail;
import com.codeheadsystems.hashchain.model.StreamId;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-stream append state: the lock every append takes, and what this process knows about the
 * tail. The cached tail is only written while the lock is held. The committed high-water mark is
 * owned by the {@link StreamRegistry} and outlives this object.
 */
public class StreamState {

  private final StreamId streamId;
  private final ReentrantLock lock = new ReentrantLock(true);
  private final AtomicLong highestCommitted;
  private volatile ChainTail cachedTail;

  /**
   * Instantiates a new Stream state.
   *
   * @param streamId         the stream id
   * @param highestCommitted the high-water mark shared with the registry
   */
  StreamState(final StreamId streamId, final AtomicLong highestCommitted) {
    this.streamId = streamId;
    this.highestCommitted = highestCommitted;
  }

  /**
   * Stream id.
   *
   * @return the stream id
   */
  public StreamId streamId() {
    return streamId;
  }

  /**
   * Lock reentrant lock.
   *
   * @return the reentrant lock
   */
  public ReentrantLock lock() {
    return lock;
  }

  /**
   * Tail as of the last append through this process, if still trusted.
   *
   * @return the optional
   */
  public Optional<ChainTail> cachedTail() {
    return Optional.ofNullable(cachedTail);
  }

  /**
   * Highest sequence number this process has committed, 0 if none.
   *
   * @return the long
   */
  public long highestCommitted() {
    return highestCommitted.get();
  }

  /**
   * Records a committed append. Caller holds the lock.
   *
   * @param tail the new tail
   */
  void advance(final ChainTail tail) {
    cachedTail = tail;
    highestCommitted.accumulateAndGet(tail.sequenceNumber(), Math::max);
  }

  /**
   * Forgets the cached tail so the next append reads it from the store. Caller holds the lock.
   */
  void invalidate() {
    cachedTail = null;
  }

  @Override
  public String toString() {
    return "StreamState{" + streamId.name() + ", tail=" + cachedTail + ", highestCommitted=" + highestCommitted.get() + "}";
  }
}
