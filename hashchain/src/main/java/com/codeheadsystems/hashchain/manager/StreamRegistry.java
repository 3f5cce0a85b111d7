package com.codeheadsystems.hashchain.manager;

import com.codeheadsystems.hashchain.model.StreamId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps stream ids to their append state, created on first use. States are softly held: a state is
 * only reclaimed once no thread references it, so a live stream never ends up with two locks.
 * The committed high-water marks are held strongly, one counter per stream, and survive the
 * reclamation of the state that advanced them.
 */
@Singleton
public class StreamRegistry {

  private static final Logger log = LoggerFactory.getLogger(StreamRegistry.class);

  private final Cache<StreamId, StreamState> states;
  private final Map<StreamId, AtomicLong> committed = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Stream registry.
   */
  @Inject
  public StreamRegistry() {
    this(Caffeine.newBuilder()
        .softValues()
        .build());
  }

  /**
   * Instantiates a new Stream registry over the given state cache.
   *
   * @param states the states
   */
  StreamRegistry(final Cache<StreamId, StreamState> states) {
    log.info("StreamRegistry()");
    this.states = states;
  }

  /**
   * State of a stream, created atomically if this is its first use.
   *
   * @param streamId the stream id
   * @return the stream state
   */
  public StreamState state(final StreamId streamId) {
    return states.get(streamId, id -> {
      log.debug("state({}): new stream state", id.name());
      return new StreamState(id, committed.computeIfAbsent(id, k -> new AtomicLong()));
    });
  }

  /**
   * Highest sequence number this process has committed to the stream, 0 if none. Unaffected by
   * the reclamation of the stream's state.
   *
   * @param streamId the stream id
   * @return the highest committed sequence number
   */
  public long highestCommitted(final StreamId streamId) {
    final AtomicLong value = committed.get(streamId);
    return value == null ? 0L : value.get();
  }

}
