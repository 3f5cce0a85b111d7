package com.codeheadsystems.hashchain.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Identifies one chain: a kind plus, for keyed kinds, the entity key.
 */
@Value.Immutable
public interface StreamId {

  /**
   * Separates the kind from the key in {@link #name()}.
   */
  String SEPARATOR = ":";

  /**
   * Longest key a stream can have.
   */
  int MAX_KEY_LENGTH = 255;

  /**
   * Singleton stream of the given kind.
   *
   * @param kind the kind
   * @return the stream id
   */
  static StreamId of(final StreamKind kind) {
    return ImmutableStreamId.of(kind, Optional.empty());
  }

  /**
   * Stream of the given kind and key. A null key means the singleton stream.
   *
   * @param kind the kind
   * @param key  the key, may be null
   * @return the stream id
   */
  static StreamId of(final StreamKind kind, final String key) {
    return ImmutableStreamId.of(kind, Optional.ofNullable(key));
  }

  /**
   * Reads a stream id back from its {@link #name()}.
   *
   * @param name the name
   * @return the stream id, empty when the name does not denote a valid stream
   */
  static Optional<StreamId> parse(final String name) {
    if (name == null) {
      return Optional.empty();
    }
    final int separator = name.indexOf(SEPARATOR);
    final String kindName = separator < 0 ? name : name.substring(0, separator);
    final String key = separator < 0 ? null : name.substring(separator + SEPARATOR.length());
    try {
      return Optional.of(of(StreamKind.valueOf(kindName), key));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * Kind of the stream.
   *
   * @return the kind
   */
  @Value.Parameter
  StreamKind kind();

  /**
   * Entity key, present only for keyed kinds.
   *
   * @return the key
   */
  @Value.Parameter
  Optional<String> key();

  /**
   * Stable name used as the storage key, {@code KIND} or {@code KIND:key}.
   *
   * @return the name
   */
  @Value.Derived
  default String name() {
    return key().map(k -> kind().name() + SEPARATOR + k).orElse(kind().name());
  }

  /**
   * Singleton kinds take no key, keyed kinds need a non-blank one of at most
   * {@link #MAX_KEY_LENGTH} characters.
   */
  @Value.Check
  default void check() {
    if (kind().keyed()) {
      if (key().isEmpty() || key().get().isBlank()) {
        throw new IllegalArgumentException("Stream kind " + kind() + " requires a key");
      }
      if (key().get().length() > MAX_KEY_LENGTH) {
        throw new IllegalArgumentException("Stream key longer than " + MAX_KEY_LENGTH + " characters");
      }
    } else if (key().isPresent()) {
      throw new IllegalArgumentException("Stream kind " + kind() + " does not take a key");
    }
  }
}
