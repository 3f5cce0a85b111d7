package com.codeheadsystems.hashchain.model;

/**
 * What kind of damage a verification pass found.
 */
public enum BreakType {

  /**
   * One or more sequence numbers are missing.
   */
  GAP,

  /**
   * A record's previous hash is not the hash recomputed for its predecessor (or GENESIS).
   */
  LINK_MISMATCH,

  /**
   * A record's stored hash does not match its stored content.
   */
  CONTENT_MISMATCH,

  /**
   * Records this process committed are no longer in the store.
   */
  TRUNCATED
}
