package com.codeheadsystems.hashchain.model;

/**
 * Which ledger store backs the application.
 */
public enum StoreType {

  /**
   * Relational store through Jdbi.
   */
  JDBI,

  /**
   * In-memory store, lost on shutdown.
   */
  VOLATILE
}
