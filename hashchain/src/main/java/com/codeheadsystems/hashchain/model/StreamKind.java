package com.codeheadsystems.hashchain.model;

/**
 * The logical chains kept by the compliance subsystems. A singleton kind has exactly one chain; a
 * keyed kind has one independent chain per entity (request id, subject id).
 */
public enum StreamKind {

  /**
   * System and data audit log.
   */
  SYSTEM_AUDIT(false),

  /**
   * Security events: logins, lockouts, role and password changes.
   */
  SECURITY_AUDIT(false),

  /**
   * Electronic signatures, including their revocations.
   */
  SIGNATURES(false),

  /**
   * Legal holds and their lifting.
   */
  LEGAL_HOLDS(false),

  /**
   * Protocol deviations.
   */
  PROTOCOL_DEVIATIONS(false),

  /**
   * History of one data subject access request.
   */
  REQUEST_HISTORY(true),

  /**
   * History of one erasure request.
   */
  ERASURE_HISTORY(true),

  /**
   * History of one rectification request.
   */
  RECTIFICATION_HISTORY(true),

  /**
   * History of one processing restriction.
   */
  RESTRICTION_HISTORY(true),

  /**
   * Consent history of one subject.
   */
  CONSENT_HISTORY(true);

  private final boolean keyed;

  StreamKind(final boolean keyed) {
    this.keyed = keyed;
  }

  /**
   * Whether streams of this kind are identified by an entity key.
   *
   * @return true for per-entity kinds
   */
  public boolean keyed() {
    return keyed;
  }
}
