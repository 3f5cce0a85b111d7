package com.codeheadsystems.dbu.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Connection settings for the relational store behind the ledger.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDatabase.class)
@JsonDeserialize(builder = ImmutableDatabase.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Database {

  /**
   * JDBC url, e.g. {@code jdbc:hsqldb:mem:ledger} or {@code jdbc:postgresql://host/db}.
   *
   * @return the url
   */
  String url();

  /**
   * Database username string.
   *
   * @return the string
   */
  String username();

  /**
   * Database password string. Never shows up in {@code toString()}.
   *
   * @return the string
   */
  @Value.Redacted
  String password();

  /**
   * Whether the schema changelog should run when the Jdbi instance is created.
   *
   * @return true by default
   */
  @Value.Default
  default boolean runLiquibase() {
    return true;
  }

  /**
   * Use postgresql boolean.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean usePostgresql() {
    return url().startsWith("jdbc:postgresql");
  }

  /**
   * Rejects urls that are not JDBC urls up front, rather than on the first connection.
   */
  @Value.Check
  default void check() {
    if (!url().startsWith("jdbc:")) {
      throw new IllegalArgumentException("Not a JDBC url: " + url());
    }
  }

}
