package com.codeheadsystems.hashchain.model;

import com.codeheadsystems.dbu.model.Database;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The ledger configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * Database database.
   *
   * @return the database
   */
  Database database();

  /**
   * Ledger ledger configuration.
   *
   * @return the ledger configuration
   */
  @Value.Default
  default LedgerConfiguration ledger() {
    return ImmutableLedgerConfiguration.builder().build();
  }

}
