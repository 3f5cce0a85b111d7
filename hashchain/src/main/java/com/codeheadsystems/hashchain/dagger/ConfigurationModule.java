package com.codeheadsystems.hashchain.dagger;

import com.codeheadsystems.dbu.model.Database;
import com.codeheadsystems.hashchain.model.Configuration;
import com.codeheadsystems.hashchain.model.LedgerConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Exposes the configuration and its parts to the graph.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Database database.
   *
   * @return the database
   */
  @Provides
  @Singleton
  public Database database() {
    return configuration.database();
  }

  /**
   * Ledger configuration.
   *
   * @return the ledger configuration
   */
  @Provides
  @Singleton
  public LedgerConfiguration ledgerConfiguration() {
    return configuration.ledger();
  }
}
