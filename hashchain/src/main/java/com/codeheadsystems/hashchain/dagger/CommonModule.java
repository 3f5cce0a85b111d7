package com.codeheadsystems.hashchain.dagger;

import dagger.Module;
import dagger.Provides;
import java.time.Clock;
import javax.inject.Singleton;

/**
 * Shared infrastructure for the ledger graph.
 */
@Module
public class CommonModule {

  /**
   * Instantiates a new Common module.
   */
  public CommonModule() {
    // Default constructor
  }

  /**
   * Source of record capture times. Always UTC so canonical timestamps never depend on the host
   * zone.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  Clock captureClock() {
    return Clock.systemUTC();
  }

}
