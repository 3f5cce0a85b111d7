package com.codeheadsystems.hashchain.dagger;

import com.codeheadsystems.hashchain.HashChainLedger;
import com.codeheadsystems.hashchain.manager.ChainManager;
import com.codeheadsystems.hashchain.manager.ChainVerifier;
import com.codeheadsystems.hashchain.model.Configuration;
import com.codeheadsystems.hashchain.store.LedgerStore;
import dagger.Component;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The interface Ledger component.
 */
@Singleton
@Component(modules = {LedgerModule.class, ConfigurationModule.class, CommonModule.class})
public interface LedgerComponent {

  /**
   * Instance ledger component.
   *
   * @param configuration the configuration
   * @return the ledger component
   */
  static LedgerComponent instance(final Configuration configuration) {
    return DaggerLedgerComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Hash chain ledger.
   *
   * @return the hash chain ledger
   */
  HashChainLedger hashChainLedger();

  /**
   * Chain manager.
   *
   * @return the chain manager
   */
  ChainManager chainManager();

  /**
   * Chain verifier.
   *
   * @return the chain verifier
   */
  ChainVerifier chainVerifier();

  /**
   * The configured ledger store.
   *
   * @return the ledger store
   */
  LedgerStore ledgerStore();

  /**
   * Jdbi, created and migrated on first request.
   *
   * @return the jdbi
   */
  Jdbi jdbi();
}
