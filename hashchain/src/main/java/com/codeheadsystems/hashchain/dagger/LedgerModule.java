package com.codeheadsystems.hashchain.dagger;

import com.codeheadsystems.dbu.factory.JdbiFactory;
import com.codeheadsystems.dbu.liquibase.LiquibaseHelper;
import com.codeheadsystems.dbu.model.Database;
import com.codeheadsystems.hashchain.dao.LedgerRecordDao;
import com.codeheadsystems.hashchain.dao.StoredRecordMapper;
import com.codeheadsystems.hashchain.model.ChainTail;
import com.codeheadsystems.hashchain.model.LedgerConfiguration;
import com.codeheadsystems.hashchain.store.JdbiLedgerStore;
import com.codeheadsystems.hashchain.store.LedgerStore;
import com.codeheadsystems.hashchain.store.VolatileLedgerStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;

/**
 * The type Ledger module.
 */
@Module
public class LedgerModule {

  /**
   * The constant LIQUIBASE_SETUP_XML.
   */
  public static final String LIQUIBASE_SETUP_XML = "liquibase/liquibase-setup.xml";

  /**
   * Instantiates a new Ledger module.
   */
  public LedgerModule() {
    // Default constructor
  }

  /**
   * Jdbi jdbi, with the schema applied when the database asks for it.
   *
   * @param factory         the factory
   * @param liquibaseHelper the liquibase helper
   * @param database        the database
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory,
                   final LiquibaseHelper liquibaseHelper,
                   final Database database) {
    final Jdbi jdbi = factory.createJdbi();
    if (database.runLiquibase()) {
      liquibaseHelper.runLiquibase(jdbi, LIQUIBASE_SETUP_XML);
    }
    return jdbi;
  }

  /**
   * Immutable classes set.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(ChainTail.class);
  }

  /**
   * Row mappers set.
   *
   * @param storedRecordMapper the stored record mapper
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.ROW_MAPPERS)
  public Set<RowMapper<?>> rowMappers(final StoredRecordMapper storedRecordMapper) {
    return Set.of(storedRecordMapper);
  }

  /**
   * Object mapper for the content column.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  /**
   * Ledger record dao.
   *
   * @param jdbi the jdbi
   * @return the ledger record dao
   */
  @Provides
  @Singleton
  public LedgerRecordDao ledgerRecordDao(final Jdbi jdbi) {
    return jdbi.onDemand(LedgerRecordDao.class);
  }

  /**
   * The configured store. The database is only touched when the jdbi store is selected.
   *
   * @param ledgerConfiguration the ledger configuration
   * @param jdbiLedgerStore     the jdbi ledger store
   * @param volatileLedgerStore the volatile ledger store
   * @return the ledger store
   */
  @Provides
  @Singleton
  public LedgerStore ledgerStore(final LedgerConfiguration ledgerConfiguration,
                                 final Provider<JdbiLedgerStore> jdbiLedgerStore,
                                 final Provider<VolatileLedgerStore> volatileLedgerStore) {
    switch (ledgerConfiguration.storeType()) {
      case VOLATILE:
        return volatileLedgerStore.get();
      case JDBI:
      default:
        return jdbiLedgerStore.get();
    }
  }

}
