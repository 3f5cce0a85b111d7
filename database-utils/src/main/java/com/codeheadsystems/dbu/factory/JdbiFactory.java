package com.codeheadsystems.dbu.factory;

import static org.slf4j.LoggerFactory.getLogger;

import com.codeheadsystems.dbu.model.Database;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.cache.caffeine.CaffeineCachePlugin;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.mapper.immutables.JdbiImmutables;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;

/**
 * Builds the {@link Jdbi} instance every DAO in the application shares.
 */
@Singleton
public class JdbiFactory {

  /**
   * Names the set of immutables types Jdbi should bind and map.
   */
  public static final String IMMUTABLES = "JdbiImmutableClasses";

  /**
   * Names the set of row mappers registered on every Jdbi instance.
   */
  public static final String ROW_MAPPERS = "JdbiRowMappers";

  private static final Logger log = getLogger(JdbiFactory.class);

  private final Database database;
  private final Set<Class<?>> immutableClasses;
  private final Set<RowMapper<?>> rowMappers;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database         the configuration
   * @param immutableClasses the immutable classes
   * @param rowMappers       the row mappers
   */
  @Inject
  public JdbiFactory(final Database database,
                     @Named(IMMUTABLES) final Set<Class<?>> immutableClasses,
                     @Named(ROW_MAPPERS) final Set<RowMapper<?>> rowMappers) {
    this.database = database;
    this.immutableClasses = immutableClasses;
    this.rowMappers = rowMappers;
    log.info("JdbiFactory({}, {}, {})", database, immutableClasses, rowMappers);
  }

  /**
   * Factory without custom row mappers.
   *
   * @param database         the database
   * @param immutableClasses the immutable classes
   */
  public JdbiFactory(final Database database,
                     final Set<Class<?>> immutableClasses) {
    this(database, immutableClasses, Set.of());
  }

  /**
   * Create jdbi jdbi.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.trace("createJdbi()");
    final Jdbi jdbi = Jdbi.create(database.url(), database.username(), database.password());
    setup(jdbi);
    return jdbi;
  }

  /**
   * Setup so it can be used even if we do not create the JDBI resource.
   *
   * @param jdbi the jdbi
   */
  public void setup(final Jdbi jdbi) {
    log.info("setup({})", jdbi);
    final JdbiImmutables immutablesConfig = jdbi.getConfig(JdbiImmutables.class);
    immutableClasses.forEach(immutablesConfig::registerImmutable);
    rowMappers.forEach(jdbi::registerRowMapper);
    jdbi.installPlugin(new SqlObjectPlugin())
        .installPlugin(new CaffeineCachePlugin());
    if (database.usePostgresql()) {
      jdbi.installPlugin(new PostgresPlugin());
    }
    jdbi.setSqlLogger(new Slf4JSqlLogger());
  }
}
