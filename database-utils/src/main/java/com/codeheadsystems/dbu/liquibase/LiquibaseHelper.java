package com.codeheadsystems.dbu.liquibase;

import static org.slf4j.LoggerFactory.getLogger;

import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import liquibase.Scope;
import liquibase.changelog.ChangeLogParameters;
import liquibase.command.CommandScope;
import liquibase.command.core.UpdateCommandStep;
import liquibase.command.core.helpers.DatabaseChangelogCommandStep;
import liquibase.command.core.helpers.DbUrlConnectionCommandStep;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;

/**
 * Applies a classpath Liquibase changelog to the database behind a Jdbi instance.
 */
@Singleton
public class LiquibaseHelper {

  private static final Logger log = getLogger(LiquibaseHelper.class);

  /**
   * Instantiates a new Liquibase helper.
   */
  @Inject
  public LiquibaseHelper() {
  }

  /**
   * Run the changelog using a connection borrowed from the jdbi handle. The handle owns the
   * connection, so it is not closed here.
   *
   * @param jdbi          the jdbi
   * @param changeLogFile the classpath changelog
   */
  public void runLiquibase(final Jdbi jdbi, final String changeLogFile) {
    log.trace("runLiquibase({}, {})", jdbi, changeLogFile);
    jdbi.useHandle(handle -> {
      try {
        runLiquibase(handle.getConnection(), changeLogFile);
        log.info("runLiquibase({}): complete", changeLogFile);
      } catch (RuntimeException e) {
        throw new IllegalStateException("Database update failure", e);
      }
    });
  }

  /**
   * Run liquibase.
   *
   * @param connection    the connection
   * @param changeLogFile the change log file
   */
  public void runLiquibase(final Connection connection,
                           final String changeLogFile) {
    try {
      final Database database = DatabaseFactory.getInstance()
          .findCorrectDatabaseImplementation(new JdbcConnection(connection));
      final ClassLoaderResourceAccessor resourceAccessor = new ClassLoaderResourceAccessor();

      final Map<String, Object> scopeObjects = new HashMap<>();
      scopeObjects.put(Scope.Attr.database.name(), database);
      scopeObjects.put(Scope.Attr.resourceAccessor.name(), resourceAccessor);

      Scope.child(scopeObjects, () -> {
        final CommandScope commandScope = new CommandScope(UpdateCommandStep.COMMAND_NAME);
        commandScope.addArgumentValue(DbUrlConnectionCommandStep.DATABASE_ARG, database);
        commandScope.addArgumentValue(UpdateCommandStep.CHANGELOG_FILE_ARG, changeLogFile);
        commandScope.addArgumentValue(DatabaseChangelogCommandStep.CHANGELOG_PARAMETERS, new ChangeLogParameters(database));
        commandScope.execute();
        return null;
      });
    } catch (Exception e) {
      throw new IllegalStateException("Unable to apply changelog " + changeLogFile, e);
    }
  }
}
