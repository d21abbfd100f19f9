package io.github.cryptoinspector.dbu.liquibase;

import javax.inject.Inject;
import javax.inject.Singleton;
import liquibase.Contexts;
import liquibase.LabelExpression;
import liquibase.Liquibase;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.LiquibaseException;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the Liquibase changelog to the database behind a Jdbi instance.
 */
@Singleton
public class LiquibaseHelper {

  private static final Logger log = LoggerFactory.getLogger(LiquibaseHelper.class);

  /**
   * Instantiates a new Liquibase helper.
   */
  @Inject
  public LiquibaseHelper() {
    log.info("LiquibaseHelper()");
  }

  /**
   * Run liquibase. The update runs in a transaction that is committed before the handle closes.
   *
   * @param jdbi          the jdbi
   * @param changeLogFile the classpath location of the changelog
   */
  public void runLiquibase(final Jdbi jdbi, final String changeLogFile) {
    log.info("runLiquibase({})", changeLogFile);
    jdbi.useTransaction(handle -> {
      try {
        final Database database = DatabaseFactory.getInstance()
            .findCorrectDatabaseImplementation(new JdbcConnection(handle.getConnection()));
        final Liquibase liquibase =
            new Liquibase(changeLogFile, new ClassLoaderResourceAccessor(), database);
        liquibase.update(new Contexts(), new LabelExpression());
      } catch (LiquibaseException e) {
        throw new IllegalStateException("Unable to apply changelog " + changeLogFile, e);
      }
    });
  }

}
