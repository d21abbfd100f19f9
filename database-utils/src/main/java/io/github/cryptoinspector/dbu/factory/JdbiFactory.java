package io.github.cryptoinspector.dbu.factory;

import io.github.cryptoinspector.dbu.model.Database;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.immutables.JdbiImmutables;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the Jdbi instance used by the DAOs.
 */
@Singleton
public class JdbiFactory {

  /**
   * Name of the injected set of Immutables model classes that Jdbi should map.
   */
  public static final String IMMUTABLES = "JdbiFactory.immutables";

  private static final Logger log = LoggerFactory.getLogger(JdbiFactory.class);

  private final Database database;
  private final Set<Class<?>> immutables;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database   the database
   * @param immutables the immutable model classes
   */
  @Inject
  public JdbiFactory(final Database database,
                     @Named(IMMUTABLES) final Set<Class<?>> immutables) {
    this.database = database;
    this.immutables = immutables;
  }

  /**
   * Create jdbi.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.info("createJdbi({})", database.url());
    final Jdbi jdbi = Jdbi.create(database.url(), database.username(), database.password());
    jdbi.installPlugin(new SqlObjectPlugin());
    final JdbiImmutables jdbiImmutables = jdbi.getConfig(JdbiImmutables.class);
    immutables.forEach(jdbiImmutables::registerImmutable);
    return jdbi;
  }

}
