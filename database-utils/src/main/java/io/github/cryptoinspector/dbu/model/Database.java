package io.github.cryptoinspector.dbu.model;

import org.immutables.value.Value;

/**
 * Connection settings for the case database.
 */
@Value.Immutable
public interface Database {

  /**
   * JDBC url.
   *
   * @return the url
   */
  String url();

  /**
   * Username.
   *
   * @return the username
   */
  String username();

  /**
   * Password.
   *
   * @return the password
   */
  @Value.Redacted
  String password();

}
