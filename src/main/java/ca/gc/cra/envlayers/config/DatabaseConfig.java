package ca.gc.cra.envlayers.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decorator adding the database address and port ({@code DB_ADDRESS}, {@code DB_PORT}).
 *
 * <p>Defaults are {@code http://localhost} and {@code 37017}. Address and port of the application are
 * read through the wrapped layer.</p>
 *
 * @since 0.1.0
 */
public final class DatabaseConfig extends AbstractConfigurationLayer {
  public static final String LAYER_NAME = "database";
  public static final String DB_ADDRESS = "DB_ADDRESS";
  public static final String DB_PORT = "DB_PORT";
  public static final String DEFAULT_DB_ADDRESS = "http://localhost";
  public static final String DEFAULT_DB_PORT = "37017";

  static final List<FieldDefinition> FIELDS = List.of(
      new FieldDefinition(DB_ADDRESS, DEFAULT_DB_ADDRESS, true),
      new FieldDefinition(DB_PORT, DEFAULT_DB_PORT, true));

  /**
   * Wraps {@code delegate} with a default-filling database layer reading the process environment.
   *
   * @param delegate inner layer
   * @param dbAddress construction-time database address
   * @param dbPort construction-time database port
   */
  public DatabaseConfig(ConfigurationLayer delegate, String dbAddress, String dbPort) {
    this(delegate, dbAddress, dbPort, EnvironmentLookup.system(), ReloadPolicy.defaultFilling());
  }

  /**
   * Wraps {@code delegate} with a database layer.
   *
   * @param delegate inner layer
   * @param dbAddress construction-time database address
   * @param dbPort construction-time database port
   * @param environment variable source consulted on reload
   * @param policy reload policy for {@code DB_ADDRESS} and {@code DB_PORT}
   */
  public DatabaseConfig(
      ConfigurationLayer delegate,
      String dbAddress,
      String dbPort,
      EnvironmentLookup environment,
      ReloadPolicy policy) {
    super(
        LAYER_NAME,
        Objects.requireNonNull(delegate, "delegate"),
        FIELDS,
        Map.of(
            DB_ADDRESS, Objects.requireNonNull(dbAddress, "dbAddress"),
            DB_PORT, Objects.requireNonNull(dbPort, "dbPort")),
        environment,
        policy);
  }

  public String dbAddress() {
    return value(DB_ADDRESS);
  }

  public String dbPort() {
    return value(DB_PORT);
  }
}
