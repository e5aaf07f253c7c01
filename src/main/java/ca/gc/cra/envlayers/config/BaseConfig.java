package ca.gc.cra.envlayers.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Innermost layer holding the application address and port.
 * <p><strong>Role:</strong> Terminates every chain; has no delegate.</p>
 * <p><strong>Environment:</strong> {@code ADDRESS} (default {@code http://localhost}) and {@code PORT}
 * (default {@code 8081}), checked in that order.</p>
 *
 * @since 0.1.0
 */
public final class BaseConfig extends AbstractConfigurationLayer {
  public static final String LAYER_NAME = "base";
  public static final String ADDRESS = "ADDRESS";
  public static final String PORT = "PORT";
  public static final String DEFAULT_ADDRESS = "http://localhost";
  public static final String DEFAULT_PORT = "8081";

  static final List<FieldDefinition> FIELDS = List.of(
      new FieldDefinition(ADDRESS, DEFAULT_ADDRESS, true),
      new FieldDefinition(PORT, DEFAULT_PORT, true));

  /**
   * Creates a default-filling base layer reading the process environment.
   *
   * @param address construction-time address
   * @param port construction-time port
   */
  public BaseConfig(String address, String port) {
    this(address, port, EnvironmentLookup.system(), ReloadPolicy.defaultFilling());
  }

  /**
   * Creates a base layer.
   *
   * @param address construction-time address
   * @param port construction-time port
   * @param environment variable source consulted on reload
   * @param policy reload policy for {@code ADDRESS} and {@code PORT}
   */
  public BaseConfig(String address, String port, EnvironmentLookup environment, ReloadPolicy policy) {
    super(LAYER_NAME, null, FIELDS, initialValues(address, port), environment, policy);
  }

  @Override
  public String address() {
    return value(ADDRESS);
  }

  @Override
  public String port() {
    return value(PORT);
  }

  private static Map<String, String> initialValues(String address, String port) {
    return Map.of(
        ADDRESS, Objects.requireNonNull(address, "address"),
        PORT, Objects.requireNonNull(port, "port"));
  }
}
