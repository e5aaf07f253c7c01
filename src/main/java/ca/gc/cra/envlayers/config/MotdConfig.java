package ca.gc.cra.envlayers.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decorator adding a message of the day read from {@code MOTD}.
 *
 * <p>The message is never required: an unset or empty {@code MOTD} always yields {@code Have a Nice Day!},
 * whatever the reload policy says.</p>
 *
 * @since 0.1.0
 */
public final class MotdConfig extends AbstractConfigurationLayer {
  public static final String LAYER_NAME = "motd";
  public static final String MOTD = "MOTD";
  public static final String DEFAULT_MESSAGE = "Have a Nice Day!";

  static final List<FieldDefinition> FIELDS = List.of(new FieldDefinition(MOTD, DEFAULT_MESSAGE, false));

  /**
   * Wraps {@code delegate} with a message layer reading the process environment.
   *
   * @param delegate inner layer
   * @param message construction-time message
   */
  public MotdConfig(ConfigurationLayer delegate, String message) {
    this(delegate, message, EnvironmentLookup.system());
  }

  /**
   * Wraps {@code delegate} with a message layer.
   *
   * @param delegate inner layer
   * @param message construction-time message
   * @param environment variable source consulted on reload
   */
  public MotdConfig(ConfigurationLayer delegate, String message, EnvironmentLookup environment) {
    super(
        LAYER_NAME,
        Objects.requireNonNull(delegate, "delegate"),
        FIELDS,
        Map.of(MOTD, Objects.requireNonNull(message, "message")),
        environment,
        ReloadPolicy.defaultFilling());
  }

  public String message() {
    return value(MOTD);
  }
}
