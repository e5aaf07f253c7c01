package ca.gc.cra.envlayers.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Supplies the flattened construction-time seeds used when assembling a chain from key/value input.
 *
 * <p>The seeds are what the layers hold before their first reload; they are not the reload defaults.</p>
 */
public final class SeedDefaults {
  public static final String ADDRESS = "address";
  public static final String PORT = "port";
  public static final String DB_ADDRESS = "dbAddress";
  public static final String DB_PORT = "dbPort";
  public static final String MOTD = "motd";
  public static final String LAYERS = "layers";
  public static final String POLICY = "policy";
  public static final String STRICT = "strict";
  public static final String FORMAT = "format";

  /** Keys whose blank value is meaningful: no decorators, no per-variable requirements. */
  public static final Set<String> CLEARABLE = Set.of(LAYERS, STRICT);

  private static final Map<String, String> DEFAULTS = buildDefaults();

  private SeedDefaults() {}

  /**
   * Returns the seed defaults in a stable order.
   *
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(ADDRESS, "http://webapp");
    map.put(PORT, "8080");
    map.put(DB_ADDRESS, "http://mongodb");
    map.put(DB_PORT, "27017");
    map.put(MOTD, "Hello, World!");
    map.put(LAYERS, DatabaseConfig.LAYER_NAME + "," + MotdConfig.LAYER_NAME);
    map.put(POLICY, "defaults");
    map.put(STRICT, "");
    map.put(FORMAT, "text");
    return Collections.unmodifiableMap(map);
  }
}
