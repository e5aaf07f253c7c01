package ca.gc.cra.envlayers.config;

import ca.gc.cra.envlayers.validation.Strings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds configuration chains from flat key/value seeds.
 * <p><strong>Why:</strong> Gives command-line callers one place that merges overrides with
 * {@link SeedDefaults}, validates them, and wires layers bottom-up.</p>
 * <p><strong>Role:</strong> Composition root for the {@code show} command and tests.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the chains it returns are not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ChainAssembler {
  private static final Logger log = LoggerFactory.getLogger(ChainAssembler.class);
  private static final Map<String, List<FieldDefinition>> FIELDS_BY_LAYER = buildFieldsByLayer();

  private ChainAssembler() {}

  /**
   * Merges overrides onto {@link SeedDefaults} with precedence overrides &gt; defaults.
   *
   * @param overrides key/value overrides, typically from the command line; may be {@code null}
   * @param warn consumer invoked when an override is ignored; may be {@code null}
   * @return unmodifiable, ordered seed map
   * @throws IllegalArgumentException on unknown keys or invalid layer/policy values
   */
  public static Map<String, String> effectiveSeeds(Map<String, String> overrides, Consumer<String> warn) {
    Map<String, String> merged = new LinkedHashMap<>(SeedDefaults.asFlatMap());
    Map<String, String> source = overrides == null ? Map.of() : overrides;
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (!merged.containsKey(key)) {
        throw new IllegalArgumentException("Unknown option: " + key);
      }
      String value = entry.getValue();
      if (value == null || value.isBlank()) {
        if (SeedDefaults.CLEARABLE.contains(key)) {
          merged.put(key, "");
        } else if (warn != null) {
          warn.accept("Blank value for " + key + "; keeping default");
        }
        continue;
      }
      merged.put(key, value.trim());
    }
    parseLayers(merged.get(SeedDefaults.LAYERS));
    policyFrom(merged);
    return Collections.unmodifiableMap(merged);
  }

  /**
   * Builds a chain from seeds: the base layer first, then each decorator named in {@code layers}.
   *
   * @param seeds seed map as produced by {@link #effectiveSeeds(Map, Consumer)}
   * @param environment variable source shared by every layer
   * @return outermost layer of the new chain; nothing is reloaded yet
   * @throws IllegalArgumentException on missing or invalid seeds
   */
  public static ConfigurationLayer assemble(Map<String, String> seeds, EnvironmentLookup environment) {
    Objects.requireNonNull(seeds, "seeds");
    Objects.requireNonNull(environment, "environment");
    ReloadPolicy policy = policyFrom(seeds);
    ConfigurationLayer layer = new BaseConfig(
        seed(seeds, SeedDefaults.ADDRESS), seed(seeds, SeedDefaults.PORT), environment, policy);
    List<String> decorators = parseLayers(seeds.get(SeedDefaults.LAYERS));
    for (String name : decorators) {
      layer = switch (name) {
        case DatabaseConfig.LAYER_NAME -> new DatabaseConfig(
            layer, seed(seeds, SeedDefaults.DB_ADDRESS), seed(seeds, SeedDefaults.DB_PORT), environment, policy);
        case MotdConfig.LAYER_NAME -> new MotdConfig(layer, seed(seeds, SeedDefaults.MOTD), environment);
        default -> throw new IllegalArgumentException("Unsupported layer: " + name);
      };
    }
    log.debug("Assembled chain with decorators {} and {}", decorators, policy);
    return layer;
  }

  /**
   * Returns the declared fields of every known layer, base first.
   *
   * @return unmodifiable map of layer name to field definitions
   */
  public static Map<String, List<FieldDefinition>> fieldsByLayer() {
    return FIELDS_BY_LAYER;
  }

  static List<String> parseLayers(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    Set<String> names = new LinkedHashSet<>();
    for (String token : value.split(",")) {
      String name = token.trim().toLowerCase(Locale.ROOT);
      if (name.isEmpty()) {
        continue;
      }
      if (BaseConfig.LAYER_NAME.equals(name)) {
        throw new IllegalArgumentException("layers must not list the base layer; it is always present");
      }
      if (!FIELDS_BY_LAYER.containsKey(name)) {
        throw new IllegalArgumentException("Unsupported layer: " + token.trim());
      }
      if (!names.add(name)) {
        throw new IllegalArgumentException("Duplicate layer: " + name);
      }
    }
    return List.copyOf(names);
  }

  static ReloadPolicy policyFrom(Map<String, String> seeds) {
    ReloadPolicy.Builder builder = ReloadPolicy.builder()
        .fallback(FieldPolicy.fromString(seed(seeds, SeedDefaults.POLICY)));
    String strict = seeds.get(SeedDefaults.STRICT);
    if (strict == null || strict.isBlank()) {
      return builder.build();
    }
    List<String> decorators = parseLayers(seeds.get(SeedDefaults.LAYERS));
    for (String token : strict.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      String variable = Strings.requireEnvironmentName(SeedDefaults.STRICT, token);
      String owner = owningLayer(variable);
      if (!BaseConfig.LAYER_NAME.equals(owner) && !decorators.contains(owner)) {
        throw new IllegalArgumentException(
            variable + " belongs to the " + owner + " layer, which is not listed in layers");
      }
      FieldDefinition definition = findDefinition(owner, variable);
      if (!definition.strictCapable()) {
        throw new IllegalArgumentException(variable + " cannot be required");
      }
      builder.require(variable);
    }
    return builder.build();
  }

  private static String owningLayer(String variable) {
    for (Map.Entry<String, List<FieldDefinition>> layer : FIELDS_BY_LAYER.entrySet()) {
      for (FieldDefinition definition : layer.getValue()) {
        if (definition.variable().equals(variable)) {
          return layer.getKey();
        }
      }
    }
    throw new IllegalArgumentException("Unknown environment variable: " + variable);
  }

  private static FieldDefinition findDefinition(String layer, String variable) {
    return FIELDS_BY_LAYER.get(layer).stream()
        .filter(definition -> definition.variable().equals(variable))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown environment variable: " + variable));
  }

  private static String seed(Map<String, String> seeds, String key) {
    String value = seeds.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing seed: " + key);
    }
    return Strings.requireNonBlank(key, value);
  }

  private static Map<String, List<FieldDefinition>> buildFieldsByLayer() {
    Map<String, List<FieldDefinition>> map = new LinkedHashMap<>();
    map.put(BaseConfig.LAYER_NAME, BaseConfig.FIELDS);
    map.put(DatabaseConfig.LAYER_NAME, DatabaseConfig.FIELDS);
    map.put(MotdConfig.LAYER_NAME, MotdConfig.FIELDS);
    return Collections.unmodifiableMap(map);
  }
}
