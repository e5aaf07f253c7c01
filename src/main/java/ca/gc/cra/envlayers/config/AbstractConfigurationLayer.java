package ca.gc.cra.envlayers.config;

import ca.gc.cra.envlayers.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared reload machinery for layers that read a fixed list of fields from an {@link EnvironmentLookup}.
 *
 * <p>Subclasses declare their {@link FieldDefinition}s and typed accessors; the reload cascade, staging, and
 * strict-mode rollback live here. Shared fields ({@link #address()}, {@link #port()}) forward to the delegate
 * unless a subclass owns them.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractConfigurationLayer implements ConfigurationLayer {
  private static final Logger log = LoggerFactory.getLogger(AbstractConfigurationLayer.class);
  private static final int MAX_LOGGED_VALUE_CHARS = 64;

  private final String name;
  private final ConfigurationLayer delegate;
  private final List<FieldDefinition> definitions;
  private final EnvironmentLookup environment;
  private final ReloadPolicy policy;
  private final Map<String, String> values = new LinkedHashMap<>();
  private LayerState state = LayerState.UNLOADED;
  private boolean wrapped;

  /**
   * Creates a layer holding construction-time values.
   *
   * @param name short layer name
   * @param delegate inner layer; {@code null} for a base layer
   * @param definitions own fields in the order they are checked
   * @param initialValues construction-time value per declared variable
   * @param environment variable source consulted on reload
   * @param policy reload policy for strict-capable fields
   * @throws IllegalArgumentException if an initial value is missing or undeclared, or if {@code delegate} is
   *     already wrapped by another layer
   */
  protected AbstractConfigurationLayer(
      String name,
      ConfigurationLayer delegate,
      List<FieldDefinition> definitions,
      Map<String, String> initialValues,
      EnvironmentLookup environment,
      ReloadPolicy policy) {
    this.name = Strings.requireNonBlank("name", name);
    if (delegate instanceof AbstractConfigurationLayer inner && inner.wrapped) {
      throw new IllegalArgumentException(inner.name + " layer is already wrapped by another layer");
    }
    this.delegate = delegate;
    this.definitions = List.copyOf(Objects.requireNonNull(definitions, "definitions"));
    this.environment = Objects.requireNonNull(environment, "environment");
    this.policy = Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(initialValues, "initialValues");
    for (FieldDefinition definition : this.definitions) {
      String initial = initialValues.get(definition.variable());
      if (initial == null) {
        throw new IllegalArgumentException(
            name + " layer requires an initial value for " + definition.variable());
      }
      values.put(definition.variable(), initial);
    }
    if (initialValues.size() != values.size()) {
      throw new IllegalArgumentException(name + " layer received undeclared initial values");
    }
    if (delegate instanceof AbstractConfigurationLayer inner) {
      inner.wrapped = true;
    }
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final void reload() throws MissingRequiredValueException {
    if (delegate != null) {
      delegate.reload();
    }
    Map<String, String> staged = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    for (FieldDefinition definition : definitions) {
      String variable = definition.variable();
      String value = environment.get(variable).orElse("");
      if (!value.isEmpty()) {
        staged.put(variable, value);
      } else if (definition.effectivePolicy(policy) == FieldPolicy.STRICT) {
        missing.add(variable);
      } else {
        staged.put(variable, definition.defaultValue());
      }
    }
    if (!missing.isEmpty()) {
      log.debug("Reload of {} layer rejected; missing variables {}", name, missing);
      throw new MissingRequiredValueException(missing);
    }
    values.putAll(staged);
    state = LayerState.LOADED;
    if (log.isDebugEnabled()) {
      log.debug("Reloaded {} layer: {}", name, describe(staged));
    }
  }

  @Override
  public final LayerState state() {
    return state;
  }

  @Override
  public final Optional<ConfigurationLayer> delegate() {
    return Optional.ofNullable(delegate);
  }

  @Override
  public final Map<String, String> ownFields() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public String address() {
    return requireDelegate().address();
  }

  @Override
  public String port() {
    return requireDelegate().port();
  }

  /**
   * Returns the current value of an own field.
   *
   * @param variable declared variable name
   * @return current value
   */
  protected final String value(String variable) {
    String value = values.get(variable);
    if (value == null) {
      throw new IllegalArgumentException(name + " layer does not own " + variable);
    }
    return value;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{state=" + state + ", fields=" + describe(values) + '}';
  }

  private ConfigurationLayer requireDelegate() {
    if (delegate == null) {
      throw new IllegalStateException(name + " layer has no delegate");
    }
    return delegate;
  }

  private static String describe(Map<String, String> fields) {
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append('=').append(abbreviate(entry.getValue()));
    }
    return sb.append('}').toString();
  }

  private static String abbreviate(String value) {
    if (value.length() <= MAX_LOGGED_VALUE_CHARS) {
      return value;
    }
    int end = MAX_LOGGED_VALUE_CHARS;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (" + value.length() + " chars)";
  }
}
