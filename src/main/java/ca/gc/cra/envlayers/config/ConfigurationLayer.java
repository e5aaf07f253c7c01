package ca.gc.cra.envlayers.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One node of a configuration delegation chain.
 * <p><strong>Why:</strong> Decorators add fields on top of a base layer while every shared field stays readable
 * from the outermost layer.</p>
 * <p><strong>Role:</strong> Core abstraction; the CLI and tests only ever hold the outermost layer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reload the inner layer first, then repopulate own fields from the environment.</li>
 *   <li>Expose own fields directly and inner fields through delegation.</li>
 * </ul>
 * <p><strong>Ownership:</strong> A layer is wrapped by at most one outer layer. Sharing one delegate between two
 * decorators would let reloading either chain mutate the other; {@link AbstractConfigurationLayer} rejects it.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers keep at most one reload in flight per chain.</p>
 *
 * @since 0.1.0
 * @see AbstractConfigurationLayer
 */
public interface ConfigurationLayer {

  /**
   * Short layer name such as {@code base}, {@code database} or {@code motd}.
   *
   * @return layer name
   */
  String name();

  /**
   * Reloads the inner layer (if any) and then this layer's own fields.
   *
   * <p>Fails fast: an inner failure propagates unchanged before this layer reads anything. A strict
   * field failure leaves this layer's fields and state as they were before the call; inner layers that
   * already completed keep their new values.</p>
   *
   * @throws MissingRequiredValueException when a strict field's variable is unset or empty
   */
  void reload() throws MissingRequiredValueException;

  /**
   * Returns the current lifecycle state.
   *
   * @return {@link LayerState#LOADED} after a successful reload
   */
  LayerState state();

  /**
   * Returns the wrapped layer.
   *
   * @return inner layer, empty for the base
   */
  Optional<ConfigurationLayer> delegate();

  /**
   * Returns this layer's own fields keyed by environment variable name, in declared order.
   *
   * @return immutable copy of own fields
   */
  Map<String, String> ownFields();

  /**
   * Returns the application address held by the base layer.
   *
   * @return address value
   */
  String address();

  /**
   * Returns the application port held by the base layer.
   *
   * @return port value as read from the environment or seeded at construction
   */
  String port();

  /**
   * Resolves a field by variable name on this layer, then on each inner layer.
   *
   * @param variable environment variable name of the field
   * @return field value when some layer in the chain owns it
   */
  default Optional<String> field(String variable) {
    Objects.requireNonNull(variable, "variable");
    String own = ownFields().get(variable);
    if (own != null) {
      return Optional.of(own);
    }
    return delegate().flatMap(inner -> inner.field(variable));
  }

  /**
   * Finds the outermost layer of the given type, starting with this one.
   *
   * @param type layer type to find
   * @param <T> layer type
   * @return matching layer, if any
   */
  default <T extends ConfigurationLayer> Optional<T> find(Class<T> type) {
    Objects.requireNonNull(type, "type");
    for (ConfigurationLayer layer : chain()) {
      if (type.isInstance(layer)) {
        return Optional.of(type.cast(layer));
      }
    }
    return Optional.empty();
  }

  /**
   * Lists this layer and every inner layer, outermost first.
   *
   * @return immutable chain ending with the base layer
   */
  default List<ConfigurationLayer> chain() {
    List<ConfigurationLayer> layers = new ArrayList<>();
    Optional<ConfigurationLayer> current = Optional.of(this);
    while (current.isPresent()) {
      ConfigurationLayer layer = current.get();
      layers.add(layer);
      current = layer.delegate();
    }
    return List.copyOf(layers);
  }
}
