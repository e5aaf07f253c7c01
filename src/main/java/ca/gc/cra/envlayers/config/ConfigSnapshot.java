package ca.gc.cra.envlayers.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time view of a chain, outermost layer first.
 *
 * <p>Two snapshots of the same chain compare equal exactly when no layer changed state or field values in
 * between, which is what rollback checks rely on.</p>
 *
 * @param layers captured layers, outermost first
 * @since 0.1.0
 */
public record ConfigSnapshot(List<LayerView> layers) {

  public ConfigSnapshot {
    layers = List.copyOf(Objects.requireNonNull(layers, "layers"));
  }

  /**
   * Captures every layer reachable from {@code outermost}.
   *
   * @param outermost outermost layer of the chain
   * @return snapshot of the chain
   */
  public static ConfigSnapshot of(ConfigurationLayer outermost) {
    Objects.requireNonNull(outermost, "outermost");
    List<LayerView> views = new ArrayList<>();
    for (ConfigurationLayer layer : outermost.chain()) {
      views.add(new LayerView(layer.name(), layer.state(), layer.ownFields()));
    }
    return new ConfigSnapshot(views);
  }

  /**
   * Returns the captured view of the named layer.
   *
   * @param name layer name
   * @return matching view
   * @throws IllegalArgumentException if no captured layer has that name
   */
  public LayerView layer(String name) {
    for (LayerView view : layers) {
      if (view.layer().equals(name)) {
        return view;
      }
    }
    throw new IllegalArgumentException("No layer named " + name);
  }

  /**
   * Captured state of a single layer.
   *
   * @param layer layer name
   * @param state lifecycle state
   * @param fields own fields in declared order
   */
  public record LayerView(String layer, LayerState state, Map<String, String> fields) {

    public LayerView {
      Objects.requireNonNull(layer, "layer");
      Objects.requireNonNull(state, "state");
      fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    }
  }
}
