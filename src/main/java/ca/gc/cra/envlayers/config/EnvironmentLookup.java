package ca.gc.cra.envlayers.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only key/value capability standing in for the process environment.
 * <p><strong>Why:</strong> Layers resolve their variables through this seam so callers can substitute
 * deterministic values for {@link System#getenv(String)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations returned by the factories are immutable.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EnvironmentLookup {

  /**
   * Resolves a variable.
   *
   * @param variable exact, case-sensitive variable name
   * @return the value when the variable is defined; may be an empty string
   */
  Optional<String> get(String variable);

  /**
   * Returns a lookup backed by the process environment.
   *
   * @return lookup delegating to {@link System#getenv(String)}
   */
  static EnvironmentLookup system() {
    return variable -> Optional.ofNullable(System.getenv(variable));
  }

  /**
   * Returns a lookup backed by an immutable copy of {@code values}.
   *
   * @param values variable values; must not contain {@code null} keys or values
   * @return map-backed lookup
   */
  static EnvironmentLookup of(Map<String, String> values) {
    Map<String, String> copy = Map.copyOf(Objects.requireNonNull(values, "values"));
    return variable -> Optional.ofNullable(copy.get(variable));
  }

  /**
   * Returns a lookup in which no variable is defined.
   *
   * @return empty lookup
   */
  static EnvironmentLookup empty() {
    return variable -> Optional.empty();
  }
}
