package ca.gc.cra.envlayers.config;

import java.util.List;
import java.util.Objects;

/**
 * Raised by {@link ConfigurationLayer#reload()} when a strict field's variable is unset or empty.
 *
 * <p>Outer layers rethrow the instance raised by the innermost failing layer unchanged.</p>
 *
 * @since 0.1.0
 */
public final class MissingRequiredValueException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String variableName;
  private final List<String> missingVariables;

  /**
   * Creates an exception naming a single missing variable.
   *
   * @param variableName missing variable
   */
  public MissingRequiredValueException(String variableName) {
    this(List.of(variableName));
  }

  /**
   * Creates an exception for every variable found missing on one layer, in declared order.
   *
   * @param missingVariables non-empty list; the first entry is reported
   */
  public MissingRequiredValueException(List<String> missingVariables) {
    super(messageFor(missingVariables));
    this.missingVariables = List.copyOf(missingVariables);
    this.variableName = this.missingVariables.get(0);
  }

  /**
   * Returns the first missing variable in declared field order.
   *
   * @return reported variable name
   */
  public String variableName() {
    return variableName;
  }

  /**
   * Returns every variable found missing on the failing layer.
   *
   * @return immutable, ordered list
   */
  public List<String> missingVariables() {
    return missingVariables;
  }

  private static String messageFor(List<String> missingVariables) {
    Objects.requireNonNull(missingVariables, "missingVariables");
    if (missingVariables.isEmpty()) {
      throw new IllegalArgumentException("missingVariables must not be empty");
    }
    return missingVariables.get(0) + " environment variable is not set";
  }
}
