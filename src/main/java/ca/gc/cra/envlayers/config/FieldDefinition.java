package ca.gc.cra.envlayers.config;

import ca.gc.cra.envlayers.validation.Strings;
import java.util.Objects;

/**
 * Declares one field owned by a layer.
 *
 * @param variable environment variable the field is read from (case-sensitive)
 * @param defaultValue value substituted in default-filling mode when the variable is unset or empty
 * @param strictCapable {@code false} pins the field to {@link FieldPolicy#DEFAULT_FILLING}
 * @since 0.1.0
 */
public record FieldDefinition(String variable, String defaultValue, boolean strictCapable) {

  public FieldDefinition {
    variable = Strings.requireEnvironmentName("variable", variable);
    Objects.requireNonNull(defaultValue, "defaultValue");
  }

  /**
   * Resolves the policy that applies to this field under {@code policy}.
   *
   * @param policy chain-level reload policy
   * @return effective policy for this field
   */
  public FieldPolicy effectivePolicy(ReloadPolicy policy) {
    if (!strictCapable) {
      return FieldPolicy.DEFAULT_FILLING;
    }
    return policy.policyFor(variable);
  }
}
