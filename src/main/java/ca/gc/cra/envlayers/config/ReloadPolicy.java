package ca.gc.cra.envlayers.config;

import ca.gc.cra.envlayers.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-field choice between default-filling and strict reload handling.
 * <p><strong>Why:</strong> Lets a deployment require some variables while defaulting others, instead of a
 * single process-wide mode.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across chains.</p>
 *
 * @since 0.1.0
 */
public final class ReloadPolicy {
  private static final ReloadPolicy DEFAULT_FILLING =
      new ReloadPolicy(FieldPolicy.DEFAULT_FILLING, Map.of());
  private static final ReloadPolicy STRICT = new ReloadPolicy(FieldPolicy.STRICT, Map.of());

  private final FieldPolicy fallback;
  private final Map<String, FieldPolicy> overrides;

  private ReloadPolicy(FieldPolicy fallback, Map<String, FieldPolicy> overrides) {
    this.fallback = fallback;
    this.overrides = Map.copyOf(overrides);
  }

  /**
   * Policy substituting defaults for every missing variable.
   *
   * @return default-filling policy
   */
  public static ReloadPolicy defaultFilling() {
    return DEFAULT_FILLING;
  }

  /**
   * Policy failing on every missing strict-capable variable.
   *
   * @return strict policy
   */
  public static ReloadPolicy strict() {
    return STRICT;
  }

  /**
   * Policy applying {@code policy} to every field.
   *
   * @param policy uniform field policy
   * @return shared policy instance
   */
  public static ReloadPolicy uniform(FieldPolicy policy) {
    return Objects.requireNonNull(policy, "policy") == FieldPolicy.STRICT ? STRICT : DEFAULT_FILLING;
  }

  /**
   * Starts a builder whose fallback is {@link FieldPolicy#DEFAULT_FILLING}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the policy configured for {@code variable}.
   *
   * @param variable environment variable name
   * @return override when one exists, otherwise the fallback
   */
  public FieldPolicy policyFor(String variable) {
    return overrides.getOrDefault(variable, fallback);
  }

  /**
   * Returns the policy used for variables without an override.
   *
   * @return fallback policy
   */
  public FieldPolicy fallback() {
    return fallback;
  }

  /**
   * Returns the per-variable overrides.
   *
   * @return immutable override map
   */
  public Map<String, FieldPolicy> overrides() {
    return overrides;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ReloadPolicy that)) {
      return false;
    }
    return fallback == that.fallback && overrides.equals(that.overrides);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fallback, overrides);
  }

  @Override
  public String toString() {
    return "ReloadPolicy{fallback=" + fallback + ", overrides=" + overrides + '}';
  }

  /** Mutable builder for {@link ReloadPolicy}. */
  public static final class Builder {
    private FieldPolicy fallback = FieldPolicy.DEFAULT_FILLING;
    private final Map<String, FieldPolicy> overrides = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Sets the policy for variables without an override.
     *
     * @param policy fallback policy
     * @return this builder
     */
    public Builder fallback(FieldPolicy policy) {
      this.fallback = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /**
     * Overrides the policy of one variable.
     *
     * @param variable environment variable name
     * @param policy policy for that variable
     * @return this builder
     */
    public Builder field(String variable, FieldPolicy policy) {
      overrides.put(
          Strings.requireEnvironmentName("variable", variable),
          Objects.requireNonNull(policy, "policy"));
      return this;
    }

    /**
     * Marks a variable as required.
     *
     * @param variable environment variable name
     * @return this builder
     */
    public Builder require(String variable) {
      return field(variable, FieldPolicy.STRICT);
    }

    public ReloadPolicy build() {
      return new ReloadPolicy(fallback, overrides);
    }
  }
}
