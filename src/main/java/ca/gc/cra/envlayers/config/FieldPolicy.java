package ca.gc.cra.envlayers.config;

import java.util.Locale;

/**
 * Handling applied when a field's environment variable is unset or empty during reload.
 *
 * @since 0.1.0
 */
public enum FieldPolicy {
  /** Substitute the field's documented default; reload never fails on this field. */
  DEFAULT_FILLING,
  /** Fail the reload with {@link MissingRequiredValueException}. */
  STRICT;

  /**
   * Parses a policy name such as {@code defaults}, {@code default-filling} or {@code strict}.
   *
   * @param value policy name, case-insensitive
   * @return parsed policy
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static FieldPolicy fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("policy must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return switch (normalized) {
      case "defaults", "default", "default-filling" -> DEFAULT_FILLING;
      case "strict" -> STRICT;
      default -> throw new IllegalArgumentException("Unsupported policy: " + value);
    };
  }
}
