package ca.gc.cra.envlayers.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by envlayers configuration and CLI code.
 * <p><strong>Why:</strong> Seeds and variable names arrive from the command line and must be sane before a
 * chain is wired.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Enforce the upper-case environment variable naming used by every layer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern ENVIRONMENT_NAME = Pattern.compile("^[A-Z_][A-Z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an environment variable name such as {@code DB_PORT}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate variable name; surrounding whitespace is trimmed
   * @return trimmed variable name
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the name is blank or not of the form {@code [A-Z_][A-Z0-9_]*}
   */
  public static String requireEnvironmentName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!ENVIRONMENT_NAME.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must be an upper-case environment variable name (was " + sanitized + ")"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
