package ca.gc.cra.envlayers.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into an ordered override map.
 * <p>Stateless and thread-safe.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on the first {@code '='}. An empty value ({@code strict=}) is kept as an empty string.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map in argument order; later duplicates win
   * @throws IllegalArgumentException if an argument has no {@code '='}, an invalid key, or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int idx = raw.indexOf('=');
      if (idx < 0 || raw.substring(0, idx).isBlank()) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String rawKey = raw.substring(0, idx);
      if (containsControl(rawKey)) {
        throw new IllegalArgumentException("argument name must not contain control characters");
      }
      String key = rawKey.trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      // trim() would silently drop leading or trailing control characters
      String rawValue = raw.substring(idx + 1);
      if (containsControl(rawValue)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, rawValue.trim());
    }
    return map;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
