package ca.gc.cra.envlayers.api;

import ca.gc.cra.envlayers.config.BaseConfig;
import ca.gc.cra.envlayers.config.ConfigSnapshot;
import ca.gc.cra.envlayers.config.DatabaseConfig;
import ca.gc.cra.envlayers.config.MotdConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link ConfigSnapshot} for the console, base layer first in text form.
 */
final class SnapshotRenderer {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Map<String, String> LABELS = Map.of(
      BaseConfig.ADDRESS, "Host",
      BaseConfig.PORT, "Port",
      DatabaseConfig.DB_ADDRESS, "DB Host",
      DatabaseConfig.DB_PORT, "DB Port",
      MotdConfig.MOTD, "MOTD");

  /** Output formats accepted by {@code format=}. */
  enum Format {
    TEXT,
    JSON;

    static Format fromString(String value) {
      if (value == null || value.isBlank()) {
        return TEXT;
      }
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("format must be text or json (was " + value + ")", ex);
      }
    }
  }

  private SnapshotRenderer() {}

  static List<String> render(ConfigSnapshot snapshot, Format format) {
    Objects.requireNonNull(snapshot, "snapshot");
    return switch (Objects.requireNonNull(format, "format")) {
      case TEXT -> renderText(snapshot);
      case JSON -> List.of(renderJson(snapshot));
    };
  }

  private static List<String> renderText(ConfigSnapshot snapshot) {
    List<String> lines = new ArrayList<>();
    List<ConfigSnapshot.LayerView> layers = snapshot.layers();
    for (int i = layers.size() - 1; i >= 0; i--) {
      for (Map.Entry<String, String> field : layers.get(i).fields().entrySet()) {
        lines.add(LABELS.getOrDefault(field.getKey(), field.getKey()) + ": " + field.getValue());
      }
    }
    return lines;
  }

  private static String renderJson(ConfigSnapshot snapshot) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
    } catch (JsonProcessingException ex) {
      throw new UncheckedIOException("Failed to render configuration as JSON", ex);
    }
  }
}
