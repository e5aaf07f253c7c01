package ca.gc.cra.envlayers.config;

/**
 * Lifecycle state of a {@link ConfigurationLayer}.
 *
 * @since 0.1.0
 */
public enum LayerState {
  /** Fields still hold construction-time values. */
  UNLOADED,
  /** At least one reload completed successfully. */
  LOADED
}
