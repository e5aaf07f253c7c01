/**
 * <strong>Purpose:</strong> Argument validation helpers shared by the configuration core and the CLI.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters before values reach logs or console output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envlayers.validation;
