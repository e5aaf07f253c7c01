/**
 * Command-line entry points for envlayers.
 * <p><strong>Role:</strong> External caller of the configuration core; wires a chain, reloads it and prints it.</p>
 * <p><strong>Observability:</strong> Failures are logged through SLF4J and mapped to {@link ca.gc.cra.envlayers.api.ExitCode}.</p>
 */
package ca.gc.cra.envlayers.api;
