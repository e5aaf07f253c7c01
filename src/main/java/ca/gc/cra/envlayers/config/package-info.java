/**
 * Layered configuration chain: a base layer plus decorators that reload from the environment.
 * <p><strong>Role:</strong> Core of envlayers; the CLI in {@code ca.gc.cra.envlayers.api} is only a caller.</p>
 * <p><strong>Concurrency:</strong> Layers are mutable and not thread-safe; one reload per chain at a time.</p>
 * <p><strong>Observability:</strong> Reload outcomes are logged at DEBUG via SLF4J.</p>
 * <p><strong>Security:</strong> Environment values are read only; the chain never writes the environment.</p>
 */
package ca.gc.cra.envlayers.config;
