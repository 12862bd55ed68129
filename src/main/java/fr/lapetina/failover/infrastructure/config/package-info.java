/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing and the environment-variable overlay.
 * Configuration is read once at startup; request handling never mutates it.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.failover.infrastructure.config.RouterConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.failover.infrastructure.config.ConfigLoader} - YAML loading and environment overlay</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Inbound HTTP server settings (host, port, backlog, worker threads, admin prefix)</li>
 *   <li>{@code origins} - Ordered list of upstream {@code host[:port]} entries</li>
 *   <li>{@code attempt} - Per-attempt timeout and success status codes</li>
 *   <li>{@code selection} - Origin selection policy ({@code sequential} or {@code random})</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.failover.infrastructure.config.ConfigLoader
 */
package fr.lapetina.failover.infrastructure.config;
