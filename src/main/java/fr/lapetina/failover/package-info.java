/**
 * Origin Failover Router - HTTP router that satisfies each request from the first healthy origin.
 *
 * <p>For every inbound request the router builds a private pool of candidate origins, then
 * tries them one at a time, each attempt bounded by a timeout, until an origin answers with a
 * success status or the pool is exhausted (503 Service unavailable).
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.failover.RouterFactory} - Main entry point for creating
 *       a fully-configured controller from YAML configuration and environment variables</li>
 *   <li>{@link fr.lapetina.failover.FailoverRouterApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RouterFactory factory = RouterFactory.create("config.yaml")) {
 *     FailoverController controller = factory.getController();
 *
 *     ProxyResponse response = controller.route(ProxyRequest.get("/status"));
 *     System.out.println(response.statusCode());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Sequential or random-without-replacement origin selection</li>
 *   <li>Per-attempt timeout with cancellation of the in-flight exchange</li>
 *   <li>Method, path, query, headers and body replayed to each origin</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.failover.RouterFactory
 * @see fr.lapetina.failover.domain.failover.FailoverController
 */
package fr.lapetina.failover;
