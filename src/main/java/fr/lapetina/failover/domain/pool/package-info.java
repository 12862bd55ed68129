/**
 * Per-request origin pools and the policies that draw from them.
 *
 * <h2>Available Policies</h2>
 * <table border="1">
 *   <tr><th>Policy</th><th>Description</th></tr>
 *   <tr><td>{@code sequential}</td><td>Tries origins in configuration order</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform draw among untried origins, without replacement</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SelectionPolicy policy = SelectionPolicyFactory.create("random").orElseThrow();
 * OriginPool pool = new OriginPool(origins, policy);
 * while (!pool.isEmpty()) {
 *     Origin origin = pool.next();
 *     // attempt...
 * }
 * }</pre>
 *
 * @see fr.lapetina.failover.domain.pool.OriginPool
 * @see fr.lapetina.failover.domain.pool.SelectionPolicyFactory
 */
package fr.lapetina.failover.domain.pool;
