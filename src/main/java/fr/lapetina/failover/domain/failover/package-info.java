/**
 * The failover decision procedure.
 *
 * <p>{@link fr.lapetina.failover.domain.failover.FailoverController} draws origins from a
 * per-request {@link fr.lapetina.failover.domain.pool.OriginPool} and hands each one to an
 * {@link fr.lapetina.failover.domain.failover.AttemptExecutor}:
 * <pre>
 * Selecting → Attempting → Succeeded          (upstream response returned)
 *                        → Failed → Selecting  (origins remain)
 *                                 → Exhausted  (503 Service unavailable)
 * </pre>
 *
 * <p>Attempts for one request never overlap, and the worst-case latency of a request is
 * the per-attempt timeout multiplied by the number of configured origins.
 */
package fr.lapetina.failover.domain.failover;
