/**
 * Domain model classes representing core concepts of the failover router.
 *
 * <p>This package contains immutable value objects passed between the origin pool,
 * the attempt executor and the failover controller.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.failover.domain.model.Origin} - Upstream host[:port] identifier</li>
 *   <li>{@link fr.lapetina.failover.domain.model.ProxyRequest} - Buffered inbound request, replayable per attempt</li>
 *   <li>{@link fr.lapetina.failover.domain.model.ProxyResponse} - Response returned to the caller</li>
 *   <li>{@link fr.lapetina.failover.domain.model.AttemptOutcome} - Tagged result of one attempt</li>
 *   <li>{@link fr.lapetina.failover.domain.model.OutcomeType} - SUCCESS, BAD_STATUS, TIMEOUT, TRANSPORT_ERROR</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All classes in this package are immutable records and can be shared freely.
 * Header maps are copied into unmodifiable maps on construction; byte arrays are
 * not copied and must not be mutated after construction.
 *
 * @see fr.lapetina.failover.domain.model.AttemptOutcome
 */
package fr.lapetina.failover.domain.model;
