/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.callrelay.exception.CallRelayException}
 * and carry a stable error code.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callrelay.exception.CallNotFoundException},
 *       {@link com.phillippitts.callrelay.exception.ConnectionNotFoundException} - unknown identifiers</li>
 *   <li>{@link com.phillippitts.callrelay.exception.DuplicateCallException},
 *       {@link com.phillippitts.callrelay.exception.DuplicateConnectionException} - identifier already in use</li>
 *   <li>{@link com.phillippitts.callrelay.exception.InvalidTransitionException} - illegal status change</li>
 *   <li>{@link com.phillippitts.callrelay.exception.ExternalCapabilityException} - transcription,
 *       response or summary failure or timeout (recoverable)</li>
 *   <li>{@link com.phillippitts.callrelay.exception.DeliveryFailureException} - send to a dead connection</li>
 *   <li>{@link com.phillippitts.callrelay.exception.MalformedMessageException},
 *       {@link com.phillippitts.callrelay.exception.UnsupportedMessageTypeException} - rejected inbound messages</li>
 * </ul>
 *
 * <p>Request-level failures (not found, duplicate, invalid transition, malformed) are reported
 * to the caller and never retried. Capability failures skip one enrichment step. Delivery
 * failures are logged and counted, never propagated from fan-out.
 *
 * @see com.phillippitts.callrelay.presentation.exception.GlobalExceptionHandler
 * @see com.phillippitts.callrelay.service.routing.MessageRouter
 * @since 1.0
 */
package com.phillippitts.callrelay.exception;
