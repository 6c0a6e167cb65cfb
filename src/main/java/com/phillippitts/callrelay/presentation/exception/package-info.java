/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code CallNotFoundException}, {@code ConnectionNotFoundException} → 404 Not Found</li>
 *   <li>{@code DuplicateCallException}, {@code InvalidTransitionException} → 409 Conflict</li>
 *   <li>{@code MalformedMessageException}, invalid request bodies → 400 Bad Request</li>
 *   <li>{@code DeliveryFailureException}, {@code ExternalCapabilityException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "CALL_NOT_FOUND",
 *   "message": "Resource not found",
 *   "details": "Call not found: c1",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Socket clients get the same codes in {@code error} messages from the router.
 */
package com.phillippitts.callrelay.presentation.exception;
