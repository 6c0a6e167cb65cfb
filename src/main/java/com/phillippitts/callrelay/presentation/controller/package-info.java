/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /ping} - liveness with connection and call counts</li>
 *   <li>{@code GET /api/calls}, {@code GET /api/calls/{callId}} - call session views</li>
 *   <li>{@code POST /api/calls/{callId}/commands} - operator command to the owning device</li>
 *   <li>{@code GET /api/connections}, {@code GET /api/connections/{id}} - connection views</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are mapped by
 * {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.callrelay.presentation.controller;
