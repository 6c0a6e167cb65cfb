/**
 * Presentation layer: the WebSocket endpoint, REST controllers and HTTP exception mapping.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - socket session handling</li>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Presentation depends on service, never the other way around.
 */
package com.phillippitts.callrelay.presentation;
