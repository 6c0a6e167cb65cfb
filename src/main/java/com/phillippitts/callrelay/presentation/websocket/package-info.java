/**
 * WebSocket transport: session lifecycle and frame hand-off to the message router.
 */
package com.phillippitts.callrelay.presentation.websocket;
