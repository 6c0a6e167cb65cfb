/**
 * Message router: parses, validates and dispatches inbound socket frames.
 */
package com.phillippitts.callrelay.service.routing;
