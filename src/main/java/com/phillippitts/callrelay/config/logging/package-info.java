/**
 * Logging infrastructure: servlet filter that seeds the Log4j2 ThreadContext for REST calls.
 */
package com.phillippitts.callrelay.config.logging;
