/**
 * Connection registry: transport handles keyed by connection id, best-effort delivery and
 * inactivity eviction.
 */
package com.phillippitts.callrelay.service.connection;
