package com.phillippitts.callrelay.service.connection;

/**
 * Outcome of a best-effort fan-out to every registered connection.
 */
public record BroadcastResult(int successCount, int failureCount) {
}
