/**
 * Chat-channel notifications for call lifecycle events, filtered by a pluggable
 * {@link com.phillippitts.callrelay.service.notify.ImportancePolicy}.
 */
package com.phillippitts.callrelay.service.notify;
