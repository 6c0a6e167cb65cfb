/**
 * Small stateless helpers: log sanitizing, duration formatting and the per-key serial executor.
 */
package com.phillippitts.callrelay.util;
