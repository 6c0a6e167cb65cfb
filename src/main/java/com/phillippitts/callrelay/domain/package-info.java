/**
 * Core domain model for call coordination.
 *
 * <p>Types here are immutable views ({@link com.phillippitts.callrelay.domain.CallSession},
 * {@link com.phillippitts.callrelay.domain.ConnectionInfo}) and wire-level enums. Mutable
 * state lives inside the owning services and is never handed out directly.
 *
 * @since 1.0
 */
package com.phillippitts.callrelay.domain;
