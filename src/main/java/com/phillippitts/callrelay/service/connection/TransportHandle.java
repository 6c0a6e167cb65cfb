package com.phillippitts.callrelay.service.connection;

import java.io.IOException;

/**
 * Write side of one accepted transport session. Owned by {@link ConnectionRegistry}; nothing
 * outside the registry holds a reference after registration.
 *
 * <p>Implementations must tolerate concurrent {@link #send(String)} calls.
 */
public interface TransportHandle {

    boolean isOpen();

    /**
     * Writes one text frame.
     *
     * @throws IOException if the transport write fails
     */
    void send(String payload) throws IOException;

    /**
     * Closes the transport. Safe to call on an already closed handle.
     */
    void close();
}
