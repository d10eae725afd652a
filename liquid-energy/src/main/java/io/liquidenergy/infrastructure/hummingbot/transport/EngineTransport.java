package io.liquidenergy.infrastructure.hummingbot.transport;

import java.time.Duration;

/**
 * One open, message-oriented connection to the gateway.
 *
 * Frames are whole text messages. {@link #send(String, Duration)} may be
 * called from several threads; {@link #receive(Duration)} is called by one
 * reader.
 */
public interface EngineTransport {

    /**
     * Send one frame, waiting at most {@code timeout} for the write, time
     * spent queued behind other senders included.
     *
     * @throws TransportClosedException if the transport is closed
     * @throws io.liquidenergy.infrastructure.hummingbot.HummingbotConnectionException if the write
     *         fails or does not finish within {@code timeout}
     */
    void send(String frame, Duration timeout);

    /**
     * Wait up to {@code timeout} for the next inbound frame.
     *
     * @return the frame, or null if none arrived in time
     * @throws TransportClosedException once the connection is closed and
     *         every frame received before the close has been returned
     */
    String receive(Duration timeout) throws InterruptedException;

    boolean isOpen();

    /**
     * Close the connection. Idempotent. Wakes a reader blocked in
     * {@link #receive(Duration)}.
     */
    void close();
}
