package io.liquidenergy.infrastructure.hummingbot.transport;

import java.net.URI;
import java.time.Duration;

/**
 * Opens transports for the client.
 */
@FunctionalInterface
public interface EngineTransportFactory {

    /**
     * @throws io.liquidenergy.infrastructure.hummingbot.HummingbotConnectionException
     *         if the connection cannot be established
     */
    EngineTransport open(URI uri, Duration connectTimeout);
}
