package io.liquidenergy.infrastructure.hummingbot.transport;

import io.liquidenergy.infrastructure.hummingbot.HummingbotConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EngineTransport} over the JDK {@link WebSocket} client.
 *
 * The listener reassembles fragmented text messages and queues them; the
 * reader drains the queue. A close or error from the socket enqueues an
 * end-of-stream marker behind any frames already received.
 */
public final class JdkWebSocketTransport implements EngineTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);
    private static final Inbound END_OF_STREAM = new Inbound(null);

    private final URI uri;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ReentrantLock sendLock = new ReentrantLock();

    private volatile WebSocket webSocket;
    private volatile String closeReason = "closed";
    private volatile Throwable closeCause;

    private JdkWebSocketTransport(URI uri) {
        this.uri = uri;
    }

    /**
     * Factory using a shared {@link HttpClient}.
     */
    public static EngineTransportFactory factory() {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        return (uri, connectTimeout) -> connect(httpClient, uri, connectTimeout);
    }

    public static JdkWebSocketTransport connect(HttpClient httpClient, URI uri, Duration connectTimeout) {
        JdkWebSocketTransport transport = new JdkWebSocketTransport(uri);
        try {
            transport.webSocket = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, transport.new InboundListener())
                .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new HummingbotConnectionException(uri.toString(),
                "WebSocket handshake failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new HummingbotConnectionException(uri.toString(),
                "WebSocket handshake timed out after " + connectTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HummingbotConnectionException(uri.toString(), "Interrupted during WebSocket handshake", e);
        }
        log.debug("[WS TRANSPORT] Opened {}", uri);
        return transport;
    }

    @Override
    public void send(String frame, Duration timeout) {
        long startNanos = System.nanoTime();
        try {
            // The JDK client allows a single outstanding send
            if (!sendLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new HummingbotConnectionException(uri.toString(),
                    "Send timed out after " + timeout.toMillis() + "ms waiting for an earlier send");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HummingbotConnectionException(uri.toString(), "Interrupted while sending", e);
        }

        try {
            WebSocket ws = webSocket;
            if (closed.get() || ws == null) {
                throw new TransportClosedException(uri.toString(), "Cannot send, transport is " + closeReason);
            }
            long remaining = timeout.toNanos() - (System.nanoTime() - startNanos);
            ws.sendText(frame, true).get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new HummingbotConnectionException(uri.toString(), "Send failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new HummingbotConnectionException(uri.toString(),
                "Send timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HummingbotConnectionException(uri.toString(), "Interrupted while sending", e);
        } finally {
            sendLock.unlock();
        }
    }

    @Override
    public String receive(Duration timeout) throws InterruptedException {
        Inbound next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return null;
        }
        if (next == END_OF_STREAM) {
            // keep the marker for any later reader
            inbound.offer(END_OF_STREAM);
            throw new TransportClosedException(uri.toString(), "Connection " + closeReason, closeCause);
        }
        return next.text;
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        markClosed("closed by client", null);
        WebSocket ws = webSocket;
        if (ws == null) {
            return;
        }
        if (ws.isOutputClosed()) {
            // peer already closed, or an earlier close() ran
            ws.abort();
            return;
        }
        try {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[WS TRANSPORT] Interrupted while closing {}", uri);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("[WS TRANSPORT] Close handshake with {} failed: {}", uri, e.toString());
        } finally {
            ws.abort();
        }
        log.debug("[WS TRANSPORT] Closed {}", uri);
    }

    private boolean markClosed(String reason, Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        closeReason = reason;
        closeCause = cause;
        inbound.offer(END_OF_STREAM);
        return true;
    }

    private static final class Inbound {
        private final String text;

        private Inbound(String text) {
            this.text = text;
        }
    }

    private final class InboundListener implements WebSocket.Listener {
        private final StringBuilder buf = new StringBuilder();

        @Override
        public void onOpen(WebSocket ws) {
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                inbound.offer(new Inbound(buf.toString()));
                buf.setLength(0);
            }
            ws.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            log.info("[WS TRANSPORT] {} closed by peer: {} {}", uri, statusCode, reason);
            markClosed("closed by peer (" + statusCode + ")", null);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            log.warn("[WS TRANSPORT] {} failed: {}", uri, error.toString());
            markClosed("failed: " + error.getMessage(), error);
        }
    }
}
