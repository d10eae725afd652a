package io.liquidenergy.infrastructure.hummingbot;

import io.liquidenergy.infrastructure.hummingbot.transport.EngineTransport;
import io.liquidenergy.infrastructure.hummingbot.transport.TransportClosedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory transport with a scripted gateway on the other end.
 *
 * Every sent frame is recorded and handed to the {@link Responder}; the
 * frames it returns are queued for the client to receive. Tests can also
 * inject raw frames and simulate the peer dropping the connection.
 */
class FakeEngineTransport implements EngineTransport {

    @FunctionalInterface
    interface Responder {
        /**
         * @return frames to deliver back, possibly none
         */
        List<String> respond(Map<String, Object> request);
    }

    private static final String END_OF_STREAM = new String("<end-of-stream>");
    private static final EngineMessageCodec CODEC = new EngineMessageCodec();

    private final Responder responder;
    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final List<Duration> sendTimeouts = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // how long a write takes before it reaches the gateway
    private volatile Duration sendLatency = Duration.ZERO;

    FakeEngineTransport(Responder responder) {
        this.responder = responder;
    }

    // ═══════════════════════════════════════════════════════════════
    // SCRIPTED REPLIES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Gateway that accepts the API key and answers nothing else.
     */
    static Responder authOnly() {
        return request -> isAuth(request) ? List.of(success(request, null)) : List.of();
    }

    static boolean isAuth(Map<String, Object> request) {
        return "authenticate".equals(request.get("type"));
    }

    static String success(Map<String, Object> request, Object data) {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("id", request.get("id"));
        reply.put("status", "success");
        if (data != null) {
            reply.put("data", data);
        }
        return CODEC.encode(reply);
    }

    static String error(Map<String, Object> request, String message) {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("id", request.get("id"));
        reply.put("status", "error");
        if (message != null) {
            reply.put("message", message);
        }
        return CODEC.encode(reply);
    }

    static String frame(Map<String, Object> message) {
        return CODEC.encode(message);
    }

    // ═══════════════════════════════════════════════════════════════
    // TEST HOOKS
    // ═══════════════════════════════════════════════════════════════

    void pushFrame(String frame) {
        inbound.offer(frame);
    }

    void simulateDisconnect() {
        if (closed.compareAndSet(false, true)) {
            inbound.offer(END_OF_STREAM);
        }
    }

    List<Map<String, Object>> sentMessages() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (String frame : sent) {
            out.add(CODEC.decode(frame));
        }
        return Collections.unmodifiableList(out);
    }

    List<Map<String, Object>> sentOfType(String type) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> message : sentMessages()) {
            if (type.equals(message.get("type"))) {
                out.add(message);
            }
        }
        return out;
    }

    int sentCount() {
        return sent.size();
    }

    void setSendLatency(Duration sendLatency) {
        this.sendLatency = sendLatency;
    }

    /**
     * Timeouts the client passed to each send, in order.
     */
    List<Duration> sendTimeouts() {
        return List.copyOf(sendTimeouts);
    }

    /**
     * Wait until at least {@code count} frames of {@code type} were sent.
     */
    List<Map<String, Object>> awaitSent(String type, int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            List<Map<String, Object>> matching = sentOfType(type);
            if (matching.size() >= count) {
                return matching;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Expected " + count + " '" + type + "' frame(s), got " + sentOfType(type).size());
    }

    // ═══════════════════════════════════════════════════════════════
    // EngineTransport
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void send(String frame, Duration timeout) {
        if (closed.get()) {
            throw new TransportClosedException("fake", "Cannot send, transport is closed");
        }
        sendTimeouts.add(timeout);
        Duration latency = sendLatency;
        if (!latency.isZero()) {
            try {
                Thread.sleep(Math.min(latency.toMillis(), timeout.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HummingbotConnectionException("fake", "Interrupted while sending", e);
            }
            if (latency.compareTo(timeout) > 0) {
                throw new HummingbotConnectionException("fake", "Send timed out after " + timeout.toMillis() + "ms");
            }
        }
        sent.add(frame);
        for (String reply : responder.respond(CODEC.decode(frame))) {
            inbound.offer(reply);
        }
    }

    @Override
    public String receive(Duration timeout) throws InterruptedException {
        String next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == END_OF_STREAM) {
            inbound.offer(END_OF_STREAM);
            throw new TransportClosedException("fake", "Connection closed by peer");
        }
        return next;
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        simulateDisconnect();
    }
}
