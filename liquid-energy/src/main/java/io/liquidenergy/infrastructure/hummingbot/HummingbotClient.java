package io.liquidenergy.infrastructure.hummingbot;

import io.liquidenergy.domain.event.Event;
import io.liquidenergy.domain.event.EventKind;
import io.liquidenergy.domain.order.OrderSide;
import io.liquidenergy.domain.order.OrderStatus;
import io.liquidenergy.domain.order.OrderType;
import io.liquidenergy.infrastructure.common.ReconnectionPolicy;
import io.liquidenergy.infrastructure.hummingbot.metrics.ClientMetrics;
import io.liquidenergy.infrastructure.hummingbot.metrics.ClientMetrics.ConnectionEvent;
import io.liquidenergy.infrastructure.hummingbot.metrics.ClientMetrics.RequestOutcome;
import io.liquidenergy.infrastructure.hummingbot.transport.EngineTransport;
import io.liquidenergy.infrastructure.hummingbot.transport.EngineTransportFactory;
import io.liquidenergy.infrastructure.hummingbot.transport.JdkWebSocketTransport;
import io.liquidenergy.infrastructure.hummingbot.transport.TransportClosedException;
import io.liquidenergy.service.core.EventEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client for the Hummingbot gateway WebSocket API.
 *
 * One connection carries both correlated request/response exchanges and
 * unsolicited push messages:
 *   caller thread → request(id=N) → transport
 *   receive thread ← frame ← transport
 *     id matches a waiting request  → resolve that request
 *     otherwise                     → map to an {@link Event} → EventEngine.put
 *
 * Request ids come from a per-client counter that is never reset, so an id is
 * not reused across reconnects. Every request waits at most the configured
 * request timeout, counted from before the send; its correlation entry is
 * removed whatever the outcome.
 *
 * Order mutations also publish to the event engine: ORDER_UPDATE on success,
 * ERROR on any failure, so bus-only observers see both.
 */
public final class HummingbotClient {
    private static final Logger log = LoggerFactory.getLogger(HummingbotClient.class);

    static final String CLIENT_ORIGIN = "hummingbot_client";

    private static final Duration RECEIVE_POLL = Duration.ofMillis(100);
    private static final long RECEIVE_SHUTDOWN_GRACE_MS = 1_000;
    private static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);
    private static final int LOGGED_FRAME_CHARS = 200;

    private static final AtomicInteger RECEIVE_THREAD_SEQ = new AtomicInteger(0);

    private final EventEngine eventEngine;
    private final HummingbotClientConfig config;
    private final EngineTransportFactory transportFactory;
    private final ClientMetrics metrics;
    private final ReconnectionPolicy retryPolicy;
    private final String endpoint;

    private final EngineMessageCodec codec = new EngineMessageCodec();
    private final PushEventMapper pushMapper = new PushEventMapper();
    private final PendingRequests pending = new PendingRequests();
    private final AtomicLong messageId = new AtomicLong(0);
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);

    // Guards connect/disconnect; never taken by the receive thread
    private final Object lifecycleLock = new Object();

    private volatile EngineTransport transport;
    private volatile boolean receiving = false;
    private volatile ExecutorService receiveExecutor;

    public HummingbotClient(EventEngine eventEngine, HummingbotClientConfig config) {
        this(eventEngine, config, JdkWebSocketTransport.factory(), ClientMetrics.noop());
    }

    public HummingbotClient(EventEngine eventEngine, HummingbotClientConfig config,
                            EngineTransportFactory transportFactory, ClientMetrics metrics) {
        if (eventEngine == null) {
            throw new ValidationException("Event engine is required");
        }
        if (config == null) {
            throw new ValidationException("Client config is required");
        }
        this.eventEngine = eventEngine;
        this.config = config;
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.metrics = metrics != null ? metrics : ClientMetrics.noop();
        this.endpoint = config.uri().toString();

        Duration initialDelay = config.getRetryInitialDelay();
        this.retryPolicy = ReconnectionPolicy.builder()
            .initialDelay(initialDelay)
            .maxDelay(initialDelay.compareTo(MAX_RETRY_DELAY) > 0 ? initialDelay : MAX_RETRY_DELAY)
            .multiplier(2.0)
            .maxRetries(config.getRetryAttempts())
            .build();

        log.info("[HUMMINGBOT] Client created for {}", config);
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTION LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open the connection, authenticate and start the receive loop.
     *
     * @throws HummingbotAuthenticationException if the API key is rejected
     * @throws HummingbotConnectionException if the connection cannot be
     *         established; the client is left DISCONNECTED
     */
    public void connect() {
        synchronized (lifecycleLock) {
            ConnectionState current = state.get();
            if (current == ConnectionState.CONNECTED) {
                log.info("[HUMMINGBOT] Already connected to {}", endpoint);
                return;
            }
            if (current == ConnectionState.ERROR) {
                teardown(new HummingbotConnectionException(endpoint, "Connection reset before reconnect"));
            }

            log.info("[HUMMINGBOT] Connecting to {}", endpoint);
            state.set(ConnectionState.CONNECTING);
            metrics.recordConnectionEvent(ConnectionEvent.CONNECTING);

            EngineTransport opened = null;
            try {
                opened = transportFactory.open(config.uri(), config.getConnectTimeout());
                authenticate(opened);

                transport = opened;
                state.set(ConnectionState.CONNECTED);
                startReceiveLoop(opened);
            } catch (HummingbotConnectionException e) {
                failConnect(opened, e);
                throw e;
            } catch (RuntimeException e) {
                HummingbotConnectionException wrapped = new HummingbotConnectionException(
                    endpoint, "Failed to connect to Hummingbot: " + e.getMessage(), e);
                failConnect(opened, wrapped);
                throw wrapped;
            }

            metrics.recordConnectionEvent(ConnectionEvent.CONNECTED);
            publish(EventKind.SYSTEM, Map.of("event", "connected", "endpoint", endpoint), CLIENT_ORIGIN);
            log.info("[HUMMINGBOT] ✅ Connected to {}", endpoint);
        }
    }

    /**
     * {@link #connect()} with up to {@code retryAttempts} further attempts,
     * backing off exponentially between them. A rejected API key is not
     * retried.
     */
    public void connectWithRetry() {
        int failures = 0;
        while (true) {
            try {
                connect();
                return;
            } catch (HummingbotAuthenticationException e) {
                throw e;
            } catch (HummingbotConnectionException e) {
                failures++;
                if (!retryPolicy.allowsRetry(failures)) {
                    if (failures > 1) {
                        log.error("[HUMMINGBOT] Giving up after {} attempts: {}", failures, e.getMessage());
                    }
                    throw e;
                }
                Duration delay = retryPolicy.delayBeforeRetry(failures);
                log.warn("[HUMMINGBOT] Connect attempt {} failed, retrying in {}ms: {}",
                    failures, delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * Stop the receive loop, close the transport and fail any request still
     * waiting. Safe to call in any state.
     */
    public void disconnect() {
        synchronized (lifecycleLock) {
            log.info("[HUMMINGBOT] Disconnecting from {}", endpoint);
            // leave CONNECTED first so a receive loop racing this close cannot report a loss
            ConnectionState previous = state.getAndSet(ConnectionState.DISCONNECTED);
            teardown(new HummingbotConnectionException(endpoint, "Client disconnected"));

            if (previous != ConnectionState.DISCONNECTED) {
                metrics.recordConnectionEvent(ConnectionEvent.DISCONNECTED);
                publish(EventKind.SYSTEM, Map.of("event", "disconnected", "endpoint", endpoint), CLIENT_ORIGIN);
            }
            log.info("[HUMMINGBOT] Disconnected from {}", endpoint);
        }
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    /**
     * Number of requests currently waiting for a response.
     */
    public int pendingRequestCount() {
        return pending.size();
    }

    public HummingbotClientConfig getConfig() {
        return config;
    }

    // ═══════════════════════════════════════════════════════════════
    // REQUEST / RESPONSE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Send a request and block until the correlated response arrives.
     *
     * The returned response may carry a non-success status; domain methods
     * turn that into {@link RemoteEngineException}.
     *
     * @throws RequestTimeoutException if no response arrives within the request timeout
     * @throws HummingbotConnectionException if not connected, or the connection
     *         is lost while waiting
     * @throws HummingbotClientException if a pinned request id is already in flight
     */
    public EngineResponse request(EngineRequest request) {
        Objects.requireNonNull(request, "request");

        EngineTransport t = transport;
        if (state.get() != ConnectionState.CONNECTED || t == null) {
            throw new HummingbotConnectionException(endpoint, "Not connected to Hummingbot");
        }

        String type = request.getType().wireValue();
        String id = request.getId() != null ? request.getId() : nextRequestId();
        Duration timeout = config.getRequestTimeout();

        CompletableFuture<EngineResponse> handle;
        try {
            handle = pending.register(id);
        } catch (IllegalStateException e) {
            // only a caller-pinned id can collide
            throw new HummingbotClientException("Request id " + id + " is already in flight", e);
        }

        long startNanos = System.nanoTime();
        try {
            t.send(codec.encode(request.toWire(id)), timeout);
            EngineResponse response = handle.get(remainingMillis(timeout, startNanos), TimeUnit.MILLISECONDS);

            metrics.recordRequest(type,
                response.isSuccess() ? RequestOutcome.SUCCESS : RequestOutcome.REMOTE_ERROR,
                elapsedSince(startNanos));
            log.debug("[HUMMINGBOT] {} id={} -> {}", type, id, response.status());
            return response;

        } catch (TimeoutException e) {
            metrics.recordRequest(type, RequestOutcome.TIMEOUT, elapsedSince(startNanos));
            log.warn("[HUMMINGBOT] {} request id={} timed out after {}ms", type, id, timeout.toMillis());
            throw new RequestTimeoutException(type, id, timeout);

        } catch (ExecutionException e) {
            metrics.recordRequest(type, RequestOutcome.CONNECTION_ERROR, elapsedSince(startNanos));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new HummingbotConnectionException(endpoint,
                "Request " + type + " (id=" + id + ") failed: " + cause.getMessage(), cause);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordRequest(type, RequestOutcome.CONNECTION_ERROR, elapsedSince(startNanos));
            throw new HummingbotConnectionException(endpoint, "Interrupted waiting for " + type + " response", e);

        } catch (HummingbotConnectionException e) {
            metrics.recordRequest(type, RequestOutcome.CONNECTION_ERROR, elapsedSince(startNanos));
            throw e;

        } finally {
            pending.remove(id);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Create an order. Publishes ORDER_UPDATE with the order data on success
     * and ERROR on failure.
     *
     * @param price required for {@link OrderType#LIMIT}, ignored for market orders
     * @return order details from the engine
     * @throws ValidationException before any I/O if the arguments are invalid
     */
    public Map<String, Object> createOrder(String exchange, String market, OrderSide side,
                                           OrderType orderType, BigDecimal amount, BigDecimal price) {
        EngineRequest request = EngineRequest.createOrder(exchange, market, side, orderType, amount, price);

        try {
            EngineResponse response = request(request);
            requireSuccess(response, "create order");

            Map<String, Object> orderData = response.dataAsMap();
            publish(EventKind.ORDER_UPDATE, orderData, PushEventMapper.ORIGIN);
            log.info("[HUMMINGBOT] Created {} {} order on {}/{}: {}", orderType, side, exchange, market,
                orderData.get("order_id"));
            return orderData;

        } catch (HummingbotClientException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("message", String.format("Failed to create %s %s order for %s on %s",
                orderType, side, market, exchange));
            error.put("exchange", exchange);
            error.put("market", market);
            error.put("reason", e.getMessage());
            publish(EventKind.ERROR, error, CLIENT_ORIGIN);
            throw e;
        }
    }

    /**
     * Cancel an order. Publishes ORDER_UPDATE with status {@code cancelled}
     * on success and ERROR on failure.
     */
    public Map<String, Object> cancelOrder(String exchange, String market, String orderId) {
        EngineRequest request = EngineRequest.cancelOrder(exchange, market, orderId);

        try {
            EngineResponse response = request(request);
            requireSuccess(response, "cancel order");

            Map<String, Object> update = new LinkedHashMap<>();
            update.put("order_id", orderId);
            update.put("status", OrderStatus.CANCELLED.wireValue());
            update.put("exchange", exchange);
            update.put("market", market);
            publish(EventKind.ORDER_UPDATE, update, PushEventMapper.ORIGIN);
            log.info("[HUMMINGBOT] Cancelled order {} on {}/{}", orderId, exchange, market);
            return response.dataAsMap();

        } catch (HummingbotClientException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("message", String.format("Failed to cancel order %s for %s on %s", orderId, market, exchange));
            error.put("exchange", exchange);
            error.put("market", market);
            error.put("order_id", orderId);
            error.put("reason", e.getMessage());
            publish(EventKind.ERROR, error, CLIENT_ORIGIN);
            throw e;
        }
    }

    public Map<String, Object> getOrderStatus(String exchange, String market, String orderId) {
        EngineResponse response = request(EngineRequest.getOrder(exchange, market, orderId));
        requireSuccess(response, "get order status");
        return response.dataAsMap();
    }

    public List<Map<String, Object>> getOpenOrders(String exchange, String market) {
        EngineResponse response = request(EngineRequest.getOpenOrders(exchange, market));
        requireSuccess(response, "get open orders");
        return response.dataAsList();
    }

    public List<Map<String, Object>> getOrderHistory(String exchange, String market) {
        return getOrderHistory(exchange, market, 50);
    }

    public List<Map<String, Object>> getOrderHistory(String exchange, String market, int limit) {
        EngineResponse response = request(EngineRequest.getOrderHistory(exchange, market, limit));
        requireSuccess(response, "get order history");
        return response.dataAsList();
    }

    // ═══════════════════════════════════════════════════════════════
    // MARKET DATA & ACCOUNT
    // ═══════════════════════════════════════════════════════════════

    public Map<String, Object> getOrderBook(String exchange, String market) {
        return getOrderBook(exchange, market, 10);
    }

    public Map<String, Object> getOrderBook(String exchange, String market, int depth) {
        EngineResponse response = request(EngineRequest.getOrderBook(exchange, market, depth));
        requireSuccess(response, "get order book");
        return response.dataAsMap();
    }

    public Map<String, Object> getTicker(String exchange, String market) {
        EngineResponse response = request(EngineRequest.getTicker(exchange, market));
        requireSuccess(response, "get ticker");
        return response.dataAsMap();
    }

    /**
     * Subscribe to order book pushes; updates arrive as MARKET_DATA events.
     *
     * @return the full subscription response
     */
    public Map<String, Object> subscribeToOrderBook(String exchange, String market) {
        EngineResponse response = request(EngineRequest.subscribe(SubscriptionChannel.ORDER_BOOK, exchange, market));
        requireSuccess(response, "subscribe to order book");
        return response.raw();
    }

    /**
     * Subscribe to trade pushes; trades arrive as TRADE_UPDATE events.
     *
     * @return the full subscription response
     */
    public Map<String, Object> subscribeToTrades(String exchange, String market) {
        EngineResponse response = request(EngineRequest.subscribe(SubscriptionChannel.TRADES, exchange, market));
        requireSuccess(response, "subscribe to trades");
        return response.raw();
    }

    /**
     * Balances keyed by asset, as reported by the engine.
     */
    public Map<String, Object> getBalances(String exchange) {
        EngineResponse response = request(EngineRequest.getBalances(exchange));
        requireSuccess(response, "get balances");
        return response.dataAsMap();
    }

    // ═══════════════════════════════════════════════════════════════
    // RECEIVE LOOP
    // ═══════════════════════════════════════════════════════════════

    private void startReceiveLoop(EngineTransport t) {
        receiving = true;
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "hummingbot-receive-" + RECEIVE_THREAD_SEQ.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        receiveExecutor = executor;
        executor.execute(() -> {
            try {
                receiveLoop(t);
            } finally {
                // the worker exits once this task returns
                executor.shutdown();
            }
        });
    }

    /**
     * True while a receive worker thread is still running.
     */
    boolean isReceiveWorkerAlive() {
        ExecutorService executor = receiveExecutor;
        return executor != null && !executor.isTerminated();
    }

    private void receiveLoop(EngineTransport t) {
        log.debug("[HUMMINGBOT] Receive loop started");
        while (receiving && transport == t) {
            String frame;
            try {
                frame = t.receive(RECEIVE_POLL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (TransportClosedException e) {
                if (receiving && transport == t) {
                    onConnectionLost(t, e);
                }
                break;
            }

            if (frame != null) {
                handleFrame(frame);
            }
        }
        log.debug("[HUMMINGBOT] Receive loop exited");
    }

    private void handleFrame(String frame) {
        Map<String, Object> message;
        try {
            message = codec.decode(frame);
        } catch (ProtocolException e) {
            metrics.recordMalformedFrame();
            log.error("[HUMMINGBOT] Received invalid frame ({}): {}", e.getMessage(), abbreviate(frame));
            return;
        }

        try {
            route(message);
        } catch (RuntimeException e) {
            log.error("[HUMMINGBOT] Error processing message: {}", abbreviate(frame), e);
        }
    }

    private void route(Map<String, Object> message) {
        Object rawId = message.get("id");
        if (rawId != null) {
            String id = String.valueOf(rawId);
            if (pending.complete(id, EngineResponse.from(message))) {
                return;
            }
            if (message.containsKey("status") && !message.containsKey("type")) {
                metrics.recordLateResponse();
                log.warn("[HUMMINGBOT] Dropping response for id={} (no request waiting, probably timed out)", id);
                return;
            }
        }
        forwardPush(message);
    }

    private void forwardPush(Map<String, Object> message) {
        Object type = message.get("type");
        Optional<Event> event;
        try {
            event = pushMapper.toEvent(message);
        } catch (ProtocolException e) {
            metrics.recordMalformedFrame();
            log.error("[HUMMINGBOT] Skipping push message: {}", e.getMessage());
            return;
        }

        if (event.isEmpty()) {
            metrics.recordDroppedPush(type != null ? String.valueOf(type) : null);
            log.warn("[HUMMINGBOT] Received unknown event type: {}", type);
            return;
        }

        metrics.recordPushEvent(event.get().kind());
        eventEngine.put(event.get());
    }

    private void onConnectionLost(EngineTransport t, TransportClosedException cause) {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.ERROR)) {
            return;
        }
        receiving = false;
        log.error("[HUMMINGBOT] ❌ Connection lost: {}", cause.getMessage());
        metrics.recordConnectionEvent(ConnectionEvent.CONNECTION_LOST);

        int failed = pending.failAll(new HummingbotConnectionException(endpoint, "Connection lost", cause));
        if (failed > 0) {
            log.warn("[HUMMINGBOT] Failed {} pending request(s) after connection loss", failed);
        }
        t.close();

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", "Connection to Hummingbot lost");
        error.put("endpoint", endpoint);
        error.put("reason", cause.getMessage());
        publish(EventKind.ERROR, error, CLIENT_ORIGIN);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void authenticate(EngineTransport t) {
        String id = nextRequestId();
        Duration timeout = config.getRequestTimeout();
        long startNanos = System.nanoTime();
        t.send(codec.encode(EngineRequest.authenticate(config.getApiKey()).toWire(id)), timeout);

        String reply;
        try {
            reply = t.receive(Duration.ofMillis(remainingMillis(timeout, startNanos)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HummingbotConnectionException(endpoint, "Interrupted while authenticating", e);
        }
        if (reply == null) {
            throw new HummingbotConnectionException(endpoint,
                "No authentication response within " + config.getRequestTimeout().toMillis() + "ms");
        }

        EngineResponse response = EngineResponse.from(codec.decode(reply));
        if (!response.isSuccess()) {
            throw new HummingbotAuthenticationException(endpoint, response.messageOr("Authentication failed"));
        }
    }

    private void failConnect(EngineTransport opened, HummingbotConnectionException cause) {
        state.set(ConnectionState.ERROR);
        metrics.recordConnectionEvent(cause instanceof HummingbotAuthenticationException
            ? ConnectionEvent.AUTH_FAILED
            : ConnectionEvent.CONNECT_FAILED);
        log.error("[HUMMINGBOT] ❌ {}", cause.getMessage());

        if (opened != null) {
            opened.close();
        }
        teardown(cause);
        state.set(ConnectionState.DISCONNECTED);

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", "Failed to connect to Hummingbot");
        error.put("endpoint", endpoint);
        error.put("reason", cause.getMessage());
        publish(EventKind.ERROR, error, CLIENT_ORIGIN);
    }

    /**
     * Stop the receive loop, close the current transport and fail waiting
     * requests. Caller holds {@link #lifecycleLock}.
     */
    private void teardown(HummingbotConnectionException cause) {
        receiving = false;

        ExecutorService executor = receiveExecutor;
        receiveExecutor = null;
        if (executor != null) {
            executor.shutdownNow();
        }

        EngineTransport t = transport;
        transport = null;
        if (t != null) {
            t.close();
        }

        if (executor != null) {
            try {
                if (!executor.awaitTermination(RECEIVE_SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("[HUMMINGBOT] Receive loop did not stop within {}ms", RECEIVE_SHUTDOWN_GRACE_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        int failed = pending.failAll(cause);
        if (failed > 0) {
            log.warn("[HUMMINGBOT] Failed {} pending request(s): {}", failed, cause.getMessage());
        }
    }

    private void requireSuccess(EngineResponse response, String operation) {
        if (!response.isSuccess()) {
            String message = response.messageOr("Unknown error");
            log.warn("[HUMMINGBOT] Failed to {}: {}", operation, message);
            throw new RemoteEngineException(operation, response.id(), message);
        }
    }

    private void publish(EventKind kind, Map<String, ?> payload, String origin) {
        eventEngine.put(Event.of(kind, payload, origin));
    }

    /**
     * Next counter id, skipping any id a caller pinned with
     * {@link EngineRequest#withId(String)} that is still in flight.
     */
    private String nextRequestId() {
        String id;
        do {
            id = String.valueOf(messageId.incrementAndGet());
        } while (pending.contains(id));
        return id;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static long remainingMillis(Duration timeout, long startNanos) {
        long remaining = timeout.toMillis() - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return Math.max(0, remaining);
    }

    private static String abbreviate(String frame) {
        if (frame.length() <= LOGGED_FRAME_CHARS) {
            return frame;
        }
        return frame.substring(0, LOGGED_FRAME_CHARS) + "...";
    }
}
