package io.liquidenergy.service.core;

import io.liquidenergy.domain.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process event bus.
 *
 * Producers call {@link #put(Event)} from any thread. A single dispatch thread
 * takes events off the queue in FIFO order and hands each one to every
 * registered listener that accepts its kind, sequentially and in registration
 * order.
 *
 * Rules:
 * - put() never blocks (unbounded queue)
 * - a failing listener is logged and skipped, dispatch continues
 * - listeners are snapshotted per event, so the lock is never held while a
 *   handler runs
 *
 * Usage:
 * <pre>
 * EventEngine engine = new EventEngine();
 * engine.register(EventListener.of("risk", EnumSet.of(EventKind.ORDER_UPDATE), riskCheck::onOrder));
 * engine.start();
 * engine.put(Event.of(EventKind.ORDER_UPDATE, Map.of("order_id", "42")));
 * engine.stop();
 * </pre>
 */
public final class EventEngine {
    private static final Logger log = LoggerFactory.getLogger(EventEngine.class);

    private static final long POLL_TIMEOUT_MS = 100;
    private static final long STOP_GRACE_MS = 1_000;

    private final BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
    private final List<EventListener> listeners = new ArrayList<>();
    private final Object listenerLock = new Object();

    private final AtomicLong dispatchedCount = new AtomicLong(0);
    private final AtomicLong listenerFailureCount = new AtomicLong(0);

    private volatile boolean running = false;
    private volatile Thread dispatchThread;

    // ═══════════════════════════════════════════════════════════════
    // LISTENERS
    // ═══════════════════════════════════════════════════════════════

    public void register(EventListener listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (listenerLock) {
            listeners.add(listener);
        }
        log.debug("[EVENT ENGINE] Registered listener {} for {}", listener.getName(), listener.getAcceptedKinds());
    }

    public void unregister(EventListener listener) {
        boolean removed;
        synchronized (listenerLock) {
            removed = listeners.remove(listener);
        }
        if (removed) {
            log.debug("[EVENT ENGINE] Unregistered listener {}", listener.getName());
        }
    }

    /**
     * Snapshot of the registered listeners, in registration order.
     */
    public List<EventListener> getListeners() {
        synchronized (listenerLock) {
            return List.copyOf(listeners);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISHING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Enqueue an event for dispatch. Never blocks.
     */
    public void put(Event event) {
        Objects.requireNonNull(event, "event");
        queue.offer(event);
    }

    /**
     * Number of events waiting for dispatch.
     */
    public int pendingEvents() {
        return queue.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatchThread = new Thread(this::dispatchLoop, "event-engine-dispatch");
        dispatchThread.setDaemon(true);
        dispatchThread.start();
        log.info("[EVENT ENGINE] Started");
    }

    /**
     * Signal the dispatch loop to exit and wait up to one second for the
     * event in flight to finish. Returns even if the loop is still busy.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        Thread t = dispatchThread;
        dispatchThread = null;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(STOP_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("[EVENT ENGINE] Dispatch thread did not exit within {}ms", STOP_GRACE_MS);
            }
        }
        log.info("[EVENT ENGINE] Stopped ({} events dispatched, {} pending)", dispatchedCount.get(), queue.size());
    }

    public boolean isRunning() {
        return running;
    }

    public long getDispatchedCount() {
        return dispatchedCount.get();
    }

    public long getListenerFailureCount() {
        return listenerFailureCount.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void dispatchLoop() {
        // A restarted engine owns a new thread; the old one exits here
        while (running && dispatchThread == Thread.currentThread()) {
            Event event;
            try {
                event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[EVENT ENGINE] Dispatch thread interrupted, exiting");
                return;
            }
            if (event == null) {
                continue;
            }

            try {
                distribute(event);
            } catch (RuntimeException e) {
                log.error("[EVENT ENGINE] Unexpected error dispatching {}", event.kind(), e);
            }
        }
    }

    private void distribute(Event event) {
        List<EventListener> snapshot = getListeners();
        for (EventListener listener : snapshot) {
            if (!listener.accepts(event.kind())) {
                continue;
            }
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                listenerFailureCount.incrementAndGet();
                log.error("[EVENT ENGINE] Listener {} failed on {}", listener.getName(), event.kind(), e);
            }
        }
        dispatchedCount.incrementAndGet();
    }
}
