package com.ralphtown.dispatch.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded send queue in front of one streaming client (an SSE emitter or a
 * WebSocket connection).
 * <p>
 * Publishers only enqueue. A single task on the sender pool writes to the client,
 * so a client that stops reading can stall nothing but its own queue. New items
 * are dropped while the queue is full. Items are written in the order they were
 * accepted.
 *
 * @param <T> the unit written to the client
 */
class ClientOutbox<T> {

    private static final Logger log = LoggerFactory.getLogger(ClientOutbox.class);

    /** Where queued items end up. */
    interface Sink<T> {
        void send(T item) throws IOException;

        void complete();
    }

    private final String topic;
    private final Sink<T> sink;
    private final Executor sender;
    private final BlockingQueue<T> queue;
    private final AtomicBoolean flushing = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean completeWhenDrained;
    private volatile boolean closed;

    ClientOutbox(String topic, Sink<T> sink, Executor sender, int capacity) {
        this.topic = topic;
        this.sink = sink;
        this.sender = sender;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    static ClientOutbox<SseEmitter.SseEventBuilder> forEmitter(String topic, SseEmitter emitter,
                                                              Executor sender, int capacity) {
        return new ClientOutbox<>(topic, new Sink<>() {
            @Override
            public void send(SseEmitter.SseEventBuilder event) throws IOException {
                emitter.send(event);
            }

            @Override
            public void complete() {
                emitter.complete();
            }
        }, sender, capacity);
    }

    /**
     * Queues an item without blocking.
     *
     * @return false if the outbox is closed or full
     */
    boolean offer(T item) {
        if (closed) {
            return false;
        }
        if (queue.offer(item)) {
            scheduleFlush();
            return true;
        }
        long count = dropped.incrementAndGet();
        if (count == 1 || count % 100 == 0) {
            log.warn("Client for {} is not keeping up, {} items dropped so far", topic, count);
        }
        return false;
    }

    /**
     * Queues the last item of the stream, evicting the oldest queued items if
     * needed, and completes the sink once it has been written.
     */
    void offerFinal(T item) {
        if (closed) {
            return;
        }
        while (!queue.offer(item)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
        completeWhenDrained = true;
        scheduleFlush();
    }

    void close() {
        closed = true;
        queue.clear();
    }

    boolean isClosed() {
        return closed;
    }

    long droppedCount() {
        return dropped.get();
    }

    private void scheduleFlush() {
        if (flushing.compareAndSet(false, true)) {
            try {
                sender.execute(this::flush);
            } catch (RejectedExecutionException e) {
                flushing.set(false);
                log.debug("Sender pool rejected flush for {}: {}", topic, e.getMessage());
            }
        }
    }

    private void flush() {
        try {
            T next;
            while (!closed && (next = queue.poll()) != null) {
                try {
                    sink.send(next);
                } catch (IOException | IllegalStateException e) {
                    // the transport's own close callbacks do the cleanup
                    log.debug("Send failed for {}, closing outbox: {}", topic, e.getMessage());
                    close();
                    return;
                }
            }
            if (completeWhenDrained && !closed && queue.isEmpty()) {
                closed = true;
                sink.complete();
            }
        } finally {
            flushing.set(false);
        }
        if (!closed && (!queue.isEmpty() || completeWhenDrained)) {
            scheduleFlush();
        }
    }
}
