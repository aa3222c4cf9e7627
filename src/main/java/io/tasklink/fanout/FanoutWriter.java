package io.tasklink.fanout;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Copies every write to a changing set of destinations.
 *
 * <p>Each write goes to all destinations in parallel and returns once all of
 * them have finished. A destination whose write throws is dropped and its
 * {@link RemovalListener} is told why; the caller never sees the failure.
 * Listeners run on a separate bounded dispatcher, never on the writing
 * thread, and at most once per removal.
 */
public final class FanoutWriter extends OutputStream {
    private static final int CALLBACK_QUEUE_CAPACITY = 1024;

    private final Map<OutputStream, RemovalListener> destinations;
    private final ReentrantLock lock;
    private final ExecutorService writers;
    private final ThreadPoolExecutor callbacks;
    private final AtomicLong failedDestinationsTotal;
    private boolean closed;

    public FanoutWriter(OutputStream... initial) {
        this.destinations = new IdentityHashMap<>();
        this.lock = new ReentrantLock();
        this.writers = Executors.newCachedThreadPool(daemonThreads("tasklink-fanout-write"));
        ThreadFactory callbackThreads = daemonThreads("tasklink-fanout-removal");
        this.callbacks = new ThreadPoolExecutor(
                1,
                1,
                30L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(CALLBACK_QUEUE_CAPACITY),
                callbackThreads,
                // Queue full: hand the callback its own thread rather than block the writer or drop it.
                (task, executor) -> callbackThreads.newThread(task).start()
        );
        this.callbacks.allowCoreThreadTimeOut(true);
        this.failedDestinationsTotal = new AtomicLong(0L);
        for (OutputStream out : initial) {
            add(out, null);
        }
    }

    /**
     * Adds a destination. A {@code null} destination is ignored, as is any
     * destination added after {@link #close()}. Adding a destination already
     * present replaces its listener.
     */
    public void add(OutputStream destination, RemovalListener onRemove) {
        if (destination == null) {
            return;
        }
        lock.lock();
        try {
            if (closed) {
                return;
            }
            destinations.put(destination, onRemove);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a destination, telling its listener with a {@code null} cause.
     *
     * @return whether the destination was present
     */
    public boolean remove(OutputStream destination) {
        lock.lock();
        try {
            if (!destinations.containsKey(destination)) {
                return false;
            }
            notifyRemoved(destinations.remove(destination), null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return destinations.size();
        } finally {
            lock.unlock();
        }
    }

    public long failedDestinationsTotal() {
        return failedDestinationsTotal.get();
    }

    @Override
    public void write(int b) {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b) {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] b, int off, int len) {
        Objects.checkFromIndexSize(off, len, b.length);
        byte[] data = Arrays.copyOfRange(b, off, off + len);
        lock.lock();
        try {
            if (destinations.isEmpty()) {
                return;
            }
            List<OutputStream> targets = new ArrayList<>(destinations.keySet());
            List<CompletableFuture<Throwable>> results = new ArrayList<>(targets.size());
            for (OutputStream target : targets) {
                results.add(CompletableFuture.supplyAsync(() -> writeTo(target, data), writers));
            }
            for (int i = 0; i < targets.size(); i++) {
                Throwable failure = results.get(i).join();
                if (failure == null) {
                    continue;
                }
                OutputStream target = targets.get(i);
                failedDestinationsTotal.incrementAndGet();
                notifyRemoved(destinations.remove(target), failure);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every destination, telling each listener with a {@code null}
     * cause, and stops the writer threads.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            for (RemovalListener listener : destinations.values()) {
                notifyRemoved(listener, null);
            }
            destinations.clear();
        } finally {
            lock.unlock();
        }
        writers.shutdown();
        callbacks.shutdown();
    }

    private static Throwable writeTo(OutputStream target, byte[] data) {
        try {
            target.write(data);
            target.flush();
            return null;
        } catch (Exception e) {
            return e;
        }
    }

    private void notifyRemoved(RemovalListener listener, Throwable cause) {
        if (listener == null) {
            return;
        }
        Runnable task = () -> {
            try {
                listener.removed(cause);
            } catch (RuntimeException e) {
                System.err.println("WARN fan-out removal listener failed: " + e);
            }
        };
        if (callbacks.isShutdown()) {
            task.run();
            return;
        }
        callbacks.execute(task);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicLong seq = new AtomicLong(0L);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
