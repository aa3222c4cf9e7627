package io.tasklink.fanout;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory pipe with a bounded buffer. Writers block while the buffer is
 * full, for at most the write timeout if one is set; a writer that runs out
 * of time closes the pipe with that failure. Closing either end, or calling
 * {@link #close(Throwable)}, closes both: readers drain what is buffered and
 * then see end of stream (or the close cause), writers fail immediately.
 * Any thread may write; the pipe does not track writer threads.
 */
public final class LogPipe {
    public static final int DEFAULT_CAPACITY = 64 * 1024;

    private final byte[] buffer;
    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final Condition notFull;
    private final InputStream source;
    private final OutputStream sink;
    private final Duration writeTimeout;
    private int head;
    private int count;
    private boolean closed;
    private Throwable closeCause;

    public LogPipe() {
        this(DEFAULT_CAPACITY);
    }

    public LogPipe(int capacity) {
        this(capacity, null);
    }

    /**
     * @param writeTimeout longest a write waits for room, or {@code null} to
     *                     wait until the reader catches up or the pipe closes
     */
    public LogPipe(int capacity, Duration writeTimeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (writeTimeout != null && writeTimeout.isNegative()) {
            throw new IllegalArgumentException("writeTimeout must not be negative");
        }
        this.writeTimeout = writeTimeout;
        this.buffer = new byte[capacity];
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
        this.notFull = lock.newCondition();
        this.source = new Source();
        this.sink = new Sink();
    }

    public InputStream source() {
        return source;
    }

    public OutputStream sink() {
        return sink;
    }

    public void close(Throwable cause) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            closeCause = cause;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private IOException closedException() {
        return closeCause == null
                ? new IOException("pipe closed")
                : new IOException("pipe closed: " + closeCause.getMessage(), closeCause);
    }

    private final class Source extends InputStream {
        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return 0;
            }
            lock.lock();
            try {
                while (count == 0 && !closed) {
                    notEmpty.awaitUninterruptibly();
                }
                if (count == 0) {
                    if (closeCause != null) {
                        throw closedException();
                    }
                    return -1;
                }
                int n = Math.min(len, count);
                for (int i = 0; i < n; i++) {
                    b[off + i] = buffer[(head + i) % buffer.length];
                }
                head = (head + n) % buffer.length;
                count -= n;
                notFull.signalAll();
                return n;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public int available() {
            lock.lock();
            try {
                return count;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            LogPipe.this.close(null);
        }
    }

    private final class Sink extends OutputStream {
        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            lock.lock();
            try {
                int written = 0;
                while (written < len) {
                    awaitRoom();
                    if (closed) {
                        throw closedException();
                    }
                    int n = Math.min(len - written, buffer.length - count);
                    int tail = (head + count) % buffer.length;
                    for (int i = 0; i < n; i++) {
                        buffer[(tail + i) % buffer.length] = b[off + written + i];
                    }
                    count += n;
                    written += n;
                    notEmpty.signalAll();
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            LogPipe.this.close(null);
        }

        private void awaitRoom() {
            if (writeTimeout == null) {
                while (count == buffer.length && !closed) {
                    notFull.awaitUninterruptibly();
                }
                return;
            }
            long remaining = writeTimeout.toNanos();
            while (count == buffer.length && !closed) {
                if (remaining <= 0L) {
                    LogPipe.this.close(new IOException("reader stalled, buffer full for " + writeTimeout));
                    return;
                }
                try {
                    remaining = notFull.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LogPipe.this.close(new IOException("interrupted waiting for the reader", e));
                    return;
                }
            }
        }
    }
}
