package io.tasklink.persist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasklink.util.Hashing;
import io.tasklink.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns one document of type {@code T}, guards it with a reader/writer lock and
 * mirrors it to a JSON file.
 *
 * <p>Readers bracket access with {@link #acquireShared()} and
 * {@link #releaseShared()}. Writers call {@link #acquireExclusive()}, change
 * {@link #document()}, then {@link #release()} or {@link #releaseAndWriteNow()}.
 * Every write serializes the document and skips the disk entirely when the
 * content hash matches the last successful write.
 *
 * <p>With a nonzero write delay, {@link #release()} starts a single deadline
 * and returns at once; further releases before it fires join the same
 * deadline rather than extending it. When it fires the document is written as
 * it stands then. A crash before that loses the changes made in the window.
 * {@link #releaseAndWriteNow()} cancels any pending deadline and writes
 * immediately.
 *
 * <p>With no file configured the manager is purely in memory: releases
 * succeed without writing, and {@link #reloadFromDisk()} and
 * {@link #flush()} throw {@link NoFileException}.
 */
public final class PersistenceManager<T> implements AutoCloseable {
    public static final Set<PosixFilePermission> DEFAULT_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r-----");

    private final JavaType type;
    private final Supplier<T> zero;
    private final Options options;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock lock;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong diskWrites;
    private final AtomicLong skippedWrites;

    /* Guarded by the write lock. */
    private T document;
    private String lastHash;
    private WriteState writeState;
    private ScheduledFuture<?> pendingWrite;
    private long pendingTicket;

    private PersistenceManager(JavaType type, Supplier<T> zero, Options options) {
        this.type = type;
        this.zero = zero;
        this.options = options;
        this.mapper = Jsons.mapper();
        this.lock = new ReentrantReadWriteLock();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "tasklink-persist-writer");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
        this.diskWrites = new AtomicLong(0L);
        this.skippedWrites = new AtomicLong(0L);
        this.lastHash = "";
        this.writeState = WriteState.CLEAN;
    }

    /**
     * Opens a manager. An existing, non-empty file is decoded into the initial
     * document; otherwise the document starts as {@code zero.get()}. The
     * document is then written straight back, which checks the file is
     * writable and sets the baseline hash.
     *
     * @throws PersistenceException if the file cannot be decoded or written
     */
    public static <T> PersistenceManager<T> open(Class<T> type, Supplier<T> zero, Options options) {
        PersistenceManager<T> manager = new PersistenceManager<>(
                Jsons.mapper().getTypeFactory().constructType(type),
                zero,
                options == null ? Options.inMemory() : options
        );
        try {
            manager.initialize();
        } catch (PersistenceException e) {
            manager.scheduler.shutdownNow();
            throw e;
        }
        return manager;
    }

    private void initialize() {
        if (!hasFile()) {
            document = zero.get();
            return;
        }
        serialize(zero.get());
        reloadFromDisk();
        lock.writeLock().lock();
        try {
            writeLocked();
        } catch (PersistenceException e) {
            throw new PersistenceException("initial write: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void acquireShared() {
        lock.readLock().lock();
    }

    public void releaseShared() {
        lock.readLock().unlock();
    }

    public void acquireExclusive() {
        lock.writeLock().lock();
    }

    /**
     * The managed document. Only valid while the caller holds the lock, and
     * only to be changed under the exclusive lock.
     */
    public T document() {
        if (lock.getReadHoldCount() == 0 && !lock.isWriteLockedByCurrentThread()) {
            throw new IllegalMonitorStateException("document accessed without holding the lock");
        }
        return document;
    }

    /**
     * Releases the exclusive lock. With no write delay the document is written
     * before returning, and a failure is both thrown and passed to the error
     * callback. With a delay, the write happens when the pending deadline
     * fires and failures only reach the error callback.
     */
    public void release() {
        requireExclusive();
        if (!hasFile()) {
            lock.writeLock().unlock();
            return;
        }
        if (options.writeDelay().isZero()) {
            releaseAndWriteNow();
            return;
        }
        try {
            if (writeState == WriteState.CLEAN) {
                long ticket = ++pendingTicket;
                writeState = WriteState.PENDING;
                pendingWrite = scheduler.schedule(
                        () -> deadlineFired(ticket),
                        options.writeDelay().toNanos(),
                        TimeUnit.NANOSECONDS
                );
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Releases the exclusive lock after writing the document, cancelling any
     * pending delayed write.
     */
    public void releaseAndWriteNow() {
        requireExclusive();
        try {
            cancelPending();
            if (!hasFile()) {
                return;
            }
            writeState = WriteState.WRITING;
            try {
                writeLocked();
            } catch (PersistenceException e) {
                report(e);
                throw e;
            } finally {
                writeState = WriteState.CLEAN;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the document with the file's contents.
     */
    public void reloadFromDisk() {
        if (!hasFile()) {
            throw new NoFileException();
        }
        lock.writeLock().lock();
        try {
            document = load();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes the document now if it changed, cancelling any pending delayed
     * write.
     */
    public void flush() {
        if (!hasFile()) {
            throw new NoFileException();
        }
        acquireExclusive();
        releaseAndWriteNow();
    }

    public Path file() {
        return options.file();
    }

    public long diskWrites() {
        return diskWrites.get();
    }

    public long skippedWrites() {
        return skippedWrites.get();
    }

    public boolean writePending() {
        lock.readLock().lock();
        try {
            return writeState == WriteState.PENDING;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Flushes a pending write, if a file is configured, and stops the
     * background writer.
     */
    @Override
    public void close() {
        try {
            if (hasFile()) {
                flush();
            }
        } finally {
            scheduler.shutdown();
        }
    }

    private void deadlineFired(long ticket) {
        lock.writeLock().lock();
        try {
            // Superseded by releaseAndWriteNow, possibly followed by a newer deadline.
            if (writeState != WriteState.PENDING || pendingTicket != ticket) {
                return;
            }
            writeState = WriteState.WRITING;
            pendingWrite = null;
            try {
                writeLocked();
            } catch (PersistenceException e) {
                report(e);
            } finally {
                writeState = WriteState.CLEAN;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void cancelPending() {
        if (pendingWrite != null) {
            pendingWrite.cancel(false);
            pendingWrite = null;
        }
        pendingTicket++;
        writeState = WriteState.CLEAN;
    }

    private void writeLocked() {
        byte[] content = serialize(document);
        String hash = Hashing.sha256Hex(content);
        if (hash.equals(lastHash)) {
            skippedWrites.incrementAndGet();
            return;
        }
        Path file = options.file();
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.deleteIfExists(tmp);
            try (FileChannel channel = FileChannel.open(tmp, Set.<OpenOption>of(
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE
            ), permissionAttributes(tmp))) {
                ByteBuffer buf = ByteBuffer.wrap(content);
                while (buf.hasRemaining()) {
                    channel.write(buf);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("writing " + file + ": " + e.getMessage(), e);
        }
        lastHash = hash;
        diskWrites.incrementAndGet();
    }

    private T load() {
        Path file = options.file();
        try {
            if (!Files.exists(file) || Files.size(file) == 0L) {
                return zero.get();
            }
            T loaded = mapper.readValue(file.toFile(), type);
            return loaded == null ? zero.get() : loaded;
        } catch (IOException e) {
            throw new PersistenceException("loading " + file + ": " + e.getMessage(), e);
        }
    }

    private byte[] serialize(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("cannot marshal " + type.getRawClass().getSimpleName() + " to JSON", e);
        }
    }

    private FileAttribute<?>[] permissionAttributes(Path path) {
        if (!path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return new FileAttribute<?>[0];
        }
        return new FileAttribute<?>[]{PosixFilePermissions.asFileAttribute(options.filePermissions())};
    }

    private void report(PersistenceException e) {
        Consumer<PersistenceException> onError = options.onError();
        if (onError == null) {
            return;
        }
        try {
            scheduler.execute(() -> onError.accept(e));
        } catch (RejectedExecutionException rejected) {
            onError.accept(e);
        }
    }

    private void requireExclusive() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalMonitorStateException("release without acquireExclusive");
        }
    }

    private boolean hasFile() {
        return options.file() != null;
    }

    private enum WriteState {
        CLEAN,
        PENDING,
        WRITING
    }

    /**
     * @param file            backing file, or {@code null} to stay in memory
     * @param filePermissions used when the file is created
     * @param writeDelay      debounce window for {@link #release()}; zero writes synchronously
     * @param onError         told about write failures, on the manager's background thread
     */
    public record Options(
            Path file,
            Set<PosixFilePermission> filePermissions,
            Duration writeDelay,
            Consumer<PersistenceException> onError
    ) {
        public Options {
            filePermissions = filePermissions == null || filePermissions.isEmpty()
                    ? DEFAULT_FILE_PERMISSIONS
                    : Set.copyOf(filePermissions);
            writeDelay = writeDelay == null || writeDelay.isNegative() ? Duration.ZERO : writeDelay;
        }

        public static Options inMemory() {
            return new Options(null, null, Duration.ZERO, null);
        }

        public static Options of(Path file) {
            return new Options(file, null, Duration.ZERO, null);
        }

        public Options withWriteDelay(Duration delay) {
            return new Options(file, filePermissions, delay, onError);
        }

        public Options withFilePermissions(Set<PosixFilePermission> permissions) {
            return new Options(file, permissions, writeDelay, onError);
        }

        public Options withOnError(Consumer<PersistenceException> callback) {
            return new Options(file, filePermissions, writeDelay, callback);
        }
    }
}
