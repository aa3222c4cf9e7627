package io.tasklink.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.Set;

public final class TaskLinkConfig {
    public static final String DEFAULT_DIR = "tasklink.d";
    public static final String LOG_FILE = "log.json";
    public static final String STATE_FILE = "state.json";
    public static final String OPERATOR_SOCKET = "op.sock";
    public static final int N_SEEN = 10;
    public static final Duration DEFAULT_ACCEPT_BACKOFF = Duration.ofMillis(250);
    public static final Duration DEFAULT_OPERATOR_NAME_WAIT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_STATE_WRITE_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_OPERATOR_WRITE_TIMEOUT = Duration.ofSeconds(2);
    public static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r-----");
    public static final Set<PosixFilePermission> DIR_PERMISSIONS = PosixFilePermissions.fromString("rwxr-x---");

    private final Path dir;
    private final boolean debug;
    private final Duration acceptBackoff;
    private final Duration operatorNameWait;
    private final Duration stateWriteDelay;
    private final Duration operatorWriteTimeout;

    public TaskLinkConfig(
            Path dir,
            boolean debug,
            Duration acceptBackoff,
            Duration operatorNameWait,
            Duration stateWriteDelay,
            Duration operatorWriteTimeout
    ) {
        this.dir = dir;
        this.debug = debug;
        this.acceptBackoff = acceptBackoff;
        this.operatorNameWait = operatorNameWait;
        this.stateWriteDelay = stateWriteDelay;
        this.operatorWriteTimeout = operatorWriteTimeout;
    }

    public static TaskLinkConfig fromDir(String dir) {
        return fromDir(dir, false);
    }

    public static TaskLinkConfig fromDir(String dir, boolean debug) {
        Path resolved = dir == null || dir.isBlank()
                ? Paths.get(DEFAULT_DIR)
                : Paths.get(dir);
        return new TaskLinkConfig(
                resolved.toAbsolutePath().normalize(),
                debug,
                DEFAULT_ACCEPT_BACKOFF,
                DEFAULT_OPERATOR_NAME_WAIT,
                DEFAULT_STATE_WRITE_DELAY,
                DEFAULT_OPERATOR_WRITE_TIMEOUT
        );
    }

    public TaskLinkConfig withOperatorNameWait(Duration wait) {
        return new TaskLinkConfig(dir, debug, acceptBackoff, wait, stateWriteDelay, operatorWriteTimeout);
    }

    public TaskLinkConfig withStateWriteDelay(Duration delay) {
        return new TaskLinkConfig(dir, debug, acceptBackoff, operatorNameWait, delay, operatorWriteTimeout);
    }

    public TaskLinkConfig withDebug(boolean on) {
        return new TaskLinkConfig(dir, on, acceptBackoff, operatorNameWait, stateWriteDelay, operatorWriteTimeout);
    }

    /**
     * How long a log line or goodbye may wait on an operator that is not
     * reading before that operator is disconnected.
     */
    public TaskLinkConfig withOperatorWriteTimeout(Duration timeout) {
        return new TaskLinkConfig(dir, debug, acceptBackoff, operatorNameWait, stateWriteDelay, timeout);
    }

    public Path dir() {
        return dir;
    }

    public boolean debug() {
        return debug;
    }

    public Duration acceptBackoff() {
        return acceptBackoff;
    }

    public Duration operatorNameWait() {
        return operatorNameWait;
    }

    public Duration stateWriteDelay() {
        return stateWriteDelay;
    }

    public Duration operatorWriteTimeout() {
        return operatorWriteTimeout;
    }

    public Path logFile() {
        return dir.resolve(LOG_FILE);
    }

    public Path stateFile() {
        return dir.resolve(STATE_FILE);
    }

    public Path operatorSocket() {
        return dir.resolve(OPERATOR_SOCKET);
    }
}
