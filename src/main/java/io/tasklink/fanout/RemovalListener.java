package io.tasklink.fanout;

/**
 * Told when a destination leaves a {@link FanoutWriter}.
 */
@FunctionalInterface
public interface RemovalListener {
    /**
     * @param cause the write failure that caused the removal, or {@code null}
     *              when the destination was removed with {@link FanoutWriter#remove}
     */
    void removed(Throwable cause);
}
