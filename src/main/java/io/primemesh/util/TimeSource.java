package io.primemesh.util;

/**
 * Clock used by the coordination core.
 *
 * <p>{@link #monotonicMillis()} measures heartbeat ages and election timeouts and
 * never jumps backwards. {@link #wallMillis()} is epoch time, used for reported
 * timestamps and for store expiry shared between processes.
 */
public interface TimeSource {
    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long monotonicMillis() {
            return System.nanoTime() / 1_000_000L;
        }

        @Override
        public long wallMillis() {
            return System.currentTimeMillis();
        }
    };

    long monotonicMillis();

    long wallMillis();
}
