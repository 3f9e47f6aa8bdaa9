package dev.newsroom.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 64-bit time-ordered id generator.
 * <pre>
 * | 1 bit unused | 41 bits millis since 2025-01-01 | 10 bits node | 12 bits sequence |
 * </pre>
 * Lock-free: the last (timestamp, sequence) pair is kept in a single {@link AtomicLong}.
 */
public final class SnowflakeId {

    static final long EPOCH_MILLIS = 1735689600000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_NODE = (1L << NODE_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;
    private static final int TIMESTAMP_SHIFT = NODE_BITS + SEQUENCE_BITS;
    private static final long MAX_BACKWARD_DRIFT_MILLIS = 5;

    private final long nodeId;
    private final AtomicLong state = new AtomicLong();

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE) {
            throw new IllegalArgumentException("Node id must be in [0, " + MAX_NODE + "], got " + nodeId);
        }
        this.nodeId = nodeId;
    }

    public long nextId() {
        while (true) {
            long now = System.currentTimeMillis() - EPOCH_MILLIS;
            long previous = state.get();
            long lastMillis = previous >>> SEQUENCE_BITS;
            long sequence = previous & MAX_SEQUENCE;

            long millis;
            if (now > lastMillis) {
                millis = now;
                sequence = 0;
            } else if (lastMillis - now > MAX_BACKWARD_DRIFT_MILLIS) {
                throw new IllegalStateException("Clock moved backwards by " + (lastMillis - now) + "ms");
            } else {
                // same millisecond, or a small backward drift: stay on the last timestamp
                millis = lastMillis;
                sequence = (sequence + 1) & MAX_SEQUENCE;
                if (sequence == 0) {
                    // sequence exhausted: wait for the clock to reach the next millisecond
                    Thread.onSpinWait();
                    continue;
                }
            }

            if (state.compareAndSet(previous, (millis << SEQUENCE_BITS) | sequence)) {
                return (millis << TIMESTAMP_SHIFT) | (nodeId << SEQUENCE_BITS) | sequence;
            }
        }
    }

    public long getNodeId() {
        return nodeId;
    }

    public static Instant createdAt(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + EPOCH_MILLIS);
    }

    public static int nodeOf(long id) {
        return (int) ((id >>> SEQUENCE_BITS) & MAX_NODE);
    }

    public static int sequenceOf(long id) {
        return (int) (id & MAX_SEQUENCE);
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
