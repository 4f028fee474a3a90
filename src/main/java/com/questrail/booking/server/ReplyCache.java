package com.questrail.booking.server;

import com.questrail.booking.internal.time.MonotonicClock;
import com.questrail.booking.model.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * ReplyCache
 * =============================================================================
 * Duplicate-suppression table for non-idempotent requests.
 *
 * <p>Maps a {@link RequestId} to the encoded reply produced by its first
 * execution. A retransmission of the same request is answered with those
 * exact bytes instead of being executed again, which gives at-most-once
 * semantics as long as the entry is retained.</p>
 *
 * <h2>In-flight duplicates</h2>
 * The entry is created before the first execution starts. A duplicate that
 * arrives while the first execution is still running waits for its reply
 * rather than executing a second time.
 *
 * <h2>Bounds</h2>
 * Entries are evicted once older than the retention window (checked lazily on
 * every access and by {@link #purgeExpired()}) and, oldest first, once the
 * table exceeds its capacity. Capacity eviction never removes an entry whose
 * execution is still running, so the table may briefly exceed its capacity
 * while that many requests are in flight. The retention window should
 * comfortably exceed the longest time a client keeps retransmitting one
 * request.
 */
public final class ReplyCache
{
    private static final Logger log = LoggerFactory.getLogger(ReplyCache.class);

    /**
     * Outcome of {@link #resolve}.
     *
     * @param reply    encoded reply to send
     * @param replayed {@code true} when the reply came from an earlier execution
     */
    public record Resolution(byte[] reply, boolean replayed) { }

    private record Entry(CompletableFuture<byte[]> reply, long insertedAtNanos) { }

    private final boolean enabled;
    private final Duration retention;
    private final int capacity;
    private final MonotonicClock clock;

    private final Object lock = new Object();
    private final LinkedHashMap<RequestId, Entry> entries = new LinkedHashMap<>();

    public ReplyCache(Duration retention, int capacity, MonotonicClock clock)
    {
        this(true, retention, capacity, clock);
    }

    private ReplyCache(boolean enabled, Duration retention, int capacity, MonotonicClock clock)
    {
        this.enabled = enabled;
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be > 0");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * A cache that never remembers anything: every delivery executes.
     */
    public static ReplyCache disabled(MonotonicClock clock)
    {
        return new ReplyCache(false, Duration.ofSeconds(1), 1, clock);
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    /**
     * Returns the reply recorded for {@code id}, or runs {@code execution},
     * records its result and returns it.
     *
     * <p>If {@code execution} throws, nothing is recorded, the exception
     * propagates, and duplicates waiting on this execution fail with it.</p>
     */
    public Resolution resolve(RequestId id, Supplier<byte[]> execution)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(execution, "execution");

        if (!enabled) {
            return new Resolution(execution.get(), false);
        }

        Entry existing;
        Entry mine = null;
        synchronized (lock) {
            long now = clock.nowNanos();
            evictExpiredLocked(now);
            existing = entries.get(id);
            if (existing == null) {
                mine = new Entry(new CompletableFuture<>(), now);
                entries.put(id, mine);
                evictOverflowLocked(now);
            }
        }

        if (existing != null) {
            log.debug("Replaying cached reply for {}", id);
            return new Resolution(existing.reply().join(), true);
        }

        try {
            byte[] reply = execution.get();
            mine.reply().complete(reply);
            return new Resolution(reply, false);
        } catch (RuntimeException | Error e) {
            synchronized (lock) {
                entries.remove(id, mine);
            }
            mine.reply().completeExceptionally(e);
            throw e;
        }
    }

    /**
     * @return number of entries evicted
     */
    public int purgeExpired()
    {
        synchronized (lock) {
            return evictExpiredLocked(clock.nowNanos());
        }
    }

    public int size()
    {
        synchronized (lock) {
            return entries.size();
        }
    }

    private int evictExpiredLocked(long now)
    {
        long retentionNanos = retention.toNanos();
        int evicted = 0;
        Iterator<Map.Entry<RequestId, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Entry e = it.next().getValue();
            if (now - e.insertedAtNanos() < retentionNanos) {
                break; // insertion order: the rest are younger
            }
            it.remove();
            evicted++;
        }
        return evicted;
    }

    private void evictOverflowLocked(long now)
    {
        long retentionNanos = retention.toNanos();
        Iterator<Map.Entry<RequestId, Entry>> it = entries.entrySet().iterator();
        while (entries.size() > capacity && it.hasNext()) {
            Map.Entry<RequestId, Entry> eldest = it.next();
            Entry e = eldest.getValue();
            if (!e.reply().isDone()) {
                continue; // still executing; its duplicates wait on this entry
            }
            it.remove();
            if (now - e.insertedAtNanos() < retentionNanos) {
                log.warn("Reply cache full; evicted {} inside its retention window, a retransmission would execute again",
                        eldest.getKey());
            }
            else {
                log.debug("Reply cache full; evicted {}", eldest.getKey());
            }
        }
    }
}
