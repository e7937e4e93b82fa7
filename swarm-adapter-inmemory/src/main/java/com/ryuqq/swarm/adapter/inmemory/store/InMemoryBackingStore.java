package com.ryuqq.swarm.adapter.inmemory.store;

import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.spi.BackingStore;
import com.ryuqq.swarm.core.spi.MessageListener;
import com.ryuqq.swarm.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link BackingStore}.
 *
 * <p>Reference implementation for tests and single-process deployments where every
 * component shares one JVM.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>All data operations are serialized by one {@link ReentrantLock}</li>
 *   <li>Listeners live in a {@link CopyOnWriteArrayList} per channel</li>
 *   <li>Messages are delivered synchronously on the publishing thread, outside the data lock</li>
 * </ul>
 *
 * <p><strong>Expiry:</strong> lazy. Each access checks the entry deadline against the injected
 * {@link Clock}; an expired entry is removed and reported as absent.</p>
 *
 * <p><strong>Atomic batches:</strong> the batch runs while holding the lock; if it throws, the
 * data set is restored from a snapshot taken before the batch.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across processes (use the Redis adapter for process-mode agents)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class InMemoryBackingStore implements BackingStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackingStore.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, Entry> entries = new HashMap<>();
    private final Map<String, List<MessageListener>> listeners = new ConcurrentHashMap<>();

    public InMemoryBackingStore() {
        this(Clock.systemUTC());
    }

    public InMemoryBackingStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    // ============================================================
    // Strings
    // ============================================================

    @Override
    public Optional<String> get(String key) {
        requireKey(key);
        lock.lock();
        try {
            Entry entry = live(key);
            return entry == null ? Optional.empty() : Optional.of(asString(key, entry));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value) {
        requireKey(key);
        requireValue(value);
        lock.lock();
        try {
            entries.put(key, new Entry(value, null));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        requireTtl(ttl);
        lock.lock();
        try {
            entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        requireTtl(ttl);
        lock.lock();
        try {
            if (live(key) != null) {
                return false;
            }
            entries.put(key, new Entry(value, clock.instant().plus(ttl)));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long delete(String... keys) {
        lock.lock();
        try {
            long removed = 0;
            for (String key : keys) {
                requireKey(key);
                if (live(key) != null) {
                    entries.remove(key);
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);
        lock.lock();
        try {
            return live(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requireKey(key);
        requireTtl(ttl);
        lock.lock();
        try {
            Entry entry = live(key);
            if (entry == null) {
                return false;
            }
            entry.expiresAt = clock.instant().plus(ttl);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long increment(String key, long delta) {
        requireKey(key);
        lock.lock();
        try {
            Entry entry = live(key);
            long current = 0;
            if (entry != null) {
                try {
                    current = Long.parseLong(asString(key, entry));
                } catch (NumberFormatException e) {
                    throw new StoreException("Value at " + key + " is not an integer", e);
                }
            }
            long next = current + delta;
            Instant expiresAt = entry == null ? null : entry.expiresAt;
            entries.put(key, new Entry(Long.toString(next), expiresAt));
            return next;
        } finally {
            lock.unlock();
        }
    }

    // ============================================================
    // Hashes
    // ============================================================

    @Override
    public void hashSet(String key, Map<String, String> fields) {
        requireKey(key);
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        lock.lock();
        try {
            hash(key, true).putAll(fields);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> hashGet(String key, String field) {
        requireKey(key);
        lock.lock();
        try {
            Map<String, String> hash = hash(key, false);
            return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> hashGetAll(String key) {
        requireKey(key);
        lock.lock();
        try {
            Map<String, String> hash = hash(key, false);
            return hash == null ? Map.of() : new LinkedHashMap<>(hash);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long hashDelete(String key, String... fields) {
        requireKey(key);
        lock.lock();
        try {
            Map<String, String> hash = hash(key, false);
            if (hash == null) {
                return 0;
            }
            long removed = 0;
            for (String field : fields) {
                if (hash.remove(field) != null) {
                    removed++;
                }
            }
            dropIfEmpty(key, hash.isEmpty());
            return removed;
        } finally {
            lock.unlock();
        }
    }

    // ============================================================
    // Sets
    // ============================================================

    @Override
    public long setAdd(String key, String... members) {
        requireKey(key);
        lock.lock();
        try {
            Set<String> set = set(key, true);
            long added = 0;
            for (String member : members) {
                requireValue(member);
                if (set.add(member)) {
                    added++;
                }
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long setRemove(String key, String... members) {
        requireKey(key);
        lock.lock();
        try {
            Set<String> set = set(key, false);
            if (set == null) {
                return 0;
            }
            long removed = 0;
            for (String member : members) {
                if (set.remove(member)) {
                    removed++;
                }
            }
            dropIfEmpty(key, set.isEmpty());
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> setMembers(String key) {
        requireKey(key);
        lock.lock();
        try {
            Set<String> set = set(key, false);
            return set == null ? Set.of() : new LinkedHashSet<>(set);
        } finally {
            lock.unlock();
        }
    }

    // ============================================================
    // Lists
    // ============================================================

    @Override
    public long listPush(String key, String... values) {
        requireKey(key);
        lock.lock();
        try {
            LinkedList<String> list = list(key, true);
            for (String value : values) {
                requireValue(value);
                list.addFirst(value);
            }
            return list.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void listTrim(String key, long start, long stop) {
        requireKey(key);
        lock.lock();
        try {
            LinkedList<String> list = list(key, false);
            if (list == null) {
                return;
            }
            List<String> kept = slice(list, start, stop);
            list.clear();
            list.addAll(kept);
            dropIfEmpty(key, list.isEmpty());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> listRange(String key, long start, long stop) {
        requireKey(key);
        lock.lock();
        try {
            LinkedList<String> list = list(key, false);
            return list == null ? List.of() : slice(list, start, stop);
        } finally {
            lock.unlock();
        }
    }

    // ============================================================
    // Pub/Sub
    // ============================================================

    @Override
    public long publish(String channel, String message) {
        requireKey(channel);
        requireValue(message);
        List<MessageListener> subscribers = listeners.getOrDefault(channel, List.of());
        long delivered = 0;
        for (MessageListener listener : subscribers) {
            try {
                listener.onMessage(channel, message);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Listener on channel {} failed", channel, e);
            }
        }
        return delivered;
    }

    @Override
    public Subscription subscribe(String channel, MessageListener listener) {
        requireKey(channel);
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.computeIfAbsent(channel, ignored -> new CopyOnWriteArrayList<>()).add(listener);
        return new InMemorySubscription(channel, listener);
    }

    // ============================================================
    // Batching
    // ============================================================

    @Override
    public void executeAtomically(Consumer<BackingStore> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        lock.lock();
        try {
            Map<String, Entry> snapshot = deepCopy(entries);
            try {
                batch.accept(this);
            } catch (RuntimeException e) {
                entries = snapshot;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 데이터와 구독을 제거 (테스트용).
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        listeners.clear();
    }

    // ============================================================
    // Internals (lock held)
    // ============================================================

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private String asString(String key, Entry entry) {
        if (entry.string == null) {
            throw wrongType(key, "string");
        }
        return entry.string;
    }

    private Map<String, String> hash(String key, boolean create) {
        Entry entry = live(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            Entry created = Entry.ofHash(new LinkedHashMap<>());
            entries.put(key, created);
            return created.hash;
        }
        if (entry.hash == null) {
            throw wrongType(key, "hash");
        }
        return entry.hash;
    }

    private Set<String> set(String key, boolean create) {
        Entry entry = live(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            Entry created = Entry.ofSet(new LinkedHashSet<>());
            entries.put(key, created);
            return created.set;
        }
        if (entry.set == null) {
            throw wrongType(key, "set");
        }
        return entry.set;
    }

    private LinkedList<String> list(String key, boolean create) {
        Entry entry = live(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            Entry created = Entry.ofList(new LinkedList<>());
            entries.put(key, created);
            return created.list;
        }
        if (entry.list == null) {
            throw wrongType(key, "list");
        }
        return entry.list;
    }

    private void dropIfEmpty(String key, boolean empty) {
        if (empty) {
            entries.remove(key);
        }
    }

    private static List<String> slice(List<String> list, long start, long stop) {
        int size = list.size();
        long from = start < 0 ? Math.max(0, size + start) : start;
        long to = stop < 0 ? size + stop : Math.min(stop, size - 1L);
        if (from > to || from >= size) {
            return new ArrayList<>();
        }
        return new ArrayList<>(list.subList((int) from, (int) to + 1));
    }

    private static Map<String, Entry> deepCopy(Map<String, Entry> source) {
        Map<String, Entry> copy = new HashMap<>();
        source.forEach((key, entry) -> copy.put(key, entry.copy()));
        return copy;
    }

    private static StoreException wrongType(String key, String expected) {
        return new StoreException("WRONGTYPE key " + key + " does not hold a " + expected);
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
    }

    private static void requireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    /**
     * 저장 항목 (값 + 만료 시각). 네 값 중 정확히 하나만 null이 아닙니다.
     */
    private static final class Entry {

        private final String string;
        private final Map<String, String> hash;
        private final Set<String> set;
        private final LinkedList<String> list;
        private Instant expiresAt;

        private Entry(String string, Instant expiresAt) {
            this(string, null, null, null, expiresAt);
        }

        private Entry(
            String string,
            Map<String, String> hash,
            Set<String> set,
            LinkedList<String> list,
            Instant expiresAt
        ) {
            this.string = string;
            this.hash = hash;
            this.set = set;
            this.list = list;
            this.expiresAt = expiresAt;
        }

        private static Entry ofHash(Map<String, String> hash) {
            return new Entry(null, hash, null, null, null);
        }

        private static Entry ofSet(Set<String> set) {
            return new Entry(null, null, set, null, null);
        }

        private static Entry ofList(LinkedList<String> list) {
            return new Entry(null, null, null, list, null);
        }

        private Entry copy() {
            return new Entry(
                string,
                hash == null ? null : new LinkedHashMap<>(hash),
                set == null ? null : new LinkedHashSet<>(set),
                list == null ? null : new LinkedList<>(list),
                expiresAt
            );
        }
    }

    private final class InMemorySubscription implements Subscription {

        private final String channel;
        private final MessageListener listener;
        private final AtomicBoolean closed = new AtomicBoolean();

        private InMemorySubscription(String channel, MessageListener listener) {
            this.channel = channel;
            this.listener = listener;
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                List<MessageListener> subscribers = listeners.get(channel);
                if (subscribers != null) {
                    subscribers.remove(listener);
                }
            }
        }
    }
}
