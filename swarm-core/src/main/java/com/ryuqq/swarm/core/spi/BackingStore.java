package com.ryuqq.swarm.core.spi;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Shared backing store SPI.
 *
 * <p>A namespaced key-value store with hash, set and list containers, TTL-based expiry
 * and publish-subscribe channels. It is the substrate all cross-process state rides on and
 * is consumed exclusively through the Memory Coordinator.</p>
 *
 * <p><strong>Key Responsibilities:</strong></p>
 * <ul>
 *   <li>String values with optional time-to-live</li>
 *   <li>Hash, set and list containers</li>
 *   <li>Atomic counters</li>
 *   <li>Per-channel publish / subscribe</li>
 *   <li>Explicitly batched atomic writes</li>
 * </ul>
 *
 * <p><strong>Consistency Model:</strong></p>
 * <ul>
 *   <li>Last-writer-wins per key</li>
 *   <li>Read-after-write of the same key is immediate within one process</li>
 *   <li>No multi-key transaction unless writes are batched with {@link #executeAtomically(Consumer)}</li>
 *   <li>An expired key is invisible to every read operation</li>
 * </ul>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>Connectivity and protocol failures surface as
 *       {@link com.ryuqq.swarm.core.error.StoreException}</li>
 *   <li>Null keys or values raise {@link IllegalArgumentException}</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface BackingStore {

    // ============================================================
    // Strings
    // ============================================================

    /**
     * Reads a string value.
     *
     * @param key key
     * @return value, or empty when absent or expired
     */
    Optional<String> get(String key);

    /**
     * Writes a string value without expiry (clears any previous TTL).
     *
     * @param key key
     * @param value value
     */
    void set(String key, String value);

    /**
     * Writes a string value that expires after {@code ttl}.
     *
     * @param key key
     * @param value value
     * @param ttl time-to-live (must be positive)
     */
    void set(String key, String value, Duration ttl);

    /**
     * Writes a string value only when the key is absent.
     *
     * @param key key
     * @param value value
     * @param ttl time-to-live (must be positive)
     * @return true if written, false if the key already existed
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Deletes keys of any type.
     *
     * @param keys keys to delete
     * @return number of keys that existed
     */
    long delete(String... keys);

    /**
     * Checks whether a key of any type exists.
     *
     * @param key key
     * @return true when present and not expired
     */
    boolean exists(String key);

    /**
     * Sets a time-to-live on an existing key of any type.
     *
     * @param key key
     * @param ttl time-to-live (must be positive)
     * @return true if the key existed
     */
    boolean expire(String key, Duration ttl);

    /**
     * Atomically adds {@code delta} to an integer value (missing key counts as 0).
     *
     * @param key key
     * @param delta increment
     * @return value after the increment
     */
    long increment(String key, long delta);

    // ============================================================
    // Hashes
    // ============================================================

    /**
     * Writes hash fields (existing fields are replaced, others kept).
     *
     * @param key hash key
     * @param fields field → value
     */
    void hashSet(String key, Map<String, String> fields);

    /**
     * Reads one hash field.
     *
     * @param key hash key
     * @param field field
     * @return value, or empty when absent
     */
    Optional<String> hashGet(String key, String field);

    /**
     * Reads every hash field.
     *
     * @param key hash key
     * @return field → value (empty map when absent)
     */
    Map<String, String> hashGetAll(String key);

    /**
     * Deletes hash fields.
     *
     * @param key hash key
     * @param fields fields to delete
     * @return number of fields removed
     */
    long hashDelete(String key, String... fields);

    // ============================================================
    // Sets
    // ============================================================

    /**
     * Adds set members.
     *
     * @param key set key
     * @param members members
     * @return number of members newly added
     */
    long setAdd(String key, String... members);

    /**
     * Removes set members.
     *
     * @param key set key
     * @param members members
     * @return number of members removed
     */
    long setRemove(String key, String... members);

    /**
     * Reads every set member.
     *
     * @param key set key
     * @return members (empty when absent)
     */
    Set<String> setMembers(String key);

    // ============================================================
    // Lists
    // ============================================================

    /**
     * Prepends values to a list (head insert, like LPUSH).
     *
     * @param key list key
     * @param values values, pushed left to right
     * @return list length after the push
     */
    long listPush(String key, String... values);

    /**
     * Trims a list to the inclusive range {@code [start, stop]}.
     *
     * <p>Negative indices count from the tail (-1 is the last element).</p>
     *
     * @param key list key
     * @param start start index
     * @param stop stop index (inclusive)
     */
    void listTrim(String key, long start, long stop);

    /**
     * Reads the inclusive range {@code [start, stop]} of a list.
     *
     * @param key list key
     * @param start start index
     * @param stop stop index (inclusive, negative counts from the tail)
     * @return elements in list order
     */
    List<String> listRange(String key, long start, long stop);

    // ============================================================
    // Pub/Sub
    // ============================================================

    /**
     * Publishes a message on a channel.
     *
     * @param channel channel name
     * @param message message
     * @return number of listeners that received it (best effort)
     */
    long publish(String channel, String message);

    /**
     * Subscribes to a channel.
     *
     * @param channel channel name
     * @param listener callback, invoked for every message published after subscription
     * @return handle that cancels the subscription when closed
     */
    Subscription subscribe(String channel, MessageListener listener);

    // ============================================================
    // Batching
    // ============================================================

    /**
     * Runs a batch of writes atomically.
     *
     * <p>The batch receives a store view whose writes are applied all-or-nothing and are never
     * interleaved with other writers. Reads inside the batch are implementation specific
     * (Redis queues them and returns no data) and should not be relied upon.</p>
     *
     * @param batch write batch
     */
    void executeAtomically(Consumer<BackingStore> batch);
}
