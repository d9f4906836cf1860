package com.example.tokenrelay.cache;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-capacity memoizing cache with least-recently-used eviction.
 *
 * <p>Values are computed by a {@link Producer} on a miss. Structural access (lookup, reorder,
 * insert, evict) is serialized by a single lock; the producer itself runs outside that lock.
 * Concurrent misses on the same key share one producer call: later callers wait for the first
 * call and receive its value or its failure. Failed computations are never stored.
 *
 * @param <K> key type, must implement {@code equals}/{@code hashCode}
 * @param <V> value type
 */
@Slf4j
public class BoundedLruCache<K, V> {

  private final Producer<K, V> producer;
  private final int maxSize;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<K, V> entries;
  private final Map<K, CompletableFuture<V>> inFlight = new HashMap<>();

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder sharedLoads = new LongAdder();
  private final LongAdder evictions = new LongAdder();
  private final LongAdder loadFailures = new LongAdder();

  public BoundedLruCache(Producer<K, V> producer, int maxSize) {
    if (maxSize < 1) {
      throw new IllegalArgumentException("maxSize must be at least 1, but was: " + maxSize);
    }
    this.producer = Objects.requireNonNull(producer, "producer");
    this.maxSize = maxSize;
    this.entries = new LinkedHashMap<>(16, 0.75f, true);
  }

  /**
   * Returns the cached value for {@code key}, computing and storing it on a miss.
   *
   * @throws RuntimeException whatever the producer threw; nothing is cached in that case
   */
  public V get(K key) {
    Objects.requireNonNull(key, "key");
    CompletableFuture<V> pending;
    boolean owner = false;

    lock.lock();
    try {
      V cached = entries.get(key);
      if (cached != null) {
        hits.increment();
        return cached;
      }
      pending = inFlight.get(key);
      if (pending == null) {
        misses.increment();
        pending = new CompletableFuture<>();
        inFlight.put(key, pending);
        owner = true;
      }
    } finally {
      lock.unlock();
    }

    return owner ? load(key, pending) : await(pending);
  }

  /**
   * Returns the cached value without computing it. A hit counts as a use.
   */
  public Optional<V> getIfPresent(K key) {
    lock.lock();
    try {
      return Optional.ofNullable(entries.get(key));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stores {@code value} under {@code key} as the most recently used entry.
   */
  public void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    lock.lock();
    try {
      entries.put(key, value);
      evictOverflow();
    } finally {
      lock.unlock();
    }
  }

  public void invalidate(K key) {
    lock.lock();
    try {
      entries.remove(key);
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      entries.clear();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int maxSize() {
    return maxSize;
  }

  /**
   * Snapshot of the cached keys, least recently used first.
   */
  public List<K> keys() {
    lock.lock();
    try {
      return List.copyOf(entries.keySet());
    } finally {
      lock.unlock();
    }
  }

  public CacheStats stats() {
    return new CacheStats(size(), maxSize, hits.sum(), misses.sum(), sharedLoads.sum(),
                          evictions.sum(), loadFailures.sum());
  }

  private V load(K key, CompletableFuture<V> pending) {
    V value;
    try {
      value = Objects.requireNonNull(producer.produce(key), "producer returned null");
    } catch (RuntimeException | Error e) {
      loadFailures.increment();
      lock.lock();
      try {
        inFlight.remove(key);
      } finally {
        lock.unlock();
      }
      pending.completeExceptionally(e);
      throw e;
    }

    lock.lock();
    try {
      entries.put(key, value);
      evictOverflow();
      inFlight.remove(key);
    } finally {
      lock.unlock();
    }
    pending.complete(value);
    return value;
  }

  private V await(CompletableFuture<V> pending) {
    try {
      V value = pending.get();
      sharedLoads.increment();
      return value;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for a pending cache load", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new CompletionException(cause);
    }
  }

  // Caller holds the lock.
  private void evictOverflow() {
    while (entries.size() > maxSize) {
      K eldest = entries.keySet().iterator().next();
      entries.remove(eldest);
      evictions.increment();
      log.debug("Evicted least recently used cache entry");
    }
  }

  /**
   * Computes the value for a missing key. May throw any unchecked exception.
   */
  @FunctionalInterface
  public interface Producer<K, V> {
    V produce(K key);
  }

  /**
   * Point-in-time counters for monitoring.
   *
   * @param sharedLoads callers that missed while another caller was loading the same key, and
   *     received that load's value
   */
  public record CacheStats(
      int size,
      int maxSize,
      long hits,
      long misses,
      long sharedLoads,
      long evictions,
      long loadFailures
  ) {}
}
