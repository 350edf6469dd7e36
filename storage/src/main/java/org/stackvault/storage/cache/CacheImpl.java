/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stackvault.storage.cache;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Write-back LRU cache. Modified entries stay in memory until they are evicted or until
 * {@link #dump()} is called, deletes go straight through to the durable store.
 *
 * <p>Every access to the in-memory entries and to the durable store happens under one lock
 * per cache. Guava delivers eviction notifications to the thread whose write caused the
 * eviction before that write returns, so an evicted entry is written back before any other
 * operation on the same cache can run, and a value loaded from the store can never be cached
 * after a concurrent delete of its key.
 */
public class CacheImpl<V extends /*@NonNull*/ Object> implements Cache<V>, CacheStatsMXBean {

    private static final Logger logger = LoggerFactory.getLogger(CacheImpl.class);

    private final String name;
    private final String prefix;
    private final KeyValueStore store;
    private final Codec<V> codec;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final com.google.common.cache.Cache<String, Entry<V>> entries;

    // evicted entries whose write back failed, retried by dump()
    @GuardedBy("lock")
    private final Map<String, V> pendingWrites = Maps.newHashMap();

    // write back failures happen inside guava's eviction, this hands them to the caller of put
    @GuardedBy("lock")
    private @Nullable CacheWriteException evictionFailure;

    public CacheImpl(String name, String prefix, int maximumSize, KeyValueStore store,
            Codec<V> codec) {
        checkArgument(maximumSize > 0, "maximum size must be positive: %s", maximumSize);
        this.name = name;
        this.prefix = prefix;
        this.store = store;
        this.codec = codec;
        entries = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .removalListener(new WriteBackListener())
                .build();
    }

    @Override
    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void put(String key, V value) throws CacheWriteException {
        checkNotNull(value);
        synchronized (lock) {
            pendingWrites.remove(key);
            entries.put(key, new Entry<V>(value, true));
            CacheWriteException failure = evictionFailure;
            evictionFailure = null;
            if (failure != null) {
                throw failure;
            }
        }
    }

    @Override
    public @Nullable V lookup(String key) throws CacheReadException {
        synchronized (lock) {
            Entry<V> entry = entries.getIfPresent(key);
            if (entry != null) {
                return entry.value;
            }
            V pendingValue = pendingWrites.get(key);
            if (pendingValue != null) {
                return pendingValue;
            }
            V value;
            try {
                byte[] bytes = store.get(prefix + key);
                if (bytes == null) {
                    return null;
                }
                value = codec.decode(bytes);
            } catch (Exception e) {
                throw new CacheReadException(name, key, e);
            }
            entries.put(key, new Entry<V>(value, false));
            return value;
        }
    }

    @Override
    public void delete(String key) throws CacheDeleteException {
        synchronized (lock) {
            entries.invalidate(key);
            pendingWrites.remove(key);
            try {
                store.delete(prefix + key);
            } catch (Exception e) {
                throw new CacheDeleteException(name, key, e);
            }
        }
    }

    @Override
    public long size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    @Override
    public List<String> keys(String keyPrefix) throws CacheReadException {
        Set<String> keys = Sets.newTreeSet();
        synchronized (lock) {
            for (String key : entries.asMap().keySet()) {
                if (key.startsWith(keyPrefix)) {
                    keys.add(key);
                }
            }
            for (String key : pendingWrites.keySet()) {
                if (key.startsWith(keyPrefix)) {
                    keys.add(key);
                }
            }
            try {
                for (String storeKey : store.keys(prefix + keyPrefix)) {
                    keys.add(storeKey.substring(prefix.length()));
                }
            } catch (Exception e) {
                throw new CacheReadException(name, keyPrefix + "*", e);
            }
        }
        return ImmutableList.copyOf(keys);
    }

    @Override
    public void dump() throws CacheWriteException {
        Map<String, byte[]> batch = Maps.newLinkedHashMap();
        List<Entry<V>> dumpedEntries = Lists.newArrayList();
        String key = "";
        synchronized (lock) {
            try {
                for (Map.Entry<String, V> pendingWrite : pendingWrites.entrySet()) {
                    key = pendingWrite.getKey();
                    batch.put(prefix + key, codec.encode(pendingWrite.getValue()));
                }
                for (Map.Entry<String, Entry<V>> cached : entries.asMap().entrySet()) {
                    Entry<V> entry = cached.getValue();
                    if (entry.dirty) {
                        key = cached.getKey();
                        batch.put(prefix + key, codec.encode(entry.value));
                        dumpedEntries.add(entry);
                    }
                }
                store.putAll(batch);
            } catch (Exception e) {
                throw new CacheWriteException(name, key, e);
            }
            for (Entry<V> entry : dumpedEntries) {
                entry.dirty = false;
            }
            pendingWrites.clear();
        }
        logger.debug("dumped {} entries of cache {}", batch.size(), name);
    }

    public CacheStats getStats() {
        return entries.stats();
    }

    @Override
    public long getSize() {
        return size();
    }

    @Override
    public long getRequestCount() {
        return entries.stats().requestCount();
    }

    @Override
    public long getHitCount() {
        return entries.stats().hitCount();
    }

    @Override
    public double getHitRate() {
        return entries.stats().hitRate();
    }

    @Override
    public long getMissCount() {
        return entries.stats().missCount();
    }

    @Override
    public long getEvictionCount() {
        return entries.stats().evictionCount();
    }

    @Override
    public long getPendingWriteCount() {
        synchronized (lock) {
            return pendingWrites.size();
        }
    }

    private static class Entry<V> {

        private final V value;
        // only read and written under the cache lock
        private boolean dirty;

        private Entry(V value, boolean dirty) {
            this.value = value;
            this.dirty = dirty;
        }
    }

    // runs on the thread holding the lock, inside the entries call that caused the eviction
    private class WriteBackListener implements RemovalListener<String, Entry<V>> {

        @Override
        public void onRemoval(RemovalNotification<String, Entry<V>> notification) {
            // replaced and explicitly deleted entries are not written back
            if (!notification.wasEvicted()) {
                return;
            }
            String key = notification.getKey();
            Entry<V> entry = notification.getValue();
            if (key == null || entry == null || !entry.dirty) {
                return;
            }
            synchronized (lock) {
                try {
                    store.put(prefix + key, codec.encode(entry.value));
                } catch (Exception e) {
                    logger.error("could not write back evicted entry {} of cache {}, it will be"
                            + " retried on the next dump: {}", key, name, e.getMessage(), e);
                    pendingWrites.put(key, entry.value);
                    evictionFailure = new CacheWriteException(name, key, e);
                }
            }
        }
    }
}
