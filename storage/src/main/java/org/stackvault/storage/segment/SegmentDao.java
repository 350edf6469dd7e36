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
package org.stackvault.storage.segment;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.stackvault.storage.cache.Cache;
import org.stackvault.storage.cache.CacheDeleteException;
import org.stackvault.storage.cache.CacheWriteException;
import org.stackvault.storage.cache.StorageException;

// segments keyed by segment key
public class SegmentDao {

    private final Cache<Segment> cache;

    public SegmentDao(Cache<Segment> cache) {
        this.cache = cache;
    }

    public @Nullable Segment lookup(String segmentKey) throws StorageException {
        return cache.lookup(segmentKey);
    }

    public void put(String segmentKey, Segment segment) throws CacheWriteException {
        cache.put(segmentKey, segment);
    }

    public void delete(String segmentKey) throws CacheDeleteException {
        cache.delete(segmentKey);
    }

    public long size() {
        return cache.size();
    }

    public void dump() throws CacheWriteException {
        cache.dump();
    }

    public Cache<Segment> getCache() {
        return cache;
    }
}
