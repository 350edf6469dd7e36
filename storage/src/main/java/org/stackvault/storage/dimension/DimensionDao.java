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
package org.stackvault.storage.dimension;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.stackvault.storage.cache.Cache;
import org.stackvault.storage.cache.CacheDeleteException;
import org.stackvault.storage.cache.CacheWriteException;
import org.stackvault.storage.cache.StorageException;

/**
 * Inverted index from {@code labelKey:labelValue} to the segment keys carrying that label.
 * A dimension is created by its first member and deleted together with its last member.
 */
public class DimensionDao {

    private static final Logger logger = LoggerFactory.getLogger(DimensionDao.class);

    private final Cache<Dimension> cache;

    public DimensionDao(Cache<Dimension> cache) {
        this.cache = cache;
    }

    public @Nullable Dimension lookup(String dimensionKey) throws StorageException {
        return cache.lookup(dimensionKey);
    }

    public void put(String dimensionKey, Dimension dimension) throws CacheWriteException {
        cache.put(dimensionKey, dimension);
    }

    public void delete(String dimensionKey) throws CacheDeleteException {
        cache.delete(dimensionKey);
    }

    public void addMember(String dimensionKey, String segmentKey) throws StorageException {
        Dimension dimension = cache.lookup(dimensionKey);
        if (dimension == null) {
            dimension = Dimension.empty();
        }
        Dimension updated = dimension.withMember(segmentKey);
        if (updated != dimension) {
            cache.put(dimensionKey, updated);
        }
    }

    public void removeMember(String dimensionKey, String segmentKey) throws StorageException {
        Dimension dimension = cache.lookup(dimensionKey);
        if (dimension == null) {
            return;
        }
        Dimension updated = dimension.withoutMember(segmentKey);
        if (updated.isEmpty()) {
            logger.debug("deleting dimension {} with its last member {}", dimensionKey,
                    segmentKey);
            cache.delete(dimensionKey);
        } else if (updated != dimension) {
            cache.put(dimensionKey, updated);
        }
    }

    public List<String> keys(String prefix) throws StorageException {
        return cache.keys(prefix);
    }

    public long size() {
        return cache.size();
    }

    public void dump() throws CacheWriteException {
        cache.dump();
    }

    public Cache<Dimension> getCache() {
        return cache;
    }
}
