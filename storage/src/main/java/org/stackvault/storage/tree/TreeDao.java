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
package org.stackvault.storage.tree;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.stackvault.common.model.CallTree;
import org.stackvault.storage.cache.Cache;
import org.stackvault.storage.cache.CacheDeleteException;
import org.stackvault.storage.cache.CacheWriteException;
import org.stackvault.storage.cache.StorageException;

/**
 * Call trees keyed by {@code segmentKey:depth:bucketStartSeconds}.
 *
 * <p>Cached trees are shared with readers, so they are never modified after being stored:
 * {@link #merge(String, CallTree)} stores a merged copy.
 */
public class TreeDao {

    private final Cache<CallTree> cache;

    public TreeDao(Cache<CallTree> cache) {
        this.cache = cache;
    }

    public @Nullable CallTree lookup(String treeKey) throws StorageException {
        return cache.lookup(treeKey);
    }

    public void put(String treeKey, CallTree tree) throws CacheWriteException {
        cache.put(treeKey, tree);
    }

    // adds the samples of tree to the tree stored under treeKey, if any
    public void merge(String treeKey, CallTree tree) throws StorageException {
        CallTree existing = cache.lookup(treeKey);
        if (existing == null) {
            cache.put(treeKey, tree);
            return;
        }
        CallTree merged = existing.copy();
        merged.merge(tree);
        cache.put(treeKey, merged);
    }

    public void delete(String treeKey) throws CacheDeleteException {
        cache.delete(treeKey);
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

    public Cache<CallTree> getCache() {
        return cache;
    }
}
