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
package org.stackvault.storage.dict;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.stackvault.common.model.Dictionary;
import org.stackvault.storage.cache.Cache;
import org.stackvault.storage.cache.CacheDeleteException;
import org.stackvault.storage.cache.CacheWriteException;
import org.stackvault.storage.cache.StorageException;

// dictionaries keyed by application name
public class DictDao {

    private final Cache<Dictionary> cache;

    public DictDao(Cache<Dictionary> cache) {
        this.cache = cache;
    }

    public @Nullable Dictionary lookup(String appName) throws StorageException {
        return cache.lookup(appName);
    }

    public void put(String appName, Dictionary dictionary) throws CacheWriteException {
        cache.put(appName, dictionary);
    }

    public void delete(String appName) throws CacheDeleteException {
        cache.delete(appName);
    }

    public long size() {
        return cache.size();
    }

    public void dump() throws CacheWriteException {
        cache.dump();
    }

    public Cache<Dictionary> getCache() {
        return cache;
    }
}
