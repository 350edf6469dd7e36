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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bounded, LRU evicting map from string keys to values, backed by a {@link KeyValueStore}.
 * Single key operations are thread safe.
 */
public interface Cache<V extends /*@NonNull*/ Object> {

    String getName();

    void put(String key, V value) throws CacheWriteException;

    @Nullable
    V lookup(String key) throws StorageException;

    void delete(String key) throws CacheDeleteException;

    // number of entries resident in memory
    long size();

    // keys in memory and in the durable store that start with the prefix, sorted
    List<String> keys(String prefix) throws StorageException;

    // writes every modified entry to the durable store
    void dump() throws CacheWriteException;
}
