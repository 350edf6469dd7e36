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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Durable byte store behind the caches. Keys carry the prefix of the cache they belong to,
 * so several caches can share one store.
 */
public interface KeyValueStore {

    @Nullable
    byte[] get(String key) throws Exception;

    void put(String key, byte[] value) throws Exception;

    void putAll(Map<String, byte[]> entries) throws Exception;

    void delete(String key) throws Exception;

    List<String> keys(String prefix) throws Exception;
}
