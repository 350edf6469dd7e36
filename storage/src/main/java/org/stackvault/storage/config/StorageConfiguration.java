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
package org.stackvault.storage.config;

import java.io.File;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

@Value.Immutable
public abstract class StorageConfiguration {

    // null means an in-memory database
    public abstract @Nullable File dataDir();

    @Value.Default
    public int treeCacheSize() {
        return 10000;
    }

    @Value.Default
    public int dictCacheSize() {
        return 1000;
    }

    @Value.Default
    public int segmentCacheSize() {
        return 1000;
    }

    @Value.Default
    public int dimensionCacheSize() {
        return 1000;
    }

    @Value.Default
    public int queryTimeoutSeconds() {
        return 60;
    }

    @Value.Check
    void check() {
        checkPositive("treeCacheSize", treeCacheSize());
        checkPositive("dictCacheSize", dictCacheSize());
        checkPositive("segmentCacheSize", segmentCacheSize());
        checkPositive("dimensionCacheSize", dimensionCacheSize());
        if (queryTimeoutSeconds() < 0) {
            throw new IllegalStateException(
                    "queryTimeoutSeconds cannot be negative: " + queryTimeoutSeconds());
        }
    }

    private static void checkPositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalStateException(name + " must be positive: " + value);
        }
    }
}
