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
package org.stackvault.storage;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

import org.stackvault.common.model.CallTree;
import org.stackvault.storage.cache.StorageException;
import org.stackvault.storage.dimension.Dimension;
import org.stackvault.storage.segment.Key;
import org.stackvault.storage.segment.Segment;

public interface ProfileRepository {

    // startTime and endTime are epoch millis, the range is [startTime, endTime)
    void put(PutInput input) throws StorageException;

    @Nullable
    GetOutput get(GetInput input) throws StorageException;

    // removes every segment, tree and dictionary of the application, unknown names are ignored
    void deleteApp(String appName) throws StorageException;

    @Nullable
    Dimension lookupAppDimension(String appName) throws StorageException;

    List<String> getAppNames() throws StorageException;

    // label names in use, including the application name label
    List<String> getKeys() throws StorageException;

    List<String> getValues(String labelKey) throws StorageException;

    @Value.Immutable
    interface PutInput {
        long startTime();
        long endTime();
        Key key();
        CallTree val();
        String spyName();
        long sampleRate();

        @Value.Check
        default void check() {
            Segment.checkRange(startTime(), endTime());
            Segment.checkSampleRate(sampleRate());
        }
    }

    @Value.Immutable
    interface GetInput {
        long startTime();
        long endTime();
        // labels of the key filter the segments of the application
        Key key();
    }

    @Value.Immutable
    interface GetOutput {
        CallTree tree();
        String spyName();
        long sampleRate();
    }
}
