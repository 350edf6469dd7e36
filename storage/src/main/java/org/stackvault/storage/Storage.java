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
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.stackvault.common.model.CallTree;
import org.stackvault.storage.cache.StorageException;
import org.stackvault.storage.dict.DictDao;
import org.stackvault.storage.dimension.Dimension;
import org.stackvault.storage.dimension.DimensionDao;
import org.stackvault.storage.segment.InvalidKeyException;
import org.stackvault.storage.segment.Key;
import org.stackvault.storage.segment.Segment;
import org.stackvault.storage.segment.Segment.Bucket;
import org.stackvault.storage.segment.SegmentDao;
import org.stackvault.storage.tree.TreeDao;

/**
 * Keeps the tree, dictionary, segment and dimension indices consistent with each other.
 *
 * <p>Mutations ({@link #put(PutInput)} and {@link #deleteApp(String)}) are serialized by a
 * single write lock. Reads do not take the lock and may observe a mutation that is only
 * partially applied.
 */
public class Storage implements ProfileRepository {

    private static final Logger logger = LoggerFactory.getLogger(Storage.class);

    private static final String APP_DIMENSION_PREFIX = Key.appDimensionKey("");

    private final TreeDao treeDao;
    private final DictDao dictDao;
    private final SegmentDao segmentDao;
    private final DimensionDao dimensionDao;

    private final Object writeLock = new Object();

    public Storage(TreeDao treeDao, DictDao dictDao, SegmentDao segmentDao,
            DimensionDao dimensionDao) {
        this.treeDao = treeDao;
        this.dictDao = dictDao;
        this.segmentDao = segmentDao;
        this.dimensionDao = dimensionDao;
    }

    @Override
    public void put(PutInput input) throws StorageException {
        synchronized (writeLock) {
            Key key = input.key();
            String segmentKey = key.segmentKey();
            Segment segment = segmentDao.lookup(segmentKey);
            if (segment == null) {
                segment = new Segment(input.spyName(), input.sampleRate());
                // stored before any dimension can name it
                segmentDao.put(segmentKey, segment);
            }
            for (String dimensionKey : key.dimensionKeys()) {
                dimensionDao.addMember(dimensionKey, segmentKey);
            }
            try {
                segment.put(input.startTime(), input.endTime(),
                        new TreeWriter(segmentKey, input.val()));
            } catch (StorageException e) {
                // keep the presence of the buckets written before the failure
                try {
                    segmentDao.put(segmentKey, segment);
                } catch (StorageException f) {
                    e.addSuppressed(f);
                }
                throw e;
            }
            segmentDao.put(segmentKey, segment);
        }
    }

    @Override
    public @Nullable GetOutput get(GetInput input) throws StorageException {
        Key key = input.key();
        List<Dimension> dimensions = Lists.newArrayList();
        for (String dimensionKey : key.dimensionKeys()) {
            Dimension dimension = dimensionDao.lookup(dimensionKey);
            if (dimension == null) {
                return null;
            }
            dimensions.add(dimension);
        }
        CallTree result = new CallTree();
        String spyName = null;
        long sampleRate = 0;
        for (String segmentKey : Dimension.intersect(dimensions)) {
            Segment segment = segmentDao.lookup(segmentKey);
            if (segment == null) {
                // deleted concurrently
                continue;
            }
            if (spyName == null) {
                spyName = segment.getSpyName();
                sampleRate = segment.getSampleRate();
            }
            segment.get(input.startTime(), input.endTime(), new TreeReader(segmentKey, result));
        }
        if (spyName == null) {
            return null;
        }
        return ImmutableGetOutput.builder()
                .tree(result)
                .spyName(spyName)
                .sampleRate(sampleRate)
                .build();
    }

    @Override
    public void deleteApp(String appName) throws StorageException {
        synchronized (writeLock) {
            Dimension appDimension = dimensionDao.lookup(Key.appDimensionKey(appName));
            if (appDimension == null) {
                logger.debug("application not found, nothing to delete: {}", appName);
                return;
            }
            for (String segmentKey : appDimension.getMembers()) {
                deleteSegment(segmentKey);
            }
            dictDao.delete(appName);
            logger.debug("deleted application {} with {} segments", appName,
                    appDimension.size());
        }
    }

    @Override
    public @Nullable Dimension lookupAppDimension(String appName) throws StorageException {
        return dimensionDao.lookup(Key.appDimensionKey(appName));
    }

    @Override
    public List<String> getAppNames() throws StorageException {
        return stripPrefix(dimensionDao.keys(APP_DIMENSION_PREFIX), APP_DIMENSION_PREFIX);
    }

    @Override
    public List<String> getKeys() throws StorageException {
        Set<String> labelKeys = Sets.newTreeSet();
        for (String dimensionKey : dimensionDao.keys("")) {
            int index = dimensionKey.indexOf(':');
            if (index != -1) {
                labelKeys.add(dimensionKey.substring(0, index));
            }
        }
        return ImmutableList.copyOf(labelKeys);
    }

    @Override
    public List<String> getValues(String labelKey) throws StorageException {
        String prefix = Key.dimensionKey(labelKey, "");
        return stripPrefix(dimensionDao.keys(prefix), prefix);
    }

    // writes every modified entry of the four indices to the durable store
    public void dump() throws StorageException {
        treeDao.dump();
        dictDao.dump();
        segmentDao.dump();
        dimensionDao.dump();
    }

    private void deleteSegment(String segmentKey) throws StorageException {
        Segment segment = segmentDao.lookup(segmentKey);
        if (segment != null) {
            for (Bucket bucket : segment.getPresentBuckets()) {
                treeDao.delete(Key.treeKey(segmentKey, bucket.depth(), bucket.start()));
            }
        }
        // trees that the segment does not know about, e.g. when the segment was never stored
        for (String treeKey : treeDao.keys(Key.treeKeyPrefix(segmentKey))) {
            treeDao.delete(treeKey);
        }
        segmentDao.delete(segmentKey);
        Key key;
        try {
            key = Key.parse(segmentKey);
        } catch (InvalidKeyException e) {
            // segment keys are only ever produced by Key.segmentKey()
            throw new IllegalStateException(e);
        }
        for (String dimensionKey : key.dimensionKeys()) {
            dimensionDao.removeMember(dimensionKey, segmentKey);
        }
    }

    private static ImmutableList<String> stripPrefix(List<String> keys, String prefix) {
        ImmutableList.Builder<String> stripped = ImmutableList.builder();
        for (String key : keys) {
            stripped.add(key.substring(prefix.length()));
        }
        return stripped.build();
    }

    private class TreeWriter implements Segment.WriteCallback<StorageException> {

        private final String segmentKey;
        private final CallTree val;

        private TreeWriter(String segmentKey, CallTree val) {
            this.segmentKey = segmentKey;
            this.val = val;
        }

        @Override
        public void write(int depth, long bucketStart, long numerator, long denominator,
                List<Bucket> seedBuckets) throws StorageException {
            CallTree samples;
            if (numerator == denominator) {
                samples = val.copy();
            } else {
                samples = val.scaled(numerator, denominator);
            }
            if (!seedBuckets.isEmpty()) {
                CallTree seeded = new CallTree();
                for (Bucket seedBucket : seedBuckets) {
                    CallTree seed = treeDao.lookup(
                            Key.treeKey(segmentKey, seedBucket.depth(), seedBucket.start()));
                    if (seed != null) {
                        seeded.merge(seed);
                    }
                }
                seeded.merge(samples);
                samples = seeded;
            }
            treeDao.merge(Key.treeKey(segmentKey, depth, bucketStart), samples);
        }
    }

    private class TreeReader implements Segment.ReadCallback<StorageException> {

        private final String segmentKey;
        private final CallTree result;

        private TreeReader(String segmentKey, CallTree result) {
            this.segmentKey = segmentKey;
            this.result = result;
        }

        @Override
        public void read(int depth, long bucketStart, long numerator, long denominator)
                throws StorageException {
            CallTree tree = treeDao.lookup(Key.treeKey(segmentKey, depth, bucketStart));
            if (tree == null) {
                return;
            }
            if (numerator == denominator) {
                result.merge(tree);
            } else {
                result.merge(tree.scaled(numerator, denominator));
            }
        }
    }
}
