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

import java.io.File;
import java.io.IOException;
import java.util.List;

import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanServer;
import javax.management.ObjectName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.stackvault.common.model.CallTree;
import org.stackvault.common.model.Dictionary;
import org.stackvault.common.util.OnlyUsedByTests;
import org.stackvault.storage.cache.CacheImpl;
import org.stackvault.storage.cache.DataSource;
import org.stackvault.storage.cache.H2KeyValueStore;
import org.stackvault.storage.config.StorageConfiguration;
import org.stackvault.storage.dict.DictCodec;
import org.stackvault.storage.dict.DictDao;
import org.stackvault.storage.dimension.Dimension;
import org.stackvault.storage.dimension.DimensionCodec;
import org.stackvault.storage.dimension.DimensionDao;
import org.stackvault.storage.segment.Segment;
import org.stackvault.storage.segment.SegmentCodec;
import org.stackvault.storage.segment.SegmentDao;
import org.stackvault.storage.tree.TreeCodec;
import org.stackvault.storage.tree.TreeDao;

public class StorageModule {

    private static final Logger logger = LoggerFactory.getLogger(StorageModule.class);

    private static final String DB_FILE_NAME = "stackvault.mv.db";

    private final DataSource dataSource;
    private final ImmutableList<CacheImpl<?>> caches;
    private final Storage storage;
    private final @Nullable MBeanServer mbeanServer;
    private final ImmutableList<ObjectName> registeredNames;

    private StorageModule(DataSource dataSource, ImmutableList<CacheImpl<?>> caches,
            Storage storage, @Nullable MBeanServer mbeanServer,
            ImmutableList<ObjectName> registeredNames) {
        this.dataSource = dataSource;
        this.caches = caches;
        this.storage = storage;
        this.mbeanServer = mbeanServer;
        this.registeredNames = registeredNames;
    }

    public static StorageModule create(StorageConfiguration config,
            @Nullable MBeanServer mbeanServer) throws Exception {
        File dataDir = config.dataDir();
        DataSource dataSource;
        if (dataDir == null) {
            dataSource = new DataSource();
        } else {
            if (!dataDir.exists() && !dataDir.mkdirs()) {
                throw new IOException("Could not create directory: " + dataDir.getAbsolutePath());
            }
            dataSource = new DataSource(new File(dataDir, DB_FILE_NAME));
        }
        H2KeyValueStore store;
        try {
            store = new H2KeyValueStore(dataSource);
        } catch (Exception e) {
            dataSource.close();
            throw e;
        }
        // safe to set query timeout after the table has been created
        dataSource.setQueryTimeoutSeconds(config.queryTimeoutSeconds());

        CacheImpl<CallTree> treeCache =
                new CacheImpl<CallTree>("trees", "t:", config.treeCacheSize(), store,
                        new TreeCodec());
        CacheImpl<Dictionary> dictCache =
                new CacheImpl<Dictionary>("dicts", "d:", config.dictCacheSize(), store,
                        new DictCodec());
        CacheImpl<Segment> segmentCache =
                new CacheImpl<Segment>("segments", "s:", config.segmentCacheSize(), store,
                        new SegmentCodec());
        CacheImpl<Dimension> dimensionCache =
                new CacheImpl<Dimension>("dimensions", "i:", config.dimensionCacheSize(), store,
                        new DimensionCodec());
        ImmutableList<CacheImpl<?>> caches =
                ImmutableList.<CacheImpl<?>>of(treeCache, dictCache, segmentCache, dimensionCache);

        Storage storage = new Storage(new TreeDao(treeCache), new DictDao(dictCache),
                new SegmentDao(segmentCache), new DimensionDao(dimensionCache));

        List<ObjectName> registeredNames = Lists.newArrayList();
        if (mbeanServer != null) {
            for (CacheImpl<?> cache : caches) {
                ObjectName name = getObjectName(cache.getName());
                try {
                    mbeanServer.registerMBean(cache, name);
                    registeredNames.add(name);
                } catch (InstanceAlreadyExistsException e) {
                    // two modules in the same jvm, only the first one exposes its caches
                    logger.debug(e.getMessage(), e);
                }
            }
        }
        return new StorageModule(dataSource, caches, storage, mbeanServer,
                ImmutableList.copyOf(registeredNames));
    }

    public ProfileRepository getProfileRepository() {
        return storage;
    }

    public Storage getStorage() {
        return storage;
    }

    @OnlyUsedByTests
    ImmutableList<CacheImpl<?>> getCaches() {
        return caches;
    }

    @OnlyUsedByTests
    DataSource getDataSource() {
        return dataSource;
    }

    // flushes every cache to the durable store before closing it
    public void close() throws Exception {
        try {
            storage.dump();
        } finally {
            if (mbeanServer != null) {
                for (ObjectName name : registeredNames) {
                    mbeanServer.unregisterMBean(name);
                }
            }
            dataSource.close();
        }
    }

    static ObjectName getObjectName(String cacheName) throws Exception {
        return new ObjectName("org.stackvault:type=Cache,name=" + cacheName);
    }
}
