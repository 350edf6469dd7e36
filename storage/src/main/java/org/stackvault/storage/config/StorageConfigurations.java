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
import java.io.IOException;
import java.util.Map;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.stackvault.common.util.PropertiesFiles;

public class StorageConfigurations {

    private static final Logger logger = LoggerFactory.getLogger(StorageConfigurations.class);

    static final String PROPERTIES_FILE_NAME = "stackvault.properties";
    static final String SYSTEM_PROPERTY_PREFIX = "stackvault.";

    private StorageConfigurations() {}

    // reads <confDir>/stackvault.properties, then applies any stackvault.* system properties
    public static StorageConfiguration load(File confDir) throws IOException {
        File propFile = new File(confDir, PROPERTIES_FILE_NAME);
        Map<String, String> properties =
                PropertiesFiles.loadWithSystemOverlay(propFile, SYSTEM_PROPERTY_PREFIX);
        ImmutableStorageConfiguration.Builder builder = ImmutableStorageConfiguration.builder();
        String dataDir = properties.get("dataDir");
        if (!Strings.isNullOrEmpty(dataDir)) {
            File dir = new File(dataDir);
            if (!dir.isAbsolute()) {
                dir = new File(confDir, dataDir);
            }
            builder.dataDir(dir);
        }
        String treeCacheSize = properties.get("treeCacheSize");
        if (!Strings.isNullOrEmpty(treeCacheSize)) {
            builder.treeCacheSize(parseInt("treeCacheSize", treeCacheSize));
        }
        String dictCacheSize = properties.get("dictCacheSize");
        if (!Strings.isNullOrEmpty(dictCacheSize)) {
            builder.dictCacheSize(parseInt("dictCacheSize", dictCacheSize));
        }
        String segmentCacheSize = properties.get("segmentCacheSize");
        if (!Strings.isNullOrEmpty(segmentCacheSize)) {
            builder.segmentCacheSize(parseInt("segmentCacheSize", segmentCacheSize));
        }
        String dimensionCacheSize = properties.get("dimensionCacheSize");
        if (!Strings.isNullOrEmpty(dimensionCacheSize)) {
            builder.dimensionCacheSize(parseInt("dimensionCacheSize", dimensionCacheSize));
        }
        String queryTimeoutSeconds = properties.get("queryTimeoutSeconds");
        if (!Strings.isNullOrEmpty(queryTimeoutSeconds)) {
            builder.queryTimeoutSeconds(parseInt("queryTimeoutSeconds", queryTimeoutSeconds));
        }
        StorageConfiguration config = builder.build();
        logger.debug("loaded storage configuration: {}", config);
        return config;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + name + " value: " + value, e);
        }
    }
}
