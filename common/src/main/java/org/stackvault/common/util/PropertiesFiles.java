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
package org.stackvault.common.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.Maps;

public class PropertiesFiles {

    private PropertiesFiles() {}

    public static Properties load(File propFile) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(propFile.toPath())) {
            props.load(in);
        }
        return props;
    }

    // file properties are keyed without the prefix, system properties are keyed with it
    public static Map<String, String> loadWithSystemOverlay(File propFile, String prefix)
            throws IOException {
        Map<String, String> properties = Maps.newHashMap();
        if (propFile.exists()) {
            Properties props = load(propFile);
            for (String key : props.stringPropertyNames()) {
                String value = props.getProperty(key);
                if (value != null) {
                    properties.put(key, value.trim());
                }
            }
        }
        for (Map.Entry<Object, Object> entry : System.getProperties().entrySet()) {
            if (entry.getKey() instanceof String && entry.getValue() instanceof String
                    && ((String) entry.getKey()).startsWith(prefix)) {
                String key = ((String) entry.getKey()).substring(prefix.length());
                properties.put(key, ((String) entry.getValue()).trim());
            }
        }
        return properties;
    }
}
