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

import java.io.IOException;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import org.checkerframework.checker.nullness.qual.Nullable;

public class ObjectMappers {

    // symbol names (e.g. generated lambda class names) can be long, but not this long
    private static final int MAX_STRING_LENGTH = 1024 * 1024;

    private ObjectMappers() {}

    public static ObjectMapper create(Module... extraModules) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.getFactory().setStreamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(MAX_STRING_LENGTH)
                .build());
        mapper.registerModule(new GuavaModule());
        for (Module extraModule : extraModules) {
            mapper.registerModule(extraModule);
        }
        mapper.setSerializationInclusion(Include.NON_ABSENT);
        return mapper;
    }

    public static JsonNode getRequiredNode(JsonNode parent, String fieldName)
            throws JsonMappingException {
        JsonNode node = parent.get(fieldName);
        if (node == null || node.isNull()) {
            throw new JsonMappingException(null, "Missing required field: " + fieldName);
        }
        return node;
    }

    public static String getRequiredText(JsonNode parent, String fieldName)
            throws JsonMappingException {
        JsonNode node = getRequiredNode(parent, fieldName);
        if (!node.isTextual()) {
            throw new JsonMappingException(null, "Expected text for field: " + fieldName);
        }
        return node.asText();
    }

    public static long getRequiredLong(JsonNode parent, String fieldName)
            throws JsonMappingException {
        JsonNode node = getRequiredNode(parent, fieldName);
        if (!node.canConvertToLong()) {
            throw new JsonMappingException(null, "Expected number for field: " + fieldName);
        }
        return node.asLong();
    }

    public static JsonNode readRequiredTree(ObjectMapper mapper, byte[] content)
            throws IOException {
        @Nullable
        JsonNode node = mapper.readTree(content);
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new JsonMappingException(null, "Content is json null");
        }
        return node;
    }
}
