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
package org.stackvault.storage.dimension;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.stackvault.common.util.ObjectMappers;
import org.stackvault.storage.cache.Codec;

// {"members":["app{}","app{env=prod}"]}
public class DimensionCodec implements Codec<Dimension> {

    private static final ObjectMapper mapper = ObjectMappers.create();

    @Override
    public byte[] encode(Dimension dimension) throws IOException {
        return mapper.writeValueAsBytes(ImmutableMap.of("members", dimension.getMembers()));
    }

    @Override
    public Dimension decode(byte[] bytes) throws IOException {
        JsonNode content = ObjectMappers.readRequiredTree(mapper, bytes);
        List<String> members = Lists.newArrayList();
        for (JsonNode member : ObjectMappers.getRequiredNode(content, "members")) {
            members.add(member.asText());
        }
        return Dimension.of(members);
    }
}
