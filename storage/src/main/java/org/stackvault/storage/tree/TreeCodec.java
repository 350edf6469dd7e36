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
package org.stackvault.storage.tree;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.stackvault.common.model.CallTree;
import org.stackvault.common.util.ObjectMappers;
import org.stackvault.storage.cache.Codec;

public class TreeCodec implements Codec<CallTree> {

    private static final ObjectMapper mapper = ObjectMappers.create();

    @Override
    public byte[] encode(CallTree tree) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonGenerator jg = mapper.getFactory().createGenerator(out);
        try {
            tree.writeJson(jg);
        } finally {
            jg.close();
        }
        return out.toByteArray();
    }

    @Override
    public CallTree decode(byte[] bytes) throws IOException {
        return CallTree.readJson(ObjectMappers.readRequiredTree(mapper, bytes));
    }
}
