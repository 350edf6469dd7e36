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
package org.stackvault.storage.segment;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.stackvault.common.util.ObjectMappers;
import org.stackvault.storage.cache.Codec;
import org.stackvault.storage.segment.Segment.ResolutionRule;

/**
 * Json encoding of a segment:
 *
 * <pre>
 * {"spyName":"gospy","sampleRate":100,
 *  "resolutionRules":[[0,10000],[1,100000],...],
 *  "touched":[[...depth 0 bucket starts...],[...depth 1...],...],
 *  "present":[[...],[...],...]}
 * </pre>
 *
 * Present buckets are always touched, so "touched" only lists the touched buckets that are not
 * present.
 */
public class SegmentCodec implements Codec<Segment> {

    private static final ObjectMapper mapper = ObjectMappers.create();

    @Override
    public byte[] encode(Segment segment) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonGenerator jg = mapper.getFactory().createGenerator(out);
        try {
            jg.writeStartObject();
            jg.writeStringField("spyName", segment.getSpyName());
            jg.writeNumberField("sampleRate", segment.getSampleRate());
            jg.writeArrayFieldStart("resolutionRules");
            for (ResolutionRule rule : segment.getResolutionRules()) {
                jg.writeStartArray();
                jg.writeNumber(rule.depth());
                jg.writeNumber(rule.widthMillis());
                jg.writeEndArray();
            }
            jg.writeEndArray();
            jg.writeArrayFieldStart("touched");
            for (int depth = 0; depth < segment.getResolutionRules().size(); depth++) {
                writeLongArray(jg, Sets.difference(segment.getTouchedBuckets(depth),
                        segment.getPresentBuckets(depth)));
            }
            jg.writeEndArray();
            jg.writeArrayFieldStart("present");
            for (int depth = 0; depth < segment.getResolutionRules().size(); depth++) {
                writeLongArray(jg, segment.getPresentBuckets(depth));
            }
            jg.writeEndArray();
            jg.writeEndObject();
        } finally {
            jg.close();
        }
        return out.toByteArray();
    }

    @Override
    public Segment decode(byte[] bytes) throws IOException {
        JsonNode content = ObjectMappers.readRequiredTree(mapper, bytes);
        String spyName = ObjectMappers.getRequiredText(content, "spyName");
        long sampleRate = ObjectMappers.getRequiredLong(content, "sampleRate");
        List<ResolutionRule> rules = Lists.newArrayList();
        for (JsonNode rule : ObjectMappers.getRequiredNode(content, "resolutionRules")) {
            rules.add(ImmutableResolutionRule.of(rule.get(0).asInt(), rule.get(1).asLong()));
        }
        Segment segment;
        try {
            segment = new Segment(spyName, sampleRate, rules);
        } catch (IllegalArgumentException e) {
            throw new JsonMappingException(null, e.getMessage(), e);
        }
        JsonNode touched = ObjectMappers.getRequiredNode(content, "touched");
        JsonNode present = ObjectMappers.getRequiredNode(content, "present");
        if (touched.size() != rules.size() || present.size() != rules.size()) {
            throw new JsonMappingException(null, "Bucket lists do not match resolution rules");
        }
        for (int depth = 0; depth < rules.size(); depth++) {
            segment.restoreBuckets(depth, readLongArray(touched.get(depth)),
                    readLongArray(present.get(depth)));
        }
        return segment;
    }

    private static void writeLongArray(JsonGenerator jg, Iterable<Long> values)
            throws IOException {
        jg.writeStartArray();
        for (long value : values) {
            jg.writeNumber(value);
        }
        jg.writeEndArray();
    }

    private static List<Long> readLongArray(JsonNode array) {
        List<Long> values = Lists.newArrayList();
        for (JsonNode value : array) {
            values.add(value.asLong());
        }
        return values;
    }
}
