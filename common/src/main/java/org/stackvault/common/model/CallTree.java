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
package org.stackvault.common.model;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.CharStreams;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.stackvault.common.util.ObjectMappers;
import org.stackvault.common.util.Traverser;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Aggregate of sampled call stacks. Each node counts the samples whose stack ended at that
 * node ({@code self}) and the samples passing through it ({@code total}).
 *
 * <p>Instances are not thread safe. Instances handed to the storage layer are treated as
 * immutable from then on, callers merge into a {@link #copy()} instead.
 */
public class CallTree {

    private static final ObjectMapper mapper = ObjectMappers.create();

    private static final Splitter FRAME_SPLITTER = Splitter.on(';').omitEmptyStrings();
    private static final Joiner FRAME_JOINER = Joiner.on(';');

    private final Node root = new Node("");

    // frames are separated by ';' and ordered from the outermost frame to the leaf frame
    public void insert(byte[] stack, long samples) {
        insert(FRAME_SPLITTER.splitToList(new String(stack, UTF_8)), samples);
    }

    public void insert(List<String> frames, long samples) {
        checkArgument(samples >= 0, "samples must be non-negative: %s", samples);
        if (samples == 0) {
            return;
        }
        Node node = root;
        node.total += samples;
        for (String frame : frames) {
            node = node.getOrCreateChild(frame);
            node.total += samples;
        }
        node.self += samples;
    }

    public void merge(CallTree other) {
        if (other == this) {
            merge(other.copy());
            return;
        }
        Deque<Node[]> toBeMerged = new ArrayDeque<Node[]>();
        toBeMerged.push(new Node[] {root, other.root});
        Node[] pair;
        while ((pair = toBeMerged.poll()) != null) {
            Node destination = pair[0];
            Node source = pair[1];
            destination.self += source.self;
            destination.total += source.total;
            for (Node sourceChild : source.childNodes.values()) {
                toBeMerged.push(
                        new Node[] {destination.getOrCreateChild(sourceChild.name), sourceChild});
            }
        }
    }

    public CallTree copy() {
        CallTree copy = new CallTree();
        copy.merge(this);
        return copy;
    }

    // sample counts are multiplied by numerator / denominator and rounded down
    public CallTree scaled(long numerator, long denominator) {
        checkArgument(denominator > 0, "denominator must be positive: %s", denominator);
        checkArgument(numerator >= 0, "numerator must be non-negative: %s", numerator);
        if (numerator == denominator) {
            return copy();
        }
        final BigInteger num = BigInteger.valueOf(numerator);
        final BigInteger den = BigInteger.valueOf(denominator);
        final CallTree scaled = new CallTree();
        new StackWalker(root) {
            @Override
            void visitStack(List<String> frames, long self) {
                long scaledSelf = BigInteger.valueOf(self).multiply(num).divide(den).longValue();
                scaled.insert(frames, scaledSelf);
            }
        }.traverse();
        return scaled;
    }

    public long getSampleCount() {
        return root.total;
    }

    public boolean isEmpty() {
        return root.total == 0;
    }

    // collapsed stack format, e.g. "main;run;work" -> 3
    public ImmutableSortedMap<String, Long> getStacks() {
        final Map<String, Long> stacks = Maps.newHashMap();
        new StackWalker(root) {
            @Override
            void visitStack(List<String> frames, long self) {
                stacks.put(FRAME_JOINER.join(frames), self);
            }
        }.traverse();
        return ImmutableSortedMap.copyOf(stacks);
    }

    public String toJson() throws IOException {
        StringBuilder sb = new StringBuilder();
        JsonGenerator jg = mapper.getFactory().createGenerator(CharStreams.asWriter(sb));
        try {
            writeJson(jg);
        } finally {
            jg.close();
        }
        return sb.toString();
    }

    // nodes are written flat in pre-order with their depth, so the nesting depth of the json
    // does not grow with the depth of the call stacks
    public void writeJson(final JsonGenerator jg) throws IOException {
        jg.writeStartObject();
        jg.writeArrayFieldStart("nodes");
        new Traverser<Node, IOException>(root) {
            @Override
            public Collection<Node> visit(Node node, int depth) throws IOException {
                jg.writeStartArray();
                jg.writeNumber(depth);
                jg.writeString(node.name);
                jg.writeNumber(node.self);
                jg.writeEndArray();
                return node.childNodes.values();
            }
        }.traverse();
        jg.writeEndArray();
        jg.writeEndObject();
    }

    public static CallTree readJson(String json) throws IOException {
        return readJson(mapper.readTree(json));
    }

    public static CallTree readJson(JsonNode content) throws JsonMappingException {
        CallTree tree = new CallTree();
        JsonNode nodes = ObjectMappers.getRequiredNode(content, "nodes");
        Deque<Node> path = new ArrayDeque<Node>();
        for (JsonNode flatNode : nodes) {
            if (!flatNode.isArray() || flatNode.size() != 3) {
                throw new JsonMappingException(null, "Invalid call tree node: " + flatNode);
            }
            int depth = flatNode.get(0).asInt();
            String name = flatNode.get(1).asText();
            long self = flatNode.get(2).asLong();
            if (depth < 0 || depth > path.size()) {
                throw new JsonMappingException(null, "Invalid call tree node depth: " + depth);
            }
            Node node;
            if (depth == 0) {
                node = tree.root;
            } else {
                while (path.size() > depth) {
                    path.pop();
                }
                node = path.getFirst().getOrCreateChild(name);
            }
            node.self += self;
            path.push(node);
        }
        new Traverser<Node, RuntimeException>(tree.root) {
            @Override
            public Collection<Node> visit(Node node, int depth) {
                return node.childNodes.values();
            }
            @Override
            protected void revisitAfterChildren(Node node, int depth) {
                long total = node.self;
                for (Node childNode : node.childNodes.values()) {
                    total += childNode.total;
                }
                node.total = total;
            }
        }.traverse();
        return tree;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof CallTree)) {
            return false;
        }
        CallTree that = (CallTree) obj;
        return root.total == that.root.total && getStacks().equals(that.getStacks());
    }

    @Override
    public int hashCode() {
        return getStacks().hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sampleCount", root.total)
                .add("stacks", getStacks())
                .toString();
    }

    private static class Node {

        private final String name;
        private long self;
        private long total;
        // sorted so that serialization and traversal order are deterministic
        private final Map<String, Node> childNodes = Maps.newTreeMap();

        private Node(String name) {
            this.name = name;
        }

        private Node getOrCreateChild(String childName) {
            Node childNode = childNodes.get(childName);
            if (childNode == null) {
                childNode = new Node(childName);
                childNodes.put(childName, childNode);
            }
            return childNode;
        }
    }

    private abstract static class StackWalker extends Traverser<Node, RuntimeException> {

        private final List<String> frames = Lists.newArrayList();

        private StackWalker(Node root) {
            super(root);
        }

        @Override
        public Collection<Node> visit(Node node, int depth) {
            // the root node has no frame
            while (frames.size() > Math.max(depth - 1, 0)) {
                frames.remove(frames.size() - 1);
            }
            if (depth > 0) {
                frames.add(node.name);
            }
            if (node.self > 0) {
                visitStack(ImmutableList.copyOf(frames), node.self);
            }
            return new ArrayList<Node>(node.childNodes.values());
        }

        abstract void visitStack(List<String> frames, long self);
    }
}
