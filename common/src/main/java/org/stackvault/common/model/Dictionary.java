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
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.GuardedBy;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.stackvault.common.util.ObjectMappers;

import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Symbol table shared by all call trees of one application. Identifiers are assigned in
 * first-seen order and never change.
 */
public class Dictionary {

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final Map<String, Integer> symbolIds = Maps.newHashMap();
    @GuardedBy("lock")
    private final List<String> symbols = Lists.newArrayList();

    public int put(String symbol) {
        synchronized (lock) {
            Integer id = symbolIds.get(symbol);
            if (id == null) {
                id = symbols.size();
                symbols.add(symbol);
                symbolIds.put(symbol, id);
            }
            return id;
        }
    }

    public @Nullable Integer lookup(String symbol) {
        synchronized (lock) {
            return symbolIds.get(symbol);
        }
    }

    public String get(int id) {
        synchronized (lock) {
            checkElementIndex(id, symbols.size());
            return symbols.get(id);
        }
    }

    public int size() {
        synchronized (lock) {
            return symbols.size();
        }
    }

    public ImmutableList<String> getSymbols() {
        synchronized (lock) {
            return ImmutableList.copyOf(symbols);
        }
    }

    public void writeJson(JsonGenerator jg) throws IOException {
        jg.writeStartObject();
        jg.writeArrayFieldStart("symbols");
        for (String symbol : getSymbols()) {
            jg.writeString(symbol);
        }
        jg.writeEndArray();
        jg.writeEndObject();
    }

    public static Dictionary readJson(JsonNode content) throws JsonMappingException {
        Dictionary dictionary = new Dictionary();
        for (JsonNode symbol : ObjectMappers.getRequiredNode(content, "symbols")) {
            dictionary.put(symbol.asText());
        }
        return dictionary;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return obj instanceof Dictionary && getSymbols().equals(((Dictionary) obj).getSymbols());
    }

    @Override
    public int hashCode() {
        return getSymbols().hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", size())
                .toString();
    }
}
