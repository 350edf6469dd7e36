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

import java.util.List;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The segment keys carrying one label value. Instances are immutable, membership changes
 * produce a new dimension.
 */
public class Dimension {

    private static final Dimension EMPTY = new Dimension(ImmutableSortedSet.<String>of());

    private final ImmutableSortedSet<String> members;

    private Dimension(ImmutableSortedSet<String> members) {
        this.members = members;
    }

    public static Dimension empty() {
        return EMPTY;
    }

    public static Dimension of(Iterable<String> members) {
        return new Dimension(ImmutableSortedSet.copyOf(members));
    }

    public Dimension withMember(String segmentKey) {
        if (members.contains(segmentKey)) {
            return this;
        }
        return new Dimension(ImmutableSortedSet.<String>naturalOrder()
                .addAll(members)
                .add(segmentKey)
                .build());
    }

    public Dimension withoutMember(String segmentKey) {
        if (!members.contains(segmentKey)) {
            return this;
        }
        Set<String> remaining = Sets.newTreeSet(members);
        remaining.remove(segmentKey);
        return new Dimension(ImmutableSortedSet.copyOf(remaining));
    }

    public boolean contains(String segmentKey) {
        return members.contains(segmentKey);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    public ImmutableSortedSet<String> getMembers() {
        return members;
    }

    // segment keys present in all of the given dimensions
    public static ImmutableSortedSet<String> intersect(List<Dimension> dimensions) {
        if (dimensions.isEmpty()) {
            return ImmutableSortedSet.of();
        }
        Set<String> result = Sets.newTreeSet(dimensions.get(0).members);
        for (int i = 1; i < dimensions.size(); i++) {
            result.retainAll(dimensions.get(i).members);
        }
        return ImmutableSortedSet.copyOf(result);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return obj instanceof Dimension && members.equals(((Dimension) obj).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("members", members)
                .toString();
    }
}
