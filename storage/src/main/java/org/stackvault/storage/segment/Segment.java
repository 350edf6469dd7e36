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

import java.util.Collection;
import java.util.List;
import java.util.NavigableSet;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Ingestion parameters and time bucket bookkeeping of one (application, label set)
 * combination.
 *
 * <p>Trees are stored per bucket at several resolutions ("depths"). Depth 0 buckets are
 * {@link #RESOLUTION_MILLIS} wide and every coarser depth is {@link #MULTIPLIER} times wider
 * than the one below it. A segment remembers, per depth, which buckets have been touched by
 * ingestion and which of them hold a stored tree ("present"). Coarse buckets only become
 * present once they are worth it: when an ingested range covers them entirely or when more
 * than one of their child buckets has been touched. From then on they receive every write
 * that overlaps them.
 */
public class Segment {

    public static final long RESOLUTION_MILLIS = SECONDS.toMillis(10);
    public static final int MULTIPLIER = 10;
    public static final int DEPTHS = 6;

    // keeps bucket arithmetic far away from overflow
    public static final long MAX_TIME_MILLIS = Long.MAX_VALUE / 4;
    // width of the widest default bucket
    public static final long MAX_RANGE_MILLIS;

    // sample rates are unsigned 32 bit values
    public static final long MAX_SAMPLE_RATE = 0xFFFFFFFFL;

    private static final ImmutableList<ResolutionRule> DEFAULT_RESOLUTION_RULES;

    static {
        ImmutableList.Builder<ResolutionRule> rules = ImmutableList.builder();
        long widthMillis = RESOLUTION_MILLIS;
        for (int depth = 0; depth < DEPTHS; depth++) {
            rules.add(ImmutableResolutionRule.of(depth, widthMillis));
            widthMillis *= MULTIPLIER;
        }
        DEFAULT_RESOLUTION_RULES = rules.build();
        MAX_RANGE_MILLIS = DEFAULT_RESOLUTION_RULES.get(DEPTHS - 1).widthMillis();
    }

    private final String spyName;
    private final long sampleRate;
    private final ImmutableList<ResolutionRule> resolutionRules;

    // one set of bucket start times per depth
    @GuardedBy("this")
    private final List<NavigableSet<Long>> touchedBuckets;
    @GuardedBy("this")
    private final List<NavigableSet<Long>> presentBuckets;

    public Segment(String spyName, long sampleRate) {
        this(spyName, sampleRate, DEFAULT_RESOLUTION_RULES);
    }

    Segment(String spyName, long sampleRate, List<ResolutionRule> resolutionRules) {
        checkSampleRate(sampleRate);
        checkArgument(!resolutionRules.isEmpty(), "at least one resolution rule is required");
        for (int i = 0; i < resolutionRules.size(); i++) {
            checkArgument(resolutionRules.get(i).depth() == i,
                    "resolution rules must be ordered by depth starting at 0");
        }
        this.spyName = checkNotNull(spyName);
        this.sampleRate = sampleRate;
        this.resolutionRules = ImmutableList.copyOf(resolutionRules);
        touchedBuckets = Lists.newArrayList();
        presentBuckets = Lists.newArrayList();
        for (int i = 0; i < resolutionRules.size(); i++) {
            touchedBuckets.add(Sets.<Long>newTreeSet());
            presentBuckets.add(Sets.<Long>newTreeSet());
        }
    }

    // both ends within MAX_TIME_MILLIS of the epoch and no longer than MAX_RANGE_MILLIS
    public static void checkRange(long startMillis, long endMillis) {
        checkTime(startMillis);
        checkTime(endMillis);
        checkArgument(endMillis - startMillis <= MAX_RANGE_MILLIS,
                "range is longer than %s millis: [%s, %s)", MAX_RANGE_MILLIS, startMillis,
                endMillis);
    }

    public static void checkSampleRate(long sampleRate) {
        checkArgument(sampleRate >= 0 && sampleRate <= MAX_SAMPLE_RATE,
                "sample rate out of range: %s", sampleRate);
    }

    public static ImmutableList<ResolutionRule> defaultResolutionRules() {
        return DEFAULT_RESOLUTION_RULES;
    }

    // start of the bucket containing timeMillis, using the resolution rules of new segments
    public static long bucketStart(int depth, long timeMillis) {
        checkArgument(depth >= 0 && depth < DEFAULT_RESOLUTION_RULES.size(),
                "depth out of range: %s", depth);
        return alignDown(timeMillis, DEFAULT_RESOLUTION_RULES.get(depth).widthMillis());
    }

    public String getSpyName() {
        return spyName;
    }

    public long getSampleRate() {
        return sampleRate;
    }

    public ImmutableList<ResolutionRule> getResolutionRules() {
        return resolutionRules;
    }

    public synchronized boolean isPresent(int depth, long bucketStart) {
        return presentBuckets.get(depth).contains(bucketStart);
    }

    public synchronized ImmutableList<Bucket> getPresentBuckets() {
        ImmutableList.Builder<Bucket> buckets = ImmutableList.builder();
        for (int depth = 0; depth < presentBuckets.size(); depth++) {
            for (long bucketStart : presentBuckets.get(depth)) {
                buckets.add(ImmutableBucket.of(depth, bucketStart));
            }
        }
        return buckets.build();
    }

    /**
     * Places the range {@code [startMillis, endMillis)} into buckets, coarsest depth first, and
     * calls back for every bucket that must receive the range's samples. A range that is empty
     * or reversed is treated as covering the depth 0 bucket containing {@code startMillis}.
     *
     * @see #checkRange(long, long)
     */
    public synchronized <E extends Exception> void put(long startMillis, long endMillis,
            WriteCallback<E> callback) throws E {
        checkRange(startMillis, endMillis);
        long start = startMillis;
        long end = endMillis;
        if (end <= start) {
            start = alignDown(startMillis, widthMillis(0));
            end = start + widthMillis(0);
        }
        long duration = end - start;
        for (int depth = resolutionRules.size() - 1; depth >= 0; depth--) {
            long width = widthMillis(depth);
            for (long bucketStart = alignDown(start, width); bucketStart < end;
                    bucketStart += width) {
                long overlap = Math.min(end, bucketStart + width) - Math.max(start, bucketStart);
                boolean present = presentBuckets.get(depth).contains(bucketStart);
                boolean write;
                if (depth == 0 || present) {
                    write = true;
                } else {
                    boolean covered = start <= bucketStart && end >= bucketStart + width;
                    write = covered || countChildren(depth, bucketStart, start, end) > 1;
                }
                touchedBuckets.get(depth).add(bucketStart);
                if (write) {
                    List<Bucket> seedBuckets;
                    if (present || depth == 0) {
                        seedBuckets = ImmutableList.of();
                    } else {
                        seedBuckets = Lists.newArrayList();
                        collectSeedBuckets(depth, bucketStart, seedBuckets);
                    }
                    callback.write(depth, bucketStart, overlap, duration, seedBuckets);
                    presentBuckets.get(depth).add(bucketStart);
                }
            }
        }
    }

    /**
     * Walks the buckets needed to answer a query over {@code [startMillis, endMillis)}, using
     * the coarsest present bucket that lies entirely inside the range. Depth 0 buckets that
     * only partially overlap the range are reported with the fraction that overlaps.
     */
    public synchronized <E extends Exception> void get(long startMillis, long endMillis,
            ReadCallback<E> callback) throws E {
        long start = Math.max(startMillis, -MAX_TIME_MILLIS);
        long end = Math.min(endMillis, MAX_TIME_MILLIS);
        if (end <= start) {
            return;
        }
        int topDepth = resolutionRules.size() - 1;
        long width = widthMillis(topDepth);
        // only touched buckets can hold anything
        for (long bucketStart : ImmutableList.copyOf(touchedBuckets.get(topDepth)
                .subSet(alignDown(start, width), true, end, false))) {
            visitForRead(topDepth, bucketStart, start, end, callback);
        }
    }

    long widthMillis(int depth) {
        return resolutionRules.get(depth).widthMillis();
    }

    synchronized ImmutableSortedSet<Long> getTouchedBuckets(int depth) {
        return ImmutableSortedSet.copyOf(touchedBuckets.get(depth));
    }

    synchronized ImmutableSortedSet<Long> getPresentBuckets(int depth) {
        return ImmutableSortedSet.copyOf(presentBuckets.get(depth));
    }

    synchronized void restoreBuckets(int depth, Collection<Long> touched,
            Collection<Long> present) {
        touchedBuckets.get(depth).addAll(touched);
        touchedBuckets.get(depth).addAll(present);
        presentBuckets.get(depth).addAll(present);
    }

    @GuardedBy("this")
    private <E extends Exception> void visitForRead(int depth, long bucketStart,
            long startMillis, long endMillis, ReadCallback<E> callback) throws E {
        if (!touchedBuckets.get(depth).contains(bucketStart)) {
            return;
        }
        long width = widthMillis(depth);
        boolean inside = startMillis <= bucketStart && bucketStart + width <= endMillis;
        boolean present = presentBuckets.get(depth).contains(bucketStart);
        if (inside && present) {
            callback.read(depth, bucketStart, width, width);
            return;
        }
        if (depth == 0) {
            if (present) {
                long overlap = Math.min(endMillis, bucketStart + width)
                        - Math.max(startMillis, bucketStart);
                callback.read(depth, bucketStart, overlap, width);
            }
            return;
        }
        long childWidth = widthMillis(depth - 1);
        long from = Math.max(startMillis, bucketStart);
        long to = Math.min(endMillis, bucketStart + width);
        for (long childStart : ImmutableList.copyOf(touchedBuckets.get(depth - 1)
                .subSet(alignDown(from, childWidth), true, to, false))) {
            visitForRead(depth - 1, childStart, startMillis, endMillis, callback);
        }
    }

    // touched children of the bucket, counting the ones this range is about to touch
    @GuardedBy("this")
    private int countChildren(int depth, long bucketStart, long start, long end) {
        long width = widthMillis(depth);
        long childWidth = widthMillis(depth - 1);
        NavigableSet<Long> touchedChildren =
                touchedBuckets.get(depth - 1).subSet(bucketStart, true, bucketStart + width, false);
        int count = touchedChildren.size();
        long from = Math.max(start, bucketStart);
        long to = Math.min(end, bucketStart + width);
        for (long childStart = alignDown(from, childWidth); childStart < to;
                childStart += childWidth) {
            if (!touchedChildren.contains(childStart)) {
                count++;
            }
        }
        return count;
    }

    // the trees that already hold this bucket's samples, as of before the current write
    @GuardedBy("this")
    private void collectSeedBuckets(int depth, long bucketStart, List<Bucket> seedBuckets) {
        long width = widthMillis(depth);
        NavigableSet<Long> touchedChildren =
                touchedBuckets.get(depth - 1).subSet(bucketStart, true, bucketStart + width, false);
        for (long childStart : touchedChildren) {
            if (presentBuckets.get(depth - 1).contains(childStart)) {
                seedBuckets.add(ImmutableBucket.of(depth - 1, childStart));
            } else if (depth - 1 > 0) {
                collectSeedBuckets(depth - 1, childStart, seedBuckets);
            }
        }
    }

    private static void checkTime(long timeMillis) {
        checkArgument(timeMillis >= -MAX_TIME_MILLIS && timeMillis <= MAX_TIME_MILLIS,
                "time out of range: %s", timeMillis);
    }

    private static long alignDown(long timeMillis, long widthMillis) {
        return timeMillis - Math.floorMod(timeMillis, widthMillis);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("spyName", spyName)
                .add("sampleRate", sampleRate)
                .add("resolutionRules", resolutionRules)
                .toString();
    }

    public interface WriteCallback<E extends Exception> {
        // the samples to write are scaled by numerator / denominator, and a bucket becoming
        // present for the first time is seeded with the trees of seedBuckets
        void write(int depth, long bucketStart, long numerator, long denominator,
                List<Bucket> seedBuckets) throws E;
    }

    public interface ReadCallback<E extends Exception> {
        void read(int depth, long bucketStart, long numerator, long denominator) throws E;
    }

    @Value.Immutable
    public interface ResolutionRule {
        @Value.Parameter
        int depth();
        @Value.Parameter
        long widthMillis();
    }

    @Value.Immutable
    public interface Bucket {
        @Value.Parameter
        int depth();
        @Value.Parameter
        long start();
    }
}
