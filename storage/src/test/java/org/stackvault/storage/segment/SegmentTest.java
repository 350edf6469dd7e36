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

import java.util.List;

import com.google.common.collect.Lists;
import org.junit.Test;

import org.stackvault.storage.segment.Segment.Bucket;
import org.stackvault.storage.segment.Segment.ReadCallback;
import org.stackvault.storage.segment.Segment.WriteCallback;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SegmentTest {

    @Test
    public void shouldUseDefaultResolutionRules() {
        // when
        Segment segment = new Segment("gospy", 100);
        // then
        assertThat(segment.getResolutionRules()).hasSize(6);
        assertThat(segment.getResolutionRules().get(0).widthMillis()).isEqualTo(10000);
        assertThat(segment.getResolutionRules().get(5).widthMillis()).isEqualTo(1000000000);
    }

    @Test
    public void shouldWriteOnlyDepthZeroForShortRange() {
        // given
        Segment segment = new Segment("gospy", 100);
        RecordingWriter writer = new RecordingWriter();
        // when
        segment.put(10000, 19000, writer);
        // then
        assertThat(writer.writes).containsExactly("0:10000:9000/9000:[]");
        assertThat(segment.getPresentBuckets()).containsExactly(ImmutableBucket.of(0, 10000));
    }

    @Test
    public void shouldWriteCoveredCoarseBucket() {
        // given
        Segment segment = new Segment("gospy", 100);
        RecordingWriter writer = new RecordingWriter();
        // when
        segment.put(0, 100000, writer);
        // then
        assertThat(writer.writes).hasSize(11);
        assertThat(writer.writes.get(0)).isEqualTo("1:0:100000/100000:[]");
        assertThat(writer.writes.subList(1, 11)).containsExactly(
                "0:0:10000/100000:[]",
                "0:10000:10000/100000:[]",
                "0:20000:10000/100000:[]",
                "0:30000:10000/100000:[]",
                "0:40000:10000/100000:[]",
                "0:50000:10000/100000:[]",
                "0:60000:10000/100000:[]",
                "0:70000:10000/100000:[]",
                "0:80000:10000/100000:[]",
                "0:90000:10000/100000:[]");
        assertThat(segment.isPresent(1, 0)).isTrue();
        assertThat(segment.isPresent(2, 0)).isFalse();
    }

    @Test
    public void shouldWriteCoarseBucketOnceSecondChildIsTouched() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(10000, 20000, new RecordingWriter());
        RecordingWriter writer = new RecordingWriter();
        // when
        segment.put(30000, 40000, writer);
        // then
        assertThat(writer.writes).containsExactly(
                "1:0:10000/10000:[0:10000]",
                "0:30000:10000/10000:[]");
        assertThat(segment.isPresent(1, 0)).isTrue();
    }

    @Test
    public void shouldKeepWritingPresentCoarseBucketWithoutSeeding() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(10000, 20000, new RecordingWriter());
        segment.put(30000, 40000, new RecordingWriter());
        RecordingWriter writer = new RecordingWriter();
        // when
        segment.put(50000, 55000, writer);
        // then
        assertThat(writer.writes).containsExactly(
                "1:0:5000/5000:[]",
                "0:50000:5000/5000:[]");
    }

    @Test
    public void shouldSeedThroughTouchedButNotPresentChildren() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(10000, 20000, new RecordingWriter());
        RecordingWriter writer = new RecordingWriter();
        // when
        segment.put(210000, 220000, writer);
        // then
        assertThat(writer.writes).containsExactly(
                "2:0:10000/10000:[0:10000]",
                "0:210000:10000/10000:[]");
        assertThat(segment.isPresent(1, 0)).isFalse();
        assertThat(segment.isPresent(1, 200000)).isFalse();
        assertThat(segment.isPresent(2, 0)).isTrue();
    }

    @Test
    public void shouldTreatEmptyRangeAsSingleBucket() {
        // given
        RecordingWriter emptyRangeWriter = new RecordingWriter();
        RecordingWriter reversedRangeWriter = new RecordingWriter();
        // when
        new Segment("gospy", 100).put(15000, 15000, emptyRangeWriter);
        new Segment("gospy", 100).put(25000, 24000, reversedRangeWriter);
        // then
        assertThat(emptyRangeWriter.writes).containsExactly("0:10000:10000/10000:[]");
        assertThat(reversedRangeWriter.writes).containsExactly("0:20000:10000/10000:[]");
    }

    @Test
    public void shouldReadCoarsestBucketInsideRange() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(0, 100000, new RecordingWriter());
        RecordingReader reader = new RecordingReader();
        // when
        segment.get(0, 100000, reader);
        // then
        assertThat(reader.reads).containsExactly("1:0:100000/100000");
    }

    @Test
    public void shouldDescendWhenCoarseBucketIsNotInsideRange() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(0, 100000, new RecordingWriter());
        RecordingReader reader = new RecordingReader();
        // when
        segment.get(0, 30000, reader);
        // then
        assertThat(reader.reads).containsExactly(
                "0:0:10000/10000",
                "0:10000:10000/10000",
                "0:20000:10000/10000");
    }

    @Test
    public void shouldReadPartialDepthZeroBuckets() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(0, 20000, new RecordingWriter());
        RecordingReader reader = new RecordingReader();
        // when
        segment.get(5000, 12000, reader);
        // then
        assertThat(reader.reads).containsExactly(
                "0:0:5000/10000",
                "0:10000:2000/10000");
    }

    @Test
    public void shouldReadNothingOutsideTouchedBuckets() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(0, 10000, new RecordingWriter());
        RecordingReader reader = new RecordingReader();
        // when
        segment.get(500000, 600000, reader);
        segment.get(10000, 0, reader);
        // then
        assertThat(reader.reads).isEmpty();
    }

    @Test
    public void shouldAlignBucketsOfNegativeTimes() {
        assertThat(Segment.bucketStart(0, -1)).isEqualTo(-10000);
        assertThat(Segment.bucketStart(1, 123456)).isEqualTo(100000);
    }

    @Test
    public void shouldRejectRangeLongerThanWidestBucket() {
        // given
        Segment segment = new Segment("gospy", 100);
        RecordingWriter writer = new RecordingWriter();
        // then
        assertThatThrownBy(() -> segment.put(0, Segment.MAX_RANGE_MILLIS + 1, writer))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(writer.writes).isEmpty();
        assertThat(segment.getPresentBuckets()).isEmpty();
    }

    @Test
    public void shouldRejectTimesNearOverflow() {
        // given
        Segment segment = new Segment("gospy", 100);
        RecordingWriter writer = new RecordingWriter();
        // then
        assertThatThrownBy(() -> segment.put(Long.MAX_VALUE - 1000, Long.MAX_VALUE, writer))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> segment.put(Long.MIN_VALUE, Long.MIN_VALUE + 1000, writer))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(writer.writes).isEmpty();
    }

    @Test
    public void shouldReadUnboundedRangeThroughTouchedBucketsOnly() {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(0, 10000, new RecordingWriter());
        RecordingReader reader = new RecordingReader();
        // when
        segment.get(Long.MIN_VALUE, Long.MAX_VALUE, reader);
        // then
        assertThat(reader.reads).containsExactly("0:0:10000/10000");
    }

    @Test
    public void shouldAcceptUnsigned32BitSampleRates() {
        assertThat(new Segment("gospy", Segment.MAX_SAMPLE_RATE).getSampleRate())
                .isEqualTo(4294967295L);
        assertThatThrownBy(() -> new Segment("gospy", Segment.MAX_SAMPLE_RATE + 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Segment("gospy", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldNotEncodePresentBucketsAsTouched() throws Exception {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(10000, 20000, new RecordingWriter());
        segment.put(30000, 40000, new RecordingWriter());
        // when
        String json = new String(new SegmentCodec().encode(segment), UTF_8);
        // then
        assertThat(json).contains("\"touched\":[[],[],[0],[0],[0],[0]]");
        assertThat(json).contains("\"present\":[[10000,30000],[0],[],[],[],[]]");
    }

    @Test
    public void shouldReadWhatWasWritten() throws Exception {
        // given
        Segment segment = new Segment("gospy", 100);
        segment.put(10000, 20000, new RecordingWriter());
        segment.put(30000, 40000, new RecordingWriter());
        SegmentCodec codec = new SegmentCodec();
        // when
        Segment read = codec.decode(codec.encode(segment));
        // then
        assertThat(read.getSpyName()).isEqualTo("gospy");
        assertThat(read.getSampleRate()).isEqualTo(100);
        assertThat(read.getResolutionRules()).isEqualTo(segment.getResolutionRules());
        assertThat(read.getPresentBuckets()).isEqualTo(segment.getPresentBuckets());
        for (int depth = 0; depth < Segment.DEPTHS; depth++) {
            assertThat(read.getTouchedBuckets(depth))
                    .isEqualTo(segment.getTouchedBuckets(depth));
        }
    }

    private static class RecordingWriter implements WriteCallback<RuntimeException> {

        private final List<String> writes = Lists.newArrayList();

        @Override
        public void write(int depth, long bucketStart, long numerator, long denominator,
                List<Bucket> seedBuckets) {
            List<String> seeds = Lists.newArrayList();
            for (Bucket seedBucket : seedBuckets) {
                seeds.add(seedBucket.depth() + ":" + seedBucket.start());
            }
            writes.add(depth + ":" + bucketStart + ":" + numerator + "/" + denominator + ":"
                    + seeds);
        }
    }

    private static class RecordingReader implements ReadCallback<RuntimeException> {

        private final List<String> reads = Lists.newArrayList();

        @Override
        public void read(int depth, long bucketStart, long numerator, long denominator) {
            reads.add(depth + ":" + bucketStart + ":" + numerator + "/" + denominator);
        }
    }
}
