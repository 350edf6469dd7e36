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

import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Application name plus label set, e.g. {@code my.app.cpu{env=prod,region=eu}}.
 *
 * <p>Labels are kept sorted by name so that the derived segment key does not depend on the
 * order in which labels were supplied.
 */
public class Key {

    // reserved label holding the application name in the dimension index
    public static final String APP_NAME_LABEL = "__name__";

    private static final Joiner.MapJoiner LABEL_JOINER = Joiner.on(',').withKeyValueSeparator('=');

    private final String appName;
    private final ImmutableSortedMap<String, String> labels;

    private Key(String appName, ImmutableSortedMap<String, String> labels) {
        this.appName = appName;
        this.labels = labels;
    }

    public static Key of(String appName, Map<String, String> labels) throws InvalidKeyException {
        // round trip through the parser so the same validation rules apply
        return parse(appName + '{' + LABEL_JOINER.join(labels) + '}');
    }

    public static Key parse(String input) throws InvalidKeyException {
        checkNotNull(input);
        Parser parser = new Parser(input);
        for (int i = 0; i < input.length(); i++) {
            parser.next(input.charAt(i));
        }
        return parser.finish();
    }

    public String appName() {
        return appName;
    }

    public ImmutableSortedMap<String, String> labels() {
        return labels;
    }

    public String segmentKey() {
        return appName + '{' + LABEL_JOINER.join(labels) + '}';
    }

    public String treeKey(int depth, long timeMillis) {
        return treeKey(segmentKey(), depth, Segment.bucketStart(depth, timeMillis));
    }

    // dimension keys of every label, starting with the application name dimension
    public ImmutableList<String> dimensionKeys() {
        ImmutableList.Builder<String> dimensionKeys = ImmutableList.builder();
        dimensionKeys.add(appDimensionKey(appName));
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            dimensionKeys.add(dimensionKey(entry.getKey(), entry.getValue()));
        }
        return dimensionKeys.build();
    }

    public static String treeKey(String segmentKey, int depth, long bucketStartMillis) {
        checkArgument(depth >= 0, "depth must be non-negative: %s", depth);
        return segmentKey + ':' + depth + ':' + MILLISECONDS.toSeconds(bucketStartMillis);
    }

    // trees of one segment all share this prefix
    public static String treeKeyPrefix(String segmentKey) {
        return segmentKey + ':';
    }

    public static String dimensionKey(String labelKey, String labelValue) {
        return labelKey + ':' + labelValue;
    }

    public static String appDimensionKey(String appName) {
        return dimensionKey(APP_NAME_LABEL, appName);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Key)) {
            return false;
        }
        Key that = (Key) obj;
        return appName.equals(that.appName) && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return 31 * appName.hashCode() + labels.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("appName", appName)
                .add("labels", labels)
                .toString();
    }

    private enum State {
        APP_NAME, LABEL_KEY, LABEL_VALUE, DONE
    }

    private static class Parser {

        private final String input;

        private final StringBuilder appName = new StringBuilder();
        private final StringBuilder labelKey = new StringBuilder();
        private final StringBuilder labelValue = new StringBuilder();
        private final Map<String, String> labels = Maps.newHashMap();

        private State state = State.APP_NAME;
        private boolean afterComma;

        private Parser(String input) {
            this.input = input;
        }

        private void next(char c) throws InvalidKeyException {
            switch (state) {
                case APP_NAME:
                    nextInAppName(c);
                    break;
                case LABEL_KEY:
                    nextInLabelKey(c);
                    break;
                case LABEL_VALUE:
                    nextInLabelValue(c);
                    break;
                case DONE:
                    if (!Character.isWhitespace(c)) {
                        throw new InvalidKeyException(input, "unexpected characters after '}'");
                    }
                    break;
                default:
                    throw new AssertionError("Unexpected parser state: " + state);
            }
        }

        private void nextInAppName(char c) throws InvalidKeyException {
            switch (c) {
                case '{':
                    state = State.LABEL_KEY;
                    break;
                case '}':
                    throw new InvalidKeyException(input, "'}' without matching '{'");
                case ',':
                case '=':
                    throw new InvalidKeyException(input,
                            "application name cannot contain '" + c + "'");
                default:
                    appName.append(c);
            }
        }

        private void nextInLabelKey(char c) throws InvalidKeyException {
            switch (c) {
                case '=':
                    state = State.LABEL_VALUE;
                    break;
                case '}':
                    if (labels.isEmpty() && !afterComma && isBlank(labelKey)) {
                        // app{}
                        state = State.DONE;
                        break;
                    }
                    throw new InvalidKeyException(input, "label without '='");
                case ',':
                    throw new InvalidKeyException(input, "label without '='");
                case '{':
                    throw new InvalidKeyException(input, "nested '{'");
                case ':':
                    throw new InvalidKeyException(input, "label name cannot contain ':'");
                default:
                    labelKey.append(c);
            }
        }

        private void nextInLabelValue(char c) throws InvalidKeyException {
            switch (c) {
                case ',':
                    addLabel();
                    afterComma = true;
                    state = State.LABEL_KEY;
                    break;
                case '}':
                    addLabel();
                    state = State.DONE;
                    break;
                case '=':
                    throw new InvalidKeyException(input, "label with more than one '='");
                case '{':
                    throw new InvalidKeyException(input, "nested '{'");
                default:
                    labelValue.append(c);
            }
        }

        private void addLabel() throws InvalidKeyException {
            String key = labelKey.toString().trim();
            String value = labelValue.toString().trim();
            labelKey.setLength(0);
            labelValue.setLength(0);
            if (key.isEmpty()) {
                throw new InvalidKeyException(input, "empty label name");
            }
            if (key.equals(APP_NAME_LABEL)) {
                throw new InvalidKeyException(input, "label name " + APP_NAME_LABEL
                        + " is reserved");
            }
            if (labels.containsKey(key)) {
                throw new InvalidKeyException(input, "duplicate label name: " + key);
            }
            labels.put(key, value);
        }

        private Key finish() throws InvalidKeyException {
            if (state == State.LABEL_KEY || state == State.LABEL_VALUE) {
                throw new InvalidKeyException(input, "missing closing '}'");
            }
            String name = appName.toString().trim();
            if (name.isEmpty()) {
                throw new InvalidKeyException(input, "empty application name");
            }
            return new Key(name, ImmutableSortedMap.copyOf(labels));
        }

        private static boolean isBlank(CharSequence chars) {
            return chars.toString().trim().isEmpty();
        }
    }
}
