/*
 * KeysAndValues.java
 *
 * This source file is part of the alerter open source project
 *
 * Copyright 2023 The alerter Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.alerter.util;

import com.google.common.collect.ImmutableList;
import io.alerter.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * An immutable, ordered list of alert context pairs. Order is kept and repeated keys are not merged.
 *
 * <p>
 * Alerts take context as a flat array alternating keys and values. {@link #of(Object...)} turns such an array into
 * pairs without ever failing:
 * </p>
 * <ul>
 *     <li>a key that is not a {@link String} becomes {@code "<non-string-key: " + key + ">"}</li>
 *     <li>a trailing key with no value is paired with {@link #NO_VALUE}</li>
 * </ul>
 *
 * <p>
 * Instances can also be assembled with a {@link Builder} and handed to
 * {@link io.alerter.Alerter#info(String, KeysAndValues)}.
 * </p>
 */
@API(API.Status.STABLE)
public final class KeysAndValues implements Iterable<KeyValue> {
    /**
     * Value paired with a key that was passed without one.
     */
    public static final String NO_VALUE = "<no-value>";

    private static final KeysAndValues EMPTY = new KeysAndValues(ImmutableList.of());

    @Nonnull
    private final ImmutableList<KeyValue> pairs;

    private KeysAndValues(@Nonnull ImmutableList<KeyValue> pairs) {
        this.pairs = pairs;
    }

    @Nonnull
    public static KeysAndValues empty() {
        return EMPTY;
    }

    /**
     * Parse a flat array of alternating keys and values.
     *
     * @param keysAndValues flattened key/value pairs, possibly {@code null}
     * @return the parsed pairs
     */
    @Nonnull
    public static KeysAndValues of(@Nullable Object... keysAndValues) {
        if (keysAndValues == null || keysAndValues.length == 0) {
            return EMPTY;
        }
        final ImmutableList.Builder<KeyValue> builder = ImmutableList.builderWithExpectedSize((keysAndValues.length + 1) / 2);
        for (int i = 0; i < keysAndValues.length; i += 2) {
            final Object value = i + 1 < keysAndValues.length ? keysAndValues[i + 1] : NO_VALUE;
            builder.add(new KeyValue(keyToString(keysAndValues[i]), value));
        }
        return new KeysAndValues(builder.build());
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    private static String keyToString(@Nullable Object key) {
        if (key instanceof String) {
            return (String)key;
        }
        return "<non-string-key: " + key + ">";
    }

    /**
     * Get a list with the pairs of {@code other} after the pairs of this list.
     *
     * @param other the pairs to append
     * @return the combined pairs
     */
    @Nonnull
    public KeysAndValues concat(@Nonnull KeysAndValues other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new KeysAndValues(ImmutableList.<KeyValue>builderWithExpectedSize(size() + other.size())
                .addAll(pairs)
                .addAll(other.pairs)
                .build());
    }

    /**
     * Get a list with the pairs parsed from {@code keysAndValues} appended.
     *
     * @param keysAndValues flattened key/value pairs
     * @return the combined pairs
     * @see #of(Object...)
     */
    @Nonnull
    public KeysAndValues concat(@Nullable Object... keysAndValues) {
        return concat(of(keysAndValues));
    }

    /**
     * Get a list with every value passed through {@code valueMapper}. Keys and order are unchanged.
     *
     * @param valueMapper function to apply to each value
     * @return the mapped pairs
     */
    @Nonnull
    public KeysAndValues mapValues(@Nonnull UnaryOperator<Object> valueMapper) {
        if (isEmpty()) {
            return this;
        }
        final ImmutableList.Builder<KeyValue> builder = ImmutableList.builderWithExpectedSize(size());
        for (KeyValue pair : pairs) {
            builder.add(new KeyValue(pair.getKey(), valueMapper.apply(pair.getValue())));
        }
        return new KeysAndValues(builder.build());
    }

    @Nonnull
    public List<KeyValue> asList() {
        return pairs;
    }

    /**
     * Get the pairs as a map. When a key repeats, the last value wins.
     *
     * @return an insertion-ordered map of the pairs
     */
    @Nonnull
    public Map<String, Object> asMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        for (KeyValue pair : pairs) {
            map.put(pair.getKey(), pair.getValue());
        }
        return map;
    }

    /**
     * Flatten the pairs into an array alternating keys and values. This is the format accepted by
     * {@link #of(Object...)}.
     *
     * @return a flattened array of the pairs
     */
    @Nonnull
    public Object[] toArray() {
        final Object[] flattened = new Object[2 * pairs.size()];
        int i = 0;
        for (KeyValue pair : pairs) {
            flattened[i] = pair.getKey();
            flattened[i + 1] = pair.getValue();
            i += 2;
        }
        return flattened;
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    @Nonnull
    @Override
    public Iterator<KeyValue> iterator() {
        return pairs.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return pairs.equals(((KeysAndValues)o).pairs);
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    @Override
    public String toString() {
        return pairs.toString();
    }

    /**
     * A builder for {@link KeysAndValues}.
     */
    public static class Builder {
        private final ImmutableList.Builder<KeyValue> pairs = ImmutableList.builder();

        private Builder() {
        }

        @Nonnull
        public Builder add(@Nonnull String key, @Nullable Object value) {
            pairs.add(new KeyValue(key, value));
            return this;
        }

        @Nonnull
        public Builder addAll(@Nonnull KeysAndValues keysAndValues) {
            pairs.addAll(keysAndValues.pairs);
            return this;
        }

        @Nonnull
        public KeysAndValues build() {
            final ImmutableList<KeyValue> built = pairs.build();
            return built.isEmpty() ? EMPTY : new KeysAndValues(built);
        }
    }
}
