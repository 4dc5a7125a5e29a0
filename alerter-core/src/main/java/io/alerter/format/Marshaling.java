/*
 * Marshaling.java
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

package io.alerter.format;

import io.alerter.AlertMarshaler;
import io.alerter.annotation.API;
import io.alerter.util.KeysAndValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Applies the {@link AlertMarshaler} protocol to alert values. Sinks call this while rendering, once per value.
 */
@API(API.Status.UNSTABLE)
public final class Marshaling {
    private static final Logger LOGGER = LoggerFactory.getLogger(Marshaling.class);

    private Marshaling() {
    }

    /**
     * Replace a value by its alert representation if it has one. The replacement is not itself checked for
     * {@link AlertMarshaler}. A marshaler that throws is replaced by a {@code <marshal-error: ...>} marker and
     * reported at WARN.
     *
     * @param value an alert value
     * @return the value to render
     */
    @Nullable
    public static Object marshal(@Nullable Object value) {
        if (!(value instanceof AlertMarshaler)) {
            return value;
        }
        try {
            return ((AlertMarshaler)value).marshalAlert();
        } catch (RuntimeException e) {
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn(AlertFormatter.of("alert marshaler failed",
                        "valueType", value.getClass().getName()), e);
            }
            return "<marshal-error: " + e + ">";
        }
    }

    /**
     * Marshal every value of a list of pairs.
     *
     * @param keysAndValues the pairs to marshal
     * @return the pairs with each value replaced by {@link #marshal(Object)}
     */
    @Nonnull
    public static KeysAndValues marshalValues(@Nonnull KeysAndValues keysAndValues) {
        return keysAndValues.mapValues(Marshaling::marshal);
    }
}
