/*
 * AlerterException.java
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

import io.alerter.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Exception thrown for invalid alerter configuration, for example an out of range
 * {@link io.alerter.sinks.SinkOptions} value. Like alerts, it carries keys and values describing what went wrong,
 * which can be read back with {@link #getLogInfo()} or handed to an {@link io.alerter.Alerter} with
 * {@link #exportLogInfo()}.
 *
 * <p>
 * Writing alerts never throws this. Sinks report their own failures rather than raising them to callers.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class AlerterException extends RuntimeException {
    @Nonnull
    private KeysAndValues logInfo = KeysAndValues.empty();

    /**
     * Create an exception with the given message and key/value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key/value pairs
     * @see #addLogInfo(Object...)
     */
    public AlerterException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        addLogInfo(keyValues);
    }

    public AlerterException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Get the log information as a map. If a key was added more than once, the last value is returned.
     *
     * @return the log information
     */
    @Nonnull
    public synchronized Map<String, Object> getLogInfo() {
        return logInfo.asMap();
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description the key
     * @param object the value
     * @return this exception
     */
    @Nonnull
    public synchronized AlerterException addLogInfo(@Nonnull String description, @Nullable Object object) {
        logInfo = logInfo.concat(KeysAndValues.newBuilder().add(description, object).build());
        return this;
    }

    /**
     * Add alternating keys and values to the log information. The array is read the same way as alert context, see
     * {@link KeysAndValues#of(Object...)}.
     *
     * @param keyValue flattened key/value pairs
     * @return this exception
     */
    @Nonnull
    public synchronized AlerterException addLogInfo(@Nullable Object... keyValue) {
        logInfo = logInfo.concat(keyValue);
        return this;
    }

    /**
     * Export the log information in insertion order as an array alternating keys and values, ready to be passed as
     * alert context.
     *
     * @return flattened key/value pairs
     */
    @Nonnull
    public synchronized Object[] exportLogInfo() {
        return logInfo.toArray();
    }
}
