/*
 * AlerterSink.java
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

package io.alerter;

import io.alerter.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The backend of an {@link Alerter}. An {@link Alerter} is a thin value over an {@code AlerterSink}, and all of the
 * real work (filtering by verbosity, formatting, writing) is done here.
 *
 * <p>
 * A sink carries its own name and its own key/value context. Both are immutable from the outside:
 * {@link #withValues(Object...)} and {@link #withName(String)} return a new sink and must not change what the
 * receiver does on later calls.
 * </p>
 *
 * <p>
 * Implementations must be safe for concurrent use. The same sink instance is commonly reached through many handles
 * on many threads, and the handle does no synchronization of its own. Implementations must also not throw out of
 * {@link #info(int, String, Object...)} or {@link #error(Throwable, String, Object...)}: failures while writing
 * should be swallowed or reported through some other channel.
 * </p>
 *
 * <p>
 * Sink implementations should provide factories that return an {@link Alerter} rather than the sink itself.
 * </p>
 */
@API(API.Status.STABLE)
public interface AlerterSink {

    /**
     * Whether this sink would write an informational alert at the given verbosity level. This is called before every
     * {@link #info(int, String, Object...)}, so it must be cheap, must not do I/O and must give the same answer for
     * the same configuration.
     *
     * @param level the verbosity level, zero or greater
     * @return whether alerts at {@code level} are written
     */
    boolean isEnabled(int level);

    /**
     * Write a non-error alert. This is only called by {@link Alerter} after {@link #isEnabled(int)} returned
     * {@code true} for the same level.
     *
     * @param level the verbosity level of the alerting handle
     * @param msg constant description of the alert
     * @param keysAndValues alternating keys and values; not validated by the caller
     */
    void info(int level, @Nonnull String msg, @Nullable Object... keysAndValues);

    /**
     * Write an error alert. This is called regardless of verbosity.
     *
     * @param err the error that triggered the alert, or {@code null} if there is none
     * @param msg constant description of the alert
     * @param keysAndValues alternating keys and values; not validated by the caller
     */
    void error(@Nullable Throwable err, @Nonnull String msg, @Nullable Object... keysAndValues);

    /**
     * Get a sink that also includes the given key/value pairs on every alert. The pairs follow any the receiver
     * already has, and repeated keys are kept.
     *
     * @param keysAndValues alternating keys and values
     * @return a new sink
     */
    @Nonnull
    AlerterSink withValues(@Nullable Object... keysAndValues);

    /**
     * Get a sink whose name has {@code name} appended as a new segment.
     *
     * @param name the name segment to append
     * @return a new sink
     */
    @Nonnull
    AlerterSink withName(@Nonnull String name);
}
