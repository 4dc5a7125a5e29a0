/*
 * Alerter.java
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
import io.alerter.sinks.DiscardSink;
import io.alerter.util.KeysAndValues;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A handle for writing structured alerts. An {@code Alerter} is an immutable value holding an {@link AlerterSink} and
 * a verbosity level; all of the real work is passed on to the sink.
 *
 * <p>
 * Alerts are made of a constant message and a list of alternating keys and values giving variable context, for
 * example {@code alerter.info("Opened store", "path", path, "size", size)}. Keys should be strings. Values may be
 * anything, and values implementing {@link AlertMarshaler} are rendered through their substitute.
 * </p>
 *
 * <p>
 * Derivation methods ({@link #withLevel(int)}, {@link #withValues(Object...)}, {@link #withName(String)} and
 * {@link #withSink(AlerterSink)}) return new handles and never change the receiver, so a handle can be shared
 * freely between threads and call sites.
 * </p>
 *
 * <p>
 * A handle with a {@code null} sink is disabled: it never writes anything, and everything derived from it is
 * disabled as well.
 * </p>
 */
@API(API.Status.STABLE)
public final class Alerter {
    @Nullable
    private final AlerterSink sink;
    private final int level;

    private Alerter(@Nullable AlerterSink sink, int level) {
        this.sink = sink;
        this.level = level;
    }

    /**
     * Create a handle at verbosity level zero that writes to the given sink. This is mostly used by sink
     * implementations in their own factories rather than by applications.
     *
     * @param sink the sink to write to, or {@code null} for a disabled handle
     * @return a new handle
     */
    @Nonnull
    public static Alerter of(@Nullable AlerterSink sink) {
        return new Alerter(sink, 0);
    }

    /**
     * Get a handle that drops every alert.
     *
     * @return a handle bound to {@link DiscardSink}
     */
    @Nonnull
    public static Alerter discard() {
        return of(DiscardSink.instance());
    }

    /**
     * Get the sink this handle writes to.
     *
     * @return the sink, or {@code null} if this handle is disabled
     */
    @Nullable
    public AlerterSink getSink() {
        return sink;
    }

    /**
     * Get a copy of this handle that writes to a different sink. The verbosity level is kept. This is intended for
     * sinks that wrap other sinks.
     *
     * @param sink the new sink, or {@code null} to disable the handle
     * @return a new handle
     */
    @Nonnull
    public Alerter withSink(@Nullable AlerterSink sink) {
        return new Alerter(sink, level);
    }

    /**
     * Get the verbosity level accumulated by {@link #withLevel(int)}.
     *
     * @return the verbosity level
     */
    public int getLevel() {
        return level;
    }

    /**
     * Whether informational alerts from this handle would be written. Callers can use this to skip building
     * expensive context.
     *
     * @return whether the sink is enabled at this handle's verbosity level
     */
    public boolean isEnabled() {
        return sink != null && sink.isEnabled(level);
    }

    /**
     * Write a non-error alert if this handle is enabled.
     *
     * @param msg constant description of the alert
     * @param keysAndValues alternating keys and values
     */
    public void info(@Nonnull String msg, @Nullable Object... keysAndValues) {
        if (sink != null && sink.isEnabled(level)) {
            sink.info(level, msg, keysAndValues);
        }
    }

    /**
     * Write a non-error alert with typed context if this handle is enabled.
     *
     * @param msg constant description of the alert
     * @param keysAndValues the context pairs
     */
    public void info(@Nonnull String msg, @Nonnull KeysAndValues keysAndValues) {
        if (sink != null && sink.isEnabled(level)) {
            sink.info(level, msg, keysAndValues.toArray());
        }
    }

    /**
     * Write an error alert. Unlike {@link #info(String, Object...)}, errors are written whatever the verbosity level
     * of this handle.
     *
     * <p>
     * {@code msg} should describe what was being attempted, and {@code err} should be the error that made it fail,
     * if there is one.
     * </p>
     *
     * @param err the triggering error, or {@code null}
     * @param msg constant description of the alert
     * @param keysAndValues alternating keys and values
     */
    public void error(@Nullable Throwable err, @Nonnull String msg, @Nullable Object... keysAndValues) {
        if (sink != null) {
            sink.error(err, msg, keysAndValues);
        }
    }

    /**
     * Write an error alert with typed context.
     *
     * @param err the triggering error, or {@code null}
     * @param msg constant description of the alert
     * @param keysAndValues the context pairs
     * @see #error(Throwable, String, Object...)
     */
    public void error(@Nullable Throwable err, @Nonnull String msg, @Nonnull KeysAndValues keysAndValues) {
        if (sink != null) {
            sink.error(err, msg, keysAndValues.toArray());
        }
    }

    /**
     * Get a handle for a higher verbosity level, relative to this one. Levels add up, so
     * {@code alerter.withLevel(1).withLevel(2)} is at level 3 above {@code alerter}. A higher level means a less
     * important alert. Negative increments are treated as zero, and the sum saturates at
     * {@link Integer#MAX_VALUE} rather than wrapping.
     *
     * @param level the increment to add to this handle's level
     * @return a new handle
     */
    @Nonnull
    public Alerter withLevel(int level) {
        if (sink == null) {
            return this;
        }
        return new Alerter(sink, (int)Math.min((long)this.level + Math.max(level, 0), Integer.MAX_VALUE));
    }

    /**
     * Get a handle that adds the given key/value pairs to every alert.
     *
     * @param keysAndValues alternating keys and values
     * @return a new handle
     */
    @Nonnull
    public Alerter withValues(@Nullable Object... keysAndValues) {
        if (sink == null) {
            return this;
        }
        return new Alerter(sink.withValues(keysAndValues), level);
    }

    /**
     * Get a handle with {@code name} appended to its name. Successive calls append further segments in call order;
     * how segments are joined is up to the sink. Segments should contain only letters, digits and hyphens.
     *
     * @param name the name segment to append
     * @return a new handle
     */
    @Nonnull
    public Alerter withName(@Nonnull String name) {
        if (sink == null) {
            return this;
        }
        return new Alerter(sink.withName(name), level);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alerter alerter = (Alerter)o;
        return level == alerter.level && Objects.equals(sink, alerter.sink);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sink, level);
    }

    @Override
    public String toString() {
        return "Alerter{sink=" + sink + ", level=" + level + "}";
    }
}
