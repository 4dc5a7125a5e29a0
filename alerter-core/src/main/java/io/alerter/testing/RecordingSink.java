/*
 * RecordingSink.java
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

package io.alerter.testing;

import com.google.common.collect.ImmutableList;
import io.alerter.Alerter;
import io.alerter.AlerterSink;
import io.alerter.annotation.API;
import io.alerter.format.Marshaling;
import io.alerter.util.KeysAndValues;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;

/**
 * A sink that keeps everything written to it in memory, for tests of code that alerts.
 *
 * <p>
 * Every sink derived from a {@code RecordingSink} through {@link #withValues(Object...)} or {@link #withName(String)}
 * records into the same place, so assertions can be made on the root. Values are marshaled once, as a structured
 * sink would, before they are recorded.
 * </p>
 *
 * <p>
 * Unlike the contract of {@link AlerterSink#isEnabled(int)}, which asks for a check without side effects,
 * {@link #isEnabled(int)} here increments a shared counter (see {@link #getEnabledChecks()}) so that tests can count
 * gate checks. Sinks meant for production should not do this.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class RecordingSink implements AlerterSink {
    @Nonnull
    private final Recorder recorder;
    @Nonnull
    private final IntPredicate enabledLevels;
    @Nonnull
    private final ImmutableList<String> names;
    @Nonnull
    private final KeysAndValues values;

    /**
     * Create a sink that is enabled at every level.
     */
    public RecordingSink() {
        this(level -> true);
    }

    /**
     * Create a sink that is enabled at the levels accepted by {@code enabledLevels}.
     *
     * @param enabledLevels test of whether a level is enabled
     */
    public RecordingSink(@Nonnull IntPredicate enabledLevels) {
        this(new Recorder(), enabledLevels, ImmutableList.of(), KeysAndValues.empty());
    }

    private RecordingSink(@Nonnull Recorder recorder, @Nonnull IntPredicate enabledLevels,
                          @Nonnull ImmutableList<String> names, @Nonnull KeysAndValues values) {
        this.recorder = recorder;
        this.enabledLevels = enabledLevels;
        this.names = names;
        this.values = values;
    }

    /**
     * Create a sink that is enabled at levels up to and including {@code maxLevel}.
     *
     * @param maxLevel the highest enabled level
     * @return a new sink
     */
    @Nonnull
    public static RecordingSink withMaxLevel(int maxLevel) {
        return new RecordingSink(level -> level <= maxLevel);
    }

    @Nonnull
    public Alerter newAlerter() {
        return Alerter.of(this);
    }

    @Override
    public boolean isEnabled(int level) {
        recorder.enabledChecks.incrementAndGet();
        return enabledLevels.test(level);
    }

    @Override
    public void info(int level, @Nonnull String msg, @Nullable Object... keysAndValues) {
        recorder.record(new RecordedAlert(RecordedAlert.Kind.INFO, level, null, msg, names, render(keysAndValues)));
    }

    @Override
    public void error(@Nullable Throwable err, @Nonnull String msg, @Nullable Object... keysAndValues) {
        recorder.record(new RecordedAlert(RecordedAlert.Kind.ERROR, 0, err, msg, names, render(keysAndValues)));
    }

    @Nonnull
    private KeysAndValues render(@Nullable Object... keysAndValues) {
        return Marshaling.marshalValues(values.concat(keysAndValues));
    }

    @Nonnull
    @Override
    public RecordingSink withValues(@Nullable Object... keysAndValues) {
        return new RecordingSink(recorder, enabledLevels, names, values.concat(keysAndValues));
    }

    @Nonnull
    @Override
    public RecordingSink withName(@Nonnull String name) {
        recorder.recordName(name);
        return new RecordingSink(recorder, enabledLevels,
                ImmutableList.<String>builderWithExpectedSize(names.size() + 1).addAll(names).add(name).build(),
                values);
    }

    /**
     * Get the alerts recorded so far by this sink and every sink derived from it.
     *
     * @return a snapshot of the recorded alerts, oldest first
     */
    @Nonnull
    public List<RecordedAlert> getAlerts() {
        return recorder.getAlerts();
    }

    /**
     * Get the arguments of every {@link #withName(String)} call made on this sink or a sink derived from it.
     *
     * @return the name segments in call order
     */
    @Nonnull
    public List<String> getNameCalls() {
        return recorder.getNameCalls();
    }

    /**
     * Get the number of times {@link #isEnabled(int)} has been called on this sink or a sink derived from it.
     *
     * @return the number of enablement checks
     */
    public int getEnabledChecks() {
        return recorder.enabledChecks.get();
    }

    @Nonnull
    public List<String> getNames() {
        return names;
    }

    @Nonnull
    public KeysAndValues getValues() {
        return values;
    }

    /**
     * Forget everything recorded so far.
     */
    public void clear() {
        recorder.clear();
    }

    @Override
    public String toString() {
        return "RecordingSink{names=" + names + ", values=" + values + "}";
    }

    private static final class Recorder {
        private final List<RecordedAlert> alerts = new ArrayList<>();
        private final List<String> nameCalls = new ArrayList<>();
        private final AtomicInteger enabledChecks = new AtomicInteger();

        synchronized void record(@Nonnull RecordedAlert alert) {
            alerts.add(alert);
        }

        synchronized void recordName(@Nonnull String name) {
            nameCalls.add(name);
        }

        @Nonnull
        synchronized List<RecordedAlert> getAlerts() {
            return ImmutableList.copyOf(alerts);
        }

        @Nonnull
        synchronized List<String> getNameCalls() {
            return ImmutableList.copyOf(nameCalls);
        }

        synchronized void clear() {
            alerts.clear();
            nameCalls.clear();
            enabledChecks.set(0);
        }
    }
}
